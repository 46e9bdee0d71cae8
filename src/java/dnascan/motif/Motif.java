package dnascan.motif;

import dnascan.core.sequence.SequenceUtils;

/**
 * A named DNA motif with its annotation
 */
public class Motif {
	
	/**
	 * Value of cut position and overhang for motifs that are not restriction sites
	 */
	public static final int NO_CUT_POSITION = -1;
	
	private final String name;
	private final String sequence;
	private final MotifCategory category;
	private final String organism;
	private final String function;
	private final String description;
	private final int cutPosition;
	private final String overhang;
	
	/**
	 * @param motifName Motif name
	 * @param motifSequence Consensus sequence, possibly with IUPAC codes
	 * @param motifCategory Category
	 * @param sourceOrganism Organism the motif is described in
	 * @param motifFunction Biological function
	 * @param motifDescription Free text description
	 */
	public Motif(String motifName, String motifSequence, MotifCategory motifCategory, String sourceOrganism, String motifFunction, String motifDescription) {
		this(motifName, motifSequence, motifCategory, sourceOrganism, motifFunction, motifDescription, NO_CUT_POSITION, null);
	}
	
	/**
	 * @param motifName Motif name
	 * @param motifSequence Consensus sequence, possibly with IUPAC codes
	 * @param motifCategory Category
	 * @param sourceOrganism Organism the motif is described in
	 * @param motifFunction Biological function
	 * @param motifDescription Free text description
	 * @param cleavagePosition Cut position on the top strand relative to the first position of the site, or {@link #NO_CUT_POSITION}
	 * @param overhangType "sticky" or "blunt" for restriction sites, null otherwise
	 */
	public Motif(String motifName, String motifSequence, MotifCategory motifCategory, String sourceOrganism, String motifFunction, String motifDescription, int cleavagePosition, String overhangType) {
		name = motifName;
		sequence = motifSequence.toUpperCase();
		category = motifCategory;
		organism = sourceOrganism;
		function = motifFunction;
		description = motifDescription;
		cutPosition = cleavagePosition;
		overhang = overhangType;
	}

	public String getName() {
		return name;
	}

	public String getSequence() {
		return sequence;
	}

	public MotifCategory getCategory() {
		return category;
	}

	public String getOrganism() {
		return organism;
	}

	public String getFunction() {
		return function;
	}

	public String getDescription() {
		return description;
	}

	/**
	 * @return Cut position on the top strand, or {@link #NO_CUT_POSITION} if not a restriction site
	 */
	public int getCutPosition() {
		return cutPosition;
	}

	/**
	 * @return Overhang type, or null if not a restriction site
	 */
	public String getOverhang() {
		return overhang;
	}
	
	/**
	 * @return Percentage of G and C in the consensus sequence
	 */
	public double getGcContent() {
		return SequenceUtils.gcContent(sequence);
	}
	
	@Override
	public String toString() {
		return name + " (" + sequence + ")";
	}

}
