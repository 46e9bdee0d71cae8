package dnascan.motif;

import java.io.BufferedReader;
import java.io.FileReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

/**
 * Read-only table of known DNA motifs, looked up by name
 * Build one with the motifs of interest or use {@link #getDefault()}, then pass it to whatever needs it
 */
public final class MotifDatabase {

	static Logger logger = Logger.getLogger(MotifDatabase.class.getName());

	private static final MotifDatabase DEFAULT = new MotifDatabase(defaultMotifs());

	private final Map<String, Motif> motifsByName;
	private final Map<MotifCategory, List<Motif>> motifsByCategory;

	/**
	 * @param motifs The motifs. Names must be unique.
	 */
	public MotifDatabase(Collection<Motif> motifs) {
		Map<String, Motif> byName = new LinkedHashMap<String, Motif>();
		Map<MotifCategory, List<Motif>> byCategory = new EnumMap<MotifCategory, List<Motif>>(MotifCategory.class);
		for(MotifCategory c : MotifCategory.values()) {
			byCategory.put(c, new ArrayList<Motif>());
		}
		for(Motif m : motifs) {
			if(byName.containsKey(m.getName())) {
				throw new IllegalArgumentException("Duplicate motif name " + m.getName());
			}
			byName.put(m.getName(), m);
			byCategory.get(m.getCategory()).add(m);
		}
		for(MotifCategory c : MotifCategory.values()) {
			byCategory.put(c, Collections.unmodifiableList(byCategory.get(c)));
		}
		motifsByName = Collections.unmodifiableMap(byName);
		motifsByCategory = Collections.unmodifiableMap(byCategory);
	}

	/**
	 * @return The built-in table of promoter elements, restriction sites and CpG sites
	 */
	public static MotifDatabase getDefault() {
		return DEFAULT;
	}

	private static List<Motif> defaultMotifs() {
		List<Motif> rtrn = new ArrayList<Motif>();
		rtrn.add(new Motif("TATA_BOX", "TATAAA", MotifCategory.PROMOTER, "Eukaryotes", "Transcription initiation", "Core promoter element found ~25-30 bp upstream of transcription start"));
		rtrn.add(new Motif("PRIBNOW_BOX", "TATAAT", MotifCategory.PROMOTER, "Prokaryotes (E. coli)", "Transcription initiation", "-10 box in bacterial promoter, recognized by sigma factor"));
		rtrn.add(new Motif("KOZAK_SEQUENCE", "GCCRCCATGG", MotifCategory.PROMOTER, "Eukaryotes", "Translation initiation", "Consensus sequence around AUG start codon for translation initiation"));
		rtrn.add(new Motif("EcoRI", "GAATTC", MotifCategory.RESTRICTION_SITE, "E. coli", "Restriction enzyme recognition site", "Cuts DNA leaving 5' overhang (AATT)", 1, "sticky"));
		rtrn.add(new Motif("BamHI", "GGATCC", MotifCategory.RESTRICTION_SITE, "Bacillus amyloliquefaciens", "Restriction enzyme recognition site", "Cuts DNA leaving 5' overhang (GATC)", 1, "sticky"));
		rtrn.add(new Motif("PstI", "CTGCAG", MotifCategory.RESTRICTION_SITE, "Providencia stuartii", "Restriction enzyme recognition site", "Cuts DNA leaving 3' overhang (TG)", 5, "sticky"));
		rtrn.add(new Motif("HindIII", "AAGCTT", MotifCategory.RESTRICTION_SITE, "Haemophilus influenzae", "Restriction enzyme recognition site", "Cuts DNA leaving 5' overhang (AGCT)", 1, "sticky"));
		rtrn.add(new Motif("EcoRV", "GATATC", MotifCategory.RESTRICTION_SITE, "E. coli", "Restriction enzyme recognition site", "Produces blunt-ended cuts", 3, "blunt"));
		rtrn.add(new Motif("CpG_DINUCLEOTIDE", "CG", MotifCategory.CPG_SITE, "Mammals", "DNA methylation site", "Often methylated, important for gene regulation"));
		return rtrn;
	}

	/**
	 * Get a motif by name
	 * @param name Motif name
	 * @return The motif, or null if there is none with this name
	 */
	public Motif getMotif(String name) {
		return motifsByName.get(name);
	}

	/**
	 * Get the consensus sequence of a motif
	 * @param name Motif name
	 * @return The sequence, or null if there is no motif with this name
	 */
	public String getMotifSequence(String name) {
		Motif m = getMotif(name);
		return m == null ? null : m.getSequence();
	}

	/**
	 * Get motifs by name, failing on unknown names
	 * @param names Motif names
	 * @return The motifs in the order of the names
	 */
	public List<Motif> getMotifs(Collection<String> names) {
		List<Motif> rtrn = new ArrayList<Motif>();
		for(String name : names) {
			Motif m = getMotif(name);
			if(m == null) {
				throw new IllegalArgumentException("Motif " + name + " not recognized. Options: " + StringUtils.join(listMotifNames(), ", "));
			}
			rtrn.add(m);
		}
		return rtrn;
	}

	/**
	 * Get collection of motifs named in a file, one name per line
	 * @param file File name
	 * @return Motifs named in the file, in file order
	 * @throws IOException
	 */
	public List<Motif> readFromFile(String file) throws IOException {
		List<String> names = new ArrayList<String>();
		BufferedReader b = new BufferedReader(new FileReader(file));
		try {
			String line;
			while((line = b.readLine()) != null) {
				if(StringUtils.isNotBlank(line)) {
					names.add(line.trim());
				}
			}
		} finally {
			b.close();
		}
		logger.debug("Read " + names.size() + " motif names from " + file);
		return getMotifs(names);
	}

	/**
	 * @return All motif names, by category then in table order
	 */
	public List<String> listMotifNames() {
		List<String> rtrn = new ArrayList<String>();
		for(MotifCategory c : MotifCategory.values()) {
			for(Motif m : motifsByCategory.get(c)) {
				rtrn.add(m.getName());
			}
		}
		return rtrn;
	}

	/**
	 * @param category Category
	 * @return Unmodifiable list of the motifs in the category
	 */
	public List<Motif> listByCategory(MotifCategory category) {
		return motifsByCategory.get(category);
	}

	/**
	 * @return Unmodifiable map of category to motifs
	 */
	public Map<MotifCategory, List<Motif>> getAllMotifs() {
		return motifsByCategory;
	}

	/**
	 * @return Number of motifs
	 */
	public int size() {
		return motifsByName.size();
	}

}
