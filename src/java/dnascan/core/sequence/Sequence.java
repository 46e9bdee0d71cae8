package dnascan.core.sequence;

/**
 * A named DNA sequence read from a fasta file
 */
public class Sequence {

	private final String id;
	private final String description;
	private final String bases;

	/**
	 * @param sequenceId First word of the header line
	 * @param sequenceDescription Full header line without the leading '>'
	 * @param sequenceBases Upper case bases
	 */
	public Sequence(String sequenceId, String sequenceDescription, String sequenceBases) {
		id = sequenceId;
		description = sequenceDescription;
		bases = sequenceBases;
	}

	public String getId() {
		return id;
	}

	public String getDescription() {
		return description;
	}

	public String getSequenceBases() {
		return bases;
	}

	public int getLength() {
		return bases.length();
	}

	@Override
	public String toString() {
		return id + " (" + getLength() + " bp)";
	}

}
