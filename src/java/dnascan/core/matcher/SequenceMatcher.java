package dnascan.core.matcher;

import java.util.List;

/**
 * An automaton that finds exact occurrences of one or more fixed patterns in a DNA sequence
 * Implementations are immutable once constructed and may be shared between threads
 */
public interface SequenceMatcher {
	
	/**
	 * Find all occurrences of the patterns in a sequence, in one left to right pass
	 * @param sequence Sequence over A, C, G, T, N. May be empty.
	 * @return New list of matches ordered by start position, then by pattern index
	 * @throws dnascan.core.error.InvalidSequenceException if the sequence contains a symbol outside the alphabet
	 */
	public List<MatchRecord> scan(String sequence);
	
	/**
	 * Get the patterns in construction order
	 * @return Unmodifiable list of patterns
	 */
	public List<String> getPatterns();
	
	/**
	 * Get a short name for the matching algorithm, for reports
	 * @return Algorithm name
	 */
	public String getAlgorithmName();

}
