package dnascan.core.matcher;

/**
 * One occurrence of a pattern in a scanned sequence
 */
public final class MatchRecord implements Comparable<MatchRecord> {
	
	/**
	 * Score of every exact match, including matches that span wildcards
	 */
	public static final double EXACT_MATCH_SCORE = 1.0;
	
	private final int start;
	private final int patternIndex;
	private final String pattern;
	private final double score;
	
	/**
	 * @param startPosition Zero based start of the occurrence in the scanned sequence
	 * @param patternId Index of the pattern in construction order
	 * @param patternSequence The pattern
	 */
	public MatchRecord(int startPosition, int patternId, String patternSequence) {
		start = startPosition;
		patternIndex = patternId;
		pattern = patternSequence;
		score = EXACT_MATCH_SCORE;
	}
	
	/**
	 * @return Zero based start position
	 */
	public int getStart() {
		return start;
	}
	
	/**
	 * @return Position after the last matched symbol
	 */
	public int getEnd() {
		return start + pattern.length();
	}
	
	/**
	 * @return Match length
	 */
	public int getLength() {
		return pattern.length();
	}
	
	/**
	 * @return Index of the matched pattern in construction order
	 */
	public int getPatternIndex() {
		return patternIndex;
	}
	
	/**
	 * @return The matched pattern
	 */
	public String getPattern() {
		return pattern;
	}
	
	/**
	 * @return Match score
	 */
	public double getScore() {
		return score;
	}

	@Override
	public int compareTo(MatchRecord o) {
		if(start != o.start) {
			return Integer.compare(start, o.start);
		}
		return Integer.compare(patternIndex, o.patternIndex);
	}
	
	@Override
	public boolean equals(Object o) {
		if(!(o instanceof MatchRecord)) {
			return false;
		}
		MatchRecord other = (MatchRecord) o;
		return start == other.start && patternIndex == other.patternIndex && pattern.equals(other.pattern);
	}
	
	@Override
	public int hashCode() {
		int rtrn = 17;
		rtrn = 31 * rtrn + start;
		rtrn = 31 * rtrn + patternIndex;
		rtrn = 31 * rtrn + pattern.hashCode();
		return rtrn;
	}
	
	@Override
	public String toString() {
		return pattern + "@" + start;
	}

}
