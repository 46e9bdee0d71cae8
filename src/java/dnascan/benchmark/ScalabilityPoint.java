package dnascan.benchmark;

/**
 * Mean scan time and match count for one text size
 */
public class ScalabilityPoint {

	private final int textSize;
	private final double timeMillis;
	private final int numMatches;

	/**
	 * @param size Text length
	 * @param millis Mean scan time in milliseconds
	 * @param matches Number of matches
	 */
	public ScalabilityPoint(int size, double millis, int matches) {
		textSize = size;
		timeMillis = millis;
		numMatches = matches;
	}

	public int getTextSize() {
		return textSize;
	}

	public double getTimeMillis() {
		return timeMillis;
	}

	public int getNumMatches() {
		return numMatches;
	}

	@Override
	public String toString() {
		return textSize + "\t" + timeMillis + "\t" + numMatches;
	}

}
