package dnascan.benchmark;

/**
 * Timings of repeated scans of one text with one matcher
 */
public class BenchmarkResult {

	private final String algorithm;
	private final int numPatterns;
	private final int textSize;
	private final int iterations;
	private final double minMillis;
	private final double maxMillis;
	private final double meanMillis;
	private final double totalMillis;
	private final int numMatches;

	/**
	 * @param algorithmName Matcher algorithm name
	 * @param patternCount Number of patterns in the matcher
	 * @param textLength Length of the scanned text
	 * @param numIterations Number of timed scans
	 * @param min Fastest scan in milliseconds
	 * @param max Slowest scan in milliseconds
	 * @param mean Mean scan time in milliseconds
	 * @param total Sum of scan times in milliseconds
	 * @param matches Number of matches reported by the last scan
	 */
	public BenchmarkResult(String algorithmName, int patternCount, int textLength, int numIterations, double min, double max, double mean, double total, int matches) {
		algorithm = algorithmName;
		numPatterns = patternCount;
		textSize = textLength;
		iterations = numIterations;
		minMillis = min;
		maxMillis = max;
		meanMillis = mean;
		totalMillis = total;
		numMatches = matches;
	}

	public String getAlgorithm() {
		return algorithm;
	}

	public int getNumPatterns() {
		return numPatterns;
	}

	public int getTextSize() {
		return textSize;
	}

	public int getIterations() {
		return iterations;
	}

	public double getMinMillis() {
		return minMillis;
	}

	public double getMaxMillis() {
		return maxMillis;
	}

	public double getMeanMillis() {
		return meanMillis;
	}

	public double getTotalMillis() {
		return totalMillis;
	}

	public int getNumMatches() {
		return numMatches;
	}

	@Override
	public String toString() {
		return algorithm + " text=" + textSize + " patterns=" + numPatterns + " mean=" + String.format("%.4f", Double.valueOf(meanMillis)) + "ms matches=" + numMatches;
	}

}
