package dnascan.benchmark;

/**
 * Single pattern automaton versus multi pattern automaton on the same text
 */
public class AlgorithmComparison {

	private final BenchmarkResult single;
	private final BenchmarkResult multi;

	/**
	 * @param singleResult Result for the single pattern matcher
	 * @param multiResult Result for the multi pattern matcher
	 */
	public AlgorithmComparison(BenchmarkResult singleResult, BenchmarkResult multiResult) {
		single = singleResult;
		multi = multiResult;
	}

	public BenchmarkResult getSingleResult() {
		return single;
	}

	public BenchmarkResult getMultiResult() {
		return multi;
	}

	/**
	 * @return Mean multi pattern time divided by mean single pattern time
	 */
	public double getSpeedup() {
		return multi.getMeanMillis() / single.getMeanMillis();
	}

	/**
	 * @return Name of the algorithm with the lower mean time
	 */
	public String getFaster() {
		return getSpeedup() > 1 ? single.getAlgorithm() : multi.getAlgorithm();
	}

	@Override
	public String toString() {
		return single.getAlgorithm() + " vs " + multi.getAlgorithm() + ": speedup " + String.format("%.2f", Double.valueOf(getSpeedup())) + ", faster: " + getFaster();
	}

}
