package dnascan.benchmark;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.random.RandomDataGenerator;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.apache.log4j.Logger;

import dnascan.core.matcher.MatchRecord;
import dnascan.core.matcher.MatcherFactory;
import dnascan.core.matcher.SequenceMatcher;

/**
 * Times matcher scans over texts of varying size
 */
public class BenchmarkRunner {

	static Logger logger = Logger.getLogger(BenchmarkRunner.class.getName());

	/**
	 * Default text sizes for scalability runs
	 */
	public static final int[] DEFAULT_SIZES = {1000, 10000, 100000, 1000000};

	/**
	 * Default percentage of G and C in generated texts
	 */
	public static final double DEFAULT_GC_PERCENTAGE = 50;

	/**
	 * Default number of timed scans per text
	 */
	public static final int DEFAULT_ITERATIONS = 3;

	private final RandomDataGenerator rdg;

	/**
	 * @param seed Seed for sequence generation
	 */
	public BenchmarkRunner(long seed) {
		rdg = new RandomDataGenerator();
		rdg.reSeed(seed);
	}

	/**
	 * Generate a random DNA sequence with a fixed G+C count
	 * floor(length * gcPercentage / 100) positions are G or C, split as evenly as possible; the rest are A or T
	 * @param length Sequence length
	 * @param gcPercentage Percentage of G and C, between 0 and 100
	 * @return Shuffled sequence
	 */
	public String generateRandomDna(int length, double gcPercentage) {
		if(length < 0) {
			throw new IllegalArgumentException("Length must be non-negative: " + length);
		}
		if(gcPercentage < 0 || gcPercentage > 100) {
			throw new IllegalArgumentException("GC percentage must be between 0 and 100: " + gcPercentage);
		}
		int numGc = (int) Math.floor(length * gcPercentage / 100);
		char[] bases = new char[length];
		for(int i = 0; i < length; i++) {
			if(i < numGc) {
				bases[i] = i % 2 == 0 ? 'G' : 'C';
			} else {
				bases[i] = (i - numGc) % 2 == 0 ? 'A' : 'T';
			}
		}
		for(int i = length - 1; i > 0; i--) {
			int j = rdg.nextInt(0, i);
			char tmp = bases[i];
			bases[i] = bases[j];
			bases[j] = tmp;
		}
		return new String(bases);
	}

	/**
	 * Time repeated scans of a text
	 * @param matcher The matcher
	 * @param text Text to scan
	 * @param iterations Number of timed scans
	 * @return Timing summary
	 */
	public static BenchmarkResult benchmark(SequenceMatcher matcher, String text, int iterations) {
		if(iterations <= 0) {
			throw new IllegalArgumentException("Number of iterations must be positive: " + iterations);
		}
		SummaryStatistics stats = new SummaryStatistics();
		int numMatches = 0;
		for(int i = 0; i < iterations; i++) {
			long start = System.nanoTime();
			List<MatchRecord> matches = matcher.scan(text);
			long end = System.nanoTime();
			stats.addValue((end - start) / 1e6);
			numMatches = matches.size();
		}
		BenchmarkResult rtrn = new BenchmarkResult(matcher.getAlgorithmName(), matcher.getPatterns().size(), text.length(), iterations, stats.getMin(), stats.getMax(), stats.getMean(), stats.getSum(), numMatches);
		logger.debug(rtrn.toString());
		return rtrn;
	}

	/**
	 * Time a matcher on generated texts of increasing size
	 * @param matcher The matcher
	 * @param sizes Text sizes
	 * @param gcPercentage Percentage of G and C in generated texts
	 * @param iterations Number of timed scans per size
	 * @return One point per size, in the order given
	 */
	public List<ScalabilityPoint> benchmarkScalability(SequenceMatcher matcher, int[] sizes, double gcPercentage, int iterations) {
		List<ScalabilityPoint> rtrn = new ArrayList<ScalabilityPoint>();
		for(int size : sizes) {
			String text = generateRandomDna(size, gcPercentage);
			BenchmarkResult result = benchmark(matcher, text, iterations);
			rtrn.add(new ScalabilityPoint(size, result.getMeanMillis(), result.getNumMatches()));
			logger.info("Size: " + size + " bp -> Time: " + String.format("%.4f", Double.valueOf(result.getMeanMillis())) + " ms | Matches: " + result.getNumMatches());
		}
		return rtrn;
	}

	/**
	 * Compare the single pattern automaton with the multi pattern automaton on the same text
	 * @param pattern Pattern for the single pattern matcher
	 * @param patterns Patterns for the multi pattern matcher
	 * @param text Text to scan
	 * @param iterations Number of timed scans per matcher
	 * @return The comparison
	 */
	public static AlgorithmComparison compareAlgorithms(String pattern, List<String> patterns, String text, int iterations) {
		BenchmarkResult single = benchmark(MatcherFactory.buildSingleMatcher(pattern), text, iterations);
		BenchmarkResult multi = benchmark(MatcherFactory.buildMultiMatcher(patterns), text, iterations);
		AlgorithmComparison rtrn = new AlgorithmComparison(single, multi);
		logger.info(rtrn.toString());
		return rtrn;
	}

}
