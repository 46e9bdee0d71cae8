package dnascan.programs;

import java.io.BufferedWriter;
import java.io.FileWriter;
import java.io.IOException;
import java.util.List;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import dnascan.benchmark.AlgorithmComparison;
import dnascan.benchmark.BenchmarkConfiguration;
import dnascan.benchmark.BenchmarkRunner;
import dnascan.benchmark.PerformanceAnalyzer;
import dnascan.benchmark.ScalabilityPoint;
import dnascan.core.matcher.MatcherFactory;
import dnascan.core.matcher.SequenceMatcher;
import dnascan.core.parser.CommandLineParser;

/**
 * Time both matchers on generated sequences of increasing size and report how scan time scales
 */
public class RunBenchmark {

	static Logger logger = Logger.getLogger(RunBenchmark.class.getName());

	/**
	 * R squared above which the time / size fit is reported as linear
	 */
	public static final double DEFAULT_MIN_R_SQUARED = 0.95;

	private final BenchmarkConfiguration config;
	private final BenchmarkRunner runner;

	/**
	 * @param configuration Benchmark parameters
	 */
	public RunBenchmark(BenchmarkConfiguration configuration) {
		config = configuration;
		runner = new BenchmarkRunner(config.getSeed());
	}

	/**
	 * Run the scalability benchmark for one matcher and format its report
	 * @param matcher The matcher
	 * @param minRSquared R squared threshold for the linear fit
	 * @return The report
	 */
	public String scalabilityReport(SequenceMatcher matcher, double minRSquared) {
		logger.info("Benchmarking " + matcher);
		List<ScalabilityPoint> points = runner.benchmarkScalability(matcher, config.getSizes(), config.getGcPercentage(), config.getIterations());
		StringBuilder sb = new StringBuilder();
		sb.append(matcher.toString()).append("\n");
		sb.append(PerformanceAnalyzer.generateReport(points)).append("\n");
		sb.append(PerformanceAnalyzer.estimateComplexity(points).getEvidence()).append("\n");
		sb.append("Linear fit over sizes: ").append(PerformanceAnalyzer.isLinearFit(points, minRSquared)).append("\n");
		return sb.toString();
	}

	/**
	 * Run both scalability benchmarks and the head to head comparison
	 * @param minRSquared R squared threshold for the linear fit
	 * @return The full report
	 */
	public String run(double minRSquared) {
		StringBuilder sb = new StringBuilder();
		sb.append(scalabilityReport(MatcherFactory.buildSingleMatcher(config.getPattern()), minRSquared)).append("\n");
		sb.append(scalabilityReport(MatcherFactory.buildMultiMatcher(config.getPatterns()), minRSquared)).append("\n");
		int[] sizes = config.getSizes();
		String text = runner.generateRandomDna(sizes[sizes.length - 1], config.getGcPercentage());
		AlgorithmComparison comparison = BenchmarkRunner.compareAlgorithms(config.getPattern(), config.getPatterns(), text, config.getIterations());
		sb.append(comparison.toString()).append("\n");
		return sb.toString();
	}

	/**
	 * @param args Command line
	 * @throws IOException
	 */
	public static void main(String[] args) throws IOException {

		CommandLineParser p = new CommandLineParser();
		p.setProgramDescription("Benchmark the DFA and Aho-Corasick matchers on random DNA of increasing size.");
		p.addBooleanArg("-d", "Debug logging on", false, false);
		p.addStringArg("-c", "Config file with options sizes, iterations, gc_percentage, seed, pattern, patterns", false);
		p.addDoubleArg("-r2", "Minimum R squared for the time / size fit to count as linear", false, DEFAULT_MIN_R_SQUARED);
		p.addStringArg("-o", "Report file, or standard out if none is provided", false);
		try {
			p.parse(args);
		} catch(IllegalArgumentException e) {
			System.err.println(e.getMessage());
			System.exit(-1);
		}
		if(p.getBooleanArg("-d")) {
			logger.setLevel(Level.DEBUG);
		}

		BenchmarkConfiguration config = p.hasValue("-c") ? BenchmarkConfiguration.fromFile(p.getStringArg("-c")) : new BenchmarkConfiguration();
		String report = new RunBenchmark(config).run(p.getDoubleArg("-r2"));

		if(p.hasValue("-o")) {
			BufferedWriter bw = new BufferedWriter(new FileWriter(p.getStringArg("-o")));
			bw.write(report);
			bw.close();
		} else {
			System.out.println(report);
		}

		logger.info("");
		logger.info("All done.");

	}

}
