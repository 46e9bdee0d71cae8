package dnascan.benchmark;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Scanner;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

/**
 * Benchmark parameters read from a config file
 * One option per line: the option name followed by its whitespace separated values. Lines starting with # are comments.
 * Options not in the file keep their defaults.
 */
public class BenchmarkConfiguration {

	static Logger logger = Logger.getLogger(BenchmarkConfiguration.class.getName());

	/**
	 * Text sizes for the scalability run, e.g. sizes 1000 10000 100000
	 */
	public static final String OPTION_SIZES = "sizes";

	/**
	 * Number of timed scans per text
	 */
	public static final String OPTION_ITERATIONS = "iterations";

	/**
	 * Percentage of G and C in generated texts
	 */
	public static final String OPTION_GC_PERCENTAGE = "gc_percentage";

	/**
	 * Random seed for text generation
	 */
	public static final String OPTION_SEED = "seed";

	/**
	 * Pattern for the single pattern automaton
	 */
	public static final String OPTION_PATTERN = "pattern";

	/**
	 * Patterns for the multi pattern automaton
	 */
	public static final String OPTION_PATTERNS = "patterns";

	/**
	 * Default pattern for the single pattern automaton
	 */
	public static final String DEFAULT_PATTERN = "GAATTC";

	/**
	 * Default patterns for the multi pattern automaton
	 */
	public static final List<String> DEFAULT_PATTERNS = Collections.unmodifiableList(Arrays.asList("GAATTC", "GGATCC", "CTGCAG", "AAGCTT", "GATATC"));

	/**
	 * Default random seed
	 */
	public static final long DEFAULT_SEED = 42;

	private int[] sizes;
	private int iterations;
	private double gcPercentage;
	private long seed;
	private String pattern;
	private List<String> patterns;

	/**
	 * Configuration with all defaults
	 */
	public BenchmarkConfiguration() {
		sizes = BenchmarkRunner.DEFAULT_SIZES.clone();
		iterations = BenchmarkRunner.DEFAULT_ITERATIONS;
		gcPercentage = BenchmarkRunner.DEFAULT_GC_PERCENTAGE;
		seed = DEFAULT_SEED;
		pattern = DEFAULT_PATTERN;
		patterns = DEFAULT_PATTERNS;
	}

	/**
	 * Read a config file
	 * @param configFileName Config file
	 * @return Configuration with the options in the file and defaults for the rest
	 * @throws IOException if the file cannot be read
	 * @throws IllegalArgumentException if an option is unknown or has a bad value
	 */
	public static BenchmarkConfiguration fromFile(String configFileName) throws IOException {
		BenchmarkConfiguration rtrn = new BenchmarkConfiguration();
		Scanner reader = new Scanner(new File(configFileName));
		try {
			int lineNumber = 0;
			while(reader.hasNextLine()) {
				String nextLine = reader.nextLine();
				lineNumber++;
				if(isComment(nextLine)) {
					continue;
				}
				String[] tokens = StringUtils.split(nextLine.trim());
				if(tokens.length < 2) {
					throw new IllegalArgumentException("Line " + lineNumber + " of " + configFileName + ": option " + tokens[0] + " has no value");
				}
				rtrn.setOption(tokens[0], Arrays.copyOfRange(tokens, 1, tokens.length));
			}
		} finally {
			reader.close();
		}
		logger.info("Read benchmark configuration from " + configFileName);
		return rtrn;
	}

	private static boolean isComment(String nextLine) {
		return StringUtils.isBlank(nextLine) || nextLine.trim().startsWith("#");
	}

	private void setOption(String option, String[] values) {
		if(option.equals(OPTION_SIZES)) {
			int[] s = new int[values.length];
			for(int i = 0; i < values.length; i++) {
				s[i] = Integer.parseInt(values[i]);
				if(s[i] <= 0) {
					throw new IllegalArgumentException("Text sizes must be positive: " + values[i]);
				}
			}
			setSizes(s);
		} else if(option.equals(OPTION_ITERATIONS)) {
			setIterations(Integer.parseInt(single(option, values)));
		} else if(option.equals(OPTION_GC_PERCENTAGE)) {
			setGcPercentage(Double.parseDouble(single(option, values)));
		} else if(option.equals(OPTION_SEED)) {
			seed = Long.parseLong(single(option, values));
		} else if(option.equals(OPTION_PATTERN)) {
			pattern = single(option, values).toUpperCase();
		} else if(option.equals(OPTION_PATTERNS)) {
			List<String> p = new ArrayList<String>();
			for(String v : values) {
				p.add(v.toUpperCase());
			}
			patterns = Collections.unmodifiableList(p);
		} else {
			throw new IllegalArgumentException("Unknown option " + option + ". Options: " + StringUtils.join(Arrays.asList(OPTION_SIZES, OPTION_ITERATIONS, OPTION_GC_PERCENTAGE, OPTION_SEED, OPTION_PATTERN, OPTION_PATTERNS), ", "));
		}
	}

	private static String single(String option, String[] values) {
		if(values.length != 1) {
			throw new IllegalArgumentException("Option " + option + " takes exactly one value");
		}
		return values[0];
	}

	public int[] getSizes() {
		return sizes.clone();
	}

	public void setSizes(int[] textSizes) {
		if(textSizes.length == 0) {
			throw new IllegalArgumentException("At least one text size is required");
		}
		sizes = textSizes.clone();
	}

	public int getIterations() {
		return iterations;
	}

	public void setIterations(int numIterations) {
		if(numIterations <= 0) {
			throw new IllegalArgumentException("Number of iterations must be positive: " + numIterations);
		}
		iterations = numIterations;
	}

	public double getGcPercentage() {
		return gcPercentage;
	}

	public void setGcPercentage(double gc) {
		if(gc < 0 || gc > 100) {
			throw new IllegalArgumentException("GC percentage must be between 0 and 100: " + gc);
		}
		gcPercentage = gc;
	}

	public long getSeed() {
		return seed;
	}

	public void setSeed(long randomSeed) {
		seed = randomSeed;
	}

	public String getPattern() {
		return pattern;
	}

	public List<String> getPatterns() {
		return patterns;
	}

}
