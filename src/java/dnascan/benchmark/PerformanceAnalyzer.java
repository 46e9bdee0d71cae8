package dnascan.benchmark;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.apache.commons.math3.stat.regression.SimpleRegression;

/**
 * Checks whether scan time grows linearly with text size and formats benchmark reports
 */
public class PerformanceAnalyzer {

	/**
	 * Allowed relative difference between a size ratio and the matching time ratio
	 */
	public static final double LINEARITY_TOLERANCE = 0.2;

	/**
	 * Smallest ratio between the largest and smallest text size accepted by {@link #isLinearFit(List, double)}
	 */
	public static final double MIN_SIZE_SPAN = 100;

	private static final String RULE = StringUtils.repeat("=", 60);
	private static final String THIN_RULE = StringUtils.repeat("-", 60);

	private PerformanceAnalyzer() {}

	/**
	 * Compare each consecutive pair of points: time should grow by the same factor as size
	 * @param points Points in increasing size order
	 * @return The analysis
	 */
	public static LinearityAnalysis checkLinearTime(List<ScalabilityPoint> points) {
		if(points.size() < 2) {
			return new LinearityAnalysis(false, Collections.<RatioCheck>emptyList(), "Need at least 2 data points");
		}
		List<RatioCheck> ratios = new ArrayList<RatioCheck>();
		boolean allLinear = true;
		for(int i = 0; i < points.size() - 1; i++) {
			ScalabilityPoint curr = points.get(i);
			ScalabilityPoint next = points.get(i + 1);
			double sizeRatio = (double) next.getTextSize() / curr.getTextSize();
			double timeRatio = next.getTimeMillis() / curr.getTimeMillis();
			double difference = Math.abs(sizeRatio - timeRatio) / sizeRatio;
			boolean linear = difference <= LINEARITY_TOLERANCE;
			ratios.add(new RatioCheck(sizeRatio, timeRatio, difference, linear));
			if(!linear) {
				allLinear = false;
			}
		}
		String explanation = allLinear ? "Scan time scales linearly with input size: O(n)" : "Deviation from O(n): check for non-linear bottlenecks";
		return new LinearityAnalysis(allLinear, ratios, explanation);
	}

	/**
	 * Least squares fit of time against size
	 * @param points Points
	 * @return Slope, intercept and R squared
	 */
	public static RegressionSummary regress(List<ScalabilityPoint> points) {
		if(points.size() < 2) {
			throw new IllegalArgumentException("Need at least 2 data points for regression");
		}
		SimpleRegression regression = new SimpleRegression();
		for(ScalabilityPoint p : points) {
			regression.addData(p.getTextSize(), p.getTimeMillis());
		}
		return new RegressionSummary(regression.getSlope(), regression.getIntercept(), regression.getRSquare(), points.size());
	}

	/**
	 * Whether time is explained by a straight line in size over a wide enough range of sizes
	 * Requires at least three points whose largest size is at least {@link #MIN_SIZE_SPAN} times the smallest
	 * @param points Points
	 * @param minRSquared Smallest acceptable R squared
	 * @return True iff the fit is linear with a positive slope
	 */
	public static boolean isLinearFit(List<ScalabilityPoint> points, double minRSquared) {
		if(points.size() < 3) {
			return false;
		}
		int minSize = Integer.MAX_VALUE;
		int maxSize = 0;
		for(ScalabilityPoint p : points) {
			minSize = Math.min(minSize, p.getTextSize());
			maxSize = Math.max(maxSize, p.getTextSize());
		}
		if(minSize <= 0 || (double) maxSize / minSize < MIN_SIZE_SPAN) {
			return false;
		}
		RegressionSummary fit = regress(points);
		return fit.getSlope() > 0 && fit.getRSquared() >= minRSquared;
	}

	/**
	 * Classify the mean growth rate of time relative to size
	 * @param points Points in increasing size order
	 * @return The estimate
	 */
	public static ComplexityEstimate estimateComplexity(List<ScalabilityPoint> points) {
		if(points.size() < 2) {
			return new ComplexityEstimate("Unknown", 0, Double.NaN, "Need at least 2 data points");
		}
		SummaryStatistics growth = new SummaryStatistics();
		for(int i = 0; i < points.size() - 1; i++) {
			ScalabilityPoint curr = points.get(i);
			ScalabilityPoint next = points.get(i + 1);
			double sizeRatio = (double) next.getTextSize() / curr.getTextSize();
			double timeRatio = next.getTimeMillis() / curr.getTimeMillis();
			growth.addValue(timeRatio / sizeRatio);
		}
		double avg = growth.getMean();
		String complexity;
		double confidence;
		if(avg < 1.1) {
			complexity = "O(n)";
			confidence = 0.9;
		} else if(avg < 1.2) {
			complexity = "O(n log n)";
			confidence = 0.7;
		} else if(avg < 1.5) {
			complexity = "O(n sqrt n)";
			confidence = 0.5;
		} else {
			complexity = "O(n^2) or worse";
			confidence = 0.6;
		}
		String evidence = "Average growth rate: " + String.format("%.2f", Double.valueOf(avg)) + "x (closer to 1.0 = more linear)";
		return new ComplexityEstimate(complexity, confidence, avg, evidence);
	}

	/**
	 * @param points Points
	 * @return Summary, or null if there are no points
	 */
	public static SummaryStats summaryStatistics(List<ScalabilityPoint> points) {
		if(points.isEmpty()) {
			return null;
		}
		SummaryStatistics times = new SummaryStatistics();
		SummaryStatistics sizes = new SummaryStatistics();
		long totalMatches = 0;
		for(ScalabilityPoint p : points) {
			times.addValue(p.getTimeMillis());
			sizes.addValue(p.getTextSize());
			totalMatches += p.getNumMatches();
		}
		return new SummaryStats(times.getMin(), times.getMax(), times.getMean(), (int) sizes.getMin(), (int) sizes.getMax(), totalMatches, points.size());
	}

	/**
	 * Plain text report with one row per point followed by the linearity analysis
	 * @param points Points in increasing size order
	 * @return The report
	 */
	public static String generateReport(List<ScalabilityPoint> points) {
		List<String> lines = new ArrayList<String>();
		lines.add(RULE);
		lines.add("BENCHMARK RESULTS");
		lines.add(RULE);
		lines.add("");
		lines.add(String.format("%-15s %-15s %-15s", "Text Size", "Time (ms)", "Matches"));
		lines.add(THIN_RULE);
		for(ScalabilityPoint p : points) {
			lines.add(String.format("%-15s %-15.4f %-15d", formatSize(p.getTextSize()), Double.valueOf(p.getTimeMillis()), Integer.valueOf(p.getNumMatches())));
		}
		lines.add("");
		lines.add(RULE);
		LinearityAnalysis analysis = checkLinearTime(points);
		lines.add("ANALYSIS");
		lines.add(THIN_RULE);
		lines.add(analysis.getExplanation());
		lines.add("");
		if(!analysis.getRatios().isEmpty()) {
			lines.add("Size-Time Ratio Analysis:");
			for(RatioCheck r : analysis.getRatios()) {
				String status = r.isLinear() ? "OK" : "!!";
				lines.add(String.format("  %s Input %.0fx larger -> Time %.2fx longer (diff: %.1f%%)", status, Double.valueOf(r.getSizeRatio()), Double.valueOf(r.getTimeRatio()), Double.valueOf(r.getDifference() * 100)));
			}
		}
		if(points.size() >= 2) {
			RegressionSummary fit = regress(points);
			lines.add("");
			lines.add(String.format("Least squares fit: time = %.6g * size + %.6g (R^2 = %.4f)", Double.valueOf(fit.getSlope()), Double.valueOf(fit.getIntercept()), Double.valueOf(fit.getRSquared())));
		}
		lines.add("");
		lines.add(RULE);
		return StringUtils.join(lines, "\n");
	}

	/**
	 * @param size Size in bases
	 * @return Size with a bp, KB or MB unit
	 */
	static String formatSize(int size) {
		if(size >= 1000000) {
			return String.format("%.1f MB", Double.valueOf(size / 1e6));
		}
		if(size >= 1000) {
			return String.format("%.1f KB", Double.valueOf(size / 1e3));
		}
		return size + " bp";
	}

	/**
	 * Size and time ratio between two consecutive points
	 */
	public static class RatioCheck {

		private final double sizeRatio;
		private final double timeRatio;
		private final double difference;
		private final boolean linear;

		RatioCheck(double sizeRatio, double timeRatio, double difference, boolean linear) {
			this.sizeRatio = sizeRatio;
			this.timeRatio = timeRatio;
			this.difference = difference;
			this.linear = linear;
		}

		public double getSizeRatio() {
			return sizeRatio;
		}

		public double getTimeRatio() {
			return timeRatio;
		}

		/**
		 * @return |sizeRatio - timeRatio| / sizeRatio
		 */
		public double getDifference() {
			return difference;
		}

		public boolean isLinear() {
			return linear;
		}

	}

	/**
	 * Result of {@link PerformanceAnalyzer#checkLinearTime(List)}
	 */
	public static class LinearityAnalysis {

		private final boolean linear;
		private final List<RatioCheck> ratios;
		private final String explanation;

		LinearityAnalysis(boolean linear, List<RatioCheck> ratios, String explanation) {
			this.linear = linear;
			this.ratios = Collections.unmodifiableList(ratios);
			this.explanation = explanation;
		}

		public boolean isLinear() {
			return linear;
		}

		public List<RatioCheck> getRatios() {
			return ratios;
		}

		public double getTolerance() {
			return LINEARITY_TOLERANCE;
		}

		public String getExplanation() {
			return explanation;
		}

	}

	/**
	 * Least squares fit of time (ms) against size (bases)
	 */
	public static class RegressionSummary {

		private final double slope;
		private final double intercept;
		private final double rSquared;
		private final int numPoints;

		RegressionSummary(double slope, double intercept, double rSquared, int numPoints) {
			this.slope = slope;
			this.intercept = intercept;
			this.rSquared = rSquared;
			this.numPoints = numPoints;
		}

		/**
		 * @return Milliseconds per base
		 */
		public double getSlope() {
			return slope;
		}

		public double getIntercept() {
			return intercept;
		}

		public double getRSquared() {
			return rSquared;
		}

		public int getNumPoints() {
			return numPoints;
		}

	}

	/**
	 * Result of {@link PerformanceAnalyzer#estimateComplexity(List)}
	 */
	public static class ComplexityEstimate {

		private final String complexity;
		private final double confidence;
		private final double growthRate;
		private final String evidence;

		ComplexityEstimate(String complexity, double confidence, double growthRate, String evidence) {
			this.complexity = complexity;
			this.confidence = confidence;
			this.growthRate = growthRate;
			this.evidence = evidence;
		}

		public String getEstimatedComplexity() {
			return complexity;
		}

		public double getConfidence() {
			return confidence;
		}

		/**
		 * @return Mean of time ratio / size ratio, or NaN with fewer than two points
		 */
		public double getGrowthRate() {
			return growthRate;
		}

		public String getEvidence() {
			return evidence;
		}

	}

	/**
	 * Result of {@link PerformanceAnalyzer#summaryStatistics(List)}
	 */
	public static class SummaryStats {

		private final double minTime;
		private final double maxTime;
		private final double meanTime;
		private final int minSize;
		private final int maxSize;
		private final long totalMatches;
		private final int numTests;

		SummaryStats(double minTime, double maxTime, double meanTime, int minSize, int maxSize, long totalMatches, int numTests) {
			this.minTime = minTime;
			this.maxTime = maxTime;
			this.meanTime = meanTime;
			this.minSize = minSize;
			this.maxSize = maxSize;
			this.totalMatches = totalMatches;
			this.numTests = numTests;
		}

		public double getMinTimeMillis() {
			return minTime;
		}

		public double getMaxTimeMillis() {
			return maxTime;
		}

		public double getMeanTimeMillis() {
			return meanTime;
		}

		public int getMinSize() {
			return minSize;
		}

		public int getMaxSize() {
			return maxSize;
		}

		public long getTotalMatches() {
			return totalMatches;
		}

		public int getNumTests() {
			return numTests;
		}

	}

}
