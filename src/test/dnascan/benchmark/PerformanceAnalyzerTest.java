package dnascan.benchmark;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import junit.framework.TestCase;

public class PerformanceAnalyzerTest extends TestCase {

	private static List<ScalabilityPoint> points(int[] sizes, double[] times) {
		List<ScalabilityPoint> rtrn = new ArrayList<ScalabilityPoint>();
		for(int i = 0; i < sizes.length; i++) {
			rtrn.add(new ScalabilityPoint(sizes[i], times[i], i));
		}
		return rtrn;
	}

	private static final int[] SIZES = {1000, 10000, 100000, 1000000};

	public void testLinearTimes() {
		List<ScalabilityPoint> linear = points(SIZES, new double[] {0.1, 1.0, 10.5, 101});
		PerformanceAnalyzer.LinearityAnalysis analysis = PerformanceAnalyzer.checkLinearTime(linear);
		assertTrue(analysis.isLinear());
		assertEquals(3, analysis.getRatios().size());
		assertEquals(10.0, analysis.getRatios().get(0).getSizeRatio(), 1e-9);
		assertEquals(0.2, analysis.getTolerance(), 0);
		assertTrue(PerformanceAnalyzer.isLinearFit(linear, 0.95));
		assertEquals("O(n)", PerformanceAnalyzer.estimateComplexity(linear).getEstimatedComplexity());
		assertEquals(0.9, PerformanceAnalyzer.estimateComplexity(linear).getConfidence(), 0);
	}

	public void testQuadraticTimes() {
		List<ScalabilityPoint> quadratic = points(SIZES, new double[] {0.01, 1, 100, 10000});
		PerformanceAnalyzer.LinearityAnalysis analysis = PerformanceAnalyzer.checkLinearTime(quadratic);
		assertFalse(analysis.isLinear());
		assertFalse(analysis.getRatios().get(0).isLinear());
		PerformanceAnalyzer.ComplexityEstimate estimate = PerformanceAnalyzer.estimateComplexity(quadratic);
		assertEquals("O(n^2) or worse", estimate.getEstimatedComplexity());
		assertEquals(10.0, estimate.getGrowthRate(), 1e-9);
	}

	public void testComplexityClasses() {
		int[] sizes = {1000, 10000};
		assertEquals("O(n log n)", PerformanceAnalyzer.estimateComplexity(points(sizes, new double[] {1, 11.5})).getEstimatedComplexity());
		assertEquals("O(n sqrt n)", PerformanceAnalyzer.estimateComplexity(points(sizes, new double[] {1, 13})).getEstimatedComplexity());
		PerformanceAnalyzer.ComplexityEstimate unknown = PerformanceAnalyzer.estimateComplexity(points(new int[] {1000}, new double[] {1}));
		assertEquals("Unknown", unknown.getEstimatedComplexity());
		assertEquals(0.0, unknown.getConfidence(), 0);
		assertTrue(Double.isNaN(unknown.getGrowthRate()));
	}

	public void testTooFewPoints() {
		PerformanceAnalyzer.LinearityAnalysis analysis = PerformanceAnalyzer.checkLinearTime(points(new int[] {1000}, new double[] {1}));
		assertFalse(analysis.isLinear());
		assertEquals("Need at least 2 data points", analysis.getExplanation());
		assertTrue(analysis.getRatios().isEmpty());
		try {
			PerformanceAnalyzer.regress(Collections.<ScalabilityPoint>emptyList());
			fail("Expected IllegalArgumentException");
		} catch(IllegalArgumentException e) {
			// expected
		}
	}

	public void testRegression() {
		PerformanceAnalyzer.RegressionSummary fit = PerformanceAnalyzer.regress(points(new int[] {100, 200, 300}, new double[] {1.5, 2.5, 3.5}));
		assertEquals(0.01, fit.getSlope(), 1e-9);
		assertEquals(0.5, fit.getIntercept(), 1e-9);
		assertEquals(1.0, fit.getRSquared(), 1e-9);
		assertEquals(3, fit.getNumPoints());
	}

	public void testLinearFitNeedsEnoughSpan() {
		// Perfect line but sizes only span 10x
		assertFalse(PerformanceAnalyzer.isLinearFit(points(new int[] {1000, 5000, 10000}, new double[] {1, 5, 10}), 0.9));
		// Two points are never enough
		assertFalse(PerformanceAnalyzer.isLinearFit(points(new int[] {1000, 1000000}, new double[] {1, 1000}), 0.9));
		// Decreasing times
		assertFalse(PerformanceAnalyzer.isLinearFit(points(SIZES, new double[] {4, 3, 2, 1}), 0.0));
	}

	public void testSummaryStatistics() {
		assertNull(PerformanceAnalyzer.summaryStatistics(Collections.<ScalabilityPoint>emptyList()));
		PerformanceAnalyzer.SummaryStats stats = PerformanceAnalyzer.summaryStatistics(Arrays.asList(new ScalabilityPoint(100, 1, 2), new ScalabilityPoint(1000, 3, 5)));
		assertEquals(1.0, stats.getMinTimeMillis(), 0);
		assertEquals(3.0, stats.getMaxTimeMillis(), 0);
		assertEquals(2.0, stats.getMeanTimeMillis(), 1e-9);
		assertEquals(100, stats.getMinSize());
		assertEquals(1000, stats.getMaxSize());
		assertEquals(7, stats.getTotalMatches());
		assertEquals(2, stats.getNumTests());
	}

	public void testFormatSize() {
		assertEquals("500 bp", PerformanceAnalyzer.formatSize(500));
		assertEquals("1.0 KB", PerformanceAnalyzer.formatSize(1000));
		assertEquals("1.0 MB", PerformanceAnalyzer.formatSize(1000000));
	}

	public void testReport() {
		String report = PerformanceAnalyzer.generateReport(points(SIZES, new double[] {0.1, 1.0, 10.5, 101}));
		assertTrue(report.contains("BENCHMARK RESULTS"));
		assertTrue(report.contains("ANALYSIS"));
		assertTrue(report.contains("1.0 MB"));
		assertTrue(report.contains("Least squares fit"));
		assertTrue(report.contains("OK Input 10x larger"));
	}

}
