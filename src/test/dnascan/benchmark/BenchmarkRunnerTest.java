package dnascan.benchmark;

import java.util.Arrays;
import java.util.List;

import dnascan.core.matcher.MatcherFactory;
import dnascan.core.matcher.SequenceMatcher;
import dnascan.core.sequence.SequenceUtils;
import junit.framework.TestCase;

public class BenchmarkRunnerTest extends TestCase {

	public void testGeneratedGcCount() {
		BenchmarkRunner runner = new BenchmarkRunner(42);
		String dna = runner.generateRandomDna(1000, 50);
		assertEquals(1000, dna.length());
		assertTrue(SequenceUtils.isValid(dna));
		assertEquals(50.0, SequenceUtils.gcContent(dna), 1e-9);
		assertEquals(0.0, SequenceUtils.gcContent(runner.generateRandomDna(500, 0)), 1e-9);
		assertEquals(100.0, SequenceUtils.gcContent(runner.generateRandomDna(500, 100)), 1e-9);
		// floor(7 * 30 / 100) = 2
		String small = runner.generateRandomDna(7, 30);
		assertEquals(2, small.replaceAll("[AT]", "").length());
		assertEquals(0, runner.generateRandomDna(0, 50).length());
	}

	public void testSeedReproducibility() {
		assertEquals(new BenchmarkRunner(7).generateRandomDna(2000, 40), new BenchmarkRunner(7).generateRandomDna(2000, 40));
		assertFalse(new BenchmarkRunner(7).generateRandomDna(2000, 40).equals(new BenchmarkRunner(8).generateRandomDna(2000, 40)));
	}

	public void testBadGenerationArguments() {
		BenchmarkRunner runner = new BenchmarkRunner(1);
		try {
			runner.generateRandomDna(-1, 50);
			fail("Expected IllegalArgumentException");
		} catch(IllegalArgumentException e) {
			// expected
		}
		try {
			runner.generateRandomDna(10, 101);
			fail("Expected IllegalArgumentException");
		} catch(IllegalArgumentException e) {
			// expected
		}
	}

	public void testBenchmark() {
		SequenceMatcher matcher = MatcherFactory.buildSingleMatcher("ACG");
		BenchmarkResult result = BenchmarkRunner.benchmark(matcher, "ACGTACGTACG", 4);
		assertEquals("DFA", result.getAlgorithm());
		assertEquals(1, result.getNumPatterns());
		assertEquals(11, result.getTextSize());
		assertEquals(4, result.getIterations());
		assertEquals(3, result.getNumMatches());
		assertTrue(result.getMinMillis() <= result.getMeanMillis());
		assertTrue(result.getMeanMillis() <= result.getMaxMillis());
		assertEquals(result.getMeanMillis() * 4, result.getTotalMillis(), 1e-6);
		try {
			BenchmarkRunner.benchmark(matcher, "ACG", 0);
			fail("Expected IllegalArgumentException");
		} catch(IllegalArgumentException e) {
			// expected
		}
	}

	public void testScalability() {
		BenchmarkRunner runner = new BenchmarkRunner(42);
		SequenceMatcher matcher = MatcherFactory.buildMultiMatcher(BenchmarkConfiguration.DEFAULT_PATTERNS);
		List<ScalabilityPoint> points = runner.benchmarkScalability(matcher, new int[] {100, 1000, 5000}, 50, 2);
		assertEquals(3, points.size());
		assertEquals(100, points.get(0).getTextSize());
		assertEquals(5000, points.get(2).getTextSize());
		for(ScalabilityPoint p : points) {
			assertTrue(p.getTimeMillis() >= 0);
			assertTrue(p.getNumMatches() >= 0);
		}
	}

	public void testCompareAlgorithms() {
		String text = new BenchmarkRunner(3).generateRandomDna(20000, 50) + "GAATTC";
		AlgorithmComparison comparison = BenchmarkRunner.compareAlgorithms("GAATTC", Arrays.asList("GAATTC", "GGATCC"), text, 2);
		assertEquals("DFA", comparison.getSingleResult().getAlgorithm());
		assertEquals("Aho-Corasick", comparison.getMultiResult().getAlgorithm());
		assertTrue(comparison.getMultiResult().getNumMatches() >= comparison.getSingleResult().getNumMatches());
		assertTrue(comparison.getSingleResult().getNumMatches() >= 1);
		assertTrue(comparison.getFaster().equals("DFA") || comparison.getFaster().equals("Aho-Corasick"));
	}

	public void testSpeedup() {
		BenchmarkResult single = new BenchmarkResult("DFA", 1, 100, 1, 1, 1, 1, 1, 0);
		BenchmarkResult multi = new BenchmarkResult("Aho-Corasick", 5, 100, 1, 3, 3, 3, 3, 0);
		AlgorithmComparison comparison = new AlgorithmComparison(single, multi);
		assertEquals(3.0, comparison.getSpeedup(), 1e-9);
		assertEquals("DFA", comparison.getFaster());
		assertEquals("Aho-Corasick", new AlgorithmComparison(multi, single).getFaster());
	}

}
