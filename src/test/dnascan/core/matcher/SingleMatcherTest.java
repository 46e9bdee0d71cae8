package dnascan.core.matcher;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import dnascan.core.error.InvalidPatternException;
import dnascan.core.error.InvalidSequenceException;
import junit.framework.TestCase;

public class SingleMatcherTest extends TestCase {

	private static List<Integer> starts(List<MatchRecord> matches) {
		List<Integer> rtrn = new ArrayList<Integer>();
		for(MatchRecord r : matches) {
			rtrn.add(Integer.valueOf(r.getStart()));
		}
		return rtrn;
	}

	static String randomString(Random random, String symbols, int length) {
		StringBuilder sb = new StringBuilder();
		for(int i = 0; i < length; i++) {
			sb.append(symbols.charAt(random.nextInt(symbols.length())));
		}
		return sb.toString();
	}

	public void testKnownScenario() {
		List<MatchRecord> matches = new SingleMatcher("ACG").scan("AACGTACG");
		assertEquals(Arrays.asList(1, 5), starts(matches));
		for(MatchRecord r : matches) {
			assertEquals(1.0, r.getScore(), 0);
			assertEquals("ACG", r.getPattern());
			assertEquals(0, r.getPatternIndex());
			assertEquals(3, r.getLength());
		}
		assertEquals(4, matches.get(0).getEnd());
	}

	public void testOverlappingMatches() {
		assertEquals(Arrays.asList(0, 3), starts(new SingleMatcher("ACG").scan("ACGACG")));
		assertEquals(Arrays.asList(0, 1, 2), starts(new SingleMatcher("AA").scan("AAAA")));
		assertEquals(Arrays.asList(0, 2, 4), starts(new SingleMatcher("ACA").scan("ACACACA")));
	}

	public void testFailureFunction() {
		assertTrue(Arrays.equals(new int[] {0, 0, 1, 2}, new SingleMatcher("ACAC").getFailureFunction()));
		assertTrue(Arrays.equals(new int[] {0, 1, 2, 3}, new SingleMatcher("AAAA").getFailureFunction()));
		assertTrue(Arrays.equals(new int[] {0, 1, 0, 1, 2, 2}, new SingleMatcher("AACAAA").getFailureFunction()));
		assertTrue(Arrays.equals(new int[] {0, 0, 0}, new SingleMatcher("ACG").getFailureFunction()));
	}

	public void testFailureFunctionBounds() {
		Random random = new Random(7);
		for(int t = 0; t < 200; t++) {
			String pattern = randomString(random, "AC", 1 + random.nextInt(12));
			int[] fail = new SingleMatcher(pattern).getFailureFunction();
			assertEquals("fail[0] for " + pattern, 0, fail[0]);
			for(int i = 0; i < fail.length; i++) {
				assertTrue("fail[" + i + "] for " + pattern, fail[i] >= 0 && fail[i] <= i);
				// fail[i] is a border of pattern[0..i]
				assertEquals(pattern.substring(0, fail[i]), pattern.substring(i + 1 - fail[i], i + 1));
			}
		}
	}

	public void testTransitionTableIsTotal() {
		SingleMatcher dfa = new SingleMatcher("GATTACA");
		assertEquals(8, dfa.getNumStates());
		for(int s = 0; s < dfa.getNumStates(); s++) {
			for(char c : "ACGTN".toCharArray()) {
				int next = dfa.nextState(s, c);
				assertTrue(next >= 0 && next <= 7);
			}
		}
		assertEquals(1, dfa.nextState(0, 'G'));
		assertEquals(0, dfa.nextState(0, 'A'));
		assertEquals(4, dfa.nextState(3, 'N'));
		// After GATTACA, reading T: longest border of GATTACAT that is a prefix is empty
		assertEquals(0, dfa.nextState(7, 'T'));
		assertEquals(1, dfa.nextState(7, 'G'));
	}

	public void testAgreesWithNaiveSearch() {
		Random random = new Random(11);
		for(int t = 0; t < 300; t++) {
			String pattern = randomString(random, "ACGT".substring(0, 2 + random.nextInt(3)), 1 + random.nextInt(5));
			String text = randomString(random, "ACGT".substring(0, 2 + random.nextInt(3)), random.nextInt(150));
			List<Integer> expected = new ArrayList<Integer>();
			for(int i = 0; i + pattern.length() <= text.length(); i++) {
				if(text.startsWith(pattern, i)) {
					expected.add(Integer.valueOf(i));
				}
			}
			assertEquals(pattern + " in " + text, expected, starts(new SingleMatcher(pattern).scan(text)));
		}
	}

	public void testWildcardInSequence() {
		assertEquals(Arrays.asList(0, 4), starts(new SingleMatcher("ACG").scan("ANGTACN")));
		assertEquals(Arrays.asList(0, 1, 2), starts(new SingleMatcher("AA").scan("ANAA")));
		assertEquals(Arrays.asList(0), starts(new SingleMatcher("ACGT").scan("ACNT")));
		assertEquals(Arrays.asList(0, 1, 2), starts(new SingleMatcher("AA").scan("NNNN")));
		// One canonical transition per wildcard: after CG the chain restarts at C, so NNNN does not also match at 1
		assertEquals(Arrays.asList(0, 2), starts(new SingleMatcher("CG").scan("NNNN")));
	}

	public void testEmptySequence() {
		assertTrue(new SingleMatcher("ACG").scan("").isEmpty());
	}

	public void testPatternLongerThanSequence() {
		assertTrue(new SingleMatcher("ACGTACGT").scan("ACGT").isEmpty());
	}

	public void testIdempotentScan() {
		SingleMatcher dfa = new SingleMatcher("TATA");
		String text = "TATATATAGGTATA";
		List<MatchRecord> first = dfa.scan(text);
		List<MatchRecord> second = dfa.scan(text);
		assertEquals(first, second);
		assertNotSame(first, second);
		assertEquals(Arrays.asList(0, 2, 4, 10), starts(first));
	}

	public void testInvalidPatterns() {
		for(String bad : new String[] {"", null, "ACGN", "acg", "ACGX", "AC GT"}) {
			try {
				new SingleMatcher(bad);
				fail("Expected InvalidPatternException for " + bad);
			} catch(InvalidPatternException e) {
				// expected
			}
		}
	}

	public void testInvalidSequence() {
		SingleMatcher dfa = new SingleMatcher("ACG");
		try {
			dfa.scan("ACXG");
			fail("Expected InvalidSequenceException");
		} catch(InvalidSequenceException e) {
			assertEquals(2, e.getPosition());
		}
		try {
			dfa.scan("acg");
			fail("Expected InvalidSequenceException for lower case");
		} catch(InvalidSequenceException e) {
			assertEquals(0, e.getPosition());
		}
		try {
			dfa.scan(null);
			fail("Expected InvalidSequenceException for null");
		} catch(InvalidSequenceException e) {
			assertEquals(-1, e.getPosition());
		}
	}

	public void testPatternAccessors() {
		SingleMatcher dfa = new SingleMatcher("GGATCC");
		assertEquals("GGATCC", dfa.getPattern());
		assertEquals(Arrays.asList("GGATCC"), dfa.getPatterns());
		assertEquals("DFA", dfa.getAlgorithmName());
		try {
			dfa.getPatterns().add("ACG");
			fail("Pattern list should be unmodifiable");
		} catch(UnsupportedOperationException e) {
			// expected
		}
	}

}
