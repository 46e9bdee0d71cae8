package dnascan.core.matcher;

import java.util.Collection;

import org.apache.log4j.Logger;

import dnascan.core.error.EmptyPatternSetException;

/**
 * Construction entry points for the matchers
 */
public class MatcherFactory {

	static Logger logger = Logger.getLogger(MatcherFactory.class.getName());

	private MatcherFactory() {}

	/**
	 * Build a single pattern matcher
	 * @param pattern Non-empty pattern over A, C, G, T
	 * @return The matcher
	 * @throws dnascan.core.error.InvalidPatternException if the pattern is empty or contains another symbol
	 */
	public static SingleMatcher buildSingleMatcher(String pattern) {
		SingleMatcher rtrn = new SingleMatcher(pattern);
		logger.info("DFA initialized for pattern " + pattern + " (" + pattern.length() + " bp)");
		return rtrn;
	}

	/**
	 * Build a multi pattern matcher
	 * @param patterns Non-empty ordered collection of non-empty patterns over A, C, G, T
	 * @return The matcher
	 * @throws EmptyPatternSetException if the collection is null or empty
	 * @throws dnascan.core.error.InvalidPatternException if any pattern is empty or contains another symbol
	 */
	public static MultiMatcher buildMultiMatcher(Collection<String> patterns) {
		if(patterns == null || patterns.isEmpty()) {
			throw new EmptyPatternSetException();
		}
		MultiMatcher rtrn = MultiMatcher.builder().addPatterns(patterns).build();
		logger.info("Aho-Corasick initialized with " + patterns.size() + " patterns (" + rtrn.getNumNodes() + " nodes)");
		return rtrn;
	}

	/**
	 * Build the natural matcher for a set of patterns: a DFA for one pattern, Aho-Corasick otherwise
	 * @param patterns Non-empty ordered collection of patterns
	 * @return The matcher
	 */
	public static SequenceMatcher buildMatcher(Collection<String> patterns) {
		if(patterns != null && patterns.size() == 1) {
			return buildSingleMatcher(patterns.iterator().next());
		}
		return buildMultiMatcher(patterns);
	}

}
