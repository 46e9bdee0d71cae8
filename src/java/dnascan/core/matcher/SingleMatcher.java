package dnascan.core.matcher;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

import dnascan.core.error.InvalidSequenceException;
import dnascan.core.sequence.DnaAlphabet;

/**
 * Single pattern matcher backed by a deterministic automaton built from the pattern's failure function
 * State s means the last s scanned symbols equal the first s symbols of the pattern. State m, the pattern length, is the only accepting state.
 * A wildcard N in the scanned sequence takes the transition that extends the longest live prefix
 */
public final class SingleMatcher implements SequenceMatcher {

	static Logger logger = Logger.getLogger(SingleMatcher.class.getName());

	private final String pattern;
	private final int[] failure;
	private final int[][] transitions;

	/**
	 * @param pattern Non-empty pattern over A, C, G, T
	 * @throws dnascan.core.error.InvalidPatternException if the pattern is empty or contains another symbol
	 */
	public SingleMatcher(String pattern) {
		DnaAlphabet.checkPattern(pattern, "Pattern");
		this.pattern = pattern;
		failure = computeFailureFunction(pattern);
		transitions = buildTransitionTable(pattern, failure);
		logger.debug("Built automaton for " + pattern + " with " + transitions.length + " states");
	}

	/**
	 * Compute the failure function of a pattern
	 * failure[i] is the length of the longest proper prefix of pattern[0..i] that is also a suffix of it
	 * @param pattern The pattern
	 * @return The failure function
	 */
	static int[] computeFailureFunction(String pattern) {
		int[] rtrn = new int[pattern.length()];
		int k = 0;
		for(int i = 1; i < pattern.length(); i++) {
			while(k > 0 && pattern.charAt(i) != pattern.charAt(k)) {
				k = rtrn[k - 1];
			}
			if(pattern.charAt(i) == pattern.charAt(k)) {
				k++;
			}
			rtrn[i] = k;
		}
		return rtrn;
	}

	/**
	 * Build the total transition table
	 * Rows are filled in increasing state order so the row of a failure target, always a smaller state, is ready when needed
	 * @param pattern The pattern
	 * @param failure Failure function of the pattern
	 * @return Table indexed by state then by alphabet column
	 */
	private static int[][] buildTransitionTable(String pattern, int[] failure) {
		int m = pattern.length();
		int[][] rtrn = new int[m + 1][DnaAlphabet.NUM_SYMBOLS];
		for(int s = 0; s <= m; s++) {
			for(int b = 0; b < DnaAlphabet.NUM_BASES; b++) {
				char c = DnaAlphabet.BASES[b];
				if(s < m && pattern.charAt(s) == c) {
					rtrn[s][b] = s + 1;
				} else if(s == 0) {
					rtrn[s][b] = 0;
				} else {
					rtrn[s][b] = rtrn[failure[s - 1]][b];
				}
			}
			// Wildcard stands in for whichever base the longest live prefix needs next
			if(s < m) {
				rtrn[s][DnaAlphabet.WILDCARD_INDEX] = s + 1;
			} else {
				rtrn[s][DnaAlphabet.WILDCARD_INDEX] = rtrn[failure[s - 1]][DnaAlphabet.WILDCARD_INDEX];
			}
		}
		return rtrn;
	}

	@Override
	public List<MatchRecord> scan(String sequence) {
		if(sequence == null) {
			throw new InvalidSequenceException("Sequence is null", -1);
		}
		int m = pattern.length();
		List<MatchRecord> rtrn = new ArrayList<MatchRecord>();
		int state = 0;
		for(int i = 0; i < sequence.length(); i++) {
			state = transitions[state][DnaAlphabet.columnAt(sequence, i)];
			if(state == m) {
				rtrn.add(new MatchRecord(i - m + 1, 0, pattern));
			}
		}
		return rtrn;
	}

	/**
	 * @return The pattern
	 */
	public String getPattern() {
		return pattern;
	}

	@Override
	public List<String> getPatterns() {
		return Collections.singletonList(pattern);
	}

	@Override
	public String getAlgorithmName() {
		return "DFA";
	}

	/**
	 * @return Number of states including the initial and accepting states
	 */
	public int getNumStates() {
		return transitions.length;
	}

	/**
	 * Get a copy of the failure function
	 * @return failure[i] is the length of the longest proper prefix of pattern[0..i] that is also a suffix of it
	 */
	public int[] getFailureFunction() {
		return failure.clone();
	}

	/**
	 * Look up a transition
	 * @param state Current state
	 * @param symbol Symbol read, one of A, C, G, T, N
	 * @return Next state
	 */
	public int nextState(int state, char symbol) {
		if(state < 0 || state >= transitions.length) {
			throw new IllegalArgumentException("State " + state + " out of range [0, " + pattern.length() + "]");
		}
		int col = DnaAlphabet.indexOf(symbol);
		if(col < 0) {
			throw new InvalidSequenceException("Invalid symbol '" + symbol + "'", -1);
		}
		return transitions[state][col];
	}

	@Override
	public String toString() {
		return getAlgorithmName() + "[" + pattern + "]";
	}

}
