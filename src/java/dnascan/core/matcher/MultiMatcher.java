package dnascan.core.matcher;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Queue;

import org.apache.log4j.Logger;

import dnascan.core.error.EmptyPatternSetException;
import dnascan.core.error.InvalidSequenceException;
import dnascan.core.sequence.DnaAlphabet;

/**
 * Multi pattern matcher backed by an Aho-Corasick automaton
 * The trie is assembled by a {@link Builder}, which computes failure links and output sets once and
 * freezes everything into arrays. Instances cannot be modified after construction.
 * Node 0 is the root; its failure link points to itself.
 */
public final class MultiMatcher implements SequenceMatcher {

	static Logger logger = Logger.getLogger(MultiMatcher.class.getName());

	private static final int NO_NODE = -1;

	private final List<String> patterns;
	private final int[][] children;
	private final int[] failure;
	private final int[][] outputs;
	private final int[] wildcardChild;

	private MultiMatcher(List<String> patterns, int[][] children, int[] failure, int[][] outputs) {
		this.patterns = patterns;
		this.children = children;
		this.failure = failure;
		this.outputs = outputs;
		wildcardChild = new int[children.length];
		for(int node = 0; node < children.length; node++) {
			wildcardChild[node] = NO_NODE;
			for(int b = 0; b < DnaAlphabet.NUM_BASES; b++) {
				if(children[node][b] != NO_NODE) {
					wildcardChild[node] = children[node][b];
					break;
				}
			}
		}
	}

	/**
	 * @return A new empty builder
	 */
	public static Builder builder() {
		return new Builder();
	}

	@Override
	public List<MatchRecord> scan(String sequence) {
		if(sequence == null) {
			throw new InvalidSequenceException("Sequence is null", -1);
		}
		List<MatchRecord> rtrn = new ArrayList<MatchRecord>();
		int node = 0;
		for(int i = 0; i < sequence.length(); i++) {
			int col = DnaAlphabet.columnAt(sequence, i);
			if(col == DnaAlphabet.WILDCARD_INDEX) {
				while(node != 0 && wildcardChild[node] == NO_NODE) {
					node = failure[node];
				}
				if(wildcardChild[node] != NO_NODE) {
					node = wildcardChild[node];
				}
			} else {
				while(node != 0 && children[node][col] == NO_NODE) {
					node = failure[node];
				}
				int next = children[node][col];
				node = next == NO_NODE ? 0 : next;
			}
			for(int p : outputs[node]) {
				String pattern = patterns.get(p);
				rtrn.add(new MatchRecord(i - pattern.length() + 1, p, pattern));
			}
		}
		// Records come out grouped by end position
		Collections.sort(rtrn);
		return rtrn;
	}

	@Override
	public List<String> getPatterns() {
		return patterns;
	}

	@Override
	public String getAlgorithmName() {
		return "Aho-Corasick";
	}

	/**
	 * @return Number of trie nodes including the root
	 */
	public int getNumNodes() {
		return children.length;
	}

	int getFailureLink(int node) {
		return failure[node];
	}

	int getChild(int node, char base) {
		return children[node][DnaAlphabet.indexOf(base)];
	}

	int[] getOutputs(int node) {
		return outputs[node].clone();
	}

	@Override
	public String toString() {
		return getAlgorithmName() + patterns.toString();
	}

	/**
	 * Mutable trie used while patterns are being added
	 * Calling {@link #build()} computes failure links and output sets and hands the result to an immutable {@link MultiMatcher}.
	 * A builder can be built only once and is not thread safe.
	 */
	public static final class Builder {

		private final List<String> patterns;
		private final List<int[]> children;
		private final List<List<Integer>> terminals;
		private boolean built;

		Builder() {
			patterns = new ArrayList<String>();
			children = new ArrayList<int[]>();
			terminals = new ArrayList<List<Integer>>();
			built = false;
			newNode();
		}

		private int newNode() {
			int[] row = new int[DnaAlphabet.NUM_BASES];
			Arrays.fill(row, NO_NODE);
			children.add(row);
			terminals.add(new ArrayList<Integer>());
			return children.size() - 1;
		}

		private void checkNotBuilt() {
			if(built) {
				throw new IllegalStateException("Builder has already been used to build a matcher");
			}
		}

		/**
		 * Insert a pattern into the trie
		 * Duplicate patterns are kept and reported separately
		 * @param pattern Non-empty pattern over A, C, G, T
		 * @return This builder
		 * @throws dnascan.core.error.InvalidPatternException if the pattern is empty or contains another symbol
		 */
		public Builder addPattern(String pattern) {
			checkNotBuilt();
			int index = patterns.size();
			DnaAlphabet.checkPattern(pattern, "Pattern " + index);
			int node = 0;
			for(int i = 0; i < pattern.length(); i++) {
				int b = DnaAlphabet.indexOf(pattern.charAt(i));
				if(children.get(node)[b] == NO_NODE) {
					int child = newNode();
					children.get(node)[b] = child;
				}
				node = children.get(node)[b];
			}
			terminals.get(node).add(Integer.valueOf(index));
			patterns.add(pattern);
			return this;
		}

		/**
		 * Insert several patterns in iteration order
		 * @param toAdd The patterns
		 * @return This builder
		 */
		public Builder addPatterns(Collection<String> toAdd) {
			for(String pattern : toAdd) {
				addPattern(pattern);
			}
			return this;
		}

		/**
		 * Compute failure links breadth first, merge inherited outputs, and freeze the automaton
		 * @return The matcher
		 * @throws EmptyPatternSetException if no pattern was added
		 */
		public MultiMatcher build() {
			checkNotBuilt();
			if(patterns.isEmpty()) {
				throw new EmptyPatternSetException();
			}
			built = true;
			int numNodes = children.size();
			int[][] frozenChildren = children.toArray(new int[numNodes][]);
			int[] failure = new int[numNodes];
			int[][] outputs = new int[numNodes][];
			outputs[0] = toArray(terminals.get(0));

			Queue<Integer> queue = new ArrayDeque<Integer>();
			for(int b = 0; b < DnaAlphabet.NUM_BASES; b++) {
				int child = frozenChildren[0][b];
				if(child != NO_NODE) {
					failure[child] = 0;
					outputs[child] = toArray(terminals.get(child));
					queue.add(Integer.valueOf(child));
				}
			}

			// A node's failure target is shallower, so it is finalized before the node itself
			while(!queue.isEmpty()) {
				int u = queue.remove().intValue();
				for(int b = 0; b < DnaAlphabet.NUM_BASES; b++) {
					int v = frozenChildren[u][b];
					if(v == NO_NODE) {
						continue;
					}
					int w = failure[u];
					while(w != 0 && frozenChildren[w][b] == NO_NODE) {
						w = failure[w];
					}
					int target = frozenChildren[w][b];
					failure[v] = target == NO_NODE ? 0 : target;
					outputs[v] = concat(terminals.get(v), outputs[failure[v]]);
					queue.add(Integer.valueOf(v));
				}
			}

			logger.debug("Built Aho-Corasick automaton for " + patterns.size() + " patterns with " + numNodes + " nodes");
			return new MultiMatcher(Collections.unmodifiableList(new ArrayList<String>(patterns)), frozenChildren, failure, outputs);
		}

		private static int[] toArray(List<Integer> values) {
			int[] rtrn = new int[values.size()];
			for(int i = 0; i < rtrn.length; i++) {
				rtrn[i] = values.get(i).intValue();
			}
			return rtrn;
		}

		private static int[] concat(List<Integer> own, int[] inherited) {
			int[] rtrn = new int[own.size() + inherited.length];
			for(int i = 0; i < own.size(); i++) {
				rtrn[i] = own.get(i).intValue();
			}
			System.arraycopy(inherited, 0, rtrn, own.size(), inherited.length);
			return rtrn;
		}

	}

}
