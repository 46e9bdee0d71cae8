package dnascan.core.sequence;

import dnascan.core.error.InvalidPatternException;
import dnascan.core.error.InvalidSequenceException;

/**
 * The symbol set shared by both automata
 * Bases are A, C, G, T. N is a wildcard that may appear in scanned sequences but never in patterns.
 * Symbols are upper case only
 */
public final class DnaAlphabet {

	/**
	 * The wildcard symbol
	 */
	public static final char WILDCARD = 'N';

	/**
	 * The concrete bases in column order
	 */
	public static final char[] BASES = {'A', 'C', 'G', 'T'};

	/**
	 * Number of concrete bases
	 */
	public static final int NUM_BASES = BASES.length;

	/**
	 * Column of the wildcard in transition tables
	 */
	public static final int WILDCARD_INDEX = NUM_BASES;

	/**
	 * Number of columns in a transition table: the bases plus the wildcard
	 */
	public static final int NUM_SYMBOLS = NUM_BASES + 1;

	private DnaAlphabet() {}

	/**
	 * Check whether a symbol may appear in a scanned sequence
	 * @param c The symbol
	 * @return True iff c is one of A, C, G, T, N
	 */
	public static boolean isValidSymbol(char c) {
		return indexOf(c) >= 0;
	}

	/**
	 * Check whether a symbol is a concrete base
	 * @param c The symbol
	 * @return True iff c is one of A, C, G, T
	 */
	public static boolean isBase(char c) {
		int i = indexOf(c);
		return i >= 0 && i < NUM_BASES;
	}

	/**
	 * Get the transition table column for a symbol
	 * @param c The symbol
	 * @return 0-3 for A, C, G, T, 4 for N, or -1 if the symbol is not in the alphabet
	 */
	public static int indexOf(char c) {
		switch(c) {
		case 'A':
			return 0;
		case 'C':
			return 1;
		case 'G':
			return 2;
		case 'T':
			return 3;
		case WILDCARD:
			return WILDCARD_INDEX;
		default:
			return -1;
		}
	}

	/**
	 * Make sure a pattern is non-empty and made only of concrete bases
	 * @param pattern The pattern
	 * @param label How to refer to the pattern in the error message
	 * @throws InvalidPatternException if the pattern is null, empty or has a non-base symbol
	 */
	public static void checkPattern(String pattern, String label) {
		if(pattern == null || pattern.isEmpty()) {
			throw new InvalidPatternException(label + " is empty");
		}
		for(int i = 0; i < pattern.length(); i++) {
			char c = pattern.charAt(i);
			if(!isBase(c)) {
				throw new InvalidPatternException(label + " " + pattern + " has symbol '" + c + "' at position " + i + ". Only A, C, G, T are allowed in patterns.");
			}
		}
	}

	/**
	 * Get the transition table column for the symbol at a position of a sequence being scanned
	 * @param sequence The sequence
	 * @param position Zero based position
	 * @return Column index of the symbol
	 * @throws InvalidSequenceException if the symbol is outside the alphabet
	 */
	public static int columnAt(String sequence, int position) {
		char c = sequence.charAt(position);
		int col = indexOf(c);
		if(col < 0) {
			throw new InvalidSequenceException("Invalid symbol '" + c + "' at position " + position + ". Only A, C, G, T, N are allowed.", position);
		}
		return col;
	}

}
