package dnascan.core.sequence;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import dnascan.core.error.InvalidSequenceException;

/**
 * Validation and simple manipulation of DNA strings
 * These helpers are lenient about case; the matchers are not, so normalize before scanning
 */
public class SequenceUtils {

	private SequenceUtils() {}

	/**
	 * Check that a sequence is non-empty and contains only A, C, G, T, N in either case
	 * @param sequence The sequence
	 * @return True iff the sequence is valid
	 */
	public static boolean isValid(String sequence) {
		if(StringUtils.isEmpty(sequence)) {
			return false;
		}
		for(int i = 0; i < sequence.length(); i++) {
			if(!DnaAlphabet.isValidSymbol(Character.toUpperCase(sequence.charAt(i)))) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Upper case a sequence and remove whitespace
	 * @param sequence The sequence
	 * @return Normalized sequence
	 * @throws InvalidSequenceException if a symbol outside the alphabet remains
	 */
	public static String normalize(String sequence) {
		if(sequence == null) {
			throw new InvalidSequenceException("Sequence is null", -1);
		}
		String rtrn = StringUtils.deleteWhitespace(sequence).toUpperCase();
		for(int i = 0; i < rtrn.length(); i++) {
			if(!DnaAlphabet.isValidSymbol(rtrn.charAt(i))) {
				throw new InvalidSequenceException("Invalid symbol '" + rtrn.charAt(i) + "' at position " + i + " of normalized sequence", i);
			}
		}
		return rtrn;
	}

	/**
	 * Upper case a sequence and drop every character outside the alphabet
	 * @param sequence The sequence
	 * @return Cleaned sequence
	 */
	public static String clean(String sequence) {
		if(sequence == null) {
			return "";
		}
		StringBuilder sb = new StringBuilder(sequence.length());
		for(int i = 0; i < sequence.length(); i++) {
			char c = Character.toUpperCase(sequence.charAt(i));
			if(DnaAlphabet.isValidSymbol(c)) {
				sb.append(c);
			}
		}
		return sb.toString();
	}

	/**
	 * Percentage of G and C
	 * @param sequence The sequence
	 * @return 100 * (G + C) / length, or 0 for an empty sequence
	 */
	public static double gcContent(String sequence) {
		if(StringUtils.isEmpty(sequence)) {
			return 0;
		}
		String upper = sequence.toUpperCase();
		int gc = StringUtils.countMatches(upper, 'G') + StringUtils.countMatches(upper, 'C');
		return 100.0 * gc / upper.length();
	}

	/**
	 * Reverse complement, with N complementing to N
	 * Characters outside the alphabet are kept as they are
	 * @param sequence The sequence
	 * @return Upper case reverse complement
	 */
	public static String reverseComplement(String sequence) {
		String upper = sequence.toUpperCase();
		StringBuilder sb = new StringBuilder(upper.length());
		for(int i = upper.length() - 1; i >= 0; i--) {
			sb.append(complement(upper.charAt(i)));
		}
		return sb.toString();
	}

	private static char complement(char c) {
		switch(c) {
		case 'A':
			return 'T';
		case 'T':
			return 'A';
		case 'C':
			return 'G';
		case 'G':
			return 'C';
		default:
			return c;
		}
	}

	/**
	 * Split a sequence into consecutive chunks
	 * @param sequence The sequence
	 * @param chunkSize Chunk size
	 * @return Chunks in order; the last one may be shorter
	 */
	public static List<String> split(String sequence, int chunkSize) {
		if(chunkSize <= 0) {
			throw new IllegalArgumentException("Chunk size must be positive: " + chunkSize);
		}
		List<String> rtrn = new ArrayList<String>();
		for(int i = 0; i < sequence.length(); i += chunkSize) {
			rtrn.add(sequence.substring(i, Math.min(sequence.length(), i + chunkSize)));
		}
		return rtrn;
	}

}
