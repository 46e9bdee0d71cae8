package dnascan.core.error;

/**
 * Thrown when a sequence to scan contains a symbol outside the alphabet
 */
public class InvalidSequenceException extends IllegalArgumentException {

	private static final long serialVersionUID = 8127736053519870043L;
	
	private final int position;

	/**
	 * @param message Description of the problem
	 * @param offendingPosition Zero based position of the first bad symbol, or -1 if not applicable
	 */
	public InvalidSequenceException(String message, int offendingPosition) {
		super(message);
		position = offendingPosition;
	}
	
	/**
	 * @return Zero based position of the first bad symbol, or -1 if not applicable
	 */
	public int getPosition() {
		return position;
	}

}
