package dnascan.core.error;

/**
 * Thrown when a pattern supplied to matcher construction is null, empty or contains a symbol outside the base alphabet
 */
public class InvalidPatternException extends IllegalArgumentException {

	private static final long serialVersionUID = 4305987714829364215L;

	/**
	 * @param message Description of the problem
	 */
	public InvalidPatternException(String message) {
		super(message);
	}

}
