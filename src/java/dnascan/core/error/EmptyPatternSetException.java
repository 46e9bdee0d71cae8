package dnascan.core.error;

/**
 * Thrown when a multi pattern matcher is constructed from zero patterns
 */
public class EmptyPatternSetException extends IllegalArgumentException {

	private static final long serialVersionUID = -2263811920356458731L;

	public EmptyPatternSetException() {
		super("At least one pattern is required");
	}

}
