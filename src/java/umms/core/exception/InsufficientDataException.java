package umms.core.exception;

/**
 * The data handed to a classifier or evaluator cannot support the requested computation,
 * e.g. an empty training set or a single label class.
 */
public class InsufficientDataException extends RuntimeException {

	private static final long serialVersionUID = 8806410071294552830L;

	public InsufficientDataException(String message) {
		super(message);
	}
}
