package umms.core.annotation;

/**
 * Outcome of one parsing attempt: either a value or the reason it could not be produced.
 *
 * @param <T> parsed value type
 */
public final class ParseResult<T> {

	private final T value;
	private final String error;
	private final int lineNumber;

	private ParseResult(T value, String error, int lineNumber) {
		this.value = value;
		this.error = error;
		this.lineNumber = lineNumber;
	}

	public static <T> ParseResult<T> success(T value) {
		return new ParseResult<T>(value, null, 0);
	}

	public static <T> ParseResult<T> failure(String error, int lineNumber) {
		return new ParseResult<T>(null, error, lineNumber);
	}

	public boolean isSuccess() {
		return error == null;
	}

	/**
	 * @throws IllegalStateException if this is a failure
	 */
	public T getValue() {
		if (!isSuccess()) {
			throw new IllegalStateException("No value, parsing failed: " + error);
		}
		return value;
	}

	public String getError() {
		return error;
	}

	public int getLineNumber() {
		return lineNumber;
	}
}
