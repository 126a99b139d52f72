package umms.core.exception;

public class ParseException extends Exception {

	private static final long serialVersionUID = -6185439028841627514L;

	private final int lineNumber;

	public ParseException(String message, int lineNumber) {
		super(message + " (line " + lineNumber + ")");
		this.lineNumber = lineNumber;
	}

	public int getLineNumber() {
		return lineNumber;
	}
}
