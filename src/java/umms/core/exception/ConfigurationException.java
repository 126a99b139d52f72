package umms.core.exception;

/**
 * Invalid command line or program configuration. Raised before any input is read.
 */
public class ConfigurationException extends IllegalArgumentException {

	private static final long serialVersionUID = 3355291760345018123L;

	public ConfigurationException(String message) {
		super(message);
	}
}
