package umms.core.coordinatesystem;

/**
 * Thrown when a window does not fit inside its chromosome or names an unknown one.
 * Windows are never clipped.
 */
public class AnnotationOutOfBoundsException extends RuntimeException {

	private static final long serialVersionUID = 4417925201986412387L;

	public AnnotationOutOfBoundsException(String message) {
		super(message);
	}

	public AnnotationOutOfBoundsException(String chr, int start, int end, long chromosomeLength) {
		super("Window " + chr + ":" + start + "-" + end + " falls outside chromosome " + chr + " of length " + chromosomeLength);
	}
}
