package umms.core.feature;

/**
 * A fixed width genomic window in 1-based inclusive coordinates.
 */
public interface Window extends Comparable<Window> {

	String getChr();

	int getStart();

	int getEnd();

	/**
	 * @return number of bases covered, end - start + 1
	 */
	int getSize();

	/**
	 * @param other another window
	 * @return true if both windows are on the same chromosome and share at least one base
	 */
	boolean overlaps(Window other);

	/**
	 * @return identifier of the form chr:start-end
	 */
	String toUCSC();

	/**
	 * @return tab delimited chr, start, end
	 */
	String toShortBED();
}
