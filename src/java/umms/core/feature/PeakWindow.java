package umms.core.feature;

/**
 * A window re-centered on the summit of a called peak.
 */
public class PeakWindow extends GenomeWindow {

	private final int peakStart;
	private final int peakEnd;
	private final int summitOffset;

	/**
	 * The window spans (width - 1) / 2 bases on either side of peakStart + summitOffset.
	 * No bounds checking is done here; a window hanging off its chromosome is reported
	 * when its sequence is extracted.
	 */
	public PeakWindow(String chr, int peakStart, int peakEnd, int summitOffset, int width) {
		super(chr, peakStart + summitOffset - halfWidth(width), width);
		this.peakStart = peakStart;
		this.peakEnd = peakEnd;
		this.summitOffset = summitOffset;
	}

	private static int halfWidth(int width) {
		checkWidth(width);
		return (width - 1) / 2;
	}

	public int getPeakStart() {
		return peakStart;
	}

	public int getPeakEnd() {
		return peakEnd;
	}

	public int getSummitOffset() {
		return summitOffset;
	}

	public int getSummit() {
		return peakStart + summitOffset;
	}
}
