package umms.core.feature;

import umms.core.exception.ConfigurationException;

public abstract class GenomeWindow implements Window {

	private final String chr;
	private final int start;
	private final int end;

	/**
	 * @param chr chromosome name
	 * @param start first base, 1-based
	 * @param width number of bases, must be odd
	 */
	protected GenomeWindow(String chr, int start, int width) {
		checkWidth(width);
		this.chr = chr;
		this.start = start;
		this.end = start + width - 1;
	}

	/**
	 * Windows are centered on a single base so their width must be a positive odd number
	 * @param width window width
	 * @throws ConfigurationException if the width is even or not positive
	 */
	public static void checkWidth(int width) {
		if (width <= 0 || width % 2 == 0) {
			throw new ConfigurationException("Window width must be a positive odd number, got " + width);
		}
	}

	@Override
	public String getChr() {
		return chr;
	}

	@Override
	public int getStart() {
		return start;
	}

	@Override
	public int getEnd() {
		return end;
	}

	@Override
	public int getSize() {
		return end - start + 1;
	}

	@Override
	public boolean overlaps(Window other) {
		return chr.equals(other.getChr()) && start <= other.getEnd() && other.getStart() <= end;
	}

	@Override
	public String toUCSC() {
		return chr + ":" + start + "-" + end;
	}

	@Override
	public String toShortBED() {
		return chr + "\t" + start + "\t" + end;
	}

	@Override
	public int compareTo(Window other) {
		int cmp = chr.compareTo(other.getChr());
		if (cmp == 0) {
			cmp = Integer.compare(start, other.getStart());
		}
		if (cmp == 0) {
			cmp = Integer.compare(end, other.getEnd());
		}
		return cmp;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Window)) {
			return false;
		}
		Window other = (Window) o;
		return chr.equals(other.getChr()) && start == other.getStart() && end == other.getEnd();
	}

	@Override
	public int hashCode() {
		return toUCSC().hashCode();
	}

	@Override
	public String toString() {
		return toUCSC();
	}
}
