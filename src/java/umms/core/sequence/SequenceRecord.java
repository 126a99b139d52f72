package umms.core.sequence;

import umms.core.feature.Window;

/**
 * A DNA subsequence named after the window it was cut from. The identifier is always
 * chr:start-end and is rebuilt from the coordinates, never stored on its own.
 */
public final class SequenceRecord {

	private final String chr;
	private final int start;
	private final int end;
	private final String sequence;

	public SequenceRecord(Window window, String sequence) {
		this(window.getChr(), window.getStart(), window.getEnd(), sequence);
	}

	private SequenceRecord(String chr, int start, int end, String sequence) {
		if (sequence == null) {
			throw new IllegalArgumentException("Sequence for " + chr + ":" + start + "-" + end + " is null");
		}
		this.chr = chr;
		this.start = start;
		this.end = end;
		this.sequence = sequence;
	}

	/**
	 * Rebuild a record from a chr:start-end identifier as written to sequence files.
	 * The last ':' separates the chromosome so chromosome names may themselves contain ':'.
	 * @throws IllegalArgumentException if the identifier does not have that form
	 */
	public static SequenceRecord fromId(String id, String sequence) {
		int colon = id.lastIndexOf(':');
		int dash = id.lastIndexOf('-');
		if (colon <= 0 || dash < colon + 2 || dash == id.length() - 1) {
			throw new IllegalArgumentException("Sequence name " + id + " is not of the form chr:start-end");
		}
		try {
			int start = Integer.parseInt(id.substring(colon + 1, dash));
			int end = Integer.parseInt(id.substring(dash + 1));
			return new SequenceRecord(id.substring(0, colon), start, end, sequence);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Sequence name " + id + " is not of the form chr:start-end", e);
		}
	}

	public String getId() {
		return chr + ":" + start + "-" + end;
	}

	public String getChr() {
		return chr;
	}

	public int getStart() {
		return start;
	}

	public int getEnd() {
		return end;
	}

	public String getSequence() {
		return sequence;
	}

	public int length() {
		return sequence.length();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof SequenceRecord)) {
			return false;
		}
		SequenceRecord other = (SequenceRecord) o;
		return chr.equals(other.chr) && start == other.start && end == other.end && sequence.equals(other.sequence);
	}

	@Override
	public int hashCode() {
		return 31 * getId().hashCode() + sequence.hashCode();
	}

	@Override
	public String toString() {
		return getId();
	}
}
