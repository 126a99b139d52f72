package umms.core.evaluation;

import java.math.BigDecimal;

import umms.core.sequence.SequenceRecord;

/**
 * Scored sequence: where it came from, its true label and the predicted probability of label 1.
 */
public final class PredictionRecord {

	private final String chr;
	private final int start;
	private final int end;
	private final int label;
	private final double probability;

	public PredictionRecord(SequenceRecord sequence, int label, double probability) {
		if (label != 0 && label != 1) {
			throw new IllegalArgumentException("Label must be 0 or 1, got " + label);
		}
		if (!(probability >= 0 && probability <= 1)) {
			throw new IllegalArgumentException("Probability must be in [0,1], got " + probability);
		}
		this.chr = sequence.getChr();
		this.start = sequence.getStart();
		this.end = sequence.getEnd();
		this.label = label;
		this.probability = probability;
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

	public int getLabel() {
		return label;
	}

	public double getProbability() {
		return probability;
	}

	/**
	 * @return chr, start, end, id, label, probability separated by tabs; the probability is
	 * written in plain decimal notation, never with an exponent
	 */
	public String toTabbedLine() {
		return chr + "\t" + start + "\t" + end + "\t" + getId() + "\t" + label + "\t" + BigDecimal.valueOf(probability).toPlainString();
	}

	@Override
	public String toString() {
		return toTabbedLine();
	}
}
