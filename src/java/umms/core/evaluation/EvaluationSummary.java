package umms.core.evaluation;

/**
 * Aggregate quality of a set of predictions.
 */
public final class EvaluationSummary {

	private final int positives;
	private final int negatives;
	private final double rocAuc;
	private final double accuracy;

	EvaluationSummary(int positives, int negatives, double rocAuc, double accuracy) {
		this.positives = positives;
		this.negatives = negatives;
		this.rocAuc = rocAuc;
		this.accuracy = accuracy;
	}

	public int getPositives() {
		return positives;
	}

	public int getNegatives() {
		return negatives;
	}

	public double getRocAuc() {
		return rocAuc;
	}

	/**
	 * @return fraction of records whose probability falls on the side of 0.5 matching their label
	 */
	public double getAccuracy() {
		return accuracy;
	}

	@Override
	public String toString() {
		return String.format("ROC-AUC: %.2f%% (positives=%d, negatives=%d, accuracy=%.2f%%)", 100 * rocAuc, positives, negatives, 100 * accuracy);
	}
}
