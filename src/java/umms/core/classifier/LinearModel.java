package umms.core.classifier;

import umms.core.kmer.SparseVector;

/**
 * Trained logistic regression parameters. Immutable.
 */
public final class LinearModel {

	private final double[] weights;
	private final double bias;

	public LinearModel(double[] weights, double bias) {
		this.weights = weights.clone();
		this.bias = bias;
	}

	/**
	 * @return w . x + b
	 */
	public double score(SparseVector x) {
		if (x.getDimension() != weights.length) {
			throw new IllegalArgumentException("Feature vector of dimension " + x.getDimension() + " for a model with " + weights.length + " weights");
		}
		return x.dot(weights) + bias;
	}

	/**
	 * @return probability of class 1
	 */
	public double probability(SparseVector x) {
		return sigmoid(score(x));
	}

	public static double sigmoid(double z) {
		if (z >= 0) {
			return 1.0 / (1.0 + Math.exp(-z));
		}
		double e = Math.exp(z);
		return e / (1.0 + e);
	}

	public int getDimension() {
		return weights.length;
	}

	public double getWeight(int column) {
		return weights[column];
	}

	public double[] getWeights() {
		return weights.clone();
	}

	public double getBias() {
		return bias;
	}
}
