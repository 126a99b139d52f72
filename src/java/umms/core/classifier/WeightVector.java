package umms.core.classifier;

import umms.core.kmer.SparseVector;

/**
 * Dense weights stored as scale * v so the L2 shrinkage of every update costs O(1)
 * instead of touching each of the (many) vocabulary columns.
 */
public class WeightVector {

	private static final double MIN_SCALE = 1e-9;

	private final double[] v;
	private double scale = 1.0;

	public WeightVector(double[] initial) {
		this.v = initial.clone();
	}

	public int getDimension() {
		return v.length;
	}

	public double dot(SparseVector x) {
		return x.dot(v) * scale;
	}

	/**
	 * w = factor * w
	 */
	public void scale(double factor) {
		if (factor <= 0) {
			throw new IllegalArgumentException("Scaling factor must be positive, got " + factor);
		}
		scale *= factor;
		if (scale < MIN_SCALE) {
			rescale();
		}
	}

	/**
	 * w = w + alpha * x
	 */
	public void add(SparseVector x, double alpha) {
		double a = alpha / scale;
		for (int i = 0; i < x.getNumNonZero(); i++) {
			v[x.getIndex(i)] += a * x.getValue(i);
		}
	}

	public double get(int column) {
		return v[column] * scale;
	}

	public double[] toArray() {
		double[] rtrn = new double[v.length];
		for (int i = 0; i < v.length; i++) {
			rtrn[i] = v[i] * scale;
		}
		return rtrn;
	}

	private void rescale() {
		for (int i = 0; i < v.length; i++) {
			v[i] *= scale;
		}
		scale = 1.0;
	}
}
