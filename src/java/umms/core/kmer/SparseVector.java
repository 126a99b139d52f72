package umms.core.kmer;

import java.util.Arrays;

/**
 * Immutable sparse row: strictly increasing column indices with their non zero values.
 */
public final class SparseVector {

	private final int dimension;
	private final int[] indices;
	private final double[] values;

	/**
	 * @param indices strictly increasing columns, each below dimension
	 * @param values value for each column, same length as indices
	 */
	public SparseVector(int dimension, int[] indices, double[] values) {
		if (indices.length != values.length) {
			throw new IllegalArgumentException("Got " + indices.length + " indices but " + values.length + " values");
		}
		for (int i = 0; i < indices.length; i++) {
			if (indices[i] < 0 || indices[i] >= dimension || (i > 0 && indices[i] <= indices[i - 1])) {
				throw new IllegalArgumentException("Column indices must be increasing and inside [0," + dimension + "), got " + Arrays.toString(indices));
			}
		}
		this.dimension = dimension;
		this.indices = indices.clone();
		this.values = values.clone();
	}

	public int getDimension() {
		return dimension;
	}

	/**
	 * @return number of stored (non zero) entries
	 */
	public int getNumNonZero() {
		return indices.length;
	}

	public int getIndex(int i) {
		return indices[i];
	}

	public double getValue(int i) {
		return values[i];
	}

	/**
	 * @return value at the column, 0 when nothing is stored there
	 */
	public double get(int column) {
		int pos = Arrays.binarySearch(indices, column);
		return pos < 0 ? 0 : values[pos];
	}

	public double dot(double[] dense) {
		double rtrn = 0;
		for (int i = 0; i < indices.length; i++) {
			rtrn += values[i] * dense[indices[i]];
		}
		return rtrn;
	}

	public double[] toDense() {
		double[] rtrn = new double[dimension];
		for (int i = 0; i < indices.length; i++) {
			rtrn[indices[i]] = values[i];
		}
		return rtrn;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof SparseVector)) {
			return false;
		}
		SparseVector other = (SparseVector) o;
		return dimension == other.dimension && Arrays.equals(indices, other.indices) && Arrays.equals(values, other.values);
	}

	@Override
	public int hashCode() {
		return 31 * Arrays.hashCode(indices) + Arrays.hashCode(values);
	}
}
