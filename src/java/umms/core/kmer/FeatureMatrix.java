package umms.core.kmer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Row sparse count matrix. Row i describes the i-th sequence handed to the vectorizer.
 */
public final class FeatureMatrix {

	private final int numColumns;
	private final List<SparseVector> rows;

	public FeatureMatrix(int numColumns, List<SparseVector> rows) {
		for (SparseVector row : rows) {
			if (row.getDimension() != numColumns) {
				throw new IllegalArgumentException("Row of dimension " + row.getDimension() + " in a matrix with " + numColumns + " columns");
			}
		}
		this.numColumns = numColumns;
		this.rows = Collections.unmodifiableList(new ArrayList<SparseVector>(rows));
	}

	public int getNumRows() {
		return rows.size();
	}

	public int getNumColumns() {
		return numColumns;
	}

	public SparseVector getRow(int i) {
		return rows.get(i);
	}

	public List<SparseVector> getRows() {
		return rows;
	}

	public long getNumNonZero() {
		long rtrn = 0;
		for (SparseVector row : rows) {
			rtrn += row.getNumNonZero();
		}
		return rtrn;
	}
}
