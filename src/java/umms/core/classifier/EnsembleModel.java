package umms.core.classifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import broad.core.math.Statistics;
import umms.core.kmer.FeatureMatrix;
import umms.core.kmer.SparseVector;

/**
 * Ordered, immutable collection of trained learners. The ensemble probability is the
 * arithmetic mean of the learners' probabilities.
 */
public final class EnsembleModel {

	private final List<LinearModel> learners;

	public EnsembleModel(List<LinearModel> learners) {
		if (learners.isEmpty()) {
			throw new IllegalArgumentException("An ensemble needs at least one learner");
		}
		int dimension = learners.get(0).getDimension();
		for (LinearModel m : learners) {
			if (m.getDimension() != dimension) {
				throw new IllegalArgumentException("Learners of different dimension " + dimension + " and " + m.getDimension());
			}
		}
		this.learners = Collections.unmodifiableList(new ArrayList<LinearModel>(learners));
	}

	public double predictProbability(SparseVector x) {
		double[] probabilities = new double[learners.size()];
		for (int i = 0; i < probabilities.length; i++) {
			probabilities[i] = learners.get(i).probability(x);
		}
		return Statistics.mean(probabilities);
	}

	/**
	 * @return probability of class 1 for each row, in row order
	 */
	public double[] predictProbabilities(FeatureMatrix X) {
		double[] rtrn = new double[X.getNumRows()];
		for (int i = 0; i < rtrn.length; i++) {
			rtrn[i] = predictProbability(X.getRow(i));
		}
		return rtrn;
	}

	public List<LinearModel> getLearners() {
		return learners;
	}

	public int size() {
		return learners.size();
	}

	public int getDimension() {
		return learners.get(0).getDimension();
	}
}
