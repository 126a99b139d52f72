package umms.core.classifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.junit.jupiter.api.Test;

import umms.core.exception.ConfigurationException;
import umms.core.exception.InsufficientDataException;
import umms.core.kmer.FeatureMatrix;
import umms.core.kmer.SparseVector;

class EnsembleClassifierTest {

	private final FeatureMatrix X = LogisticRegressionSGDTest.separable(8);
	private final int[] y = LogisticRegressionSGDTest.labels(8);

	@Test
	void singleLearnerEnsembleEqualsTheLearner() {
		LogisticRegressionSGD prototype = new LogisticRegressionSGD(1e-3);
		RandomGenerator reference = new MersenneTwister(7);
		LinearModel single = prototype.copy().fit(X, y, new MersenneTwister(reference.nextLong()));

		EnsembleModel ensemble = new EnsembleClassifier(prototype, 1, 1).train(X, y, new MersenneTwister(7));

		for (SparseVector row : X.getRows()) {
			assertThat(ensemble.predictProbability(row)).isEqualTo(single.probability(row));
		}
	}

	@Test
	void resultDoesNotDependOnThreadCount() {
		LogisticRegressionSGD prototype = new LogisticRegressionSGD(1e-3);

		double[] serial = new EnsembleClassifier(prototype, 6, 1).train(X, y, new MersenneTwister(11)).predictProbabilities(X);
		double[] parallel = new EnsembleClassifier(prototype, 6, 4).train(X, y, new MersenneTwister(11)).predictProbabilities(X);

		assertThat(parallel).containsExactly(serial);
	}

	@Test
	void ensembleProbabilityIsTheMeanOfItsLearners() {
		LinearModel a = new LinearModel(new double[] {0, 0, 0}, 0);
		LinearModel b = new LinearModel(new double[] {0, 0, 0}, 100);
		EnsembleModel model = new EnsembleModel(Arrays.asList(a, b));

		assertThat(model.predictProbability(X.getRow(0))).isCloseTo(0.75, within(1e-12));
		assertThat(model.size()).isEqualTo(2);
	}

	@Test
	void learnersDiffer() {
		EnsembleModel model = new EnsembleClassifier(new LogisticRegressionSGD(1e-3), 3, 2).train(X, y, new MersenneTwister(5));

		assertThat(model.getLearners().get(0).getWeights()).isNotEqualTo(model.getLearners().get(1).getWeights());
	}

	@Test
	void singleClassTrainingFails() {
		EnsembleClassifier classifier = new EnsembleClassifier(new LogisticRegressionSGD(1e-3), 2, 2);

		assertThatThrownBy(() -> classifier.train(X, new int[X.getNumRows()], new MersenneTwister(1))).isInstanceOf(InsufficientDataException.class);
	}

	@Test
	void failingLearnerStopsTheOthersBeforeReturning() {
		AtomicInteger copies = new AtomicInteger();
		AtomicInteger running = new AtomicInteger();
		LogisticRegressionSGD prototype = new FirstCopyFails(copies, running);
		FeatureMatrix large = LogisticRegressionSGDTest.separable(200);
		int[] labels = LogisticRegressionSGDTest.labels(200);

		assertThatThrownBy(() -> new EnsembleClassifier(prototype, 3, 3).train(large, labels, new MersenneTwister(1)))
			.isInstanceOf(IllegalStateException.class)
			.hasMessage("learner failed");
		assertThat(running.get()).isZero();
	}

	@Test
	void interruptedLearnerStopsAtTheNextEpoch() {
		Thread.currentThread().interrupt();

		assertThatThrownBy(() -> new LogisticRegressionSGD(1e-3).fit(X, y, new MersenneTwister(1)))
			.isInstanceOf(IllegalStateException.class)
			.hasMessageContaining("interrupted");
		assertThat(Thread.currentThread().isInterrupted()).isFalse();
	}

	/**
	 * Learners whose first copy throws and whose other copies train for a very long time
	 */
	private static class FirstCopyFails extends LogisticRegressionSGD {
		private final AtomicInteger copies;
		private final AtomicInteger running;
		private final boolean fails;

		FirstCopyFails(AtomicInteger copies, AtomicInteger running) {
			this(copies, running, false);
		}

		private FirstCopyFails(AtomicInteger copies, AtomicInteger running, boolean fails) {
			super(1e-4, 1000000, 0.01, LearningRateSchedule.CONSTANT, 0.01);
			this.copies = copies;
			this.running = running;
			this.fails = fails;
		}

		@Override
		public LogisticRegressionSGD copy() {
			return new FirstCopyFails(copies, running, copies.getAndIncrement() == 0);
		}

		@Override
		public LinearModel fit(FeatureMatrix X, int[] labels, RandomGenerator generator) {
			running.incrementAndGet();
			try {
				if (fails) {
					throw new IllegalStateException("learner failed");
				}
				return super.fit(X, labels, generator);
			} finally {
				running.decrementAndGet();
			}
		}
	}

	@Test
	void rejectsEmptyEnsembleAndZeroThreads() {
		assertThatThrownBy(() -> new EnsembleClassifier(new LogisticRegressionSGD(1e-3), 0, 1)).isInstanceOf(ConfigurationException.class);
		assertThatThrownBy(() -> new EnsembleClassifier(new LogisticRegressionSGD(1e-3), 1, 0)).isInstanceOf(ConfigurationException.class);
	}
}
