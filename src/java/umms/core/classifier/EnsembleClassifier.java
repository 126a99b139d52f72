package umms.core.classifier;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.log4j.Logger;

import umms.core.exception.ConfigurationException;
import umms.core.kmer.FeatureMatrix;

/**
 * Trains several logistic regression learners on the same rows and averages their output.
 * <p>
 * Learners are not given bootstrap samples: all of them see every row and differ only in
 * their random starting weights and visiting order, which is where most of the variance of
 * stochastic gradient training comes from. Learners share nothing but the read-only feature
 * matrix and are trained on a pool of worker threads. Each learner's generator is seeded from
 * the caller's generator before any work starts, so the result does not depend on scheduling.
 */
public class EnsembleClassifier {

	static Logger logger = Logger.getLogger(EnsembleClassifier.class.getName());

	public static final int DEFAULT_NUM_LEARNERS = 10;

	private final LogisticRegressionSGD prototype;
	private final int numLearners;
	private final int numThreads;

	public EnsembleClassifier(LogisticRegressionSGD prototype, int numLearners, int numThreads) {
		if (numLearners < 1) {
			throw new ConfigurationException("Ensemble size must be positive, got " + numLearners);
		}
		if (numThreads < 1) {
			throw new ConfigurationException("Number of threads must be positive, got " + numThreads);
		}
		this.prototype = prototype;
		this.numLearners = numLearners;
		this.numThreads = numThreads;
	}

	/**
	 * @param labels 0/1 label of each row of X
	 * @param generator source of the per learner seeds
	 * @throws umms.core.exception.InsufficientDataException if X is empty or holds a single class
	 */
	public EnsembleModel train(final FeatureMatrix X, final int[] labels, RandomGenerator generator) {
		LogisticRegressionSGD.checkTrainingData(X, labels);
		logger.info("Training " + numLearners + " learners on " + X.getNumRows() + " sequences x " + X.getNumColumns() + " k-mers using " + numThreads + " threads");

		List<Callable<LinearModel>> tasks = new ArrayList<Callable<LinearModel>>(numLearners);
		for (int i = 0; i < numLearners; i++) {
			final long seed = generator.nextLong();
			final LogisticRegressionSGD learner = prototype.copy();
			tasks.add(new Callable<LinearModel>() {
				public LinearModel call() {
					return learner.fit(X, labels, new MersenneTwister(seed));
				}
			});
		}

		ExecutorService taskExecutor = Executors.newFixedThreadPool(Math.min(numThreads, numLearners));
		List<LinearModel> learners = new ArrayList<LinearModel>(numLearners);
		try {
			List<Future<LinearModel>> futures = new ArrayList<Future<LinearModel>>(numLearners);
			for (Callable<LinearModel> task : tasks) {
				futures.add(taskExecutor.submit(task));
			}
			for (Future<LinearModel> f : futures) {
				learners.add(f.get());
				logger.debug("Learner " + learners.size() + " of " + numLearners + " trained");
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Interrupted while training learners", e);
		} catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if (cause instanceof RuntimeException) {
				throw (RuntimeException) cause;
			}
			if (cause instanceof Error) {
				throw (Error) cause;
			}
			throw new IllegalStateException("Learner training failed", cause);
		} finally {
			stop(taskExecutor);
		}
		logger.info("Trained ensemble of " + learners.size() + " learners");
		return new EnsembleModel(learners);
	}

	/**
	 * Interrupt every running learner and wait until all of them have returned
	 */
	private static void stop(ExecutorService taskExecutor) {
		taskExecutor.shutdownNow();
		try {
			while (!taskExecutor.awaitTermination(1, TimeUnit.MINUTES)) {
				logger.warn("Still waiting for interrupted learners to stop");
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
	}

	public int getNumLearners() {
		return numLearners;
	}

	public int getNumThreads() {
		return numThreads;
	}

	public LogisticRegressionSGD getPrototype() {
		return prototype;
	}
}
