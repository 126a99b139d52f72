package umms.core.classifier;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.log4j.Logger;

import umms.core.exception.ConfigurationException;
import umms.core.exception.InsufficientDataException;
import umms.core.kmer.FeatureMatrix;
import umms.core.kmer.SparseVector;

/**
 * L2 regularized logistic regression fitted by stochastic gradient descent.
 * <p>
 * Each epoch visits every training row once in a fresh random order. For row (x, y) with
 * p = sigmoid(w.x + b) the update is
 * <pre>
 *   w = w - eta * ((p - y) * x + lambda * w)
 *   b = b - eta * (p - y)
 * </pre>
 * The bias is not regularized. Weights start from N(0, initScale^2) draws, so two learners given
 * different generators differ in both starting point and visiting order.
 */
public class LogisticRegressionSGD {

	static Logger logger = Logger.getLogger(LogisticRegressionSGD.class.getName());

	public static final double DEFAULT_LAMBDA = 1e-4;
	public static final int DEFAULT_EPOCHS = 5;
	public static final double DEFAULT_ETA0 = 0.01;
	public static final double DEFAULT_INIT_SCALE = 0.01;

	private final double lambda;
	private final int epochs;
	private final double eta0;
	private final LearningRateSchedule schedule;
	private final double initScale;

	private WeightVector weights;
	private double bias;
	private long t;

	public LogisticRegressionSGD(double lambda) {
		this(lambda, DEFAULT_EPOCHS, DEFAULT_ETA0, LearningRateSchedule.INVERSE_SCALING, DEFAULT_INIT_SCALE);
	}

	public LogisticRegressionSGD(double lambda, int epochs, double eta0, LearningRateSchedule schedule, double initScale) {
		if (lambda < 0) {
			throw new ConfigurationException("Regularization weight must not be negative, got " + lambda);
		}
		if (epochs < 1) {
			throw new ConfigurationException("Number of epochs must be positive, got " + epochs);
		}
		if (eta0 <= 0) {
			throw new ConfigurationException("Learning rate must be positive, got " + eta0);
		}
		if (eta0 * lambda >= 1) {
			throw new ConfigurationException("Learning rate times regularization weight must be below 1, got " + (eta0 * lambda));
		}
		if (initScale < 0) {
			throw new ConfigurationException("Initial weight scale must not be negative, got " + initScale);
		}
		this.lambda = lambda;
		this.epochs = epochs;
		this.eta0 = eta0;
		this.schedule = schedule;
		this.initScale = initScale;
	}

	/**
	 * @return an untrained learner with the same hyper parameters
	 */
	public LogisticRegressionSGD copy() {
		return new LogisticRegressionSGD(lambda, epochs, eta0, schedule, initScale);
	}

	/**
	 * Reset the learner to random starting weights and a zero bias
	 */
	public void initialize(int dimension, RandomGenerator generator) {
		double[] w = new double[dimension];
		if (initScale > 0) {
			for (int i = 0; i < dimension; i++) {
				w[i] = initScale * generator.nextGaussian();
			}
		}
		weights = new WeightVector(w);
		bias = 0;
		t = 0;
	}

	/**
	 * Apply one gradient step for a single example
	 * @param y label, 0 or 1
	 * @return probability of class 1 for x before the step
	 */
	public double update(SparseVector x, int y) {
		if (weights == null) {
			throw new IllegalStateException("Learner must be initialized before updating");
		}
		double eta = schedule.rate(eta0, lambda, t);
		double p = LinearModel.sigmoid(weights.dot(x) + bias);
		double gradient = p - y;
		if (lambda > 0) {
			weights.scale(1 - eta * lambda);
		}
		weights.add(x, -eta * gradient);
		bias -= eta * gradient;
		t++;
		return p;
	}

	/**
	 * Train from scratch on all rows of X
	 * @param labels 0/1 label of each row
	 * @throws InsufficientDataException if X is empty or only one class is present
	 * @throws IllegalStateException if the calling thread is interrupted, checked once per epoch
	 */
	public LinearModel fit(FeatureMatrix X, int[] labels, RandomGenerator generator) {
		checkTrainingData(X, labels);
		initialize(X.getNumColumns(), generator);
		int[] order = new int[X.getNumRows()];
		for (int i = 0; i < order.length; i++) {
			order[i] = i;
		}
		for (int epoch = 0; epoch < epochs; epoch++) {
			if (Thread.interrupted()) {
				throw new IllegalStateException("Training interrupted after " + epoch + " of " + epochs + " epochs");
			}
			shuffle(order, generator);
			double loss = 0;
			for (int i : order) {
				double p = update(X.getRow(i), labels[i]);
				loss -= labels[i] == 1 ? Math.log(Math.max(p, 1e-15)) : Math.log(Math.max(1 - p, 1e-15));
			}
			logger.debug("Epoch " + (epoch + 1) + " mean log loss " + (loss / order.length));
		}
		return getModel();
	}

	public LinearModel getModel() {
		if (weights == null) {
			throw new IllegalStateException("Learner has not been initialized");
		}
		return new LinearModel(weights.toArray(), bias);
	}

	static void shuffle(int[] order, RandomGenerator generator) {
		for (int i = order.length - 1; i > 0; i--) {
			int j = generator.nextInt(i + 1);
			int tmp = order[i];
			order[i] = order[j];
			order[j] = tmp;
		}
	}

	/**
	 * @throws InsufficientDataException unless X has at least one row and both labels 0 and 1 occur
	 */
	public static void checkTrainingData(FeatureMatrix X, int[] labels) {
		if (X.getNumRows() == 0) {
			throw new InsufficientDataException("No training examples");
		}
		if (labels.length != X.getNumRows()) {
			throw new IllegalArgumentException("Got " + labels.length + " labels for " + X.getNumRows() + " rows");
		}
		boolean positive = false;
		boolean negative = false;
		for (int y : labels) {
			if (y == 1) {
				positive = true;
			} else if (y == 0) {
				negative = true;
			} else {
				throw new IllegalArgumentException("Labels must be 0 or 1, got " + y);
			}
		}
		if (!positive || !negative) {
			throw new InsufficientDataException("Training labels contain a single class (" + (positive ? "1" : "0") + "), two are required");
		}
	}

	public long getNumUpdates() {
		return t;
	}

	public double getLambda() {
		return lambda;
	}

	public int getEpochs() {
		return epochs;
	}

	public double getEta0() {
		return eta0;
	}

	public LearningRateSchedule getSchedule() {
		return schedule;
	}

	public double getInitScale() {
		return initScale;
	}
}
