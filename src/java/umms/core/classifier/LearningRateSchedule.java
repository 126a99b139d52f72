package umms.core.classifier;

/**
 * Step size of the t-th stochastic gradient update (t starts at 0).
 */
public enum LearningRateSchedule {

	/** eta = eta0 */
	CONSTANT {
		@Override
		public double rate(double eta0, double lambda, long t) {
			return eta0;
		}
	},

	/** eta = eta0 / (1 + eta0 * lambda * t) */
	INVERSE_SCALING {
		@Override
		public double rate(double eta0, double lambda, long t) {
			return eta0 / (1 + eta0 * lambda * t);
		}
	};

	public abstract double rate(double eta0, double lambda, long t);

	public static LearningRateSchedule fromName(String name) {
		for (LearningRateSchedule s : values()) {
			if (s.name().equalsIgnoreCase(name.replace('-', '_'))) {
				return s;
			}
		}
		throw new IllegalArgumentException("Unknown learning rate schedule " + name);
	}
}
