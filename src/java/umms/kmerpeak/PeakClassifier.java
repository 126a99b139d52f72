package umms.kmerpeak;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.log4j.Logger;

import broad.core.sequence.FastaSequenceIO;
import broad.core.util.CLUtil;
import broad.core.util.CLUtil.ArgumentMap;
import umms.core.classifier.EnsembleClassifier;
import umms.core.classifier.EnsembleModel;
import umms.core.classifier.LearningRateSchedule;
import umms.core.classifier.LogisticRegressionSGD;
import umms.core.evaluation.EvaluationSummary;
import umms.core.evaluation.Evaluator;
import umms.core.evaluation.PredictionRecord;
import umms.core.exception.ConfigurationException;
import umms.core.exception.InsufficientDataException;
import umms.core.exception.ParseException;
import umms.core.kmer.FeatureMatrix;
import umms.core.kmer.KmerVectorizer;
import umms.core.sequence.OrderedSequenceMap;

/**
 * Learns to tell peak sequences from control sequences in one experiment and scores the
 * peak and control sequences of another.
 */
public class PeakClassifier {

	static final String usage = "Usage: PeakClassifier -trainTreatment <fasta> -trainControl <fasta> -targetTreatment <fasta> -targetControl <fasta> -out <predictions> [options]"+
			"\n**************************************************************"+
			"\n\t\tMANDATORY arguments"+
			"\n**************************************************************"+
			"\n\t\t-trainTreatment <Peak sequences of the training experiment>"+
			"\n\t\t-trainControl <Control sequences of the training experiment>"+
			"\n\t\t-targetTreatment <Peak sequences of the experiment to score>"+
			"\n\t\t-targetControl <Control sequences of the experiment to score>"+
			"\n\t\t-out <Output file: chr start end id label probability>"+
			"\n\n**************************************************************"+
			"\n\t\tOPTIONAL arguments"+
			"\n**************************************************************"+
			"\n\t\t-lambda <L2 regularization weight. DEFAULT: " + LogisticRegressionSGD.DEFAULT_LAMBDA + ">"+
			"\n\t\t-learners <Number of learners in the ensemble. DEFAULT: " + EnsembleClassifier.DEFAULT_NUM_LEARNERS + ">"+
			"\n\t\t-threads <Number of learners trained in parallel. DEFAULT: 1>"+
			"\n\t\t-epochs <Passes over the training data per learner. DEFAULT: " + LogisticRegressionSGD.DEFAULT_EPOCHS + ">"+
			"\n\t\t-learningRate <Initial learning rate. DEFAULT: " + LogisticRegressionSGD.DEFAULT_ETA0 + ">"+
			"\n\t\t-schedule <constant or inverse_scaling. DEFAULT: inverse_scaling>"+
			"\n\t\t-initScale <Standard deviation of the random initial weights. DEFAULT: " + LogisticRegressionSGD.DEFAULT_INIT_SCALE + ">"+
			"\n\t\t-minK <Shortest k-mer counted. DEFAULT: " + KmerVectorizer.DEFAULT_MIN_K + ">"+
			"\n\t\t-maxK <Longest k-mer counted. DEFAULT: " + KmerVectorizer.DEFAULT_MAX_K + ">"+
			"\n\t\t-seed <Seed of the random number generator. DEFAULT: unseeded>"+
			"\n";

	static Logger logger = Logger.getLogger(PeakClassifier.class.getName());

	private final File trainTreatmentFile;
	private final File trainControlFile;
	private final File targetTreatmentFile;
	private final File targetControlFile;
	private final File outputFile;
	private final KmerVectorizer vectorizer;
	private final EnsembleClassifier classifier;
	private final RandomGenerator generator;

	/**
	 * Validate every argument; nothing is read yet
	 * @throws ConfigurationException on a missing, malformed or invalid argument
	 */
	public PeakClassifier(ArgumentMap argMap) {
		trainTreatmentFile = new File(argMap.getMandatory("trainTreatment"));
		trainControlFile = new File(argMap.getMandatory("trainControl"));
		targetTreatmentFile = new File(argMap.getMandatory("targetTreatment"));
		targetControlFile = new File(argMap.getMandatory("targetControl"));
		outputFile = new File(argMap.getOutput());

		LearningRateSchedule schedule;
		try {
			schedule = LearningRateSchedule.fromName(argMap.get("schedule", LearningRateSchedule.INVERSE_SCALING.name()));
		} catch (IllegalArgumentException e) {
			throw new ConfigurationException(e.getMessage() + "\n" + usage);
		}
		LogisticRegressionSGD learner = new LogisticRegressionSGD(
				argMap.getDouble("lambda", LogisticRegressionSGD.DEFAULT_LAMBDA),
				argMap.getInteger("epochs", LogisticRegressionSGD.DEFAULT_EPOCHS),
				argMap.getDouble("learningRate", LogisticRegressionSGD.DEFAULT_ETA0),
				schedule,
				argMap.getDouble("initScale", LogisticRegressionSGD.DEFAULT_INIT_SCALE));
		classifier = new EnsembleClassifier(learner, argMap.getInteger("learners", EnsembleClassifier.DEFAULT_NUM_LEARNERS), argMap.getInteger("threads", 1));
		try {
			vectorizer = new KmerVectorizer(argMap.getInteger("minK", KmerVectorizer.DEFAULT_MIN_K), argMap.getInteger("maxK", KmerVectorizer.DEFAULT_MAX_K));
		} catch (IllegalArgumentException e) {
			throw new ConfigurationException(e.getMessage());
		}
		generator = argMap.isPresent("seed") ? new MersenneTwister(argMap.getLong("seed")) : new MersenneTwister();
	}

	/**
	 * Train on the training experiment, score the target experiment and write the predictions
	 */
	public EvaluationSummary classify() throws IOException, ParseException {
		OrderedSequenceMap trainTreatment = FastaSequenceIO.loadSequences(trainTreatmentFile);
		OrderedSequenceMap trainControl = FastaSequenceIO.loadSequences(trainControlFile);
		OrderedSequenceMap targetTreatment = FastaSequenceIO.loadSequences(targetTreatmentFile);
		OrderedSequenceMap targetControl = FastaSequenceIO.loadSequences(targetControlFile);

		List<String> trainSequences = concatenate(trainTreatment, trainControl);
		vectorizer.fit(trainSequences);
		FeatureMatrix trainFeatures = vectorizer.transform(trainSequences);
		FeatureMatrix targetFeatures = vectorizer.transform(concatenate(targetTreatment, targetControl));

		EnsembleModel model = classifier.train(trainFeatures, labels(trainTreatment.size(), trainControl.size()), generator);
		double[] probabilities = model.predictProbabilities(targetFeatures);

		List<PredictionRecord> records = Evaluator.toRecords(targetTreatment, targetControl, probabilities);
		Evaluator.write(records, outputFile);
		return Evaluator.summarize(records);
	}

	static List<String> concatenate(OrderedSequenceMap treatment, OrderedSequenceMap control) {
		List<String> rtrn = new ArrayList<String>(treatment.size() + control.size());
		rtrn.addAll(treatment.getSequences());
		rtrn.addAll(control.getSequences());
		return rtrn;
	}

	/**
	 * @return numTreatment ones followed by numControl zeros
	 */
	static int[] labels(int numTreatment, int numControl) {
		int[] rtrn = new int[numTreatment + numControl];
		for (int i = 0; i < numTreatment; i++) {
			rtrn[i] = 1;
		}
		return rtrn;
	}

	/**
	 * @return 0 on success, 2 on a configuration error (before any processing), 1 on any other failure
	 */
	public static int instanceMain(String[] args) {
		PeakClassifier peakClassifier;
		try {
			peakClassifier = new PeakClassifier(CLUtil.getParameters(args, usage));
		} catch (ConfigurationException e) {
			logger.error(e.getMessage());
			return 2;
		}
		try {
			EvaluationSummary summary = peakClassifier.classify();
			System.out.println(String.format("ROC-AUC: %.2f%%", 100 * summary.getRocAuc()));
			return 0;
		} catch (IOException e) {
			logger.error("I/O error: " + e.getMessage(), e);
		} catch (ParseException e) {
			logger.error("Parse error: " + e.getMessage(), e);
		} catch (InsufficientDataException e) {
			logger.error("Insufficient data: " + e.getMessage(), e);
		}
		return 1;
	}

	public static void main(String[] args) {
		System.exit(instanceMain(args));
	}

	public File getOutputFile() {
		return outputFile;
	}
}
