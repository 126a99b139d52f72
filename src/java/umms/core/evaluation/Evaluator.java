package umms.core.evaluation;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import broad.core.math.MannWhitney;
import umms.core.exception.InsufficientDataException;
import umms.core.sequence.OrderedSequenceMap;
import umms.core.sequence.SequenceRecord;

/**
 * Pairs predictions with the sequences they were made for and measures how well they
 * separate treatment (label 1) from control (label 0).
 */
public class Evaluator {

	static Logger logger = Logger.getLogger(Evaluator.class.getName());

	public static final double DECISION_THRESHOLD = 0.5;

	/**
	 * Build one record per sequence: every treatment sequence in map order, then every control
	 * sequence in map order.
	 * @param probabilities predictions in that same order
	 */
	public static List<PredictionRecord> toRecords(OrderedSequenceMap treatment, OrderedSequenceMap control, double[] probabilities) {
		if (probabilities.length != treatment.size() + control.size()) {
			throw new IllegalArgumentException("Got " + probabilities.length + " predictions for " + (treatment.size() + control.size()) + " sequences");
		}
		List<PredictionRecord> rtrn = new ArrayList<PredictionRecord>(probabilities.length);
		int i = 0;
		for (SequenceRecord r : treatment) {
			rtrn.add(new PredictionRecord(r, 1, probabilities[i++]));
		}
		for (SequenceRecord r : control) {
			rtrn.add(new PredictionRecord(r, 0, probabilities[i++]));
		}
		return rtrn;
	}

	/**
	 * Rank based (Mann-Whitney) area under the ROC curve, ties receiving their average rank
	 * @throws InsufficientDataException if either label is absent
	 */
	public static double rocAuc(int[] labels, double[] probabilities) {
		if (labels.length != probabilities.length) {
			throw new IllegalArgumentException("Got " + labels.length + " labels and " + probabilities.length + " predictions");
		}
		int positives = 0;
		for (int y : labels) {
			if (y == 1) {
				positives++;
			} else if (y != 0) {
				throw new IllegalArgumentException("Labels must be 0 or 1, got " + y);
			}
		}
		int negatives = labels.length - positives;
		if (positives == 0 || negatives == 0) {
			throw new InsufficientDataException("ROC-AUC needs both labels, got " + positives + " positives and " + negatives + " negatives");
		}
		double[] positiveScores = new double[positives];
		double[] negativeScores = new double[negatives];
		int p = 0;
		int n = 0;
		for (int i = 0; i < labels.length; i++) {
			if (labels[i] == 1) {
				positiveScores[p++] = probabilities[i];
			} else {
				negativeScores[n++] = probabilities[i];
			}
		}
		return new MannWhitney(positiveScores, negativeScores).getAUC();
	}

	public static EvaluationSummary summarize(List<PredictionRecord> records) {
		int[] labels = new int[records.size()];
		double[] probabilities = new double[records.size()];
		int positives = 0;
		int correct = 0;
		for (int i = 0; i < labels.length; i++) {
			PredictionRecord r = records.get(i);
			labels[i] = r.getLabel();
			probabilities[i] = r.getProbability();
			positives += labels[i];
			int call = probabilities[i] >= DECISION_THRESHOLD ? 1 : 0;
			if (call == labels[i]) {
				correct++;
			}
		}
		double auc = rocAuc(labels, probabilities);
		EvaluationSummary summary = new EvaluationSummary(positives, labels.length - positives, auc, correct / (double) labels.length);
		logger.info(summary);
		return summary;
	}

	/**
	 * Write records as headerless tab delimited lines: chr, start, end, id, label, probability
	 */
	public static void write(List<PredictionRecord> records, File output) throws IOException {
		BufferedWriter bw = new BufferedWriter(new OutputStreamWriter(new FileOutputStream(output), StandardCharsets.UTF_8));
		try {
			for (PredictionRecord r : records) {
				bw.write(r.toTabbedLine());
				bw.newLine();
			}
		} finally {
			bw.close();
		}
		logger.info("Wrote " + records.size() + " predictions to " + output);
	}
}
