package umms.core.evaluation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import umms.core.exception.InsufficientDataException;
import umms.core.feature.ControlWindow;
import umms.core.sequence.OrderedSequenceMap;
import umms.core.sequence.SequenceRecord;

class EvaluatorTest {

	@TempDir
	File tmp;

	private static OrderedSequenceMap sequences(String chr, int count) {
		OrderedSequenceMap rtrn = new OrderedSequenceMap();
		for (int i = 0; i < count; i++) {
			rtrn.put(new SequenceRecord(new ControlWindow(chr, 1 + 10 * i, 3), "ACG"));
		}
		return rtrn;
	}

	@Test
	void treatmentRecordsComeFirst() {
		List<PredictionRecord> records = Evaluator.toRecords(sequences("chr1", 2), sequences("chr2", 1), new double[] {0.9, 0.8, 0.2});

		assertThat(records).extracting(PredictionRecord::getId).containsExactly("chr1:1-3", "chr1:11-13", "chr2:1-3");
		assertThat(records).extracting(PredictionRecord::getLabel).containsExactly(1, 1, 0);
		assertThat(records.get(1).toTabbedLine()).isEqualTo("chr1\t11\t13\tchr1:11-13\t1\t0.8");
	}

	@Test
	void perfectRankingScoresOne() {
		assertThat(Evaluator.rocAuc(new int[] {1, 1, 0, 0}, new double[] {0.9, 0.8, 0.3, 0.1})).isEqualTo(1.0);
	}

	@Test
	void probabilitiesEqualToLabelsScoreOne() {
		assertThat(Evaluator.rocAuc(new int[] {0, 1, 1, 0, 1}, new double[] {0, 1, 1, 0, 1})).isEqualTo(1.0);
	}

	@Test
	void invertedRankingScoresZero() {
		assertThat(Evaluator.rocAuc(new int[] {1, 0}, new double[] {0.1, 0.9})).isEqualTo(0.0);
	}

	@Test
	void constantPredictionsScoreOneHalf() {
		assertThat(Evaluator.rocAuc(new int[] {1, 0, 1, 0, 0}, new double[] {0.5, 0.5, 0.5, 0.5, 0.5})).isCloseTo(0.5, within(1e-12));
	}

	@Test
	void singleLabelHasNoAuc() {
		assertThatThrownBy(() -> Evaluator.rocAuc(new int[] {1, 1}, new double[] {0.2, 0.4})).isInstanceOf(InsufficientDataException.class);
	}

	@Test
	void summaryCountsAccuracyAtOneHalf() {
		List<PredictionRecord> records = Evaluator.toRecords(sequences("chr1", 2), sequences("chr2", 2), new double[] {0.5, 0.4, 0.6, 0.1});

		EvaluationSummary summary = Evaluator.summarize(records);

		assertThat(summary.getPositives()).isEqualTo(2);
		assertThat(summary.getNegatives()).isEqualTo(2);
		assertThat(summary.getAccuracy()).isCloseTo(0.5, within(1e-12));
		assertThat(summary.getRocAuc()).isCloseTo(0.5, within(1e-12));
		assertThat(summary.toString()).startsWith("ROC-AUC: 50.00%");
	}

	@Test
	void writesOneTabbedLinePerRecord() throws Exception {
		List<PredictionRecord> records = Evaluator.toRecords(sequences("chr1", 1), sequences("chr2", 1), new double[] {1, 0});
		File out = new File(tmp, "predictions.txt");

		Evaluator.write(records, out);

		assertThat(FileUtils.readLines(out, StandardCharsets.UTF_8)).containsExactly(
				"chr1\t1\t3\tchr1:1-3\t1\t1.0",
				"chr2\t1\t3\tchr2:1-3\t0\t0.0");
	}

	@Test
	void tinyProbabilitiesAreWrittenWithoutExponent() {
		List<PredictionRecord> records = Evaluator.toRecords(sequences("chr1", 1), sequences("chr2", 1), new double[] {0.99999, 1.5e-5});

		assertThat(records.get(1).toTabbedLine()).isEqualTo("chr2\t1\t3\tchr2:1-3\t0\t0.000015");
		assertThat(records.get(0).toTabbedLine()).endsWith("\t0.99999");
		assertThat(new PredictionRecord(new SequenceRecord(new ControlWindow("chr1", 1, 3), "ACG"), 0, 1e-300).toTabbedLine())
			.doesNotContain("E")
			.contains("\t0\t0.000000");
	}

	@Test
	void predictionCountMustMatch() {
		assertThatThrownBy(() -> Evaluator.toRecords(sequences("chr1", 2), sequences("chr2", 1), new double[] {0.5}))
			.isInstanceOf(IllegalArgumentException.class);
	}
}
