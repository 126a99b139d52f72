package broad.core.sequence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import umms.core.exception.ParseException;
import umms.core.feature.ControlWindow;
import umms.core.sequence.Genome;
import umms.core.sequence.OrderedSequenceMap;
import umms.core.sequence.SequenceRecord;

class FastaSequenceIOTest {

	@TempDir
	File tmp;

	private File write(String name, String content) throws IOException {
		File f = new File(tmp, name);
		FileUtils.writeStringToFile(f, content, StandardCharsets.UTF_8);
		return f;
	}

	@Test
	void writtenSequencesReadBackIdentically() throws Exception {
		OrderedSequenceMap seqs = new OrderedSequenceMap();
		seqs.put(new SequenceRecord(new ControlWindow("chr2", 11, 131), StringUtils.repeat("ACGTTGCA", 16) + "ACG"));
		seqs.put(new SequenceRecord(new ControlWindow("chr1", 1, 3), "NNN"));
		File out = new File(tmp, "out.fa");

		new FastaSequenceIO(out).write(seqs);
		OrderedSequenceMap read = FastaSequenceIO.loadSequences(out);

		assertThat(read.getRecords()).isEqualTo(seqs.getRecords());
	}

	@Test
	void wrapsAtSixtyColumns() throws Exception {
		OrderedSequenceMap seqs = new OrderedSequenceMap();
		seqs.put(new SequenceRecord(new ControlWindow("chr1", 1, 131), StringUtils.repeat("A", 131)));
		File out = new File(tmp, "wrapped.fa");

		new FastaSequenceIO(out).write(seqs);
		List<String> lines = FileUtils.readLines(out, StandardCharsets.UTF_8);

		assertThat(lines).hasSize(4);
		assertThat(lines.get(0)).isEqualTo(">chr1:1-131");
		assertThat(lines.get(1)).hasSize(60);
		assertThat(lines.get(2)).hasSize(60);
		assertThat(lines.get(3)).hasSize(11);
	}

	@Test
	void genomeNamesAreTheFirstHeaderToken() throws Exception {
		File fa = write("genome.fa", ">chr1 assembled chromosome 1\nACGT\nAC\n\n>chr2\nTTTT\n");

		Genome genome = FastaSequenceIO.loadGenome(fa);

		assertThat(genome.getChromosomeNames()).containsExactly("chr1", "chr2");
		assertThat(genome.getSequence("chr1")).isEqualTo("ACGTAC");
		assertThat(genome.getGenomicSpace().getLength("chr2")).isEqualTo(4);
	}

	@Test
	void dataBeforeFirstHeaderIsAParseError() throws Exception {
		File fa = write("bad.fa", "ACGT\n>chr1\nACGT\n");

		assertThatThrownBy(() -> FastaSequenceIO.loadGenome(fa))
			.isInstanceOf(ParseException.class)
			.satisfies(e -> assertThat(((ParseException) e).getLineNumber()).isEqualTo(1));
	}

	@Test
	void repeatedChromosomeIsAParseError() throws Exception {
		File fa = write("dup.fa", ">chr1\nACGT\n>chr1\nACGT\n");

		assertThatThrownBy(() -> FastaSequenceIO.loadGenome(fa)).isInstanceOf(ParseException.class);
	}

	@Test
	void sequenceNamesMustBeWindowIdentifiers() throws Exception {
		File fa = write("names.fa", ">chr1:1-4\nACGT\n>peak_7\nACGT\n");

		assertThatThrownBy(() -> FastaSequenceIO.loadSequences(fa))
			.isInstanceOf(ParseException.class)
			.hasMessageContaining("peak_7");
	}
}
