package broad.core.sequence;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.log4j.Logger;

import umms.core.exception.ParseException;
import umms.core.sequence.Genome;
import umms.core.sequence.OrderedSequenceMap;
import umms.core.sequence.SequenceRecord;

/**
 * Reads and writes multi-record fasta files. A record starts with a '>' line whose first
 * whitespace delimited token is the record name; the following lines, stripped of line
 * breaks, are concatenated into its sequence.
 *
 * @author MGarber
 *
 */
public class FastaSequenceIO {
	public static final int LINE_LENGTH = 60;
	private static Logger logger = Logger.getLogger(FastaSequenceIO.class.getName());

	private final File file;

	public FastaSequenceIO(String fileName) {
		this(new File(fileName));
	}

	public FastaSequenceIO(File file) {
		this.file = file;
	}

	/**
	 * Callback receiving each record as soon as it is complete
	 */
	interface RecordHandler {
		void handle(String name, String sequence, int headerLine) throws ParseException;
	}

	/**
	 * @param genomeFasta Fasta file of chromosomes
	 * @return chromosome name to sequence, in file order
	 */
	public static Genome loadGenome(File genomeFasta) throws IOException, ParseException {
		logger.info("Reading chromosome sequences from file " + genomeFasta + "...");
		final Map<String, String> chromosomes = new LinkedHashMap<String, String>();
		new FastaSequenceIO(genomeFasta).read(new RecordHandler() {
			public void handle(String name, String sequence, int headerLine) throws ParseException {
				if (chromosomes.containsKey(name)) {
					throw new ParseException("Chromosome " + name + " appears more than once", headerLine);
				}
				chromosomes.put(name, sequence);
			}
		});
		logger.info("Loaded " + chromosomes.size() + " chromosomes.");
		return new Genome(chromosomes);
	}

	/**
	 * Load window sequences written by {@link #write(OrderedSequenceMap)}; names must be chr:start-end
	 */
	public static OrderedSequenceMap loadSequences(File fasta) throws IOException, ParseException {
		final OrderedSequenceMap rtrn = new OrderedSequenceMap();
		new FastaSequenceIO(fasta).read(new RecordHandler() {
			public void handle(String name, String sequence, int headerLine) throws ParseException {
				try {
					rtrn.put(SequenceRecord.fromId(name, sequence));
				} catch (IllegalArgumentException e) {
					throw new ParseException(e.getMessage(), headerLine);
				}
			}
		});
		logger.info("Loaded " + rtrn.size() + " sequences from " + fasta.getName());
		return rtrn;
	}

	void read(RecordHandler handler) throws IOException, ParseException {
		InputStream is = new FileInputStream(file);
		try {
			read(is, handler);
		} finally {
			is.close();
		}
	}

	void read(InputStream is, RecordHandler handler) throws IOException, ParseException {
		BufferedReader br = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8));
		String line = null;
		String currentSeqId = null;
		int headerLine = 0;
		int lineNumber = 0;
		StringBuilder seq = new StringBuilder();
		while((line = br.readLine()) != null) {
			lineNumber++;
			if (line.startsWith(">")) {
				if(currentSeqId != null) {
					handler.handle(currentSeqId, seq.toString(), headerLine);
				}
				String [] spaceSeparatedIds = line.substring(1).trim().split("\\s+");
				currentSeqId = spaceSeparatedIds[0];
				if(currentSeqId.isEmpty()) {
					throw new ParseException("Fasta header without a name", lineNumber);
				}
				headerLine = lineNumber;
				seq.setLength(0);
				continue;
			}
			String trimmed = line.trim();
			if(trimmed.isEmpty()) {
				continue;
			}
			if(currentSeqId == null) {
				throw new ParseException("Sequence data found before the first fasta header", lineNumber);
			}
			seq.append(trimmed);
		}
		if(currentSeqId != null) {
			handler.handle(currentSeqId, seq.toString(), headerLine);
		}
	}

	/**
	 * Write records in map order, wrapping sequences at {@link #LINE_LENGTH} columns
	 */
	public void write(OrderedSequenceMap seqs) throws IOException {
		BufferedWriter bw = new BufferedWriter(new OutputStreamWriter(new FileOutputStream(file), StandardCharsets.UTF_8));
		try {
			for(SequenceRecord record : seqs) {
				bw.write(">");
				bw.write(record.getId());
				bw.newLine();
				String bases = record.getSequence();
				for(int i = 0; i < bases.length(); i += LINE_LENGTH) {
					bw.write(bases, i, Math.min(LINE_LENGTH, bases.length() - i));
					bw.newLine();
				}
			}
		} finally {
			bw.close();
		}
		logger.info("Wrote " + seqs.size() + " sequences to " + file);
	}

	public File getFile() {
		return file;
	}
}
