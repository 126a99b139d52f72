package umms.kmerpeak;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;

import org.apache.commons.collections15.iterators.FilterIterator;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.log4j.Logger;

import broad.core.sequence.FastaSequenceIO;
import broad.core.util.CLUtil;
import broad.core.util.CLUtil.ArgumentMap;
import umms.core.annotation.PeakFileParser;
import umms.core.annotation.filter.ChromosomeFilter;
import umms.core.coordinatesystem.AnnotationOutOfBoundsException;
import umms.core.coordinatesystem.ControlWindowSampler;
import umms.core.exception.ConfigurationException;
import umms.core.exception.ParseException;
import umms.core.feature.ControlWindow;
import umms.core.feature.GenomeWindow;
import umms.core.feature.PeakWindow;
import umms.core.sequence.Genome;
import umms.core.sequence.OrderedSequenceMap;
import umms.core.sequence.SequenceExtractor;
import umms.core.writers.WindowWriter;

/**
 * Builds the treatment and control window sets of one experiment: peak windows centered on
 * their summits, an equal number of randomly placed background windows that avoid every peak,
 * and the genome sequence of each.
 */
public class WindowPreparer {

	static final String usage = "Usage: WindowPreparer -peaks <peak file> -genome <genome fasta> [options]"+
			"\n**************************************************************"+
			"\n\t\tMANDATORY arguments"+
			"\n**************************************************************"+
			"\n\t\t-peaks <Called peaks, whitespace delimited: chr start end ... summitOffset (10th column). Files with only chr start end are accepted, summits then default to the peak start>"+
			"\n\t\t-genome <Genome sequence in fasta format>"+
			"\n\n**************************************************************"+
			"\n\t\tOPTIONAL arguments"+
			"\n**************************************************************"+
			"\n\t\t-window <Window width, must be odd. DEFAULT: " + WindowPreparer.DEFAULT_WIDTH + ">"+
			"\n\t\t-chromosomes <Comma separated list of chromosomes to use. DEFAULT: all>"+
			"\n\t\t-maxAttempts <Random draws allowed per control window before giving up on it. DEFAULT: " + ControlWindowSampler.DEFAULT_MAX_ATTEMPTS + ">"+
			"\n\t\t-seed <Seed of the random number generator. DEFAULT: unseeded>"+
			"\n\t\t-outPrefix <Prefix of the output files. DEFAULT: peak file name without extension>"+
			"\n\t\t-treatmentWindows <Output peak windows. DEFAULT: <prefix>.peaks.bed>"+
			"\n\t\t-treatmentSequences <Output peak sequences. DEFAULT: <prefix>.peaks.fa>"+
			"\n\t\t-controlWindows <Output control windows. DEFAULT: <prefix>.controls.bed>"+
			"\n\t\t-controlSequences <Output control sequences. DEFAULT: <prefix>.controls.fa>"+
			"\n";

	static Logger logger = Logger.getLogger(WindowPreparer.class.getName());

	public static final int DEFAULT_WIDTH = 501;

	private final File peakFile;
	private final File genomeFile;
	private final int width;
	private final int maxAttempts;
	private final List<String> chromosomes;
	private final RandomGenerator generator;
	private final File treatmentWindowFile;
	private final File treatmentSequenceFile;
	private final File controlWindowFile;
	private final File controlSequenceFile;

	/**
	 * Validate every argument; nothing is read yet
	 * @throws ConfigurationException on a missing, malformed or invalid argument
	 */
	public WindowPreparer(ArgumentMap argMap) {
		width = argMap.getInteger("window", DEFAULT_WIDTH);
		GenomeWindow.checkWidth(width);
		maxAttempts = argMap.getInteger("maxAttempts", ControlWindowSampler.DEFAULT_MAX_ATTEMPTS);
		if (maxAttempts < 1) {
			throw new ConfigurationException("maxAttempts must be positive, got " + maxAttempts);
		}
		peakFile = new File(argMap.getMandatory("peaks"));
		genomeFile = new File(argMap.getMandatory("genome"));
		chromosomes = argMap.getList("chromosomes");
		generator = argMap.isPresent("seed") ? new MersenneTwister(argMap.getLong("seed")) : new MersenneTwister();

		String prefix = argMap.get("outPrefix", FilenameUtils.removeExtension(peakFile.getPath()));
		treatmentWindowFile = new File(argMap.get("treatmentWindows", prefix + ".peaks.bed"));
		treatmentSequenceFile = new File(argMap.get("treatmentSequences", prefix + ".peaks.fa"));
		controlWindowFile = new File(argMap.get("controlWindows", prefix + ".controls.bed"));
		controlSequenceFile = new File(argMap.get("controlSequences", prefix + ".controls.fa"));
	}

	/**
	 * Run the whole preparation and write the four output files
	 * @return number of control windows produced
	 */
	public int prepare() throws IOException, ParseException {
		List<PeakWindow> peaks = new PeakFileParser(width).load(peakFile);
		if (!chromosomes.isEmpty()) {
			peaks = restrict(peaks, chromosomes);
			logger.info("Kept " + peaks.size() + " peaks on chromosomes " + chromosomes);
		}
		peaks = collapseDuplicates(peaks);

		Genome genome = FastaSequenceIO.loadGenome(genomeFile);
		SequenceExtractor extractor = new SequenceExtractor(genome);
		OrderedSequenceMap treatment = extractor.extractAll(peaks);

		ControlWindowSampler sampler = new ControlWindowSampler(extractor.getGenomicSpace(), width, maxAttempts, generator);
		List<ControlWindow> controls = sampler.sample(peaks);
		OrderedSequenceMap control = extractor.extractAll(controls);

		WindowWriter.write(peaks, treatmentWindowFile);
		new FastaSequenceIO(treatmentSequenceFile).write(treatment);
		WindowWriter.write(controls, controlWindowFile);
		new FastaSequenceIO(controlSequenceFile).write(control);

		logger.info("Prepared " + peaks.size() + " treatment and " + controls.size() + " control windows of width " + width);
		return controls.size();
	}

	static List<PeakWindow> restrict(List<PeakWindow> peaks, List<String> chromosomes) {
		List<PeakWindow> rtrn = new ArrayList<PeakWindow>();
		Iterator<PeakWindow> it = new FilterIterator<PeakWindow>(peaks.iterator(), new ChromosomeFilter<PeakWindow>(chromosomes));
		while (it.hasNext()) {
			rtrn.add(it.next());
		}
		return rtrn;
	}

	/**
	 * Peaks that re-center to the same window share one sequence record, so only the first is kept
	 * and every output file lists the same windows.
	 */
	static List<PeakWindow> collapseDuplicates(List<PeakWindow> peaks) {
		List<PeakWindow> rtrn = new ArrayList<PeakWindow>(new LinkedHashSet<PeakWindow>(peaks));
		if (rtrn.size() < peaks.size()) {
			logger.info("Collapsed " + (peaks.size() - rtrn.size()) + " peaks centered on an already listed window");
		}
		return rtrn;
	}

	/**
	 * @return 0 on success, 2 on a configuration error (before any processing), 1 on any other failure
	 */
	public static int instanceMain(String[] args) {
		WindowPreparer preparer;
		try {
			preparer = new WindowPreparer(CLUtil.getParameters(args, usage));
		} catch (ConfigurationException e) {
			logger.error(e.getMessage());
			return 2;
		}
		try {
			preparer.prepare();
			return 0;
		} catch (IOException e) {
			logger.error("I/O error: " + e.getMessage(), e);
		} catch (ParseException e) {
			logger.error("Parse error: " + e.getMessage(), e);
		} catch (AnnotationOutOfBoundsException e) {
			logger.error("Window out of bounds: " + e.getMessage(), e);
		}
		return 1;
	}

	public static void main(String[] args) {
		System.exit(instanceMain(args));
	}

	public int getWidth() {
		return width;
	}

	public File getTreatmentWindowFile() {
		return treatmentWindowFile;
	}

	public File getTreatmentSequenceFile() {
		return treatmentSequenceFile;
	}

	public File getControlWindowFile() {
		return controlWindowFile;
	}

	public File getControlSequenceFile() {
		return controlSequenceFile;
	}
}
