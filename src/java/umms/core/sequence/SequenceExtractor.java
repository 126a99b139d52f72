package umms.core.sequence;

import java.util.Collection;

import org.apache.log4j.Logger;

import umms.core.coordinatesystem.AnnotationOutOfBoundsException;
import umms.core.coordinatesystem.GenomicSpace;
import umms.core.feature.Window;

/**
 * Cuts window sequences out of a genome.
 */
public class SequenceExtractor {

	static Logger logger = Logger.getLogger(SequenceExtractor.class.getName());

	private final Genome genome;
	private final GenomicSpace space;

	public SequenceExtractor(Genome genome) {
		this.genome = genome;
		this.space = genome.getGenomicSpace();
	}

	/**
	 * @return bases start through end of the window's chromosome, both inclusive and 1-based
	 * @throws AnnotationOutOfBoundsException if the window is not entirely inside its chromosome
	 */
	public SequenceRecord extract(Window window) {
		space.checkBounds(window);
		String chromosome = genome.getSequence(window.getChr());
		return new SequenceRecord(window, chromosome.substring(window.getStart() - 1, window.getEnd()));
	}

	/**
	 * Extract every window, keeping the order of the input collection
	 */
	public OrderedSequenceMap extractAll(Collection<? extends Window> windows) {
		OrderedSequenceMap rtrn = new OrderedSequenceMap();
		for (Window w : windows) {
			if (!rtrn.put(extract(w))) {
				logger.debug("Window " + w.toUCSC() + " listed more than once");
			}
		}
		logger.info("Extracted " + rtrn.size() + " sequences from " + windows.size() + " windows");
		return rtrn;
	}

	public GenomicSpace getGenomicSpace() {
		return space;
	}
}
