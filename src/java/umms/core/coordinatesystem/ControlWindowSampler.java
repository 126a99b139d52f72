package umms.core.coordinatesystem;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.log4j.Logger;

import umms.core.feature.ControlWindow;
import umms.core.feature.GenomeWindow;
import umms.core.feature.Window;

/**
 * Draws background windows that overlap neither a peak nor any previously drawn control.
 * <p>
 * One control is attempted per peak. The chromosome of each attempt is drawn from the peaks'
 * chromosomes with replacement, so chromosomes carrying more peaks receive proportionally more
 * controls regardless of their length. Within a chromosome the start is uniform over every
 * position where the window fits. A slot that finds no free position within the allowed number
 * of draws is dropped, so fewer controls than peaks may be returned.
 */
public class ControlWindowSampler {

	static Logger logger = Logger.getLogger(ControlWindowSampler.class.getName());

	public static final int DEFAULT_MAX_ATTEMPTS = 1000;

	private final GenomicSpace space;
	private final int width;
	private final int maxAttempts;
	private final RandomGenerator generator;
	private int exhaustedSlots;

	public ControlWindowSampler(GenomicSpace space, int width, RandomGenerator generator) {
		this(space, width, DEFAULT_MAX_ATTEMPTS, generator);
	}

	public ControlWindowSampler(GenomicSpace space, int width, int maxAttempts, RandomGenerator generator) {
		GenomeWindow.checkWidth(width);
		if (maxAttempts < 1) {
			throw new IllegalArgumentException("Number of attempts must be positive, got " + maxAttempts);
		}
		this.space = space;
		this.width = width;
		this.maxAttempts = maxAttempts;
		this.generator = generator;
	}

	/**
	 * @param peaks peak windows, all of them are excluded from sampling
	 * @return accepted control windows in the order they were drawn
	 */
	public List<ControlWindow> sample(List<? extends Window> peaks) {
		ExclusionIndex index = new ExclusionIndex(peaks);
		List<String> peakChromosomes = new ArrayList<String>(peaks.size());
		for (Window peak : peaks) {
			peakChromosomes.add(peak.getChr());
		}

		exhaustedSlots = 0;
		List<ControlWindow> controls = new ArrayList<ControlWindow>(peaks.size());
		for (int slot = 0; slot < peakChromosomes.size(); slot++) {
			String chr = peakChromosomes.get(generator.nextInt(peakChromosomes.size()));
			try {
				ControlWindow control = placeControl(chr, index);
				index.add(control);
				controls.add(control);
			} catch (PermutationNotFoundException e) {
				exhaustedSlots++;
				logger.warn("Skipping control slot " + slot + ": " + e.getMessage());
			}
		}
		logger.info("Sampled " + controls.size() + " control windows for " + peaks.size() + " peaks (" + exhaustedSlots + " slots exhausted)");
		return controls;
	}

	/**
	 * Draw start positions on chr until a window clears the index
	 * @throws PermutationNotFoundException if every attempt overlaps an occupied interval
	 * or the chromosome is shorter than the window
	 */
	ControlWindow placeControl(String chr, ExclusionIndex index) {
		// offsets are 0-based, valid ones lie in [0, length - width]
		int lastOffset = space.getLength(chr) - width;
		if (lastOffset < 0) {
			throw new PermutationNotFoundException(chr, maxAttempts);
		}
		for (int i = 0; i < maxAttempts; i++) {
			int offset = generator.nextInt(lastOffset + 1);
			ControlWindow candidate = new ControlWindow(chr, offset + 1, width);
			if (!index.overlaps(candidate)) {
				return candidate;
			}
		}
		throw new PermutationNotFoundException(chr, maxAttempts);
	}

	/**
	 * @return number of slots dropped by the most recent call to {@link #sample(List)}
	 */
	public int getExhaustedSlots() {
		return exhaustedSlots;
	}

	public int getWidth() {
		return width;
	}
}
