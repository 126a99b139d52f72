package umms.core.coordinatesystem;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.log4j.Logger;

import umms.core.feature.Window;

/**
 * Class representing a genome with defined linear chromosomes. Only the chromosome
 * lengths are kept, which is all that sampling and bounds checking need.
 */
public class GenomicSpace {

	static Logger logger = Logger.getLogger(GenomicSpace.class.getName());

	private final Map<String, Integer> chromosomeSizes;

	/**
	 * @param chromosomeSizes chromosome name to length, iteration order is kept
	 */
	public GenomicSpace(Map<String, Integer> chromosomeSizes) {
		this.chromosomeSizes = Collections.unmodifiableMap(new LinkedHashMap<String, Integer>(chromosomeSizes));
	}

	public boolean hasChromosome(String chr) {
		return chromosomeSizes.containsKey(chr);
	}

	public int getLength(String chr) {
		Integer size = chromosomeSizes.get(chr);
		if (size == null) {
			throw new AnnotationOutOfBoundsException("Chromosome name " + chr + " not recognized.");
		}
		return size.intValue();
	}

	public long getLength() {
		long rtrn = 0;
		for (Integer size : chromosomeSizes.values()) {
			rtrn += size;
		}
		return rtrn;
	}

	public Collection<String> getReferenceNames() {
		return chromosomeSizes.keySet();
	}

	/**
	 * @return true if the chromosome is known and 1 <= start, end <= chromosome length
	 */
	public boolean isValidWindow(Window window) {
		return hasChromosome(window.getChr()) && window.getStart() >= 1 && window.getEnd() <= chromosomeSizes.get(window.getChr());
	}

	/**
	 * @throws AnnotationOutOfBoundsException if the window does not lie inside its chromosome
	 */
	public void checkBounds(Window window) {
		if (!hasChromosome(window.getChr())) {
			throw new AnnotationOutOfBoundsException("Window " + window.toUCSC() + " is on chromosome " + window.getChr() + " which is not in the genome");
		}
		if (!isValidWindow(window)) {
			throw new AnnotationOutOfBoundsException(window.getChr(), window.getStart(), window.getEnd(), getLength(window.getChr()));
		}
	}
}
