package umms.core.sequence;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import umms.core.coordinatesystem.GenomicSpace;

/**
 * Chromosome sequences by name. Immutable once built.
 */
public class Genome {

	private final Map<String, String> chromosomes;

	public Genome(Map<String, String> chromosomes) {
		this.chromosomes = Collections.unmodifiableMap(new LinkedHashMap<String, String>(chromosomes));
	}

	public boolean hasChromosome(String chr) {
		return chromosomes.containsKey(chr);
	}

	/**
	 * @return the full chromosome sequence or null if chr is not part of the genome
	 */
	public String getSequence(String chr) {
		return chromosomes.get(chr);
	}

	public Collection<String> getChromosomeNames() {
		return chromosomes.keySet();
	}

	public int size() {
		return chromosomes.size();
	}

	public GenomicSpace getGenomicSpace() {
		Map<String, Integer> sizes = new LinkedHashMap<String, Integer>();
		for (Map.Entry<String, String> e : chromosomes.entrySet()) {
			sizes.put(e.getKey(), e.getValue().length());
		}
		return new GenomicSpace(sizes);
	}
}
