package umms.core.kmer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Fixed, ordered set of k-mers. Column i holds the i-th k-mer in lexicographic order.
 */
public final class KmerVocabulary {

	private final List<String> kmers;
	private final Map<String, Integer> columns;

	public KmerVocabulary(Collection<String> kmers) {
		this.kmers = Collections.unmodifiableList(new ArrayList<String>(new TreeSet<String>(kmers)));
		this.columns = new HashMap<String, Integer>(this.kmers.size() * 2);
		for (int i = 0; i < this.kmers.size(); i++) {
			columns.put(this.kmers.get(i), i);
		}
	}

	/**
	 * @return column of the k-mer, or -1 if it is not part of the vocabulary
	 */
	public int getColumn(String kmer) {
		Integer column = columns.get(kmer);
		return column == null ? -1 : column.intValue();
	}

	public String getKmer(int column) {
		return kmers.get(column);
	}

	public List<String> getKmers() {
		return kmers;
	}

	public int size() {
		return kmers.size();
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof KmerVocabulary && kmers.equals(((KmerVocabulary) o).kmers);
	}

	@Override
	public int hashCode() {
		return kmers.hashCode();
	}
}
