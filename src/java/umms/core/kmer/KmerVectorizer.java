package umms.core.kmer;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.apache.log4j.Logger;

/**
 * Counts overlapping k-mers of every length between minK and maxK.
 * <p>
 * {@link #fit(List)} fixes the vocabulary to the k-mers seen in the given sequences. Every later
 * {@link #transform(List)} counts only those k-mers; anything else, including k-mers found only in a
 * different experiment, is ignored. Matching is case sensitive and windows are never padded.
 */
public class KmerVectorizer {

	static Logger logger = Logger.getLogger(KmerVectorizer.class.getName());

	public static final int DEFAULT_MIN_K = 6;
	public static final int DEFAULT_MAX_K = 8;

	private final int minK;
	private final int maxK;
	private KmerVocabulary vocabulary;

	public KmerVectorizer() {
		this(DEFAULT_MIN_K, DEFAULT_MAX_K);
	}

	public KmerVectorizer(int minK, int maxK) {
		if (minK < 1 || maxK < minK) {
			throw new IllegalArgumentException("Invalid k-mer length range [" + minK + "," + maxK + "]");
		}
		this.minK = minK;
		this.maxK = maxK;
	}

	/**
	 * Build the vocabulary from every distinct k-mer in the sequences
	 * @return the fitted vocabulary
	 */
	public KmerVocabulary fit(List<String> sequences) {
		Set<String> kmers = new HashSet<String>();
		for (String seq : sequences) {
			for (int k = minK; k <= maxK; k++) {
				for (int i = 0; i + k <= seq.length(); i++) {
					kmers.add(seq.substring(i, i + k));
				}
			}
		}
		vocabulary = new KmerVocabulary(kmers);
		logger.info("Fitted vocabulary of " + vocabulary.size() + " k-mers (k=" + minK + ".." + maxK + ") on " + sequences.size() + " sequences");
		return vocabulary;
	}

	/**
	 * @return one count row per sequence, in input order
	 * @throws IllegalStateException if called before {@link #fit(List)}
	 */
	public FeatureMatrix transform(List<String> sequences) {
		if (vocabulary == null) {
			throw new IllegalStateException("Vectorizer must be fitted before transforming sequences");
		}
		List<SparseVector> rows = new ArrayList<SparseVector>(sequences.size());
		for (String seq : sequences) {
			rows.add(count(seq));
		}
		return new FeatureMatrix(vocabulary.size(), rows);
	}

	public FeatureMatrix fitTransform(List<String> sequences) {
		fit(sequences);
		return transform(sequences);
	}

	SparseVector count(String seq) {
		Map<Integer, Integer> counts = new TreeMap<Integer, Integer>();
		for (int k = minK; k <= maxK; k++) {
			for (int i = 0; i + k <= seq.length(); i++) {
				int column = vocabulary.getColumn(seq.substring(i, i + k));
				if (column >= 0) {
					Integer c = counts.get(column);
					counts.put(column, c == null ? 1 : c + 1);
				}
			}
		}
		int[] indices = new int[counts.size()];
		double[] values = new double[counts.size()];
		int j = 0;
		for (Map.Entry<Integer, Integer> e : counts.entrySet()) {
			indices[j] = e.getKey();
			values[j] = e.getValue();
			j++;
		}
		return new SparseVector(vocabulary.size(), indices, values);
	}

	public KmerVocabulary getVocabulary() {
		return vocabulary;
	}

	public int getMinK() {
		return minK;
	}

	public int getMaxK() {
		return maxK;
	}
}
