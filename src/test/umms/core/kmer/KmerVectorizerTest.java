package umms.core.kmer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

class KmerVectorizerTest {

	@Test
	void homopolymerHasOneKmer() {
		KmerVectorizer vectorizer = new KmerVectorizer(6, 6);

		FeatureMatrix X = vectorizer.fitTransform(Collections.singletonList("AAAAAA"));

		assertThat(vectorizer.getVocabulary().getKmers()).containsExactly("AAAAAA");
		assertThat(X.getNumRows()).isEqualTo(1);
		assertThat(X.getRow(0).toDense()).containsExactly(1.0);
	}

	@Test
	void unseenKmersGiveAnAllZeroRow() {
		KmerVectorizer vectorizer = new KmerVectorizer(6, 6);
		vectorizer.fit(Collections.singletonList("AAAAAA"));

		FeatureMatrix X = vectorizer.transform(Collections.singletonList("CCCCCC"));

		assertThat(X.getNumColumns()).isEqualTo(1);
		assertThat(X.getRow(0).getNumNonZero()).isZero();
	}

	@Test
	void columnsAreInLexicographicOrder() {
		KmerVectorizer vectorizer = new KmerVectorizer(2, 2);

		KmerVocabulary vocabulary = vectorizer.fit(Arrays.asList("TGCA", "GAC"));

		assertThat(vocabulary.getKmers()).containsExactly("AC", "CA", "GA", "GC", "TG");
		assertThat(vocabulary.getColumn("GA")).isEqualTo(2);
		assertThat(vocabulary.getKmer(4)).isEqualTo("TG");
		assertThat(vocabulary.getColumn("TT")).isEqualTo(-1);
	}

	@Test
	void countsOverlappingKmersOfEveryLength() {
		KmerVectorizer vectorizer = new KmerVectorizer(6, 8);
		String seq = "AAAAAAAAAA";

		FeatureMatrix X = vectorizer.fitTransform(Collections.singletonList(seq));
		KmerVocabulary v = vectorizer.getVocabulary();

		assertThat(v.getKmers()).containsExactly("AAAAAA", "AAAAAAA", "AAAAAAAA");
		SparseVector row = X.getRow(0);
		assertThat(row.get(v.getColumn("AAAAAA"))).isEqualTo(5.0);
		assertThat(row.get(v.getColumn("AAAAAAA"))).isEqualTo(4.0);
		assertThat(row.get(v.getColumn("AAAAAAAA"))).isEqualTo(3.0);
	}

	@Test
	void sequencesShorterThanKContributeNothing() {
		KmerVectorizer vectorizer = new KmerVectorizer(6, 8);

		FeatureMatrix X = vectorizer.fitTransform(Arrays.asList("ACGTACG", "ACG"));

		assertThat(vectorizer.getVocabulary().getKmers()).containsExactly("ACGTAC", "ACGTACG", "CGTACG");
		assertThat(X.getRow(1).getNumNonZero()).isZero();
	}

	@Test
	void matchingIsCaseSensitive() {
		KmerVectorizer vectorizer = new KmerVectorizer(3, 3);
		vectorizer.fit(Collections.singletonList("ACG"));

		assertThat(vectorizer.transform(Collections.singletonList("acg")).getNumNonZero()).isZero();
	}

	@Test
	void targetVocabularyIsNotExtended() {
		KmerVectorizer vectorizer = new KmerVectorizer(3, 3);
		vectorizer.fit(Collections.singletonList("AAAC"));

		FeatureMatrix X = vectorizer.transform(Arrays.asList("AAACCC", "GGG"));

		assertThat(X.getNumColumns()).isEqualTo(2);
		assertThat(X.getRow(0).toDense()).containsExactly(1.0, 1.0);
		assertThat(vectorizer.getVocabulary().size()).isEqualTo(2);
	}

	@Test
	void transformBeforeFitFails() {
		assertThatThrownBy(() -> new KmerVectorizer().transform(Collections.singletonList("ACGT")))
			.isInstanceOf(IllegalStateException.class);
	}

	@Test
	void rejectsInvalidLengthRange() {
		assertThatThrownBy(() -> new KmerVectorizer(0, 3)).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new KmerVectorizer(5, 4)).isInstanceOf(IllegalArgumentException.class);
	}
}
