package umms.core.classifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

import umms.core.kmer.SparseVector;

class WeightVectorTest {

	@Test
	void scaledVectorMatchesDenseArithmetic() {
		WeightVector w = new WeightVector(new double[] {1, 2, 3});
		SparseVector x = new SparseVector(3, new int[] {0, 2}, new double[] {1, 1});

		w.scale(0.5);
		w.add(x, 1);

		assertThat(w.toArray()).containsExactly(new double[] {1.5, 1, 2.5}, within(1e-12));
		assertThat(w.dot(x)).isCloseTo(4, within(1e-12));
	}

	@Test
	void survivesManyShrinkSteps() {
		WeightVector w = new WeightVector(new double[] {1, 1});
		SparseVector x = new SparseVector(2, new int[] {1}, new double[] {1});

		for (int i = 0; i < 10000; i++) {
			w.scale(0.99);
			w.add(x, 0.01);
		}

		assertThat(w.get(0)).isCloseTo(0, within(1e-12));
		// fixed point of w = 0.99 w + 0.01
		assertThat(w.get(1)).isCloseTo(1, within(1e-9));
	}
}
