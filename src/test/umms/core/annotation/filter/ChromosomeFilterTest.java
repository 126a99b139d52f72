package umms.core.annotation.filter;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import umms.core.feature.ControlWindow;

class ChromosomeFilterTest {

	@Test
	void acceptsOnlyListedChromosomes() {
		ChromosomeFilter<ControlWindow> filter = new ChromosomeFilter<ControlWindow>(Arrays.asList("chr1", "chrX"));

		assertThat(filter.evaluate(new ControlWindow("chr1", 1, 3))).isTrue();
		assertThat(filter.evaluate(new ControlWindow("chrX", 1, 3))).isTrue();
		assertThat(filter.evaluate(new ControlWindow("chr10", 1, 3))).isFalse();
	}
}
