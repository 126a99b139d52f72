package umms.core.coordinatesystem;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import umms.core.feature.ControlWindow;

class ExclusionIndexTest {

	@Test
	void chromosomesAreIndexedIndependently() {
		ExclusionIndex index = new ExclusionIndex(Arrays.asList(new ControlWindow("chr1", 100, 11), new ControlWindow("chr2", 500, 11)));

		assertThat(index.overlaps(new ControlWindow("chr1", 105, 11))).isTrue();
		assertThat(index.overlaps(new ControlWindow("chr2", 105, 11))).isFalse();
		assertThat(index.overlaps(new ControlWindow("chr3", 100, 11))).isFalse();
		assertThat(index.size()).isEqualTo(2);
		assertThat(index.size("chr1")).isEqualTo(1);
	}

	@Test
	void addedWindowsBlockLaterQueries() {
		ExclusionIndex index = new ExclusionIndex();
		ControlWindow w = new ControlWindow("chr1", 1, 21);
		assertThat(index.overlaps(w)).isFalse();

		index.add(w);

		assertThat(index.overlaps(new ControlWindow("chr1", 21, 3))).isTrue();
		assertThat(index.overlaps(new ControlWindow("chr1", 22, 3))).isFalse();
	}
}
