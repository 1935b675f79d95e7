package org.carball.mcda.analyzer;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class RandomIndexTest {

    @Test
    void shouldReturnSaatyRandomIndices() {
        assertThat(RandomIndex.forSize(1)).isZero();
        assertThat(RandomIndex.forSize(2)).isZero();
        assertThat(RandomIndex.forSize(3)).isEqualTo(0.58);
        assertThat(RandomIndex.forSize(10)).isEqualTo(1.49);
        assertThat(RandomIndex.forSize(15)).isEqualTo(1.59);
    }

    @Test
    void shouldReuseLastValueBeyondTable() {
        assertThat(RandomIndex.forSize(20)).isEqualTo(RandomIndex.forSize(RandomIndex.MAX_TABULATED_SIZE));
    }

    @Test
    void shouldRejectNonPositiveSize() {
        assertThatThrownBy(() -> RandomIndex.forSize(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
