package org.carball.mcda.model.ahp;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class SaatyScaleTest {

    @Test
    void shouldAcceptValuesOnTheScale() {
        assertThat(SaatyScale.isWithinScale(1)).isTrue();
        assertThat(SaatyScale.isWithinScale(9)).isTrue();
        assertThat(SaatyScale.isWithinScale(1.0 / 9.0)).isTrue();
        assertThat(SaatyScale.isWithinScale(0.111)).isTrue();
    }

    @Test
    void shouldRejectValuesOffTheScale() {
        assertThat(SaatyScale.isWithinScale(10)).isFalse();
        assertThat(SaatyScale.isWithinScale(9.0009)).isFalse();
        assertThat(SaatyScale.isWithinScale(0.105)).isFalse();
        assertThat(SaatyScale.isWithinScale(0.05)).isFalse();
        assertThat(SaatyScale.isWithinScale(0)).isFalse();
        assertThat(SaatyScale.isWithinScale(Double.NaN)).isFalse();
    }

    @Test
    void shouldDescribeJudgements() {
        assertThat(SaatyScale.describe(1)).isEqualTo("Equal importance");
        assertThat(SaatyScale.describe(5)).isEqualTo("Strong importance");
        assertThat(SaatyScale.describe(1.0 / 7.0)).isEqualTo("Reciprocal of Very strong importance");
        assertThat(SaatyScale.describe(2.5)).isEqualTo("Unknown comparison value");
    }
}
