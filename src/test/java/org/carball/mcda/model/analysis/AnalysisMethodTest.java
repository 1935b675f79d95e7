package org.carball.mcda.model.analysis;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class AnalysisMethodTest {

    @Test
    void shouldResolveLegacyMethodNames() {
        assertThat(AnalysisMethod.fromName("direct")).isEqualTo(AnalysisMethod.DIRECT);
        assertThat(AnalysisMethod.fromName("TOPSIS_W")).isEqualTo(AnalysisMethod.DIRECT);
        assertThat(AnalysisMethod.fromName(" ahp ")).isEqualTo(AnalysisMethod.AHP);
        assertThat(AnalysisMethod.fromName("topsis_ahp")).isEqualTo(AnalysisMethod.AHP);
    }

    @Test
    void shouldRejectUnknownMethod() {
        assertThatThrownBy(() -> AnalysisMethod.fromName("promethee"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown analysis method: promethee");

        assertThatThrownBy(() -> AnalysisMethod.fromName(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
