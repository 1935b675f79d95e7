package org.carball.mcda.model.analysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record SensitivityReport(
    Map<String, CriterionSensitivity> criteria,
    String mostSensitiveCriterion
) {
    public SensitivityReport {
        criteria = Collections.unmodifiableMap(new LinkedHashMap<>(criteria));
    }

    /**
     * True when no weight variation changed the order of any alternatives.
     */
    public boolean isRankingStable() {
        return criteria.values().stream()
                .allMatch(c -> c.minRankCorrelation() >= 1.0 - 1e-12);
    }
}
