package org.carball.mcda.model.analysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of re-ranking under random weight and value noise. Bounds are the 2.5th and
 * 97.5th percentiles of each alternative's simulated scores.
 */
public record RankingStabilityReport(
    int simulations,
    double weightUncertainty,
    double dataUncertainty,
    long seed,
    Map<String, AlternativeRobustness> alternatives,
    List<String> robustRanking,
    String mostStableAlternative,
    String leastStableAlternative,
    Map<String, Double> criterionVariation,
    String mostUncertainCriterion
) {
    public RankingStabilityReport {
        alternatives = Collections.unmodifiableMap(new LinkedHashMap<>(alternatives));
        robustRanking = List.copyOf(robustRanking);
        criterionVariation = Collections.unmodifiableMap(new LinkedHashMap<>(criterionVariation));
    }
}
