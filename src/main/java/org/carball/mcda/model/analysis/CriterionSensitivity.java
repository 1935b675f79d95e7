package org.carball.mcda.model.analysis;

import java.util.List;

/**
 * Effect of scaling one criterion's weight by each variation factor.
 * Lists are aligned by index with {@code variations}.
 */
public record CriterionSensitivity(
    String criterionId,
    List<Double> variations,
    List<Double> meanScoreChanges,
    List<Double> rankCorrelations
) {
    public CriterionSensitivity {
        variations = List.copyOf(variations);
        meanScoreChanges = List.copyOf(meanScoreChanges);
        rankCorrelations = List.copyOf(rankCorrelations);
    }

    public double maxMeanScoreChange() {
        return meanScoreChanges.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
    }

    public double minRankCorrelation() {
        return rankCorrelations.stream().mapToDouble(Double::doubleValue).min().orElse(1.0);
    }
}
