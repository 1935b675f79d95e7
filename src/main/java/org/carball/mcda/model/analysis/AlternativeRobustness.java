package org.carball.mcda.model.analysis;

import java.util.List;

/**
 * Score distribution and rank frequencies of one alternative across Monte Carlo runs.
 * {@code rankProbabilities.get(k)} is the share of runs in which the alternative ranked k + 1.
 */
public record AlternativeRobustness(
    String alternativeId,
    double meanScore,
    double scoreStandardDeviation,
    double lowerBound,
    double upperBound,
    List<Double> rankProbabilities,
    double topThreeProbability
) {
    public AlternativeRobustness {
        rankProbabilities = List.copyOf(rankProbabilities);
    }
}
