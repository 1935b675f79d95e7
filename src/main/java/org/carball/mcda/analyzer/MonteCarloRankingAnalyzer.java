package org.carball.mcda.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.carball.mcda.config.AnalysisThresholds;
import org.carball.mcda.model.alternative.Alternative;
import org.carball.mcda.model.analysis.AlternativeRobustness;
import org.carball.mcda.model.analysis.RankingStabilityReport;
import org.carball.mcda.model.criterion.Criterion;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Re-ranks the alternatives many times with weights and site values scaled by normally
 * distributed noise, and reports how often each alternative lands at each rank.
 * <p>
 * Each call starts a fresh generator from the configured seed, so the same input always
 * produces the same report.
 */
@Slf4j
public class MonteCarloRankingAnalyzer {

    private static final int TOP_RANKS = 3;

    private final TopsisEngine topsisEngine;
    private final int simulations;
    private final double weightUncertainty;
    private final double dataUncertainty;
    private final long seed;

    public MonteCarloRankingAnalyzer(TopsisEngine topsisEngine, AnalysisThresholds thresholds) {
        this.topsisEngine = topsisEngine;
        this.simulations = thresholds.getMonteCarloSimulations();
        this.weightUncertainty = thresholds.getWeightUncertainty();
        this.dataUncertainty = thresholds.getDataUncertainty();
        this.seed = thresholds.getMonteCarloSeed();
    }

    public RankingStabilityReport analyze(List<Alternative> alternatives, List<Criterion> criteria) {
        if (simulations < 1) {
            throw new McdaComputationException("At least one Monte Carlo simulation is required, got " + simulations);
        }

        int m = alternatives.size();
        RandomGenerator random = new Well19937c(seed);

        DescriptiveStatistics[] scoreStatistics = new DescriptiveStatistics[m];
        for (int i = 0; i < m; i++) {
            scoreStatistics[i] = new DescriptiveStatistics();
        }
        int[][] rankCounts = new int[m][m];

        for (int run = 0; run < simulations; run++) {
            List<Criterion> weights = perturbWeights(criteria, random);
            List<Alternative> values = perturbValues(alternatives, criteria, random);

            double[] scores = topsisEngine.scores(values, weights);
            int[] ranks = TopsisEngine.ranksOf(scores);
            for (int i = 0; i < m; i++) {
                scoreStatistics[i].addValue(scores[i]);
                rankCounts[i][ranks[i] - 1]++;
            }
        }

        Map<String, AlternativeRobustness> robustness = new LinkedHashMap<>();
        double[] meanScores = new double[m];
        String mostStable = null;
        String leastStable = null;
        double highestTopProbability = Double.NEGATIVE_INFINITY;
        double lowestTopProbability = Double.POSITIVE_INFINITY;

        for (int i = 0; i < m; i++) {
            DescriptiveStatistics statistics = scoreStatistics[i];
            List<Double> rankProbabilities = new ArrayList<>(m);
            double topProbability = 0.0;
            for (int rank = 0; rank < m; rank++) {
                double probability = (double) rankCounts[i][rank] / simulations;
                rankProbabilities.add(probability);
                if (rank < TOP_RANKS) {
                    topProbability += probability;
                }
            }

            String id = alternatives.get(i).id();
            meanScores[i] = statistics.getMean();
            robustness.put(id, new AlternativeRobustness(
                    id,
                    meanScores[i],
                    Math.sqrt(statistics.getPopulationVariance()),
                    statistics.getPercentile(2.5),
                    statistics.getPercentile(97.5),
                    rankProbabilities,
                    topProbability));

            if (topProbability > highestTopProbability) {
                highestTopProbability = topProbability;
                mostStable = id;
            }
            if (topProbability < lowestTopProbability) {
                lowestTopProbability = topProbability;
                leastStable = id;
            }
        }

        int[] robustRanks = TopsisEngine.ranksOf(meanScores);
        String[] robustOrder = new String[m];
        for (int i = 0; i < m; i++) {
            robustOrder[robustRanks[i] - 1] = alternatives.get(i).id();
        }

        Map<String, Double> variation = criterionVariation(alternatives, criteria);
        String mostUncertain = null;
        for (Map.Entry<String, Double> entry : variation.entrySet()) {
            if (mostUncertain == null || entry.getValue() > variation.get(mostUncertain)) {
                mostUncertain = entry.getKey();
            }
        }

        log.debug("Monte Carlo ranking over {} runs (seed {}): robust leader {}, most stable {}",
                simulations, seed, robustOrder[0], mostStable);
        return new RankingStabilityReport(simulations, weightUncertainty, dataUncertainty, seed,
                robustness, List.of(robustOrder), mostStable, leastStable, variation, mostUncertain);
    }

    private List<Criterion> perturbWeights(List<Criterion> criteria, RandomGenerator random) {
        double[] weights = new double[criteria.size()];
        double total = 0.0;
        for (int j = 0; j < criteria.size(); j++) {
            double factor = 1.0 + weightUncertainty * random.nextGaussian();
            weights[j] = Math.max(0.0, criteria.get(j).weight() * factor);
            total += weights[j];
        }

        List<Criterion> perturbed = new ArrayList<>(criteria.size());
        for (int j = 0; j < criteria.size(); j++) {
            Criterion c = criteria.get(j);
            double weight = total == 0.0 ? c.weight() : Math.min(1.0, weights[j] / total);
            perturbed.add(new Criterion(c.id(), c.name(), c.direction(), weight));
        }
        return perturbed;
    }

    private List<Alternative> perturbValues(List<Alternative> alternatives, List<Criterion> criteria,
                                            RandomGenerator random) {
        List<Alternative> perturbed = new ArrayList<>(alternatives.size());
        for (Alternative alternative : alternatives) {
            Map<String, Double> values = new LinkedHashMap<>();
            for (Criterion criterion : criteria) {
                Double value = alternative.values().get(criterion.id());
                double factor = 1.0 + dataUncertainty * random.nextGaussian();
                values.put(criterion.id(), value == null ? null : value * factor);
            }
            perturbed.add(new Alternative(alternative.id(), alternative.name(), values));
        }
        return perturbed;
    }

    /**
     * Coefficient of variation of each criterion's raw values: population standard deviation
     * over mean, 0 when the mean is 0.
     */
    static Map<String, Double> criterionVariation(List<Alternative> alternatives, List<Criterion> criteria) {
        Map<String, Double> variation = new LinkedHashMap<>();
        for (Criterion criterion : criteria) {
            DescriptiveStatistics statistics = new DescriptiveStatistics();
            for (Alternative alternative : alternatives) {
                Double value = alternative.values().get(criterion.id());
                if (value != null) {
                    statistics.addValue(value);
                }
            }
            double mean = statistics.getMean();
            double cv = mean == 0.0 || Double.isNaN(mean)
                    ? 0.0
                    : Math.sqrt(statistics.getPopulationVariance()) / mean;
            variation.put(criterion.id(), cv);
        }
        return variation;
    }
}
