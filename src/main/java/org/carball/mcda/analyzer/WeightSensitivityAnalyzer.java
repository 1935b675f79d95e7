package org.carball.mcda.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.stat.correlation.SpearmansCorrelation;
import org.carball.mcda.config.AnalysisThresholds;
import org.carball.mcda.model.alternative.Alternative;
import org.carball.mcda.model.analysis.CriterionSensitivity;
import org.carball.mcda.model.analysis.SensitivityReport;
import org.carball.mcda.model.criterion.Criterion;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Measures how much a TOPSIS ranking depends on each weight by scaling one weight at a time,
 * renormalising, and re-scoring.
 */
@Slf4j
public class WeightSensitivityAnalyzer {

    private final TopsisEngine topsisEngine;
    private final List<Double> variations;

    public WeightSensitivityAnalyzer(TopsisEngine topsisEngine, AnalysisThresholds thresholds) {
        this.topsisEngine = topsisEngine;
        this.variations = List.copyOf(thresholds.getSensitivityVariations());
    }

    public SensitivityReport analyze(List<Alternative> alternatives, List<Criterion> criteria) {
        double[] baseScores = topsisEngine.scores(alternatives, criteria);
        int[] baseRanks = TopsisEngine.ranksOf(baseScores);

        Map<String, CriterionSensitivity> results = new LinkedHashMap<>();
        for (int k = 0; k < criteria.size(); k++) {
            List<Double> scoreChanges = new ArrayList<>();
            List<Double> correlations = new ArrayList<>();

            for (double variation : variations) {
                List<Criterion> perturbed = perturb(criteria, k, variation);
                double[] scores = topsisEngine.scores(alternatives, perturbed);

                scoreChanges.add(meanAbsoluteChange(baseScores, scores));
                correlations.add(spearman(baseRanks, TopsisEngine.ranksOf(scores)));
            }

            String criterionId = criteria.get(k).id();
            results.put(criterionId, new CriterionSensitivity(criterionId, variations, scoreChanges, correlations));
        }

        String mostSensitive = results.values().stream()
                .max(Comparator.comparingDouble(CriterionSensitivity::maxMeanScoreChange))
                .map(CriterionSensitivity::criterionId)
                .orElse(null);

        log.debug("Sensitivity analysis over {} criteria, most sensitive: {}", criteria.size(), mostSensitive);
        return new SensitivityReport(results, mostSensitive);
    }

    static List<Criterion> perturb(List<Criterion> criteria, int index, double variation) {
        double[] weights = new double[criteria.size()];
        double total = 0.0;
        for (int j = 0; j < criteria.size(); j++) {
            weights[j] = criteria.get(j).weight() * (j == index ? variation : 1.0);
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

    /**
     * Spearman correlation of two rankings; a single alternative is trivially unchanged.
     */
    static double spearman(int[] ranksA, int[] ranksB) {
        if (ranksA.length < 2) {
            return 1.0;
        }
        return new SpearmansCorrelation().correlation(toDoubles(ranksA), toDoubles(ranksB));
    }

    private static double meanAbsoluteChange(double[] base, double[] changed) {
        return new ArrayRealVector(changed).subtract(new ArrayRealVector(base)).getL1Norm() / base.length;
    }

    private static double[] toDoubles(int[] values) {
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = values[i];
        }
        return result;
    }
}
