package org.carball.mcda.analyzer;

import org.carball.mcda.catalog.CriterionCatalog;
import org.carball.mcda.config.AnalysisThresholds;
import org.carball.mcda.model.alternative.Alternative;
import org.carball.mcda.model.analysis.AnalysisMethod;
import org.carball.mcda.model.analysis.AnalysisRequest;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Checks an analysis request before any engine runs. Every rule is evaluated and all
 * violations are returned together so a caller can fix them in one round trip.
 */
public class RequestValidator {

    private final CriterionCatalog catalog;
    private final int minimumAlternatives;
    private final int maximumAhpCriteria;
    private final double weightSumTolerance;

    public RequestValidator(CriterionCatalog catalog, AnalysisThresholds thresholds) {
        this.catalog = catalog;
        this.minimumAlternatives = thresholds.getMinimumAlternatives();
        this.maximumAhpCriteria = thresholds.getMaximumAhpCriteria();
        this.weightSumTolerance = thresholds.getWeightSumTolerance();
    }

    public List<String> validate(AnalysisRequest request) {
        List<String> errors = new ArrayList<>();
        List<String> criteria = request.getCriteria() == null ? List.of() : request.getCriteria();
        List<Alternative> alternatives = request.getAlternatives() == null ? List.of() : request.getAlternatives();

        if (alternatives.size() < minimumAlternatives) {
            errors.add("At least " + minimumAlternatives + " sites are required for comparison");
        }

        if (criteria.isEmpty()) {
            errors.add("At least 1 criterion must be selected");
        }

        List<String> knownCriteria = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (String criterion : criteria) {
            if (!seen.add(criterion)) {
                errors.add("Duplicate criterion: " + criterion);
            } else if (!catalog.contains(criterion)) {
                errors.add("Unknown criterion: " + criterion);
            } else {
                knownCriteria.add(criterion);
            }
        }

        validateAlternativeValues(alternatives, knownCriteria, errors);

        if (request.getMethod() == null) {
            errors.add("Analysis method is required");
        } else if (request.getMethod() == AnalysisMethod.DIRECT) {
            validateDirectWeights(request.getWeights(), seen, errors);
        } else {
            validatePairwiseComparisons(request, seen.size(), errors);
        }

        return errors;
    }

    private void validateAlternativeValues(List<Alternative> alternatives, List<String> criteria, List<String> errors) {
        for (Alternative alternative : alternatives) {
            for (String criterion : criteria) {
                Double value = alternative.values().get(criterion);
                if (value == null) {
                    errors.add("Alternative '" + alternative.name() + "' is missing value for criterion '" + criterion + "'");
                } else if (!Double.isFinite(value)) {
                    errors.add("Alternative '" + alternative.name() + "' has a non-finite value for criterion '" + criterion + "'");
                }
            }
        }
    }

    private void validateDirectWeights(Map<String, Double> weights, Set<String> criteria, List<String> errors) {
        if (weights == null || weights.isEmpty()) {
            errors.add("Weights are required for DIRECT method");
            return;
        }

        double sum = 0.0;
        for (String criterion : criteria) {
            Double weight = weights.get(criterion);
            if (weight == null) {
                errors.add("Weight missing for criterion: " + criterion);
                continue;
            }
            if (!Double.isFinite(weight) || weight < 0.0 || weight > 1.0) {
                errors.add("Weight for criterion '" + criterion + "' must be between 0 and 1");
            }
            sum += weight;
        }

        if (!(Math.abs(sum - 1.0) <= weightSumTolerance)) {
            errors.add(String.format(Locale.ROOT, "Weights must sum to 1, but sum to %.3f", sum));
        }
    }

    private void validatePairwiseComparisons(AnalysisRequest request, int criteriaCount, List<String> errors) {
        if (request.getPairwiseComparisons() == null) {
            errors.add("Pairwise comparisons are required for AHP method");
            return;
        }

        if (criteriaCount > maximumAhpCriteria) {
            errors.add("AHP supports at most " + maximumAhpCriteria + " criteria, got " + criteriaCount);
        }

        int required = AhpEngine.requiredComparisons(criteriaCount);
        int supplied = request.getPairwiseComparisons().size();
        if (supplied < required) {
            errors.add("Insufficient pairwise comparisons. Expected " + required + ", got " + supplied);
        }
    }
}
