package org.carball.mcda.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.stat.StatUtils;
import org.carball.mcda.config.AnalysisThresholds;
import org.carball.mcda.model.ahp.AhpResult;
import org.carball.mcda.model.ahp.ComparisonPair;
import org.carball.mcda.model.ahp.PairwiseComparison;
import org.carball.mcda.model.ahp.SaatyScale;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives criterion weights from pairwise importance judgements (Analytic Hierarchy Process).
 * <p>
 * The principal eigenvector is approximated by normalising each column of the comparison
 * matrix and averaging the rows, not by power iteration. For consistent matrices both give
 * the same weights; under strong inconsistency they may differ slightly, and some AHP
 * literature expects the power method. λmax is estimated from the same vector as the mean
 * of (M·w)[i] / w[i].
 */
@Slf4j
public class AhpEngine {

    private final double consistencyThreshold;

    public AhpEngine() {
        this(AnalysisThresholds.defaults());
    }

    public AhpEngine(AnalysisThresholds thresholds) {
        this.consistencyThreshold = thresholds.getConsistencyThreshold();
    }

    public AhpResult deriveWeights(List<String> criteria, List<PairwiseComparison> comparisons) {
        if (criteria.isEmpty()) {
            throw new EmptyInputException("At least one criterion is required for AHP analysis");
        }
        int n = criteria.size();

        if (n == 1) {
            return new AhpResult(Map.of(criteria.get(0), 1.0), 0.0, true, 0.0, 1.0);
        }

        RealMatrix matrix = comparisonMatrix(criteria, comparisons);
        RealVector weights = approximatePrincipalEigenvector(matrix);
        double lambdaMax = estimateLambdaMax(matrix, weights);

        double consistencyIndex = n <= 2 ? 0.0 : (lambdaMax - n) / (n - 1);
        double randomIndex = RandomIndex.forSize(n);
        double consistencyRatio = randomIndex == 0.0 ? 0.0 : consistencyIndex / randomIndex;
        boolean consistent = consistencyRatio <= consistencyThreshold;

        Map<String, Double> weightsById = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            weightsById.put(criteria.get(i), weights.getEntry(i));
        }

        log.debug("AHP over {} criteria: lambdaMax={}, CI={}, CR={}", n, lambdaMax, consistencyIndex, consistencyRatio);
        return new AhpResult(weightsById, consistencyRatio, consistent, consistencyIndex, lambdaMax);
    }

    /**
     * Builds the reciprocal comparison matrix. Only one orientation of each pair is read;
     * the mirrored cell is always derived as its reciprocal. A pair supplied more than once
     * keeps the last judgement.
     */
    public double[][] buildComparisonMatrix(List<String> criteria, List<PairwiseComparison> comparisons) {
        return comparisonMatrix(criteria, comparisons).getData();
    }

    private RealMatrix comparisonMatrix(List<String> criteria, List<PairwiseComparison> comparisons) {
        int n = criteria.size();
        Map<String, Integer> indexById = new HashMap<>();
        for (int i = 0; i < n; i++) {
            indexById.put(criteria.get(i), i);
        }

        // upper[i][j] for i < j; null until judged
        Double[][] upper = new Double[n][n];
        for (PairwiseComparison comparison : comparisons) {
            Integer a = indexById.get(comparison.criterionA());
            Integer b = indexById.get(comparison.criterionB());
            if (a == null || b == null) {
                throw new InvalidComparisonException("Unknown criterion in comparison: "
                        + (a == null ? comparison.criterionA() : comparison.criterionB()));
            }
            if (a.equals(b)) {
                throw new InvalidComparisonException("Cannot compare criterion with itself: " + comparison.criterionA());
            }
            if (!SaatyScale.isWithinScale(comparison.value())) {
                throw new InvalidComparisonException("Comparison value must be between 1/9 and 9, but got "
                        + comparison.value() + " for " + comparison.criterionA() + " vs " + comparison.criterionB());
            }

            if (a < b) {
                upper[a][b] = comparison.value();
            } else {
                upper[b][a] = 1.0 / comparison.value();
            }
        }

        RealMatrix matrix = MatrixUtils.createRealIdentityMatrix(n);
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                if (upper[i][j] == null) {
                    throw new IncompleteMatrixException(criteria.get(i), criteria.get(j));
                }
                matrix.setEntry(i, j, upper[i][j]);
                matrix.setEntry(j, i, 1.0 / upper[i][j]);
            }
        }
        return matrix;
    }

    private RealVector approximatePrincipalEigenvector(RealMatrix matrix) {
        int n = matrix.getRowDimension();
        RealMatrix normalized = matrix.copy();
        for (int j = 0; j < n; j++) {
            double columnSum = StatUtils.sum(matrix.getColumn(j));
            normalized.setColumnVector(j, matrix.getColumnVector(j).mapDivide(columnSum));
        }

        RealVector weights = new ArrayRealVector(n);
        for (int i = 0; i < n; i++) {
            weights.setEntry(i, StatUtils.mean(normalized.getRow(i)));
        }
        return weights;
    }

    private double estimateLambdaMax(RealMatrix matrix, RealVector weights) {
        RealVector ratios = matrix.operate(weights).ebeDivide(weights);
        return StatUtils.mean(ratios.toArray());
    }

    /**
     * Lists the n(n-1)/2 pairs an analyst has to judge, in the order the matrix reads them.
     */
    public static List<ComparisonPair> comparisonPairs(List<String> criteria) {
        List<ComparisonPair> pairs = new ArrayList<>();
        for (int i = 0; i < criteria.size(); i++) {
            for (int j = i + 1; j < criteria.size(); j++) {
                pairs.add(new ComparisonPair(criteria.get(i), criteria.get(j)));
            }
        }
        return pairs;
    }

    public static int requiredComparisons(int criteriaCount) {
        return criteriaCount * (criteriaCount - 1) / 2;
    }

    public static Map<String, Double> equalWeights(List<String> criteria) {
        Map<String, Double> weights = new LinkedHashMap<>();
        for (String criterion : criteria) {
            weights.put(criterion, 1.0 / criteria.size());
        }
        return weights;
    }
}
