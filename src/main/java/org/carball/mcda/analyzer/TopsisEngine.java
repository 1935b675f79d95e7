package org.carball.mcda.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.carball.mcda.model.alternative.Alternative;
import org.carball.mcda.model.analysis.TopsisResult;
import org.carball.mcda.model.criterion.Criterion;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ranks alternatives by relative closeness to the ideal solution (TOPSIS).
 */
@Slf4j
public class TopsisEngine {

    public List<TopsisResult> rank(List<Alternative> alternatives, List<Criterion> criteria) {
        Evaluation evaluation = evaluate(alternatives, criteria);
        int m = alternatives.size();

        List<Integer> order = inRankOrder(evaluation.scores);

        List<TopsisResult> results = new ArrayList<>(m);
        for (int position = 0; position < m; position++) {
            int i = order.get(position);
            Alternative alternative = alternatives.get(i);
            results.add(new TopsisResult(
                    alternative.id(),
                    alternative.name(),
                    evaluation.scores[i],
                    position + 1,
                    evaluation.distanceToIdeal[i],
                    evaluation.distanceToNegativeIdeal[i]));
        }

        log.debug("Ranked {} alternatives over {} criteria, leader: {}",
                m, criteria.size(), results.get(0).alternativeId());
        return results;
    }

    /**
     * Closeness coefficients in input order, without ranking.
     */
    public double[] scores(List<Alternative> alternatives, List<Criterion> criteria) {
        return evaluate(alternatives, criteria).scores;
    }

    private Evaluation evaluate(List<Alternative> alternatives, List<Criterion> criteria) {
        if (alternatives.isEmpty()) {
            throw new EmptyInputException("At least one alternative is required");
        }
        if (criteria.isEmpty()) {
            throw new EmptyInputException("At least one criterion is required");
        }

        int m = alternatives.size();
        int n = criteria.size();
        RealMatrix values = decisionMatrix(alternatives, criteria);

        // Step 1 + 2: vector normalisation and weighting
        RealMatrix weighted = MatrixUtils.createRealMatrix(m, n);
        for (int j = 0; j < n; j++) {
            RealVector column = values.getColumnVector(j);
            double norm = column.getNorm();
            if (isConstant(column) || norm == 0.0) {
                throw new DegenerateCriterionException(criteria.get(j).id());
            }
            weighted.setColumnVector(j, column.mapMultiply(criteria.get(j).weight() / norm));
        }

        // Step 3: ideal and negative-ideal solutions
        RealVector ideal = new ArrayRealVector(n);
        RealVector negativeIdeal = new ArrayRealVector(n);
        for (int j = 0; j < n; j++) {
            RealVector column = weighted.getColumnVector(j);
            boolean benefit = criteria.get(j).direction().prefersHigher();
            ideal.setEntry(j, benefit ? column.getMaxValue() : column.getMinValue());
            negativeIdeal.setEntry(j, benefit ? column.getMinValue() : column.getMaxValue());
        }

        // Step 4 + 5: distances and relative closeness
        Evaluation evaluation = new Evaluation(m);
        for (int i = 0; i < m; i++) {
            RealVector row = weighted.getRowVector(i);
            double dBest = row.getDistance(ideal);
            double dWorst = row.getDistance(negativeIdeal);
            double total = dBest + dWorst;

            evaluation.distanceToIdeal[i] = dBest;
            evaluation.distanceToNegativeIdeal[i] = dWorst;
            evaluation.scores[i] = total == 0.0 ? 0.0 : dWorst / total;
        }
        return evaluation;
    }

    private RealMatrix decisionMatrix(List<Alternative> alternatives, List<Criterion> criteria) {
        RealMatrix values = MatrixUtils.createRealMatrix(alternatives.size(), criteria.size());
        for (int i = 0; i < alternatives.size(); i++) {
            Alternative alternative = alternatives.get(i);
            for (int j = 0; j < criteria.size(); j++) {
                String criterionId = criteria.get(j).id();
                Double value = alternative.values().get(criterionId);
                if (value == null || !Double.isFinite(value)) {
                    throw new McdaComputationException("Alternative '" + alternative.name()
                            + "' has no usable value for criterion '" + criterionId + "'");
                }
                values.setEntry(i, j, value);
            }
        }
        return values;
    }

    private static boolean isConstant(RealVector column) {
        return Double.compare(column.getMaxValue(), column.getMinValue()) == 0;
    }

    /**
     * 1-based rank of each score, descending, ties resolved by input order as in {@link #rank}.
     */
    static int[] ranksOf(double[] scores) {
        List<Integer> order = inRankOrder(scores);
        int[] ranks = new int[scores.length];
        for (int position = 0; position < order.size(); position++) {
            ranks[order.get(position)] = position + 1;
        }
        return ranks;
    }

    private static List<Integer> inRankOrder(double[] scores) {
        List<Integer> order = new ArrayList<>(scores.length);
        for (int i = 0; i < scores.length; i++) {
            order.add(i);
        }
        // Descending score; equal scores keep input order
        order.sort(Comparator.<Integer>comparingDouble(i -> scores[i]).reversed()
                .thenComparingInt(i -> i));
        return order;
    }

    private static final class Evaluation {
        final double[] scores;
        final double[] distanceToIdeal;
        final double[] distanceToNegativeIdeal;

        Evaluation(int size) {
            this.scores = new double[size];
            this.distanceToIdeal = new double[size];
            this.distanceToNegativeIdeal = new double[size];
        }
    }
}
