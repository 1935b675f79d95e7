package org.carball.mcda.model.ahp;

/**
 * A judgement that {@code criterionA} is {@code value} times as important as {@code criterionB}
 * on Saaty's 1-9 scale. Values below 1 express the opposite preference.
 */
public record PairwiseComparison(
    String criterionA,
    String criterionB,
    double value
) {
    public static PairwiseComparison of(String criterionA, String criterionB, double value) {
        return new PairwiseComparison(criterionA, criterionB, value);
    }
}
