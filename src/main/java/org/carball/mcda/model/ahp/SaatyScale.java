package org.carball.mcda.model.ahp;

import lombok.Getter;

/**
 * Saaty's fundamental scale of absolute numbers used for pairwise judgements.
 */
@Getter
public enum SaatyScale {
    EQUAL(1, "Equal importance"),
    WEAK(2, "Weak or slight importance"),
    MODERATE(3, "Moderate importance"),
    MODERATE_PLUS(4, "Moderate plus importance"),
    STRONG(5, "Strong importance"),
    STRONG_PLUS(6, "Strong plus importance"),
    VERY_STRONG(7, "Very strong importance"),
    VERY_VERY_STRONG(8, "Very, very strong importance"),
    EXTREME(9, "Extreme importance");

    public static final double MIN_VALUE = 1.0 / 9.0;
    public static final double MAX_VALUE = 9.0;

    // Lets a user-entered 0.111 stand for 1/9; the upper bound is exact
    private static final double RECIPROCAL_ROUNDING = 1e-3;

    private final int value;
    private final String description;

    SaatyScale(int value, String description) {
        this.value = value;
        this.description = description;
    }

    public static boolean isWithinScale(double value) {
        return Double.isFinite(value)
                && value >= MIN_VALUE - RECIPROCAL_ROUNDING
                && value <= MAX_VALUE;
    }

    /**
     * Returns the verbal meaning of a judgement value. Reciprocal values are described
     * in terms of the intensity they invert.
     */
    public static String describe(double value) {
        if (!Double.isFinite(value) || value <= 0) {
            return "Unknown comparison value";
        }
        if (value < 1) {
            return "Reciprocal of " + describe(1.0 / value);
        }
        for (SaatyScale intensity : values()) {
            if (Math.abs(intensity.value - value) < 1e-9) {
                return intensity.description;
            }
        }
        return "Unknown comparison value";
    }
}
