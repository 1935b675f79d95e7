package org.carball.mcda.analyzer;

/**
 * Saaty's random consistency index, the mean consistency index of randomly generated
 * reciprocal matrices of each size.
 */
public final class RandomIndex {

    public static final int MAX_TABULATED_SIZE = 15;

    // Index 0 unused so that TABLE[n] is RI(n)
    private static final double[] TABLE = {
            0.00,
            0.00, 0.00, 0.58, 0.90, 1.12,
            1.24, 1.32, 1.41, 1.45, 1.49,
            1.51, 1.48, 1.56, 1.57, 1.59
    };

    private RandomIndex() {
    }

    /**
     * RI for an n x n matrix. Sizes above the table reuse its last entry.
     */
    public static double forSize(int n) {
        if (n < 1) {
            throw new IllegalArgumentException("Matrix size must be positive, got " + n);
        }
        return TABLE[Math.min(n, MAX_TABULATED_SIZE)];
    }
}
