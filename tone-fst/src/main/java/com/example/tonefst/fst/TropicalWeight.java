package com.example.tonefst.fst;

/**
 * Tropical semiring over {@code double} costs: path weights are added, alternative paths keep
 * the minimum. {@link #ONE} is the free cost and {@link #ZERO} marks unreachable paths.
 */
public final class TropicalWeight {

    public static final double ONE = 0.0;
    public static final double ZERO = Double.POSITIVE_INFINITY;

    private TropicalWeight() {
    }

    public static double plus(double a, double b) {
        return Math.min(a, b);
    }

    public static double times(double a, double b) {
        if (isZero(a) || isZero(b)) {
            return ZERO;
        }
        return a + b;
    }

    public static boolean isZero(double weight) {
        return weight == ZERO;
    }

    /**
     * Rounds {@code weight} to a multiple of {@code delta} so that weights differing only by
     * floating point noise compare equal.
     */
    public static double quantize(double weight, double delta) {
        if (isZero(weight) || delta <= 0) {
            return weight;
        }
        return Math.round(weight / delta) * delta;
    }
}
