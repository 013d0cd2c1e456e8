package com.shiftsentinel.core.stats;

import java.util.Objects;

/**
 * Variance-stabilising transforms for skewed, positive-valued series such as
 * durations and counts.
 *
 * <p>
 * Values {@code <= 1} pass through unchanged so that the transforms stay
 * monotonic and never produce {@code NaN} for zero or negative input.
 * </p>
 *
 * @since 1.0.0
 */
public final class Transforms {

    private Transforms() {
        // utility class, not instantiable
    }

    public static double toSqrt(double x) {
        return x > 1 ? Math.sqrt(x) : x;
    }

    /**
     * Square-root transform every value into a new array.
     *
     * @param data values; must not be {@code null}
     * @return transformed copy
     */
    public static double[] toSqrt(double[] data) {
        Objects.requireNonNull(data, "data must not be null");
        double[] out = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            out[i] = toSqrt(data[i]);
        }
        return out;
    }

    /** Inverse of {@link #toSqrt(double)}. */
    public static double fromSqrt(double x) {
        return x > 1 ? x * x : x;
    }

    /**
     * Log transform {@code log(x + 1)} for values above 1.
     *
     * <p>
     * Values in {@code (1, e - 1]} map into {@code (log 2, 1]}, where
     * {@link #fromLog(double)} passes them through, so the round trip is
     * exact only for {@code x > e - 1}.
     * </p>
     */
    public static double toLog(double x) {
        return x > 1 ? Math.log(x + 1) : x;
    }

    public static double[] toLog(double[] data) {
        Objects.requireNonNull(data, "data must not be null");
        double[] out = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            out[i] = toLog(data[i]);
        }
        return out;
    }

    /** Inverse of {@link #toLog(double)} for transformed values above 1. */
    public static double fromLog(double x) {
        return x > 1 ? Math.exp(x) - 1 : x;
    }
}
