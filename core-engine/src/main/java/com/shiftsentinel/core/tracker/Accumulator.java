package com.shiftsentinel.core.tracker;

/**
 * Control-chart accumulator over a stream of test scores.
 *
 * <p>
 * State is a pair of running sums, a lower one {@code sl <= 0} and an upper
 * one {@code sh >= 0}, both starting at zero. Each call applies the single
 * transition rule of the implementation and returns the sum with the larger
 * magnitude ({@code sh} on an exact tie). There is no terminal state; the
 * caller stops when it has seen enough.
 * </p>
 *
 * @since 1.0.0
 */
public interface Accumulator {

    /**
     * Fold one score into the running state.
     *
     * @param score next test score
     * @return the current signed statistic
     */
    double observe(double score);

    /** Return both sums to zero. */
    void reset();

    double getLower();

    double getUpper();

    static double signedMax(double lower, double upper) {
        return Math.abs(upper) >= Math.abs(lower) ? upper : lower;
    }
}
