package com.shiftsentinel.core.changepoint;

import java.util.Objects;

/**
 * Finds the most likely single changepoint in a series by scanning every
 * admissible split and keeping the one with the largest absolute score.
 *
 * <p>
 * Candidates run over {@code [MIN_BEFORE, n - MIN_AFTER)} so each side holds
 * enough values for a meaningful comparison. When several candidates share
 * the maximum magnitude the lowest index wins. Implementations are
 * stateless and safe to share between threads.
 * </p>
 *
 * @since 1.0.0
 */
public interface SplitFinder {

    /** Smallest number of values before a candidate split. */
    int MIN_BEFORE = 14;

    /** Smallest number of values from a candidate split to the end. */
    int MIN_AFTER = 4;

    /**
     * Search {@code data[from, to)}.
     *
     * @param data series; must not be {@code null}
     * @param from first index of the range, inclusive
     * @param to   last index of the range, exclusive
     * @return best split, index relative to {@code from}; {@link Split#NONE}
     *         if the range admits no candidate
     */
    Split find(double[] data, int from, int to);

    /**
     * Search the whole series.
     *
     * @param data series; must not be {@code null}
     * @return best split
     */
    default Split find(double[] data) {
        Objects.requireNonNull(data, "data must not be null");
        return find(data, 0, data.length);
    }
}
