package com.shiftsentinel.core.changepoint;

import com.shiftsentinel.core.stats.BaseStats;

import java.util.Arrays;
import java.util.Objects;

/**
 * Parametric split finder. Scores each candidate {@code k} by the
 * difference of means after and before the split, in units of twice the
 * whole-range standard deviation, scaled by {@code sqrt(k (n - k) / n)}.
 *
 * <p>
 * A constant range has no spread to measure against and yields
 * {@link Split#NONE}.
 * </p>
 *
 * @since 1.0.0
 */
public class TIndependentSplitFinder implements SplitFinder {

    @Override
    public Split find(double[] data, int from, int to) {
        Objects.requireNonNull(data, "data must not be null");
        int n = to - from;
        if (MIN_BEFORE >= n - MIN_AFTER) {
            return Split.NONE;
        }
        double sd = BaseStats.std(Arrays.copyOfRange(data, from, to));
        if (sd == 0) {
            return Split.NONE;
        }

        double total = 0;
        for (int i = from; i < to; i++) {
            total += data[i];
        }
        double prefix = 0;
        for (int i = 0; i < MIN_BEFORE; i++) {
            prefix += data[from + i];
        }

        double maxScore = 0;
        int maxIndex = 0;
        for (int k = MIN_BEFORE; k < n - MIN_AFTER; k++) {
            double u0 = prefix / k;
            double u1 = (total - prefix) / (n - k);
            double score = ((u1 - u0) / (sd * 2)) * Math.sqrt((k * (double) (n - k)) / n);
            if (Math.abs(score) > Math.abs(maxScore)) {
                maxScore = score;
                maxIndex = k;
            }
            prefix += data[from + k];
        }
        return new Split(maxScore, maxIndex);
    }
}
