package com.shiftsentinel.core.changepoint;

import com.shiftsentinel.core.stats.ScorePrimitives;

import java.util.Arrays;
import java.util.Objects;

/**
 * Nonparametric split finder. Ranks the whole range once, centres the ranks
 * by {@code n / 2}, and scores each candidate {@code k} by the summed ranks
 * of the "after" part normalised by {@code sqrt(k (n - k) (n + 1) / 3)}.
 *
 * <p>
 * The after-sum is derived from a running prefix, so a scan is linear in
 * the range length.
 * </p>
 *
 * @since 1.0.0
 */
public class RankSumSplitFinder implements SplitFinder {

    @Override
    public Split find(double[] data, int from, int to) {
        Objects.requireNonNull(data, "data must not be null");
        int n = to - from;
        if (MIN_BEFORE >= n - MIN_AFTER) {
            return Split.NONE;
        }
        double[] ranks = ScorePrimitives.rankTransform(Arrays.copyOfRange(data, from, to));
        double total = 0;
        for (int i = 0; i < n; i++) {
            ranks[i] -= n / 2.0;
            total += ranks[i];
        }

        double prefix = 0;
        for (int i = 0; i < MIN_BEFORE; i++) {
            prefix += ranks[i];
        }

        double maxScore = 0;
        int maxIndex = 0;
        for (int k = MIN_BEFORE; k < n - MIN_AFTER; k++) {
            double sd = Math.sqrt((k * (double) (n - k) * (n + 1)) / 3);
            double score = (total - prefix) / sd;
            if (Math.abs(score) > Math.abs(maxScore)) {
                maxScore = score;
                maxIndex = k;
            }
            prefix += ranks[k];
        }
        return new Split(maxScore, maxIndex);
    }
}
