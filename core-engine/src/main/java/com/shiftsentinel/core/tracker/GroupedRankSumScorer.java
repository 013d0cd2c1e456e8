package com.shiftsentinel.core.tracker;

import com.shiftsentinel.core.error.InvalidParameterException;
import com.shiftsentinel.core.stats.BaseStats;
import com.shiftsentinel.core.stats.ScorePrimitives;

import java.util.Arrays;
import java.util.OptionalDouble;

/**
 * Collects values into fixed-size groups and scores each completed group
 * with a rank-sum test against all values from earlier groups, clipped to
 * {@code [-6, 6]}.
 *
 * <p>
 * A group scores {@code 0} until the baseline holds at least two groups.
 * The rank-sum test itself needs four values per side, so groups smaller
 * than four always score {@code 0}.
 * </p>
 *
 * @since 1.0.0
 */
public class GroupedRankSumScorer implements ScoreSource {

    static final double MAX_SCORE = 6;

    private final int groupSize;
    private final double[] group;
    private int filled;

    private double[] baseline = new double[0];
    private int baselineSize;

    /**
     * @param groupSize values per group, {@code >= 1}
     * @throws InvalidParameterException if {@code groupSize < 1}
     */
    public GroupedRankSumScorer(int groupSize) {
        if (groupSize < 1) {
            throw InvalidParameterException.of("groupSize", ">= 1", groupSize);
        }
        this.groupSize = groupSize;
        this.group = new double[groupSize];
    }

    @Override
    public OptionalDouble offer(double value) {
        group[filled++] = value;
        if (filled < groupSize) {
            return OptionalDouble.empty();
        }
        double score = 0;
        if (baselineSize >= groupSize * 2) {
            score = ScorePrimitives.rankSumScoreSorted(baseline, baselineSize, group, groupSize);
        }
        absorbGroup();
        return OptionalDouble.of(BaseStats.clip(score, -MAX_SCORE, MAX_SCORE));
    }

    private void absorbGroup() {
        double[] sorted = Arrays.copyOf(group, groupSize);
        Arrays.sort(sorted);
        double[] merged = new double[baselineSize + groupSize];
        int i = 0;
        int j = 0;
        int t = 0;
        while (i < baselineSize && j < groupSize) {
            merged[t++] = baseline[i] <= sorted[j] ? baseline[i++] : sorted[j++];
        }
        while (i < baselineSize) {
            merged[t++] = baseline[i++];
        }
        while (j < groupSize) {
            merged[t++] = sorted[j++];
        }
        baseline = merged;
        baselineSize = merged.length;
        filled = 0;
    }
}
