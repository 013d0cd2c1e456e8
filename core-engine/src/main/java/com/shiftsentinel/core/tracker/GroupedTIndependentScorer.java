package com.shiftsentinel.core.tracker;

import com.shiftsentinel.core.error.InvalidParameterException;
import com.shiftsentinel.core.stats.BaseStats;
import com.shiftsentinel.core.stats.Transforms;

import java.util.OptionalDouble;

/**
 * Collects square-root transformed values into fixed-size groups and
 * scores each completed group's mean against the mean of all earlier group
 * means, clipped to {@code [-6, 6]}.
 *
 * <p>
 * The group's own standard deviation, bias-corrected with
 * {@link BaseStats#c4(int)}, sets the scale. The first group, and any group
 * with zero spread, scores {@code 0}.
 * </p>
 *
 * @since 1.0.0
 */
public class GroupedTIndependentScorer implements ScoreSource {

    static final double MAX_SCORE = 6;

    private final int groupSize;
    private final double[] group;
    private int filled;

    private int groups;
    private double meanSum;

    /**
     * @param groupSize values per group, {@code >= 1}
     * @throws InvalidParameterException if {@code groupSize < 1}
     */
    public GroupedTIndependentScorer(int groupSize) {
        if (groupSize < 1) {
            throw InvalidParameterException.of("groupSize", ">= 1", groupSize);
        }
        this.groupSize = groupSize;
        this.group = new double[groupSize];
    }

    @Override
    public OptionalDouble offer(double value) {
        group[filled++] = Transforms.toSqrt(value);
        if (filled < groupSize) {
            return OptionalDouble.empty();
        }
        double m1 = BaseStats.mean(group);
        double sd = BaseStats.std(group, m1) / BaseStats.c4(groupSize);
        double score = 0;
        if (groups > 0 && sd > 0) {
            double m0 = meanSum / groups;
            score = BaseStats.clip((m1 - m0) / (sd * 2), -MAX_SCORE, MAX_SCORE);
        }
        groups++;
        meanSum += m1;
        filled = 0;
        return OptionalDouble.of(score);
    }
}
