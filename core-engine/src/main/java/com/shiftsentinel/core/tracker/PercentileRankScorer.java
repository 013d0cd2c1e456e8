package com.shiftsentinel.core.tracker;

import com.shiftsentinel.core.error.InvalidParameterException;
import com.shiftsentinel.core.stats.ScorePrimitives;

import java.util.Arrays;
import java.util.OptionalDouble;

/**
 * Scores each value by its percentile rank, in {@code [-1, 1]}, within a
 * sorted baseline of earlier values.
 *
 * <h3>Staged baseline</h3>
 * <p>
 * Each value is scored against the baseline as it stood <em>before</em> the
 * value arrived, then staged. Once {@code stageSize} values are staged they
 * are merged into the sorted baseline together. Until the first merge every
 * score is {@code 0}.
 * </p>
 *
 * <p>
 * A value equal to some baseline values takes the midpoint of their rank
 * range, so a constant series scores close to {@code 0} rather than drifting
 * to {@code -1}.
 * </p>
 *
 * @since 1.0.0
 */
public class PercentileRankScorer implements ScoreSource {

    private final int stageSize;
    private final double[] stage;
    private int staged;

    private double[] baseline = new double[0];
    private int baselineSize;

    /**
     * @param stageSize values to collect before growing the baseline, {@code >= 1}
     * @throws InvalidParameterException if {@code stageSize < 1}
     */
    public PercentileRankScorer(int stageSize) {
        if (stageSize < 1) {
            throw InvalidParameterException.of("stageSize", ">= 1", stageSize);
        }
        this.stageSize = stageSize;
        this.stage = new double[stageSize];
    }

    @Override
    public OptionalDouble offer(double value) {
        double score = 0;
        if (baselineSize > 0) {
            int lo = ScorePrimitives.lowerBound(baseline, baselineSize, value);
            int hi = ScorePrimitives.upperBound(baseline, baselineSize, value);
            double rank = lo + (hi - lo) / 2.0;
            score = (rank / (baselineSize + 0.5) - 0.5) * 2;
        }
        stage[staged++] = value;
        if (staged == stageSize) {
            merge();
        }
        return OptionalDouble.of(score);
    }

    /**
     * @return number of values merged into the baseline so far
     */
    public int getBaselineSize() {
        return baselineSize;
    }

    private void merge() {
        Arrays.sort(stage, 0, staged);
        int total = baselineSize + staged;
        double[] merged = new double[total];
        int i = 0;
        int j = 0;
        int t = 0;
        while (i < baselineSize && j < staged) {
            merged[t++] = baseline[i] <= stage[j] ? baseline[i++] : stage[j++];
        }
        while (i < baselineSize) {
            merged[t++] = baseline[i++];
        }
        while (j < staged) {
            merged[t++] = stage[j++];
        }
        baseline = merged;
        baselineSize = total;
        staged = 0;
    }
}
