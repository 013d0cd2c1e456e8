package com.shiftsentinel.core.tracker;

import com.shiftsentinel.core.error.InvalidParameterException;
import com.shiftsentinel.core.stats.BaseStats;
import com.shiftsentinel.core.stats.Transforms;

import java.util.OptionalDouble;

/**
 * Scores each square-root transformed value as a standard score against a
 * baseline of earlier values, clipped to {@code [-6, 6]}.
 *
 * <p>
 * Uses the same staged cadence as {@link PercentileRankScorer}, but the
 * baseline is summarised by a running mean and variance. The scale is the
 * baseline standard deviation divided by {@value #MAD_RATIO}, which widens
 * it to be tolerant of heavy tails. A baseline with zero spread scores
 * {@code 0}.
 * </p>
 *
 * @since 1.0.0
 */
public class TIndependentScorer implements ScoreSource {

    static final double MAD_RATIO = 0.6745;
    static final double MAX_SCORE = 6;

    private final int stageSize;
    private final double[] stage;
    private int staged;

    // Welford accumulators over the merged baseline
    private long count;
    private double mean;
    private double m2;

    private double mu;
    private double sd;

    /**
     * @param stageSize values to collect before growing the baseline, {@code >= 1}
     * @throws InvalidParameterException if {@code stageSize < 1}
     */
    public TIndependentScorer(int stageSize) {
        if (stageSize < 1) {
            throw InvalidParameterException.of("stageSize", ">= 1", stageSize);
        }
        this.stageSize = stageSize;
        this.stage = new double[stageSize];
    }

    @Override
    public OptionalDouble offer(double value) {
        double x = Transforms.toSqrt(value);
        double score = 0;
        if (count > 0 && sd > 0) {
            score = BaseStats.clip((x - mu) / sd, -MAX_SCORE, MAX_SCORE);
        }
        stage[staged++] = x;
        if (staged == stageSize) {
            merge();
        }
        return OptionalDouble.of(score);
    }

    private void merge() {
        for (int i = 0; i < staged; i++) {
            count++;
            double d = stage[i] - mean;
            mean += d / count;
            m2 += d * (stage[i] - mean);
        }
        staged = 0;
        mu = mean;
        sd = count > 1 ? Math.sqrt(Math.max(m2, 0) / (count - 1)) / MAD_RATIO : 0;
    }
}
