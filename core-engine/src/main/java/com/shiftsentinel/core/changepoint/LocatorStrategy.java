package com.shiftsentinel.core.changepoint;

import com.shiftsentinel.core.stats.BaseStats;
import com.shiftsentinel.core.stats.Transforms;

/**
 * Scoring strategy for {@link ChangepointLocator}: which split finder to
 * use, how to summarise each side of a split, and how to prepare the
 * series beforehand.
 *
 * @since 1.0.0
 */
public enum LocatorStrategy {

    /** Rank-sum scores, medians as locations, raw data. */
    RANK_SUM(new RankSumSplitFinder()) {
        @Override
        double location(double[] data, int from, int to) {
            return BaseStats.median(data, from, to);
        }

        @Override
        double[] prepare(double[] data) {
            return data;
        }
    },

    /**
     * T scores, means as locations, square-root transformed data. Locations
     * are reported on the transformed scale.
     */
    T_INDEPENDENT(new TIndependentSplitFinder()) {
        @Override
        double location(double[] data, int from, int to) {
            return BaseStats.mean(data, from, to);
        }

        @Override
        double[] prepare(double[] data) {
            return Transforms.toSqrt(data);
        }
    };

    private final SplitFinder finder;

    LocatorStrategy(SplitFinder finder) {
        this.finder = finder;
    }

    public SplitFinder getFinder() {
        return finder;
    }

    abstract double location(double[] data, int from, int to);

    abstract double[] prepare(double[] data);
}
