package com.shiftsentinel.core.changepoint;

import com.shiftsentinel.core.error.InsufficientDataException;
import com.shiftsentinel.core.error.InvalidParameterException;
import com.shiftsentinel.core.model.Changepoint;
import com.shiftsentinel.core.stats.BaseStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Locates zero or more changepoints in a historical series.
 *
 * <h3>Search</h3>
 * <p>
 * The best single split of the whole series is found first. If it passes
 * the significance gate, the ranges before and after it are searched the
 * same way, and so on until no range is at least {@code minSearchSize}
 * long. The range after a changepoint starts {@code minSearchSize / 2}
 * values past it so the same boundary is not found twice. Pending ranges
 * are kept on an explicit work-list rather than the call stack.
 * </p>
 *
 * <h3>Significance gate</h3>
 * <p>
 * A split is accepted only if {@code |score| >= threshold} <em>and</em> the
 * percentage difference between the after and before locations is at least
 * {@code minPercentDifference} in magnitude. The second test suppresses
 * shifts that are statistically clear but too small to matter.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Instances hold only immutable configuration and may be shared.
 * </p>
 *
 * @since 1.0.0
 */
public class ChangepointLocator {

    private static final Logger LOG = LoggerFactory.getLogger(ChangepointLocator.class);

    public static final double DEFAULT_THRESHOLD = 3;
    public static final double DEFAULT_MIN_PERCENT_DIFFERENCE = 10;
    public static final int DEFAULT_MIN_SEARCH_SIZE = 30;

    /** Shortest series with at least one candidate split. */
    public static final int MIN_SERIES_LENGTH = SplitFinder.MIN_BEFORE + SplitFinder.MIN_AFTER + 1;

    private final LocatorStrategy strategy;
    private final double threshold;
    private final double minPercentDifference;
    private final int minSearchSize;

    /**
     * @param strategy             scoring strategy; must not be {@code null}
     * @param threshold            minimum absolute test score, {@code >= 0}
     * @param minPercentDifference minimum absolute percentage difference
     *                             between after and before locations
     * @param minSearchSize        smallest range worth searching, {@code >= 1}
     * @throws InvalidParameterException if a parameter is out of range
     */
    public ChangepointLocator(LocatorStrategy strategy, double threshold, double minPercentDifference,
            int minSearchSize) {
        this.strategy = Objects.requireNonNull(strategy, "strategy must not be null");
        if (!(threshold >= 0) || Double.isInfinite(threshold)) {
            throw InvalidParameterException.of("threshold", "finite and >= 0", threshold);
        }
        if (!Double.isFinite(minPercentDifference)) {
            throw InvalidParameterException.of("minPercentDifference", "finite", minPercentDifference);
        }
        if (minSearchSize < 1) {
            throw InvalidParameterException.of("minSearchSize", ">= 1", minSearchSize);
        }
        this.threshold = threshold;
        this.minPercentDifference = minPercentDifference;
        this.minSearchSize = minSearchSize;
    }

    public static ChangepointLocator rankSum(double threshold) {
        return new ChangepointLocator(LocatorStrategy.RANK_SUM, threshold,
                DEFAULT_MIN_PERCENT_DIFFERENCE, DEFAULT_MIN_SEARCH_SIZE);
    }

    public static ChangepointLocator tIndependent(double threshold) {
        return new ChangepointLocator(LocatorStrategy.T_INDEPENDENT, threshold,
                DEFAULT_MIN_PERCENT_DIFFERENCE, DEFAULT_MIN_SEARCH_SIZE);
    }

    /**
     * Find every significant changepoint in {@code data}.
     *
     * @param data the series; must not be {@code null}; not modified
     * @return changepoints ordered by ascending {@code changeIndex}; empty if
     *         none passed the gate
     * @throws InsufficientDataException if {@code data} is shorter than
     *                                   {@value #MIN_SERIES_LENGTH}
     */
    public List<Changepoint> locate(double[] data) {
        Objects.requireNonNull(data, "data must not be null");
        if (data.length < MIN_SERIES_LENGTH) {
            throw new InsufficientDataException(MIN_SERIES_LENGTH, data.length);
        }
        double[] series = strategy.prepare(data);
        SplitFinder finder = strategy.getFinder();

        List<Changepoint> found = new ArrayList<>();
        Deque<int[]> pending = new ArrayDeque<>();
        pending.push(new int[] {0, series.length});

        while (!pending.isEmpty()) {
            int[] range = pending.pop();
            int offset = range[0];
            int n = range[1];

            Split split = finder.find(series, offset, offset + n);
            if (!split.isFound()) {
                continue;
            }
            int k = split.getIndex();
            double before = strategy.location(series, offset, offset + k);
            double after = strategy.location(series, offset + k, offset + n);
            double pcd = BaseStats.pctDiff(after, before);

            if (Math.abs(split.getScore()) < threshold || Math.abs(pcd) < Math.abs(minPercentDifference)) {
                LOG.trace("Rejected split at {} in [{}, {}): score={} pcd={}",
                        offset + k, offset, offset + n, split.getScore(), pcd);
                continue;
            }

            Changepoint cp = Changepoint.builder()
                    .startIndex(offset)
                    .changeIndex(offset + k)
                    .endIndex(offset + n)
                    .before(before)
                    .after(after)
                    .percentDifference(pcd)
                    .testScore(split.getScore())
                    .build();
            LOG.debug("Changepoint accepted: {}", cp);
            found.add(cp);

            if (k >= minSearchSize) {
                pending.push(new int[] {offset, k});
            }
            int skip = k + minSearchSize / 2;
            if (n - skip >= minSearchSize) {
                pending.push(new int[] {offset + skip, n - skip});
            }
        }

        found.sort(Comparator.comparingInt(Changepoint::getChangeIndex));
        return found;
    }

    public LocatorStrategy getStrategy() {
        return strategy;
    }

    public double getThreshold() {
        return threshold;
    }

    public double getMinPercentDifference() {
        return minPercentDifference;
    }

    public int getMinSearchSize() {
        return minSearchSize;
    }
}
