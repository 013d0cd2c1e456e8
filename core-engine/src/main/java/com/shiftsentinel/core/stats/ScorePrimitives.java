package com.shiftsentinel.core.stats;

import java.util.Arrays;
import java.util.Objects;

/**
 * Two-sample test scores and per-value score transforms.
 *
 * <h3>Neutral degradation</h3>
 * <p>
 * None of these functions throw on short input. The two-sample scores need
 * at least {@value #MIN_SAMPLE_SIZE} values on each side and
 * {@value #MIN_COMBINED_SIZE} overall; below that they return {@code 0},
 * meaning "no signal". Callers that search shrinking partitions rely on
 * this to terminate.
 * </p>
 *
 * <h3>Ties</h3>
 * <p>
 * Ties are grouped by exact {@code ==} equality. No tolerance is applied,
 * so values that differ in the last bit rank separately.
 * </p>
 *
 * @since 1.0.0
 */
public final class ScorePrimitives {

    /** Minimum values per sample for a two-sample score. */
    public static final int MIN_SAMPLE_SIZE = 4;

    /** Minimum values across both samples for a two-sample score. */
    public static final int MIN_COMBINED_SIZE = 12;

    private ScorePrimitives() {
        // utility class, not instantiable
    }

    // ---------------------------------------------------------------
    // Ranks
    // ---------------------------------------------------------------

    /**
     * Average ranks, 1-based. Tied values share the mean of the rank range
     * they occupy.
     *
     * @param data values; must not be {@code null}
     * @return ranks aligned with {@code data}
     */
    public static double[] rankTransform(double[] data) {
        Objects.requireNonNull(data, "data must not be null");
        int n = data.length;
        Integer[] order = new Integer[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
        }
        Arrays.sort(order, (a, b) -> Double.compare(data[a], data[b]));

        double[] ranks = new double[n];
        int i = 0;
        while (i < n) {
            int j = i + 1;
            while (j < n && data[order[j]] == data[order[i]]) {
                j++;
            }
            // positions i..j-1 hold ranks i+1..j
            double avg = (i + 1 + j) / 2.0;
            for (int t = i; t < j; t++) {
                ranks[order[t]] = avg;
            }
            i = j;
        }
        return ranks;
    }

    /**
     * Percentile scores in {@code [-1, 1]}: {@code ((rank / (n + 0.5)) - 0.5) * 2}
     * using average ranks.
     *
     * @param data values; must not be {@code null}
     * @return scores aligned with {@code data}
     */
    public static double[] percentileScores(double[] data) {
        double[] ranks = rankTransform(data);
        double n = data.length + 0.5;
        double[] out = new double[ranks.length];
        for (int i = 0; i < ranks.length; i++) {
            out[i] = ((ranks[i] / n) - 0.5) * 2;
        }
        return out;
    }

    /**
     * Standard scores {@code (x - mean) / sd}. All zeros when there are fewer
     * than three values or the series is constant.
     *
     * @param data values; must not be {@code null}
     * @return scores aligned with {@code data}
     */
    public static double[] zScores(double[] data) {
        Objects.requireNonNull(data, "data must not be null");
        double[] out = new double[data.length];
        if (data.length < 3) {
            return out;
        }
        double mu = BaseStats.mean(data);
        double sd = BaseStats.std(data, mu);
        if (sd == 0) {
            return out;
        }
        for (int i = 0; i < data.length; i++) {
            out[i] = (data[i] - mu) / sd;
        }
        return out;
    }

    // ---------------------------------------------------------------
    // Two-sample scores
    // ---------------------------------------------------------------

    /**
     * Rank-sum score of {@code test} against {@code base}. Each test value
     * contributes its mid-rank within the sorted base (ties at half weight),
     * centred by {@code n / 2}; the sum is normalised by
     * {@code sqrt(n * m * (n + m + 1) / 12)}.
     *
     * @param base reference sample; must not be {@code null}
     * @param test sample under test; must not be {@code null}
     * @return normalised score, positive when {@code test} ranks higher
     */
    public static double rankSumScore(double[] base, double[] test) {
        Objects.requireNonNull(base, "base must not be null");
        Objects.requireNonNull(test, "test must not be null");
        int n = base.length;
        int m = test.length;
        if (!enoughData(n, m)) {
            return 0;
        }
        double[] sorted = base.clone();
        Arrays.sort(sorted);
        return rankSumScoreSorted(sorted, n, test, m);
    }

    /**
     * {@link #rankSumScore(double[], double[])} against a base that is
     * already sorted, for callers that keep a sorted baseline between calls.
     *
     * @param sortedBase base values sorted ascending in {@code [0, baseSize)}
     * @param baseSize   number of base values in use
     * @param test       sample under test; order irrelevant
     * @param testSize   number of test values in use
     * @return normalised score
     */
    public static double rankSumScoreSorted(double[] sortedBase, int baseSize, double[] test, int testSize) {
        Objects.requireNonNull(sortedBase, "sortedBase must not be null");
        Objects.requireNonNull(test, "test must not be null");
        int n = baseSize;
        int m = testSize;
        if (!enoughData(n, m)) {
            return 0;
        }
        double rs = 0;
        for (int i = 0; i < m; i++) {
            double x = test[i];
            int lo = lowerBound(sortedBase, n, x);
            int hi = upperBound(sortedBase, n, x);
            rs += lo + (hi - lo) / 2.0 - n / 2.0;
        }
        return rs / Math.sqrt((n * (double) m * (n + m + 1)) / 12);
    }

    /**
     * Independent-samples T score of {@code test} against {@code base},
     * corrected towards the Student-t scale with {@link #tcf(double, double)}.
     *
     * @param base reference sample; must not be {@code null}
     * @param test sample under test; must not be {@code null}
     * @return corrected score, {@code 0} below the minimum sizes or when both
     *         samples are constant
     */
    public static double tIndependentScore(double[] base, double[] test) {
        Objects.requireNonNull(base, "base must not be null");
        Objects.requireNonNull(test, "test must not be null");
        int n = base.length;
        int m = test.length;
        if (!enoughData(n, m)) {
            return 0;
        }
        double total = n + m;
        double se = BaseStats.stderr(base) * (n / total) + BaseStats.stderr(test) * (m / total);
        if (se == 0) {
            return 0;
        }
        double z = (BaseStats.mean(test) - BaseStats.mean(base)) / (se * 2);
        return tcf(n + m - 2, z);
    }

    /**
     * Shrink a normal score {@code z} towards its Student-t equivalent with
     * {@code n} degrees of freedom using a truncated series expansion. The
     * correction vanishes as {@code n} grows.
     *
     * @param n degrees of freedom
     * @param z normal score
     * @return corrected score
     */
    public static double tcf(double n, double z) {
        double z3 = z * z * z;
        double z5 = z3 * z * z;
        return (z * 2) - (z + ((z3 + z) / (4 * n))
                + (((5 * z5) + (16 * z3) + (3 * z)) / (96 * n * n)));
    }

    // ---------------------------------------------------------------
    // Sorted-buffer lookups
    // ---------------------------------------------------------------

    /**
     * First index in {@code sorted[0, size)} whose value is {@code >= x}.
     */
    public static int lowerBound(double[] sorted, int size, double x) {
        int lo = 0;
        int hi = size;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (sorted[mid] < x) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    /**
     * First index in {@code sorted[0, size)} whose value is {@code > x}.
     */
    public static int upperBound(double[] sorted, int size, double x) {
        int lo = 0;
        int hi = size;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (sorted[mid] <= x) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    private static boolean enoughData(int n, int m) {
        return n >= MIN_SAMPLE_SIZE && m >= MIN_SAMPLE_SIZE && n + m >= MIN_COMBINED_SIZE;
    }
}
