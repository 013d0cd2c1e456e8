package com.shiftsentinel.core.stats;

import com.shiftsentinel.core.error.InsufficientDataException;
import com.shiftsentinel.core.error.InvalidParameterException;

import java.util.Arrays;
import java.util.Objects;

/**
 * Outlier-resistant location and scale estimates: trimming, winsorizing
 * and an iteratively reweighted M-estimate.
 *
 * <p>
 * Proportions must lie in {@code [0, 1)}; anything else is rejected with
 * {@link InvalidParameterException}. Accepted proportions are then capped
 * ({@value #MAX_TRIM} for trimming and winsorizing, {@value #MAX_ESTIMATE_TRIM}
 * for {@link #trimEstimate(double[], double)}) so that at least a central
 * third of the data survives.
 * </p>
 *
 * @since 1.0.0
 */
public final class RobustStats {

    public static final double MAX_TRIM = 0.33;
    public static final double MAX_ESTIMATE_TRIM = 0.4;
    public static final int MIN_TRIM_LENGTH = 3;
    public static final int MIN_M_ESTIMATE_LENGTH = 5;

    private RobustStats() {
        // utility class, not instantiable
    }

    // ---------------------------------------------------------------
    // Trimming / winsorizing
    // ---------------------------------------------------------------

    /**
     * Lower (inclusive) and upper (exclusive) offsets into the sorted data
     * that survive trimming proportion {@code p} from each end. At least one
     * value is always cut from each end.
     *
     * @param n number of values, at least {@value #MIN_TRIM_LENGTH}
     * @param p proportion in {@code [0, 1)}, capped at {@value #MAX_TRIM}
     * @return {@code {lower, upper}}
     */
    public static int[] trimLimits(int n, double p) {
        if (n < MIN_TRIM_LENGTH) {
            throw new InsufficientDataException(MIN_TRIM_LENGTH, n);
        }
        double q = Math.min(checkProportion(p), MAX_TRIM);
        return limits(n, q);
    }

    public static double[] trim(double[] data, double p) {
        Objects.requireNonNull(data, "data must not be null");
        int[] li = trimLimits(data.length, p);
        double[] xs = sorted(data);
        return Arrays.copyOfRange(xs, li[0], li[1]);
    }

    public static double trimMean(double[] data) {
        return trimMean(data, 0.2);
    }

    /**
     * Mean of the values left after trimming proportion {@code p} from both
     * ends of the sorted data.
     */
    public static double trimMean(double[] data, double p) {
        return BaseStats.mean(trim(data, p));
    }

    public static double[] winsorize(double[] data) {
        return winsorize(data, 0.25);
    }

    /**
     * Flatten proportion {@code p} at both ends of the sorted data onto the
     * nearest surviving value. The result is in sorted order.
     *
     * @param data values; must not be {@code null}
     * @param p    proportion in {@code [0, 1)}
     * @return winsorized values, sorted
     */
    public static double[] winsorize(double[] data, double p) {
        Objects.requireNonNull(data, "data must not be null");
        int[] li = trimLimits(data.length, p);
        return flatten(sorted(data), li[0], li[1]);
    }

    public static double winsorizedStderr(double[] data) {
        return winsorizedStderr(data, 0.2);
    }

    /**
     * Standard error of a trimmed mean, estimated from the winsorized
     * standard deviation.
     */
    public static double winsorizedStderr(double[] data, double p) {
        double q = Math.min(checkProportion(p), MAX_TRIM);
        double sd = BaseStats.std(winsorize(data, q));
        return sd / Math.sqrt(data.length * (1 - q * 2));
    }

    // ---------------------------------------------------------------
    // Estimators
    // ---------------------------------------------------------------

    public static LocationEstimate trimEstimate(double[] data) {
        return trimEstimate(data, 0.2);
    }

    /**
     * Trimmed mean with a winsorized standard error. For {@code p = 0.2} and
     * {@code [1..8]} the mean uses {@code [2..7]} and the error uses
     * {@code [2,2,3,4,5,6,7,7]}.
     *
     * @param data values; must not be {@code null}
     * @param p    proportion in {@code [0, 1)}, capped at
     *             {@value #MAX_ESTIMATE_TRIM}
     * @return trimmed mean and winsorized standard error
     */
    public static LocationEstimate trimEstimate(double[] data, double p) {
        Objects.requireNonNull(data, "data must not be null");
        int n = data.length;
        if (n < MIN_TRIM_LENGTH) {
            throw new InsufficientDataException(MIN_TRIM_LENGTH, n);
        }
        double q = Math.min(checkProportion(p), MAX_ESTIMATE_TRIM);
        int[] li = limits(n, q);
        double[] xs = sorted(data);
        double mu = BaseStats.mean(xs, li[0], li[1]);
        double se = BaseStats.std(flatten(xs, li[0], li[1])) / Math.sqrt(n * (1 - q * 2));
        return new LocationEstimate(mu, se);
    }

    public static LocationEstimate mEstimate(double[] data) {
        return mEstimate(data, 2, 0.01, 12);
    }

    /**
     * Iteratively reweighted M-estimate of location. Values further than
     * {@code cf} median absolute deviations from the current estimate are
     * down-weighted in proportion to their distance. Iteration stops once the
     * percentage change between rounds drops below {@code pctImprovement} or
     * after {@code maxIterations} rounds.
     *
     * @param data           values; must not be {@code null}
     * @param cf             convergence factor, {@code > 0}
     * @param pctImprovement minimum percentage change to keep iterating,
     *                       {@code >= 0}
     * @param maxIterations  iteration cap, {@code >= 1}
     * @return estimate and its standard error
     */
    public static LocationEstimate mEstimate(double[] data, double cf, double pctImprovement, int maxIterations) {
        Objects.requireNonNull(data, "data must not be null");
        if (!(cf > 0)) {
            throw InvalidParameterException.of("cf", "> 0", cf);
        }
        if (!(pctImprovement >= 0)) {
            throw InvalidParameterException.of("pctImprovement", ">= 0", pctImprovement);
        }
        if (maxIterations < 1) {
            throw InvalidParameterException.of("maxIterations", ">= 1", maxIterations);
        }
        int n = data.length;
        if (n < MIN_M_ESTIMATE_LENGTH) {
            throw new InsufficientDataException(MIN_M_ESTIMATE_LENGTH, n);
        }

        double m1 = BaseStats.median(data);
        double[] dev = new double[n];
        for (int i = 0; i < n; i++) {
            dev[i] = Math.abs(data[i] - m1);
        }
        double tv = BaseStats.median(dev) * cf;

        double[] wt = new double[n];
        Arrays.fill(wt, 1);
        for (int iter = 0; iter < maxIterations; iter++) {
            double m0 = m1;
            double ws = 0;
            for (int i = 0; i < n; i++) {
                double x = data[i];
                if (x < m1 - tv) {
                    wt[i] = -tv / (x - m1);
                } else if (x > m1 + tv) {
                    wt[i] = tv / (x - m1);
                }
                ws += wt[i] * x;
            }
            m1 = ws / n;
            if (Math.abs(BaseStats.pctDiff(m1, m0)) < pctImprovement) {
                break;
            }
        }

        double[] weighted = new double[n];
        int unweighted = 0;
        for (int i = 0; i < n; i++) {
            weighted[i] = data[i] * wt[i];
            if (wt[i] == 1) {
                unweighted++;
            }
        }
        double se = BaseStats.std(weighted, m1) / Math.sqrt(Math.max(unweighted, 1));
        return new LocationEstimate(m1, se);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static double checkProportion(double p) {
        if (!(p >= 0 && p < 1)) {
            throw InvalidParameterException.of("proportion", "in [0, 1)", p);
        }
        return p;
    }

    private static int[] limits(int n, double p) {
        int lower = Math.max((int) Math.floor(n * p), 1);
        int upper = Math.min((int) Math.ceil(n * (1 - p)), n - 1);
        return new int[] {lower, upper};
    }

    private static double[] sorted(double[] data) {
        double[] xs = data.clone();
        Arrays.sort(xs);
        return xs;
    }

    private static double[] flatten(double[] xs, int lower, int upper) {
        double[] out = xs.clone();
        for (int i = 0; i < out.length; i++) {
            if (i < lower) {
                out[i] = xs[lower];
            } else if (i >= upper) {
                out[i] = xs[upper];
            }
        }
        return out;
    }
}
