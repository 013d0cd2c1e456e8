package com.shiftsentinel.core.stats;

import java.util.Arrays;
import java.util.Objects;

/**
 * Descriptive statistics over {@code double} arrays and array ranges.
 *
 * <p>
 * Range overloads ({@code from} inclusive, {@code to} exclusive) let the
 * changepoint locator work on sub-ranges without copying.
 * </p>
 *
 * @since 1.0.0
 */
public final class BaseStats {

    private BaseStats() {
        // utility class, not instantiable
    }

    /**
     * Arithmetic mean, or {@code 0} for an empty array.
     *
     * @param data values; must not be {@code null}
     * @return mean
     */
    public static double mean(double[] data) {
        Objects.requireNonNull(data, "data must not be null");
        return mean(data, 0, data.length);
    }

    public static double mean(double[] data, int from, int to) {
        int n = to - from;
        if (n <= 0) {
            return 0;
        }
        double sum = 0;
        for (int i = from; i < to; i++) {
            sum += data[i];
        }
        return sum / n;
    }

    /**
     * Sample standard deviation (n - 1 denominator), or {@code 0} for fewer
     * than two values.
     *
     * @param data values; must not be {@code null}
     * @return standard deviation
     */
    public static double std(double[] data) {
        Objects.requireNonNull(data, "data must not be null");
        return std(data, mean(data));
    }

    /**
     * Sample standard deviation around a supplied centre.
     *
     * @param data values; must not be {@code null}
     * @param mu   centre to measure deviations from
     * @return standard deviation
     */
    public static double std(double[] data, double mu) {
        Objects.requireNonNull(data, "data must not be null");
        if (data.length < 2) {
            return 0;
        }
        double ss = 0;
        for (double x : data) {
            double d = x - mu;
            ss += d * d;
        }
        return Math.sqrt(ss / (data.length - 1));
    }

    /**
     * Standard error of the mean: {@code std / sqrt(n)}.
     *
     * @param data values; must not be {@code null}
     * @return standard error, {@code 0} for an empty array
     */
    public static double stderr(double[] data) {
        Objects.requireNonNull(data, "data must not be null");
        if (data.length == 0) {
            return 0;
        }
        return std(data) / Math.sqrt(data.length);
    }

    /**
     * Median with the even-length midpoint average.
     *
     * @param data values; must not be {@code null}
     * @return median, {@code 0} for an empty array
     */
    public static double median(double[] data) {
        Objects.requireNonNull(data, "data must not be null");
        return median(data, 0, data.length);
    }

    public static double median(double[] data, int from, int to) {
        int n = to - from;
        if (n <= 0) {
            return 0;
        }
        double[] xs = Arrays.copyOfRange(data, from, to);
        Arrays.sort(xs);
        int m = n / 2;
        return n % 2 == 1 ? xs[m] : (xs[m] + xs[m - 1]) / 2;
    }

    /**
     * Percentile {@code pc} (0 to 100) by linear interpolation between
     * closest ranks. Needs at least three values, otherwise {@code 0}.
     *
     * @param data values; must not be {@code null}
     * @param pc   percentile in {@code [0, 100]}
     * @return percentile value
     */
    public static double percentile(double[] data, double pc) {
        Objects.requireNonNull(data, "data must not be null");
        if (data.length < 3) {
            return 0;
        }
        double[] xs = data.clone();
        Arrays.sort(xs);
        double r = (xs.length - 1) * pc / 100;
        int i = (int) r;
        if (i < xs.length - 1) {
            return xs[i] + (xs[i + 1] - xs[i]) * (r - i);
        }
        return xs[xs.length - 1];
    }

    /**
     * Percentage difference between {@code x} and {@code y} measured from
     * their midpoint, so the result lies in {@code [-200, 200]} for
     * non-negative inputs.
     *
     * @param x first value
     * @param y second value
     * @return percentage difference, {@code 0} when {@code x + y == 0}
     */
    public static double pctDiff(double x, double y) {
        double sum = x + y;
        return sum != 0 ? (x - y) / (sum / 2) * 100 : 0;
    }

    /**
     * Control-chart bias correction for the standard deviation of small
     * samples.
     *
     * @param n sample size; values below 2 are treated as 2
     * @return correction factor in {@code (0, 1)}
     */
    public static double c4(int n) {
        int m = Math.max(n, 2);
        return (4.0 * m - 4) / (4.0 * m - 3);
    }

    /**
     * Clip {@code value} into {@code [lo, hi]}.
     */
    public static double clip(double value, double lo, double hi) {
        return Math.min(Math.max(value, lo), hi);
    }
}
