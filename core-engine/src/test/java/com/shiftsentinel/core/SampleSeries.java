package com.shiftsentinel.core;

import java.util.Arrays;
import java.util.Random;

/**
 * Shared fixture series for the statistical tests.
 */
public final class SampleSeries {

    /** Level shift upwards at index 30. */
    public static final double[] SHIFT_UP = {
            1.28, 1.15, 2.28, 1.98, 1.08, 0.56, 1.38, 2.29, 1.49, 1.11, 1.49,
            1.99, 1.84, 1.79, 2.05, 1.31, 0.96, 1.93, 2.48, 0.87, 1.34, 2.0,
            1.67, 1.99, 0.72, 1.54, 2.01, 2.34, 1.26, 2.21, 2.66, 5.62, 3.78,
            5.02, 7.48, 6.89, 2.92, 3.78, 3.1, 4.77, 3.92, 3.15, 5.27, 4.13,
            6.7, 3.49, 5.48, 5.81, 3.3, 3.33 };

    /** Online tracker input that jumps up around index 31. */
    public static final double[] TRACK_UP = {
            5.06, 4.2, 4.55, 6.08, 1.65, 7.33, 4.87, 4.41, 3.27, 8.54, 4.77,
            3.09, 1.62, 5.61, 5.04, 3.72, 2.64, 2.94, 1.12, 1.01, 2.92, 7.71,
            2.51, 6.42, 6.96, 1.11, 0.63, 5.58, 2.41, 6.98, 8.06, 13.44, 15.05,
            3.84, 16.69, 18.65, 24.11, 16.58, 16.39, 28.15, 14.01, 5.13, 14.14,
            26.98, 17.94, 11.75, 15.69, 10.85, 27.27, 14.54 };

    /** Online tracker input that drops around index 30. */
    public static final double[] TRACK_DOWN = {
            2.16, 3.48, 1.79, 4.32, 2.21, 5.93, 3.0, 4.16, 4.57, 2.46, 5.67,
            6.14, 2.79, 3.83, 6.61, 5.36, 4.18, 3.05, 3.44, 4.48, 6.52, 3.08,
            1.69, 4.15, 9.62, 7.09, 4.36, 3.83, 6.14, 3.95, 0.51, 0.4, 0.76, 0.5,
            0.91, 0.17, 0.65, 1.33, 0.51, 0.14, 1.23, 1.05, 0.6, 0.18, 0.12, 1.22,
            1.61, 0.14, 1.3, 0.61 };

    /** Down at 50, back up at about 102. */
    public static final double[] DOWN_THEN_UP = {
            1.68, 0.95, 3.53, 5.06, 0.81, 2.88, 1.68, 3.79, 2.93, 1.12,
            1.36, 0.15, 1.62, 0.5, 0.3, 1.46, 2.63, 1.85, 2.51, 3.2, 5.77,
            5.53, 3.18, 0.55, 1.3, 4.99, 4.69, 5.55, 1.77, 4.19, 1.21,
            3.06, 0.08, 4.93, 4.74, 2.93, 0.48, 1.35, 1.35, 4.98, 3.15,
            3.95, 4.73, 4.0, 5.42, 5.69, 5.06, 1.94, 4.33, 2.92, 1.35,
            0.73, 1.99, 0.91, 0.58, 1.05, 1.18, 1.51, 0.88, 0.93, 0.91,
            0.49, 1.92, 1.97, 1.52, 1.97, 1.13, 1.66, 0.35, 1.22, 0.35,
            1.86, 1.02, 0.74, 1.62, 1.04, 1.78, 1.89, 0.12, 1.86, 0.83,
            0.52, 0.41, 0.98, 1.11, 1.28, 1.89, 1.17, 1.72, 0.87, 0.29,
            1.51, 1.12, 1.64, 0.47, 0.29, 1.02, 0.38, 1.85, 0.09, 1.07,
            1.52, 2.46, 5.52, 0.53, 2.17, 5.39, 2.31, 5.42, 1.48, 5.02,
            5.42, 1.05, 4.72, 3.23, 1.77, 3.3, 1.26, 1.55, 1.59, 1.36,
            4.64, 5.67, 1.92, 5.1, 2.25, 5.41, 2.68, 0.96, 3.82, 2.9,
            0.36, 2.32, 4.36, 1.34, 2.72, 5.16, 1.36, 3.45, 3.19, 1.95,
            3.56, 3.88, 2.78, 3.09, 4.54, 4.72, 1.94, 3.33, 5.81 };

    /** Up at 50, back down at 100. */
    public static final double[] UP_THEN_DOWN = {
            0.9, 1.43, 0.94, 0.35, 0.74, 0.54, 0.81, 0.61, 1.0, 0.25, 1.27,
            0.51, 1.78, 1.33, 1.02, 0.37, 0.29, 0.07, 0.57, 1.58, 0.4, 0.4,
            1.66, 1.51, 1.18, 0.12, 0.83, 0.58, 1.07, 0.74, 0.78, 0.37, 1.3,
            0.97, 1.28, 1.17, 1.49, 0.49, 1.33, 0.79, 1.03, 1.09, 1.95, 0.85,
            1.16, 0.8, 0.73, 1.15, 0.95, 1.2, 4.57, 4.75, 12.59, 4.17, 16.82,
            5.25, 14.0, 4.03, 10.76, 14.18, 8.11, 5.83, 9.77, 6.0, 3.5, 4.13,
            12.47, 13.74, 6.7, 11.64, 6.3, 6.9, 4.81, 4.08, 1.85, 6.33, 9.2,
            11.43, 10.95, 2.52, 2.87, 6.95, 6.59, 10.14, 9.99, 7.76, 4.56,
            4.25, 14.26, 7.87, 3.7, 2.83, 9.71, 7.8, 8.72, 8.83, 7.74, 1.85,
            6.29, 9.3, 0.16, 0.7, 0.66, 0.83, 1.13, 1.16, 2.27, 1.97, 0.88,
            0.43, 0.64, 0.91, 0.92, 1.38, 1.23, 0.37, 0.91, 0.98, 0.82,
            1.28, 0.81, 1.23, 0.73, 1.94, 0.83, 0.72, 1.02, 0.3, 0.88, 2.19,
            0.54, 0.78, 0.86, 0.78, 0.41, 0.96, 0.74, 1.1, 1.01, 0.58, 0.45,
            0.78, 0.56, 1.23, 1.3, 0.58, 0.85, 1.63, 0.99, 0.26 };

    private SampleSeries() {
    }

    public static double[] slice(double[] data, int from, int to) {
        return Arrays.copyOfRange(data, from, to);
    }

    public static double[] constant(int n, double value) {
        double[] out = new double[n];
        Arrays.fill(out, value);
        return out;
    }

    /** 150 values cycling 4, 5, 6, 5 followed by 50 values of 15. */
    public static double[] cycleThenStep() {
        double[] cycle = {4, 5, 6, 5};
        double[] out = new double[200];
        for (int i = 0; i < 150; i++) {
            out[i] = cycle[i % cycle.length];
        }
        for (int i = 150; i < 200; i++) {
            out[i] = 15;
        }
        return out;
    }

    /** Weibull variate by inverse CDF. */
    public static double weibull(Random random, double scale, double shape) {
        return scale * Math.pow(-Math.log(1 - random.nextDouble()), 1 / shape);
    }

    public static double[] weibullSeries(Random random, int n, double scale, double shape) {
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            out[i] = weibull(random, scale, shape);
        }
        return out;
    }
}
