package com.shiftsentinel.core.tracker;

import com.shiftsentinel.core.error.InvalidParameterException;

import java.util.Objects;

/**
 * Exponentially weighted moving-average accumulator. Each score is blended
 * into the upper and lower averages with weight {@code a}; an average that
 * crosses zero is reset to zero.
 *
 * <p>
 * The signed result is passed through a {@link Scaling} so that outputs of
 * trackers with different {@code a} can be compared against one threshold.
 * </p>
 *
 * @since 1.0.0
 */
public class EwmaAccumulator implements Accumulator {

    /**
     * Output scaling applied after the signed maximum is taken.
     */
    public enum Scaling {

        /** Raw signed average. */
        NONE {
            @Override
            double apply(double value, double a) {
                return value;
            }
        },

        /** Divide by the control-limit scale {@code sqrt(a / (2 - a)) * 2}. */
        CONTROL_LIMIT {
            @Override
            double apply(double value, double a) {
                return value / (stderrFactor(a) * 2);
            }
        },

        /** As {@link #CONTROL_LIMIT}, but never enlarging the value. */
        CAPPED_CONTROL_LIMIT {
            @Override
            double apply(double value, double a) {
                return value / Math.min(stderrFactor(a) * 2, 1);
            }
        },

        /** Divide by the asymptotic standard error factor {@code sqrt(a / (2 - a))}. */
        STANDARD_ERROR {
            @Override
            double apply(double value, double a) {
                return value / stderrFactor(a);
            }
        },

        /** Sign-preserving power {@code sign(v) * |v|^a}, for scores in {@code [-1, 1]}. */
        POWER {
            @Override
            double apply(double value, double a) {
                return value > 0 ? Math.pow(value, a) : -Math.pow(Math.abs(value), a);
            }
        };

        abstract double apply(double value, double a);

        static double stderrFactor(double a) {
            return Math.sqrt(a / (2 - a));
        }
    }

    private final double smoothing;
    private final Scaling scaling;
    private double lower;
    private double upper;

    public EwmaAccumulator(double smoothing) {
        this(smoothing, Scaling.NONE);
    }

    /**
     * @param smoothing weight {@code a} of the newest score, {@code 0 < a < 1}
     * @param scaling   output scaling; must not be {@code null}
     * @throws InvalidParameterException if {@code a} is outside {@code (0, 1)}
     */
    public EwmaAccumulator(double smoothing, Scaling scaling) {
        if (!(smoothing > 0 && smoothing < 1)) {
            throw InvalidParameterException.of("a", "in (0, 1)", smoothing);
        }
        this.smoothing = smoothing;
        this.scaling = Objects.requireNonNull(scaling, "scaling must not be null");
    }

    @Override
    public double observe(double score) {
        double a = smoothing;
        lower = Math.min(a * score + (1 - a) * lower, 0);
        upper = Math.max(a * score + (1 - a) * upper, 0);
        return scaling.apply(Accumulator.signedMax(lower, upper), a);
    }

    @Override
    public void reset() {
        lower = 0;
        upper = 0;
    }

    @Override
    public double getLower() {
        return lower;
    }

    @Override
    public double getUpper() {
        return upper;
    }

    public double getSmoothing() {
        return smoothing;
    }

    public Scaling getScaling() {
        return scaling;
    }
}
