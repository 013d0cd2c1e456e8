package com.shiftsentinel.core.tracker;

import com.shiftsentinel.core.error.InvalidParameterException;
import com.shiftsentinel.core.model.ThresholdCrossing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.PrimitiveIterator;

/**
 * Online change tracker: a {@link ScoreSource} feeding an
 * {@link Accumulator}. Every score the source produces yields one output,
 * the accumulator's current signed statistic. Callers compare its magnitude
 * against their own alert threshold.
 *
 * <h3>Driving</h3>
 * <p>
 * Push values with {@link #observe(double)}, or pull outputs lazily with
 * {@link #scores(PrimitiveIterator.OfDouble)}. Both advance the same state,
 * so they produce identical outputs for identical input.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe. Use one instance per stream.
 * </p>
 *
 * @since 1.0.0
 */
public class SequentialTracker {

    private static final Logger LOG = LoggerFactory.getLogger(SequentialTracker.class);

    private final ScoreSource source;
    private final Accumulator accumulator;

    /**
     * @param source      per-value or grouped scorer; must not be {@code null}
     * @param accumulator CUSUM or EWMA accumulator; must not be {@code null}
     */
    public SequentialTracker(ScoreSource source, Accumulator accumulator) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.accumulator = Objects.requireNonNull(accumulator, "accumulator must not be null");
        LOG.debug("Tracker created: source={} accumulator={}",
                source.getClass().getSimpleName(), accumulator.getClass().getSimpleName());
    }

    /**
     * Consume one raw value.
     *
     * @param value next observation
     * @return the updated statistic, or empty if a grouped source is still
     *         filling its current group
     */
    public OptionalDouble observe(double value) {
        OptionalDouble score = source.offer(value);
        if (score.isEmpty()) {
            return score;
        }
        return OptionalDouble.of(accumulator.observe(score.getAsDouble()));
    }

    /**
     * Eagerly run every value through the tracker.
     *
     * @param data observations; must not be {@code null}
     * @return one output per produced score
     */
    public double[] scoreAll(double[] data) {
        Objects.requireNonNull(data, "data must not be null");
        double[] out = new double[data.length];
        int n = 0;
        for (double x : data) {
            OptionalDouble s = observe(x);
            if (s.isPresent()) {
                out[n++] = s.getAsDouble();
            }
        }
        return n == out.length ? out : Arrays.copyOf(out, n);
    }

    /**
     * Lazily map an input stream to tracker outputs. Input is pulled only as
     * far as needed to produce the next output, so unbounded input is fine.
     * An exception raised while consuming surfaces from the pull that caused
     * it.
     *
     * @param input observations; must not be {@code null}
     * @return outputs, not restartable
     */
    public PrimitiveIterator.OfDouble scores(PrimitiveIterator.OfDouble input) {
        Objects.requireNonNull(input, "input must not be null");
        return new PrimitiveIterator.OfDouble() {
            private boolean ready;
            private double next;

            @Override
            public boolean hasNext() {
                while (!ready && input.hasNext()) {
                    OptionalDouble s = observe(input.nextDouble());
                    if (s.isPresent()) {
                        next = s.getAsDouble();
                        ready = true;
                    }
                }
                return ready;
            }

            @Override
            public double nextDouble() {
                if (!hasNext()) {
                    throw new NoSuchElementException("Input exhausted");
                }
                ready = false;
                return next;
            }
        };
    }

    /**
     * Run {@code data} through the tracker and report the first output whose
     * magnitude exceeds {@code threshold}.
     *
     * @param data      observations; must not be {@code null}
     * @param threshold alert threshold {@code h}, {@code >= 0}
     * @return the first crossing, or empty if none occurred
     * @throws InvalidParameterException if {@code threshold} is negative or NaN
     */
    public Optional<ThresholdCrossing> firstCrossing(double[] data, double threshold) {
        Objects.requireNonNull(data, "data must not be null");
        if (!(threshold >= 0)) {
            throw InvalidParameterException.of("threshold", ">= 0", threshold);
        }
        int index = 0;
        for (double x : data) {
            OptionalDouble s = observe(x);
            if (s.isEmpty()) {
                continue;
            }
            double v = s.getAsDouble();
            if (Math.abs(v) > threshold) {
                LOG.debug("Threshold {} crossed at output {} with score {}", threshold, index, v);
                return Optional.of(new ThresholdCrossing(index, v));
            }
            index++;
        }
        return Optional.empty();
    }

    public ScoreSource getSource() {
        return source;
    }

    public Accumulator getAccumulator() {
        return accumulator;
    }
}
