package com.shiftsentinel.core.tracker;

import java.util.OptionalDouble;

/**
 * Turns a stream of raw observations into a stream of test scores, each
 * measured against the history seen so far.
 *
 * <p>
 * Implementations are <strong>stateful</strong> and not thread-safe: one
 * instance per stream. Per-value sources score every observation;
 * grouped sources score only when a group completes.
 * </p>
 *
 * @since 1.0.0
 */
public interface ScoreSource {

    /**
     * Consume one observation.
     *
     * @param value the next raw value
     * @return the score it produced, or empty if it only filled a pending group
     */
    OptionalDouble offer(double value);
}
