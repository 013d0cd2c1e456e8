/**
 * Online change tracking. A {@link com.shiftsentinel.core.tracker.ScoreSource}
 * scores each value (or group of values) against a baseline that grows as
 * data arrives, and an {@link com.shiftsentinel.core.tracker.Accumulator}
 * turns the score stream into a signed statistic.
 *
 * @since 1.0.0
 */
package com.shiftsentinel.core.tracker;
