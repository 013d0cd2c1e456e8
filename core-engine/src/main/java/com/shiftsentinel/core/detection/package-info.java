/**
 * Wiring from rule configuration to detectors.
 *
 * <p>
 * {@link com.shiftsentinel.core.detection.DetectorFactory} maps each
 * {@link com.shiftsentinel.core.model.DetectionRule} type to a
 * {@link com.shiftsentinel.core.changepoint.ChangepointLocator} or a
 * {@link com.shiftsentinel.core.tracker.SequentialTracker}.
 * </p>
 *
 * @since 1.0.0
 */
package com.shiftsentinel.core.detection;
