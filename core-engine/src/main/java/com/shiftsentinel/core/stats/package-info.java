/**
 * Statistical building blocks: descriptive statistics, rank and two-sample
 * scores, trend tests and robust location estimators.
 *
 * <p>
 * Everything here is a stateless static function over {@code double[]}.
 * </p>
 *
 * @since 1.0.0
 */
package com.shiftsentinel.core.stats;
