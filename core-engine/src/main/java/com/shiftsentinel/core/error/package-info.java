/**
 * Exception types shared by the change-detection engine.
 *
 * <p>
 * Entry points validate once, up front, and raise
 * {@link com.shiftsentinel.core.error.InsufficientDataException} or
 * {@link com.shiftsentinel.core.error.InvalidParameterException}. Score
 * primitives never raise for short samples; they return {@code 0}.
 * </p>
 *
 * @since 1.0.0
 */
package com.shiftsentinel.core.error;
