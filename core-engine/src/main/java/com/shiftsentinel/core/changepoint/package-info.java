/**
 * Offline changepoint location over a complete historical series.
 *
 * @since 1.0.0
 */
package com.shiftsentinel.core.changepoint;
