/**
 * Domain model: rule configuration and detection results.
 *
 * @since 1.0.0
 */
package com.shiftsentinel.core.model;
