/**
 * Configuration loading and validation for change-detection rules.
 *
 * <p>
 * Rules are defined in YAML and loaded by
 * {@link com.shiftsentinel.core.config.RulesLoader} into a
 * {@link com.shiftsentinel.core.config.RulesConfig} instance. Validation
 * runs automatically after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.shiftsentinel.core.config;
