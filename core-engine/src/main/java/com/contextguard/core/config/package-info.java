/**
 * Configuration loading and validation for Context Guard.
 *
 * <p>
 * Configuration is defined in YAML and loaded by
 * {@link com.contextguard.core.config.GuardConfigLoader} into a
 * {@link com.contextguard.core.config.GuardConfig} instance. Validation
 * is performed automatically after parsing to ensure fail-fast behaviour.
 * </p>
 *
 * @since 1.0.0
 */
package com.contextguard.core.config;
