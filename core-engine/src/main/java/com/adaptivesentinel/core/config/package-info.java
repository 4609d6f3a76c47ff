/**
 * Configuration loading and validation for the threshold engine.
 *
 * <p>
 * Tuning is defined in YAML and loaded by
 * {@link com.adaptivesentinel.core.config.EngineConfigLoader} into an
 * {@link com.adaptivesentinel.core.config.EngineConfig} instance. Validation
 * is performed automatically after parsing to ensure fail-fast behaviour.
 * </p>
 *
 * @since 1.0.0
 */
package com.adaptivesentinel.core.config;
