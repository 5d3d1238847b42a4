/**
 * Configuration loading and validation for the Quality Sentinel engine.
 *
 * <p>
 * The configuration is defined in YAML and loaded by
 * {@link com.qualitysentinel.core.config.ConfigLoader} into a
 * {@link com.qualitysentinel.core.config.DetectionConfig} instance. Validation
 * is performed automatically after parsing to ensure fail-fast behaviour.
 * </p>
 *
 * @since 1.0.0
 */
package com.qualitysentinel.core.config;
