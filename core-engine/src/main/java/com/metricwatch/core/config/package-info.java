/**
 * Configuration loading and validation for the Metric Watch detectors.
 *
 * <p>
 * Detector tuning is defined in YAML and loaded by
 * {@link com.metricwatch.core.config.DetectionConfigLoader} into a
 * {@link com.metricwatch.core.config.DetectionConfig} instance. Validation is
 * performed automatically after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.metricwatch.core.config;
