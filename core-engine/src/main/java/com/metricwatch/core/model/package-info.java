/**
 * Domain model classes for Metric Watch.
 *
 * <p>
 * This package contains the values exchanged between the ingestion pipeline,
 * the detectors and the alerting collaborators:
 * </p>
 * <ul>
 * <li>{@link com.metricwatch.core.model.DataPoint} - one metric sample</li>
 * <li>{@link com.metricwatch.core.model.DetectionResult} - outcome of scoring a
 * value</li>
 * <li>{@link com.metricwatch.core.model.MetricStats} - sliding-window
 * aggregates for one metric</li>
 * <li>{@link com.metricwatch.core.model.Severity} - alert tier</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.metricwatch.core.model;
