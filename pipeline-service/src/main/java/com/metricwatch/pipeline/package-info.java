/**
 * Runtime service around the detection core: a bounded ingestion pipeline
 * with periodic flushing, a model training scheduler, JSON codecs, and a
 * health/metrics HTTP endpoint.
 *
 * <p>
 * Entry point: {@link com.metricwatch.pipeline.MetricWatchApplication}.
 * </p>
 */
package com.metricwatch.pipeline;
