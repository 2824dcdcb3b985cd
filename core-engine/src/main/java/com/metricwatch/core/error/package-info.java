/**
 * Exception types raised by the detection engine and ingestion pipeline.
 *
 * @since 1.0.0
 */
package com.metricwatch.core.error;
