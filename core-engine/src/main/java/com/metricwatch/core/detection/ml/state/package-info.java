/**
 * Plain state objects describing a fitted ML detector, written to and read
 * from JSON model artifacts.
 *
 * @since 1.0.0
 */
package com.metricwatch.core.detection.ml.state;
