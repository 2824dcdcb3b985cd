/**
 * Batch machine-learning detection.
 *
 * <p>
 * {@link com.metricwatch.core.detection.ml.MlAnomalyDetector} is the only
 * entry point; the model implementations and their persistence mapping are
 * package-private. Fitted models are saved as JSON
 * {@link com.metricwatch.core.detection.ml.state.ModelState} artifacts.
 * </p>
 *
 * @since 1.0.0
 */
package com.metricwatch.core.detection.ml;
