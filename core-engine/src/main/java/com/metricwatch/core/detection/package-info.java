/**
 * Statistical anomaly detectors.
 *
 * <ul>
 * <li>{@link com.metricwatch.core.detection.StreamingZScoreDetector} - z-score
 * of each new value against a rolling per-metric window</li>
 * <li>{@link com.metricwatch.core.detection.BaselineZScoreDetector} - z-score
 * against a baseline fitted once on history</li>
 * <li>{@link com.metricwatch.core.detection.IqrDetector} - Tukey fences over an
 * arbitrary array</li>
 * </ul>
 *
 * <p>
 * The model-based detector lives in
 * {@link com.metricwatch.core.detection.ml}.
 * </p>
 *
 * @since 1.0.0
 */
package com.metricwatch.core.detection;
