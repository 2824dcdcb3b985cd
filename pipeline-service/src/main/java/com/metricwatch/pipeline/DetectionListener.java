package com.metricwatch.pipeline;

import com.metricwatch.core.model.DetectionResult;

/**
 * Receives every detection result the pipeline produces: streaming results
 * on the consumer thread, ML results on a worker thread.
 *
 * <p>
 * Implementations must be thread-safe and should return quickly. Exceptions
 * are logged and counted but never stop the pipeline.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface DetectionListener {

    void onResult(DetectionResult result);
}
