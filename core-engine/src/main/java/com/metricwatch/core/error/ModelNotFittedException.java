package com.metricwatch.core.error;

/**
 * Thrown when a detector is asked to score before it has been fitted.
 *
 * @since 1.0.0
 */
public class ModelNotFittedException extends MetricWatchException {

    private static final long serialVersionUID = 1L;

    public ModelNotFittedException(String message) {
        super(message);
    }
}
