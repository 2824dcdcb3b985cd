package com.metricwatch.core.error;

/**
 * Thrown when training input is empty, ragged or non-finite, or when the
 * underlying algorithm fails. The detector keeps its previous state.
 *
 * @since 1.0.0
 */
public class ModelFitException extends MetricWatchException {

    private static final long serialVersionUID = 1L;

    public ModelFitException(String message) {
        super(message);
    }

    public ModelFitException(String message, Throwable cause) {
        super(message, cause);
    }
}
