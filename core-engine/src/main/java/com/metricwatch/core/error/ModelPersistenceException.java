package com.metricwatch.core.error;

/**
 * Thrown when a model artifact cannot be written, read, or does not match the
 * expected format, version or algorithm.
 *
 * @since 1.0.0
 */
public class ModelPersistenceException extends MetricWatchException {

    private static final long serialVersionUID = 1L;

    public ModelPersistenceException(String message) {
        super(message);
    }

    public ModelPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
