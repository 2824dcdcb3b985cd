package com.metricwatch.core.error;

/**
 * Root of the Metric Watch failure taxonomy.
 *
 * <p>
 * Every subclass names one failure kind, so callers can tell detector-health
 * problems ({@link ModelNotFittedException}, {@link ModelFitException},
 * {@link ModelPersistenceException}) apart from ingestion backpressure
 * ({@link QueueFullException}).
 * </p>
 *
 * @since 1.0.0
 */
public class MetricWatchException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public MetricWatchException(String message) {
        super(message);
    }

    public MetricWatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
