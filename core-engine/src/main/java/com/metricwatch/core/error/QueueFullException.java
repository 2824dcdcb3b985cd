package com.metricwatch.core.error;

/**
 * Thrown by the ingestion pipeline when its bounded queue cannot accept
 * another point. The caller chooses whether to retry or drop.
 *
 * @since 1.0.0
 */
public class QueueFullException extends MetricWatchException {

    private static final long serialVersionUID = 1L;

    private final int capacity;

    public QueueFullException(int capacity) {
        super("Ingestion queue is full (capacity " + capacity + ")");
        this.capacity = capacity;
    }

    public int getCapacity() {
        return capacity;
    }
}
