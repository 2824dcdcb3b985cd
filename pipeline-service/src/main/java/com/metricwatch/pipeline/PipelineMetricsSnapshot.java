package com.metricwatch.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;

/**
 * Immutable point-in-time copy of the pipeline counters, served as JSON by
 * the health server's {@code /metrics} endpoint.
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "points_received", "points_processed", "points_dropped", "batches_flushed",
        "flush_failures", "errors", "anomalies_detected", "models_fitted", "buffer_size",
        "queue_size", "timestamp" })
public final class PipelineMetricsSnapshot {

    private final long pointsReceived;
    private final long pointsProcessed;
    private final long pointsDropped;
    private final long batchesFlushed;
    private final long flushFailures;
    private final long errors;
    private final long anomaliesDetected;
    private final long modelsFitted;
    private final int bufferSize;
    private final int queueSize;
    private final Instant timestamp;

    PipelineMetricsSnapshot(long pointsReceived, long pointsProcessed, long pointsDropped,
                            long batchesFlushed, long flushFailures, long errors,
                            long anomaliesDetected, long modelsFitted,
                            int bufferSize, int queueSize, Instant timestamp) {
        this.pointsReceived = pointsReceived;
        this.pointsProcessed = pointsProcessed;
        this.pointsDropped = pointsDropped;
        this.batchesFlushed = batchesFlushed;
        this.flushFailures = flushFailures;
        this.errors = errors;
        this.anomaliesDetected = anomaliesDetected;
        this.modelsFitted = modelsFitted;
        this.bufferSize = bufferSize;
        this.queueSize = queueSize;
        this.timestamp = timestamp;
    }

    @JsonProperty("points_received")
    public long getPointsReceived() {
        return pointsReceived;
    }

    @JsonProperty("points_processed")
    public long getPointsProcessed() {
        return pointsProcessed;
    }

    @JsonProperty("points_dropped")
    public long getPointsDropped() {
        return pointsDropped;
    }

    @JsonProperty("batches_flushed")
    public long getBatchesFlushed() {
        return batchesFlushed;
    }

    @JsonProperty("flush_failures")
    public long getFlushFailures() {
        return flushFailures;
    }

    @JsonProperty("errors")
    public long getErrors() {
        return errors;
    }

    @JsonProperty("anomalies_detected")
    public long getAnomaliesDetected() {
        return anomaliesDetected;
    }

    @JsonProperty("models_fitted")
    public long getModelsFitted() {
        return modelsFitted;
    }

    @JsonProperty("buffer_size")
    public int getBufferSize() {
        return bufferSize;
    }

    @JsonProperty("queue_size")
    public int getQueueSize() {
        return queueSize;
    }

    @JsonProperty("timestamp")
    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "PipelineMetricsSnapshot{" +
                "pointsReceived=" + pointsReceived +
                ", pointsProcessed=" + pointsProcessed +
                ", pointsDropped=" + pointsDropped +
                ", batchesFlushed=" + batchesFlushed +
                ", flushFailures=" + flushFailures +
                ", errors=" + errors +
                ", anomaliesDetected=" + anomaliesDetected +
                ", modelsFitted=" + modelsFitted +
                ", bufferSize=" + bufferSize +
                ", queueSize=" + queueSize +
                ", timestamp=" + timestamp +
                '}';
    }
}
