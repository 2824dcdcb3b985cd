package com.metricwatch.pipeline;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.IntSupplier;

/**
 * Micrometer meter definitions for the ingestion pipeline.
 *
 * <p>
 * The meters are registered once, when the pipeline is built, in whatever
 * {@link MeterRegistry} the embedding application supplies (a Prometheus
 * registry in production, a {@code SimpleMeterRegistry} otherwise).
 * </p>
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 * <li>{@code metricwatch.points.received} – points accepted by {@code submit}</li>
 * <li>{@code metricwatch.points.processed} – valid points buffered</li>
 * <li>{@code metricwatch.points.dropped} – points rejected by validation</li>
 * <li>{@code metricwatch.batches.flushed} – batches handed to storage</li>
 * <li>{@code metricwatch.flush.failures} – failed storage attempts</li>
 * <li>{@code metricwatch.errors} – every logged processing failure</li>
 * <li>{@code metricwatch.anomalies.detected} – anomalous results published</li>
 * <li>{@code metricwatch.models.fitted} – successful ML fits</li>
 * <li>{@code metricwatch.buffer.size} – gauge of points in the ring buffer</li>
 * <li>{@code metricwatch.queue.size} – gauge of points awaiting the consumer</li>
 * <li>{@code metricwatch.processing.latency} – timer of per-point work</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class PipelineMetrics {

    private static final String PREFIX = "metricwatch.";

    private final Clock clock;
    private final IntSupplier bufferSize;
    private final IntSupplier queueSize;

    private final Counter pointsReceived;
    private final Counter pointsProcessed;
    private final Counter pointsDropped;
    private final Counter batchesFlushed;
    private final Counter flushFailures;
    private final Counter errors;
    private final Counter anomaliesDetected;
    private final Counter modelsFitted;
    private final Timer processingLatency;

    /**
     * @param registry   registry the meters are bound to
     * @param bufferSize current ring-buffer occupancy
     * @param queueSize  current ingestion-queue depth
     * @param clock      time source for snapshots
     */
    public PipelineMetrics(MeterRegistry registry, IntSupplier bufferSize, IntSupplier queueSize, Clock clock) {
        Objects.requireNonNull(registry, "MeterRegistry must not be null");
        this.bufferSize = Objects.requireNonNull(bufferSize, "bufferSize must not be null");
        this.queueSize = Objects.requireNonNull(queueSize, "queueSize must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");

        this.pointsReceived = counter(registry, "points.received", "Points accepted into the ingestion queue");
        this.pointsProcessed = counter(registry, "points.processed", "Valid points appended to the buffer");
        this.pointsDropped = counter(registry, "points.dropped", "Points rejected by validation");
        this.batchesFlushed = counter(registry, "batches.flushed", "Batches handed to storage");
        this.flushFailures = counter(registry, "flush.failures", "Failed storage attempts");
        this.errors = counter(registry, "errors", "Processing failures of any kind");
        this.anomaliesDetected = counter(registry, "anomalies.detected", "Anomalous detection results");
        this.modelsFitted = counter(registry, "models.fitted", "Successful ML model fits");

        Gauge.builder(PREFIX + "buffer.size", bufferSize, s -> s.getAsInt())
                .description("Points currently held in the ring buffer")
                .register(registry);
        Gauge.builder(PREFIX + "queue.size", queueSize, s -> s.getAsInt())
                .description("Points waiting for the consumer")
                .register(registry);

        this.processingLatency = Timer.builder(PREFIX + "processing.latency")
                .description("Time to buffer, score and publish one point")
                .register(registry);
    }

    private static Counter counter(MeterRegistry registry, String name, String description) {
        return Counter.builder(PREFIX + name)
                .description(description)
                .register(registry);
    }

    public void pointReceived() {
        pointsReceived.increment();
    }

    public void pointProcessed() {
        pointsProcessed.increment();
    }

    public void pointDropped() {
        pointsDropped.increment();
    }

    public void batchFlushed() {
        batchesFlushed.increment();
    }

    /**
     * Count a failed storage attempt; also counted as an error.
     */
    public void flushFailed() {
        flushFailures.increment();
        errors.increment();
    }

    public void error() {
        errors.increment();
    }

    public void anomalyDetected() {
        anomaliesDetected.increment();
    }

    public void modelFitted() {
        modelsFitted.increment();
    }

    public void recordLatency(long nanos) {
        processingLatency.record(nanos, TimeUnit.NANOSECONDS);
    }

    /**
     * @return a consistent-enough view of every meter; each value is read
     *         once, without a global lock
     */
    public PipelineMetricsSnapshot snapshot() {
        return new PipelineMetricsSnapshot(
                (long) pointsReceived.count(),
                (long) pointsProcessed.count(),
                (long) pointsDropped.count(),
                (long) batchesFlushed.count(),
                (long) flushFailures.count(),
                (long) errors.count(),
                (long) anomaliesDetected.count(),
                (long) modelsFitted.count(),
                bufferSize.getAsInt(),
                queueSize.getAsInt(),
                clock.instant());
    }
}
