package com.metricwatch.pipeline;

import com.metricwatch.core.buffer.MetricRingBuffer;
import com.metricwatch.core.error.QueueFullException;
import com.metricwatch.core.model.DataPoint;
import com.metricwatch.core.model.DetectionResult;
import com.metricwatch.core.model.MetricStats;
import com.metricwatch.core.registry.DetectorRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bounded ingestion front end: queue, validating consumer, ring buffer and
 * periodic flush.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   submit(DataPoint)                      (producer threads, never blocks)
 *     → bounded queue                      (full → QueueFullException)
 *     → consumer thread                    (1 s poll, checks running flag)
 *         → validate                       (invalid → dropped + counted)
 *         → MetricRingBuffer.add
 *         → StreamingZScoreDetector.observe
 *         → DetectionListener.onResult
 *   flush thread, every flushInterval
 *     → MetricRingBuffer.pendingFlush → MetricStorage.store → markFlushed
 * </pre>
 *
 * <h3>Flushing</h3>
 * <p>
 * Flushing never removes points from the buffer; it only advances a
 * watermark once storage accepts a batch. A failed batch is retried in full
 * on the next interval. Points evicted from the buffer before they were
 * flushed are lost.
 * </p>
 *
 * <h3>Lifecycle</h3>
 * <p>
 * {@link #start()} is idempotent. {@link #stop()} signals the consumer, waits
 * for it to drain what is already queued, stops the flush thread and makes a
 * final flush attempt. A stopped pipeline cannot be restarted.
 * </p>
 *
 * @since 1.0.0
 */
public class IngestionPipeline implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(IngestionPipeline.class);

    private static final long SHUTDOWN_TIMEOUT_MS = 10_000;

    private final PipelineConfig config;
    private final DetectorRegistry registry;
    private final MetricStorage storage;
    private final BlockingQueue<DataPoint> queue;
    private final MetricRingBuffer buffer;
    private final PipelineMetrics metrics;
    private final List<DetectionListener> listeners = new CopyOnWriteArrayList<>();

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final ReentrantLock flushLock = new ReentrantLock();
    // Read side: check-and-offer in submit. Write side: stop() raising the flag.
    private final ReentrantReadWriteLock submitLock = new ReentrantReadWriteLock();

    private Thread consumer;
    private ScheduledExecutorService flushExecutor;

    public IngestionPipeline(PipelineConfig config, DetectorRegistry registry, MetricStorage storage) {
        this(config, registry, storage, new SimpleMeterRegistry(), Clock.systemUTC());
    }

    /**
     * @param config        queue, buffer and flush settings
     * @param registry      detectors; its streaming detector scores every point
     * @param storage       destination for flushed batches
     * @param meterRegistry registry the pipeline meters are bound to
     * @param clock         time source for the buffer and metric snapshots
     */
    public IngestionPipeline(PipelineConfig config, DetectorRegistry registry, MetricStorage storage,
                             MeterRegistry meterRegistry, Clock clock) {
        this.config = Objects.requireNonNull(config, "PipelineConfig must not be null");
        this.registry = Objects.requireNonNull(registry, "DetectorRegistry must not be null");
        this.storage = Objects.requireNonNull(storage, "MetricStorage must not be null");
        Objects.requireNonNull(meterRegistry, "MeterRegistry must not be null");
        Objects.requireNonNull(clock, "clock must not be null");

        this.queue = new LinkedBlockingQueue<>(config.getQueueCapacity());
        this.buffer = new MetricRingBuffer(config.getBufferMaxSize(), clock);
        this.metrics = new PipelineMetrics(meterRegistry, buffer::size, queue::size, clock);
    }

    // ---------------------------------------------------------------
    // Submission
    // ---------------------------------------------------------------

    /**
     * Queue a point for processing. Never blocks.
     *
     * @param point data point; validated later by the consumer
     * @throws QueueFullException if the queue is at capacity
     */
    public void submit(DataPoint point) {
        Objects.requireNonNull(point, "DataPoint must not be null");
        submitLock.readLock().lock();
        try {
            if (stopped.get()) {
                throw new IllegalStateException("Pipeline has been stopped");
            }
            if (!queue.offer(point)) {
                LOG.debug("Ingestion queue full ({}), rejecting point for [{}]",
                        config.getQueueCapacity(), point.getMetricName());
                throw new QueueFullException(config.getQueueCapacity());
            }
            metrics.pointReceived();
        } finally {
            submitLock.readLock().unlock();
        }
    }

    /**
     * Queue points in order, stopping at the first rejection.
     *
     * @param points data points
     * @throws QueueFullException if the queue fills up; earlier points remain
     *                            queued
     */
    public void submitAll(List<DataPoint> points) {
        Objects.requireNonNull(points, "points must not be null");
        for (DataPoint point : points) {
            submit(point);
        }
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    /**
     * @param metricName metric filter, or {@code null} for every metric
     * @param duration   look-back period
     * @return buffered points with a timestamp at or after {@code now - duration}
     */
    public List<DataPoint> getRecent(String metricName, Duration duration) {
        return buffer.getRecent(metricName, duration);
    }

    public List<DataPoint> getRecent(Duration duration) {
        return buffer.getRecent(null, duration);
    }

    public Optional<MetricStats> getStats(String metricName) {
        return buffer.getStats(metricName);
    }

    /**
     * @return current counter values
     */
    public PipelineMetricsSnapshot metrics() {
        return metrics.snapshot();
    }

    public MetricRingBuffer getBuffer() {
        return buffer;
    }

    public DetectorRegistry getRegistry() {
        return registry;
    }

    PipelineMetrics getPipelineMetrics() {
        return metrics;
    }

    // ---------------------------------------------------------------
    // Listeners
    // ---------------------------------------------------------------

    public void addListener(DetectionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public void removeListener(DetectionListener listener) {
        listeners.remove(listener);
    }

    /**
     * Deliver a result to every listener, isolating listener failures.
     */
    void publish(DetectionResult result) {
        if (result.isAnomaly()) {
            metrics.anomalyDetected();
        }
        for (DetectionListener listener : listeners) {
            try {
                listener.onResult(result);
            } catch (RuntimeException e) {
                metrics.error();
                LOG.warn("Detection listener {} failed for [{}]: {}",
                        listener, result.getMetricName(), e.getMessage(), e);
            }
        }
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Start the consumer and flush threads. Calling it again is a no-op.
     *
     * @throws IllegalStateException if the pipeline was already stopped
     */
    public void start() {
        if (stopped.get()) {
            throw new IllegalStateException("A stopped pipeline cannot be restarted");
        }
        if (!running.compareAndSet(false, true)) {
            return;
        }

        consumer = new Thread(this::consumeLoop, "metric-ingest-consumer");
        consumer.setDaemon(true);
        consumer.start();

        flushExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "metric-flush");
            t.setDaemon(true);
            return t;
        });
        long interval = config.getFlushIntervalMs();
        flushExecutor.scheduleAtFixedRate(this::scheduledFlush, interval, interval, TimeUnit.MILLISECONDS);

        LOG.info("Ingestion pipeline started (queue={}, buffer={}, flushInterval={} ms)",
                config.getQueueCapacity(), config.getBufferMaxSize(), interval);
    }

    /**
     * Stop accepting work, drain the queue, stop the flush thread and run a
     * final flush.
     */
    public void stop() {
        // Once the write lock is released no submit can enqueue, so the drain
        // below sees every accepted point
        submitLock.writeLock().lock();
        try {
            if (!stopped.compareAndSet(false, true)) {
                return;
            }
        } finally {
            submitLock.writeLock().unlock();
        }
        if (!running.getAndSet(false)) {
            // Never started: process what was queued on this thread, then flush
            drainQueue();
            flush();
            return;
        }

        try {
            consumer.join(config.getPollTimeoutMs() + SHUTDOWN_TIMEOUT_MS);
            if (consumer.isAlive()) {
                LOG.warn("Consumer did not stop within timeout, interrupting");
                consumer.interrupt();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            consumer.interrupt();
        }

        flushExecutor.shutdown();
        try {
            if (!flushExecutor.awaitTermination(SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                flushExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            flushExecutor.shutdownNow();
        }

        boolean flushed = flush();
        LOG.info("Ingestion pipeline stopped (final flush {}): {}",
                flushed ? "succeeded" : "failed", metrics.snapshot());
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running.get();
    }

    // ---------------------------------------------------------------
    // Consumer
    // ---------------------------------------------------------------

    private void consumeLoop() {
        LOG.debug("Consumer thread started");
        try {
            while (running.get()) {
                DataPoint point = queue.poll(config.getPollTimeoutMs(), TimeUnit.MILLISECONDS);
                if (point != null) {
                    process(point);
                }
            }
            drainQueue();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Consumer thread interrupted with {} point(s) still queued", queue.size());
        }
        LOG.debug("Consumer thread exited");
    }

    private void drainQueue() {
        List<DataPoint> remaining = new ArrayList<>();
        queue.drainTo(remaining);
        if (!remaining.isEmpty()) {
            LOG.info("Draining {} queued point(s) before shutdown", remaining.size());
        }
        for (DataPoint point : remaining) {
            process(point);
        }
    }

    private void process(DataPoint point) {
        if (!point.isValid()) {
            metrics.pointDropped();
            LOG.debug("Dropping invalid point: {}", point);
            return;
        }

        long start = System.nanoTime();
        DetectionResult result;
        try {
            buffer.add(point);
            metrics.pointProcessed();
            result = registry.streamingDetector()
                    .observe(point.getMetricName(), point.getValue(), point.getTimestamp());
        } catch (RuntimeException e) {
            metrics.error();
            LOG.error("Failed to process point for [{}]: {}", point.getMetricName(), e.getMessage(), e);
            return;
        }
        publish(result);
        metrics.recordLatency(System.nanoTime() - start);
    }

    // ---------------------------------------------------------------
    // Flush
    // ---------------------------------------------------------------

    private void scheduledFlush() {
        try {
            flush();
        } catch (RuntimeException e) {
            // An exception escaping this method cancels the schedule
            metrics.error();
            LOG.error("Unexpected flush error: {}", e.getMessage(), e);
        }
    }

    /**
     * Hand every unflushed buffered point to storage.
     *
     * @return {@code true} if nothing was pending or storage accepted the
     *         batch; {@code false} if storage failed and the batch stays
     *         pending
     */
    public boolean flush() {
        flushLock.lock();
        try {
            Optional<MetricRingBuffer.FlushBatch> pending = buffer.pendingFlush();
            if (pending.isEmpty()) {
                return true;
            }
            MetricRingBuffer.FlushBatch batch = pending.get();
            try {
                storage.store(batch.points());
            } catch (IOException | RuntimeException e) {
                metrics.flushFailed();
                LOG.error("Flush of {} point(s) failed, will retry in {} ms: {}",
                        batch.size(), config.getFlushIntervalMs(), e.getMessage(), e);
                return false;
            }
            buffer.markFlushed(batch);
            metrics.batchFlushed();
            LOG.debug("Flushed {} point(s) through sequence {}", batch.size(), batch.lastSequence());
            return true;
        } finally {
            flushLock.unlock();
        }
    }
}
