package com.metricwatch.core.buffer;

import com.metricwatch.core.model.DataPoint;
import com.metricwatch.core.model.MetricStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed-capacity FIFO window of recent {@link DataPoint}s across all metrics,
 * with per-metric aggregate statistics.
 *
 * <p>
 * Once {@code maxSize} points are held, each new point evicts the oldest one.
 * The per-metric aggregates ({@code min}, {@code max}, {@code sum},
 * {@code count}) always describe exactly the points still inside the window;
 * a metric whose last point is evicted disappears from {@link #getStats}.
 * </p>
 *
 * <h3>Flush tracking</h3>
 * <p>
 * Every accepted point receives a sequence number. {@link #pendingFlush()}
 * returns the points newer than the last acknowledged flush, and
 * {@link #markFlushed(FlushBatch)} advances the watermark. Flushing never
 * removes points from the window.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * All reads and writes take a single {@link ReentrantLock}.
 * </p>
 *
 * @since 1.0.0
 */
public class MetricRingBuffer {

    private static final Logger LOG = LoggerFactory.getLogger(MetricRingBuffer.class);

    /** Default number of points held. */
    public static final int DEFAULT_MAX_SIZE = 10_000;

    private final int maxSize;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private final Deque<Entry> entries = new ArrayDeque<>();
    private final Map<String, MetricAggregate> aggregates = new LinkedHashMap<>();

    private long nextSequence = 1;
    private long flushedThrough;
    private long evictedUnflushed;

    public MetricRingBuffer() {
        this(DEFAULT_MAX_SIZE);
    }

    public MetricRingBuffer(int maxSize) {
        this(maxSize, Clock.systemUTC());
    }

    /**
     * @param maxSize maximum number of points held; must be &gt; 0
     * @param clock   time source for {@link #getRecent}
     * @throws IllegalArgumentException if {@code maxSize} is not positive
     */
    public MetricRingBuffer(int maxSize, Clock clock) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be >= 1, got: " + maxSize);
        }
        this.maxSize = maxSize;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // ---------------------------------------------------------------
    // Writes
    // ---------------------------------------------------------------

    /**
     * Append a point, evicting the oldest point if the buffer is full.
     *
     * @param point a valid data point
     * @throws IllegalArgumentException if the point is not
     *                                  {@linkplain DataPoint#isValid() valid}
     */
    public void add(DataPoint point) {
        Objects.requireNonNull(point, "DataPoint must not be null");
        if (!point.isValid()) {
            throw new IllegalArgumentException("Refusing to buffer invalid point: " + point);
        }
        lock.lock();
        try {
            if (entries.size() == maxSize) {
                evictOldest();
            }
            entries.addLast(new Entry(nextSequence++, point));
            aggregates.computeIfAbsent(point.getMetricName(), MetricAggregate::new)
                    .add(point.getValue(), point.getTimestamp());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Append every point in iteration order.
     *
     * @param points valid data points
     */
    public void addAll(Collection<DataPoint> points) {
        Objects.requireNonNull(points, "points must not be null");
        lock.lock();
        try {
            for (DataPoint point : points) {
                add(point);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop every point and aggregate. The flush watermark moves to the current
     * sequence so nothing cleared is reported as pending.
     */
    public void clear() {
        lock.lock();
        try {
            entries.clear();
            aggregates.clear();
            flushedThrough = nextSequence - 1;
        } finally {
            lock.unlock();
        }
    }

    private void evictOldest() {
        Entry evicted = entries.pollFirst();
        DataPoint point = evicted.point;
        MetricAggregate aggregate = aggregates.get(point.getMetricName());
        aggregate.removeOldest(point.getValue());
        if (aggregate.isEmpty()) {
            aggregates.remove(point.getMetricName());
        }
        if (evicted.sequence > flushedThrough) {
            evictedUnflushed++;
            LOG.trace("Evicted unflushed point seq={} metric={}", evicted.sequence, point.getMetricName());
        }
    }

    // ---------------------------------------------------------------
    // Reads
    // ---------------------------------------------------------------

    /**
     * Return buffered points whose timestamp is within {@code duration} of now.
     *
     * @param metricName optional metric filter; {@code null} for all metrics
     * @param duration   look-back period
     * @return points in insertion order
     */
    public List<DataPoint> getRecent(String metricName, Duration duration) {
        Objects.requireNonNull(duration, "duration must not be null");
        Instant cutoff = clock.instant().minus(duration);
        lock.lock();
        try {
            List<DataPoint> result = new ArrayList<>();
            for (Entry entry : entries) {
                DataPoint point = entry.point;
                if (metricName != null && !metricName.equals(point.getMetricName())) {
                    continue;
                }
                if (!point.getTimestamp().isBefore(cutoff)) {
                    result.add(point);
                }
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @param metricName metric key
     * @return aggregates for the metric, or empty if it has no buffered points
     */
    public Optional<MetricStats> getStats(String metricName) {
        lock.lock();
        try {
            MetricAggregate aggregate = aggregates.get(metricName);
            return aggregate == null ? Optional.empty() : Optional.of(aggregate.snapshot());
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return aggregates for every metric currently buffered
     */
    public Map<String, MetricStats> allStats() {
        lock.lock();
        try {
            Map<String, MetricStats> result = new LinkedHashMap<>();
            aggregates.forEach((name, aggregate) -> result.put(name, aggregate.snapshot()));
            return Collections.unmodifiableMap(result);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return names of all metrics with at least one buffered point
     */
    public Set<String> metricNames() {
        lock.lock();
        try {
            return Collections.unmodifiableSet(new LinkedHashSet<>(aggregates.keySet()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * @param metricName metric key
     * @return buffered values for the metric, oldest first
     */
    public double[] values(String metricName) {
        Objects.requireNonNull(metricName, "metricName must not be null");
        lock.lock();
        try {
            return entries.stream()
                    .filter(e -> metricName.equals(e.point.getMetricName()))
                    .mapToDouble(e -> e.point.getValue())
                    .toArray();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Buffered values for one metric as a single-feature matrix, the shape the
     * ML detector trains on.
     *
     * @param metricName metric key
     * @return {@code n × 1} matrix, oldest first
     */
    public double[][] toMatrix(String metricName) {
        double[] values = values(metricName);
        double[][] matrix = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            matrix[i] = new double[] { values[i] };
        }
        return matrix;
    }

    /**
     * @return every buffered point, oldest first
     */
    public List<DataPoint> snapshot() {
        lock.lock();
        try {
            List<DataPoint> result = new ArrayList<>(entries.size());
            for (Entry entry : entries) {
                result.add(entry.point);
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return maxSize;
    }

    // ---------------------------------------------------------------
    // Flush tracking
    // ---------------------------------------------------------------

    /**
     * @return points not yet acknowledged by {@link #markFlushed}, or empty if
     *         there are none
     */
    public Optional<FlushBatch> pendingFlush() {
        lock.lock();
        try {
            List<DataPoint> pending = new ArrayList<>();
            long last = flushedThrough;
            for (Entry entry : entries) {
                if (entry.sequence > flushedThrough) {
                    pending.add(entry.point);
                    last = entry.sequence;
                }
            }
            return pending.isEmpty()
                    ? Optional.empty()
                    : Optional.of(new FlushBatch(Collections.unmodifiableList(pending), last));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Acknowledge that a batch reached storage.
     *
     * @param batch batch returned by {@link #pendingFlush()}
     */
    public void markFlushed(FlushBatch batch) {
        Objects.requireNonNull(batch, "batch must not be null");
        lock.lock();
        try {
            flushedThrough = Math.max(flushedThrough, batch.lastSequence());
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return number of points evicted before they were flushed
     */
    public long evictedUnflushed() {
        lock.lock();
        try {
            return evictedUnflushed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ordered points awaiting storage, up to and including
     * {@link #lastSequence()}.
     */
    public static final class FlushBatch {
        private final List<DataPoint> points;
        private final long lastSequence;

        FlushBatch(List<DataPoint> points, long lastSequence) {
            this.points = points;
            this.lastSequence = lastSequence;
        }

        public List<DataPoint> points() {
            return points;
        }

        public long lastSequence() {
            return lastSequence;
        }

        public int size() {
            return points.size();
        }
    }

    private static final class Entry {
        private final long sequence;
        private final DataPoint point;

        private Entry(long sequence, DataPoint point) {
            this.sequence = sequence;
            this.point = point;
        }
    }
}
