package com.metricwatch.core.buffer;

import com.metricwatch.core.model.MetricStats;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Sliding-window aggregate for one metric.
 *
 * <p>
 * {@code min} and {@code max} are tracked with monotonic deques, so removing
 * the oldest value is O(1) amortized and never leaves a stale extreme behind.
 * Values must be removed in the order they were added.
 * </p>
 *
 * <p>
 * Not thread-safe; guarded by the owning {@link MetricRingBuffer}.
 * </p>
 */
final class MetricAggregate {

    private final String metricName;

    /** Non-decreasing from head to tail. */
    private final Deque<Double> minCandidates = new ArrayDeque<>();

    /** Non-increasing from head to tail. */
    private final Deque<Double> maxCandidates = new ArrayDeque<>();

    private double sum;
    private long count;
    private Instant lastUpdate;

    MetricAggregate(String metricName) {
        this.metricName = metricName;
    }

    void add(double value, Instant timestamp) {
        while (!minCandidates.isEmpty() && minCandidates.peekLast() > value) {
            minCandidates.pollLast();
        }
        minCandidates.addLast(value);

        while (!maxCandidates.isEmpty() && maxCandidates.peekLast() < value) {
            maxCandidates.pollLast();
        }
        maxCandidates.addLast(value);

        sum += value;
        count++;
        if (lastUpdate == null || !timestamp.isBefore(lastUpdate)) {
            lastUpdate = timestamp;
        }
    }

    /**
     * Remove the oldest value still counted by this aggregate.
     *
     * @param value the evicted value
     */
    void removeOldest(double value) {
        if (!minCandidates.isEmpty() && Double.compare(minCandidates.peekFirst(), value) == 0) {
            minCandidates.pollFirst();
        }
        if (!maxCandidates.isEmpty() && Double.compare(maxCandidates.peekFirst(), value) == 0) {
            maxCandidates.pollFirst();
        }
        count--;
        sum = count == 0 ? 0.0 : sum - value;
    }

    boolean isEmpty() {
        return count == 0;
    }

    MetricStats snapshot() {
        return new MetricStats(metricName, minCandidates.peekFirst(), maxCandidates.peekFirst(),
                sum, count, lastUpdate);
    }
}
