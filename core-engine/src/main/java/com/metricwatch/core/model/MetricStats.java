package com.metricwatch.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Point-in-time aggregate statistics for one metric over the points currently
 * held in the ring buffer.
 *
 * @since 1.0.0
 */
public final class MetricStats implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String metricName;
    private final double min;
    private final double max;
    private final double sum;
    private final long count;
    private final Instant lastUpdate;

    public MetricStats(String metricName, double min, double max, double sum, long count,
            Instant lastUpdate) {
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        if (count <= 0) {
            throw new IllegalArgumentException("count must be > 0, got: " + count);
        }
        this.min = min;
        this.max = max;
        this.sum = sum;
        this.count = count;
        this.lastUpdate = lastUpdate;
    }

    public String getMetricName() {
        return metricName;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public double getSum() {
        return sum;
    }

    public long getCount() {
        return count;
    }

    public double getMean() {
        return sum / count;
    }

    public Instant getLastUpdate() {
        return lastUpdate;
    }

    @Override
    public String toString() {
        return "MetricStats{" +
                "metricName='" + metricName + '\'' +
                ", min=" + min +
                ", max=" + max +
                ", mean=" + getMean() +
                ", count=" + count +
                ", lastUpdate=" + lastUpdate +
                '}';
    }
}
