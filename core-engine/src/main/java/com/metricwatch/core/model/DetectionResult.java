package com.metricwatch.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of scoring one value with one detector.
 *
 * <p>
 * Produced fresh for every detection call and never mutated afterwards. The
 * alerting layer decides what to do with it based on {@link #isAnomaly()} and
 * {@link #getSeverity()}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code metricName}, {@code detector} and
 * {@code timestamp} are required; omitting any of them throws a
 * {@link NullPointerException} at build time. The score is clamped into
 * [0, 1]; a NaN score is rejected with an {@link IllegalArgumentException}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonDeserialize(builder = DetectionResult.Builder.class)
public final class DetectionResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String metricName;
    private final double value;
    private final boolean anomaly;
    private final double score;
    private final Severity severity;
    private final double mean;
    private final double stdDev;
    private final double threshold;
    private final double zScore;
    private final DetectionStatus status;
    private final String detector;
    private final Instant timestamp;

    private DetectionResult(Builder builder) {
        this.metricName = Objects.requireNonNull(builder.metricName, "metricName must not be null");
        this.detector = Objects.requireNonNull(builder.detector, "detector must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        if (Double.isNaN(builder.score)) {
            throw new IllegalArgumentException("score must not be NaN");
        }
        this.value = builder.value;
        this.anomaly = builder.anomaly;
        this.score = Math.max(0.0, Math.min(1.0, builder.score));
        this.severity = builder.severity != null ? builder.severity : Severity.LOW;
        this.mean = builder.mean;
        this.stdDev = builder.stdDev;
        this.threshold = builder.threshold;
        this.zScore = builder.zScore;
        this.status = builder.status != null ? builder.status : DetectionStatus.EVALUATED;
    }

    /**
     * Create a new {@link Builder}.
     *
     * @return builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link DetectionResult} instances.
     */
    @JsonPOJOBuilder(withPrefix = "")
    public static class Builder {
        private String metricName;
        private double value;
        private boolean anomaly;
        private double score;
        private Severity severity;
        private double mean;
        private double stdDev;
        private double threshold;
        private double zScore;
        private DetectionStatus status;
        private String detector;
        private Instant timestamp;

        public Builder metricName(String metricName) {
            this.metricName = metricName;
            return this;
        }

        public Builder value(double value) {
            this.value = value;
            return this;
        }

        public Builder anomaly(boolean anomaly) {
            this.anomaly = anomaly;
            return this;
        }

        public Builder score(double score) {
            this.score = score;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder mean(double mean) {
            this.mean = mean;
            return this;
        }

        public Builder stdDev(double stdDev) {
            this.stdDev = stdDev;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        @JsonProperty("zScore")
        public Builder zScore(double zScore) {
            this.zScore = zScore;
            return this;
        }

        public Builder status(DetectionStatus status) {
            this.status = status;
            return this;
        }

        public Builder detector(String detector) {
            this.detector = detector;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        /**
         * Build the result.
         *
         * @return a new {@link DetectionResult}
         * @throws NullPointerException if {@code metricName}, {@code detector} or
         *                              {@code timestamp} is {@code null}
         */
        public DetectionResult build() {
            return new DetectionResult(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getMetricName() {
        return metricName;
    }

    public double getValue() {
        return value;
    }

    @JsonProperty("anomaly")
    public boolean isAnomaly() {
        return anomaly;
    }

    /**
     * @return normalized anomaly confidence in [0, 1]
     */
    public double getScore() {
        return score;
    }

    public Severity getSeverity() {
        return severity;
    }

    public double getMean() {
        return mean;
    }

    public double getStdDev() {
        return stdDev;
    }

    /**
     * @return value boundary reported for display; its meaning depends on the
     *         detector (e.g. {@code mean + 2σ} for the streaming detector)
     */
    public double getThreshold() {
        return threshold;
    }

    @JsonProperty("zScore")
    public double getZScore() {
        return zScore;
    }

    public DetectionStatus getStatus() {
        return status;
    }

    /**
     * @return name of the detector that produced this result
     */
    public String getDetector() {
        return detector;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectionResult that))
            return false;
        return Double.compare(value, that.value) == 0
                && anomaly == that.anomaly
                && Double.compare(score, that.score) == 0
                && Objects.equals(metricName, that.metricName)
                && Objects.equals(detector, that.detector)
                && Objects.equals(timestamp, that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metricName, value, anomaly, score, detector, timestamp);
    }

    @Override
    public String toString() {
        return "DetectionResult{" +
                "metricName='" + metricName + '\'' +
                ", value=" + value +
                ", anomaly=" + anomaly +
                ", score=" + score +
                ", severity=" + severity +
                ", zScore=" + zScore +
                ", status=" + status +
                ", detector='" + detector + '\'' +
                ", timestamp=" + timestamp +
                '}';
    }
}
