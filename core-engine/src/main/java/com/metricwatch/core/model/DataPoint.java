package com.metricwatch.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single metric sample produced by a collector.
 *
 * <p>
 * Instances are immutable once created. The tag map is copied on construction
 * and exposed as an unmodifiable view, so neither the producer nor any
 * consumer can alter a point after it has been submitted.
 * </p>
 *
 * <p>
 * Construction does <strong>not</strong> validate the sample: malformed points
 * (blank metric name, non-finite value, missing timestamp) are representable so
 * that the ingestion pipeline can count and drop them. See {@link #isValid()}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class DataPoint implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant timestamp;
    private final String metricName;
    private final double value;
    private final String host;
    private final Map<String, String> tags;

    /**
     * @param timestamp  observation time
     * @param metricName metric key, e.g. {@code cpu_usage}
     * @param value      observed value
     * @param host       originating host; may be {@code null}
     * @param tags       free-form labels; {@code null} is treated as empty
     */
    @JsonCreator
    public DataPoint(@JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("metricName") String metricName,
            @JsonProperty("value") double value,
            @JsonProperty("host") String host,
            @JsonProperty("tags") Map<String, String> tags) {
        this.timestamp = timestamp;
        this.metricName = metricName;
        this.value = value;
        this.host = host;
        this.tags = tags != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(tags))
                : Collections.emptyMap();
    }

    /**
     * Convenience factory for an untagged point stamped with the current time.
     *
     * @param metricName metric key
     * @param value      observed value
     * @param host       originating host
     * @return a new data point
     */
    public static DataPoint of(String metricName, double value, String host) {
        return new DataPoint(Instant.now(), metricName, value, host, null);
    }

    /**
     * Convenience factory for an untagged point with an explicit timestamp.
     *
     * @param timestamp  observation time
     * @param metricName metric key
     * @param value      observed value
     * @return a new data point with no host
     */
    public static DataPoint of(Instant timestamp, String metricName, double value) {
        return new DataPoint(timestamp, metricName, value, null, null);
    }

    /**
     * A point is valid when it has a timestamp, a non-blank metric name and a
     * finite value.
     *
     * @return {@code true} if the point may be buffered
     */
    @JsonIgnore
    public boolean isValid() {
        return timestamp != null
                && metricName != null
                && !metricName.isBlank()
                && Double.isFinite(value);
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getMetricName() {
        return metricName;
    }

    public double getValue() {
        return value;
    }

    public String getHost() {
        return host;
    }

    /**
     * @return unmodifiable tag map, never {@code null}
     */
    public Map<String, String> getTags() {
        return tags;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DataPoint that))
            return false;
        return Double.compare(value, that.value) == 0
                && Objects.equals(timestamp, that.timestamp)
                && Objects.equals(metricName, that.metricName)
                && Objects.equals(host, that.host)
                && Objects.equals(tags, that.tags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, metricName, value, host, tags);
    }

    @Override
    public String toString() {
        return "DataPoint{" +
                "timestamp=" + timestamp +
                ", metricName='" + metricName + '\'' +
                ", value=" + value +
                ", host='" + host + '\'' +
                ", tags=" + tags +
                '}';
    }
}
