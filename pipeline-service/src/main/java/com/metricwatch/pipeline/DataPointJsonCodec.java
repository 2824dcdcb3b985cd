package com.metricwatch.pipeline;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.metricwatch.core.model.DataPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * Converts JSON text to {@link DataPoint} and back.
 *
 * <pre>
 * {"timestamp":"2024-05-01T12:00:00Z","metricName":"cpu","value":42.5,
 *  "host":"web-1","tags":{"dc":"eu"}}
 * </pre>
 *
 * <p>
 * {@code metricName} and a numeric {@code value} are required. A missing
 * {@code timestamp} is filled with the ingestion time. Malformed records are
 * logged and dropped (an empty result), so a single bad record does not
 * stop the input loop.
 * </p>
 */
public class DataPointJsonCodec {

    private static final Logger LOG = LoggerFactory.getLogger(DataPointJsonCodec.class);

    private final ObjectMapper mapper;
    private final Clock clock;

    public DataPointJsonCodec() {
        this(Clock.systemUTC());
    }

    public DataPointJsonCodec(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    public Optional<DataPoint> decode(byte[] message) {
        if (message == null || message.length == 0) {
            return Optional.empty();
        }
        return decode(new String(message, StandardCharsets.UTF_8));
    }

    /**
     * @param json one JSON object
     * @return the data point, or empty if the record is malformed
     */
    public Optional<DataPoint> decode(String json) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode node = mapper.readTree(json);
            if (node == null || !node.isObject()) {
                LOG.warn("Skipping data point that is not a JSON object: {}", abbreviate(json));
                return Optional.empty();
            }
            if (!node.hasNonNull("metricName") || !node.path("value").isNumber()) {
                LOG.warn("Skipping data point without metricName or numeric value: {}", abbreviate(json));
                return Optional.empty();
            }
            DataPoint point = mapper.treeToValue(node, DataPoint.class);
            if (point.getTimestamp() == null) {
                point = new DataPoint(clock.instant(), point.getMetricName(), point.getValue(),
                        point.getHost(), point.getTags());
            }
            return Optional.of(point);
        } catch (Exception e) {
            LOG.warn("Failed to deserialize data point – skipping: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * @param point data point
     * @return its JSON form with an ISO-8601 timestamp
     */
    public String encode(DataPoint point) {
        Objects.requireNonNull(point, "DataPoint must not be null");
        try {
            return mapper.writeValueAsString(point);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to serialize data point: " + e.getMessage(), e);
        }
    }

    private static String abbreviate(String json) {
        return json.length() <= 200 ? json : json.substring(0, 200) + "...";
    }
}
