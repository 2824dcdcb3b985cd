package com.metricwatch.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.metricwatch.core.model.DetectionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

/**
 * Converts {@link DetectionResult} → JSON with ISO-8601 timestamps and
 * lowercase severities, for logs and downstream alerting.
 */
public class DetectionResultSerializer {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionResultSerializer.class);

    private final ObjectMapper mapper;

    public DetectionResultSerializer() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    /**
     * @param result detection result
     * @return UTF-8 JSON, or an empty array if serialization fails
     */
    public byte[] serialize(DetectionResult result) {
        try {
            return mapper.writeValueAsBytes(result);
        } catch (Exception e) {
            LOG.error("Failed to serialize detection result: {}", e.getMessage(), e);
            return new byte[0];
        }
    }

    public String toJson(DetectionResult result) {
        return new String(serialize(result), StandardCharsets.UTF_8);
    }

    ObjectMapper getMapper() {
        return mapper;
    }
}
