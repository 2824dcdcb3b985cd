package com.metricwatch.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.metricwatch.core.model.DetectionResult;
import com.metricwatch.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link DetectionResultSerializer}.
 */
class DetectionResultSerializerTest {

    private final DetectionResultSerializer serializer = new DetectionResultSerializer();

    @Test
    @DisplayName("Should render lowercase severity and ISO-8601 timestamp")
    void shouldRenderResult() throws Exception {
        DetectionResult result = DetectionResult.builder()
                .metricName("latency")
                .value(870)
                .anomaly(true)
                .score(0.82)
                .severity(Severity.HIGH)
                .zScore(3.2)
                .detector("isolation_forest")
                .timestamp(Instant.parse("2024-05-01T12:00:00Z"))
                .build();

        JsonNode json = serializer.getMapper().readTree(serializer.serialize(result));

        assertThat(json.get("metricName").asText()).isEqualTo("latency");
        assertThat(json.get("anomaly").asBoolean()).isTrue();
        assertThat(json.get("severity").asText()).isEqualTo("high");
        assertThat(json.get("detector").asText()).isEqualTo("isolation_forest");
        assertThat(json.get("timestamp").asText()).isEqualTo("2024-05-01T12:00:00Z");
        assertThat(json.get("zScore").asDouble()).isEqualTo(3.2);
    }

    @Test
    @DisplayName("Should read back what it writes")
    void shouldRoundTrip() throws Exception {
        DetectionResult result = DetectionResult.builder()
                .metricName("cpu")
                .value(12)
                .detector("zscore")
                .timestamp(Instant.parse("2024-05-01T12:00:00Z"))
                .build();

        DetectionResult read = serializer.getMapper().readValue(serializer.toJson(result), DetectionResult.class);

        assertThat(read.getMetricName()).isEqualTo("cpu");
        assertThat(read.getSeverity()).isEqualTo(Severity.LOW);
        assertThat(read.isAnomaly()).isFalse();
    }
}
