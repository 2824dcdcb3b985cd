package com.metricwatch.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectionResult}.
 */
class DetectionResultTest {

    private static DetectionResult.Builder base() {
        return DetectionResult.builder()
                .metricName("cpu")
                .value(1)
                .detector("zscore")
                .timestamp(Instant.parse("2024-05-01T12:00:00Z"));
    }

    @Test
    @DisplayName("Should clamp the score into [0, 1]")
    void shouldClampScore() {
        assertThat(base().score(1.7).build().getScore()).isEqualTo(1.0);
        assertThat(base().score(-0.2).build().getScore()).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Should reject a NaN score")
    void shouldRejectNanScore() {
        assertThatThrownBy(() -> base().score(Double.NaN).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("NaN");
    }

    @Test
    @DisplayName("Should default to a low-severity evaluated result")
    void shouldApplyDefaults() {
        DetectionResult result = base().build();

        assertThat(result.getSeverity()).isEqualTo(Severity.LOW);
        assertThat(result.getStatus()).isEqualTo(DetectionStatus.EVALUATED);
        assertThat(result.isAnomaly()).isFalse();
    }
}
