package com.metricwatch.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link Severity}.
 */
class SeverityTest {

    @Test
    @DisplayName("Should map z-scores onto tiers with strict boundaries")
    void shouldMapZScoreTiers() {
        assertThat(Severity.fromZScore(2.0)).isEqualTo(Severity.LOW);
        assertThat(Severity.fromZScore(2.5)).isEqualTo(Severity.LOW);
        assertThat(Severity.fromZScore(2.51)).isEqualTo(Severity.MEDIUM);
        assertThat(Severity.fromZScore(3.0)).isEqualTo(Severity.MEDIUM);
        assertThat(Severity.fromZScore(3.2)).isEqualTo(Severity.HIGH);
        assertThat(Severity.fromZScore(3.5)).isEqualTo(Severity.HIGH);
        assertThat(Severity.fromZScore(3.51)).isEqualTo(Severity.CRITICAL);
    }

    @Test
    @DisplayName("Should never lower severity as the z-score grows")
    void shouldBeMonotonicInZScore() {
        Severity previous = Severity.LOW;
        for (double z = 0; z < 10; z += 0.01) {
            Severity current = Severity.fromZScore(z);
            assertThat(current.compareTo(previous)).isGreaterThanOrEqualTo(0);
            previous = current;
        }
        assertThat(previous).isEqualTo(Severity.CRITICAL);
    }

    @Test
    @DisplayName("Should map model scores onto tiers")
    void shouldMapScoreTiers() {
        assertThat(Severity.fromScore(0.6)).isEqualTo(Severity.LOW);
        assertThat(Severity.fromScore(0.75)).isEqualTo(Severity.MEDIUM);
        assertThat(Severity.fromScore(0.85)).isEqualTo(Severity.HIGH);
        assertThat(Severity.fromScore(0.95)).isEqualTo(Severity.CRITICAL);
    }

    @Test
    @DisplayName("Should serialize as lowercase and parse case-insensitively")
    void shouldRoundTripJsonNames() {
        assertThat(Severity.CRITICAL.toJson()).isEqualTo("critical");
        assertThat(Severity.fromJson("High")).isEqualTo(Severity.HIGH);
    }
}
