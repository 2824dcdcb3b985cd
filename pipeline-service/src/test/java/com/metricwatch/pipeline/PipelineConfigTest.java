package com.metricwatch.pipeline;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link PipelineConfig}.
 */
class PipelineConfigTest {

    @Test
    @DisplayName("Should fall back to defaults when no variables are set")
    void shouldUseDefaults() {
        PipelineConfig config = PipelineConfig.fromEnvironment(Map.of());

        assertThat(config.getQueueCapacity()).isEqualTo(10_000);
        assertThat(config.getBufferMaxSize()).isEqualTo(10_000);
        assertThat(config.getFlushIntervalMs()).isEqualTo(5_000);
        assertThat(config.getRetrainIntervalMs()).isEqualTo(60_000);
        assertThat(config.getMinTrainingSamples()).isEqualTo(50);
        assertThat(config.getWorkerThreads()).isEqualTo(2);
        assertThat(config.getHealthPort()).isEqualTo(8080);
        assertThat(config.getDetectionConfigPath()).isEmpty();
        assertThat(config.getModelDirectory()).isEmpty();
    }

    @Test
    @DisplayName("Should read values from the environment")
    void shouldReadEnvironment() {
        PipelineConfig config = PipelineConfig.fromEnvironment(Map.of(
                "QUEUE_CAPACITY", "500",
                "BUFFER_MAX_SIZE", " 2000 ",
                "FLUSH_INTERVAL_MS", "250",
                "MIN_TRAINING_SAMPLES", "20",
                "WORKER_THREADS", "4",
                "HEALTH_PORT", "0",
                "MODEL_DIR", "/var/lib/metric-watch/models",
                "DETECTION_CONFIG_PATH", "/etc/metric-watch/detection.yml"));

        assertThat(config.getQueueCapacity()).isEqualTo(500);
        assertThat(config.getBufferMaxSize()).isEqualTo(2000);
        assertThat(config.getFlushIntervalMs()).isEqualTo(250);
        assertThat(config.getMinTrainingSamples()).isEqualTo(20);
        assertThat(config.getWorkerThreads()).isEqualTo(4);
        assertThat(config.getHealthPort()).isZero();
        assertThat(config.getModelDirectory()).contains(Path.of("/var/lib/metric-watch/models"));
        assertThat(config.getDetectionConfigPath()).isEqualTo("/etc/metric-watch/detection.yml");
    }

    @Test
    @DisplayName("Should treat blank variables as unset")
    void shouldIgnoreBlankValues() {
        PipelineConfig config = PipelineConfig.fromEnvironment(Map.of("QUEUE_CAPACITY", "  ", "MODEL_DIR", ""));

        assertThat(config.getQueueCapacity()).isEqualTo(10_000);
        assertThat(config.getModelDirectory()).isEmpty();
    }

    @Test
    @DisplayName("Should report unparsable numbers as a configuration error")
    void shouldRejectUnparsableNumber() {
        assertThatThrownBy(() -> PipelineConfig.fromEnvironment(Map.of("QUEUE_CAPACITY", "lots")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("lots");
    }

    @Test
    @DisplayName("Should reject out-of-range values")
    void shouldRejectOutOfRangeValues() {
        assertThatThrownBy(() -> new PipelineConfig.Builder().queueCapacity(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("queueCapacity");
        assertThatThrownBy(() -> new PipelineConfig.Builder().minTrainingSamples(1).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("minTrainingSamples");
        assertThatThrownBy(() -> new PipelineConfig.Builder().healthPort(70_000).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("healthPort");
        assertThatThrownBy(() -> PipelineConfig.fromEnvironment(Map.of("WORKER_THREADS", "0")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("workerThreads");
    }
}
