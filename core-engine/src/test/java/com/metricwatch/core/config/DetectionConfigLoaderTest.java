package com.metricwatch.core.config;

import com.metricwatch.core.detection.ml.Algorithm;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectionConfigLoader}.
 */
class DetectionConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should load test config from classpath and keep defaults for omitted keys")
    void shouldLoadFromClasspath() {
        DetectionConfig config = DetectionConfigLoader.fromClasspath("test-detection.yml");

        assertThat(config.getStreaming().getWindowSize()).isEqualTo(50);
        assertThat(config.getStreaming().getMinObservations()).isEqualTo(5);
        assertThat(config.getStreaming().getAnomalyZ()).isEqualTo(2.0);
        assertThat(config.getMl().algorithm()).isEqualTo(Algorithm.LOCAL_OUTLIER_FACTOR);
        assertThat(config.getMl().getContamination()).isEqualTo(0.05);
        assertThat(config.getMl().getNeighbors()).isEqualTo(10);
        assertThat(config.getMl().getNumTrees()).isEqualTo(100);
        assertThat(config.getBaselineZThreshold()).isEqualTo(2.5);
        assertThat(config.getIqrMultiplier()).isEqualTo(1.5);
    }

    @Test
    @DisplayName("Should load the bundled default config")
    void shouldLoadBundledDefaults() {
        DetectionConfig config = DetectionConfigLoader.fromClasspath(DetectionConfigLoader.DEFAULT_RESOURCE);

        assertThat(config.getStreaming().getWindowSize()).isEqualTo(100);
        assertThat(config.getMl().algorithm()).isEqualTo(Algorithm.ISOLATION_FOREST);
        assertThat(config.getMl().getSeed()).isEqualTo(42L);
    }

    @Test
    @DisplayName("Should report every invalid value at once")
    void shouldCollectAllValidationErrors() {
        assertThatThrownBy(() -> DetectionConfigLoader.fromClasspath("invalid-detection.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("streaming.minObservations")
                .hasMessageContaining("ml.algorithm")
                .hasMessageContaining("ml.contamination");
    }

    @Test
    @DisplayName("Should load from a file system path")
    void shouldLoadFromFile() throws Exception {
        Path file = tempDir.resolve("detection.yml");
        Files.writeString(file, "ml:\n  threshold: 0.6\n");

        DetectionConfig config = DetectionConfigLoader.fromFile(file.toString());

        assertThat(config.getMl().getThreshold()).isEqualTo(0.6);
    }

    @Test
    @DisplayName("Should fall back to defaults for an empty file")
    void shouldUseDefaultsForEmptyFile() throws Exception {
        Path file = tempDir.resolve("empty.yml");
        Files.writeString(file, "");

        DetectionConfig config = DetectionConfigLoader.fromFile(file.toString());

        assertThat(config.getStreaming().getWindowSize()).isEqualTo(100);
    }

    @Test
    @DisplayName("Should throw when classpath resource or file does not exist")
    void shouldThrowForMissingSources() {
        assertThatThrownBy(() -> DetectionConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
        assertThatThrownBy(() -> DetectionConfigLoader.fromFile(tempDir.resolve("nope.yml").toString()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should reject duplicate keys")
    void shouldRejectDuplicateKeys() throws Exception {
        Path file = tempDir.resolve("dup.yml");
        Files.writeString(file, "iqrMultiplier: 1.5\niqrMultiplier: 2.0\n");

        assertThatThrownBy(() -> DetectionConfigLoader.fromFile(file.toString()))
                .isInstanceOf(RuntimeException.class);
    }
}
