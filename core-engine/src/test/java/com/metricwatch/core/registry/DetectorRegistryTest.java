package com.metricwatch.core.registry;

import com.metricwatch.core.config.DetectionConfig;
import com.metricwatch.core.detection.BaselineZScoreDetector;
import com.metricwatch.core.detection.ml.Algorithm;
import com.metricwatch.core.detection.ml.MlAnomalyDetector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link DetectorRegistry}.
 */
class DetectorRegistryTest {

    private DetectorRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new DetectorRegistry(DetectionConfig.defaults());
    }

    @Test
    @DisplayName("Should return the same ML detector for the same metric and algorithm")
    void shouldReuseMlDetector() {
        MlAnomalyDetector first = registry.mlDetector("cpu");
        MlAnomalyDetector second = registry.mlDetector("cpu", Algorithm.ISOLATION_FOREST);

        assertThat(second).isSameAs(first);
        assertThat(first.getAlgorithm()).isEqualTo(Algorithm.ISOLATION_FOREST);
    }

    @Test
    @DisplayName("Should keep separate ML detectors per algorithm and per metric")
    void shouldSeparateKeys() {
        MlAnomalyDetector forest = registry.mlDetector("cpu", Algorithm.ISOLATION_FOREST);
        MlAnomalyDetector lof = registry.mlDetector("cpu", Algorithm.LOCAL_OUTLIER_FACTOR);
        MlAnomalyDetector memory = registry.mlDetector("memory");

        assertThat(lof).isNotSameAs(forest);
        assertThat(memory).isNotSameAs(forest);
        assertThat(registry.mlDetectors())
                .containsOnlyKeys("cpu_isolation_forest", "cpu_local_outlier_factor", "memory_isolation_forest");
    }

    @Test
    @DisplayName("Should use the configured default algorithm and baseline threshold")
    void shouldApplyConfiguration() {
        DetectionConfig config = DetectionConfig.defaults();
        config.getMl().setAlgorithm("local_outlier_factor");
        config.setBaselineZThreshold(2.0);
        DetectorRegistry custom = new DetectorRegistry(config);

        assertThat(custom.mlDetector("cpu").getAlgorithm()).isEqualTo(Algorithm.LOCAL_OUTLIER_FACTOR);

        BaselineZScoreDetector baseline = custom.baselineDetector("cpu");
        baseline.fit(new double[] { 45, 55, 45, 55 });
        assertThat(baseline.detect(61).isAnomaly()).isTrue();
        assertThat(custom.baselineDetector("cpu")).isSameAs(baseline);
    }

    @Test
    @DisplayName("Should share one streaming detector")
    void shouldShareStreamingDetector() {
        assertThat(registry.streamingDetector()).isSameAs(registry.streamingDetector());
        assertThat(registry.iqrDetector().getK()).isEqualTo(1.5);
    }

    @Test
    @DisplayName("Should hand every concurrent caller the same instance")
    void shouldBeThreadSafe() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            Callable<MlAnomalyDetector> lookup = () -> registry.mlDetector("disk");
            Set<MlAnomalyDetector> seen = ConcurrentHashMap.newKeySet();
            for (Future<MlAnomalyDetector> future : pool.invokeAll(
                    IntStream.range(0, 64).mapToObj(i -> lookup).collect(Collectors.toList()))) {
                seen.add(future.get(10, TimeUnit.SECONDS));
            }
            assertThat(seen).hasSize(1);
        } finally {
            pool.shutdownNow();
        }
    }
}
