package com.metricwatch.core.detection;

import com.metricwatch.core.config.StreamingSettings;
import com.metricwatch.core.model.DetectionResult;
import com.metricwatch.core.model.DetectionStatus;
import com.metricwatch.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link StreamingZScoreDetector}.
 */
class StreamingZScoreDetectorTest {

    private StreamingZScoreDetector detector;

    @BeforeEach
    void setUp() {
        detector = new StreamingZScoreDetector();
    }

    @Test
    @DisplayName("Should report COLLECTING_BASELINE for the first nine values")
    void shouldCollectBaselineBeforeTenObservations() {
        for (int i = 0; i < 9; i++) {
            DetectionResult result = detector.observe("cpu", i == 8 ? 1_000 : 50);
            assertThat(result.getStatus()).isEqualTo(DetectionStatus.COLLECTING_BASELINE);
            assertThat(result.isAnomaly()).isFalse();
            assertThat(result.getSeverity()).isEqualTo(Severity.LOW);
        }

        DetectionResult tenth = detector.observe("cpu", 50);
        assertThat(tenth.getStatus()).isEqualTo(DetectionStatus.EVALUATED);
    }

    @Test
    @DisplayName("Should never flag a perfectly flat series")
    void shouldNotFlagFlatSeries() {
        DetectionResult last = null;
        for (int i = 0; i < 30; i++) {
            last = detector.observe("memory", 5.0);
            assertThat(last.isAnomaly()).isFalse();
        }
        assertThat(last.getStdDev()).isZero();
        assertThat(last.getZScore()).isZero();
        assertThat(last.getScore()).isZero();
    }

    @Test
    @DisplayName("Should flag a spike to 90 after a stable series around 50 as high or critical")
    void shouldFlagSpikeAfterStableSeries() {
        for (int i = 0; i < 30; i++) {
            detector.observe("cpu", i % 2 == 0 ? 45 : 55);
        }

        DetectionResult result = detector.observe("cpu", 90);

        assertThat(result.isAnomaly()).isTrue();
        assertThat(result.getStatus()).isEqualTo(DetectionStatus.EVALUATED);
        assertThat(result.getSeverity()).isIn(Severity.HIGH, Severity.CRITICAL);
        assertThat(result.getZScore()).isGreaterThan(3.0);
        assertThat(result.getScore()).isEqualTo(Math.min(result.getZScore() / 4.0, 1.0));
        assertThat(result.getDetector()).isEqualTo(StreamingZScoreDetector.NAME);
    }

    @Test
    @DisplayName("Should flag a spike after gaussian noise around 50")
    void shouldFlagSpikeAfterGaussianNoise() {
        Random random = new Random(42);
        for (int i = 0; i < 30; i++) {
            detector.observe("cpu", 50 + random.nextGaussian() * 5);
        }

        DetectionResult result = detector.observe("cpu", 90);

        assertThat(result.isAnomaly()).isTrue();
        assertThat(result.getSeverity()).isIn(Severity.HIGH, Severity.CRITICAL);
    }

    @Test
    @DisplayName("Should report threshold as mean + 2 sigma")
    void shouldReportThreshold() {
        DetectionResult result = null;
        for (int i = 0; i < 10; i++) {
            result = detector.observe("disk", i % 2 == 0 ? 10 : 20);
        }
        assertThat(result.getMean()).isEqualTo(15.0);
        assertThat(result.getStdDev()).isEqualTo(5.0);
        assertThat(result.getThreshold()).isEqualTo(25.0);
    }

    @Test
    @DisplayName("Should keep at most windowSize values per metric")
    void shouldBoundWindow() {
        for (int i = 0; i < 250; i++) {
            detector.observe("net", i);
        }
        assertThat(detector.windowSize("net")).isEqualTo(100);
        assertThat(detector.windowSize("unknown")).isZero();
    }

    @Test
    @DisplayName("Should keep separate windows per metric and forget a metric on reset")
    void shouldIsolateMetrics() {
        for (int i = 0; i < 20; i++) {
            detector.observe("a", 1);
        }
        detector.observe("b", 1);

        assertThat(detector.windowSize("a")).isEqualTo(20);
        assertThat(detector.windowSize("b")).isEqualTo(1);

        detector.reset("a");
        assertThat(detector.windowSize("a")).isZero();
        assertThat(detector.observe("a", 1).getStatus()).isEqualTo(DetectionStatus.COLLECTING_BASELINE);
    }

    @Test
    @DisplayName("Should honour custom thresholds")
    void shouldHonourCustomSettings() {
        StreamingSettings settings = new StreamingSettings();
        settings.setWindowSize(10);
        settings.setMinObservations(3);
        StreamingZScoreDetector custom = new StreamingZScoreDetector(settings);

        custom.observe("x", 1);
        custom.observe("x", 1);
        assertThat(custom.observe("x", 1).getStatus()).isEqualTo(DetectionStatus.EVALUATED);
    }

    @Test
    @DisplayName("Should reject non-finite values")
    void shouldRejectNonFinite() {
        assertThatThrownBy(() -> detector.observe("cpu", Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> detector.observe("cpu", Double.POSITIVE_INFINITY))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(detector.windowSize("cpu")).isZero();
    }

    @Test
    @DisplayName("Should stay consistent under concurrent observers on one metric")
    void shouldHandleConcurrentObservers() throws Exception {
        int threads = 8;
        int perThread = 1_000;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                int offset = t;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        DetectionResult result = detector.observe("shared", 50 + (i + offset) % 7);
                        assertThat(result.getScore()).isBetween(0.0, 1.0);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(detector.windowSize("shared")).isEqualTo(100);
    }
}
