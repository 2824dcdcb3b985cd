package com.metricwatch.pipeline;

import com.metricwatch.core.config.DetectionConfig;
import com.metricwatch.core.error.QueueFullException;
import com.metricwatch.core.model.DataPoint;
import com.metricwatch.core.model.DetectionResult;
import com.metricwatch.core.model.DetectionStatus;
import com.metricwatch.core.model.MetricStats;
import com.metricwatch.core.model.Severity;
import com.metricwatch.core.registry.DetectorRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * Unit tests for {@link IngestionPipeline}.
 */
class IngestionPipelineTest {

    private IngestionPipeline pipeline;

    @AfterEach
    void tearDown() {
        if (pipeline != null) {
            pipeline.close();
        }
    }

    private static PipelineConfig.Builder fastConfig() {
        return new PipelineConfig.Builder()
                .pollTimeoutMs(50)
                .flushIntervalMs(100)
                .healthPort(0);
    }

    private IngestionPipeline newPipeline(PipelineConfig config, MetricStorage storage) {
        pipeline = new IngestionPipeline(config, new DetectorRegistry(DetectionConfig.defaults()), storage);
        return pipeline;
    }

    private static DataPoint point(String metric, double value) {
        return new DataPoint(Instant.now(), metric, value, "web-1", null);
    }

    private static DetectionResult result(String metric) {
        return DetectionResult.builder()
                .metricName(metric)
                .value(1)
                .detector("zscore")
                .timestamp(Instant.now())
                .build();
    }

    @Test
    @DisplayName("Should score every point and flag a spike after the baseline")
    void shouldScorePointsAndFlagSpike() {
        newPipeline(fastConfig().build(), new RecordingStorage());
        List<DetectionResult> results = new CopyOnWriteArrayList<>();
        pipeline.addListener(results::add);
        pipeline.start();

        for (int i = 0; i < 20; i++) {
            pipeline.submit(point("cpu", i % 2 == 0 ? 45 : 55));
        }
        pipeline.submit(point("cpu", 90));

        await().atMost(Duration.ofSeconds(5)).until(() -> results.size() == 21);

        assertThat(results.get(0).getStatus()).isEqualTo(DetectionStatus.COLLECTING_BASELINE);
        DetectionResult spike = results.get(20);
        assertThat(spike.isAnomaly()).isTrue();
        assertThat(spike.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(results.subList(0, 20)).noneMatch(DetectionResult::isAnomaly);

        PipelineMetricsSnapshot snapshot = pipeline.metrics();
        assertThat(snapshot.getPointsReceived()).isEqualTo(21);
        assertThat(snapshot.getPointsProcessed()).isEqualTo(21);
        assertThat(snapshot.getAnomaliesDetected()).isEqualTo(1);
        assertThat(snapshot.getBufferSize()).isEqualTo(21);
    }

    @Test
    @DisplayName("Should drop invalid points without buffering them")
    void shouldDropInvalidPoints() {
        newPipeline(fastConfig().build(), new RecordingStorage());
        pipeline.start();

        pipeline.submit(point("cpu", Double.NaN));
        pipeline.submit(point(" ", 1.0));
        pipeline.submit(new DataPoint(null, "cpu", 1.0, null, null));
        pipeline.submit(point("cpu", 1.0));

        await().atMost(Duration.ofSeconds(5))
                .until(() -> pipeline.metrics().getPointsProcessed() == 1);

        assertThat(pipeline.metrics().getPointsDropped()).isEqualTo(3);
        assertThat(pipeline.getBuffer().size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject submissions immediately when the queue is full")
    void shouldRejectWhenQueueFull() {
        newPipeline(fastConfig().queueCapacity(2).build(), new RecordingStorage());

        pipeline.submit(point("cpu", 1));
        pipeline.submit(point("cpu", 2));

        long start = System.nanoTime();
        assertThatThrownBy(() -> pipeline.submit(point("cpu", 3)))
                .isInstanceOf(QueueFullException.class)
                .hasMessageContaining("2");
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(1));
        assertThat(pipeline.metrics().getPointsReceived()).isEqualTo(2);
        assertThat(pipeline.metrics().getQueueSize()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should refuse submissions after stop")
    void shouldRefuseSubmissionsAfterStop() {
        newPipeline(fastConfig().build(), new RecordingStorage());
        pipeline.start();
        pipeline.stop();

        assertThat(pipeline.isRunning()).isFalse();
        assertThatThrownBy(() -> pipeline.submit(point("cpu", 1)))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(pipeline::start)
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should process every accepted point when stop races with a producer")
    void shouldNotStrandPointsSubmittedDuringStop() throws Exception {
        for (int cycle = 0; cycle < 50; cycle++) {
            IngestionPipeline racing = new IngestionPipeline(fastConfig().build(),
                    new DetectorRegistry(DetectionConfig.defaults()), new RecordingStorage());
            racing.start();
            Thread producer = new Thread(() -> {
                while (true) {
                    try {
                        racing.submit(point("cpu", 1.0));
                    } catch (QueueFullException e) {
                        Thread.onSpinWait();
                    } catch (IllegalStateException e) {
                        return;
                    }
                }
            }, "test-producer");
            producer.start();
            Thread.sleep(2);

            racing.stop();
            producer.join(5_000);

            PipelineMetricsSnapshot snapshot = racing.metrics();
            assertThat(producer.isAlive()).isFalse();
            assertThat(snapshot.getQueueSize()).as("cycle %d", cycle).isZero();
            assertThat(snapshot.getPointsProcessed()).as("cycle %d", cycle)
                    .isEqualTo(snapshot.getPointsReceived());
        }
    }

    @Test
    @DisplayName("Should process queued points on stop even if never started")
    void shouldProcessQueueWhenStoppedBeforeStart() {
        RecordingStorage storage = new RecordingStorage();
        newPipeline(fastConfig().build(), storage);
        List<DetectionResult> results = new CopyOnWriteArrayList<>();
        pipeline.addListener(results::add);

        pipeline.submit(point("cpu", 1));
        pipeline.submit(point("cpu", 2));
        pipeline.stop();

        assertThat(results).hasSize(2);
        assertThat(storage.stored()).hasSize(2);
        assertThat(pipeline.metrics().getQueueSize()).isZero();
    }

    @Test
    @DisplayName("Should stop delivering results to a removed listener")
    void shouldStopNotifyingRemovedListener() {
        newPipeline(fastConfig().build(), new RecordingStorage());
        List<DetectionResult> received = new CopyOnWriteArrayList<>();
        DetectionListener listener = received::add;
        pipeline.addListener(listener);

        pipeline.publish(result("cpu"));
        pipeline.removeListener(listener);
        pipeline.publish(result("mem"));

        assertThat(received).extracting(DetectionResult::getMetricName).containsExactly("cpu");
    }

    @Test
    @DisplayName("Should keep a failed batch pending and deliver it on the next flush")
    void shouldRetryFailedFlush() {
        RecordingStorage storage = new RecordingStorage(1);
        newPipeline(fastConfig().build(), storage);
        pipeline.getBuffer().add(point("cpu", 1));
        pipeline.getBuffer().add(point("cpu", 2));
        pipeline.getBuffer().add(point("mem", 3));

        assertThat(pipeline.flush()).isFalse();
        assertThat(pipeline.metrics().getFlushFailures()).isEqualTo(1);
        assertThat(pipeline.metrics().getErrors()).isEqualTo(1);
        assertThat(storage.batches()).isEmpty();

        assertThat(pipeline.flush()).isTrue();
        assertThat(storage.stored()).extracting(DataPoint::getValue).containsExactly(1.0, 2.0, 3.0);
        assertThat(pipeline.metrics().getBatchesFlushed()).isEqualTo(1);

        // Nothing new: no empty batch reaches storage
        assertThat(pipeline.flush()).isTrue();
        assertThat(storage.batches()).hasSize(1);
        assertThat(pipeline.getBuffer().size()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should flush periodically while running")
    void shouldFlushPeriodically() {
        RecordingStorage storage = new RecordingStorage();
        newPipeline(fastConfig().build(), storage);
        pipeline.start();

        pipeline.submitAll(List.of(point("cpu", 1), point("cpu", 2), point("cpu", 3)));

        await().atMost(Duration.ofSeconds(5)).until(() -> storage.stored().size() == 3);
        assertThat(pipeline.metrics().getBatchesFlushed()).isGreaterThanOrEqualTo(1);
    }

    @Test
    @DisplayName("Should drain the queue and flush everything on stop")
    void shouldDrainAndFlushOnStop() {
        RecordingStorage storage = new RecordingStorage();
        newPipeline(fastConfig().flushIntervalMs(60_000).build(), storage);
        pipeline.start();

        for (int i = 0; i < 5; i++) {
            pipeline.submit(point("cpu", i));
        }
        pipeline.stop();

        assertThat(storage.stored()).hasSize(5);
        assertThat(pipeline.metrics().getPointsProcessed()).isEqualTo(5);
    }

    @Test
    @DisplayName("Should isolate a failing listener from the others")
    void shouldIsolateFailingListener() {
        newPipeline(fastConfig().build(), new RecordingStorage());
        List<DetectionResult> received = new CopyOnWriteArrayList<>();
        pipeline.addListener(result -> {
            throw new IllegalStateException("listener broke");
        });
        pipeline.addListener(received::add);

        DetectionResult result = DetectionResult.builder()
                .metricName("cpu")
                .value(99)
                .anomaly(true)
                .score(0.95)
                .severity(Severity.CRITICAL)
                .detector("zscore")
                .timestamp(Instant.now())
                .build();
        pipeline.publish(result);

        assertThat(received).containsExactly(result);
        assertThat(pipeline.metrics().getErrors()).isEqualTo(1);
        assertThat(pipeline.metrics().getAnomaliesDetected()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should answer recent-point and statistics queries from the buffer")
    void shouldAnswerQueries() {
        newPipeline(fastConfig().build(), new RecordingStorage());
        pipeline.start();

        pipeline.submit(point("cpu", 10));
        pipeline.submit(point("cpu", 30));
        pipeline.submit(point("mem", 5));

        await().atMost(Duration.ofSeconds(5))
                .until(() -> pipeline.metrics().getPointsProcessed() == 3);

        assertThat(pipeline.getRecent(Duration.ofMinutes(1))).hasSize(3);
        assertThat(pipeline.getRecent("cpu", Duration.ofMinutes(1))).hasSize(2);

        MetricStats stats = pipeline.getStats("cpu").orElseThrow();
        assertThat(stats.getCount()).isEqualTo(2);
        assertThat(stats.getMin()).isEqualTo(10.0);
        assertThat(stats.getMax()).isEqualTo(30.0);
        assertThat(stats.getMean()).isEqualTo(20.0);
        assertThat(pipeline.getStats("disk")).isEmpty();
    }
}
