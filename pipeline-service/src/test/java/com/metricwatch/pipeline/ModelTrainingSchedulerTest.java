package com.metricwatch.pipeline;

import com.metricwatch.core.config.DetectionConfig;
import com.metricwatch.core.detection.ml.MlAnomalyDetector;
import com.metricwatch.core.error.ModelFitException;
import com.metricwatch.core.error.ModelNotFittedException;
import com.metricwatch.core.model.DataPoint;
import com.metricwatch.core.model.DetectionResult;
import com.metricwatch.core.registry.DetectorRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * Unit tests for {@link ModelTrainingScheduler}.
 */
class ModelTrainingSchedulerTest {

    @TempDir
    Path tempDir;

    private final List<AutoCloseable> toClose = new ArrayList<>();

    @AfterEach
    void tearDown() throws Exception {
        for (AutoCloseable closeable : toClose) {
            closeable.close();
        }
    }

    private PipelineConfig.Builder config() {
        return new PipelineConfig.Builder()
                .pollTimeoutMs(50)
                .flushIntervalMs(60_000)
                .retrainIntervalMs(60_000)
                .minTrainingSamples(20)
                .workerThreads(1);
    }

    private IngestionPipeline pipeline(PipelineConfig config) {
        IngestionPipeline pipeline = new IngestionPipeline(config,
                new DetectorRegistry(DetectionConfig.defaults()), new RecordingStorage());
        toClose.add(pipeline);
        return pipeline;
    }

    private ModelTrainingScheduler scheduler(IngestionPipeline pipeline, PipelineConfig config) {
        ModelTrainingScheduler scheduler = new ModelTrainingScheduler(pipeline, config);
        toClose.add(0, scheduler);
        return scheduler;
    }

    private static void fill(IngestionPipeline pipeline, String metric, int count, long seed) {
        Random random = new Random(seed);
        for (int i = 0; i < count; i++) {
            pipeline.getBuffer().add(new DataPoint(Instant.now(), metric, 50 + random.nextGaussian() * 5, null, null));
        }
    }

    @Test
    @DisplayName("Should fit on buffered history and flag a far outlier")
    void shouldFitAndScore() throws Exception {
        PipelineConfig config = config().build();
        IngestionPipeline pipeline = pipeline(config);
        ModelTrainingScheduler scheduler = scheduler(pipeline, config);
        List<DetectionResult> published = new CopyOnWriteArrayList<>();
        pipeline.addListener(published::add);
        fill(pipeline, "cpu", 100, 1);

        MlAnomalyDetector detector = scheduler.fitAsync("cpu").get(10, TimeUnit.SECONDS);
        DetectionResult result = scheduler.scoreAsync("cpu", 1000).get(10, TimeUnit.SECONDS);

        assertThat(detector.isFitted()).isTrue();
        assertThat(detector.getTrainingSamples()).isEqualTo(100);
        assertThat(result.isAnomaly()).isTrue();
        assertThat(result.getDetector()).isEqualTo("isolation_forest");
        assertThat(published).containsExactly(result);
        assertThat(pipeline.metrics().getModelsFitted()).isEqualTo(1);
        assertThat(pipeline.metrics().getAnomaliesDetected()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should refuse to fit a metric with too little history")
    void shouldRefuseFitWithTooFewSamples() {
        PipelineConfig config = config().build();
        IngestionPipeline pipeline = pipeline(config);
        ModelTrainingScheduler scheduler = scheduler(pipeline, config);
        fill(pipeline, "cpu", 5, 2);

        assertThatThrownBy(() -> scheduler.fitAsync("cpu").get(10, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(ModelFitException.class)
                .hasMessageContaining("need 20");
        assertThat(pipeline.getRegistry().mlDetector("cpu").isFitted()).isFalse();
    }

    @Test
    @DisplayName("Should fail scoring when no model is fitted or saved")
    void shouldFailScoringWithoutModel() {
        PipelineConfig config = config().build();
        ModelTrainingScheduler scheduler = scheduler(pipeline(config), config);

        assertThatThrownBy(() -> scheduler.scoreAsync("cpu", 1.0).get(10, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(ModelNotFittedException.class);
    }

    @Test
    @DisplayName("Should save fitted models and restore them in a fresh process")
    void shouldPersistAndRestoreModels() throws Exception {
        PipelineConfig config = config().modelDirectory(tempDir.toString()).build();
        IngestionPipeline first = pipeline(config);
        fill(first, "api.latency/p99", 100, 3);
        scheduler(first, config).fitAsync("api.latency/p99").get(10, TimeUnit.SECONDS);

        Path artifact = tempDir.resolve("api.latency_p99_isolation_forest.json");
        assertThat(artifact).exists();
        assertThat(Files.readString(artifact)).contains("\"format\"");

        IngestionPipeline second = pipeline(config);
        DetectionResult result = scheduler(second, config)
                .scoreAsync("api.latency/p99", 1000).get(10, TimeUnit.SECONDS);

        assertThat(second.getRegistry().mlDetector("api.latency/p99").isFitted()).isTrue();
        assertThat(result.isAnomaly()).isTrue();
    }

    @Test
    @DisplayName("Retrain cycle should only train metrics with enough history")
    void retrainCycleShouldSkipShortMetrics() {
        PipelineConfig config = config().build();
        IngestionPipeline pipeline = pipeline(config);
        ModelTrainingScheduler scheduler = scheduler(pipeline, config);
        List<DetectionResult> published = new CopyOnWriteArrayList<>();
        pipeline.addListener(published::add);
        fill(pipeline, "cpu", 60, 4);
        fill(pipeline, "mem", 5, 5);

        assertThat(scheduler.retrainCycle()).isEqualTo(1);

        await().atMost(Duration.ofSeconds(10)).until(() -> published.size() == 1);
        assertThat(published.get(0).getMetricName()).isEqualTo("cpu");
        assertThat(pipeline.metrics().getModelsFitted()).isEqualTo(1);
        assertThat(pipeline.getRegistry().mlDetector("mem").isFitted()).isFalse();
    }

    @Test
    @DisplayName("Should retrain on schedule once started")
    void shouldRetrainOnSchedule() {
        PipelineConfig config = config().retrainIntervalMs(100).build();
        IngestionPipeline pipeline = pipeline(config);
        ModelTrainingScheduler scheduler = scheduler(pipeline, config);
        fill(pipeline, "cpu", 40, 6);

        scheduler.start();
        scheduler.start();

        await().atMost(Duration.ofSeconds(10))
                .until(() -> pipeline.metrics().getModelsFitted() >= 2);
    }

    @Test
    @DisplayName("Should map metric names to safe file names")
    void shouldMakeFileSafeNames() {
        assertThat(ModelTrainingScheduler.fileSafe("cpu.usage/host:1")).isEqualTo("cpu.usage_host_1");
        assertThat(ModelTrainingScheduler.fileSafe("mem_free-bytes")).isEqualTo("mem_free-bytes");
    }
}
