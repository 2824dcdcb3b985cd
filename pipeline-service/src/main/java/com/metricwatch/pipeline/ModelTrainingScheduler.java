package com.metricwatch.pipeline;

import com.metricwatch.core.buffer.MetricRingBuffer;
import com.metricwatch.core.detection.ml.MlAnomalyDetector;
import com.metricwatch.core.error.ModelFitException;
import com.metricwatch.core.error.ModelPersistenceException;
import com.metricwatch.core.model.DetectionResult;
import com.metricwatch.core.registry.DetectorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Periodically re-fits each metric's ML detector on the buffered history and
 * scores the latest value.
 *
 * <p>
 * Every {@code retrainInterval}, each metric holding at least
 * {@code minTrainingSamples} buffered values gets a fit on the worker pool,
 * followed by a score of its most recent value; the resulting
 * {@link DetectionResult} is published to the pipeline's listeners. A metric
 * whose previous cycle is still running is skipped.
 * </p>
 *
 * <h3>Model persistence</h3>
 * <p>
 * When a model directory is configured, every successful fit is saved as
 * {@code <metric>_<algorithm>.json}, and a detector that has never been
 * fitted adopts a saved artifact before its first score.
 * </p>
 *
 * <p>
 * Fit, score and persistence failures are logged and counted; they never
 * cancel the schedule.
 * </p>
 *
 * @since 1.0.0
 */
public class ModelTrainingScheduler implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ModelTrainingScheduler.class);

    private static final long SHUTDOWN_TIMEOUT_MS = 10_000;

    private final IngestionPipeline pipeline;
    private final PipelineConfig config;
    private final MetricRingBuffer buffer;
    private final DetectorRegistry registry;
    private final PipelineMetrics metrics;
    private final ExecutorService workers;
    private final ScheduledExecutorService scheduler;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean running = new AtomicBoolean(false);

    public ModelTrainingScheduler(IngestionPipeline pipeline, PipelineConfig config) {
        this.pipeline = Objects.requireNonNull(pipeline, "IngestionPipeline must not be null");
        this.config = Objects.requireNonNull(config, "PipelineConfig must not be null");
        this.buffer = pipeline.getBuffer();
        this.registry = pipeline.getRegistry();
        this.metrics = pipeline.getPipelineMetrics();
        this.workers = Executors.newFixedThreadPool(config.getWorkerThreads(), namedThreads("ml-worker-"));
        this.scheduler = Executors.newSingleThreadScheduledExecutor(namedThreads("ml-retrain-"));
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Schedule the periodic retrain cycle. Calling it again is a no-op.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        long interval = config.getRetrainIntervalMs();
        scheduler.scheduleAtFixedRate(this::retrainCycle, interval, interval, TimeUnit.MILLISECONDS);
        LOG.info("Model training scheduled every {} ms (min {} samples, {} worker(s))",
                interval, config.getMinTrainingSamples(), config.getWorkerThreads());
    }

    /**
     * Stop scheduling, let running fits finish and shut the worker pool down.
     */
    @Override
    public void close() {
        running.set(false);
        scheduler.shutdown();
        workers.shutdown();
        try {
            if (!scheduler.awaitTermination(SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                scheduler.shutdownNow();
            }
            if (!workers.awaitTermination(SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                LOG.warn("ML workers did not finish within {} ms, interrupting", SHUTDOWN_TIMEOUT_MS);
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
            workers.shutdownNow();
        }
        LOG.info("Model training scheduler stopped");
    }

    // ---------------------------------------------------------------
    // Cycle
    // ---------------------------------------------------------------

    /**
     * Run one retrain pass over every eligible metric.
     *
     * @return number of metrics for which a fit was started
     */
    int retrainCycle() {
        int started = 0;
        try {
            for (String metric : buffer.metricNames()) {
                double[] values = buffer.values(metric);
                if (values.length < config.getMinTrainingSamples()) {
                    LOG.trace("Metric [{}] has {} sample(s), need {}", metric, values.length,
                            config.getMinTrainingSamples());
                    continue;
                }
                if (!inFlight.add(metric)) {
                    LOG.debug("Previous training of [{}] still running, skipping", metric);
                    continue;
                }
                double latest = values[values.length - 1];
                started++;
                fitAsync(metric)
                        .thenCompose(detector -> scoreAsync(metric, latest))
                        .whenComplete((result, error) -> {
                            inFlight.remove(metric);
                            if (error != null) {
                                metrics.error();
                                LOG.warn("Training cycle for [{}] failed: {}", metric, rootMessage(error));
                            }
                        });
            }
        } catch (RuntimeException e) {
            metrics.error();
            LOG.error("Retrain cycle failed: {}", e.getMessage(), e);
        }
        return started;
    }

    /**
     * Fit the metric's default ML detector on its buffered values.
     *
     * @param metricName metric key
     * @return future completing with the fitted detector, or exceptionally with
     *         a {@link ModelFitException}
     */
    public CompletableFuture<MlAnomalyDetector> fitAsync(String metricName) {
        Objects.requireNonNull(metricName, "metricName must not be null");
        return CompletableFuture.supplyAsync(() -> {
            double[][] x = buffer.toMatrix(metricName);
            if (x.length < config.getMinTrainingSamples()) {
                throw new ModelFitException("Metric [" + metricName + "] has " + x.length
                        + " buffered sample(s), need " + config.getMinTrainingSamples());
            }
            MlAnomalyDetector detector = registry.mlDetector(metricName);
            detector.fit(x);
            metrics.modelFitted();
            modelPath(metricName, detector).ifPresent(path -> save(detector, path));
            return detector;
        }, workers);
    }

    /**
     * Score a value with the metric's ML detector and publish the result.
     *
     * @param metricName metric key
     * @param value      value to score
     * @return future completing with the published result, or exceptionally
     *         with a {@link com.metricwatch.core.error.ModelNotFittedException}
     *         if no model is available
     */
    public CompletableFuture<DetectionResult> scoreAsync(String metricName, double value) {
        Objects.requireNonNull(metricName, "metricName must not be null");
        return CompletableFuture.supplyAsync(() -> {
            MlAnomalyDetector detector = registry.mlDetector(metricName);
            if (!detector.isFitted()) {
                modelPath(metricName, detector)
                        .filter(Files::exists)
                        .ifPresent(path -> restore(detector, path));
            }
            DetectionResult result = detector.evaluate(metricName, value);
            pipeline.publish(result);
            return result;
        }, workers);
    }

    // ---------------------------------------------------------------
    // Persistence
    // ---------------------------------------------------------------

    private Optional<Path> modelPath(String metricName, MlAnomalyDetector detector) {
        return config.getModelDirectory()
                .map(dir -> dir.resolve(fileSafe(metricName) + "_" + detector.getAlgorithm().id() + ".json"));
    }

    private void save(MlAnomalyDetector detector, Path path) {
        try {
            detector.save(path);
        } catch (ModelPersistenceException e) {
            metrics.error();
            LOG.warn("Could not save model to {}: {}", path, e.getMessage());
        }
    }

    private void restore(MlAnomalyDetector detector, Path path) {
        try {
            detector.load(path);
        } catch (ModelPersistenceException e) {
            metrics.error();
            LOG.warn("Ignoring unusable model artifact {}: {}", path, e.getMessage());
        }
    }

    static String fileSafe(String metricName) {
        return metricName.replaceAll("[^A-Za-z0-9._-]", "_");
    }

    private static String rootMessage(Throwable error) {
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage();
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
