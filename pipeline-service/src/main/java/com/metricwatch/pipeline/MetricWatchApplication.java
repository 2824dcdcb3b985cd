package com.metricwatch.pipeline;

import com.metricwatch.core.config.DetectionConfig;
import com.metricwatch.core.config.DetectionConfigLoader;
import com.metricwatch.core.error.QueueFullException;
import com.metricwatch.core.model.DataPoint;
import com.metricwatch.core.registry.DetectorRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Main entry point for the Metric Watch service.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   stdin (one JSON data point per line)
 *     → DataPointJsonCodec → DataPoint
 *     → IngestionPipeline (bounded queue, ring buffer, streaming z-score)
 *     → periodic flush → MetricStorage
 *     → ModelTrainingScheduler (periodic ML fit + score)
 *     → anomalies logged as JSON
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Runtime settings are resolved from environment variables via
 * {@link PipelineConfig}; detection tuning comes from
 * {@code DETECTION_CONFIG_PATH} or the classpath {@code detection.yml}.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricWatchApplication implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(MetricWatchApplication.class);
    private static final Logger ANOMALY_LOG = LoggerFactory.getLogger("com.metricwatch.anomalies");

    private static final long BACKOFF_MS = 50;

    private final IngestionPipeline pipeline;
    private final ModelTrainingScheduler scheduler;
    private final HealthServer healthServer;
    private final PipelineConfig config;
    private final DataPointJsonCodec codec = new DataPointJsonCodec();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    MetricWatchApplication(PipelineConfig config, DetectionConfig detectionConfig) {
        this.config = config;
        DetectorRegistry registry = new DetectorRegistry(detectionConfig);
        this.pipeline = new IngestionPipeline(config, registry, new LoggingMetricStorage(),
                new SimpleMeterRegistry(), Clock.systemUTC());
        DetectionResultSerializer serializer = new DetectionResultSerializer();
        pipeline.addListener(result -> {
            if (result.isAnomaly()) {
                ANOMALY_LOG.warn("{}", serializer.toJson(result));
            }
        });
        this.scheduler = new ModelTrainingScheduler(pipeline, config);
        this.healthServer = new HealthServer(pipeline::metrics, pipeline::isRunning);
    }

    public static void main(String[] args) throws IOException {
        // 1. Load configuration
        PipelineConfig config = PipelineConfig.fromEnvironment();
        LOG.info("Starting Metric Watch with config: {}", config);

        // 2. Load detection tuning
        DetectionConfig detectionConfig = loadDetectionConfig(config);
        LOG.info("Loaded detection config: {}", detectionConfig);

        // 3. Wire and start components, with shutdown hook
        MetricWatchApplication app = new MetricWatchApplication(config, detectionConfig);
        Runtime.getRuntime().addShutdownHook(new Thread(app::close, "metric-watch-shutdown"));
        app.start();

        // 4. Feed stdin until EOF
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
            long accepted = app.consume(reader);
            LOG.info("Input closed after {} data point(s)", accepted);
        } finally {
            app.close();
        }
    }

    void start() {
        healthServer.start(config.getHealthPort());
        pipeline.start();
        scheduler.start();
    }

    /**
     * Decode and submit every line until the reader is exhausted.
     *
     * @return number of data points accepted by the pipeline
     */
    long consume(BufferedReader reader) throws IOException {
        long accepted = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            Optional<DataPoint> point = codec.decode(line);
            if (point.isPresent() && submitWithBackoff(point.get())) {
                accepted++;
            }
        }
        return accepted;
    }

    private boolean submitWithBackoff(DataPoint point) {
        while (!closed.get()) {
            try {
                pipeline.submit(point);
                return true;
            } catch (QueueFullException e) {
                LOG.debug("Ingest queue full, retrying in {} ms", BACKOFF_MS);
                try {
                    Thread.sleep(BACKOFF_MS);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            } catch (IllegalStateException e) {
                LOG.warn("Pipeline stopped, discarding remaining input");
                return false;
            }
        }
        return false;
    }

    IngestionPipeline getPipeline() {
        return pipeline;
    }

    /**
     * Stop training, drain and flush the pipeline, then stop the health server.
     * Safe to call more than once.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        scheduler.close();
        pipeline.close();
        healthServer.stop();
        LOG.info("Metric Watch stopped: {}", pipeline.metrics());
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static DetectionConfig loadDetectionConfig(PipelineConfig config) {
        String path = config.getDetectionConfigPath();
        if (path != null && !path.isBlank()) {
            return DetectionConfigLoader.fromFile(path);
        }
        return DetectionConfigLoader.load();
    }
}
