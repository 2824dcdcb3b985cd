package com.metricwatch.pipeline;

import java.io.Serializable;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed, immutable runtime configuration for the Metric Watch pipeline.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the service is configurable through container {@code -e} flags or a shell
 * environment. Detection tuning (thresholds, window sizes, model
 * hyper-parameters) lives separately in {@code detection.yml}.
 * </p>
 *
 * <table>
 * <caption>Environment variables</caption>
 * <tr><th>Variable</th><th>Default</th></tr>
 * <tr><td>{@code QUEUE_CAPACITY}</td><td>10000</td></tr>
 * <tr><td>{@code BUFFER_MAX_SIZE}</td><td>10000</td></tr>
 * <tr><td>{@code FLUSH_INTERVAL_MS}</td><td>5000</td></tr>
 * <tr><td>{@code RETRAIN_INTERVAL_MS}</td><td>60000</td></tr>
 * <tr><td>{@code MIN_TRAINING_SAMPLES}</td><td>50</td></tr>
 * <tr><td>{@code WORKER_THREADS}</td><td>2</td></tr>
 * <tr><td>{@code HEALTH_PORT}</td><td>8080</td></tr>
 * <tr><td>{@code DETECTION_CONFIG_PATH}</td><td>(classpath {@code detection.yml})</td></tr>
 * <tr><td>{@code MODEL_DIR}</td><td>(models not persisted)</td></tr>
 * </table>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder} for
 * programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class PipelineConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    // ---------------------------------------------------------------
    // Ingestion
    // ---------------------------------------------------------------
    private final int queueCapacity;
    private final int bufferMaxSize;
    private final long pollTimeoutMs;
    private final long flushIntervalMs;

    // ---------------------------------------------------------------
    // Model training
    // ---------------------------------------------------------------
    private final long retrainIntervalMs;
    private final int minTrainingSamples;
    private final int workerThreads;
    private final String modelDirectory;

    // ---------------------------------------------------------------
    // Detection tuning
    // ---------------------------------------------------------------
    private final String detectionConfigPath;

    // ---------------------------------------------------------------
    // Health / Metrics
    // ---------------------------------------------------------------
    private final int healthPort;

    private PipelineConfig(Builder b) {
        this.queueCapacity = b.queueCapacity;
        this.bufferMaxSize = b.bufferMaxSize;
        this.pollTimeoutMs = b.pollTimeoutMs;
        this.flushIntervalMs = b.flushIntervalMs;
        this.retrainIntervalMs = b.retrainIntervalMs;
        this.minTrainingSamples = b.minTrainingSamples;
        this.workerThreads = b.workerThreads;
        this.modelDirectory = b.modelDirectory;
        this.detectionConfigPath = b.detectionConfigPath;
        this.healthPort = b.healthPort;
    }

    // ---------------------------------------------------------------
    // Factory - resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link PipelineConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static PipelineConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    static PipelineConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "environment must not be null");
        try {
            return new Builder()
                    .queueCapacity(parseIntEnv(env, "QUEUE_CAPACITY", "10000"))
                    .bufferMaxSize(parseIntEnv(env, "BUFFER_MAX_SIZE", "10000"))
                    .flushIntervalMs(parseLongEnv(env, "FLUSH_INTERVAL_MS", "5000"))
                    .retrainIntervalMs(parseLongEnv(env, "RETRAIN_INTERVAL_MS", "60000"))
                    .minTrainingSamples(parseIntEnv(env, "MIN_TRAINING_SAMPLES", "50"))
                    .workerThreads(parseIntEnv(env, "WORKER_THREADS", "2"))
                    .healthPort(parseIntEnv(env, "HEALTH_PORT", "8080"))
                    .detectionConfigPath(env(env, "DETECTION_CONFIG_PATH", ""))
                    .modelDirectory(env(env, "MODEL_DIR", ""))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public int getBufferMaxSize() {
        return bufferMaxSize;
    }

    public long getPollTimeoutMs() {
        return pollTimeoutMs;
    }

    public long getFlushIntervalMs() {
        return flushIntervalMs;
    }

    public long getRetrainIntervalMs() {
        return retrainIntervalMs;
    }

    public int getMinTrainingSamples() {
        return minTrainingSamples;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    /**
     * @return directory fitted models are saved to and restored from, if
     *         configured
     */
    public Optional<Path> getModelDirectory() {
        return modelDirectory.isBlank() ? Optional.empty() : Optional.of(Path.of(modelDirectory));
    }

    public String getDetectionConfigPath() {
        return detectionConfigPath;
    }

    public int getHealthPort() {
        return healthPort;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link PipelineConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (positive capacities and intervals, at least two training
     * samples, port in [0, 65535] where 0 picks a free port).
     * </p>
     */
    public static class Builder {
        private int queueCapacity = 10_000;
        private int bufferMaxSize = 10_000;
        private long pollTimeoutMs = 1_000;
        private long flushIntervalMs = 5_000;
        private long retrainIntervalMs = 60_000;
        private int minTrainingSamples = 50;
        private int workerThreads = 2;
        private String modelDirectory = "";
        private String detectionConfigPath = "";
        private int healthPort = 8080;

        public Builder queueCapacity(int v) {
            this.queueCapacity = v;
            return this;
        }

        public Builder bufferMaxSize(int v) {
            this.bufferMaxSize = v;
            return this;
        }

        public Builder pollTimeoutMs(long v) {
            this.pollTimeoutMs = v;
            return this;
        }

        public Builder flushIntervalMs(long v) {
            this.flushIntervalMs = v;
            return this;
        }

        public Builder retrainIntervalMs(long v) {
            this.retrainIntervalMs = v;
            return this;
        }

        public Builder minTrainingSamples(int v) {
            this.minTrainingSamples = v;
            return this;
        }

        public Builder workerThreads(int v) {
            this.workerThreads = v;
            return this;
        }

        public Builder modelDirectory(String v) {
            this.modelDirectory = v;
            return this;
        }

        public Builder detectionConfigPath(String v) {
            this.detectionConfigPath = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link PipelineConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public PipelineConfig build() {
            Objects.requireNonNull(modelDirectory, "modelDirectory required (use \"\" for none)");
            Objects.requireNonNull(detectionConfigPath, "detectionConfigPath required (use \"\" for classpath)");

            requirePositive(queueCapacity, "queueCapacity");
            requirePositive(bufferMaxSize, "bufferMaxSize");
            requirePositive(pollTimeoutMs, "pollTimeoutMs");
            requirePositive(flushIntervalMs, "flushIntervalMs");
            requirePositive(retrainIntervalMs, "retrainIntervalMs");
            requirePositive(workerThreads, "workerThreads");
            if (minTrainingSamples < 2) {
                throw new IllegalArgumentException(
                        "minTrainingSamples must be >= 2, got: " + minTrainingSamples);
            }
            if (healthPort < 0 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [0, 65535], got: " + healthPort);
            }

            return new PipelineConfig(this);
        }

        private static void requirePositive(long value, String name) {
            if (value < 1) {
                throw new IllegalArgumentException(name + " must be >= 1, got: " + value);
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    private static int parseIntEnv(Map<String, String> env, String name, String defaultValue) {
        return Integer.parseInt(env(env, name, defaultValue));
    }

    private static long parseLongEnv(Map<String, String> env, String name, String defaultValue) {
        return Long.parseLong(env(env, name, defaultValue));
    }

    @Override
    public String toString() {
        return "PipelineConfig{" +
                "queueCapacity=" + queueCapacity +
                ", bufferMaxSize=" + bufferMaxSize +
                ", pollTimeoutMs=" + pollTimeoutMs +
                ", flushIntervalMs=" + flushIntervalMs +
                ", retrainIntervalMs=" + retrainIntervalMs +
                ", minTrainingSamples=" + minTrainingSamples +
                ", workerThreads=" + workerThreads +
                ", modelDirectory='" + modelDirectory + '\'' +
                ", detectionConfigPath='" + detectionConfigPath + '\'' +
                ", healthPort=" + healthPort +
                '}';
    }
}
