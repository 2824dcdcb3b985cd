package com.metricwatch.core.registry;

import com.metricwatch.core.config.DetectionConfig;
import com.metricwatch.core.detection.BaselineZScoreDetector;
import com.metricwatch.core.detection.IqrDetector;
import com.metricwatch.core.detection.StreamingZScoreDetector;
import com.metricwatch.core.detection.ml.Algorithm;
import com.metricwatch.core.detection.ml.MlAnomalyDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Owns the detector instances of one pipeline.
 *
 * <p>
 * ML detectors are keyed by {@code (metric, algorithm)}, baseline detectors by
 * metric. Both are created on first request from the {@link DetectionConfig}
 * this registry was built with and live as long as the registry. The
 * streaming detector and the IQR detector are single shared instances.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Lookups go through {@link ConcurrentMap#computeIfAbsent}, so concurrent
 * callers asking for the same key always receive the same instance.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectorRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorRegistry.class);

    private final DetectionConfig config;
    private final Clock clock;
    private final StreamingZScoreDetector streamingDetector;
    private final IqrDetector iqrDetector;
    private final ConcurrentMap<MlKey, MlAnomalyDetector> mlDetectors = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, BaselineZScoreDetector> baselineDetectors = new ConcurrentHashMap<>();

    public DetectorRegistry(DetectionConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * @param config validated detection configuration
     * @param clock  time source handed to every detector created here
     */
    public DetectorRegistry(DetectionConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "DetectionConfig must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.streamingDetector = new StreamingZScoreDetector(config.getStreaming(), clock);
        this.iqrDetector = new IqrDetector(config.getIqrMultiplier());
    }

    /**
     * @param metricName metric key
     * @return the metric's ML detector using the configured default algorithm
     */
    public MlAnomalyDetector mlDetector(String metricName) {
        return mlDetector(metricName, config.getMl().algorithm());
    }

    /**
     * @param metricName metric key
     * @param algorithm  model family
     * @return the metric's detector for that algorithm, created on first use
     */
    public MlAnomalyDetector mlDetector(String metricName, Algorithm algorithm) {
        Objects.requireNonNull(metricName, "metricName must not be null");
        Objects.requireNonNull(algorithm, "algorithm must not be null");
        return mlDetectors.computeIfAbsent(new MlKey(metricName, algorithm), key -> {
            LOG.debug("Creating {} detector for metric [{}]", algorithm.id(), metricName);
            return new MlAnomalyDetector(algorithm, config.getMl(), clock);
        });
    }

    /**
     * @param metricName metric key
     * @return the metric's frozen-baseline detector, created on first use
     */
    public BaselineZScoreDetector baselineDetector(String metricName) {
        Objects.requireNonNull(metricName, "metricName must not be null");
        return baselineDetectors.computeIfAbsent(metricName,
                name -> new BaselineZScoreDetector(name, config.getBaselineZThreshold(), clock));
    }

    public StreamingZScoreDetector streamingDetector() {
        return streamingDetector;
    }

    public IqrDetector iqrDetector() {
        return iqrDetector;
    }

    /**
     * @return snapshot of the ML detectors created so far, keyed
     *         {@code metric_algorithm}
     */
    public Map<String, MlAnomalyDetector> mlDetectors() {
        Map<String, MlAnomalyDetector> snapshot = new LinkedHashMap<>();
        mlDetectors.forEach((key, detector) -> snapshot.put(key.toString(), detector));
        return Collections.unmodifiableMap(snapshot);
    }

    public DetectionConfig getConfig() {
        return config;
    }

    private static final class MlKey {
        private final String metricName;
        private final Algorithm algorithm;

        private MlKey(String metricName, Algorithm algorithm) {
            this.metricName = metricName;
            this.algorithm = algorithm;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof MlKey other)) {
                return false;
            }
            return metricName.equals(other.metricName) && algorithm == other.algorithm;
        }

        @Override
        public int hashCode() {
            return Objects.hash(metricName, algorithm);
        }

        @Override
        public String toString() {
            return metricName + "_" + algorithm.id();
        }
    }
}
