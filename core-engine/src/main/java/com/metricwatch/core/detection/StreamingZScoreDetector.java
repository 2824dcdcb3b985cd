package com.metricwatch.core.detection;

import com.metricwatch.core.config.StreamingSettings;
import com.metricwatch.core.model.DetectionResult;
import com.metricwatch.core.model.DetectionStatus;
import com.metricwatch.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Low-latency z-score detector evaluated on every incoming sample.
 *
 * <p>
 * Keeps a bounded window of the last <i>N</i> raw values per metric. Each
 * observed value is appended to its window first, then scored against the
 * window's population mean and standard deviation:
 * </p>
 * <ul>
 * <li>{@code z = |value - mean| / σ}, or 0 when {@code σ == 0}</li>
 * <li>anomalous when {@code z > anomalyZ} (2.0)</li>
 * <li>severity from the 2.5 / 3.0 / 3.5 tiers</li>
 * <li>{@code score = min(z / 4, 1)}</li>
 * <li>reported threshold {@code mean + 2σ}</li>
 * </ul>
 *
 * <h3>Warm-up</h3>
 * <p>
 * Until a metric has {@code minObservations} (10) values the result is never
 * anomalous and carries {@link DetectionStatus#COLLECTING_BASELINE}.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Windows live in a concurrent map and each window is guarded by its own
 * monitor, so callers on different metrics never contend and callers on the
 * same metric are serialized. No call performs I/O.
 * </p>
 *
 * @since 1.0.0
 */
public class StreamingZScoreDetector {

    private static final Logger LOG = LoggerFactory.getLogger(StreamingZScoreDetector.class);

    /** Detector name reported in results. */
    public static final String NAME = "zscore";

    private final StreamingSettings settings;
    private final Clock clock;
    private final ConcurrentMap<String, MetricWindow> windows = new ConcurrentHashMap<>();

    public StreamingZScoreDetector() {
        this(new StreamingSettings());
    }

    public StreamingZScoreDetector(StreamingSettings settings) {
        this(settings, Clock.systemUTC());
    }

    /**
     * @param settings window and threshold tuning; must not be {@code null}
     * @param clock    time source for result timestamps
     */
    public StreamingZScoreDetector(StreamingSettings settings, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "StreamingSettings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (settings.getWindowSize() < settings.getMinObservations()) {
            throw new IllegalArgumentException("windowSize (" + settings.getWindowSize()
                    + ") must be >= minObservations (" + settings.getMinObservations() + ")");
        }
    }

    /**
     * Record a value and score it, stamped with the current time.
     *
     * @param metricName metric key; must not be {@code null}
     * @param value      observed value; must be finite
     * @return the detection result for this value
     */
    public DetectionResult observe(String metricName, double value) {
        return observe(metricName, value, clock.instant());
    }

    /**
     * Record a value and score it.
     *
     * @param metricName metric key; must not be {@code null}
     * @param value      observed value; must be finite
     * @param timestamp  time reported in the result
     * @return the detection result for this value
     * @throws IllegalArgumentException if {@code value} is NaN or infinite
     */
    public DetectionResult observe(String metricName, double value, Instant timestamp) {
        Objects.requireNonNull(metricName, "metricName must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("value must be finite, got: " + value);
        }

        MetricWindow window = windows.computeIfAbsent(metricName, k -> new MetricWindow());
        synchronized (window) {
            window.values.addLast(value);
            if (window.values.size() > settings.getWindowSize()) {
                window.values.pollFirst();
            }

            int observations = window.values.size();
            double mean = WindowStatistics.mean(window.values);
            double stdDev = WindowStatistics.stdDev(window.values, mean);

            DetectionResult.Builder result = DetectionResult.builder()
                    .metricName(metricName)
                    .value(value)
                    .mean(mean)
                    .stdDev(stdDev)
                    .threshold(mean + 2 * stdDev)
                    .detector(NAME)
                    .timestamp(timestamp);

            if (observations < settings.getMinObservations()) {
                return result.status(DetectionStatus.COLLECTING_BASELINE)
                        .anomaly(false)
                        .score(0.0)
                        .severity(Severity.LOW)
                        .build();
            }

            // A perfectly flat signal is never anomalous
            double zScore = stdDev == 0 ? 0.0 : Math.abs(value - mean) / stdDev;
            boolean anomaly = zScore > settings.getAnomalyZ();
            Severity severity = anomaly
                    ? Severity.fromZScore(zScore, settings.getMediumZ(), settings.getHighZ(),
                            settings.getCriticalZ())
                    : Severity.LOW;

            if (anomaly) {
                LOG.debug("Metric [{}] anomalous: value={} mean={} stddev={} z={} severity={}",
                        metricName, value, mean, stdDev, zScore, severity);
            }

            return result.status(DetectionStatus.EVALUATED)
                    .zScore(zScore)
                    .anomaly(anomaly)
                    .score(Math.min(zScore / settings.getScoreDivisor(), 1.0))
                    .severity(severity)
                    .build();
        }
    }

    /**
     * @param metricName metric key
     * @return number of values currently in the metric's window
     */
    public int windowSize(String metricName) {
        MetricWindow window = windows.get(metricName);
        if (window == null) {
            return 0;
        }
        synchronized (window) {
            return window.values.size();
        }
    }

    /**
     * Forget a metric's history; its next value starts a new baseline.
     *
     * @param metricName metric key
     */
    public void reset(String metricName) {
        windows.remove(metricName);
    }

    public StreamingSettings getSettings() {
        return settings;
    }

    private static final class MetricWindow {
        private final Deque<Double> values = new ArrayDeque<>();
    }
}
