package com.metricwatch.core.detection;

import com.metricwatch.core.error.ModelFitException;
import com.metricwatch.core.error.ModelNotFittedException;
import com.metricwatch.core.model.DetectionResult;
import com.metricwatch.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * z-score detector against a frozen baseline.
 *
 * <p>
 * Unlike {@link StreamingZScoreDetector}, the mean and standard deviation are
 * learned once from a historical series by {@link #fit(double[])} and do not
 * move as new values are scored. Useful for comparing live values with a
 * known-good period.
 * </p>
 *
 * <p>
 * The fitted baseline is replaced atomically, so concurrent scoring always
 * sees a consistent mean/σ pair.
 * </p>
 *
 * @since 1.0.0
 */
public class BaselineZScoreDetector {

    private static final Logger LOG = LoggerFactory.getLogger(BaselineZScoreDetector.class);

    /** Detector name reported in results. */
    public static final String NAME = "baseline_zscore";

    /** Default z-score threshold. */
    public static final double DEFAULT_THRESHOLD = 3.0;

    private final String metricName;
    private final double defaultThreshold;
    private final Clock clock;

    private volatile Baseline baseline;

    public BaselineZScoreDetector(String metricName) {
        this(metricName, DEFAULT_THRESHOLD, Clock.systemUTC());
    }

    /**
     * @param metricName       metric reported in results
     * @param defaultThreshold z-score threshold used by {@link #detect(double)}
     * @param clock            time source for result timestamps
     */
    public BaselineZScoreDetector(String metricName, double defaultThreshold, Clock clock) {
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (defaultThreshold <= 0) {
            throw new IllegalArgumentException("threshold must be > 0, got: " + defaultThreshold);
        }
        this.defaultThreshold = defaultThreshold;
    }

    /**
     * Learn the baseline from historical values.
     *
     * @param history historical values; must contain at least one finite value
     * @return this detector
     * @throws ModelFitException if {@code history} is empty or contains
     *                           non-finite values
     */
    public BaselineZScoreDetector fit(double[] history) {
        if (history == null || history.length == 0) {
            throw new ModelFitException("Cannot fit baseline for '" + metricName + "' on empty history");
        }
        for (double v : history) {
            if (!Double.isFinite(v)) {
                throw new ModelFitException("Baseline history for '" + metricName
                        + "' contains a non-finite value: " + v);
            }
        }
        double mean = WindowStatistics.mean(history);
        double stdDev = WindowStatistics.stdDev(history, mean);
        this.baseline = new Baseline(mean, stdDev);
        LOG.info("Baseline detector for '{}' fitted on {} values (mean={}, std={})",
                metricName, history.length, String.format("%.2f", mean), String.format("%.2f", stdDev));
        return this;
    }

    /**
     * Score a value with the default threshold.
     *
     * @param value value to score
     * @return detection result
     * @throws ModelNotFittedException if {@link #fit} has not been called
     */
    public DetectionResult detect(double value) {
        return detect(value, defaultThreshold);
    }

    /**
     * Score a value.
     *
     * @param value     value to score
     * @param threshold z-score above which the value is anomalous
     * @return detection result whose score is {@code min(z / threshold, 1)}
     * @throws ModelNotFittedException  if {@link #fit} has not been called
     * @throws IllegalArgumentException if {@code value} is NaN or infinite
     */
    public DetectionResult detect(double value, double threshold) {
        Baseline current = baseline;
        if (current == null) {
            throw new ModelNotFittedException("Baseline detector for '" + metricName
                    + "' must be fitted before detection");
        }
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be > 0, got: " + threshold);
        }
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("value must be finite, got: " + value);
        }

        double zScore = current.stdDev == 0 ? 0.0 : Math.abs(value - current.mean) / current.stdDev;
        boolean anomaly = current.stdDev != 0 && zScore > threshold;

        return DetectionResult.builder()
                .metricName(metricName)
                .value(value)
                .mean(current.mean)
                .stdDev(current.stdDev)
                .threshold(current.mean + threshold * current.stdDev)
                .zScore(zScore)
                .anomaly(anomaly)
                .score(Math.min(zScore / threshold, 1.0))
                .severity(anomaly ? Severity.fromZScore(zScore) : Severity.LOW)
                .detector(NAME)
                .timestamp(clock.instant())
                .build();
    }

    public boolean isFitted() {
        return baseline != null;
    }

    public String getMetricName() {
        return metricName;
    }

    private static final class Baseline {
        private final double mean;
        private final double stdDev;

        private Baseline(double mean, double stdDev) {
            this.mean = mean;
            this.stdDev = stdDev;
        }
    }
}
