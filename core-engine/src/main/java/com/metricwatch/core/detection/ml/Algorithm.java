package com.metricwatch.core.detection.ml;

import com.metricwatch.core.config.MlSettings;

import java.util.Locale;
import java.util.Objects;

/**
 * Unsupervised algorithms available to {@link MlAnomalyDetector}.
 *
 * <p>
 * Each constant carries its own trainer and the steepness of the logistic
 * curve that maps its decision function into [0, 1]; the detector never
 * dispatches on algorithm names at scoring time.
 * </p>
 *
 * @since 1.0.0
 */
public enum Algorithm {

    ISOLATION_FOREST("isolation_forest", 10.0) {
        @Override
        AnomalyModelTrainer trainer(MlSettings settings) {
            return new IsolationForest.Trainer(settings.getNumTrees(), settings.getMaxSamples(),
                    settings.getSeed());
        }
    },

    LOCAL_OUTLIER_FACTOR("local_outlier_factor", 5.0) {
        @Override
        AnomalyModelTrainer trainer(MlSettings settings) {
            return new LocalOutlierFactor.Trainer(settings.getNeighbors());
        }
    };

    private final String id;
    private final double scoreSteepness;

    Algorithm(String id, double scoreSteepness) {
        this.id = id;
        this.scoreSteepness = scoreSteepness;
    }

    /**
     * Create a trainer for this algorithm.
     *
     * @param settings hyper-parameters
     * @return a fresh trainer
     */
    abstract AnomalyModelTrainer trainer(MlSettings settings);

    /**
     * @return stable identifier used in configuration files and model artifacts
     */
    public String id() {
        return id;
    }

    /**
     * Map a decision-function value (negative means outlier) into [0, 1].
     *
     * @param decision raw decision value
     * @return anomaly score; 0.5 at the calibrated boundary
     */
    public double squash(double decision) {
        return 1.0 / (1.0 + Math.exp(scoreSteepness * decision));
    }

    /**
     * Resolve an identifier such as {@code isolation_forest} or
     * {@code LOCAL_OUTLIER_FACTOR}.
     *
     * @param value identifier, case-insensitive
     * @return the matching algorithm
     * @throws IllegalArgumentException if the identifier is unknown
     */
    public static Algorithm fromId(String value) {
        Objects.requireNonNull(value, "Algorithm id must not be null");
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Algorithm algorithm : values()) {
            if (algorithm.id.equals(normalized)) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException("Unknown algorithm: '" + value
                + "'. Supported: isolation_forest, local_outlier_factor");
    }
}
