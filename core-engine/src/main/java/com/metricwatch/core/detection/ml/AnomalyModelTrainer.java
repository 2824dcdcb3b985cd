package com.metricwatch.core.detection.ml;

/**
 * Fits one {@link AnomalyModel}. Created per fit by {@link Algorithm}.
 */
interface AnomalyModelTrainer {

    /**
     * @param scaled        standardized, validated training rows
     * @param contamination expected outlier fraction
     * @return the fitted model with its offset calibrated
     */
    AnomalyModel train(double[][] scaled, double contamination);
}
