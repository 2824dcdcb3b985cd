package com.metricwatch.core.detection.ml;

import java.util.Arrays;

/**
 * A fitted unsupervised model operating on standardized features.
 *
 * <p>
 * Implementations are immutable once trained, so a model can be scored from
 * many threads while a replacement is being fitted.
 * </p>
 */
interface AnomalyModel {

    /**
     * @return the algorithm that produced this model
     */
    Algorithm algorithm();

    /**
     * Raw normality scores: the lower, the more abnormal.
     *
     * @param scaled standardized rows
     * @return one score per row
     */
    double[] scoreSamples(double[][] scaled);

    /**
     * @return score below which a training row counts as an outlier
     */
    double offset();

    /**
     * {@code scoreSamples - offset}; negative values are outliers.
     *
     * @param scaled standardized rows
     * @return one decision value per row
     */
    default double[] decisionFunction(double[][] scaled) {
        double[] scores = scoreSamples(scaled);
        double offset = offset();
        for (int i = 0; i < scores.length; i++) {
            scores[i] -= offset;
        }
        return scores;
    }

    /**
     * The {@code contamination} quantile of the training scores, so that
     * that fraction of training rows falls below the offset.
     *
     * @param trainingScores raw scores of the training rows
     * @param contamination  expected outlier fraction in (0, 0.5]
     * @return calibrated offset
     */
    static double calibrateOffset(double[] trainingScores, double contamination) {
        double[] sorted = trainingScores.clone();
        Arrays.sort(sorted);
        double rank = contamination * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (rank - lower);
    }
}
