package com.metricwatch.core.detection.ml;

import java.time.Instant;

/**
 * Everything a fit produces, published to readers as one immutable value.
 */
final class FittedModel {

    private final StandardScaler scaler;
    private final AnomalyModel model;
    private final double contamination;
    private final double threshold;
    private final int trainingSamples;
    private final Instant fittedAt;

    FittedModel(StandardScaler scaler, AnomalyModel model, double contamination,
                double threshold, int trainingSamples, Instant fittedAt) {
        this.scaler = scaler;
        this.model = model;
        this.contamination = contamination;
        this.threshold = threshold;
        this.trainingSamples = trainingSamples;
        this.fittedAt = fittedAt;
    }

    Algorithm algorithm() {
        return model.algorithm();
    }

    StandardScaler scaler() {
        return scaler;
    }

    AnomalyModel model() {
        return model;
    }

    double contamination() {
        return contamination;
    }

    double threshold() {
        return threshold;
    }

    int trainingSamples() {
        return trainingSamples;
    }

    Instant fittedAt() {
        return fittedAt;
    }
}
