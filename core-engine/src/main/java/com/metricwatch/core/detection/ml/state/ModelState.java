package com.metricwatch.core.detection.ml.state;

import java.time.Instant;

/**
 * Serializable snapshot of a fitted
 * {@link com.metricwatch.core.detection.ml.MlAnomalyDetector}.
 *
 * <p>
 * Exactly one of {@link #getIsolationForest()} and
 * {@link #getLocalOutlierFactor()} is set, matching {@link #getAlgorithm()}.
 * {@link #getFormat()} and {@link #getVersion()} let a reader reject artifacts
 * it does not understand.
 * </p>
 *
 * @since 1.0.0
 */
public class ModelState {

    /** Format marker written into every artifact. */
    public static final String FORMAT = "metric-watch-model";

    /** Current artifact version. */
    public static final String VERSION = "1.0";

    private String format = FORMAT;
    private String version = VERSION;
    private String algorithm;
    private double contamination;
    private double threshold;
    private int trainingSamples;
    private Instant fittedAt;
    private ScalerState scaler;
    private IsolationForestState isolationForest;
    private LocalOutlierFactorState localOutlierFactor;

    public String getFormat() {
        return format;
    }

    public void setFormat(String format) {
        this.format = format;
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public String getAlgorithm() {
        return algorithm;
    }

    public void setAlgorithm(String algorithm) {
        this.algorithm = algorithm;
    }

    public double getContamination() {
        return contamination;
    }

    public void setContamination(double contamination) {
        this.contamination = contamination;
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public int getTrainingSamples() {
        return trainingSamples;
    }

    public void setTrainingSamples(int trainingSamples) {
        this.trainingSamples = trainingSamples;
    }

    public Instant getFittedAt() {
        return fittedAt;
    }

    public void setFittedAt(Instant fittedAt) {
        this.fittedAt = fittedAt;
    }

    public ScalerState getScaler() {
        return scaler;
    }

    public void setScaler(ScalerState scaler) {
        this.scaler = scaler;
    }

    public IsolationForestState getIsolationForest() {
        return isolationForest;
    }

    public void setIsolationForest(IsolationForestState isolationForest) {
        this.isolationForest = isolationForest;
    }

    public LocalOutlierFactorState getLocalOutlierFactor() {
        return localOutlierFactor;
    }

    public void setLocalOutlierFactor(LocalOutlierFactorState localOutlierFactor) {
        this.localOutlierFactor = localOutlierFactor;
    }
}
