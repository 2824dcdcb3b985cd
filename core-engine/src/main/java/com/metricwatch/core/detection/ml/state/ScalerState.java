package com.metricwatch.core.detection.ml.state;

/**
 * Per-feature mean and scale of a fitted standard scaler.
 */
public class ScalerState {

    private double[] mean;
    private double[] scale;

    public double[] getMean() {
        return mean;
    }

    public void setMean(double[] mean) {
        this.mean = mean;
    }

    public double[] getScale() {
        return scale;
    }

    public void setScale(double[] scale) {
        this.scale = scale;
    }
}
