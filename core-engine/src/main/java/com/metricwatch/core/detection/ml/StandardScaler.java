package com.metricwatch.core.detection.ml;

import java.util.Objects;

/**
 * Per-feature standardization to zero mean and unit (population) variance.
 *
 * <p>
 * A feature with zero variance gets a scale of 1, so transforming it only
 * centers it. Instances are immutable.
 * </p>
 */
final class StandardScaler {

    private final double[] mean;
    private final double[] scale;

    StandardScaler(double[] mean, double[] scale) {
        Objects.requireNonNull(mean, "mean must not be null");
        Objects.requireNonNull(scale, "scale must not be null");
        if (mean.length != scale.length) {
            throw new IllegalArgumentException("mean and scale lengths differ: "
                    + mean.length + " vs " + scale.length);
        }
        this.mean = mean.clone();
        this.scale = scale.clone();
    }

    /**
     * Learn per-column mean and standard deviation.
     *
     * @param x rectangular, non-empty matrix
     * @return fitted scaler
     */
    static StandardScaler fit(double[][] x) {
        int rows = x.length;
        int cols = x[0].length;
        double[] mean = new double[cols];
        double[] scale = new double[cols];

        for (double[] row : x) {
            for (int j = 0; j < cols; j++) {
                mean[j] += row[j];
            }
        }
        for (int j = 0; j < cols; j++) {
            mean[j] /= rows;
        }
        for (double[] row : x) {
            for (int j = 0; j < cols; j++) {
                double diff = row[j] - mean[j];
                scale[j] += diff * diff;
            }
        }
        for (int j = 0; j < cols; j++) {
            double std = Math.sqrt(scale[j] / rows);
            scale[j] = std == 0 ? 1.0 : std;
        }
        return new StandardScaler(mean, scale);
    }

    double[][] transform(double[][] x) {
        double[][] out = new double[x.length][];
        for (int i = 0; i < x.length; i++) {
            out[i] = transform(x[i]);
        }
        return out;
    }

    double[] transform(double[] row) {
        if (row.length != mean.length) {
            throw new IllegalArgumentException("Expected " + mean.length
                    + " feature(s), got " + row.length);
        }
        double[] out = new double[row.length];
        for (int j = 0; j < row.length; j++) {
            out[j] = (row[j] - mean[j]) / scale[j];
        }
        return out;
    }

    int features() {
        return mean.length;
    }

    double[] mean() {
        return mean.clone();
    }

    double[] scale() {
        return scale.clone();
    }
}
