package com.metricwatch.core.detection;

import java.util.Arrays;

/**
 * Interquartile-range outlier detector over an arbitrary array.
 *
 * <p>
 * Fences are {@code [Q1 - k·IQR, Q3 + k·IQR]}. A value outside the fences is
 * anomalous and scored by its distance beyond the nearest fence divided by
 * the IQR; when the IQR is 0 any such value scores 1.0. Quartiles use linear
 * interpolation between closest ranks.
 * </p>
 *
 * <p>
 * This is a <strong>stateless</strong> detector: every call is a pure
 * function of its input, independent of any live window.
 * </p>
 *
 * @since 1.0.0
 */
public class IqrDetector {

    /** Default fence multiplier. */
    public static final double DEFAULT_K = 1.5;

    private final double k;

    public IqrDetector() {
        this(DEFAULT_K);
    }

    /**
     * @param k fence multiplier; must be &gt; 0
     */
    public IqrDetector(double k) {
        if (!(k > 0)) {
            throw new IllegalArgumentException("k must be > 0, got: " + k);
        }
        this.k = k;
    }

    /**
     * Flag outliers in {@code data}.
     *
     * @param data values to audit; not modified
     * @return per-value flags and scores in input order; empty for empty input
     * @throws IllegalArgumentException if any value is NaN or infinite
     */
    public IqrResult detect(double[] data) {
        if (data == null || data.length == 0) {
            return new IqrResult(Double.NaN, Double.NaN, Double.NaN, Double.NaN,
                    new boolean[0], new double[0]);
        }
        for (double v : data) {
            if (!Double.isFinite(v)) {
                throw new IllegalArgumentException("IQR input must be finite, got: " + v);
            }
        }

        double[] sorted = data.clone();
        Arrays.sort(sorted);
        double q1 = percentile(sorted, 25);
        double q3 = percentile(sorted, 75);
        double iqr = q3 - q1;
        double lower = q1 - k * iqr;
        double upper = q3 + k * iqr;

        boolean[] anomalies = new boolean[data.length];
        double[] scores = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            double v = data[i];
            if (v < lower) {
                anomalies[i] = true;
                scores[i] = iqr > 0 ? (lower - v) / iqr : 1.0;
            } else if (v > upper) {
                anomalies[i] = true;
                scores[i] = iqr > 0 ? (v - upper) / iqr : 1.0;
            }
        }
        return new IqrResult(q1, q3, lower, upper, anomalies, scores);
    }

    public double getK() {
        return k;
    }

    /**
     * Percentile of already-sorted data with linear interpolation.
     *
     * @param sorted ascending values, non-empty
     * @param p      percentile in [0, 100]
     * @return interpolated value
     */
    static double percentile(double[] sorted, double p) {
        double rank = (p / 100.0) * (sorted.length - 1);
        int lowerIndex = (int) Math.floor(rank);
        int upperIndex = (int) Math.ceil(rank);
        double fraction = rank - lowerIndex;
        return sorted[lowerIndex] + (sorted[upperIndex] - sorted[lowerIndex]) * fraction;
    }
}
