package com.metricwatch.core.detection;

import java.util.Arrays;

/**
 * Per-value outcome of an {@link IqrDetector} pass plus the fences used.
 *
 * @since 1.0.0
 */
public final class IqrResult {

    private final double q1;
    private final double q3;
    private final double lowerBound;
    private final double upperBound;
    private final boolean[] anomalies;
    private final double[] scores;

    IqrResult(double q1, double q3, double lowerBound, double upperBound,
            boolean[] anomalies, double[] scores) {
        this.q1 = q1;
        this.q3 = q3;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        this.anomalies = anomalies;
        this.scores = scores;
    }

    public double getQ1() {
        return q1;
    }

    public double getQ3() {
        return q3;
    }

    public double getIqr() {
        return q3 - q1;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public double getUpperBound() {
        return upperBound;
    }

    /**
     * @return a copy of the per-value anomaly flags, in input order
     */
    public boolean[] getAnomalies() {
        return anomalies.clone();
    }

    /**
     * @return a copy of the per-value scores, in input order; 0 for values
     *         inside the fences
     */
    public double[] getScores() {
        return scores.clone();
    }

    public boolean isAnomaly(int index) {
        return anomalies[index];
    }

    public double score(int index) {
        return scores[index];
    }

    public int size() {
        return anomalies.length;
    }

    public int anomalyCount() {
        int count = 0;
        for (boolean a : anomalies) {
            if (a) {
                count++;
            }
        }
        return count;
    }

    @Override
    public String toString() {
        return "IqrResult{" +
                "q1=" + q1 +
                ", q3=" + q3 +
                ", lowerBound=" + lowerBound +
                ", upperBound=" + upperBound +
                ", anomalies=" + Arrays.toString(anomalies) +
                '}';
    }
}
