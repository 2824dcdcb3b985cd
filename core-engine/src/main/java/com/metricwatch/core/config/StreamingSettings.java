package com.metricwatch.core.config;

import java.io.Serializable;
import java.util.List;

/**
 * Tuning for the streaming z-score detector.
 *
 * <pre>
 * streaming:
 *   windowSize: 100
 *   minObservations: 10
 *   anomalyZ: 2.0
 *   mediumZ: 2.5
 *   highZ: 3.0
 *   criticalZ: 3.5
 *   scoreDivisor: 4.0
 * </pre>
 *
 * @since 1.0.0
 */
public class StreamingSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Number of recent values kept per metric. */
    private int windowSize = 100;

    /** Observations required before a value can be flagged. */
    private int minObservations = 10;

    /** z-score above which a value is anomalous. */
    private double anomalyZ = 2.0;

    private double mediumZ = 2.5;
    private double highZ = 3.0;
    private double criticalZ = 3.5;

    /** z-score that maps to a score of 1.0. */
    private double scoreDivisor = 4.0;

    void collectErrors(List<String> errors) {
        if (windowSize < 2) {
            errors.add("streaming.windowSize must be >= 2, got: " + windowSize);
        }
        if (minObservations < 2) {
            errors.add("streaming.minObservations must be >= 2, got: " + minObservations);
        }
        if (minObservations > windowSize) {
            errors.add("streaming.minObservations (" + minObservations
                    + ") must not exceed streaming.windowSize (" + windowSize + ")");
        }
        if (anomalyZ <= 0) {
            errors.add("streaming.anomalyZ must be > 0, got: " + anomalyZ);
        }
        if (!(anomalyZ <= mediumZ && mediumZ <= highZ && highZ <= criticalZ)) {
            errors.add("streaming severity boundaries must satisfy anomalyZ <= mediumZ <= highZ <= criticalZ");
        }
        if (scoreDivisor <= 0) {
            errors.add("streaming.scoreDivisor must be > 0, got: " + scoreDivisor);
        }
    }

    public int getWindowSize() {
        return windowSize;
    }

    public void setWindowSize(int windowSize) {
        this.windowSize = windowSize;
    }

    public int getMinObservations() {
        return minObservations;
    }

    public void setMinObservations(int minObservations) {
        this.minObservations = minObservations;
    }

    public double getAnomalyZ() {
        return anomalyZ;
    }

    public void setAnomalyZ(double anomalyZ) {
        this.anomalyZ = anomalyZ;
    }

    public double getMediumZ() {
        return mediumZ;
    }

    public void setMediumZ(double mediumZ) {
        this.mediumZ = mediumZ;
    }

    public double getHighZ() {
        return highZ;
    }

    public void setHighZ(double highZ) {
        this.highZ = highZ;
    }

    public double getCriticalZ() {
        return criticalZ;
    }

    public void setCriticalZ(double criticalZ) {
        this.criticalZ = criticalZ;
    }

    public double getScoreDivisor() {
        return scoreDivisor;
    }

    public void setScoreDivisor(double scoreDivisor) {
        this.scoreDivisor = scoreDivisor;
    }

    @Override
    public String toString() {
        return "StreamingSettings{" +
                "windowSize=" + windowSize +
                ", minObservations=" + minObservations +
                ", anomalyZ=" + anomalyZ +
                ", mediumZ=" + mediumZ +
                ", highZ=" + highZ +
                ", criticalZ=" + criticalZ +
                ", scoreDivisor=" + scoreDivisor +
                '}';
    }
}
