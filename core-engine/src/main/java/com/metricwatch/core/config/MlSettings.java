package com.metricwatch.core.config;

import com.metricwatch.core.detection.ml.Algorithm;

import java.io.Serializable;
import java.util.List;

/**
 * Hyper-parameters for the batch ML detector.
 *
 * <pre>
 * ml:
 *   algorithm: isolation_forest
 *   contamination: 0.1
 *   threshold: 0.5
 *   numTrees: 100
 *   maxSamples: 256
 *   neighbors: 20
 *   seed: 42
 * </pre>
 *
 * @since 1.0.0
 */
public class MlSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** {@code isolation_forest} or {@code local_outlier_factor}. */
    private String algorithm = Algorithm.ISOLATION_FOREST.id();

    /** Expected fraction of anomalies in training data. */
    private double contamination = 0.1;

    /** Score above which a prediction is anomalous. */
    private double threshold = 0.5;

    // --- Isolation Forest ---
    private int numTrees = 100;
    private int maxSamples = 256;
    private long seed = 42L;

    // --- Local Outlier Factor ---
    private int neighbors = 20;

    void collectErrors(List<String> errors) {
        try {
            Algorithm.fromId(algorithm);
        } catch (IllegalArgumentException | NullPointerException e) {
            errors.add("ml.algorithm: " + e.getMessage());
        }
        if (!(contamination > 0 && contamination <= 0.5)) {
            errors.add("ml.contamination must be in (0, 0.5], got: " + contamination);
        }
        if (!(threshold > 0 && threshold < 1)) {
            errors.add("ml.threshold must be in (0, 1), got: " + threshold);
        }
        if (numTrees < 1) {
            errors.add("ml.numTrees must be >= 1, got: " + numTrees);
        }
        if (maxSamples < 2) {
            errors.add("ml.maxSamples must be >= 2, got: " + maxSamples);
        }
        if (neighbors < 1) {
            errors.add("ml.neighbors must be >= 1, got: " + neighbors);
        }
    }

    /**
     * @return the configured algorithm
     * @throws IllegalArgumentException if the identifier is unknown
     */
    public Algorithm algorithm() {
        return Algorithm.fromId(algorithm);
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

    public int getNumTrees() {
        return numTrees;
    }

    public void setNumTrees(int numTrees) {
        this.numTrees = numTrees;
    }

    public int getMaxSamples() {
        return maxSamples;
    }

    public void setMaxSamples(int maxSamples) {
        this.maxSamples = maxSamples;
    }

    public long getSeed() {
        return seed;
    }

    public void setSeed(long seed) {
        this.seed = seed;
    }

    public int getNeighbors() {
        return neighbors;
    }

    public void setNeighbors(int neighbors) {
        this.neighbors = neighbors;
    }

    @Override
    public String toString() {
        return "MlSettings{" +
                "algorithm='" + algorithm + '\'' +
                ", contamination=" + contamination +
                ", threshold=" + threshold +
                ", numTrees=" + numTrees +
                ", maxSamples=" + maxSamples +
                ", seed=" + seed +
                ", neighbors=" + neighbors +
                '}';
    }
}
