package com.metricwatch.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the detection YAML configuration.
 *
 * <p>
 * Expected YAML structure (every key is optional and falls back to the
 * default shown):
 * </p>
 *
 * <pre>
 * streaming:
 *   windowSize: 100
 *   minObservations: 10
 * ml:
 *   algorithm: isolation_forest
 *   contamination: 0.1
 * baselineZThreshold: 3.0
 * iqrMultiplier: 1.5
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading to verify every section.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private StreamingSettings streaming = new StreamingSettings();
    private MlSettings ml = new MlSettings();

    /** z-score threshold used by the frozen-baseline detector. */
    private double baselineZThreshold = 3.0;

    /** IQR fence multiplier ({@code k}). */
    private double iqrMultiplier = 1.5;

    /**
     * @return a configuration holding only default values
     */
    public static DetectionConfig defaults() {
        return new DetectionConfig();
    }

    /**
     * Validate every section, collecting all errors before failing.
     *
     * @throws IllegalStateException if one or more values are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        streaming.collectErrors(errors);
        ml.collectErrors(errors);
        if (baselineZThreshold <= 0) {
            errors.add("baselineZThreshold must be > 0, got: " + baselineZThreshold);
        }
        if (iqrMultiplier <= 0) {
            errors.add("iqrMultiplier must be > 0, got: " + iqrMultiplier);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Detection configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    public StreamingSettings getStreaming() {
        return streaming;
    }

    /**
     * Set the streaming section (used by SnakeYAML during deserialization).
     *
     * @param streaming section, {@code null} restores defaults
     */
    public void setStreaming(StreamingSettings streaming) {
        this.streaming = streaming != null ? streaming : new StreamingSettings();
    }

    public MlSettings getMl() {
        return ml;
    }

    public void setMl(MlSettings ml) {
        this.ml = ml != null ? ml : new MlSettings();
    }

    public double getBaselineZThreshold() {
        return baselineZThreshold;
    }

    public void setBaselineZThreshold(double baselineZThreshold) {
        this.baselineZThreshold = baselineZThreshold;
    }

    public double getIqrMultiplier() {
        return iqrMultiplier;
    }

    public void setIqrMultiplier(double iqrMultiplier) {
        this.iqrMultiplier = iqrMultiplier;
    }

    @Override
    public String toString() {
        return "DetectionConfig{" +
                "streaming=" + streaming +
                ", ml=" + ml +
                ", baselineZThreshold=" + baselineZThreshold +
                ", iqrMultiplier=" + iqrMultiplier +
                '}';
    }
}
