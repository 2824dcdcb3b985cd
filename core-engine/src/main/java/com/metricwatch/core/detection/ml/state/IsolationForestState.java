package com.metricwatch.core.detection.ml.state;

import java.util.List;

/**
 * Trees, sub-sample size and calibrated offset of an Isolation Forest.
 */
public class IsolationForestState {

    private int sampleSize;
    private double offset;
    private List<IsolationTreeState> trees;

    public int getSampleSize() {
        return sampleSize;
    }

    public void setSampleSize(int sampleSize) {
        this.sampleSize = sampleSize;
    }

    public double getOffset() {
        return offset;
    }

    public void setOffset(double offset) {
        this.offset = offset;
    }

    public List<IsolationTreeState> getTrees() {
        return trees;
    }

    public void setTrees(List<IsolationTreeState> trees) {
        this.trees = trees;
    }
}
