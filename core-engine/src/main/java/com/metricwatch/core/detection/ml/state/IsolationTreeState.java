package com.metricwatch.core.detection.ml.state;

/**
 * One isolation tree as parallel node arrays. Node 0 is the root; a node whose
 * {@code feature} is -1 is a leaf holding {@code size} training rows.
 */
public class IsolationTreeState {

    private int[] feature;
    private double[] split;
    private int[] left;
    private int[] right;
    private int[] size;

    public int[] getFeature() {
        return feature;
    }

    public void setFeature(int[] feature) {
        this.feature = feature;
    }

    public double[] getSplit() {
        return split;
    }

    public void setSplit(double[] split) {
        this.split = split;
    }

    public int[] getLeft() {
        return left;
    }

    public void setLeft(int[] left) {
        this.left = left;
    }

    public int[] getRight() {
        return right;
    }

    public void setRight(int[] right) {
        this.right = right;
    }

    public int[] getSize() {
        return size;
    }

    public void setSize(int[] size) {
        this.size = size;
    }
}
