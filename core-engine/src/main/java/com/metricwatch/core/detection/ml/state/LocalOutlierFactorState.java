package com.metricwatch.core.detection.ml.state;

/**
 * Training points and per-point density data of a Local Outlier Factor model.
 */
public class LocalOutlierFactorState {

    private int neighbors;
    private double offset;
    private double[][] points;
    private double[] kthNeighborDistances;
    private double[] densities;

    public int getNeighbors() {
        return neighbors;
    }

    public void setNeighbors(int neighbors) {
        this.neighbors = neighbors;
    }

    public double getOffset() {
        return offset;
    }

    public void setOffset(double offset) {
        this.offset = offset;
    }

    public double[][] getPoints() {
        return points;
    }

    public void setPoints(double[][] points) {
        this.points = points;
    }

    public double[] getKthNeighborDistances() {
        return kthNeighborDistances;
    }

    public void setKthNeighborDistances(double[] kthNeighborDistances) {
        this.kthNeighborDistances = kthNeighborDistances;
    }

    public double[] getDensities() {
        return densities;
    }

    public void setDensities(double[] densities) {
        this.densities = densities;
    }
}
