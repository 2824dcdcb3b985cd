package com.metricwatch.core.detection.ml;

import com.metricwatch.core.detection.ml.state.LocalOutlierFactorState;

import java.util.Arrays;

/**
 * Local Outlier Factor in novelty mode: new rows are compared with the
 * density of their nearest training neighbours.
 *
 * <p>
 * For a query {@code x} with neighbours {@code N_k(x)} among the training
 * rows:
 * </p>
 * <ul>
 * <li>{@code reach(x, o) = max(kDist(o), d(x, o))}</li>
 * <li>{@code lrd(x) = 1 / mean(reach(x, o))}</li>
 * <li>{@code lof(x) = mean(lrd(o)) / lrd(x)}</li>
 * </ul>
 * <p>
 * The raw score is {@code -lof(x)}: around -1 for rows as dense as their
 * neighbourhood, much lower for isolated rows. Neighbours are found by brute
 * force over Euclidean distance; training keeps only the {@code k} nearest
 * of each row, so memory grows with {@code rows * k}, not {@code rows^2}.
 * </p>
 */
final class LocalOutlierFactor implements AnomalyModel {

    private static final double DENSITY_EPSILON = 1e-10;

    private final int neighbors;
    private final double offset;
    private final double[][] points;
    private final double[] kthNeighborDistances;
    private final double[] densities;

    LocalOutlierFactor(int neighbors, double offset, double[][] points,
                       double[] kthNeighborDistances, double[] densities) {
        this.neighbors = neighbors;
        this.offset = offset;
        this.points = points;
        this.kthNeighborDistances = kthNeighborDistances;
        this.densities = densities;
    }

    @Override
    public Algorithm algorithm() {
        return Algorithm.LOCAL_OUTLIER_FACTOR;
    }

    @Override
    public double[] scoreSamples(double[][] scaled) {
        double[] scores = new double[scaled.length];
        double[] distances = new double[points.length];
        for (int i = 0; i < scaled.length; i++) {
            for (int j = 0; j < points.length; j++) {
                distances[j] = distance(scaled[i], points[j]);
            }
            int[] nearest = nearest(distances, neighbors, -1);
            scores[i] = -outlierFactor(nearest, distances);
        }
        return scores;
    }

    @Override
    public double offset() {
        return offset;
    }

    int neighbors() {
        return neighbors;
    }

    private double outlierFactor(int[] nearest, double[] distances) {
        double reachSum = 0;
        double neighborDensitySum = 0;
        for (int j : nearest) {
            reachSum += Math.max(kthNeighborDistances[j], distances[j]);
            neighborDensitySum += densities[j];
        }
        double density = 1.0 / (reachSum / nearest.length + DENSITY_EPSILON);
        return (neighborDensitySum / nearest.length) / density;
    }

    static double distance(double[] a, double[] b) {
        double sum = 0;
        for (int f = 0; f < a.length; f++) {
            double diff = a[f] - b[f];
            sum += diff * diff;
        }
        return Math.sqrt(sum);
    }

    /**
     * Indices of the {@code k} smallest distances, nearest first; ties broken
     * by index. Uses a bounded max-heap, so only {@code k} indices are held.
     *
     * @param distances distance to every training row
     * @param k         neighbours wanted
     * @param exclude   index to skip (the row itself during training), or -1
     */
    static int[] nearest(double[] distances, int k, int exclude) {
        int[] heap = new int[k];
        int size = 0;
        for (int i = 0; i < distances.length; i++) {
            if (i == exclude) {
                continue;
            }
            if (size < k) {
                heap[size] = i;
                siftUp(heap, size, distances);
                size++;
            } else if (k > 0 && closer(i, heap[0], distances)) {
                heap[0] = i;
                siftDown(heap, 0, size, distances);
            }
        }
        // Repeatedly move the farthest to the end: ascending order in place
        for (int end = size - 1; end > 0; end--) {
            int farthest = heap[0];
            heap[0] = heap[end];
            heap[end] = farthest;
            siftDown(heap, 0, end, distances);
        }
        return size == k ? heap : Arrays.copyOf(heap, size);
    }

    private static boolean closer(int a, int b, double[] distances) {
        int cmp = Double.compare(distances[a], distances[b]);
        return cmp != 0 ? cmp < 0 : a < b;
    }

    private static void siftUp(int[] heap, int index, double[] distances) {
        int child = index;
        while (child > 0) {
            int parent = (child - 1) / 2;
            if (!closer(heap[parent], heap[child], distances)) {
                return;
            }
            swap(heap, parent, child);
            child = parent;
        }
    }

    private static void siftDown(int[] heap, int index, int size, double[] distances) {
        int parent = index;
        while (true) {
            int left = 2 * parent + 1;
            if (left >= size) {
                return;
            }
            int right = left + 1;
            int farther = right < size && closer(heap[left], heap[right], distances) ? right : left;
            if (!closer(heap[parent], heap[farther], distances)) {
                return;
            }
            swap(heap, parent, farther);
            parent = farther;
        }
    }

    private static void swap(int[] heap, int i, int j) {
        int tmp = heap[i];
        heap[i] = heap[j];
        heap[j] = tmp;
    }

    // ---------------------------------------------------------------
    // State mapping
    // ---------------------------------------------------------------

    LocalOutlierFactorState toState() {
        LocalOutlierFactorState state = new LocalOutlierFactorState();
        state.setNeighbors(neighbors);
        state.setOffset(offset);
        double[][] copy = new double[points.length][];
        for (int i = 0; i < points.length; i++) {
            copy[i] = points[i].clone();
        }
        state.setPoints(copy);
        state.setKthNeighborDistances(kthNeighborDistances.clone());
        state.setDensities(densities.clone());
        return state;
    }

    static LocalOutlierFactor fromState(LocalOutlierFactorState state, int features) {
        double[][] points = state.getPoints();
        double[] kDist = state.getKthNeighborDistances();
        double[] densities = state.getDensities();
        if (points == null || kDist == null || densities == null) {
            throw new IllegalArgumentException("Local outlier factor state is incomplete");
        }
        if (points.length < 2 || kDist.length != points.length || densities.length != points.length) {
            throw new IllegalArgumentException("Local outlier factor arrays have inconsistent lengths");
        }
        if (state.getNeighbors() < 1 || state.getNeighbors() > points.length - 1) {
            throw new IllegalArgumentException("Invalid neighbour count: " + state.getNeighbors());
        }
        double[][] copy = new double[points.length][];
        for (int i = 0; i < points.length; i++) {
            if (points[i] == null || points[i].length != features) {
                throw new IllegalArgumentException("Training point " + i + " does not have "
                        + features + " feature(s)");
            }
            copy[i] = points[i].clone();
        }
        return new LocalOutlierFactor(state.getNeighbors(), state.getOffset(), copy,
                kDist.clone(), densities.clone());
    }

    // ---------------------------------------------------------------
    // Training
    // ---------------------------------------------------------------

    /**
     * Computes neighbourhoods and densities of the training rows. The
     * neighbour count is capped at {@code rows - 1}.
     */
    static final class Trainer implements AnomalyModelTrainer {

        private final int neighbors;

        Trainer(int neighbors) {
            if (neighbors < 1) {
                throw new IllegalArgumentException("neighbors must be >= 1, got: " + neighbors);
            }
            this.neighbors = neighbors;
        }

        @Override
        public AnomalyModel train(double[][] scaled, double contamination) {
            int n = scaled.length;
            int k = Math.min(neighbors, n - 1);

            // One row of distances at a time; only the k nearest are kept
            int[][] neighborhoods = new int[n][];
            double[][] neighborDistances = new double[n][];
            double[] kDist = new double[n];
            double[] row = new double[n];
            for (int i = 0; i < n; i++) {
                for (int j = 0; j < n; j++) {
                    row[j] = distance(scaled[i], scaled[j]);
                }
                int[] nearest = nearest(row, k, i);
                double[] nearestDistances = new double[k];
                for (int m = 0; m < k; m++) {
                    nearestDistances[m] = row[nearest[m]];
                }
                neighborhoods[i] = nearest;
                neighborDistances[i] = nearestDistances;
                kDist[i] = nearestDistances[k - 1];
            }

            double[] densities = new double[n];
            for (int i = 0; i < n; i++) {
                double reachSum = 0;
                for (int m = 0; m < k; m++) {
                    reachSum += Math.max(kDist[neighborhoods[i][m]], neighborDistances[i][m]);
                }
                densities[i] = 1.0 / (reachSum / k + DENSITY_EPSILON);
            }

            double[] trainingScores = new double[n];
            for (int i = 0; i < n; i++) {
                double neighborDensitySum = 0;
                for (int j : neighborhoods[i]) {
                    neighborDensitySum += densities[j];
                }
                trainingScores[i] = -(neighborDensitySum / k) / densities[i];
            }

            double[][] points = new double[n][];
            for (int i = 0; i < n; i++) {
                points[i] = scaled[i].clone();
            }
            double offset = AnomalyModel.calibrateOffset(trainingScores, contamination);
            return new LocalOutlierFactor(k, offset, points, kDist, densities);
        }
    }
}
