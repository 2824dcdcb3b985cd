package com.metricwatch.core.detection.ml;

import com.metricwatch.core.detection.ml.state.IsolationForestState;
import com.metricwatch.core.detection.ml.state.IsolationTreeState;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Isolation Forest: an ensemble of random partitioning trees.
 *
 * <p>
 * Each tree is grown on a random sub-sample (without replacement) by picking a
 * random non-constant feature and a uniform split value between that
 * feature's minimum and maximum, until a node holds one row or the depth
 * limit {@code ceil(log2(sampleSize))} is reached. Anomalies are isolated
 * closer to the root, so a shorter average path means a more abnormal row.
 * </p>
 *
 * <p>
 * Raw score: {@code -2^(-E[h(x)] / c(sampleSize))}, where {@code c(n)} is the
 * average path length of an unsuccessful binary-search-tree lookup. Values
 * near -1 are anomalous, values near -0.5 or above are normal.
 * </p>
 */
final class IsolationForest implements AnomalyModel {

    private static final double EULER_GAMMA = 0.5772156649015329;

    private final List<IsolationTree> trees;
    private final int sampleSize;
    private final double offset;

    IsolationForest(List<IsolationTree> trees, int sampleSize, double offset) {
        if (trees.isEmpty()) {
            throw new IllegalArgumentException("An isolation forest needs at least one tree");
        }
        this.trees = Collections.unmodifiableList(new ArrayList<>(trees));
        this.sampleSize = sampleSize;
        this.offset = offset;
    }

    @Override
    public Algorithm algorithm() {
        return Algorithm.ISOLATION_FOREST;
    }

    @Override
    public double[] scoreSamples(double[][] scaled) {
        double normalizer = averagePathLength(sampleSize);
        double[] scores = new double[scaled.length];
        for (int i = 0; i < scaled.length; i++) {
            double totalPath = 0;
            for (IsolationTree tree : trees) {
                totalPath += tree.pathLength(scaled[i]);
            }
            double meanPath = totalPath / trees.size();
            scores[i] = -Math.pow(2.0, -meanPath / normalizer);
        }
        return scores;
    }

    @Override
    public double offset() {
        return offset;
    }

    int sampleSize() {
        return sampleSize;
    }

    List<IsolationTree> trees() {
        return trees;
    }

    /**
     * Average path length of an unsuccessful search in a binary search tree
     * built from {@code n} points; the expected depth correction for a leaf
     * holding {@code n} rows.
     */
    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0.0;
        }
        if (n == 2) {
            return 1.0;
        }
        return 2.0 * (Math.log(n - 1.0) + EULER_GAMMA) - 2.0 * (n - 1.0) / n;
    }

    // ---------------------------------------------------------------
    // State mapping
    // ---------------------------------------------------------------

    IsolationForestState toState() {
        IsolationForestState state = new IsolationForestState();
        state.setSampleSize(sampleSize);
        state.setOffset(offset);
        List<IsolationTreeState> treeStates = new ArrayList<>(trees.size());
        for (IsolationTree tree : trees) {
            treeStates.add(tree.toState());
        }
        state.setTrees(treeStates);
        return state;
    }

    static IsolationForest fromState(IsolationForestState state, int features) {
        if (state.getTrees() == null || state.getTrees().isEmpty()) {
            throw new IllegalArgumentException("Isolation forest state has no trees");
        }
        if (state.getSampleSize() < 1) {
            throw new IllegalArgumentException("Invalid sample size: " + state.getSampleSize());
        }
        List<IsolationTree> trees = new ArrayList<>(state.getTrees().size());
        for (IsolationTreeState treeState : state.getTrees()) {
            trees.add(IsolationTree.fromState(treeState, features));
        }
        return new IsolationForest(trees, state.getSampleSize(), state.getOffset());
    }

    // ---------------------------------------------------------------
    // Tree
    // ---------------------------------------------------------------

    /**
     * One isolation tree stored as parallel node arrays.
     */
    static final class IsolationTree {

        private static final int LEAF = -1;

        private final int[] feature;
        private final double[] split;
        private final int[] left;
        private final int[] right;
        private final int[] size;

        private IsolationTree(int[] feature, double[] split, int[] left, int[] right, int[] size) {
            this.feature = feature;
            this.split = split;
            this.left = left;
            this.right = right;
            this.size = size;
        }

        /**
         * Depth at which {@code point} lands, plus the expected remaining depth
         * of the leaf it lands in.
         */
        double pathLength(double[] point) {
            int node = 0;
            int depth = 0;
            while (feature[node] != LEAF) {
                node = point[feature[node]] <= split[node] ? left[node] : right[node];
                depth++;
            }
            return depth + averagePathLength(size[node]);
        }

        IsolationTreeState toState() {
            IsolationTreeState state = new IsolationTreeState();
            state.setFeature(feature.clone());
            state.setSplit(split.clone());
            state.setLeft(left.clone());
            state.setRight(right.clone());
            state.setSize(size.clone());
            return state;
        }

        static IsolationTree fromState(IsolationTreeState state, int features) {
            int[] feature = state.getFeature();
            double[] split = state.getSplit();
            int[] left = state.getLeft();
            int[] right = state.getRight();
            int[] size = state.getSize();
            if (feature == null || split == null || left == null || right == null || size == null) {
                throw new IllegalArgumentException("Isolation tree state is incomplete");
            }
            int nodes = feature.length;
            if (nodes == 0 || split.length != nodes || left.length != nodes
                    || right.length != nodes || size.length != nodes) {
                throw new IllegalArgumentException("Isolation tree node arrays have inconsistent lengths");
            }
            for (int i = 0; i < nodes; i++) {
                if (feature[i] == LEAF) {
                    continue;
                }
                if (feature[i] < 0 || feature[i] >= features
                        || left[i] <= i || left[i] >= nodes
                        || right[i] <= i || right[i] >= nodes) {
                    throw new IllegalArgumentException("Isolation tree node " + i + " is malformed");
                }
            }
            return new IsolationTree(feature.clone(), split.clone(), left.clone(), right.clone(),
                    size.clone());
        }
    }

    // ---------------------------------------------------------------
    // Training
    // ---------------------------------------------------------------

    /**
     * Grows a forest from standardized rows. Reusing the same seed on the same
     * data yields the same forest.
     */
    static final class Trainer implements AnomalyModelTrainer {

        private final int numTrees;
        private final int maxSamples;
        private final long seed;

        Trainer(int numTrees, int maxSamples, long seed) {
            if (numTrees < 1) {
                throw new IllegalArgumentException("numTrees must be >= 1, got: " + numTrees);
            }
            if (maxSamples < 2) {
                throw new IllegalArgumentException("maxSamples must be >= 2, got: " + maxSamples);
            }
            this.numTrees = numTrees;
            this.maxSamples = maxSamples;
            this.seed = seed;
        }

        @Override
        public AnomalyModel train(double[][] scaled, double contamination) {
            int rows = scaled.length;
            int sampleSize = Math.min(maxSamples, rows);
            int maxDepth = (int) Math.ceil(Math.log(Math.max(sampleSize, 2)) / Math.log(2));
            Random random = new Random(seed);

            int[] indices = new int[rows];
            for (int i = 0; i < rows; i++) {
                indices[i] = i;
            }

            List<IsolationTree> trees = new ArrayList<>(numTrees);
            for (int t = 0; t < numTrees; t++) {
                // Partial Fisher-Yates: the first sampleSize slots become the sub-sample
                for (int i = 0; i < sampleSize; i++) {
                    int j = i + random.nextInt(rows - i);
                    int tmp = indices[i];
                    indices[i] = indices[j];
                    indices[j] = tmp;
                }
                int[] sample = Arrays.copyOf(indices, sampleSize);
                trees.add(new TreeBuilder(scaled, sampleSize, maxDepth, random).build(sample));
            }

            IsolationForest unCalibrated = new IsolationForest(trees, sampleSize, 0.0);
            double offset = AnomalyModel.calibrateOffset(unCalibrated.scoreSamples(scaled), contamination);
            return new IsolationForest(trees, sampleSize, offset);
        }
    }

    private static final class TreeBuilder {

        private final double[][] data;
        private final int maxDepth;
        private final Random random;

        private final int[] feature;
        private final double[] split;
        private final int[] left;
        private final int[] right;
        private final int[] size;
        private int nodeCount;

        TreeBuilder(double[][] data, int sampleSize, int maxDepth, Random random) {
            this.data = data;
            this.maxDepth = maxDepth;
            this.random = random;
            // A binary tree with at most sampleSize leaves has fewer than 2 * sampleSize nodes
            int capacity = 2 * sampleSize;
            this.feature = new int[capacity];
            this.split = new double[capacity];
            this.left = new int[capacity];
            this.right = new int[capacity];
            this.size = new int[capacity];
        }

        IsolationTree build(int[] rows) {
            grow(rows, 0);
            return new IsolationTree(
                    Arrays.copyOf(feature, nodeCount),
                    Arrays.copyOf(split, nodeCount),
                    Arrays.copyOf(left, nodeCount),
                    Arrays.copyOf(right, nodeCount),
                    Arrays.copyOf(size, nodeCount));
        }

        private int grow(int[] rows, int depth) {
            int node = nodeCount++;
            size[node] = rows.length;
            feature[node] = IsolationTree.LEAF;

            if (rows.length <= 1 || depth >= maxDepth) {
                return node;
            }

            int features = data[rows[0]].length;
            double[] min = new double[features];
            double[] max = new double[features];
            Arrays.fill(min, Double.POSITIVE_INFINITY);
            Arrays.fill(max, Double.NEGATIVE_INFINITY);
            for (int row : rows) {
                for (int f = 0; f < features; f++) {
                    double v = data[row][f];
                    min[f] = Math.min(min[f], v);
                    max[f] = Math.max(max[f], v);
                }
            }

            int[] candidates = new int[features];
            int candidateCount = 0;
            for (int f = 0; f < features; f++) {
                if (max[f] > min[f]) {
                    candidates[candidateCount++] = f;
                }
            }
            if (candidateCount == 0) {
                // All rows identical: nothing left to isolate
                return node;
            }

            int f = candidates[random.nextInt(candidateCount)];
            double value = min[f] + random.nextDouble() * (max[f] - min[f]);

            int leftCount = 0;
            for (int row : rows) {
                if (data[row][f] <= value) {
                    leftCount++;
                }
            }
            int[] leftRows = new int[leftCount];
            int[] rightRows = new int[rows.length - leftCount];
            int li = 0;
            int ri = 0;
            for (int row : rows) {
                if (data[row][f] <= value) {
                    leftRows[li++] = row;
                } else {
                    rightRows[ri++] = row;
                }
            }

            feature[node] = f;
            split[node] = value;
            left[node] = grow(leftRows, depth + 1);
            right[node] = grow(rightRows, depth + 1);
            return node;
        }
    }
}
