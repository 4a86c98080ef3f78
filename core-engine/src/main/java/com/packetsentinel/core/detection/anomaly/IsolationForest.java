package com.packetsentinel.core.detection.anomaly;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Isolation Forest over standardized features.
 *
 * <p>
 * The anomaly score of a point is {@code 2^(-E[h(x)] / c(psi))}, where
 * {@code h(x)} is the path length of the point in a tree, {@code psi} the
 * subsample size and {@code c} the average path length of an unsuccessful
 * binary search tree lookup. Scores are in (0, 1]; values near 1 are
 * isolated quickly and therefore anomalous, values around 0.5 and below
 * are normal.
 * </p>
 *
 * <h3>Confidence</h3>
 * <p>
 * At training time the score quantile {@code q} at {@code 1 - contamination}
 * is recorded. The confidence of a point is
 * {@code clamp((score - q) / (1 - q), 0, 1)}, so only points scoring above
 * the bulk of the training data get a positive confidence.
 * </p>
 *
 * <p>
 * Instances are immutable; build them with {@link IsolationForestTrainer}.
 * </p>
 *
 * @since 1.0.0
 */
public final class IsolationForest implements AnomalyModel {

    private final FeatureScaler scaler;
    private final List<Node> trees;
    private final int subsampleSize;
    private final double scoreQuantile;

    IsolationForest(FeatureScaler scaler, List<Node> trees, int subsampleSize, double scoreQuantile) {
        this.scaler = Objects.requireNonNull(scaler, "scaler must not be null");
        this.trees = List.copyOf(trees);
        this.subsampleSize = subsampleSize;
        this.scoreQuantile = scoreQuantile;
    }

    @Override
    public double score(double[] features) {
        return scoreScaled(scaler.transform(features));
    }

    @Override
    public double confidence(double[] features) {
        double score = score(features);
        if (scoreQuantile >= 1.0) {
            return 0.0;
        }
        double confidence = (score - scoreQuantile) / (1.0 - scoreQuantile);
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    @Override
    public int featureCount() {
        return scaler.width();
    }

    public int treeCount() {
        return trees.size();
    }

    /**
     * @return training-score quantile used as the confidence origin
     */
    public double scoreQuantile() {
        return scoreQuantile;
    }

    double scoreScaled(double[] scaled) {
        double totalPath = 0.0;
        for (Node tree : trees) {
            totalPath += pathLength(tree, scaled, 0);
        }
        double meanPath = totalPath / trees.size();
        return Math.pow(2.0, -meanPath / averagePathLength(subsampleSize));
    }

    private static double pathLength(Node node, double[] point, int depth) {
        Node current = node;
        int currentDepth = depth;
        while (!current.isLeaf()) {
            current = point[current.feature] < current.splitValue ? current.left : current.right;
            currentDepth++;
        }
        return currentDepth + averagePathLength(current.size);
    }

    /**
     * Average path length of an unsuccessful search in a binary search tree
     * of {@code n} nodes.
     */
    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0.0;
        }
        if (n == 2) {
            return 1.0;
        }
        double harmonic = Math.log(n - 1.0) + 0.5772156649015329;
        return 2.0 * harmonic - 2.0 * (n - 1.0) / n;
    }

    // ---------------------------------------------------------------
    // Tree node
    // ---------------------------------------------------------------

    /**
     * Immutable isolation tree node. Leaves keep the number of training
     * points that reached them.
     */
    static final class Node {
        private final int feature;
        private final double splitValue;
        private final Node left;
        private final Node right;
        private final int size;

        private Node(int feature, double splitValue, Node left, Node right, int size) {
            this.feature = feature;
            this.splitValue = splitValue;
            this.left = left;
            this.right = right;
            this.size = size;
        }

        static Node leaf(int size) {
            return new Node(-1, 0.0, null, null, size);
        }

        static Node split(int feature, double splitValue, Node left, Node right) {
            return new Node(feature, splitValue, left, right, left.size + right.size);
        }

        boolean isLeaf() {
            return left == null;
        }
    }

    @Override
    public String toString() {
        return "IsolationForest{trees=" + trees.size()
                + ", subsampleSize=" + subsampleSize
                + ", features=" + scaler.width()
                + ", scoreQuantile=" + String.format("%.4f", scoreQuantile)
                + '}';
    }

    static double quantile(double[] values, double q) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double position = q * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        double fraction = position - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }
}
