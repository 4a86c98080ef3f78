package com.packetsentinel.core.detection.anomaly;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Trains {@link IsolationForest} models.
 *
 * <p>
 * Defaults: 100 trees, subsamples of 256 points, contamination 0.1 and a
 * fixed seed of 42, so the same samples always produce the same model.
 * </p>
 *
 * @since 1.0.0
 */
public class IsolationForestTrainer implements AnomalyModelTrainer {

    private static final Logger LOG = LoggerFactory.getLogger(IsolationForestTrainer.class);

    public static final int DEFAULT_TREES = 100;
    public static final int DEFAULT_SUBSAMPLE_SIZE = 256;
    public static final double DEFAULT_CONTAMINATION = 0.1;
    public static final long DEFAULT_SEED = 42L;

    private final int treeCount;
    private final int subsampleSize;
    private final double contamination;
    private final long seed;

    public IsolationForestTrainer() {
        this(DEFAULT_TREES, DEFAULT_SUBSAMPLE_SIZE, DEFAULT_CONTAMINATION, DEFAULT_SEED);
    }

    public IsolationForestTrainer(int treeCount, int subsampleSize, double contamination, long seed) {
        if (treeCount < 1) {
            throw new IllegalArgumentException("treeCount must be >= 1, got: " + treeCount);
        }
        if (subsampleSize < 2) {
            throw new IllegalArgumentException("subsampleSize must be >= 2, got: " + subsampleSize);
        }
        if (!(contamination > 0.0 && contamination < 0.5)) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5), got: " + contamination);
        }
        this.treeCount = treeCount;
        this.subsampleSize = subsampleSize;
        this.contamination = contamination;
        this.seed = seed;
    }

    @Override
    public IsolationForest train(List<double[]> samples) {
        if (samples == null || samples.isEmpty()) {
            throw new IllegalArgumentException("Cannot train an isolation forest without samples");
        }
        long started = System.nanoTime();
        FeatureScaler scaler = FeatureScaler.fit(samples);
        double[][] scaled = new double[samples.size()][];
        for (int i = 0; i < scaled.length; i++) {
            scaled[i] = scaler.transform(samples.get(i));
        }

        Random random = new Random(seed);
        int psi = Math.min(subsampleSize, scaled.length);
        int heightLimit = (int) Math.ceil(Math.log(Math.max(psi, 2)) / Math.log(2));

        List<IsolationForest.Node> trees = new ArrayList<>(treeCount);
        for (int t = 0; t < treeCount; t++) {
            double[][] subsample = subsample(scaled, psi, random);
            trees.add(build(subsample, 0, subsample.length, 0, heightLimit, random));
        }

        IsolationForest unnormalised = new IsolationForest(scaler, trees, psi, 1.0);
        double[] trainingScores = new double[scaled.length];
        for (int i = 0; i < scaled.length; i++) {
            trainingScores[i] = unnormalised.scoreScaled(scaled[i]);
        }
        double quantile = IsolationForest.quantile(trainingScores, 1.0 - contamination);
        IsolationForest model = new IsolationForest(scaler, trees, psi, quantile);

        LOG.debug("Trained {} on {} samples in {} ms", model, samples.size(),
                (System.nanoTime() - started) / 1_000_000);
        return model;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static double[][] subsample(double[][] data, int size, Random random) {
        if (size >= data.length) {
            return data.clone();
        }
        // partial Fisher-Yates over an index array
        int[] indices = new int[data.length];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = i;
        }
        double[][] picked = new double[size][];
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(indices.length - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
            picked[i] = data[indices[i]];
        }
        return picked;
    }

    // Builds over rows [from, to) of data, reordering rows in place.
    private static IsolationForest.Node build(double[][] data, int from, int to, int depth, int heightLimit,
            Random random) {
        int size = to - from;
        if (size <= 1 || depth >= heightLimit) {
            return IsolationForest.Node.leaf(size);
        }

        int width = data[from].length;
        List<Integer> splittable = new ArrayList<>(width);
        double[] mins = new double[width];
        double[] maxs = new double[width];
        for (int f = 0; f < width; f++) {
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (int i = from; i < to; i++) {
                min = Math.min(min, data[i][f]);
                max = Math.max(max, data[i][f]);
            }
            mins[f] = min;
            maxs[f] = max;
            if (max > min) {
                splittable.add(f);
            }
        }
        if (splittable.isEmpty()) {
            return IsolationForest.Node.leaf(size);
        }

        int feature = splittable.get(random.nextInt(splittable.size()));
        double split = mins[feature] + random.nextDouble() * (maxs[feature] - mins[feature]);
        if (split <= mins[feature]) {
            split = Math.nextUp(mins[feature]);
        }

        // partition: values < split go left
        int boundary = from;
        for (int i = from; i < to; i++) {
            if (data[i][feature] < split) {
                double[] tmp = data[boundary];
                data[boundary] = data[i];
                data[i] = tmp;
                boundary++;
            }
        }

        IsolationForest.Node left = build(data, from, boundary, depth + 1, heightLimit, random);
        IsolationForest.Node right = build(data, boundary, to, depth + 1, heightLimit, random);
        return IsolationForest.Node.split(feature, split, left, right);
    }
}
