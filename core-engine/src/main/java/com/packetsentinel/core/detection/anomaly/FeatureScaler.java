package com.packetsentinel.core.detection.anomaly;

import java.util.List;

/**
 * Standardizes features to zero mean and unit variance.
 *
 * <p>
 * Fitted once on the training samples and immutable afterwards. Features
 * with zero variance are only centred. Vectors of a different length are
 * zero-padded or truncated to the fitted width.
 * </p>
 *
 * @since 1.0.0
 */
public final class FeatureScaler {

    private final double[] means;
    private final double[] stdDevs;

    private FeatureScaler(double[] means, double[] stdDevs) {
        this.means = means;
        this.stdDevs = stdDevs;
    }

    /**
     * @param samples non-empty list of equally sized vectors
     * @return scaler fitted to {@code samples}
     */
    public static FeatureScaler fit(List<double[]> samples) {
        if (samples == null || samples.isEmpty()) {
            throw new IllegalArgumentException("Cannot fit a scaler without samples");
        }
        int width = samples.get(0).length;
        double[] means = new double[width];
        double[] stdDevs = new double[width];

        for (double[] sample : samples) {
            for (int i = 0; i < width; i++) {
                means[i] += valueAt(sample, i);
            }
        }
        for (int i = 0; i < width; i++) {
            means[i] /= samples.size();
        }
        for (double[] sample : samples) {
            for (int i = 0; i < width; i++) {
                double diff = valueAt(sample, i) - means[i];
                stdDevs[i] += diff * diff;
            }
        }
        for (int i = 0; i < width; i++) {
            double std = Math.sqrt(stdDevs[i] / samples.size());
            stdDevs[i] = std == 0 ? 1.0 : std;
        }
        return new FeatureScaler(means, stdDevs);
    }

    /**
     * @return a new, standardized copy of {@code features}
     */
    public double[] transform(double[] features) {
        double[] scaled = new double[means.length];
        for (int i = 0; i < means.length; i++) {
            scaled[i] = (valueAt(features, i) - means[i]) / stdDevs[i];
        }
        return scaled;
    }

    public int width() {
        return means.length;
    }

    private static double valueAt(double[] values, int index) {
        return index < values.length ? values[index] : 0.0;
    }
}
