package com.packetsentinel.core.detection.anomaly;

/**
 * A trained, immutable unsupervised model.
 *
 * <p>
 * Implementations are read concurrently by all workers and are never
 * mutated after training; retraining produces a new instance.
 * </p>
 *
 * @since 1.0.0
 */
public interface AnomalyModel {

    /**
     * @param features raw (unscaled) feature values
     * @return raw anomaly score, higher means more anomalous
     */
    double score(double[] features);

    /**
     * @param features raw (unscaled) feature values
     * @return score normalised to [0, 1] with the normalisation learned at
     *         training time
     */
    double confidence(double[] features);

    /**
     * @return number of features the model was trained on
     */
    int featureCount();
}
