package com.packetsentinel.core.detection.anomaly;

import java.util.List;

/**
 * Builds an {@link AnomalyModel} from buffered samples.
 *
 * @since 1.0.0
 */
public interface AnomalyModelTrainer {

    /**
     * @param samples training vectors, all of the same length; not modified
     * @return a new model
     * @throws IllegalArgumentException if {@code samples} is empty
     */
    AnomalyModel train(List<double[]> samples);
}
