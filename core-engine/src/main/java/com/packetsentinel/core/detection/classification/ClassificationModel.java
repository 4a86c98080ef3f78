package com.packetsentinel.core.detection.classification;

import java.util.List;

/**
 * A pre-trained two-class (benign / malicious) model.
 *
 * @since 1.0.0
 */
public interface ClassificationModel {

    /**
     * @return number of features the model was trained on
     */
    int featureCount();

    /**
     * @return training feature names in model order
     */
    List<String> featureNames();

    /**
     * @param features exactly {@link #featureCount()} values
     * @return probability that the sample is malicious, in [0, 1]
     */
    double maliciousProbability(double[] features);
}
