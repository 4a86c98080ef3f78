package com.packetsentinel.core.detection.anomaly;

/**
 * Lifecycle of the {@link AnomalyDetector}.
 *
 * <pre>
 * UNTRAINED -&gt; COLLECTING -&gt; TRAINED -&gt; RETRAINING -&gt; TRAINED ...
 * </pre>
 *
 * @since 1.0.0
 */
public enum AnomalyState {

    /** No sample seen yet. */
    UNTRAINED,

    /** Buffering samples until the minimum sample count is reached. */
    COLLECTING,

    /** A model is active and scoring. */
    TRAINED,

    /** A replacement model is being trained; the active one keeps scoring. */
    RETRAINING
}
