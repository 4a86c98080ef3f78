/**
 * Unsupervised anomaly detection layer.
 *
 * <p>
 * {@link com.packetsentinel.core.detection.anomaly.AnomalyDetector} buffers
 * feature vectors, trains an
 * {@link com.packetsentinel.core.detection.anomaly.AnomalyModel} once enough
 * samples are in and swaps in retrained models atomically. The default model
 * is an {@link com.packetsentinel.core.detection.anomaly.IsolationForest}.
 * </p>
 *
 * @since 1.0.0
 */
package com.packetsentinel.core.detection.anomaly;
