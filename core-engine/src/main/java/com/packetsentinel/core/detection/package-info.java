/**
 * The detector contract shared by the signature, anomaly and classification
 * layers, plus the per-packet context they read.
 *
 * @since 1.0.0
 */
package com.packetsentinel.core.detection;
