/**
 * Supervised classification layer backed by pre-trained Weka models.
 *
 * @since 1.0.0
 */
package com.packetsentinel.core.detection.classification;
