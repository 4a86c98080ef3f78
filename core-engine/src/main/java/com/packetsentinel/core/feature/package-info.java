/**
 * Feature extraction from packets and tracker state.
 *
 * @since 1.0.0
 */
package com.packetsentinel.core.feature;
