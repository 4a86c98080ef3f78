/**
 * Per-packet fan-out to the detection layers and merge of their results.
 *
 * @since 1.0.0
 */
package com.packetsentinel.core.coordinator;
