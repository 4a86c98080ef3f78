/**
 * Windowed traffic statistics, flushed periodically to the persistence
 * sink.
 *
 * @since 1.0.0
 */
package com.packetsentinel.core.stats;
