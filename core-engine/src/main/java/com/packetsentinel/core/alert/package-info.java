/**
 * Alert deduplication, persistence and broadcast.
 *
 * <p>
 * {@link com.packetsentinel.core.alert.AlertSink} turns detections into
 * alerts. Writes go through
 * {@link com.packetsentinel.core.alert.RetryingWriter} to a
 * {@link com.packetsentinel.core.alert.PersistenceSink}; a persistence
 * outage is logged and counted but never stops detection.
 * </p>
 *
 * @since 1.0.0
 */
package com.packetsentinel.core.alert;
