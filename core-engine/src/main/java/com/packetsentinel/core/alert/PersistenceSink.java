package com.packetsentinel.core.alert;

import com.packetsentinel.core.model.Alert;
import com.packetsentinel.core.model.TrafficStatsSnapshot;

/**
 * Destination for alerts and traffic snapshots.
 *
 * <p>
 * Implementations may throw any {@link RuntimeException} on failure; callers
 * retry through {@link RetryingWriter}. {@link #persistAlert(Alert)} is
 * called again for an alert whose state changed (for example on resolve),
 * so writes should upsert by alert id.
 * </p>
 *
 * @since 1.0.0
 */
public interface PersistenceSink {

    void persistAlert(Alert alert);

    void persistSnapshot(TrafficStatsSnapshot snapshot);
}
