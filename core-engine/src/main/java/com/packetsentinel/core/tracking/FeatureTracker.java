package com.packetsentinel.core.tracking;

import java.time.Instant;

/**
 * Common contract of the per-key feature trackers.
 *
 * <p>
 * Implementations must tolerate {@link #sweep(Instant)} running on a timer
 * thread while workers record and query concurrently.
 * </p>
 *
 * @since 1.0.0
 */
public interface FeatureTracker {

    /**
     * Evict every entry that has expired as of {@code now}.
     *
     * @param now reference instant
     * @return number of evicted entries
     */
    int sweep(Instant now);

    /**
     * @return number of keys currently tracked
     */
    int size();
}
