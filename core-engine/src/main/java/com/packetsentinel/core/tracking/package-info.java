/**
 * Stateful per-flow and per-source trackers feeding the feature extractor.
 *
 * <p>
 * Every tracker is a {@link java.util.concurrent.ConcurrentHashMap} whose
 * values are updated only through {@code compute} and
 * {@code computeIfPresent}. Updates for one key are atomic; different keys
 * never contend on a shared lock. Expiry is lazy on access and eager on
 * {@link com.packetsentinel.core.tracking.FeatureTracker#sweep(java.time.Instant)}.
 * </p>
 *
 * @since 1.0.0
 */
package com.packetsentinel.core.tracking;
