package com.packetsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A {@link Detection} promoted to persisted and broadcast form.
 *
 * <p>
 * Serialized to JSON and published to the configured Kafka alerts topic.
 * </p>
 *
 * <h3>Lifecycle</h3>
 * <p>
 * An alert is created by the alert sink the first time a (source IP,
 * detector kind, description) combination is seen inside the dedup window.
 * Repeats inside the window only {@link #touch(Instant) touch} it, bumping
 * {@code lastSeen} and {@code occurrences}. An operator may
 * {@link #resolve(Instant) resolve} it; a resolved alert no longer absorbs
 * repeats.
 * </p>
 *
 * <p>
 * The identity and detection fields are immutable. The mutable counters are
 * guarded by the instance monitor, so alerts can be touched from several
 * worker threads.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "id", "createdAt", "lastSeen", "occurrences", "resolved", "resolvedAt" })
public final class Alert {

    private final String id;
    private final Detection detection;
    private final Instant createdAt;

    private Instant lastSeen;
    private int occurrences;
    private boolean resolved;
    private Instant resolvedAt;

    private Alert(String id, Detection detection, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.detection = Objects.requireNonNull(detection, "detection must not be null");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
        this.lastSeen = createdAt;
        this.occurrences = 1;
    }

    /**
     * Create a new, unresolved alert with a random id.
     *
     * @param detection detection being promoted
     * @param createdAt creation instant
     * @return new alert with one occurrence
     */
    public static Alert create(Detection detection, Instant createdAt) {
        return new Alert(UUID.randomUUID().toString(), detection, createdAt);
    }

    // ---------------------------------------------------------------
    // Mutation
    // ---------------------------------------------------------------

    /**
     * Record another occurrence of the same activity.
     *
     * @param at when it was seen
     */
    public synchronized void touch(Instant at) {
        occurrences++;
        if (at.isAfter(lastSeen)) {
            lastSeen = at;
        }
    }

    /**
     * Mark the alert resolved. Resolving twice keeps the first instant.
     *
     * @param at resolution instant
     * @return {@code true} if this call resolved the alert
     */
    public synchronized boolean resolve(Instant at) {
        if (resolved) {
            return false;
        }
        resolved = true;
        resolvedAt = at;
        return true;
    }

    // ---------------------------------------------------------------
    // Getters (used by Jackson)
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public Detection getDetection() {
        return detection;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized Instant getLastSeen() {
        return lastSeen;
    }

    public synchronized int getOccurrences() {
        return occurrences;
    }

    public synchronized boolean isResolved() {
        return resolved;
    }

    public synchronized Instant getResolvedAt() {
        return resolvedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert that))
            return false;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Alert{" +
                "id=" + id +
                ", kind=" + detection.getKind().id() +
                ", severity=" + detection.getSeverity().id() +
                ", source=" + detection.getSourceIp() +
                ", description='" + detection.getDescription() + '\'' +
                ", occurrences=" + getOccurrences() +
                ", resolved=" + isResolved() +
                '}';
    }
}
