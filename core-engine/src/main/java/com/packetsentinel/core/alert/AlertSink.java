package com.packetsentinel.core.alert;

import com.packetsentinel.core.model.Alert;
import com.packetsentinel.core.model.Detection;
import com.packetsentinel.core.model.DetectorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Deduplicates detections into alerts, persists and broadcasts new ones.
 *
 * <h3>Deduplication</h3>
 * <p>
 * Alerts are indexed by (source IP, detector kind, description). The lookup
 * and the insert of a new alert happen inside one
 * {@link ConcurrentMap#compute} call, so two workers submitting the same
 * detection can never both create an alert. An indexed alert absorbs
 * repeats until {@code window} has passed since its creation or it has been
 * resolved; a repeat only updates last-seen time and occurrence count.
 * </p>
 *
 * <h3>Side Effects</h3>
 * <p>
 * Only a newly created alert is persisted (through {@link RetryingWriter})
 * and handed to the listeners, both outside the index lock. A failing
 * listener is logged and does not affect the others.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertSink {

    private static final Logger LOG = LoggerFactory.getLogger(AlertSink.class);

    static final String WRITE_TYPE = "alert";

    private final ConcurrentMap<DedupKey, Alert> index = new ConcurrentHashMap<>();
    private final List<AlertListener> listeners = new CopyOnWriteArrayList<>();
    private final PersistenceSink persistence;
    private final RetryingWriter writer;
    private final Duration window;
    private final Clock clock;

    public AlertSink(PersistenceSink persistence, RetryingWriter writer, Duration window, Clock clock) {
        this.persistence = Objects.requireNonNull(persistence, "persistence must not be null");
        this.writer = Objects.requireNonNull(writer, "writer must not be null");
        this.window = Objects.requireNonNull(window, "window must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive, got: " + window);
        }
    }

    public void addListener(AlertListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    /**
     * Submit a detection.
     *
     * @param detection detection to promote
     * @return the new alert, or the existing one that absorbed the detection
     */
    public Alert submit(Detection detection) {
        Objects.requireNonNull(detection, "detection must not be null");
        DedupKey key = DedupKey.of(detection);
        Instant now = clock.instant();
        boolean[] created = new boolean[1];

        Alert alert = index.compute(key, (k, existing) -> {
            if (existing != null && absorbs(existing, now)) {
                existing.touch(now);
                return existing;
            }
            created[0] = true;
            return Alert.create(detection, now);
        });

        if (!created[0]) {
            LOG.trace("Detection absorbed by alert {}", alert.getId());
            return alert;
        }

        LOG.info("New {} alert {} [{}] from {}: {}", detection.getSeverity().id(), alert.getId(),
                detection.getKind().id(), detection.getSourceIp(), detection.getDescription());
        writer.write(WRITE_TYPE, alert, () -> persistence.persistAlert(alert));
        broadcast(alert);
        return alert;
    }

    /**
     * Resolve an indexed alert and persist the change.
     *
     * @param alertId alert id
     * @return {@code true} if the alert was found and was not yet resolved
     */
    public boolean resolve(String alertId) {
        Optional<Alert> found = find(alertId);
        if (found.isEmpty()) {
            LOG.debug("Cannot resolve unknown or expired alert {}", alertId);
            return false;
        }
        Alert alert = found.get();
        if (!alert.resolve(clock.instant())) {
            return false;
        }
        LOG.info("Alert {} resolved", alertId);
        writer.write(WRITE_TYPE, alert, () -> persistence.persistAlert(alert));
        return true;
    }

    /**
     * Drop index entries that can no longer absorb repeats.
     *
     * @return number of removed entries
     */
    public int sweep(Instant now) {
        int removed = 0;
        for (DedupKey key : index.keySet()) {
            boolean[] dropped = new boolean[1];
            index.computeIfPresent(key, (k, alert) -> {
                dropped[0] = !absorbs(alert, now);
                return dropped[0] ? null : alert;
            });
            if (dropped[0]) {
                removed++;
            }
        }
        if (removed > 0) {
            LOG.debug("Dedup sweep removed {} entr(ies), {} remaining", removed, index.size());
        }
        return removed;
    }

    public Optional<Alert> find(String alertId) {
        for (Alert alert : index.values()) {
            if (alert.getId().equals(alertId)) {
                return Optional.of(alert);
            }
        }
        return Optional.empty();
    }

    /**
     * @return alerts currently in the dedup index
     */
    public List<Alert> indexedAlerts() {
        return new ArrayList<>(index.values());
    }

    public int indexSize() {
        return index.size();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private boolean absorbs(Alert alert, Instant now) {
        return !alert.isResolved() && Duration.between(alert.getCreatedAt(), now).compareTo(window) < 0;
    }

    private void broadcast(Alert alert) {
        for (AlertListener listener : listeners) {
            try {
                listener.onAlert(alert);
            } catch (RuntimeException e) {
                LOG.error("Alert listener {} failed for alert {}", listener, alert.getId(), e);
            }
        }
    }

    /**
     * (source IP, detector kind, description).
     */
    static final class DedupKey {
        private final String sourceIp;
        private final DetectorKind kind;
        private final String description;

        private DedupKey(String sourceIp, DetectorKind kind, String description) {
            this.sourceIp = sourceIp;
            this.kind = kind;
            this.description = description;
        }

        static DedupKey of(Detection detection) {
            return new DedupKey(detection.getSourceIp(), detection.getKind(), detection.getDescription());
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof DedupKey that))
                return false;
            return kind == that.kind && sourceIp.equals(that.sourceIp) && description.equals(that.description);
        }

        @Override
        public int hashCode() {
            return Objects.hash(sourceIp, kind, description);
        }
    }
}
