package com.packetsentinel.core.tracking;

import com.packetsentinel.core.model.FlowKey;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Bytes-per-second of each flow since it was first seen.
 *
 * <p>
 * {@code rate = totalBytes / max(elapsedSeconds, 1)}. A flow idle past the
 * idle timeout restarts from zero on its next packet and is removed by
 * {@link #sweep(Instant)}.
 * </p>
 *
 * @since 1.0.0
 */
public class FlowRateCalculator implements FeatureTracker {

    private final ConcurrentMap<FlowKey, FlowTotals> flows = new ConcurrentHashMap<>();
    private final Duration idleTimeout;

    public FlowRateCalculator(Duration idleTimeout) {
        this.idleTimeout = Objects.requireNonNull(idleTimeout, "idleTimeout must not be null");
        if (idleTimeout.isNegative() || idleTimeout.isZero()) {
            throw new IllegalArgumentException("idleTimeout must be positive, got: " + idleTimeout);
        }
    }

    public void record(FlowKey flow, Instant at, long bytes) {
        Objects.requireNonNull(flow, "flow must not be null");
        Objects.requireNonNull(at, "at must not be null");
        long added = Math.max(0, bytes);
        flows.compute(flow, (key, totals) -> {
            if (totals == null || totals.isIdle(at, idleTimeout)) {
                return new FlowTotals(at, at, added);
            }
            Instant last = at.isAfter(totals.lastSeen) ? at : totals.lastSeen;
            return new FlowTotals(totals.firstSeen, last, totals.bytes + added);
        });
    }

    /**
     * @return bytes per second of the flow, {@code 0} when it is unknown or
     *         idle
     */
    public double query(FlowKey flow, Instant now) {
        FlowTotals totals = flows.get(flow);
        if (totals == null || totals.isIdle(now, idleTimeout)) {
            return 0.0;
        }
        double elapsed = Math.max(0, Duration.between(totals.firstSeen, now).toMillis()) / 1000.0;
        return totals.bytes / Math.max(elapsed, 1.0);
    }

    @Override
    public int sweep(Instant now) {
        int evicted = 0;
        for (FlowKey flow : flows.keySet()) {
            boolean[] removed = new boolean[1];
            flows.computeIfPresent(flow, (key, totals) -> {
                removed[0] = totals.isIdle(now, idleTimeout);
                return removed[0] ? null : totals;
            });
            if (removed[0]) {
                evicted++;
            }
        }
        return evicted;
    }

    @Override
    public int size() {
        return flows.size();
    }

    private static final class FlowTotals {
        private final Instant firstSeen;
        private final Instant lastSeen;
        private final long bytes;

        private FlowTotals(Instant firstSeen, Instant lastSeen, long bytes) {
            this.firstSeen = firstSeen;
            this.lastSeen = lastSeen;
            this.bytes = bytes;
        }

        private boolean isIdle(Instant now, Duration idleTimeout) {
            return Duration.between(lastSeen, now).compareTo(idleTimeout) > 0;
        }
    }
}
