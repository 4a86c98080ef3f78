package com.packetsentinel.core.tracking;

import com.packetsentinel.core.model.ConnectionState;
import com.packetsentinel.core.model.FlowKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Tracks connection duration per flow.
 *
 * <p>
 * Each flow maps to an immutable {@link ConnectionState} that is replaced
 * through {@link ConcurrentMap#compute}, giving per-key atomic updates
 * without a global lock. A flow idle for longer than the idle timeout is
 * treated as closed: queries ignore it, the next packet starts a fresh
 * connection, and {@link #sweep(Instant)} removes it.
 * </p>
 *
 * @since 1.0.0
 */
public class ConnectionTracker implements FeatureTracker {

    private static final Logger LOG = LoggerFactory.getLogger(ConnectionTracker.class);

    private final ConcurrentMap<FlowKey, ConnectionState> connections = new ConcurrentHashMap<>();
    private final Duration idleTimeout;

    public ConnectionTracker(Duration idleTimeout) {
        this.idleTimeout = Objects.requireNonNull(idleTimeout, "idleTimeout must not be null");
        if (idleTimeout.isNegative() || idleTimeout.isZero()) {
            throw new IllegalArgumentException("idleTimeout must be positive, got: " + idleTimeout);
        }
    }

    /**
     * Upsert the flow with one packet of {@code bytes} seen at {@code at}.
     *
     * @return the state after the update
     */
    public ConnectionState record(FlowKey flow, Instant at, long bytes) {
        Objects.requireNonNull(flow, "flow must not be null");
        Objects.requireNonNull(at, "at must not be null");
        return connections.compute(flow, (key, current) -> {
            if (current == null || current.isIdle(at, idleTimeout)) {
                return ConnectionState.start(key, at, bytes);
            }
            return current.update(at, bytes);
        });
    }

    /**
     * @return seconds since the flow was first seen, or empty when the flow
     *         is unknown or idle past the timeout
     */
    public OptionalDouble query(FlowKey flow, Instant now) {
        ConnectionState state = connections.get(flow);
        if (state == null || state.isIdle(now, idleTimeout)) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(state.elapsedSeconds(now));
    }

    /**
     * @return the live state of the flow, if any
     */
    public Optional<ConnectionState> state(FlowKey flow) {
        return Optional.ofNullable(connections.get(flow));
    }

    @Override
    public int sweep(Instant now) {
        int evicted = 0;
        for (FlowKey flow : connections.keySet()) {
            boolean[] removed = new boolean[1];
            connections.computeIfPresent(flow, (key, state) -> {
                if (state.isIdle(now, idleTimeout)) {
                    removed[0] = true;
                    return null;
                }
                return state;
            });
            if (removed[0]) {
                evicted++;
            }
        }
        if (evicted > 0) {
            LOG.debug("Evicted {} idle connection(s), {} active", evicted, connections.size());
        }
        return evicted;
    }

    /**
     * @return number of tracked flows that are not idle as of {@code now}
     */
    public int activeCount(Instant now) {
        int active = 0;
        for (ConnectionState state : connections.values()) {
            if (!state.isIdle(now, idleTimeout)) {
                active++;
            }
        }
        return active;
    }

    @Override
    public int size() {
        return connections.size();
    }

    public Duration getIdleTimeout() {
        return idleTimeout;
    }
}
