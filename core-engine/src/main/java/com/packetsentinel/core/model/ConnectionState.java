package com.packetsentinel.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of one tracked flow.
 *
 * <p>
 * The connection tracker replaces the snapshot atomically on every packet
 * via {@link #update(Instant, long)}, so readers always see a consistent
 * (first-seen, last-seen, counters) tuple.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConnectionState {

    private final FlowKey flow;
    private final Instant firstSeen;
    private final Instant lastSeen;
    private final long bytes;
    private final long packets;

    private ConnectionState(FlowKey flow, Instant firstSeen, Instant lastSeen, long bytes, long packets) {
        this.flow = Objects.requireNonNull(flow, "flow must not be null");
        this.firstSeen = Objects.requireNonNull(firstSeen, "firstSeen must not be null");
        this.lastSeen = Objects.requireNonNull(lastSeen, "lastSeen must not be null");
        this.bytes = bytes;
        this.packets = packets;
    }

    /**
     * @param flow  the flow
     * @param at    instant of the first packet
     * @param bytes size of the first packet
     * @return state with one packet
     */
    public static ConnectionState start(FlowKey flow, Instant at, long bytes) {
        return new ConnectionState(flow, at, at, Math.max(0, bytes), 1);
    }

    /**
     * @return a new state with one more packet of {@code bytes} seen at
     *         {@code at}; out-of-order instants never move
     *         {@code lastSeen} backwards
     */
    public ConnectionState update(Instant at, long bytes) {
        Instant newLast = at.isAfter(lastSeen) ? at : lastSeen;
        return new ConnectionState(flow, firstSeen, newLast, this.bytes + Math.max(0, bytes), packets + 1);
    }

    /**
     * @return seconds between first-seen and {@code now}, never negative
     */
    public double elapsedSeconds(Instant now) {
        long millis = Duration.between(firstSeen, now).toMillis();
        return Math.max(0, millis) / 1000.0;
    }

    /**
     * @return {@code true} when nothing was seen for longer than
     *         {@code idleTimeout} before {@code now}
     */
    public boolean isIdle(Instant now, Duration idleTimeout) {
        return Duration.between(lastSeen, now).compareTo(idleTimeout) > 0;
    }

    public FlowKey getFlow() {
        return flow;
    }

    public Instant getFirstSeen() {
        return firstSeen;
    }

    public Instant getLastSeen() {
        return lastSeen;
    }

    public long getBytes() {
        return bytes;
    }

    public long getPackets() {
        return packets;
    }

    @Override
    public String toString() {
        return "ConnectionState{" + flow +
                ", firstSeen=" + firstSeen +
                ", lastSeen=" + lastSeen +
                ", bytes=" + bytes +
                ", packets=" + packets +
                '}';
    }
}
