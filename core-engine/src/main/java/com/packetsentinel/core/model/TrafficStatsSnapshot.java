package com.packetsentinel.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregate traffic statistics for one flush interval.
 *
 * <p>
 * Produced by the stats aggregator on every flush and never mutated
 * afterwards. Maps are unmodifiable copies; the top-N maps are ordered by
 * descending count.
 * </p>
 *
 * @since 1.0.0
 */
public final class TrafficStatsSnapshot {

    private final Instant windowStart;
    private final Instant windowEnd;
    private final long packetCount;
    private final long byteCount;
    private final Map<Protocol, Long> protocolCounts;
    private final int activeConnections;
    private final Map<DetectorKind, Long> detectionCounts;
    private final long droppedPackets;
    private final Map<String, Long> topSourceIps;
    private final Map<Integer, Long> topDestinationPorts;

    private TrafficStatsSnapshot(Builder b) {
        this.windowStart = Objects.requireNonNull(b.windowStart, "windowStart must not be null");
        this.windowEnd = Objects.requireNonNull(b.windowEnd, "windowEnd must not be null");
        if (windowEnd.isBefore(windowStart)) {
            throw new IllegalArgumentException("windowEnd must not be before windowStart");
        }
        this.packetCount = b.packetCount;
        this.byteCount = b.byteCount;
        this.protocolCounts = Collections.unmodifiableMap(copyEnum(b.protocolCounts, Protocol.class));
        this.activeConnections = b.activeConnections;
        this.detectionCounts = Collections.unmodifiableMap(copyEnum(b.detectionCounts, DetectorKind.class));
        this.droppedPackets = b.droppedPackets;
        this.topSourceIps = Collections.unmodifiableMap(new LinkedHashMap<>(b.topSourceIps));
        this.topDestinationPorts = Collections.unmodifiableMap(new LinkedHashMap<>(b.topDestinationPorts));
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Derived values
    // ---------------------------------------------------------------

    /**
     * @return window length in seconds, at least one
     */
    public double getWindowSeconds() {
        double seconds = Duration.between(windowStart, windowEnd).toMillis() / 1000.0;
        return Math.max(1.0, seconds);
    }

    public double getPacketsPerSecond() {
        return packetCount / getWindowSeconds();
    }

    public double getBytesPerSecond() {
        return byteCount / getWindowSeconds();
    }

    public double getAveragePacketSize() {
        return packetCount == 0 ? 0.0 : (double) byteCount / packetCount;
    }

    public long getTotalDetections() {
        long total = 0;
        for (long count : detectionCounts.values()) {
            total += count;
        }
        return total;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Instant getWindowStart() {
        return windowStart;
    }

    public Instant getWindowEnd() {
        return windowEnd;
    }

    public long getPacketCount() {
        return packetCount;
    }

    public long getByteCount() {
        return byteCount;
    }

    public Map<Protocol, Long> getProtocolCounts() {
        return protocolCounts;
    }

    public int getActiveConnections() {
        return activeConnections;
    }

    public Map<DetectorKind, Long> getDetectionCounts() {
        return detectionCounts;
    }

    public long getDroppedPackets() {
        return droppedPackets;
    }

    public Map<String, Long> getTopSourceIps() {
        return topSourceIps;
    }

    public Map<Integer, Long> getTopDestinationPorts() {
        return topDestinationPorts;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private Instant windowStart;
        private Instant windowEnd;
        private long packetCount;
        private long byteCount;
        private Map<Protocol, Long> protocolCounts = Map.of();
        private int activeConnections;
        private Map<DetectorKind, Long> detectionCounts = Map.of();
        private long droppedPackets;
        private Map<String, Long> topSourceIps = Map.of();
        private Map<Integer, Long> topDestinationPorts = Map.of();

        public Builder windowStart(Instant windowStart) {
            this.windowStart = windowStart;
            return this;
        }

        public Builder windowEnd(Instant windowEnd) {
            this.windowEnd = windowEnd;
            return this;
        }

        public Builder packetCount(long packetCount) {
            this.packetCount = packetCount;
            return this;
        }

        public Builder byteCount(long byteCount) {
            this.byteCount = byteCount;
            return this;
        }

        public Builder protocolCounts(Map<Protocol, Long> protocolCounts) {
            this.protocolCounts = Objects.requireNonNull(protocolCounts, "protocolCounts must not be null");
            return this;
        }

        public Builder activeConnections(int activeConnections) {
            this.activeConnections = activeConnections;
            return this;
        }

        public Builder detectionCounts(Map<DetectorKind, Long> detectionCounts) {
            this.detectionCounts = Objects.requireNonNull(detectionCounts, "detectionCounts must not be null");
            return this;
        }

        public Builder droppedPackets(long droppedPackets) {
            this.droppedPackets = droppedPackets;
            return this;
        }

        /**
         * @param topSourceIps source IP to packet count, already ordered
         */
        public Builder topSourceIps(Map<String, Long> topSourceIps) {
            this.topSourceIps = Objects.requireNonNull(topSourceIps, "topSourceIps must not be null");
            return this;
        }

        /**
         * @param topDestinationPorts port to packet count, already ordered
         */
        public Builder topDestinationPorts(Map<Integer, Long> topDestinationPorts) {
            this.topDestinationPorts = Objects.requireNonNull(topDestinationPorts,
                    "topDestinationPorts must not be null");
            return this;
        }

        public TrafficStatsSnapshot build() {
            return new TrafficStatsSnapshot(this);
        }
    }

    private static <E extends Enum<E>> Map<E, Long> copyEnum(Map<E, Long> source, Class<E> type) {
        Map<E, Long> copy = new EnumMap<>(type);
        copy.putAll(source);
        return copy;
    }

    @Override
    public String toString() {
        return "TrafficStatsSnapshot{" +
                "window=" + windowStart + ".." + windowEnd +
                ", packets=" + packetCount +
                ", bytes=" + byteCount +
                ", activeConnections=" + activeConnections +
                ", detections=" + getTotalDetections() +
                ", dropped=" + droppedPackets +
                '}';
    }
}
