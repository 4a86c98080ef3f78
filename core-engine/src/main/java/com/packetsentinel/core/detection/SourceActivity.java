package com.packetsentinel.core.detection;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable snapshot of the recent traffic of one source.
 *
 * <p>
 * Aggregate signature rules query it over their own window, which is
 * measured back from the newest packet in the snapshot and capped by the
 * window the snapshot was taken with. Packet and byte totals have
 * one-second granularity: a bucket counts when any part of its second lies
 * inside the window.
 * </p>
 *
 * @since 1.0.0
 */
public final class SourceActivity {

    private final String sourceIp;
    private final long newestMillis;
    private final long[] bucketSeconds;
    private final long[] bucketPackets;
    private final long[] bucketBytes;
    private final long[] portTimestampsMillis;
    private final int[] destinationPorts;

    SourceActivity(String sourceIp, long newestMillis,
            long[] bucketSeconds, long[] bucketPackets, long[] bucketBytes,
            long[] portTimestampsMillis, int[] destinationPorts) {
        this.sourceIp = Objects.requireNonNull(sourceIp, "sourceIp must not be null");
        if (bucketSeconds.length != bucketPackets.length || bucketSeconds.length != bucketBytes.length) {
            throw new IllegalArgumentException("Bucket arrays must have the same length");
        }
        if (portTimestampsMillis.length != destinationPorts.length) {
            throw new IllegalArgumentException("Port arrays must have the same length");
        }
        this.newestMillis = newestMillis;
        this.bucketSeconds = bucketSeconds;
        this.bucketPackets = bucketPackets;
        this.bucketBytes = bucketBytes;
        this.portTimestampsMillis = portTimestampsMillis;
        this.destinationPorts = destinationPorts;
    }

    /**
     * @return activity with no packets
     */
    public static SourceActivity empty(String sourceIp) {
        return new SourceActivity(sourceIp, 0L, new long[0], new long[0], new long[0], new long[0], new int[0]);
    }

    public String getSourceIp() {
        return sourceIp;
    }

    /**
     * @return number of packets in the snapshot
     */
    public long packetCount() {
        return packetCount(Duration.ZERO);
    }

    /**
     * @param window look-back from the newest packet; zero or negative means
     *               the whole snapshot
     * @return packets inside {@code window}
     */
    public long packetCount(Duration window) {
        long total = 0;
        for (int i = firstBucket(window); i < bucketPackets.length; i++) {
            total += bucketPackets[i];
        }
        return total;
    }

    public long totalBytes(Duration window) {
        long total = 0;
        for (int i = firstBucket(window); i < bucketBytes.length; i++) {
            total += bucketBytes[i];
        }
        return total;
    }

    /**
     * Counted over the most recent port samples only.
     */
    public int distinctDestinationPorts(Duration window) {
        Set<Integer> ports = new HashSet<>();
        long cutoff = isWholeSnapshot(window) ? Long.MIN_VALUE : newestMillis - window.toMillis();
        for (int i = destinationPorts.length - 1; i >= 0 && portTimestampsMillis[i] >= cutoff; i--) {
            ports.add(destinationPorts[i]);
        }
        return ports.size();
    }

    /**
     * @return timestamp of the newest packet, or {@code null} when empty
     */
    public Instant newest() {
        return bucketSeconds.length == 0 ? null : Instant.ofEpochMilli(newestMillis);
    }

    private int firstBucket(Duration window) {
        if (bucketSeconds.length == 0 || isWholeSnapshot(window)) {
            return 0;
        }
        long cutoffSecond = Math.floorDiv(newestMillis - window.toMillis(), 1000L);
        int index = bucketSeconds.length;
        while (index > 0 && bucketSeconds[index - 1] >= cutoffSecond) {
            index--;
        }
        return index;
    }

    private static boolean isWholeSnapshot(Duration window) {
        return window == null || window.isZero() || window.isNegative();
    }

    @Override
    public String toString() {
        return "SourceActivity{" + sourceIp + ", packets=" + packetCount() + '}';
    }
}
