package com.packetsentinel.core.detection;

import com.packetsentinel.core.model.PacketRecord;
import com.packetsentinel.core.tracking.FeatureTracker;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Sliding window of recent traffic per source IP.
 *
 * <h3>Per Source</h3>
 * <ul>
 * <li>Packet and byte totals in one-second buckets. These are never capped by
 * packet count, so volume rules see every packet of the window; memory is
 * bounded by the window length in seconds.</li>
 * <li>The destination ports of the last {@code maxPortSamples} packets, for
 * distinct-port queries.</li>
 * </ul>
 *
 * <p>
 * Nothing older than {@code window} relative to the newest packet of the
 * source is kept. Recording a packet and taking the snapshot happen in the
 * same {@code compute} call, so the returned {@link SourceActivity} always
 * includes the recorded packet.
 * </p>
 *
 * @since 1.0.0
 */
public class RecentTrafficWindow implements FeatureTracker {

    private final ConcurrentMap<String, History> sources = new ConcurrentHashMap<>();
    private final Duration window;
    private final int maxPortSamples;

    /**
     * @param window         history length
     * @param maxPortSamples destination ports kept per source
     */
    public RecentTrafficWindow(Duration window, int maxPortSamples) {
        this.window = Objects.requireNonNull(window, "window must not be null");
        if (window.toMillis() < 1000) {
            throw new IllegalArgumentException("window must be at least one second, got: " + window);
        }
        if (maxPortSamples < 1) {
            throw new IllegalArgumentException("maxPortSamples must be >= 1, got: " + maxPortSamples);
        }
        this.maxPortSamples = maxPortSamples;
    }

    /**
     * Append {@code packet} to its source's window.
     *
     * @return the source's activity including {@code packet}
     */
    public SourceActivity record(PacketRecord packet) {
        Objects.requireNonNull(packet, "packet must not be null");
        long at = packet.getTimestamp().toEpochMilli();
        SourceActivity[] snapshot = new SourceActivity[1];
        sources.compute(packet.getSourceIp(), (ip, history) -> {
            History target = history != null ? history : new History();
            target.add(at, packet.getDestinationPort(), packet.getSize(), maxPortSamples);
            target.prune(target.newestMillis - window.toMillis());
            snapshot[0] = target.snapshot(ip);
            return target;
        });
        return snapshot[0];
    }

    @Override
    public int sweep(Instant now) {
        long cutoff = now.toEpochMilli() - window.toMillis();
        int evicted = 0;
        for (String ip : sources.keySet()) {
            boolean[] removed = new boolean[1];
            sources.computeIfPresent(ip, (key, history) -> {
                history.prune(cutoff);
                removed[0] = history.isEmpty();
                return removed[0] ? null : history;
            });
            if (removed[0]) {
                evicted++;
            }
        }
        return evicted;
    }

    @Override
    public int size() {
        return sources.size();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    /**
     * Mutated only inside {@code compute}, which serializes access per key.
     */
    private static final class History {
        // {second, packets, bytes}, oldest first
        private final Deque<long[]> buckets = new ArrayDeque<>();
        // {timestampMillis, destinationPort}, oldest first
        private final Deque<long[]> ports = new ArrayDeque<>();
        private long newestMillis = Long.MIN_VALUE;

        private void add(long at, int destinationPort, long size, int maxPortSamples) {
            newestMillis = Math.max(newestMillis, at);
            long second = Math.floorDiv(at, 1000L);
            long[] last = buckets.peekLast();
            if (last != null && second <= last[0]) {
                // same second, or out of order: credit the newest bucket
                last[1]++;
                last[2] += size;
            } else {
                buckets.addLast(new long[] { second, 1, size });
            }
            ports.addLast(new long[] { at, destinationPort });
            while (ports.size() > maxPortSamples) {
                ports.pollFirst();
            }
        }

        private void prune(long cutoffMillis) {
            long cutoffSecond = Math.floorDiv(cutoffMillis, 1000L);
            while (!buckets.isEmpty() && buckets.peekFirst()[0] < cutoffSecond) {
                buckets.pollFirst();
            }
            while (!ports.isEmpty() && ports.peekFirst()[0] < cutoffMillis) {
                ports.pollFirst();
            }
        }

        private boolean isEmpty() {
            return buckets.isEmpty();
        }

        private SourceActivity snapshot(String sourceIp) {
            long[] seconds = new long[buckets.size()];
            long[] packets = new long[seconds.length];
            long[] bytes = new long[seconds.length];
            int i = 0;
            for (long[] bucket : buckets) {
                seconds[i] = bucket[0];
                packets[i] = bucket[1];
                bytes[i] = bucket[2];
                i++;
            }
            long[] portTimestamps = new long[ports.size()];
            int[] destinationPorts = new int[portTimestamps.length];
            int j = 0;
            for (long[] sample : ports) {
                portTimestamps[j] = sample[0];
                destinationPorts[j] = (int) sample[1];
                j++;
            }
            return new SourceActivity(sourceIp, newestMillis, seconds, packets, bytes,
                    portTimestamps, destinationPorts);
        }
    }
}
