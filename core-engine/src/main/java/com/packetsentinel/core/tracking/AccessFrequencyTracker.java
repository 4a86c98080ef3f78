package com.packetsentinel.core.tracking;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Packets per source IP inside a trailing window.
 *
 * <p>
 * Counts are kept in one-second buckets, so memory per source is bounded by
 * the window length in seconds regardless of the packet rate.
 * </p>
 *
 * @since 1.0.0
 */
public class AccessFrequencyTracker implements FeatureTracker {

    private final ConcurrentMap<String, SecondBuckets> sources = new ConcurrentHashMap<>();
    private final Duration window;

    public AccessFrequencyTracker(Duration window) {
        this.window = Objects.requireNonNull(window, "window must not be null");
        if (window.getSeconds() < 1) {
            throw new IllegalArgumentException("window must be at least one second, got: " + window);
        }
    }

    public void record(String sourceIp, Instant at) {
        Objects.requireNonNull(sourceIp, "sourceIp must not be null");
        Objects.requireNonNull(at, "at must not be null");
        sources.compute(sourceIp, (ip, buckets) -> {
            SecondBuckets target = buckets != null ? buckets : new SecondBuckets();
            target.increment(at.getEpochSecond());
            return target;
        });
    }

    /**
     * @return packets of {@code sourceIp} in the window ending at {@code now}
     */
    public long query(String sourceIp, Instant now) {
        long[] count = new long[1];
        sources.computeIfPresent(sourceIp, (ip, buckets) -> {
            buckets.prune(cutoffSecond(now));
            count[0] = buckets.total();
            return buckets.isEmpty() ? null : buckets;
        });
        return count[0];
    }

    @Override
    public int sweep(Instant now) {
        long cutoff = cutoffSecond(now);
        int evicted = 0;
        for (String ip : sources.keySet()) {
            boolean[] removed = new boolean[1];
            sources.computeIfPresent(ip, (key, buckets) -> {
                buckets.prune(cutoff);
                removed[0] = buckets.isEmpty();
                return removed[0] ? null : buckets;
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

    // Buckets at or after this second are inside the window.
    private long cutoffSecond(Instant now) {
        return now.getEpochSecond() - window.getSeconds() + 1;
    }

    /**
     * Mutated only inside {@code compute}, which serializes access per key.
     */
    private static final class SecondBuckets {
        private final Deque<long[]> buckets = new ArrayDeque<>();
        private long total;

        private void increment(long second) {
            long[] last = buckets.peekLast();
            if (last != null && last[0] == second) {
                last[1]++;
            } else if (last != null && second < last[0]) {
                // out of order: credit the newest bucket
                last[1]++;
            } else {
                buckets.addLast(new long[] { second, 1 });
            }
            total++;
        }

        private void prune(long cutoffSecond) {
            while (!buckets.isEmpty() && buckets.peekFirst()[0] < cutoffSecond) {
                total -= buckets.pollFirst()[1];
            }
        }

        private long total() {
            return total;
        }

        private boolean isEmpty() {
            return buckets.isEmpty();
        }
    }
}
