package com.packetsentinel.core.stats;

import com.packetsentinel.core.alert.PersistenceSink;
import com.packetsentinel.core.alert.RetryingWriter;
import com.packetsentinel.core.model.Detection;
import com.packetsentinel.core.model.DetectorKind;
import com.packetsentinel.core.model.PacketRecord;
import com.packetsentinel.core.model.Protocol;
import com.packetsentinel.core.model.TrafficStatsSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.IntSupplier;

/**
 * Accumulates traffic counters and periodically flushes them as a
 * {@link TrafficStatsSnapshot}.
 *
 * <h3>Concurrency</h3>
 * <p>
 * Recording threads share the read lock and increment {@link LongAdder}s of
 * the current window. {@link #flush()} takes the write lock only to swap in
 * a fresh window, so every increment lands in exactly one snapshot. The
 * retired window is summarised and persisted after the lock is released.
 * </p>
 *
 * @since 1.0.0
 */
public class StatsAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(StatsAggregator.class);

    static final String WRITE_TYPE = "stats";
    static final int TOP_N = 10;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final PersistenceSink persistence;
    private final RetryingWriter writer;
    private final IntSupplier activeConnections;
    private final Clock clock;
    private final AtomicReference<TrafficStatsSnapshot> lastSnapshot = new AtomicReference<>();

    private Window current;

    /**
     * @param persistence       snapshot destination
     * @param writer            retry policy for snapshot writes
     * @param activeConnections live connection count at flush time
     * @param clock             clock for window boundaries
     */
    public StatsAggregator(PersistenceSink persistence, RetryingWriter writer,
            IntSupplier activeConnections, Clock clock) {
        this.persistence = Objects.requireNonNull(persistence, "persistence must not be null");
        this.writer = Objects.requireNonNull(writer, "writer must not be null");
        this.activeConnections = Objects.requireNonNull(activeConnections, "activeConnections must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.current = new Window(clock.instant());
    }

    // ---------------------------------------------------------------
    // Recording
    // ---------------------------------------------------------------

    public void record(PacketRecord packet) {
        lock.readLock().lock();
        try {
            current.add(packet);
        } finally {
            lock.readLock().unlock();
        }
    }

    public void recordDetection(Detection detection) {
        lock.readLock().lock();
        try {
            current.detections.get(detection.getKind()).increment();
        } finally {
            lock.readLock().unlock();
        }
    }

    public void recordDropped(long count) {
        if (count <= 0) {
            return;
        }
        lock.readLock().lock();
        try {
            current.dropped.add(count);
        } finally {
            lock.readLock().unlock();
        }
    }

    // ---------------------------------------------------------------
    // Flush
    // ---------------------------------------------------------------

    /**
     * Close the current window, persist its snapshot and start a new one.
     *
     * @return snapshot of the closed window
     */
    public TrafficStatsSnapshot flush() {
        Window retired;
        Instant now;
        lock.writeLock().lock();
        try {
            now = clock.instant();
            retired = current;
            current = new Window(now);
        } finally {
            lock.writeLock().unlock();
        }

        TrafficStatsSnapshot snapshot = retired.toSnapshot(now, activeConnectionsSafely());
        lastSnapshot.set(snapshot);
        LOG.info("Stats window {}..{}: {} packets, {} bytes, {} detections, {} dropped",
                snapshot.getWindowStart(), snapshot.getWindowEnd(), snapshot.getPacketCount(),
                snapshot.getByteCount(), snapshot.getTotalDetections(), snapshot.getDroppedPackets());
        writer.write(WRITE_TYPE, snapshot, () -> persistence.persistSnapshot(snapshot));
        return snapshot;
    }

    /**
     * @return the most recently flushed snapshot, if any
     */
    public Optional<TrafficStatsSnapshot> lastSnapshot() {
        return Optional.ofNullable(lastSnapshot.get());
    }

    private int activeConnectionsSafely() {
        try {
            return activeConnections.getAsInt();
        } catch (RuntimeException e) {
            LOG.warn("Could not read active connection count", e);
            return 0;
        }
    }

    // ---------------------------------------------------------------
    // Window
    // ---------------------------------------------------------------

    private static final class Window {
        private final Instant start;
        private final LongAdder packets = new LongAdder();
        private final LongAdder bytes = new LongAdder();
        private final LongAdder dropped = new LongAdder();
        private final Map<Protocol, LongAdder> protocols = new EnumMap<>(Protocol.class);
        private final Map<DetectorKind, LongAdder> detections = new EnumMap<>(DetectorKind.class);
        private final ConcurrentMap<String, LongAdder> sources = new ConcurrentHashMap<>();
        private final ConcurrentMap<Integer, LongAdder> ports = new ConcurrentHashMap<>();

        Window(Instant start) {
            this.start = start;
            // Fully populated up front; the enum maps are read-only afterwards.
            for (Protocol p : Protocol.values()) {
                protocols.put(p, new LongAdder());
            }
            for (DetectorKind k : DetectorKind.values()) {
                detections.put(k, new LongAdder());
            }
        }

        void add(PacketRecord packet) {
            packets.increment();
            bytes.add(packet.getSize());
            protocols.get(packet.getProtocol()).increment();
            sources.computeIfAbsent(packet.getSourceIp(), k -> new LongAdder()).increment();
            ports.computeIfAbsent(packet.getDestinationPort(), k -> new LongAdder()).increment();
        }

        TrafficStatsSnapshot toSnapshot(Instant end, int activeConnections) {
            return TrafficStatsSnapshot.builder()
                    .windowStart(start)
                    .windowEnd(end.isBefore(start) ? start : end)
                    .packetCount(packets.sum())
                    .byteCount(bytes.sum())
                    .protocolCounts(sums(protocols, Protocol.class))
                    .activeConnections(activeConnections)
                    .detectionCounts(sums(detections, DetectorKind.class))
                    .droppedPackets(dropped.sum())
                    .topSourceIps(top(sources))
                    .topDestinationPorts(top(ports))
                    .build();
        }

        private static <E extends Enum<E>> Map<E, Long> sums(Map<E, LongAdder> adders, Class<E> type) {
            Map<E, Long> result = new EnumMap<>(type);
            adders.forEach((key, adder) -> {
                long sum = adder.sum();
                if (sum > 0) {
                    result.put(key, sum);
                }
            });
            return result;
        }

        private static <K> Map<K, Long> top(Map<K, LongAdder> counts) {
            Map<K, Long> result = new LinkedHashMap<>();
            counts.entrySet().stream()
                    .map(e -> Map.entry(e.getKey(), e.getValue().sum()))
                    .sorted(Map.Entry.<K, Long>comparingByValue(Comparator.reverseOrder()))
                    .limit(TOP_N)
                    .forEach(e -> result.put(e.getKey(), e.getValue()));
            return result;
        }
    }
}
