package com.packetsentinel.core.stats;

import com.packetsentinel.core.alert.RetryingWriter;
import com.packetsentinel.core.model.Detection;
import com.packetsentinel.core.model.DetectorKind;
import com.packetsentinel.core.model.Protocol;
import com.packetsentinel.core.model.Severity;
import com.packetsentinel.core.model.TrafficStatsSnapshot;
import com.packetsentinel.core.support.MutableClock;
import com.packetsentinel.core.support.Packets;
import com.packetsentinel.core.support.RecordingPersistenceSink;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link StatsAggregator}.
 */
class StatsAggregatorTest {

    private MutableClock clock;
    private RecordingPersistenceSink persistence;
    private StatsAggregator stats;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Packets.T0);
        persistence = new RecordingPersistenceSink();
        stats = new StatsAggregator(persistence,
                new RetryingWriter(3, Duration.ZERO, new SimpleMeterRegistry()), () -> 7, clock);
    }

    @Test
    @DisplayName("Should summarise the window and persist the snapshot on flush")
    void shouldFlushSnapshot() {
        stats.record(Packets.tcp("10.0.0.5", "10.0.0.1", 80).size(100).build());
        stats.record(Packets.tcp("10.0.0.5", "10.0.0.1", 443).size(300).build());
        stats.record(Packets.tcp("10.0.0.6", "10.0.0.1", 80).protocol(Protocol.UDP).size(200).build());
        stats.recordDetection(detection());
        stats.recordDropped(4);
        clock.advance(Duration.ofSeconds(60));

        TrafficStatsSnapshot snapshot = stats.flush();

        assertThat(snapshot.getPacketCount()).isEqualTo(3);
        assertThat(snapshot.getByteCount()).isEqualTo(600);
        assertThat(snapshot.getPacketsPerSecond()).isEqualTo(3 / 60.0);
        assertThat(snapshot.getAveragePacketSize()).isEqualTo(200.0);
        assertThat(snapshot.getProtocolCounts()).containsEntry(Protocol.TCP, 2L).containsEntry(Protocol.UDP, 1L);
        assertThat(snapshot.getDetectionCounts()).containsEntry(DetectorKind.SIGNATURE, 1L);
        assertThat(snapshot.getDroppedPackets()).isEqualTo(4);
        assertThat(snapshot.getActiveConnections()).isEqualTo(7);
        assertThat(snapshot.getTopSourceIps().keySet()).containsExactly("10.0.0.5", "10.0.0.6");
        assertThat(snapshot.getTopDestinationPorts()).containsEntry(80, 2L);
        assertThat(persistence.snapshots()).containsExactly(snapshot);
        assertThat(stats.lastSnapshot()).contains(snapshot);
    }

    @Test
    @DisplayName("Should start a fresh window after every flush")
    void shouldResetAfterFlush() {
        stats.record(Packets.withPayload("abc"));
        TrafficStatsSnapshot first = stats.flush();
        clock.advance(Duration.ofSeconds(60));

        TrafficStatsSnapshot second = stats.flush();

        assertThat(second.getPacketCount()).isZero();
        assertThat(second.getWindowStart()).isEqualTo(first.getWindowEnd());
    }

    @Test
    @DisplayName("Should keep only the top ten sources")
    void shouldLimitTopSources() {
        for (int i = 0; i < 15; i++) {
            for (int n = 0; n <= i; n++) {
                stats.record(Packets.tcp("10.0.1." + i, "10.0.0.1", 80).build());
            }
        }

        TrafficStatsSnapshot snapshot = stats.flush();

        assertThat(snapshot.getTopSourceIps()).hasSize(10);
        assertThat(snapshot.getTopSourceIps().keySet().iterator().next()).isEqualTo("10.0.1.14");
    }

    @Test
    @DisplayName("Should account every concurrent increment in exactly one snapshot")
    void shouldNotLoseIncrementsAcrossFlushes() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        AtomicBoolean running = new AtomicBoolean(true);
        List<TrafficStatsSnapshot> snapshots = new ArrayList<>();
        try {
            List<Future<?>> writers = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                writers.add(pool.submit(() -> {
                    for (int i = 0; i < 5000; i++) {
                        stats.record(Packets.tcp("10.0.0.5", "10.0.0.1", 80).size(10).build());
                    }
                }));
            }
            while (running.get()) {
                snapshots.add(stats.flush());
                running.set(writers.stream().anyMatch(f -> !f.isDone()));
            }
            for (Future<?> f : writers) {
                f.get();
            }
        } finally {
            pool.shutdownNow();
        }
        snapshots.add(stats.flush());

        long total = snapshots.stream().mapToLong(TrafficStatsSnapshot::getPacketCount).sum();
        assertThat(total).isEqualTo(20_000);
    }

    @Test
    @DisplayName("Should still return the snapshot when persisting it fails")
    void shouldSurvivePersistenceFailure() {
        persistence.failNext(3);
        stats.record(Packets.withPayload("abc"));

        TrafficStatsSnapshot snapshot = stats.flush();

        assertThat(snapshot.getPacketCount()).isEqualTo(1);
        assertThat(persistence.snapshots()).isEmpty();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Detection detection() {
        return Detection.forPacket(DetectorKind.SIGNATURE, Packets.withPayload("x"))
                .severity(Severity.LOW)
                .description("test")
                .build();
    }
}
