package com.packetsentinel.core.pipeline;

import com.packetsentinel.core.alert.AlertSink;
import com.packetsentinel.core.alert.RetryingWriter;
import com.packetsentinel.core.config.DetectionSettings;
import com.packetsentinel.core.config.SignatureRulesLoader;
import com.packetsentinel.core.coordinator.DetectionCoordinator;
import com.packetsentinel.core.detection.AnalysisContext;
import com.packetsentinel.core.detection.Detector;
import com.packetsentinel.core.detection.RecentTrafficWindow;
import com.packetsentinel.core.feature.FeatureExtractor;
import com.packetsentinel.core.model.Detection;
import com.packetsentinel.core.model.DetectorKind;
import com.packetsentinel.core.model.FeatureLayout;
import com.packetsentinel.core.model.TrafficStatsSnapshot;
import com.packetsentinel.core.stats.StatsAggregator;
import com.packetsentinel.core.support.Packets;
import com.packetsentinel.core.support.RecordingPersistenceSink;
import com.packetsentinel.core.tracking.FeatureTrackers;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link PacketPipeline} and {@link PipelineAssembler}.
 */
class PacketPipelineTest {

    private RecordingPersistenceSink persistence;
    private SimpleMeterRegistry registry;
    private CountDownLatch entered;
    private CountDownLatch release;

    @BeforeEach
    void setUp() {
        persistence = new RecordingPersistenceSink();
        registry = new SimpleMeterRegistry();
        entered = new CountDownLatch(1);
        release = new CountDownLatch(1);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
    }

    @Test
    @DisplayName("Should drop the arriving packet and count it when the queue is full")
    void shouldDropNewestWhenFull() throws Exception {
        PacketPipeline pipeline = blockingPipeline(2);
        pipeline.start();

        assertThat(pipeline.submit(Packets.withPayload("p1"))).isTrue();
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(pipeline.submit(Packets.withPayload("p2"))).isTrue();
        assertThat(pipeline.submit(Packets.withPayload("p3"))).isTrue();
        assertThat(pipeline.submit(Packets.withPayload("p4"))).isFalse();

        assertThat(pipeline.droppedCount()).isEqualTo(1);
        assertThat(pipeline.queueDepth()).isEqualTo(2);
        assertThat(registry.get("sentinel.queue.depth").gauge().value()).isEqualTo(2.0);

        release.countDown();
        assertThat(pipeline.shutdown(Duration.ofSeconds(10))).isTrue();

        assertThat(pipeline.processedCount()).isEqualTo(3);
        TrafficStatsSnapshot last = persistence.snapshots().get(persistence.snapshots().size() - 1);
        assertThat(last.getDroppedPackets()).isEqualTo(1);
        assertThat(last.getPacketCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should count packets still queued when the shutdown timeout expires")
    void shouldCountLeftoversAtShutdown() throws Exception {
        PacketPipeline pipeline = blockingPipeline(10);
        pipeline.start();
        pipeline.submit(Packets.withPayload("p1"));
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
        pipeline.submit(Packets.withPayload("p2"));
        pipeline.submit(Packets.withPayload("p3"));

        boolean drained = pipeline.shutdown(Duration.ofMillis(200));

        assertThat(drained).isFalse();
        // two queued packets plus the one interrupted mid-analysis
        assertThat(pipeline.droppedCount()).isEqualTo(3);
        assertThat(pipeline.processedCount()).isZero();
        assertThat(pipeline.getState()).isEqualTo(PipelineState.STOPPED);
    }

    @Test
    @DisplayName("Should count a packet interrupted mid-analysis at shutdown as dropped, not processed")
    void shouldCountInterruptedPacketAsDropped() throws Exception {
        PacketPipeline pipeline = blockingPipeline(10);
        pipeline.start();
        pipeline.submit(Packets.withPayload("id=1' OR 1=1 --"));
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        boolean drained = pipeline.shutdown(Duration.ofMillis(200));

        assertThat(drained).isFalse();
        assertThat(pipeline.processedCount()).isZero();
        assertThat(pipeline.droppedCount()).isEqualTo(1);
        assertThat(registry.get("sentinel.detector.timeouts").tag("kind", "signature").counter().count())
                .isEqualTo(1.0);
        assertThat(persistence.alerts()).isEmpty();
        TrafficStatsSnapshot last = persistence.snapshots().get(persistence.snapshots().size() - 1);
        assertThat(last.getDroppedPackets()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should drain the queue, deduplicate alerts and flush stats on shutdown")
    void shouldDrainAndFlushOnShutdown() {
        DetectionSettings settings = new DetectionSettings.Builder()
                .workerCount(2)
                .detectorTimeoutMillis(0)
                .build();
        PacketPipeline pipeline = PipelineAssembler.forSettings(settings)
                .rules(SignatureRulesLoader.fromClasspath("signatures.yml"))
                .persistence(persistence)
                .registry(registry)
                .persistenceBackoff(Duration.ZERO)
                .assemble();
        pipeline.start();

        for (int i = 0; i < 50; i++) {
            pipeline.submit(i % 5 == 0
                    ? Packets.withPayload("id=1' OR 1=1 --")
                    : Packets.withPayload("GET /index.html HTTP/1.1"));
        }
        boolean drained = pipeline.shutdown(Duration.ofSeconds(30));

        assertThat(drained).isTrue();
        assertThat(pipeline.processedCount()).isEqualTo(50);
        assertThat(pipeline.droppedCount()).isZero();
        assertThat(persistence.alerts()).hasSize(1);
        assertThat(persistence.alerts().get(0).getOccurrences()).isEqualTo(10);
        assertThat(persistence.snapshots()).hasSize(1);
        assertThat(persistence.snapshots().get(0).getPacketCount()).isEqualTo(50);
        assertThat(persistence.snapshots().get(0).getDetectionCounts()).containsEntry(DetectorKind.SIGNATURE, 10L);
    }

    @Test
    @DisplayName("Should reject and count packets submitted before start or after shutdown")
    void shouldRejectOutsideRunningState() {
        PacketPipeline pipeline = PipelineAssembler.forSettings(DetectionSettings.defaults())
                .rules(SignatureRulesLoader.fromClasspath("signatures.yml"))
                .persistence(persistence)
                .registry(registry)
                .assemble();

        assertThat(pipeline.submit(Packets.withPayload("early"))).isFalse();
        pipeline.start();
        pipeline.shutdown(Duration.ofSeconds(5));
        assertThat(pipeline.submit(Packets.withPayload("late"))).isFalse();

        assertThat(pipeline.droppedCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should run independent pipelines side by side")
    void shouldRunIndependentPipelines() {
        DetectionSettings settings = new DetectionSettings.Builder().workerCount(1).detectorTimeoutMillis(0).build();
        RecordingPersistenceSink other = new RecordingPersistenceSink();
        PacketPipeline a = PipelineAssembler.forSettings(settings)
                .rules(SignatureRulesLoader.fromClasspath("signatures.yml"))
                .persistence(persistence)
                .registry(registry)
                .assemble();
        PacketPipeline b = PipelineAssembler.forSettings(settings)
                .rules(SignatureRulesLoader.fromClasspath("signatures.yml"))
                .persistence(other)
                .registry(registry)
                .assemble();
        a.start();
        b.start();

        a.submit(Packets.withPayload("id=1' OR 1=1"));
        a.shutdown(Duration.ofSeconds(10));
        b.shutdown(Duration.ofSeconds(10));

        assertThat(a.getName()).isNotEqualTo(b.getName());
        assertThat(persistence.alerts()).hasSize(1);
        assertThat(other.alerts()).isEmpty();
        assertThat(a.processedCount()).isEqualTo(1);
        assertThat(b.processedCount()).isZero();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private PacketPipeline blockingPipeline(int queueCapacity) {
        Detector blocking = new Detector() {
            @Override
            public DetectorKind kind() {
                return DetectorKind.SIGNATURE;
            }

            @Override
            public List<Detection> detect(AnalysisContext context) {
                entered.countDown();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return List.of();
            }
        };
        FeatureTrackers trackers = FeatureTrackers.create(DetectionSettings.defaults());
        RecentTrafficWindow recentTraffic = new RecentTrafficWindow(Duration.ofSeconds(60), 100);
        ExecutorService detectorExecutor = Executors.newFixedThreadPool(2);
        DetectionCoordinator coordinator = new DetectionCoordinator(
                new FeatureExtractor(trackers, FeatureLayout.LIVE), recentTraffic, List.of(blocking),
                detectorExecutor, Duration.ZERO, registry);
        RetryingWriter writer = new RetryingWriter(1, Duration.ZERO, registry);
        StatsAggregator stats = new StatsAggregator(persistence, writer, () -> 0, Clock.systemUTC());

        return PacketPipeline.builder()
                .coordinator(coordinator)
                .alertSink(new AlertSink(persistence, writer, Duration.ofMinutes(5), Clock.systemUTC()))
                .stats(stats)
                .trackers(trackers)
                .recentTraffic(recentTraffic)
                .detectorExecutor(detectorExecutor)
                .registry(registry)
                .queueCapacity(queueCapacity)
                .workerCount(1)
                .build();
    }
}
