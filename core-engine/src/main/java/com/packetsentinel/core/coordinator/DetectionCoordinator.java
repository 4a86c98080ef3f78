package com.packetsentinel.core.coordinator;

import com.packetsentinel.core.detection.AnalysisContext;
import com.packetsentinel.core.detection.Detector;
import com.packetsentinel.core.detection.RecentTrafficWindow;
import com.packetsentinel.core.detection.SourceActivity;
import com.packetsentinel.core.feature.FeatureExtractor;
import com.packetsentinel.core.model.Detection;
import com.packetsentinel.core.model.DetectorKind;
import com.packetsentinel.core.model.FeatureVector;
import com.packetsentinel.core.model.PacketRecord;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the detectors for each packet and merges their verdicts.
 *
 * <h3>Per Packet</h3>
 * <ol>
 * <li>Extract features once (updating the trackers).</li>
 * <li>Record the packet in the recent traffic window of its source.</li>
 * <li>Submit every detector to the detector executor.</li>
 * <li>Wait for each result until a shared deadline of {@code timeout} after
 * submission. A late detector is cancelled and contributes nothing.</li>
 * <li>Stamp all detections with one random correlation id.</li>
 * </ol>
 *
 * <h3>Isolation</h3>
 * <p>
 * A detector that throws, times out or cannot be scheduled is logged and
 * counted; the others still contribute. {@link #analyze(PacketRecord)}
 * never throws for a detector fault. There is no deduplication here; that is
 * the alert sink's job.
 * </p>
 *
 * <p>
 * An interrupt of the calling thread is not a detector fault: the detectors
 * still running are cancelled and counted as timeouts, and
 * {@link AnalysisInterruptedException} is thrown instead of a partial result.
 * </p>
 *
 * <h3>Metrics</h3>
 * <ul>
 * <li>{@code sentinel.detections{kind}}</li>
 * <li>{@code sentinel.detector.failures{kind}}</li>
 * <li>{@code sentinel.detector.timeouts{kind}}</li>
 * <li>{@code sentinel.analysis.latency}</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class DetectionCoordinator {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionCoordinator.class);

    private final FeatureExtractor extractor;
    private final RecentTrafficWindow recentTraffic;
    private final List<Detector> detectors;
    private final ExecutorService executor;
    private final Duration timeout;

    private final Map<DetectorKind, Counter> detectionCounters = new EnumMap<>(DetectorKind.class);
    private final Map<DetectorKind, Counter> failureCounters = new EnumMap<>(DetectorKind.class);
    private final Map<DetectorKind, Counter> timeoutCounters = new EnumMap<>(DetectorKind.class);
    private final Timer latency;

    /**
     * @param extractor     feature extractor
     * @param recentTraffic per-source recent packet window
     * @param detectors     detectors, run in parallel for each packet
     * @param executor      executor running the detectors; must not be the
     *                      pool that calls {@link #analyze(PacketRecord)}
     * @param timeout       per-packet wait for detectors; zero or negative
     *                      waits indefinitely
     * @param registry      meter registry
     */
    public DetectionCoordinator(FeatureExtractor extractor,
            RecentTrafficWindow recentTraffic,
            List<Detector> detectors,
            ExecutorService executor,
            Duration timeout,
            MeterRegistry registry) {
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
        this.recentTraffic = Objects.requireNonNull(recentTraffic, "recentTraffic must not be null");
        this.detectors = List.copyOf(Objects.requireNonNull(detectors, "detectors must not be null"));
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        Objects.requireNonNull(registry, "registry must not be null");

        for (DetectorKind kind : DetectorKind.values()) {
            detectionCounters.put(kind, Counter.builder("sentinel.detections")
                    .description("Detections produced, before deduplication")
                    .tag("kind", kind.id())
                    .register(registry));
            failureCounters.put(kind, Counter.builder("sentinel.detector.failures")
                    .description("Detector invocations that threw or could not be scheduled")
                    .tag("kind", kind.id())
                    .register(registry));
            timeoutCounters.put(kind, Counter.builder("sentinel.detector.timeouts")
                    .description("Detector invocations cancelled at the deadline")
                    .tag("kind", kind.id())
                    .register(registry));
        }
        this.latency = Timer.builder("sentinel.analysis.latency")
                .description("Time to analyze one packet")
                .register(registry);
    }

    /**
     * Analyze one packet.
     *
     * @param packet the packet
     * @return detections of all layers sharing one correlation id, possibly
     *         empty
     * @throws AnalysisInterruptedException if the calling thread is
     *                                      interrupted while detectors run
     */
    public List<Detection> analyze(PacketRecord packet) {
        Objects.requireNonNull(packet, "packet must not be null");
        long started = System.nanoTime();
        try {
            AnalysisContext context = buildContext(packet);
            List<Detection> detections = runDetectors(context);
            if (detections.isEmpty()) {
                return List.of();
            }
            String correlationId = UUID.randomUUID().toString();
            List<Detection> stamped = new ArrayList<>(detections.size());
            for (Detection detection : detections) {
                stamped.add(detection.withCorrelationId(correlationId));
                detectionCounters.get(detection.getKind()).increment();
            }
            LOG.debug("Packet {} produced {} detection(s), correlationId={}",
                    packet, stamped.size(), correlationId);
            return Collections.unmodifiableList(stamped);
        } finally {
            latency.record(System.nanoTime() - started, TimeUnit.NANOSECONDS);
        }
    }

    public List<Detector> getDetectors() {
        return detectors;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private AnalysisContext buildContext(PacketRecord packet) {
        FeatureVector features = extractor.extract(packet);
        SourceActivity activity;
        try {
            activity = recentTraffic.record(packet);
        } catch (RuntimeException e) {
            LOG.debug("Recent traffic update failed for {}", packet, e);
            activity = SourceActivity.empty(packet.getSourceIp());
        }
        return new AnalysisContext(packet, features, activity);
    }

    private List<Detection> runDetectors(AnalysisContext context) {
        List<Future<List<Detection>>> futures = new ArrayList<>(detectors.size());
        for (Detector detector : detectors) {
            try {
                futures.add(executor.submit(() -> detector.detect(context)));
            } catch (RejectedExecutionException e) {
                LOG.error("Detector [{}] could not be scheduled", detector.kind().id(), e);
                failureCounters.get(detector.kind()).increment();
                futures.add(null);
            }
        }

        boolean bounded = !timeout.isZero() && !timeout.isNegative();
        long deadline = System.nanoTime() + timeout.toNanos();
        List<Detection> merged = new ArrayList<>();

        for (int i = 0; i < detectors.size(); i++) {
            Future<List<Detection>> future = futures.get(i);
            if (future == null) {
                continue;
            }
            DetectorKind kind = detectors.get(i).kind();
            try {
                List<Detection> result = bounded
                        ? future.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS)
                        : future.get();
                if (result != null) {
                    merged.addAll(result);
                }
            } catch (TimeoutException e) {
                future.cancel(true);
                timeoutCounters.get(kind).increment();
                LOG.debug("Detector [{}] missed the {} ms deadline", kind.id(), timeout.toMillis());
            } catch (ExecutionException e) {
                failureCounters.get(kind).increment();
                LOG.error("Detector [{}] failed for {}", kind.id(), context.getPacket(), e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                int cancelled = cancelFrom(futures, i);
                LOG.warn("Interrupted while waiting for detectors, {} detector(s) cancelled for {}",
                        cancelled, context.getPacket());
                throw new AnalysisInterruptedException(
                        "Analysis of " + context.getPacket() + " interrupted", e);
            }
        }
        return merged;
    }

    /**
     * Cancel the unfinished detectors from {@code index} on, counting each
     * as timed out.
     *
     * @return number of detectors cancelled
     */
    private int cancelFrom(List<Future<List<Detection>>> futures, int index) {
        int cancelled = 0;
        for (int i = index; i < futures.size(); i++) {
            Future<List<Detection>> future = futures.get(i);
            if (future != null && future.cancel(true)) {
                timeoutCounters.get(detectors.get(i).kind()).increment();
                cancelled++;
            }
        }
        return cancelled;
    }
}
