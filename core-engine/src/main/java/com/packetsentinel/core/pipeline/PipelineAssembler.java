package com.packetsentinel.core.pipeline;

import com.packetsentinel.core.alert.AlertListener;
import com.packetsentinel.core.alert.AlertSink;
import com.packetsentinel.core.alert.PersistenceSink;
import com.packetsentinel.core.alert.RetryingWriter;
import com.packetsentinel.core.config.DetectionSettings;
import com.packetsentinel.core.config.SignatureRulesConfig;
import com.packetsentinel.core.coordinator.DetectionCoordinator;
import com.packetsentinel.core.detection.Detector;
import com.packetsentinel.core.detection.RecentTrafficWindow;
import com.packetsentinel.core.detection.anomaly.AnomalyDetector;
import com.packetsentinel.core.detection.anomaly.AnomalyModelTrainer;
import com.packetsentinel.core.detection.anomaly.IsolationForestTrainer;
import com.packetsentinel.core.detection.classification.ClassificationDetector;
import com.packetsentinel.core.detection.classification.ClassificationModel;
import com.packetsentinel.core.detection.signature.SignatureDetector;
import com.packetsentinel.core.feature.FeatureExtractor;
import com.packetsentinel.core.stats.StatsAggregator;
import com.packetsentinel.core.tracking.FeatureTrackers;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires a {@link PacketPipeline} from settings, rules, an optional
 * classification model and a persistence sink.
 *
 * <p>
 * Every call to {@link #assemble()} builds fresh trackers, detectors and
 * executors; nothing is shared between pipelines.
 * </p>
 *
 * <pre>{@code
 * PacketPipeline pipeline = PipelineAssembler.forSettings(settings)
 *         .rules(SignatureRulesLoader.load())
 *         .persistence(sink)
 *         .assemble();
 * pipeline.start();
 * }</pre>
 *
 * @since 1.0.0
 */
public final class PipelineAssembler {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineAssembler.class);

    private static final Duration DEFAULT_PERSISTENCE_BACKOFF = Duration.ofMillis(50);

    private final DetectionSettings settings;
    private SignatureRulesConfig rules;
    private ClassificationModel classificationModel;
    private Path modelPath;
    private PersistenceSink persistence;
    private final List<AlertListener> listeners = new ArrayList<>();
    private MeterRegistry registry;
    private Clock clock = Clock.systemUTC();
    private AnomalyModelTrainer anomalyTrainer = new IsolationForestTrainer();
    private Duration persistenceBackoff = DEFAULT_PERSISTENCE_BACKOFF;

    private PipelineAssembler(DetectionSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    public static PipelineAssembler forSettings(DetectionSettings settings) {
        return new PipelineAssembler(settings);
    }

    public PipelineAssembler rules(SignatureRulesConfig rules) {
        this.rules = rules;
        return this;
    }

    /**
     * @param model     loaded model, or {@code null} to run without the
     *                  classification layer's verdicts
     * @param modelPath file the model was loaded from, used for periodic
     *                  reloads; may be {@code null}
     */
    public PipelineAssembler classificationModel(ClassificationModel model, Path modelPath) {
        this.classificationModel = model;
        this.modelPath = modelPath;
        return this;
    }

    public PipelineAssembler persistence(PersistenceSink persistence) {
        this.persistence = persistence;
        return this;
    }

    public PipelineAssembler listener(AlertListener listener) {
        this.listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
        return this;
    }

    /** Defaults to a fresh {@link SimpleMeterRegistry}. */
    public PipelineAssembler registry(MeterRegistry registry) {
        this.registry = registry;
        return this;
    }

    public PipelineAssembler clock(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        return this;
    }

    public PipelineAssembler anomalyTrainer(AnomalyModelTrainer anomalyTrainer) {
        this.anomalyTrainer = Objects.requireNonNull(anomalyTrainer, "anomalyTrainer must not be null");
        return this;
    }

    public PipelineAssembler persistenceBackoff(Duration persistenceBackoff) {
        this.persistenceBackoff = Objects.requireNonNull(persistenceBackoff, "persistenceBackoff must not be null");
        return this;
    }

    /**
     * @return a new, not yet started pipeline
     * @throws NullPointerException if rules or persistence are missing
     */
    public PacketPipeline assemble() {
        Objects.requireNonNull(rules, "rules must not be null");
        Objects.requireNonNull(persistence, "persistence must not be null");
        MeterRegistry meters = registry != null ? registry : new SimpleMeterRegistry();

        FeatureTrackers trackers = FeatureTrackers.create(settings);
        FeatureExtractor extractor = new FeatureExtractor(trackers, settings.getFeatureLayout());
        RecentTrafficWindow recentTraffic = new RecentTrafficWindow(settings.getHistoryWindow(),
                settings.getHistoryMaxPackets());

        SignatureDetector signatures = SignatureDetector.fromConfig(rules);
        AnomalyDetector anomaly = new AnomalyDetector(anomalyTrainer, settings.getMinAnomalySamples(),
                settings.getAnomalyThreshold(), settings.getAnomalySampleCapacity());
        ClassificationDetector classification = new ClassificationDetector(classificationModel,
                settings.getClassificationThreshold());
        List<Detector> detectors = List.of(signatures, anomaly, classification);

        ExecutorService detectorExecutor = Executors.newFixedThreadPool(
                settings.getWorkerCount() * detectors.size(), detectorThreads());
        DetectionCoordinator coordinator = new DetectionCoordinator(extractor, recentTraffic, detectors,
                detectorExecutor, settings.getDetectorTimeout(), meters);

        RetryingWriter writer = new RetryingWriter(settings.getPersistenceMaxAttempts(), persistenceBackoff, meters);
        AlertSink alertSink = new AlertSink(persistence, writer, settings.getAlertDedupWindow(), clock);
        listeners.forEach(alertSink::addListener);
        StatsAggregator stats = new StatsAggregator(persistence, writer,
                () -> trackers.connections().activeCount(clock.instant()), clock);

        LOG.info("Assembled pipeline: {} signature rule(s), classification model {}, layout {}",
                signatures.getRules().size(), classificationModel != null ? "loaded" : "absent",
                settings.getFeatureLayout());

        return PacketPipeline.builder()
                .coordinator(coordinator)
                .alertSink(alertSink)
                .stats(stats)
                .trackers(trackers)
                .recentTraffic(recentTraffic)
                .anomalyDetector(anomaly)
                .classificationDetector(classification, modelPath)
                .detectorExecutor(detectorExecutor)
                .clock(clock)
                .registry(meters)
                .queueCapacity(settings.getQueueCapacity())
                .workerCount(settings.getWorkerCount())
                .trackerSweepInterval(settings.getTrackerSweepInterval())
                .statsFlushInterval(settings.getStatsFlushInterval())
                .anomalyRetrainInterval(settings.getAnomalyRetrainInterval())
                .modelReloadInterval(settings.getModelReloadInterval())
                .build();
    }

    private static ThreadFactory detectorThreads() {
        AtomicInteger count = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "sentinel-detector-" + count.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
