package com.packetsentinel.core.pipeline;

import com.packetsentinel.core.alert.AlertSink;
import com.packetsentinel.core.coordinator.AnalysisInterruptedException;
import com.packetsentinel.core.coordinator.DetectionCoordinator;
import com.packetsentinel.core.detection.RecentTrafficWindow;
import com.packetsentinel.core.detection.anomaly.AnomalyDetector;
import com.packetsentinel.core.detection.classification.ClassificationDetector;
import com.packetsentinel.core.model.Detection;
import com.packetsentinel.core.model.PacketRecord;
import com.packetsentinel.core.stats.StatsAggregator;
import com.packetsentinel.core.tracking.FeatureTrackers;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Runs packets through detection, alerting and statistics on a worker pool.
 *
 * <h3>Flow</h3>
 * <ol>
 * <li>{@link #submit(PacketRecord)} offers the packet to a bounded queue
 * without blocking. When the queue is full the arriving packet is dropped
 * and counted.</li>
 * <li>Workers take packets from the queue, record them in the
 * {@link StatsAggregator}, run the {@link DetectionCoordinator} and hand
 * every detection to the {@link AlertSink}.</li>
 * <li>A scheduler sweeps the trackers and the dedup index, flushes stats,
 * retrains the anomaly model and optionally reloads the classification
 * model.</li>
 * </ol>
 *
 * <h3>Shutdown</h3>
 * <p>
 * {@link #shutdown(Duration)} stops accepting packets, lets the workers drain
 * the queue up to the timeout, counts anything left as dropped, stops the
 * timers and flushes stats one last time. A packet whose analysis is cut
 * short by the interrupt at the timeout is counted as dropped too.
 * </p>
 *
 * <p>
 * Instances are built by {@link PipelineAssembler}; several independent
 * pipelines may run in one process.
 * </p>
 *
 * @since 1.0.0
 */
public class PacketPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(PacketPipeline.class);

    private static final long POLL_MILLIS = 100;
    private static final long INTERRUPT_GRACE_MILLIS = 1_000;
    private static final AtomicInteger PIPELINE_IDS = new AtomicInteger();

    private final String name;
    private final DetectionCoordinator coordinator;
    private final AlertSink alertSink;
    private final StatsAggregator stats;
    private final FeatureTrackers trackers;
    private final RecentTrafficWindow recentTraffic;
    private final AnomalyDetector anomalyDetector;
    private final ClassificationDetector classificationDetector;
    private final Path modelPath;
    private final ExecutorService detectorExecutor;
    private final Clock clock;

    private final int workerCount;
    private final Duration trackerSweepInterval;
    private final Duration statsFlushInterval;
    private final Duration anomalyRetrainInterval;
    private final Duration modelReloadInterval;

    private final BlockingQueue<PacketRecord> queue;
    private final AtomicReference<PipelineState> state = new AtomicReference<>(PipelineState.NEW);
    private final ReadWriteLock admission = new ReentrantReadWriteLock();
    private final Counter processed;
    private final Counter dropped;

    private ExecutorService workers;
    private ScheduledExecutorService scheduler;

    private PacketPipeline(Builder b) {
        this.name = "pipeline-" + PIPELINE_IDS.incrementAndGet();
        this.coordinator = Objects.requireNonNull(b.coordinator, "coordinator must not be null");
        this.alertSink = Objects.requireNonNull(b.alertSink, "alertSink must not be null");
        this.stats = Objects.requireNonNull(b.stats, "stats must not be null");
        this.trackers = Objects.requireNonNull(b.trackers, "trackers must not be null");
        this.recentTraffic = Objects.requireNonNull(b.recentTraffic, "recentTraffic must not be null");
        this.detectorExecutor = Objects.requireNonNull(b.detectorExecutor, "detectorExecutor must not be null");
        this.clock = Objects.requireNonNull(b.clock, "clock must not be null");
        this.anomalyDetector = b.anomalyDetector;
        this.classificationDetector = b.classificationDetector;
        this.modelPath = b.modelPath;
        this.workerCount = b.workerCount;
        this.trackerSweepInterval = Objects.requireNonNull(b.trackerSweepInterval, "trackerSweepInterval");
        this.statsFlushInterval = Objects.requireNonNull(b.statsFlushInterval, "statsFlushInterval");
        this.anomalyRetrainInterval = Objects.requireNonNull(b.anomalyRetrainInterval, "anomalyRetrainInterval");
        this.modelReloadInterval = b.modelReloadInterval != null ? b.modelReloadInterval : Duration.ZERO;
        if (b.queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be >= 1, got: " + b.queueCapacity);
        }
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1, got: " + workerCount);
        }
        this.queue = new ArrayBlockingQueue<>(b.queueCapacity);

        MeterRegistry registry = Objects.requireNonNull(b.registry, "registry must not be null");
        this.processed = Counter.builder("sentinel.packets.processed")
                .description("Packets fully analyzed")
                .tag("pipeline", name)
                .register(registry);
        this.dropped = Counter.builder("sentinel.packets.dropped")
                .description("Packets dropped on a full queue or at shutdown")
                .tag("pipeline", name)
                .register(registry);
        Gauge.builder("sentinel.queue.depth", queue, BlockingQueue::size)
                .description("Packets waiting for a worker")
                .tag("pipeline", name)
                .register(registry);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Start the workers and timers.
     *
     * @throws IllegalStateException if the pipeline was already started
     */
    public void start() {
        if (!state.compareAndSet(PipelineState.NEW, PipelineState.RUNNING)) {
            throw new IllegalStateException("Pipeline " + name + " is " + state.get());
        }
        workers = Executors.newFixedThreadPool(workerCount, threadFactory(name + "-worker"));
        for (int i = 0; i < workerCount; i++) {
            workers.execute(this::workLoop);
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(threadFactory(name + "-timer"));
        schedule("tracker sweep", trackerSweepInterval, this::sweep);
        schedule("stats flush", statsFlushInterval, stats::flush);
        if (anomalyDetector != null) {
            schedule("anomaly retrain", anomalyRetrainInterval, anomalyDetector::retrain);
        }
        if (classificationDetector != null && modelPath != null && isPositive(modelReloadInterval)) {
            schedule("model reload", modelReloadInterval, () -> classificationDetector.reload(modelPath));
        }
        LOG.info("{} started: {} worker(s), queue capacity {}", name, workerCount, queue.remainingCapacity());
    }

    /**
     * Offer a packet for analysis without blocking.
     *
     * @param packet packet to analyze
     * @return {@code true} if queued, {@code false} if dropped
     */
    public boolean submit(PacketRecord packet) {
        Objects.requireNonNull(packet, "packet must not be null");
        admission.readLock().lock();
        try {
            if (state.get() == PipelineState.RUNNING && queue.offer(packet)) {
                return true;
            }
        } finally {
            admission.readLock().unlock();
        }
        drop(1);
        return false;
    }

    /**
     * Stop accepting packets, drain the queue and flush stats.
     *
     * @param timeout how long the workers may keep draining
     * @return {@code true} if the queue was fully drained in time
     */
    public boolean shutdown(Duration timeout) {
        admission.writeLock().lock();
        try {
            if (!state.compareAndSet(PipelineState.RUNNING, PipelineState.STOPPING)) {
                LOG.debug("{} shutdown ignored in state {}", name, state.get());
                return state.get() == PipelineState.STOPPED;
            }
        } finally {
            admission.writeLock().unlock();
        }
        LOG.info("{} stopping, {} packet(s) queued", name, queue.size());

        boolean drained = awaitWorkers(timeout);
        List<PacketRecord> leftovers = new ArrayList<>();
        queue.drainTo(leftovers);
        if (!leftovers.isEmpty()) {
            LOG.warn("{} dropped {} unprocessed packet(s) at shutdown", name, leftovers.size());
            drop(leftovers.size());
            drained = false;
        }

        scheduler.shutdownNow();
        try {
            stats.flush();
        } catch (RuntimeException e) {
            LOG.error("{} final stats flush failed", name, e);
        }
        detectorExecutor.shutdownNow();
        state.set(PipelineState.STOPPED);
        LOG.info("{} stopped: processed={}, dropped={}", name, processedCount(), droppedCount());
        return drained;
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public PipelineState getState() {
        return state.get();
    }

    public int queueDepth() {
        return queue.size();
    }

    public long processedCount() {
        return (long) processed.count();
    }

    public long droppedCount() {
        return (long) dropped.count();
    }

    public AlertSink getAlertSink() {
        return alertSink;
    }

    public StatsAggregator getStats() {
        return stats;
    }

    // ---------------------------------------------------------------
    // Workers
    // ---------------------------------------------------------------

    private void workLoop() {
        while (!Thread.currentThread().isInterrupted()) {
            PacketRecord packet;
            try {
                packet = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (packet != null) {
                process(packet);
            } else if (state.get() != PipelineState.RUNNING) {
                return;
            }
        }
    }

    void process(PacketRecord packet) {
        try {
            stats.record(packet);
            List<Detection> detections = coordinator.analyze(packet);
            for (Detection detection : detections) {
                stats.recordDetection(detection);
                try {
                    alertSink.submit(detection);
                } catch (RuntimeException e) {
                    LOG.error("Alert submission failed for {}", detection, e);
                }
            }
        } catch (AnalysisInterruptedException e) {
            LOG.warn("{} analysis of {} interrupted, counting it as dropped", name, packet);
            drop(1);
            return;
        } catch (RuntimeException e) {
            LOG.error("Failed to process packet {}", packet, e);
        }
        processed.increment();
    }

    private void drop(int count) {
        dropped.increment(count);
        stats.recordDropped(count);
        LOG.debug("{} dropped {} packet(s)", name, count);
    }

    private boolean awaitWorkers(Duration timeout) {
        workers.shutdown();
        try {
            if (workers.awaitTermination(Math.max(0, timeout.toMillis()), TimeUnit.MILLISECONDS)) {
                return true;
            }
            LOG.warn("{} workers did not drain within {}, interrupting", name, timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        workers.shutdownNow();
        try {
            // interrupted workers still account for their in-flight packet
            if (!workers.awaitTermination(INTERRUPT_GRACE_MILLIS, TimeUnit.MILLISECONDS)) {
                LOG.warn("{} workers still running {} ms after the interrupt", name, INTERRUPT_GRACE_MILLIS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return false;
    }

    // ---------------------------------------------------------------
    // Timers
    // ---------------------------------------------------------------

    private void sweep() {
        int removed = trackers.sweepAll(clock.instant());
        removed += recentTraffic.sweep(clock.instant());
        int alerts = alertSink.sweep(clock.instant());
        LOG.debug("{} sweep evicted {} tracker entr(ies) and {} dedup entr(ies)", name, removed, alerts);
    }

    private void schedule(String task, Duration interval, Runnable action) {
        if (!isPositive(interval)) {
            LOG.info("{} {} disabled", name, task);
            return;
        }
        long millis = interval.toMillis();
        scheduler.scheduleAtFixedRate(() -> {
            try {
                action.run();
            } catch (RuntimeException e) {
                LOG.error("{} {} failed", name, task, e);
            }
        }, millis, millis, TimeUnit.MILLISECONDS);
    }

    private static boolean isPositive(Duration d) {
        return d != null && !d.isZero() && !d.isNegative();
    }

    private static ThreadFactory threadFactory(String prefix) {
        AtomicInteger count = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + count.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private DetectionCoordinator coordinator;
        private AlertSink alertSink;
        private StatsAggregator stats;
        private FeatureTrackers trackers;
        private RecentTrafficWindow recentTraffic;
        private AnomalyDetector anomalyDetector;
        private ClassificationDetector classificationDetector;
        private Path modelPath;
        private ExecutorService detectorExecutor;
        private Clock clock = Clock.systemUTC();
        private MeterRegistry registry;
        private int queueCapacity = 10_000;
        private int workerCount = Runtime.getRuntime().availableProcessors();
        private Duration trackerSweepInterval = Duration.ofSeconds(60);
        private Duration statsFlushInterval = Duration.ofSeconds(60);
        private Duration anomalyRetrainInterval = Duration.ofHours(1);
        private Duration modelReloadInterval = Duration.ZERO;

        public Builder coordinator(DetectionCoordinator coordinator) {
            this.coordinator = coordinator;
            return this;
        }

        public Builder alertSink(AlertSink alertSink) {
            this.alertSink = alertSink;
            return this;
        }

        public Builder stats(StatsAggregator stats) {
            this.stats = stats;
            return this;
        }

        public Builder trackers(FeatureTrackers trackers) {
            this.trackers = trackers;
            return this;
        }

        public Builder recentTraffic(RecentTrafficWindow recentTraffic) {
            this.recentTraffic = recentTraffic;
            return this;
        }

        /** Optional; enables the retrain timer. */
        public Builder anomalyDetector(AnomalyDetector anomalyDetector) {
            this.anomalyDetector = anomalyDetector;
            return this;
        }

        /** Optional; with a model path and reload interval enables reloads. */
        public Builder classificationDetector(ClassificationDetector classificationDetector, Path modelPath) {
            this.classificationDetector = classificationDetector;
            this.modelPath = modelPath;
            return this;
        }

        /** Executor the coordinator runs detectors on; shut down with the pipeline. */
        public Builder detectorExecutor(ExecutorService detectorExecutor) {
            this.detectorExecutor = detectorExecutor;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder registry(MeterRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder queueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
            return this;
        }

        public Builder workerCount(int workerCount) {
            this.workerCount = workerCount;
            return this;
        }

        public Builder trackerSweepInterval(Duration trackerSweepInterval) {
            this.trackerSweepInterval = trackerSweepInterval;
            return this;
        }

        public Builder statsFlushInterval(Duration statsFlushInterval) {
            this.statsFlushInterval = statsFlushInterval;
            return this;
        }

        public Builder anomalyRetrainInterval(Duration anomalyRetrainInterval) {
            this.anomalyRetrainInterval = anomalyRetrainInterval;
            return this;
        }

        public Builder modelReloadInterval(Duration modelReloadInterval) {
            this.modelReloadInterval = modelReloadInterval;
            return this;
        }

        public PacketPipeline build() {
            return new PacketPipeline(this);
        }
    }
}
