package com.packetsentinel.core.detection.anomaly;

import com.packetsentinel.core.detection.AnalysisContext;
import com.packetsentinel.core.detection.Detector;
import com.packetsentinel.core.model.Detection;
import com.packetsentinel.core.model.DetectorKind;
import com.packetsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Online-trained unsupervised detector.
 *
 * <h3>Lifecycle</h3>
 * <p>
 * Every feature vector is buffered. While no model exists the detector is
 * {@link AnomalyState#COLLECTING COLLECTING} and never fires. When the buffer
 * reaches {@code minSamples} the packet that crossed the line trains the
 * first model synchronously and is then scored by it. Concurrent workers
 * that find a training run in progress skip scoring instead of waiting.
 * </p>
 *
 * <p>
 * {@link #retrain()} is meant for a background timer. It trains a
 * replacement from the buffered samples and publishes it through an
 * {@link AtomicReference}; detect calls in flight finish on the model they
 * already hold.
 * </p>
 *
 * <h3>Firing</h3>
 * <p>
 * A detection fires when the model confidence is strictly greater than the
 * anomaly threshold. Severity is {@code high} from confidence 0.8 upwards,
 * {@code medium} below.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyDetector implements Detector {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyDetector.class);

    public static final String RULE_ID = "ml_anomaly";
    static final String DESCRIPTION = "Anomalous traffic pattern detected";
    private static final double HIGH_SEVERITY_CONFIDENCE = 0.8;

    private final AnomalyModelTrainer trainer;
    private final int minSamples;
    private final double threshold;
    private final SampleBuffer samples;

    private final AtomicReference<AnomalyModel> activeModel = new AtomicReference<>();
    private final ReentrantLock trainLock = new ReentrantLock();
    private final AtomicLong observed = new AtomicLong();
    private volatile AnomalyState state = AnomalyState.UNTRAINED;

    /** Observation count at which a failed initial training may be retried. */
    private volatile long retryInitialAt;

    /**
     * @param trainer        model trainer
     * @param minSamples     samples required before the first training, &ge; 2
     * @param threshold      confidence a detection must exceed, in [0, 1]
     * @param sampleCapacity maximum buffered samples, &ge; {@code minSamples}
     */
    public AnomalyDetector(AnomalyModelTrainer trainer, int minSamples, double threshold, int sampleCapacity) {
        this.trainer = Objects.requireNonNull(trainer, "trainer must not be null");
        if (minSamples < 2) {
            throw new IllegalArgumentException("minSamples must be >= 2, got: " + minSamples);
        }
        if (sampleCapacity < minSamples) {
            throw new IllegalArgumentException("sampleCapacity must be >= minSamples, got: " + sampleCapacity);
        }
        if (!(threshold >= 0.0 && threshold <= 1.0)) {
            throw new IllegalArgumentException("threshold must be in [0, 1], got: " + threshold);
        }
        this.minSamples = minSamples;
        this.threshold = threshold;
        this.samples = new SampleBuffer(sampleCapacity);
    }

    @Override
    public DetectorKind kind() {
        return DetectorKind.ANOMALY;
    }

    @Override
    public List<Detection> detect(AnalysisContext context) {
        double[] vector = context.getFeatures().toArray();
        int buffered = samples.add(vector);
        long seen = observed.incrementAndGet();

        AnomalyModel model = activeModel.get();
        if (model == null) {
            if (state == AnomalyState.UNTRAINED) {
                state = AnomalyState.COLLECTING;
            }
            if (buffered < minSamples || seen < retryInitialAt) {
                return List.of();
            }
            model = trainInitial();
            if (model == null) {
                return List.of();
            }
        }

        double confidence = model.confidence(vector);
        if (confidence <= threshold) {
            return List.of();
        }
        LOG.debug("Anomaly from {} with confidence {}", context.getPacket().getSourceIp(), confidence);
        return List.of(Detection.forPacket(DetectorKind.ANOMALY, context.getPacket())
                .ruleId(RULE_ID)
                .severity(confidence >= HIGH_SEVERITY_CONFIDENCE ? Severity.HIGH : Severity.MEDIUM)
                .confidence(confidence)
                .description(DESCRIPTION)
                .evidence(String.format("score=%.4f confidence=%.2f", model.score(vector), confidence))
                .build());
    }

    /**
     * Train a replacement model from the buffered samples and swap it in.
     * Does the initial training instead when no model exists yet and enough
     * samples are buffered.
     *
     * @return {@code true} if a new model was published
     */
    public boolean retrain() {
        if (activeModel.get() == null) {
            return samples.size() >= minSamples && trainInitial() != null;
        }
        trainLock.lock();
        try {
            state = AnomalyState.RETRAINING;
            List<double[]> snapshot = samples.snapshot();
            long started = System.currentTimeMillis();
            AnomalyModel replacement = trainer.train(snapshot);
            activeModel.set(replacement);
            LOG.info("Anomaly model retrained on {} samples in {} ms",
                    snapshot.size(), System.currentTimeMillis() - started);
            return true;
        } catch (RuntimeException e) {
            LOG.error("Anomaly model retraining failed, keeping the active model", e);
            return false;
        } finally {
            state = AnomalyState.TRAINED;
            trainLock.unlock();
        }
    }

    public AnomalyState getState() {
        return state;
    }

    public boolean isTrained() {
        return activeModel.get() != null;
    }

    public int bufferedSamples() {
        return samples.size();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    /**
     * @return the active model, or {@code null} if training is running in
     *         another thread or failed
     */
    private AnomalyModel trainInitial() {
        if (!trainLock.tryLock()) {
            return null;
        }
        try {
            AnomalyModel existing = activeModel.get();
            if (existing != null) {
                return existing;
            }
            List<double[]> snapshot = samples.snapshot();
            AnomalyModel model = trainer.train(snapshot);
            activeModel.set(model);
            state = AnomalyState.TRAINED;
            LOG.info("Anomaly model trained on {} samples, detector is active", snapshot.size());
            return model;
        } catch (RuntimeException e) {
            retryInitialAt = observed.get() + minSamples;
            LOG.error("Initial anomaly model training failed, retrying after {} more samples", minSamples, e);
            return null;
        } finally {
            trainLock.unlock();
        }
    }
}
