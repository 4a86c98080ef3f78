package com.packetsentinel.core.detection.classification;

import com.packetsentinel.core.detection.AnalysisContext;
import com.packetsentinel.core.detection.Detector;
import com.packetsentinel.core.model.Detection;
import com.packetsentinel.core.model.DetectorKind;
import com.packetsentinel.core.model.FeatureVector;
import com.packetsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Supervised classification layer.
 *
 * <h3>Feature Alignment</h3>
 * <p>
 * The live vector is aligned to the model's feature count {@code F}:
 * shorter vectors are right-padded with zeros, longer ones truncated to
 * their first {@code F} values. A mismatch is logged at WARN the first time
 * a (live, expected) size pair is seen and at DEBUG afterwards; it never
 * fails the call.
 * </p>
 *
 * <h3>Labels</h3>
 * <p>
 * The predicted label is the more probable class. If the model's confidence
 * in it is below the classification threshold, the label is
 * {@link Classification.Label#BENIGN BENIGN} regardless. Without a model the
 * result is {@link Classification#unavailable()}.
 * </p>
 *
 * <h3>Model Swap</h3>
 * <p>
 * The model sits in an {@link AtomicReference}; {@link #reload(Path)} and
 * {@link #setModel(ClassificationModel)} replace it without disturbing
 * calls in flight.
 * </p>
 *
 * @since 1.0.0
 */
public class ClassificationDetector implements Detector {

    private static final Logger LOG = LoggerFactory.getLogger(ClassificationDetector.class);

    public static final String RULE_ID = "ml_classification";
    static final String DESCRIPTION = "Malicious traffic identified by classification model";
    private static final double HIGH_SEVERITY_CONFIDENCE = 0.9;

    private final AtomicReference<ClassificationModel> model;
    private final double threshold;
    private final Set<String> reportedMismatches = ConcurrentHashMap.newKeySet();

    /**
     * @param model     initial model, may be {@code null}
     * @param threshold minimum confidence for a non-benign label, in [0, 1]
     */
    public ClassificationDetector(ClassificationModel model, double threshold) {
        if (!(threshold >= 0.0 && threshold <= 1.0)) {
            throw new IllegalArgumentException("threshold must be in [0, 1], got: " + threshold);
        }
        this.model = new AtomicReference<>(model);
        this.threshold = threshold;
    }

    @Override
    public DetectorKind kind() {
        return DetectorKind.CLASSIFICATION;
    }

    @Override
    public List<Detection> detect(AnalysisContext context) {
        Classification result = classify(context.getFeatures());
        if (!result.isMalicious()) {
            return List.of();
        }
        double confidence = result.getConfidence();
        return List.of(Detection.forPacket(DetectorKind.CLASSIFICATION, context.getPacket())
                .ruleId(RULE_ID)
                .severity(confidence >= HIGH_SEVERITY_CONFIDENCE ? Severity.HIGH : Severity.MEDIUM)
                .confidence(confidence)
                .description(DESCRIPTION)
                .evidence(String.format("p(malicious)=%.3f", result.getMaliciousProbability()))
                .build());
    }

    /**
     * Classify a feature vector. Never throws.
     *
     * @param features live feature vector of any length
     * @return the classification, {@link Classification#unavailable()} when
     *         no model is loaded or the model fails
     */
    public Classification classify(FeatureVector features) {
        ClassificationModel current = model.get();
        if (current == null) {
            return Classification.unavailable();
        }
        double[] aligned = align(features.toArray(), current.featureCount());
        double pMalicious;
        try {
            pMalicious = current.maliciousProbability(aligned);
        } catch (RuntimeException e) {
            LOG.error("Classification model failed, treating layer as unavailable for this packet", e);
            return Classification.unavailable();
        }
        if (!Double.isFinite(pMalicious)) {
            return Classification.unavailable();
        }
        pMalicious = Math.max(0.0, Math.min(1.0, pMalicious));

        boolean malicious = pMalicious >= 0.5;
        double confidence = malicious ? pMalicious : 1.0 - pMalicious;
        Classification.Label label = malicious && confidence >= threshold
                ? Classification.Label.MALICIOUS
                : Classification.Label.BENIGN;
        return Classification.of(label, confidence, pMalicious);
    }

    /**
     * Replace the model from a model file. On failure the current model is
     * kept.
     *
     * @return {@code true} if the new model is active
     */
    public boolean reload(Path path) {
        try {
            setModel(ClassificationModelLoader.load(path));
            return true;
        } catch (ModelLoadException e) {
            LOG.error("Model reload from {} failed, keeping the current model", path, e);
            return false;
        }
    }

    public void setModel(ClassificationModel replacement) {
        ClassificationModel previous = model.getAndSet(replacement);
        if (previous != replacement) {
            reportedMismatches.clear();
        }
    }

    public Optional<ClassificationModel> getModel() {
        return Optional.ofNullable(model.get());
    }

    public boolean isAvailable() {
        return model.get() != null;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    double[] align(double[] live, int expected) {
        if (live.length == expected) {
            return live;
        }
        String pair = live.length + "->" + expected;
        if (reportedMismatches.add(pair)) {
            LOG.warn("Feature count mismatch: live vector has {} features, model expects {}; {}",
                    live.length, expected, live.length < expected ? "padding with zeros" : "truncating");
        } else {
            LOG.debug("Feature count mismatch {}", pair);
        }
        return Arrays.copyOf(live, expected);
    }
}
