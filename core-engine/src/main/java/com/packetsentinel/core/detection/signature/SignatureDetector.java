package com.packetsentinel.core.detection.signature;

import com.packetsentinel.core.config.SignatureRulesConfig;
import com.packetsentinel.core.detection.AnalysisContext;
import com.packetsentinel.core.detection.Detector;
import com.packetsentinel.core.model.Detection;
import com.packetsentinel.core.model.DetectorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Rule-table detector.
 *
 * <p>
 * Evaluates every rule against every packet; several rules may fire on the
 * same packet and each contributes at most one detection. A rule that throws
 * is logged and skipped for that packet, the remaining rules still run.
 * </p>
 *
 * @since 1.0.0
 */
public class SignatureDetector implements Detector {

    private static final Logger LOG = LoggerFactory.getLogger(SignatureDetector.class);

    private final List<SignatureRule> rules;

    public SignatureDetector(List<SignatureRule> rules) {
        Objects.requireNonNull(rules, "rules must not be null");
        this.rules = List.copyOf(rules);
        LOG.info("Signature detector initialised with {} rule(s)", this.rules.size());
    }

    /**
     * Build a detector from a loaded rule configuration.
     */
    public static SignatureDetector fromConfig(SignatureRulesConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        return new SignatureDetector(SignatureRuleFactory.createAll(config.getRules()));
    }

    @Override
    public DetectorKind kind() {
        return DetectorKind.SIGNATURE;
    }

    @Override
    public List<Detection> detect(AnalysisContext context) {
        List<Detection> detections = new ArrayList<>(2);
        for (SignatureRule rule : rules) {
            try {
                Optional<Detection> detection = rule.evaluate(context);
                detection.ifPresent(detections::add);
            } catch (RuntimeException e) {
                LOG.error("Rule [{}] failed for {}", rule.getName(), context.getPacket(), e);
            }
        }
        return detections;
    }

    public List<SignatureRule> getRules() {
        return rules;
    }
}
