package com.packetsentinel.core.detection.signature;

import com.packetsentinel.core.config.SignatureRuleDefinition;
import com.packetsentinel.core.detection.AnalysisContext;
import com.packetsentinel.core.model.Detection;
import com.packetsentinel.core.model.DetectorKind;
import com.packetsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Base class of the multi-packet rules.
 *
 * <p>
 * A subclass observes one number per packet, usually from the recent
 * activity of the packet's source. The rule fires when the observation
 * exceeds the threshold, with a confidence that grows from the configured
 * base towards 1 as the observation moves past the threshold:
 * </p>
 *
 * <pre>
 * confidence = min(1, base + (1 - base) * (observed / threshold - 1))
 * </pre>
 *
 * <p>
 * The description is fixed; the observed value goes into the evidence so
 * repeated firings deduplicate into one alert.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class AggregateRule implements SignatureRule {

    private static final Logger LOG = LoggerFactory.getLogger(AggregateRule.class);

    private final String name;
    private final Severity severity;
    private final double baseConfidence;
    private final String description;
    private final double threshold;
    private final Duration window;

    /**
     * @param definition a validated rule definition with a positive threshold
     * @throws IllegalArgumentException if the threshold is not positive
     */
    protected AggregateRule(SignatureRuleDefinition definition) {
        Objects.requireNonNull(definition, "SignatureRuleDefinition must not be null");
        this.name = Objects.requireNonNull(definition.getName(), "Rule name must not be null");
        this.severity = Severity.fromName(definition.getSeverity());
        this.baseConfidence = definition.getConfidence();
        this.description = definition.getDescription();
        this.threshold = definition.getThreshold();
        this.window = Duration.ofSeconds(Math.max(0, definition.getWindowSeconds()));
        if (threshold <= 0) {
            throw new IllegalArgumentException(
                    "threshold must be > 0 for rule '" + name + "', got: " + threshold);
        }
    }

    /**
     * @return the value compared against the threshold
     */
    protected abstract double observe(AnalysisContext context);

    /**
     * @return evidence text for a firing with {@code observed}
     */
    protected abstract String evidence(double observed);

    /**
     * Strictly greater by default.
     */
    protected boolean exceeds(double observed) {
        return observed > threshold;
    }

    @Override
    public Optional<Detection> evaluate(AnalysisContext context) {
        double observed = observe(context);
        if (!exceeds(observed)) {
            return Optional.empty();
        }
        LOG.debug("Rule [{}] fired for {}: observed={} threshold={}",
                name, context.getPacket().getSourceIp(), observed, threshold);
        return Optional.of(Detection.forPacket(DetectorKind.SIGNATURE, context.getPacket())
                .ruleId(name)
                .severity(severity)
                .confidence(scaledConfidence(observed))
                .description(description)
                .evidence(evidence(observed))
                .build());
    }

    double scaledConfidence(double observed) {
        double excess = Math.max(0.0, observed / threshold - 1.0);
        return Math.min(1.0, baseConfidence + (1.0 - baseConfidence) * excess);
    }

    @Override
    public String getName() {
        return name;
    }

    public double getThreshold() {
        return threshold;
    }

    /**
     * @return rule window; zero means the whole recent history
     */
    protected Duration getWindow() {
        return window;
    }

    protected String windowText() {
        return window.isZero() ? "the recent window" : window.getSeconds() + "s";
    }
}
