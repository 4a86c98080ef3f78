package com.packetsentinel.core.detection.signature;

import com.packetsentinel.core.config.SignatureRuleDefinition;
import com.packetsentinel.core.detection.AnalysisContext;
import com.packetsentinel.core.model.Detection;
import com.packetsentinel.core.model.DetectorKind;
import com.packetsentinel.core.model.PacketRecord;
import com.packetsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Single-packet rule matching regular expressions against one packet field.
 *
 * <p>
 * Patterns are compiled case-insensitively and tried in declaration order;
 * the first match wins and is reported as evidence. Patterns that do not
 * compile are skipped with a warning. A rule left with no usable pattern
 * cannot be built; see {@link #hasPatterns()}.
 * </p>
 *
 * @since 1.0.0
 */
public class PatternRule implements SignatureRule {

    private static final Logger LOG = LoggerFactory.getLogger(PatternRule.class);

    /** Longest matched text copied into the evidence. */
    private static final int MAX_EVIDENCE_LENGTH = 120;

    private final String name;
    private final String field;
    private final Severity severity;
    private final double confidence;
    private final String description;
    private final List<Pattern> patterns;

    /**
     * @param definition a validated rule definition of type {@code pattern}
     */
    public PatternRule(SignatureRuleDefinition definition) {
        Objects.requireNonNull(definition, "SignatureRuleDefinition must not be null");
        this.name = Objects.requireNonNull(definition.getName(), "Rule name must not be null");
        this.field = definition.getField();
        this.severity = Severity.fromName(definition.getSeverity());
        this.confidence = definition.getConfidence();
        this.description = definition.getDescription();

        List<Pattern> compiled = new ArrayList<>();
        for (String regex : definition.getPatterns()) {
            try {
                compiled.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
            } catch (PatternSyntaxException e) {
                LOG.warn("Rule [{}]: skipping pattern that does not compile: {} ({})",
                        name, regex, e.getDescription());
            }
        }
        this.patterns = Collections.unmodifiableList(compiled);
    }

    @Override
    public Optional<Detection> evaluate(AnalysisContext context) {
        PacketRecord packet = context.getPacket();
        Optional<String> target = target(packet);
        if (target.isEmpty() || target.get().isEmpty()) {
            return Optional.empty();
        }
        String text = target.get();
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                LOG.debug("Rule [{}] matched {} of {}", name, field, packet.getSourceIp());
                return Optional.of(Detection.forPacket(DetectorKind.SIGNATURE, packet)
                        .ruleId(name)
                        .severity(severity)
                        .confidence(confidence)
                        .description(description)
                        .evidence(field + " matched '" + abbreviate(matcher.group()) + "'")
                        .build());
            }
        }
        return Optional.empty();
    }

    @Override
    public String getName() {
        return name;
    }

    /**
     * @return {@code true} if at least one pattern compiled
     */
    public boolean hasPatterns() {
        return !patterns.isEmpty();
    }

    int patternCount() {
        return patterns.size();
    }

    private Optional<String> target(PacketRecord packet) {
        return switch (field) {
            case SignatureRuleDefinition.FIELD_URI -> packet.getUri();
            case SignatureRuleDefinition.FIELD_USER_AGENT -> packet.getUserAgent();
            default -> Optional.of(packet.payloadText());
        };
    }

    private static String abbreviate(String matched) {
        return matched.length() <= MAX_EVIDENCE_LENGTH ? matched : matched.substring(0, MAX_EVIDENCE_LENGTH) + "...";
    }
}
