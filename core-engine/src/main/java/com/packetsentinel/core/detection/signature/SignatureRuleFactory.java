package com.packetsentinel.core.detection.signature;

import com.packetsentinel.core.config.SignatureRuleDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Factory that creates {@link SignatureRule} instances from
 * {@link SignatureRuleDefinition} configurations.
 *
 * <p>
 * This is the single point of extension when adding new rule types:
 * register the new type string here and create the corresponding rule.
 * </p>
 *
 * @since 1.0.0
 */
public final class SignatureRuleFactory {

    private static final Logger LOG = LoggerFactory.getLogger(SignatureRuleFactory.class);

    private SignatureRuleFactory() {
        // utility class
    }

    /**
     * Create a rule for the given definition.
     *
     * @param definition the rule configuration; must not be {@code null}
     * @return the rule, or empty when it is a pattern rule none of whose
     *         patterns compile
     * @throws NullPointerException     if {@code definition} or its type is
     *                                  {@code null}
     * @throws IllegalArgumentException if the rule type is unknown
     */
    public static Optional<SignatureRule> create(SignatureRuleDefinition definition) {
        Objects.requireNonNull(definition, "SignatureRuleDefinition must not be null");
        Objects.requireNonNull(definition.getType(), "Rule type must not be null");

        SignatureRule rule = switch (definition.getType()) {
            case SignatureRuleDefinition.TYPE_PATTERN -> new PatternRule(definition);
            case SignatureRuleDefinition.TYPE_PORT_SCAN -> new PortScanRule(definition);
            case SignatureRuleDefinition.TYPE_PACKET_BURST -> new PacketBurstRule(definition);
            case SignatureRuleDefinition.TYPE_EXFILTRATION -> new ExfiltrationRule(definition);
            case SignatureRuleDefinition.TYPE_BRUTE_FORCE -> new BruteForceRule(definition);
            default -> throw new IllegalArgumentException(
                    "Unknown rule type: '" + definition.getType()
                            + "'. Supported types: pattern, port_scan, packet_burst, exfiltration, brute_force");
        };

        if (rule instanceof PatternRule patternRule && !patternRule.hasPatterns()) {
            LOG.warn("Rule [{}] has no usable pattern and is disabled", definition.getName());
            return Optional.empty();
        }
        return Optional.of(rule);
    }

    /**
     * Create rules for every definition, dropping disabled ones.
     *
     * @param definitions rule configurations; must not be {@code null}
     * @return unmodifiable list of rules in definition order
     */
    public static List<SignatureRule> createAll(List<SignatureRuleDefinition> definitions) {
        Objects.requireNonNull(definitions, "Definitions list must not be null");
        List<SignatureRule> rules = new ArrayList<>(definitions.size());
        for (SignatureRuleDefinition definition : definitions) {
            create(definition).ifPresent(rules::add);
        }
        LOG.info("Created {} of {} signature rule(s)", rules.size(), definitions.size());
        return Collections.unmodifiableList(rules);
    }
}
