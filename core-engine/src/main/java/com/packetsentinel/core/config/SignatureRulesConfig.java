package com.packetsentinel.core.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Top-level POJO for the signature rules YAML.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * rules:
 *   - name: sql_injection
 *     type: pattern
 *     field: payload
 *     severity: critical
 *     confidence: 0.9
 *     description: Potential SQL injection attempt detected
 *     patterns:
 *       - "(or\\s+1=1|and\\s+1=1)"
 *   - name: port_scan
 *     type: port_scan
 *     severity: medium
 *     threshold: 20
 *     windowSeconds: 10
 *     description: Port scanning activity detected
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading to verify every rule is valid.
 * </p>
 *
 * @since 1.0.0
 */
public class SignatureRulesConfig {

    private List<SignatureRuleDefinition> rules = new ArrayList<>();

    /**
     * Return the rules list. The returned list is <strong>unmodifiable</strong>.
     *
     * @return unmodifiable list of rule definitions
     */
    public List<SignatureRuleDefinition> getRules() {
        return Collections.unmodifiableList(rules);
    }

    /**
     * Set the rules list (used by SnakeYAML during deserialization).
     *
     * @param rules the rule definitions
     */
    public void setRules(List<SignatureRuleDefinition> rules) {
        this.rules = rules != null ? new ArrayList<>(rules) : new ArrayList<>();
    }

    /**
     * Validate every rule and check that rule names are unique.
     *
     * <p>
     * Collects all errors and throws a single exception if any rule is
     * invalid.
     * </p>
     *
     * @throws IllegalStateException if one or more rules are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        Set<String> names = new HashSet<>();

        for (int i = 0; i < rules.size(); i++) {
            SignatureRuleDefinition rule = Objects.requireNonNull(rules.get(i),
                    "Rule at index " + i + " is null");
            try {
                rule.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
            if (rule.getName() != null && !names.add(rule.getName())) {
                errors.add("Duplicate rule name: '" + rule.getName() + "'");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Signature rules validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    @Override
    public String toString() {
        return "SignatureRulesConfig{rules=" + rules + '}';
    }
}
