package com.packetsentinel.core.config;

import com.packetsentinel.core.model.Severity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Describes a single signature rule loaded from configuration.
 *
 * <p>
 * Supported rule types:
 * </p>
 * <ul>
 * <li>{@code pattern} - regex match against a packet field
 * ({@code payload}, {@code uri} or {@code user_agent})</li>
 * <li>{@code port_scan} - distinct destination ports of a source within
 * the recent window</li>
 * <li>{@code packet_burst} - packets of a source within the recent
 * window</li>
 * <li>{@code exfiltration} - bytes sent by a source within the recent
 * window</li>
 * <li>{@code brute_force} - failed logins of a source within the login
 * window</li>
 * </ul>
 *
 * <p>
 * Call {@link #validate()} after deserialization. Validation only checks
 * structure; whether the regexes compile is decided when the rule is
 * built, so one bad pattern cannot take the whole rule table down.
 * </p>
 *
 * @since 1.0.0
 */
public class SignatureRuleDefinition {

    public static final String TYPE_PATTERN = "pattern";
    public static final String TYPE_PORT_SCAN = "port_scan";
    public static final String TYPE_PACKET_BURST = "packet_burst";
    public static final String TYPE_EXFILTRATION = "exfiltration";
    public static final String TYPE_BRUTE_FORCE = "brute_force";

    public static final String FIELD_PAYLOAD = "payload";
    public static final String FIELD_URI = "uri";
    public static final String FIELD_USER_AGENT = "user_agent";

    /** Unique rule name, used as the detection rule id. */
    private String name;

    /** Rule type, see class documentation. */
    private String type;

    /** Stable description copied into every detection of this rule. */
    private String description;

    /** Severity name: low, medium, high or critical. */
    private String severity;

    /** Fixed confidence for pattern rules, base confidence for aggregates. */
    private double confidence = 0.8;

    // --- Pattern fields ---
    /** Packet field the patterns are matched against. */
    private String field = FIELD_PAYLOAD;

    /** Regular expressions, matched case-insensitively in order. */
    private List<String> patterns = new ArrayList<>();

    // --- Aggregate fields ---
    /** Value the observation must exceed (brute force: reach). */
    private double threshold;

    /**
     * Optional window narrowing the recent history, in seconds. Zero uses
     * the whole history window.
     */
    private int windowSeconds;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that all required fields for the declared rule type are
     * present and contain legal values.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (name == null || name.isBlank()) {
            errors.add("Rule 'name' is required");
        }
        if (description == null || description.isBlank()) {
            errors.add("Rule '" + name + "' requires 'description'");
        }
        if (severity == null || severity.isBlank()) {
            errors.add("Rule '" + name + "' requires 'severity'");
        } else {
            try {
                Severity.fromName(severity);
            } catch (IllegalArgumentException e) {
                errors.add("Rule '" + name + "': " + e.getMessage());
            }
        }
        if (confidence < 0.0 || confidence > 1.0) {
            errors.add("Rule '" + name + "' requires 'confidence' in [0, 1]");
        }

        if (type == null || type.isBlank()) {
            errors.add("Rule 'type' is required");
        } else {
            switch (type) {
                case TYPE_PATTERN -> {
                    if (patterns == null || patterns.isEmpty()) {
                        errors.add("Pattern rule '" + name + "' requires at least one entry in 'patterns'");
                    }
                    if (!FIELD_PAYLOAD.equals(field) && !FIELD_URI.equals(field)
                            && !FIELD_USER_AGENT.equals(field)) {
                        errors.add("Pattern rule '" + name + "' has unknown field '" + field
                                + "'. Supported: payload, uri, user_agent");
                    }
                }
                case TYPE_PORT_SCAN, TYPE_PACKET_BURST, TYPE_EXFILTRATION, TYPE_BRUTE_FORCE -> {
                    if (threshold <= 0) {
                        errors.add("Rule '" + name + "' requires 'threshold' > 0");
                    }
                    if (windowSeconds < 0) {
                        errors.add("Rule '" + name + "' requires 'windowSeconds' >= 0");
                    }
                }
                default -> errors.add("Unknown rule type: '" + type
                        + "'. Supported: pattern, port_scan, packet_burst, exfiltration, brute_force");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid SignatureRuleDefinition: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getType() {
        return type;
    }

    /**
     * Set the rule type, normalised to lowercase.
     *
     * @param type rule type string
     */
    public void setType(String type) {
        this.type = type != null ? type.trim().toLowerCase(Locale.ROOT) : null;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getSeverity() {
        return severity;
    }

    public void setSeverity(String severity) {
        this.severity = severity;
    }

    public double getConfidence() {
        return confidence;
    }

    public void setConfidence(double confidence) {
        this.confidence = confidence;
    }

    public String getField() {
        return field;
    }

    /**
     * Set the target field, normalised to lowercase.
     *
     * @param field packet field name
     */
    public void setField(String field) {
        this.field = field != null ? field.trim().toLowerCase(Locale.ROOT) : FIELD_PAYLOAD;
    }

    /**
     * @return unmodifiable list of patterns
     */
    public List<String> getPatterns() {
        return Collections.unmodifiableList(patterns);
    }

    public void setPatterns(List<String> patterns) {
        this.patterns = patterns != null ? new ArrayList<>(patterns) : new ArrayList<>();
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public int getWindowSeconds() {
        return windowSeconds;
    }

    public void setWindowSeconds(int windowSeconds) {
        this.windowSeconds = windowSeconds;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SignatureRuleDefinition that))
            return false;
        return Objects.equals(name, that.name) && Objects.equals(type, that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return "SignatureRuleDefinition{" +
                "name='" + name + '\'' +
                ", type='" + type + '\'' +
                ", severity='" + severity + '\'' +
                ", field='" + field + '\'' +
                ", patterns=" + patterns.size() +
                ", threshold=" + threshold +
                ", windowSeconds=" + windowSeconds +
                '}';
    }
}
