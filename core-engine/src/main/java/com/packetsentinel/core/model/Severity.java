package com.packetsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity assigned to a {@link Detection}.
 *
 * @since 1.0.0
 */
public enum Severity {

    LOW(1),
    MEDIUM(2),
    HIGH(3),
    CRITICAL(4);

    private final int priority;

    Severity(int priority) {
        this.priority = priority;
    }

    public int priority() {
        return priority;
    }

    /**
     * @return lowercase identifier used in alerts and JSON
     */
    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Strict lookup used when validating rule configuration.
     *
     * @param name severity name, case-insensitive
     * @return the severity
     * @throws IllegalArgumentException if the name is unknown
     * @throws NullPointerException     if {@code name} is {@code null}
     */
    public static Severity fromName(String name) {
        if (name == null) {
            throw new NullPointerException("Severity name must not be null");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown severity: '" + name
                    + "'. Supported: low, medium, high, critical", e);
        }
    }
}
