package com.packetsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The detection layer a {@link Detection} originates from.
 *
 * @since 1.0.0
 */
public enum DetectorKind {

    SIGNATURE,
    ANOMALY,
    CLASSIFICATION;

    /**
     * @return lowercase identifier used in alerts, metrics tags and JSON
     */
    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
