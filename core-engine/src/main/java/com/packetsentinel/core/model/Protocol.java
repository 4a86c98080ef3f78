package com.packetsentinel.core.model;

import java.util.Locale;

/**
 * Transport protocol of a captured packet.
 *
 * <p>
 * Each constant carries the numeric code used as the {@code protocol_type}
 * feature. Codes are part of the trained-model contract and must not change.
 * </p>
 *
 * @since 1.0.0
 */
public enum Protocol {

    OTHER(0),
    TCP(1),
    UDP(2),
    ICMP(3);

    private final int code;

    Protocol(int code) {
        this.code = code;
    }

    /**
     * @return numeric feature code of this protocol
     */
    public int code() {
        return code;
    }

    /**
     * Lenient lookup by name. Unknown, blank or {@code null} names map to
     * {@link #OTHER}.
     *
     * @param name protocol name, case-insensitive
     * @return matching protocol, never {@code null}
     */
    public static Protocol fromName(String name) {
        if (name == null || name.isBlank()) {
            return OTHER;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return OTHER;
        }
    }
}
