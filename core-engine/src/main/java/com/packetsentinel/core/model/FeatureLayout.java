package com.packetsentinel.core.model;

import java.util.List;
import java.util.Locale;

/**
 * Ordered feature names produced by the feature extractor.
 *
 * <p>
 * {@link #LIVE} is the six-feature layout every detector understands.
 * {@link #EXTENDED} appends packet-level features for models trained on
 * richer datasets. The first six names are shared, so a model trained on
 * {@code LIVE} still sees its features in the expected positions when the
 * extended layout is truncated.
 * </p>
 *
 * @since 1.0.0
 */
public enum FeatureLayout {

    LIVE(List.of(
            FeatureNames.PACKET_SIZE,
            FeatureNames.PROTOCOL_TYPE,
            FeatureNames.CONNECTION_DURATION,
            FeatureNames.FAILED_LOGIN_ATTEMPTS,
            FeatureNames.DATA_TRANSFER_RATE,
            FeatureNames.ACCESS_FREQUENCY)),

    EXTENDED(List.of(
            FeatureNames.PACKET_SIZE,
            FeatureNames.PROTOCOL_TYPE,
            FeatureNames.CONNECTION_DURATION,
            FeatureNames.FAILED_LOGIN_ATTEMPTS,
            FeatureNames.DATA_TRANSFER_RATE,
            FeatureNames.ACCESS_FREQUENCY,
            FeatureNames.SOURCE_PORT,
            FeatureNames.DESTINATION_PORT,
            FeatureNames.TCP_FLAGS,
            FeatureNames.PAYLOAD_ENTROPY,
            FeatureNames.HOUR_OF_DAY));

    private final List<String> names;

    FeatureLayout(List<String> names) {
        this.names = names;
    }

    /**
     * @return unmodifiable list of feature names in vector order
     */
    public List<String> names() {
        return names;
    }

    public int size() {
        return names.size();
    }

    /**
     * @param name layout name, case-insensitive
     * @return the layout
     * @throws IllegalArgumentException if the name is unknown
     */
    public static FeatureLayout fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("Unknown feature layout: '" + name
                    + "'. Supported: live, extended", e);
        }
    }

    /**
     * Feature name constants.
     */
    public static final class FeatureNames {
        public static final String PACKET_SIZE = "packet_size";
        public static final String PROTOCOL_TYPE = "protocol_type";
        public static final String CONNECTION_DURATION = "connection_duration";
        public static final String FAILED_LOGIN_ATTEMPTS = "failed_login_attempts";
        public static final String DATA_TRANSFER_RATE = "data_transfer_rate";
        public static final String ACCESS_FREQUENCY = "access_frequency";
        public static final String SOURCE_PORT = "src_port";
        public static final String DESTINATION_PORT = "dst_port";
        public static final String TCP_FLAGS = "tcp_flags";
        public static final String PAYLOAD_ENTROPY = "payload_entropy";
        public static final String HOUR_OF_DAY = "hour_of_day";

        private FeatureNames() {
        }
    }
}
