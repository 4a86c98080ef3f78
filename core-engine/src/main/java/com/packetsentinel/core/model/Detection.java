package com.packetsentinel.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A verdict produced by exactly one detector for one packet.
 *
 * <p>
 * Detections are immutable. The {@code description} is stable per rule or
 * model so that repeated detections of the same activity share it and can be
 * deduplicated; observed values belong in {@code evidence}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code kind}, {@code severity}, {@code description}
 * and {@code timestamp} are required; {@code confidence} is clamped to
 * [0, 1]. The correlation id is attached later by the coordinator via
 * {@link #withCorrelationId(String)}.
 * </p>
 *
 * @since 1.0.0
 */
public final class Detection {

    private final DetectorKind kind;
    private final String ruleId;
    private final Severity severity;
    private final double confidence;
    private final String description;
    private final String evidence;
    private final String sourceIp;
    private final String destinationIp;
    private final int destinationPort;
    private final Protocol protocol;
    private final Instant timestamp;
    private final String correlationId;

    private Detection(Builder b) {
        this.kind = Objects.requireNonNull(b.kind, "kind must not be null");
        this.ruleId = b.ruleId != null ? b.ruleId : kind.id();
        this.severity = Objects.requireNonNull(b.severity, "severity must not be null");
        this.confidence = clamp(b.confidence);
        this.description = Objects.requireNonNull(b.description, "description must not be null");
        this.evidence = b.evidence;
        this.sourceIp = b.sourceIp != null ? b.sourceIp : PacketRecord.UNKNOWN_ADDRESS;
        this.destinationIp = b.destinationIp != null ? b.destinationIp : PacketRecord.UNKNOWN_ADDRESS;
        this.destinationPort = b.destinationPort;
        this.protocol = b.protocol != null ? b.protocol : Protocol.OTHER;
        this.timestamp = Objects.requireNonNull(b.timestamp, "timestamp must not be null");
        this.correlationId = b.correlationId;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Start a builder pre-filled with the offending flow of {@code packet}.
     *
     * @param kind   originating detector
     * @param packet packet that triggered the detection
     * @return builder with addresses, port, protocol and timestamp set
     */
    public static Builder forPacket(DetectorKind kind, PacketRecord packet) {
        return new Builder()
                .kind(kind)
                .sourceIp(packet.getSourceIp())
                .destinationIp(packet.getDestinationIp())
                .destinationPort(packet.getDestinationPort())
                .protocol(packet.getProtocol())
                .timestamp(packet.getTimestamp());
    }

    /**
     * @param correlationId id shared by all detections of one packet
     * @return a copy of this detection carrying {@code correlationId}
     */
    public Detection withCorrelationId(String correlationId) {
        return toBuilder().correlationId(correlationId).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .kind(kind)
                .ruleId(ruleId)
                .severity(severity)
                .confidence(confidence)
                .description(description)
                .evidence(evidence)
                .sourceIp(sourceIp)
                .destinationIp(destinationIp)
                .destinationPort(destinationPort)
                .protocol(protocol)
                .timestamp(timestamp)
                .correlationId(correlationId);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public DetectorKind getKind() {
        return kind;
    }

    public String getRuleId() {
        return ruleId;
    }

    public Severity getSeverity() {
        return severity;
    }

    public double getConfidence() {
        return confidence;
    }

    public String getDescription() {
        return description;
    }

    public String getEvidence() {
        return evidence;
    }

    public String getSourceIp() {
        return sourceIp;
    }

    public String getDestinationIp() {
        return destinationIp;
    }

    public int getDestinationPort() {
        return destinationPort;
    }

    public Protocol getProtocol() {
        return protocol;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * @return correlation id, or {@code null} before the coordinator attached
     *         one
     */
    public String getCorrelationId() {
        return correlationId;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private DetectorKind kind;
        private String ruleId;
        private Severity severity;
        private double confidence;
        private String description;
        private String evidence;
        private String sourceIp;
        private String destinationIp;
        private int destinationPort;
        private Protocol protocol;
        private Instant timestamp;
        private String correlationId;

        public Builder kind(DetectorKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder ruleId(String ruleId) {
            this.ruleId = ruleId;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder evidence(String evidence) {
            this.evidence = evidence;
            return this;
        }

        public Builder sourceIp(String sourceIp) {
            this.sourceIp = sourceIp;
            return this;
        }

        public Builder destinationIp(String destinationIp) {
            this.destinationIp = destinationIp;
            return this;
        }

        public Builder destinationPort(int destinationPort) {
            this.destinationPort = destinationPort;
            return this;
        }

        public Builder protocol(Protocol protocol) {
            this.protocol = protocol;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        /**
         * @return a new {@link Detection}
         * @throws NullPointerException if a required field is missing
         */
        public Detection build() {
            return new Detection(this);
        }
    }

    private static double clamp(double value) {
        if (!Double.isFinite(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Detection that))
            return false;
        return Double.compare(confidence, that.confidence) == 0
                && destinationPort == that.destinationPort
                && kind == that.kind
                && ruleId.equals(that.ruleId)
                && severity == that.severity
                && description.equals(that.description)
                && sourceIp.equals(that.sourceIp)
                && destinationIp.equals(that.destinationIp)
                && timestamp.equals(that.timestamp)
                && Objects.equals(correlationId, that.correlationId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, ruleId, severity, description, sourceIp, destinationIp,
                destinationPort, timestamp, correlationId);
    }

    @Override
    public String toString() {
        return "Detection{" +
                "kind=" + kind.id() +
                ", ruleId='" + ruleId + '\'' +
                ", severity=" + severity.id() +
                ", confidence=" + String.format("%.2f", confidence) +
                ", source=" + sourceIp +
                ", destination=" + destinationIp + ':' + destinationPort +
                ", description='" + description + '\'' +
                ", correlationId=" + correlationId +
                '}';
    }
}
