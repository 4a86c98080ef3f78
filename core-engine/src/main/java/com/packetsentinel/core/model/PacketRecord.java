package com.packetsentinel.core.model;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * A parsed packet as delivered by the capture layer.
 *
 * <p>
 * Instances are immutable and safe to share between worker threads. The
 * payload is copied on the way in and on the way out.
 * </p>
 *
 * <h3>Missing Values</h3>
 * <p>
 * The capture layer does not always know every field. The builder fills
 * gaps with neutral defaults ({@code "unknown"} addresses, port {@code 0},
 * {@link Protocol#OTHER}, empty payload) so downstream feature extraction
 * never has to deal with {@code null}s. The optional HTTP fields are exposed
 * as {@link Optional}.
 * </p>
 *
 * @since 1.0.0
 */
public final class PacketRecord {

    /** Placeholder used when an address is missing. */
    public static final String UNKNOWN_ADDRESS = "unknown";

    private static final byte[] EMPTY = new byte[0];

    private final Instant timestamp;
    private final String sourceIp;
    private final int sourcePort;
    private final String destinationIp;
    private final int destinationPort;
    private final Protocol protocol;
    private final byte[] payload;
    private final int tcpFlags;
    private final int size;

    // --- Application-layer fields (HTTP only) ---
    private final String httpMethod;
    private final String uri;
    private final String userAgent;

    private PacketRecord(Builder b) {
        this.timestamp = Objects.requireNonNull(b.timestamp, "timestamp must not be null");
        this.sourceIp = blankToUnknown(b.sourceIp);
        this.sourcePort = Math.max(0, b.sourcePort);
        this.destinationIp = blankToUnknown(b.destinationIp);
        this.destinationPort = Math.max(0, b.destinationPort);
        this.protocol = b.protocol != null ? b.protocol : Protocol.OTHER;
        this.payload = b.payload != null ? b.payload.clone() : EMPTY;
        this.tcpFlags = Math.max(0, b.tcpFlags);
        this.size = b.size > 0 ? b.size : this.payload.length;
        this.httpMethod = b.httpMethod;
        this.uri = b.uri;
        this.userAgent = b.userAgent;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Derived views
    // ---------------------------------------------------------------

    /**
     * @return the flow this packet belongs to
     */
    public FlowKey flowKey() {
        return new FlowKey(sourceIp, destinationIp, destinationPort);
    }

    /**
     * Payload decoded as ISO-8859-1, which maps every byte to exactly one
     * character. Binary payloads therefore never fail to decode.
     *
     * @return payload text, empty when there is no payload
     */
    public String payloadText() {
        return payload.length == 0 ? "" : new String(payload, StandardCharsets.ISO_8859_1);
    }

    public int payloadLength() {
        return payload.length;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getSourceIp() {
        return sourceIp;
    }

    public int getSourcePort() {
        return sourcePort;
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

    /**
     * @return a copy of the raw payload bytes
     */
    public byte[] getPayload() {
        return payload.clone();
    }

    public int getTcpFlags() {
        return tcpFlags;
    }

    /**
     * @return size of the packet on the wire, falling back to the payload
     *         length when the capture layer did not report one
     */
    public int getSize() {
        return size;
    }

    public Optional<String> getHttpMethod() {
        return Optional.ofNullable(httpMethod);
    }

    public Optional<String> getUri() {
        return Optional.ofNullable(uri);
    }

    public Optional<String> getUserAgent() {
        return Optional.ofNullable(userAgent);
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link PacketRecord}. Only {@code timestamp} is
     * required.
     */
    public static class Builder {
        private Instant timestamp;
        private String sourceIp;
        private int sourcePort;
        private String destinationIp;
        private int destinationPort;
        private Protocol protocol;
        private byte[] payload;
        private int tcpFlags;
        private int size;
        private String httpMethod;
        private String uri;
        private String userAgent;

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder sourceIp(String sourceIp) {
            this.sourceIp = sourceIp;
            return this;
        }

        public Builder sourcePort(int sourcePort) {
            this.sourcePort = sourcePort;
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

        public Builder payload(byte[] payload) {
            this.payload = payload;
            return this;
        }

        /**
         * Convenience for text payloads, encoded as ISO-8859-1 so that
         * {@link PacketRecord#payloadText()} returns the same string.
         */
        public Builder payload(String text) {
            this.payload = text != null ? text.getBytes(StandardCharsets.ISO_8859_1) : null;
            return this;
        }

        public Builder tcpFlags(int tcpFlags) {
            this.tcpFlags = tcpFlags;
            return this;
        }

        public Builder size(int size) {
            this.size = size;
            return this;
        }

        public Builder httpMethod(String httpMethod) {
            this.httpMethod = httpMethod;
            return this;
        }

        public Builder uri(String uri) {
            this.uri = uri;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        /**
         * @return a new {@link PacketRecord}
         * @throws NullPointerException if {@code timestamp} is {@code null}
         */
        public PacketRecord build() {
            return new PacketRecord(this);
        }
    }

    private static String blankToUnknown(String value) {
        return value == null || value.isBlank() ? UNKNOWN_ADDRESS : value.trim();
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PacketRecord that))
            return false;
        return sourcePort == that.sourcePort
                && destinationPort == that.destinationPort
                && tcpFlags == that.tcpFlags
                && size == that.size
                && timestamp.equals(that.timestamp)
                && sourceIp.equals(that.sourceIp)
                && destinationIp.equals(that.destinationIp)
                && protocol == that.protocol
                && Arrays.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(timestamp, sourceIp, sourcePort, destinationIp, destinationPort,
                protocol, tcpFlags, size);
        return 31 * result + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "PacketRecord{" +
                "timestamp=" + timestamp +
                ", " + sourceIp + ':' + sourcePort +
                " -> " + destinationIp + ':' + destinationPort +
                ", protocol=" + protocol +
                ", size=" + size +
                ", payloadLength=" + payload.length +
                '}';
    }
}
