package com.packetsentinel.app;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.packetsentinel.core.model.PacketRecord;
import com.packetsentinel.core.model.Protocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Base64;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Converts raw Kafka bytes into a {@link PacketRecord}.
 *
 * <h3>Wire Format</h3>
 *
 * <pre>
 * {
 *   "timestamp": 1705312800000 | "2024-01-15T10:00:00Z",
 *   "src_ip": "10.0.0.5", "src_port": 40000,
 *   "dst_ip": "10.0.0.1", "dst_port": 80,
 *   "protocol": "TCP", "size": 512,
 *   "flags": 18 | "SYN,ACK",
 *   "payload": "GET / HTTP/1.1 ..." | "payload_base64": "R0VU...",
 *   "http_method": "GET", "uri": "/", "user_agent": "curl/8.0"
 * }
 * </pre>
 *
 * <p>
 * Malformed JSON is logged and dropped ({@link Optional#empty()}), so a
 * single bad record does not stop the consumer. Individual fields are read
 * leniently: a missing or ill-typed field falls back to the neutral default
 * of {@link PacketRecord.Builder}, and a missing timestamp becomes the
 * ingestion time.
 * </p>
 */
public class PacketRecordDeserializer {

    private static final Logger LOG = LoggerFactory.getLogger(PacketRecordDeserializer.class);

    private final ObjectMapper mapper;
    private final Clock clock;

    public PacketRecordDeserializer() {
        this(Clock.systemUTC());
    }

    public PacketRecordDeserializer(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * @param message raw record value, may be {@code null}
     * @return the packet, or empty when the message is not a JSON object
     */
    public Optional<PacketRecord> deserialize(byte[] message) {
        if (message == null || message.length == 0) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = mapper.readTree(message);
        } catch (Exception e) {
            LOG.warn("Failed to deserialize packet - skipping: {}", e.getMessage());
            return Optional.empty();
        }
        if (root == null || !root.isObject()) {
            LOG.warn("Packet message is not a JSON object - skipping");
            return Optional.empty();
        }
        return Optional.of(toPacket(root));
    }

    // ---------------------------------------------------------------
    // Field mapping
    // ---------------------------------------------------------------

    private PacketRecord toPacket(JsonNode node) {
        PacketRecord.Builder builder = PacketRecord.builder()
                .timestamp(timestamp(node.get("timestamp")))
                .sourceIp(text(node, "src_ip"))
                .sourcePort(integer(node, "src_port"))
                .destinationIp(text(node, "dst_ip"))
                .destinationPort(integer(node, "dst_port"))
                .protocol(Protocol.fromName(text(node, "protocol")))
                .tcpFlags(tcpFlags(node.get("flags")))
                .size(integer(node, "size"))
                .httpMethod(text(node, "http_method"))
                .uri(text(node, "uri"))
                .userAgent(text(node, "user_agent"));

        String base64 = text(node, "payload_base64");
        if (base64 != null) {
            try {
                builder.payload(Base64.getDecoder().decode(base64));
            } catch (IllegalArgumentException e) {
                LOG.debug("Ignoring undecodable payload_base64: {}", e.getMessage());
            }
        } else {
            builder.payload(text(node, "payload"));
        }
        return builder.build();
    }

    private Instant timestamp(JsonNode node) {
        if (node != null) {
            if (node.isNumber()) {
                return Instant.ofEpochMilli(node.asLong());
            }
            if (node.isTextual()) {
                try {
                    return Instant.parse(node.asText());
                } catch (DateTimeParseException e) {
                    LOG.debug("Unparseable packet timestamp '{}', using ingestion time", node.asText());
                }
            }
        }
        return clock.instant();
    }

    /**
     * Flags arrive either as the raw flag byte or as comma separated names.
     */
    static int tcpFlags(JsonNode node) {
        if (node == null || node.isNull()) {
            return 0;
        }
        if (node.isNumber()) {
            return node.asInt();
        }
        int flags = 0;
        for (String name : node.asText("").split(",")) {
            switch (name.trim().toUpperCase(Locale.ROOT)) {
                case "FIN" -> flags |= 0x01;
                case "SYN" -> flags |= 0x02;
                case "RST" -> flags |= 0x04;
                case "PSH" -> flags |= 0x08;
                case "ACK" -> flags |= 0x10;
                case "URG" -> flags |= 0x20;
                default -> {
                    // unknown flag names carry no bits
                }
            }
        }
        return flags;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private static int integer(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return 0;
        }
        if (value.isNumber()) {
            return value.asInt();
        }
        return value.asInt(0);
    }
}
