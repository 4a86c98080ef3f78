package com.packetsentinel.core.model;

import com.packetsentinel.core.support.Packets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the value types in the model package.
 */
class ModelTest {

    @Test
    @DisplayName("Should copy the payload so later changes to the source array are not visible")
    void shouldCopyPayload() {
        byte[] payload = "abc".getBytes(StandardCharsets.ISO_8859_1);
        PacketRecord packet = Packets.tcp("10.0.0.5", "10.0.0.1", 80).payload(payload).build();

        payload[0] = 'x';

        assertThat(packet.payloadText()).isEqualTo("abc");
    }

    @Test
    @DisplayName("Should replace blank addresses with 'unknown' and fall back to payload length for size")
    void shouldNormaliseMissingFields() {
        PacketRecord packet = PacketRecord.builder()
                .timestamp(Instant.EPOCH)
                .sourceIp(" ")
                .payload("hello")
                .build();

        assertThat(packet.getSourceIp()).isEqualTo(PacketRecord.UNKNOWN_ADDRESS);
        assertThat(packet.getSize()).isEqualTo(5);
        assertThat(packet.getProtocol()).isEqualTo(Protocol.OTHER);
        assertThat(packet.getUri()).isEmpty();
    }

    @Test
    @DisplayName("Should look up features by name and default missing ones")
    void shouldReadFeatureVector() {
        FeatureVector vector = FeatureVector.builder()
                .add("packet_size", 1500)
                .add("protocol_type", 1)
                .build();

        assertThat(vector.get("packet_size")).hasValue(1500.0);
        assertThat(vector.get("missing")).isEmpty();
        assertThat(vector.getOrDefault("missing", -1)).isEqualTo(-1.0);
        assertThat(vector.toArray()).containsExactly(1500.0, 1.0);
        assertThat(FeatureVector.zeros(FeatureLayout.EXTENDED).size()).isEqualTo(11);
    }

    @Test
    @DisplayName("Should parse severities strictly and order them by priority")
    void shouldParseSeverity() {
        assertThat(Severity.fromName("Critical")).isEqualTo(Severity.CRITICAL);
        assertThat(Severity.CRITICAL.priority()).isGreaterThan(Severity.LOW.priority());
        assertThatThrownBy(() -> Severity.fromName("urgent")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should clamp detection confidence and carry the correlation id on copies")
    void shouldBuildDetection() {
        Detection detection = Detection.forPacket(DetectorKind.ANOMALY, Packets.withPayload("x"))
                .severity(Severity.MEDIUM)
                .confidence(1.7)
                .description("Anomalous traffic pattern detected")
                .build();

        Detection stamped = detection.withCorrelationId("c-1");

        assertThat(detection.getConfidence()).isEqualTo(1.0);
        assertThat(detection.getRuleId()).isEqualTo("anomaly");
        assertThat(detection.getCorrelationId()).isNull();
        assertThat(stamped.getCorrelationId()).isEqualTo("c-1");
        assertThat(stamped.getSourceIp()).isEqualTo("10.0.0.5");
    }

    @Test
    @DisplayName("Should reject a snapshot window that ends before it starts")
    void shouldValidateSnapshotWindow() {
        assertThatThrownBy(() -> TrafficStatsSnapshot.builder()
                .windowStart(Packets.T0)
                .windowEnd(Packets.T0.minusSeconds(1))
                .build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
