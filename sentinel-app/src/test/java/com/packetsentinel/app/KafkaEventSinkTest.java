package com.packetsentinel.app;

import com.packetsentinel.core.model.Alert;
import com.packetsentinel.core.model.Detection;
import com.packetsentinel.core.model.DetectorKind;
import com.packetsentinel.core.model.PacketRecord;
import com.packetsentinel.core.model.Protocol;
import com.packetsentinel.core.model.Severity;
import com.packetsentinel.core.model.TrafficStatsSnapshot;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link KafkaEventSink}.
 */
class KafkaEventSinkTest {

    private static final Instant T0 = Instant.parse("2024-01-15T10:00:00Z");

    @Test
    @DisplayName("Should publish alerts keyed by id with ISO timestamps")
    void shouldPublishAlert() {
        MockProducer<String, byte[]> producer = producer(true);
        KafkaEventSink sink = sink(producer, Duration.ofSeconds(1));
        Alert alert = Alert.create(sqlInjection(), T0);

        sink.persistAlert(alert);

        List<ProducerRecord<String, byte[]>> history = producer.history();
        assertThat(history).hasSize(1);
        assertThat(history.get(0).topic()).isEqualTo("alerts");
        assertThat(history.get(0).key()).isEqualTo(alert.getId());
        String json = new String(history.get(0).value(), StandardCharsets.UTF_8);
        assertThat(json)
                .contains("\"id\":\"" + alert.getId() + "\"")
                .contains("\"createdAt\":\"2024-01-15T10:00:00Z\"")
                .contains("\"severity\":\"critical\"")
                .contains("SQL injection attempt");
    }

    @Test
    @DisplayName("Should republish an alert under the same key once resolved")
    void shouldRepublishResolvedAlert() {
        MockProducer<String, byte[]> producer = producer(true);
        KafkaEventSink sink = sink(producer, Duration.ofSeconds(1));
        Alert alert = Alert.create(sqlInjection(), T0);

        sink.persistAlert(alert);
        alert.resolve(T0.plusSeconds(60));
        sink.persistAlert(alert);

        assertThat(producer.history()).extracting(ProducerRecord::key)
                .containsExactly(alert.getId(), alert.getId());
        assertThat(new String(producer.history().get(1).value(), StandardCharsets.UTF_8))
                .contains("\"resolved\":true");
    }

    @Test
    @DisplayName("Should publish snapshots to the stats topic")
    void shouldPublishSnapshot() {
        MockProducer<String, byte[]> producer = producer(true);
        KafkaEventSink sink = sink(producer, Duration.ofSeconds(1));
        TrafficStatsSnapshot snapshot = TrafficStatsSnapshot.builder()
                .windowStart(T0)
                .windowEnd(T0.plusSeconds(60))
                .packetCount(120)
                .byteCount(12_000)
                .protocolCounts(Map.of(Protocol.TCP, 120L))
                .topSourceIps(Map.of("10.0.0.5", 120L))
                .build();

        sink.persistSnapshot(snapshot);

        ProducerRecord<String, byte[]> record = producer.history().get(0);
        assertThat(record.topic()).isEqualTo("traffic-stats");
        assertThat(record.key()).isEqualTo("2024-01-15T10:01:00Z");
        assertThat(new String(record.value(), StandardCharsets.UTF_8))
                .contains("\"packetCount\":120")
                .contains("\"10.0.0.5\":120");
    }

    @Test
    @DisplayName("Should surface a send that does not complete in time")
    void shouldFailOnSendTimeout() {
        MockProducer<String, byte[]> producer = producer(false);
        KafkaEventSink sink = sink(producer, Duration.ofMillis(50));

        assertThatThrownBy(() -> sink.persistAlert(Alert.create(sqlInjection(), T0)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Timed out");
    }

    @Test
    @DisplayName("Should flush and close the producer")
    void shouldCloseProducer() {
        MockProducer<String, byte[]> producer = producer(true);

        sink(producer, Duration.ofSeconds(1)).close();

        assertThat(producer.flushed()).isTrue();
        assertThat(producer.closed()).isTrue();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static MockProducer<String, byte[]> producer(boolean autoComplete) {
        return new MockProducer<>(autoComplete, new StringSerializer(), new ByteArraySerializer());
    }

    private static KafkaEventSink sink(MockProducer<String, byte[]> producer, Duration timeout) {
        return new KafkaEventSink(producer, "alerts", "traffic-stats", timeout);
    }

    private static Detection sqlInjection() {
        PacketRecord packet = PacketRecord.builder()
                .timestamp(T0)
                .sourceIp("10.0.0.5")
                .destinationIp("10.0.0.1")
                .destinationPort(80)
                .protocol(Protocol.TCP)
                .payload("id=1' OR '1'='1")
                .build();
        return Detection.forPacket(DetectorKind.SIGNATURE, packet)
                .ruleId("sql_injection")
                .severity(Severity.CRITICAL)
                .confidence(0.9)
                .description("SQL injection attempt")
                .build();
    }
}
