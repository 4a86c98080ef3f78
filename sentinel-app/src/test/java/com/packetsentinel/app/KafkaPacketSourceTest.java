package com.packetsentinel.app;

import com.packetsentinel.core.config.DetectionSettings;
import com.packetsentinel.core.config.SignatureRulesLoader;
import com.packetsentinel.core.pipeline.PacketPipeline;
import com.packetsentinel.core.pipeline.PipelineAssembler;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link KafkaPacketSource}, running packets from a mock
 * consumer through a real pipeline into a mock producer.
 */
class KafkaPacketSourceTest {

    private static final String TOPIC = "packets";
    private static final TopicPartition PARTITION = new TopicPartition(TOPIC, 0);

    private MockConsumer<byte[], byte[]> consumer;
    private MockProducer<String, byte[]> producer;
    private PacketPipeline pipeline;
    private KafkaPacketSource source;
    private Thread sourceThread;

    @BeforeEach
    void setUp() {
        consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
        consumer.updateBeginningOffsets(Map.of(PARTITION, 0L));
        producer = new MockProducer<>(true, new StringSerializer(), new ByteArraySerializer());

        DetectionSettings settings = new DetectionSettings.Builder()
                .workerCount(2)
                .detectorTimeoutMillis(0)
                .build();
        pipeline = PipelineAssembler.forSettings(settings)
                .rules(SignatureRulesLoader.fromClasspath("signatures.yml"))
                .persistence(new KafkaEventSink(producer, "alerts", "traffic-stats", Duration.ofSeconds(1)))
                .registry(new SimpleMeterRegistry())
                .persistenceBackoff(Duration.ZERO)
                .assemble();
        pipeline.start();
        source = new KafkaPacketSource(consumer, TOPIC, new PacketRecordDeserializer(), pipeline);
    }

    @AfterEach
    void tearDown() {
        source.stop(Duration.ofSeconds(5));
        pipeline.shutdown(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("Should feed consumed packets into the pipeline and publish the resulting alert")
    void shouldFeedPipeline() throws Exception {
        consumer.schedulePollTask(() -> {
            consumer.rebalance(List.of(PARTITION));
            for (int i = 0; i < 20; i++) {
                String payload = i % 4 == 0 ? "id=1' OR 1=1 --" : "GET /index.html HTTP/1.1";
                consumer.addRecord(record(i, packetJson(payload)));
            }
        });

        startSource();
        awaitTrue(() -> pipeline.processedCount() == 20);
        assertThat(source.stop(Duration.ofSeconds(5))).isTrue();
        sourceThread.join(5_000);

        assertThat(source.consumedCount()).isEqualTo(20);
        assertThat(source.malformedCount()).isZero();
        assertThat(consumer.closed()).isTrue();
        assertThat(producer.history()).extracting(ProducerRecord::topic).containsOnly("alerts");
        assertThat(producer.history()).hasSize(1);

        pipeline.shutdown(Duration.ofSeconds(5));
        assertThat(producer.history()).extracting(ProducerRecord::topic).containsExactly("alerts", "traffic-stats");
    }

    @Test
    @DisplayName("Should skip malformed records without stopping")
    void shouldSkipMalformedRecords() {
        consumer.schedulePollTask(() -> {
            consumer.rebalance(List.of(PARTITION));
            consumer.addRecord(record(0, "{broken"));
            consumer.addRecord(record(1, packetJson("hello")));
            consumer.addRecord(record(2, "42"));
            consumer.addRecord(record(3, packetJson("world")));
        });

        startSource();
        awaitTrue(() -> pipeline.processedCount() == 2);

        assertThat(source.isRunning()).isTrue();
        assertThat(source.malformedCount()).isEqualTo(2);
        assertThat(source.consumedCount()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should return immediately when stopped before running")
    void shouldStopWithoutRun() {
        assertThat(source.stop(Duration.ofMillis(10))).isTrue();
        assertThat(source.isRunning()).isFalse();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void startSource() {
        sourceThread = new Thread(source, "test-packet-source");
        sourceThread.setDaemon(true);
        sourceThread.start();
    }

    private static ConsumerRecord<byte[], byte[]> record(long offset, String value) {
        return new ConsumerRecord<>(TOPIC, 0, offset, null, value.getBytes(StandardCharsets.UTF_8));
    }

    private static String packetJson(String payload) {
        return "{\"timestamp\":\"2024-01-15T10:00:00Z\",\"src_ip\":\"10.0.0.5\",\"src_port\":40000,"
                + "\"dst_ip\":\"10.0.0.1\",\"dst_port\":80,\"protocol\":\"TCP\","
                + "\"payload\":\"" + payload + "\"}";
    }

    private static void awaitTrue(BooleanSupplier condition) {
        long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Condition not met within 10 s");
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AssertionError("Interrupted while waiting", e);
            }
        }
    }
}
