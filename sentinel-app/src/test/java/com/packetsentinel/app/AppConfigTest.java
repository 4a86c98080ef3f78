package com.packetsentinel.app;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AppConfig}.
 */
class AppConfigTest {

    @Test
    @DisplayName("Should build with defaults")
    void shouldBuildWithDefaults() {
        AppConfig config = new AppConfig.Builder().build();

        assertThat(config.getKafkaBootstrapServers()).isEqualTo("localhost:9092");
        assertThat(config.getKafkaPacketTopic()).isEqualTo("packets");
        assertThat(config.getKafkaAlertTopic()).isEqualTo("alerts");
        assertThat(config.getKafkaStatsTopic()).isEqualTo("traffic-stats");
        assertThat(config.getKafkaGroupId()).isEqualTo("packet-sentinel");
        assertThat(config.getHealthPort()).isEqualTo(8080);
        assertThat(config.getSignatureRulesPath()).isEmpty();
        assertThat(config.getClassificationModelPath()).isEmpty();
    }

    @Test
    @DisplayName("Should expose a configured model path")
    void shouldExposeModelPath() {
        AppConfig config = new AppConfig.Builder()
                .classificationModelPath("/models/ids.model")
                .build();

        assertThat(config.getClassificationModelPath()).contains(Path.of("/models/ids.model"));
    }

    @Test
    @DisplayName("Should treat a null rules path as unset")
    void shouldTreatNullRulesPathAsUnset() {
        AppConfig config = new AppConfig.Builder().signatureRulesPath(null).build();

        assertThat(config.getSignatureRulesPath()).isEmpty();
    }

    @Test
    @DisplayName("Should reject blank topics")
    void shouldRejectBlankTopics() {
        assertThatThrownBy(() -> new AppConfig.Builder().kafkaPacketTopic(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("kafkaPacketTopic");
    }

    @Test
    @DisplayName("Should reject identical alert and stats topics")
    void shouldRejectSharedOutputTopic() {
        assertThatThrownBy(() -> new AppConfig.Builder()
                .kafkaAlertTopic("out")
                .kafkaStatsTopic("out")
                .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must differ");
    }

    @Test
    @DisplayName("Should reject an out-of-range health port")
    void shouldRejectBadPort() {
        assertThatThrownBy(() -> new AppConfig.Builder().healthPort(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new AppConfig.Builder().healthPort(70_000).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should build consumer and producer properties for raw byte values")
    void shouldBuildKafkaProperties() {
        AppConfig config = new AppConfig.Builder()
                .kafkaBootstrapServers("broker:9092")
                .kafkaGroupId("ids")
                .build();

        Properties consumer = config.kafkaConsumerProperties();
        Properties producer = config.kafkaProducerProperties();

        assertThat(consumer.getProperty("bootstrap.servers")).isEqualTo("broker:9092");
        assertThat(consumer.getProperty("group.id")).isEqualTo("ids");
        assertThat(consumer.getProperty("value.deserializer")).endsWith("ByteArrayDeserializer");
        assertThat(producer.getProperty("bootstrap.servers")).isEqualTo("broker:9092");
        assertThat(producer.getProperty("value.serializer")).endsWith("ByteArraySerializer");
    }
}
