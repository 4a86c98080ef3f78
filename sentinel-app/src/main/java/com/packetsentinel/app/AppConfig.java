package com.packetsentinel.app;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

/**
 * Typed, immutable configuration of the Packet Sentinel host application.
 *
 * <p>
 * Covers the outer surfaces only: Kafka wiring, the health port and the
 * locations of the signature rules and the classification model. Detection
 * tuning lives in {@link com.packetsentinel.core.config.DetectionSettings}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for tests. The builder validates inputs at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class AppConfig {

    // ---------------------------------------------------------------
    // Kafka
    // ---------------------------------------------------------------
    private final String kafkaBootstrapServers;
    private final String kafkaPacketTopic;
    private final String kafkaAlertTopic;
    private final String kafkaStatsTopic;
    private final String kafkaGroupId;

    // ---------------------------------------------------------------
    // Detection inputs
    // ---------------------------------------------------------------
    private final String signatureRulesPath;
    private final String classificationModelPath;

    // ---------------------------------------------------------------
    // Health
    // ---------------------------------------------------------------
    private final int healthPort;

    private AppConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaPacketTopic = b.kafkaPacketTopic;
        this.kafkaAlertTopic = b.kafkaAlertTopic;
        this.kafkaStatsTopic = b.kafkaStatsTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.signatureRulesPath = b.signatureRulesPath;
        this.classificationModelPath = b.classificationModelPath;
        this.healthPort = b.healthPort;
    }

    // ---------------------------------------------------------------
    // Factory - resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build an {@link AppConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static AppConfig fromEnvironment() {
        try {
            return new Builder()
                    .kafkaBootstrapServers(env("KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .kafkaPacketTopic(env("KAFKA_PACKET_TOPIC", "packets"))
                    .kafkaAlertTopic(env("KAFKA_ALERT_TOPIC", "alerts"))
                    .kafkaStatsTopic(env("KAFKA_STATS_TOPIC", "traffic-stats"))
                    .kafkaGroupId(env("KAFKA_GROUP_ID", "packet-sentinel"))
                    .signatureRulesPath(env("SIGNATURE_RULES_PATH", ""))
                    .classificationModelPath(env("CLASSIFICATION_MODEL_PATH", ""))
                    .healthPort(parseIntEnv("HEALTH_PORT", "8080"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Kafka properties helpers
    // ---------------------------------------------------------------

    /**
     * Build Kafka consumer {@link Properties} for the packet topic. Keys and
     * values are read as raw bytes.
     *
     * @return new Properties instance configured for consumption
     */
    public Properties kafkaConsumerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("group.id", kafkaGroupId);
        props.setProperty("auto.offset.reset", "latest");
        props.setProperty("enable.auto.commit", "true");
        props.setProperty("key.deserializer", "org.apache.kafka.common.serialization.ByteArrayDeserializer");
        props.setProperty("value.deserializer", "org.apache.kafka.common.serialization.ByteArrayDeserializer");
        return props;
    }

    /**
     * Build Kafka producer {@link Properties} for alerts and stats.
     *
     * @return new Properties instance configured for production
     */
    public Properties kafkaProducerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("acks", "all");
        props.setProperty("linger.ms", "5");
        props.setProperty("key.serializer", "org.apache.kafka.common.serialization.StringSerializer");
        props.setProperty("value.serializer", "org.apache.kafka.common.serialization.ByteArraySerializer");
        return props;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaPacketTopic() {
        return kafkaPacketTopic;
    }

    public String getKafkaAlertTopic() {
        return kafkaAlertTopic;
    }

    public String getKafkaStatsTopic() {
        return kafkaStatsTopic;
    }

    public String getKafkaGroupId() {
        return kafkaGroupId;
    }

    /**
     * @return rules file path, blank when the bundled rules should be used
     */
    public String getSignatureRulesPath() {
        return signatureRulesPath;
    }

    /**
     * @return the configured model file, empty when classification is off
     */
    public Optional<Path> getClassificationModelPath() {
        return classificationModelPath.isBlank()
                ? Optional.empty()
                : Optional.of(Path.of(classificationModelPath));
    }

    public int getHealthPort() {
        return healthPort;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link AppConfig}.
     *
     * <p>
     * The {@link #build()} method validates that topic names are non-blank,
     * the alert and stats topics differ, and the port is in [1, 65535].
     * </p>
     */
    public static class Builder {
        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaPacketTopic = "packets";
        private String kafkaAlertTopic = "alerts";
        private String kafkaStatsTopic = "traffic-stats";
        private String kafkaGroupId = "packet-sentinel";
        private String signatureRulesPath = "";
        private String classificationModelPath = "";
        private int healthPort = 8080;

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaPacketTopic(String v) {
            this.kafkaPacketTopic = v;
            return this;
        }

        public Builder kafkaAlertTopic(String v) {
            this.kafkaAlertTopic = v;
            return this;
        }

        public Builder kafkaStatsTopic(String v) {
            this.kafkaStatsTopic = v;
            return this;
        }

        public Builder kafkaGroupId(String v) {
            this.kafkaGroupId = v;
            return this;
        }

        public Builder signatureRulesPath(String v) {
            this.signatureRulesPath = v;
            return this;
        }

        public Builder classificationModelPath(String v) {
            this.classificationModelPath = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link AppConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public AppConfig build() {
            Objects.requireNonNull(kafkaBootstrapServers, "kafkaBootstrapServers required");
            requireNonBlank(kafkaPacketTopic, "kafkaPacketTopic");
            requireNonBlank(kafkaAlertTopic, "kafkaAlertTopic");
            requireNonBlank(kafkaStatsTopic, "kafkaStatsTopic");
            requireNonBlank(kafkaGroupId, "kafkaGroupId");

            if (kafkaAlertTopic.equals(kafkaStatsTopic)) {
                throw new IllegalArgumentException(
                        "kafkaAlertTopic and kafkaStatsTopic must differ, both are: " + kafkaAlertTopic);
            }
            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [1, 65535], got: " + healthPort);
            }
            if (signatureRulesPath == null) {
                signatureRulesPath = "";
            }
            if (classificationModelPath == null) {
                classificationModelPath = "";
            }

            return new AppConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue));
    }

    @Override
    public String toString() {
        return "AppConfig{" +
                "kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", kafkaPacketTopic='" + kafkaPacketTopic + '\'' +
                ", kafkaAlertTopic='" + kafkaAlertTopic + '\'' +
                ", kafkaStatsTopic='" + kafkaStatsTopic + '\'' +
                ", kafkaGroupId='" + kafkaGroupId + '\'' +
                ", signatureRulesPath='" + signatureRulesPath + '\'' +
                ", classificationModelPath='" + classificationModelPath + '\'' +
                ", healthPort=" + healthPort +
                '}';
    }
}
