package com.packetsentinel.app;

import com.packetsentinel.core.config.DetectionSettings;
import com.packetsentinel.core.config.SignatureRulesConfig;
import com.packetsentinel.core.config.SignatureRulesLoader;
import com.packetsentinel.core.detection.classification.ClassificationModel;
import com.packetsentinel.core.detection.classification.ClassificationModelLoader;
import com.packetsentinel.core.pipeline.PacketPipeline;
import com.packetsentinel.core.pipeline.PipelineAssembler;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Main entry point of Packet Sentinel.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (packets topic)
 *     → Deserialize JSON → PacketRecord
 *     → PacketPipeline (signature, anomaly and classification layers)
 *     → Deduplicated alerts → Kafka (alerts topic)
 *     → Periodic traffic snapshots → Kafka (stats topic)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Outer wiring comes from {@link AppConfig}, detection tuning from
 * {@link DetectionSettings}; both are resolved from environment variables.
 * Invalid configuration, unreadable rules or an unreadable configured model
 * stop the process before any packet is consumed.
 * </p>
 *
 * @since 1.0.0
 */
public final class SentinelApplication {

    private static final Logger LOG = LoggerFactory.getLogger(SentinelApplication.class);
    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration SEND_TIMEOUT = Duration.ofSeconds(10);

    private SentinelApplication() {
        // entry-point class - not instantiable
    }

    public static void main(String[] args) {
        // 1. Load configuration
        AppConfig config = AppConfig.fromEnvironment();
        DetectionSettings settings = DetectionSettings.fromEnvironment();
        LOG.info("Starting Packet Sentinel with config: {}", config);
        LOG.info("Detection settings: {}", settings);

        // 2. Load signature rules and the optional classification model
        SignatureRulesConfig rules = SignatureRulesLoader.load(config.getSignatureRulesPath());
        LOG.info("Loaded {} signature rule(s)", rules.getRules().size());
        Optional<Path> modelPath = config.getClassificationModelPath();
        ClassificationModel model = modelPath.map(ClassificationModelLoader::load).orElse(null);
        if (model == null) {
            LOG.info("No classification model configured, classification layer disabled");
        }

        // 3. Assemble the pipeline around the Kafka sink
        KafkaEventSink sink = new KafkaEventSink(
                new KafkaProducer<>(config.kafkaProducerProperties()),
                config.getKafkaAlertTopic(),
                config.getKafkaStatsTopic(),
                SEND_TIMEOUT);
        PacketPipeline pipeline = PipelineAssembler.forSettings(settings)
                .rules(rules)
                .classificationModel(model, modelPath.orElse(null))
                .persistence(sink)
                .listener(alert -> LOG.warn("New alert {} [{}] from {}: {}",
                        alert.getId(),
                        alert.getDetection().getSeverity().id(),
                        alert.getDetection().getSourceIp(),
                        alert.getDetection().getDescription()))
                .registry(new SimpleMeterRegistry())
                .assemble();

        // 4. Start health server (for K8s health checks) and the pipeline
        HealthServer healthServer = new HealthServer(pipeline);
        healthServer.start(config.getHealthPort());
        pipeline.start();

        // 5. Consume until the shutdown hook stops the source
        KafkaPacketSource source = new KafkaPacketSource(
                new KafkaConsumer<>(config.kafkaConsumerProperties()),
                config.getKafkaPacketTopic(),
                new PacketRecordDeserializer(),
                pipeline);
        Thread mainThread = Thread.currentThread();
        Runtime.getRuntime().addShutdownHook(new Thread(
                () -> shutdown(source, pipeline, healthServer, sink, mainThread), "sentinel-shutdown"));

        source.run();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    static void shutdown(KafkaPacketSource source, PacketPipeline pipeline, HealthServer healthServer,
            KafkaEventSink sink, Thread mainThread) {
        LOG.info("Shutting down Packet Sentinel");
        if (!source.stop(SHUTDOWN_TIMEOUT)) {
            LOG.warn("Packet source did not stop within {} s", SHUTDOWN_TIMEOUT.toSeconds());
        }
        if (!pipeline.shutdown(SHUTDOWN_TIMEOUT)) {
            LOG.warn("Pipeline {} did not drain within {} s", pipeline.getName(), SHUTDOWN_TIMEOUT.toSeconds());
        }
        healthServer.stop();
        sink.close();
        try {
            mainThread.join(SHUTDOWN_TIMEOUT.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LOG.info("Packet Sentinel stopped: {} processed, {} dropped",
                pipeline.processedCount(), pipeline.droppedCount());
    }
}
