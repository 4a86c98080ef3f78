package com.packetsentinel.app;

import com.packetsentinel.core.alert.PersistenceSink;
import com.packetsentinel.core.model.Alert;
import com.packetsentinel.core.model.TrafficStatsSnapshot;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link PersistenceSink} that publishes alerts and traffic snapshots as
 * JSON to Kafka.
 *
 * <h3>Topics</h3>
 * <ul>
 * <li>Alerts are keyed by alert id, so a compacted alerts topic keeps the
 * latest state of every alert (the sink is called again when an alert is
 * resolved).</li>
 * <li>Snapshots are keyed by the ISO end of their window.</li>
 * </ul>
 *
 * <p>
 * Sends are synchronous with a bounded wait. A failed or timed-out send is
 * rethrown as {@link IllegalStateException} so the caller's retry policy
 * applies.
 * </p>
 *
 * @since 1.0.0
 */
public class KafkaEventSink implements PersistenceSink, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(KafkaEventSink.class);

    private final Producer<String, byte[]> producer;
    private final String alertTopic;
    private final String statsTopic;
    private final EventSerializer serializer;
    private final Duration sendTimeout;

    public KafkaEventSink(Producer<String, byte[]> producer, String alertTopic, String statsTopic,
            Duration sendTimeout) {
        this.producer = Objects.requireNonNull(producer, "producer must not be null");
        this.alertTopic = Objects.requireNonNull(alertTopic, "alertTopic must not be null");
        this.statsTopic = Objects.requireNonNull(statsTopic, "statsTopic must not be null");
        this.sendTimeout = Objects.requireNonNull(sendTimeout, "sendTimeout must not be null");
        this.serializer = new EventSerializer();
    }

    @Override
    public void persistAlert(Alert alert) {
        send(alertTopic, alert.getId(), serializer.serialize(alert));
    }

    @Override
    public void persistSnapshot(TrafficStatsSnapshot snapshot) {
        send(statsTopic, snapshot.getWindowEnd().toString(), serializer.serialize(snapshot));
    }

    /**
     * Flush pending sends and close the producer.
     */
    @Override
    public void close() {
        try {
            producer.flush();
        } finally {
            producer.close(sendTimeout);
            LOG.info("Kafka event sink closed");
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void send(String topic, String key, byte[] value) {
        try {
            RecordMetadata metadata = producer.send(new ProducerRecord<>(topic, key, value))
                    .get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
            LOG.trace("Published {} to {}-{}@{}", key, metadata.topic(), metadata.partition(), metadata.offset());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while publishing " + key + " to " + topic, e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Failed to publish " + key + " to " + topic, e.getCause());
        } catch (TimeoutException e) {
            throw new IllegalStateException("Timed out publishing " + key + " to " + topic
                    + " after " + sendTimeout.toMillis() + " ms", e);
        }
    }
}
