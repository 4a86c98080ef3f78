package com.packetsentinel.app;

import com.packetsentinel.core.model.PacketRecord;
import com.packetsentinel.core.pipeline.PacketPipeline;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.common.errors.WakeupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Feeds packets from a Kafka topic into a {@link PacketPipeline}.
 *
 * <p>
 * {@link #run()} polls until {@link #stop(Duration)} is called, typically from a
 * shutdown hook on another thread. Records that do not deserialize are
 * skipped. The pipeline never blocks the poll loop: when its queue is full
 * the packet is dropped and counted there.
 * </p>
 *
 * @since 1.0.0
 */
public class KafkaPacketSource implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(KafkaPacketSource.class);
    private static final Duration POLL_TIMEOUT = Duration.ofMillis(500);

    private final Consumer<byte[], byte[]> consumer;
    private final String topic;
    private final PacketRecordDeserializer deserializer;
    private final PacketPipeline pipeline;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final CountDownLatch stopped = new CountDownLatch(1);
    private volatile long consumed;
    private volatile long malformed;

    public KafkaPacketSource(Consumer<byte[], byte[]> consumer, String topic,
            PacketRecordDeserializer deserializer, PacketPipeline pipeline) {
        this.consumer = Objects.requireNonNull(consumer, "consumer must not be null");
        this.topic = Objects.requireNonNull(topic, "topic must not be null");
        this.deserializer = Objects.requireNonNull(deserializer, "deserializer must not be null");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
    }

    @Override
    public void run() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Packet source can only be run once");
        }
        LOG.info("Consuming packets from topic {}", topic);
        try {
            consumer.subscribe(List.of(topic));
            while (!stopRequested.get()) {
                ConsumerRecords<byte[], byte[]> records = consumer.poll(POLL_TIMEOUT);
                for (ConsumerRecord<byte[], byte[]> record : records) {
                    handle(record);
                }
            }
        } catch (WakeupException e) {
            if (!stopRequested.get()) {
                throw e;
            }
        } finally {
            consumer.close();
            stopped.countDown();
            LOG.info("Packet source stopped after {} record(s), {} malformed", consumed, malformed);
        }
    }

    /**
     * Ask the poll loop to exit and wait for it to close the consumer. A
     * source that was never run returns immediately.
     *
     * @param timeout how long to wait for the loop to finish
     * @return {@code true} if the loop finished within the timeout
     */
    public boolean stop(Duration timeout) {
        if (stopRequested.compareAndSet(false, true) && started.get()) {
            consumer.wakeup();
        }
        if (!started.get()) {
            return true;
        }
        try {
            return stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public boolean isRunning() {
        return started.get() && stopped.getCount() > 0;
    }

    public long consumedCount() {
        return consumed;
    }

    public long malformedCount() {
        return malformed;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void handle(ConsumerRecord<byte[], byte[]> record) {
        consumed++;
        Optional<PacketRecord> packet = deserializer.deserialize(record.value());
        if (packet.isEmpty()) {
            malformed++;
            LOG.debug("Skipped malformed record at {}-{}@{}", record.topic(), record.partition(), record.offset());
            return;
        }
        pipeline.submit(packet.get());
    }
}
