package com.packetsentinel.core.alert;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Runs a write with a bounded number of attempts and linear backoff.
 *
 * <p>
 * Attempt {@code n} failing waits {@code n * backoff} before the next one.
 * When every attempt failed the write is logged at ERROR with its subject
 * and counted in {@code sentinel.persistence.failures{type}}; the caller
 * carries on.
 * </p>
 *
 * @since 1.0.0
 */
public class RetryingWriter {

    private static final Logger LOG = LoggerFactory.getLogger(RetryingWriter.class);

    private final int maxAttempts;
    private final Duration backoff;
    private final MeterRegistry registry;

    public RetryingWriter(int maxAttempts, Duration backoff, MeterRegistry registry) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /**
     * @param type    write type used in logs and the failure metric tag
     * @param subject what is being written, for the error log
     * @param write   the write
     * @return {@code true} if an attempt succeeded
     */
    public boolean write(String type, Object subject, Runnable write) {
        RuntimeException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                write.run();
                if (attempt > 1) {
                    LOG.info("Persisted {} on attempt {}", type, attempt);
                }
                return true;
            } catch (RuntimeException e) {
                last = e;
                LOG.warn("Persisting {} failed (attempt {}/{}): {}", type, attempt, maxAttempts, e.toString());
                if (attempt < maxAttempts && !pause(attempt)) {
                    break;
                }
            }
        }
        failureCounter(type).increment();
        LOG.error("Giving up persisting {} {}", type, subject, last);
        return false;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    private Counter failureCounter(String type) {
        return Counter.builder("sentinel.persistence.failures")
                .description("Writes that failed after every retry")
                .tag("type", type)
                .register(registry);
    }

    private boolean pause(int attempt) {
        if (backoff.isZero() || backoff.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(backoff.toMillis() * attempt);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
