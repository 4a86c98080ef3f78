package com.packetsentinel.core.tracking;

import com.packetsentinel.core.model.LoginAttemptRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Counts failed authentication attempts per source IP inside a trailing
 * window.
 *
 * <p>
 * Old entries are pruned lazily: on {@link #query(String, Instant)} for the
 * queried source and on {@link #sweep(Instant)} for everyone. Records are
 * only ever touched inside {@code compute}/{@code computeIfPresent}.
 * </p>
 *
 * @since 1.0.0
 */
public class LoginAttemptTracker implements FeatureTracker {

    private static final Logger LOG = LoggerFactory.getLogger(LoginAttemptTracker.class);

    private final ConcurrentMap<String, LoginAttemptRecord> attempts = new ConcurrentHashMap<>();
    private final Duration window;

    public LoginAttemptTracker(Duration window) {
        this.window = Objects.requireNonNull(window, "window must not be null");
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive, got: " + window);
        }
    }

    /**
     * Record one failed authentication of {@code sourceIp} at {@code at}.
     */
    public void record(String sourceIp, Instant at) {
        Objects.requireNonNull(sourceIp, "sourceIp must not be null");
        Objects.requireNonNull(at, "at must not be null");
        attempts.compute(sourceIp, (ip, record) -> {
            LoginAttemptRecord target = record != null ? record : new LoginAttemptRecord(ip);
            target.add(at);
            return target;
        });
    }

    /**
     * @return failures of {@code sourceIp} inside the window ending at
     *         {@code now}
     */
    public int query(String sourceIp, Instant now) {
        int[] count = new int[1];
        attempts.computeIfPresent(sourceIp, (ip, record) -> {
            record.prune(now.minus(window));
            count[0] = record.count();
            return record.isEmpty() ? null : record;
        });
        return count[0];
    }

    @Override
    public int sweep(Instant now) {
        Instant cutoff = now.minus(window);
        int evicted = 0;
        for (String ip : attempts.keySet()) {
            boolean[] removed = new boolean[1];
            attempts.computeIfPresent(ip, (key, record) -> {
                record.prune(cutoff);
                removed[0] = record.isEmpty();
                return removed[0] ? null : record;
            });
            if (removed[0]) {
                evicted++;
            }
        }
        if (evicted > 0) {
            LOG.debug("Evicted {} login record(s)", evicted);
        }
        return evicted;
    }

    @Override
    public int size() {
        return attempts.size();
    }
}
