package com.packetsentinel.core.model;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Failed authentication instants of one source IP, oldest first.
 *
 * <p>
 * Not thread-safe. The login attempt tracker only touches a record from
 * inside {@code ConcurrentHashMap.compute}, which serializes access per
 * source IP.
 * </p>
 *
 * @since 1.0.0
 */
public final class LoginAttemptRecord {

    private final String sourceIp;
    private final Deque<Instant> failures = new ArrayDeque<>();

    public LoginAttemptRecord(String sourceIp) {
        this.sourceIp = Objects.requireNonNull(sourceIp, "sourceIp must not be null");
    }

    public void add(Instant at) {
        failures.addLast(Objects.requireNonNull(at, "at must not be null"));
    }

    /**
     * Drop every failure strictly before {@code cutoff}.
     *
     * @return number of entries removed
     */
    public int prune(Instant cutoff) {
        int removed = 0;
        while (!failures.isEmpty() && failures.peekFirst().isBefore(cutoff)) {
            failures.pollFirst();
            removed++;
        }
        return removed;
    }

    public int count() {
        return failures.size();
    }

    public boolean isEmpty() {
        return failures.isEmpty();
    }

    public String getSourceIp() {
        return sourceIp;
    }

    @Override
    public String toString() {
        return "LoginAttemptRecord{" + sourceIp + ", failures=" + failures.size() + '}';
    }
}
