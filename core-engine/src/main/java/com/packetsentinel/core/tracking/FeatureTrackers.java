package com.packetsentinel.core.tracking;

import com.packetsentinel.core.config.DetectionSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * The four feature trackers of one pipeline.
 *
 * <p>
 * Owned by the pipeline and passed explicitly to the feature extractor;
 * independent pipelines never share trackers.
 * </p>
 *
 * @since 1.0.0
 */
public final class FeatureTrackers {

    private static final Logger LOG = LoggerFactory.getLogger(FeatureTrackers.class);

    private final ConnectionTracker connections;
    private final LoginAttemptTracker loginAttempts;
    private final FlowRateCalculator flowRates;
    private final AccessFrequencyTracker accessFrequency;

    public FeatureTrackers(ConnectionTracker connections,
            LoginAttemptTracker loginAttempts,
            FlowRateCalculator flowRates,
            AccessFrequencyTracker accessFrequency) {
        this.connections = Objects.requireNonNull(connections, "connections must not be null");
        this.loginAttempts = Objects.requireNonNull(loginAttempts, "loginAttempts must not be null");
        this.flowRates = Objects.requireNonNull(flowRates, "flowRates must not be null");
        this.accessFrequency = Objects.requireNonNull(accessFrequency, "accessFrequency must not be null");
    }

    /**
     * Build a fresh set of trackers sized by {@code settings}.
     */
    public static FeatureTrackers create(DetectionSettings settings) {
        Objects.requireNonNull(settings, "settings must not be null");
        return new FeatureTrackers(
                new ConnectionTracker(settings.getConnectionIdleTimeout()),
                new LoginAttemptTracker(settings.getLoginWindow()),
                new FlowRateCalculator(settings.getConnectionIdleTimeout()),
                new AccessFrequencyTracker(settings.getAccessWindow()));
    }

    /**
     * Sweep every tracker. A failing tracker does not stop the others.
     *
     * @return total number of evicted entries
     */
    public int sweepAll(Instant now) {
        int evicted = 0;
        for (FeatureTracker tracker : all()) {
            try {
                evicted += tracker.sweep(now);
            } catch (RuntimeException e) {
                LOG.error("Sweep failed for {}", tracker.getClass().getSimpleName(), e);
            }
        }
        if (evicted > 0) {
            LOG.debug("Tracker sweep evicted {} entr(ies)", evicted);
        }
        return evicted;
    }

    public List<FeatureTracker> all() {
        return List.of(connections, loginAttempts, flowRates, accessFrequency);
    }

    public ConnectionTracker connections() {
        return connections;
    }

    public LoginAttemptTracker loginAttempts() {
        return loginAttempts;
    }

    public FlowRateCalculator flowRates() {
        return flowRates;
    }

    public AccessFrequencyTracker accessFrequency() {
        return accessFrequency;
    }
}
