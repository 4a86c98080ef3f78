package com.packetsentinel.core.tracking;

import com.packetsentinel.core.config.DetectionSettings;
import com.packetsentinel.core.model.FlowKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link FeatureTrackers}, {@link FlowRateCalculator} and
 * {@link AccessFrequencyTracker}.
 */
class FeatureTrackersTest {

    private static final Instant T0 = Instant.parse("2024-01-15T10:00:00Z");
    private static final FlowKey FLOW = new FlowKey("10.0.0.5", "10.0.0.1", 80);

    private FeatureTrackers trackers;

    @BeforeEach
    void setUp() {
        trackers = FeatureTrackers.create(DetectionSettings.defaults());
    }

    @Test
    @DisplayName("Should compute bytes per second over the flow lifetime")
    void shouldComputeTransferRate() {
        trackers.flowRates().record(FLOW, T0, 1000);
        trackers.flowRates().record(FLOW, T0.plusSeconds(5), 1000);

        assertThat(trackers.flowRates().query(FLOW, T0.plusSeconds(10))).isEqualTo(200.0);
    }

    @Test
    @DisplayName("Should not divide by less than one second")
    void shouldFloorElapsedTime() {
        trackers.flowRates().record(FLOW, T0, 500);

        assertThat(trackers.flowRates().query(FLOW, T0)).isEqualTo(500.0);
    }

    @Test
    @DisplayName("Should count packets of a source inside the access window")
    void shouldCountAccesses() {
        AccessFrequencyTracker access = trackers.accessFrequency();
        access.record("10.0.0.5", T0);
        access.record("10.0.0.5", T0);
        access.record("10.0.0.5", T0.plusSeconds(200));

        assertThat(access.query("10.0.0.5", T0.plusSeconds(200))).isEqualTo(3);
        assertThat(access.query("10.0.0.5", T0.plusSeconds(400))).isEqualTo(1);
    }

    @Test
    @DisplayName("Should sweep every tracker and leave nothing behind after all windows passed")
    void shouldSweepAllTrackers() {
        trackers.connections().record(FLOW, T0, 100);
        trackers.flowRates().record(FLOW, T0, 100);
        trackers.loginAttempts().record("10.0.0.1", T0);
        trackers.accessFrequency().record("10.0.0.5", T0);

        int evicted = trackers.sweepAll(T0.plus(Duration.ofHours(2)));

        assertThat(evicted).isEqualTo(4);
        assertThat(trackers.all()).allSatisfy(t -> assertThat(t.size()).isZero());
    }
}
