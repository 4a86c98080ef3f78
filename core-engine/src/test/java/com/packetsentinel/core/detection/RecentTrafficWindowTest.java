package com.packetsentinel.core.detection;

import com.packetsentinel.core.support.Packets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link RecentTrafficWindow} and {@link SourceActivity}.
 */
class RecentTrafficWindowTest {

    @Test
    @DisplayName("Should keep only packets inside the history window")
    void shouldPruneByAge() {
        RecentTrafficWindow window = new RecentTrafficWindow(Duration.ofSeconds(60), 1000);

        window.record(Packets.tcp("10.0.0.5", "10.0.0.1", 80).build());
        SourceActivity activity = window.record(Packets.tcp("10.0.0.5", "10.0.0.1", 81)
                .timestamp(Packets.T0.plusSeconds(61))
                .build());

        assertThat(activity.packetCount()).isEqualTo(1);
        assertThat(activity.distinctDestinationPorts(Duration.ZERO)).isEqualTo(1);
    }

    @Test
    @DisplayName("Should cap the port samples but keep counting every packet")
    void shouldCapPortSamplesOnly() {
        RecentTrafficWindow window = new RecentTrafficWindow(Duration.ofSeconds(60), 3);

        SourceActivity activity = null;
        for (int i = 0; i < 5; i++) {
            activity = window.record(Packets.tcp("10.0.0.5", "10.0.0.1", 80 + i).size(100).build());
        }

        assertThat(activity.packetCount()).isEqualTo(5);
        assertThat(activity.totalBytes(Duration.ZERO)).isEqualTo(500);
        assertThat(activity.distinctDestinationPorts(Duration.ZERO)).isEqualTo(3);
    }

    @Test
    @DisplayName("Should sum the bytes of many small packets beyond the port sample cap")
    void shouldSumBytesBeyondSampleCap() {
        RecentTrafficWindow window = new RecentTrafficWindow(Duration.ofSeconds(60), 1000);

        SourceActivity activity = null;
        for (int i = 0; i < 4000; i++) {
            activity = window.record(Packets.tcp("10.0.0.5", "203.0.113.9", 443)
                    .timestamp(Packets.T0.plusMillis(i * 7L))
                    .size(500)
                    .build());
        }

        assertThat(activity.packetCount(Duration.ofSeconds(60))).isEqualTo(4000);
        assertThat(activity.totalBytes(Duration.ofSeconds(60))).isEqualTo(2_000_000);
    }

    @Test
    @DisplayName("Should credit out-of-order packets to the newest second")
    void shouldCreditOutOfOrderPackets() {
        RecentTrafficWindow window = new RecentTrafficWindow(Duration.ofSeconds(60), 1000);

        window.record(Packets.tcp("10.0.0.5", "10.0.0.1", 80).timestamp(Packets.T0.plusSeconds(5)).size(100).build());
        SourceActivity activity = window.record(Packets.tcp("10.0.0.5", "10.0.0.1", 80)
                .timestamp(Packets.T0.plusSeconds(2))
                .size(50)
                .build());

        assertThat(activity.packetCount(Duration.ofSeconds(1))).isEqualTo(2);
        assertThat(activity.totalBytes(Duration.ofSeconds(1))).isEqualTo(150);
        assertThat(activity.newest()).isEqualTo(Packets.T0.plusSeconds(5));
    }

    @Test
    @DisplayName("Should narrow queries to a look-back from the newest packet")
    void shouldNarrowToRuleWindow() {
        RecentTrafficWindow window = new RecentTrafficWindow(Duration.ofSeconds(60), 1000);

        window.record(Packets.tcp("10.0.0.5", "10.0.0.1", 22).size(100).build());
        SourceActivity activity = window.record(Packets.tcp("10.0.0.5", "10.0.0.1", 23)
                .timestamp(Packets.T0.plusSeconds(30))
                .size(200)
                .build());

        assertThat(activity.packetCount(Duration.ofSeconds(10))).isEqualTo(1);
        assertThat(activity.totalBytes(Duration.ofSeconds(10))).isEqualTo(200);
        assertThat(activity.totalBytes(Duration.ZERO)).isEqualTo(300);
        assertThat(activity.newest()).isEqualTo(Packets.T0.plusSeconds(30));
    }

    @Test
    @DisplayName("Should drop sources with no recent packets on sweep")
    void shouldSweepIdleSources() {
        RecentTrafficWindow window = new RecentTrafficWindow(Duration.ofSeconds(60), 1000);
        window.record(Packets.tcp("10.0.0.5", "10.0.0.1", 80).build());
        window.record(Packets.tcp("10.0.0.6", "10.0.0.1", 80).timestamp(Packets.T0.plusSeconds(100)).build());

        assertThat(window.sweep(Packets.T0.plusSeconds(120))).isEqualTo(1);
        assertThat(window.size()).isEqualTo(1);
    }
}
