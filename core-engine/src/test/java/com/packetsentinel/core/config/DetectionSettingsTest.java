package com.packetsentinel.core.config;

import com.packetsentinel.core.model.FeatureLayout;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectionSettings}.
 */
class DetectionSettingsTest {

    @Test
    @DisplayName("Should apply documented defaults")
    void shouldApplyDefaults() {
        DetectionSettings settings = DetectionSettings.defaults();

        assertThat(settings.getMinAnomalySamples()).isEqualTo(100);
        assertThat(settings.getAnomalyThreshold()).isEqualTo(0.5);
        assertThat(settings.getClassificationThreshold()).isEqualTo(0.7);
        assertThat(settings.getLoginWindow()).isEqualTo(Duration.ofHours(1));
        assertThat(settings.getConnectionIdleTimeout()).isEqualTo(Duration.ofMinutes(5));
        assertThat(settings.getAlertDedupWindow()).isEqualTo(Duration.ofMinutes(5));
        assertThat(settings.getQueueCapacity()).isEqualTo(10_000);
        assertThat(settings.getDetectorTimeout()).isEqualTo(Duration.ofMillis(20));
        assertThat(settings.getFeatureLayout()).isEqualTo(FeatureLayout.LIVE);
        assertThat(settings.getModelReloadInterval()).isEqualTo(Duration.ZERO);
    }

    @Test
    @DisplayName("Should report every invalid value in one exception")
    void shouldCollectAllErrors() {
        DetectionSettings.Builder builder = new DetectionSettings.Builder()
                .minAnomalySamples(1)
                .anomalyThreshold(1.5)
                .queueCapacity(0);

        assertThatThrownBy(builder::build)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("minAnomalySamples")
                .hasMessageContaining("anomalyThreshold")
                .hasMessageContaining("queueCapacity");
    }

    @Test
    @DisplayName("Should reject a sample capacity below the training minimum")
    void shouldRejectSmallSampleCapacity() {
        DetectionSettings.Builder builder = new DetectionSettings.Builder()
                .minAnomalySamples(50)
                .anomalySampleCapacity(10);

        assertThatThrownBy(builder::build)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("anomalySampleCapacity");
    }

    @Test
    @DisplayName("Should allow a non-positive detector timeout")
    void shouldAllowUnboundedDetectorTimeout() {
        DetectionSettings settings = new DetectionSettings.Builder()
                .detectorTimeoutMillis(0)
                .build();

        assertThat(settings.getDetectorTimeout()).isEqualTo(Duration.ZERO);
    }
}
