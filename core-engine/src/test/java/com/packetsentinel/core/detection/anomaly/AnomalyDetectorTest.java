package com.packetsentinel.core.detection.anomaly;

import com.packetsentinel.core.detection.AnalysisContext;
import com.packetsentinel.core.detection.SourceActivity;
import com.packetsentinel.core.model.Detection;
import com.packetsentinel.core.model.DetectorKind;
import com.packetsentinel.core.model.FeatureVector;
import com.packetsentinel.core.model.PacketRecord;
import com.packetsentinel.core.model.Severity;
import com.packetsentinel.core.support.Packets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AnomalyDetector}.
 */
class AnomalyDetectorTest {

    @Test
    @DisplayName("Should collect without detecting until the minimum sample count, then train")
    void shouldTrainAtMinimumSamples() {
        AnomalyDetector detector = new AnomalyDetector(new IsolationForestTrainer(), 100, 0.5, 10_000);
        assertThat(detector.getState()).isEqualTo(AnomalyState.UNTRAINED);

        List<double[]> samples = IsolationForestTest.normalTraffic(100, new Random(5));
        for (int i = 0; i < 99; i++) {
            assertThat(detector.detect(context(samples.get(i)))).isEmpty();
        }
        assertThat(detector.getState()).isEqualTo(AnomalyState.COLLECTING);
        assertThat(detector.isTrained()).isFalse();

        detector.detect(context(samples.get(99)));

        assertThat(detector.getState()).isEqualTo(AnomalyState.TRAINED);
        assertThat(detector.isTrained()).isTrue();
        assertThat(detector.bufferedSamples()).isEqualTo(100);
    }

    @Test
    @DisplayName("Should fire only when confidence exceeds the threshold")
    void shouldApplyThreshold() {
        AnomalyDetector detector = new AnomalyDetector(samples -> fixedModel(0.6), 2, 0.5, 10);
        detector.detect(context(new double[] { 1 }));

        List<Detection> detections = detector.detect(context(new double[] { 2 }));

        assertThat(detections).hasSize(1);
        Detection detection = detections.get(0);
        assertThat(detection.getKind()).isEqualTo(DetectorKind.ANOMALY);
        assertThat(detection.getRuleId()).isEqualTo(AnomalyDetector.RULE_ID);
        assertThat(detection.getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(detection.getConfidence()).isEqualTo(0.6);

        AnomalyDetector quiet = new AnomalyDetector(samples -> fixedModel(0.5), 2, 0.5, 10);
        quiet.detect(context(new double[] { 1 }));
        assertThat(quiet.detect(context(new double[] { 2 }))).isEmpty();
    }

    @Test
    @DisplayName("Should report high severity for very confident anomalies")
    void shouldEscalateSeverity() {
        AnomalyDetector detector = new AnomalyDetector(samples -> fixedModel(0.95), 2, 0.5, 10);
        detector.detect(context(new double[] { 1 }));

        assertThat(detector.detect(context(new double[] { 2 })))
                .extracting(Detection::getSeverity)
                .containsExactly(Severity.HIGH);
    }

    @Test
    @DisplayName("Should stay collecting when the initial training fails")
    void shouldSurviveTrainingFailure() {
        AnomalyDetector detector = new AnomalyDetector(samples -> {
            throw new IllegalStateException("no convergence");
        }, 2, 0.5, 10);

        detector.detect(context(new double[] { 1 }));
        assertThat(detector.detect(context(new double[] { 2 }))).isEmpty();

        assertThat(detector.getState()).isEqualTo(AnomalyState.COLLECTING);
        assertThat(detector.isTrained()).isFalse();
    }

    @Test
    @DisplayName("Should keep the active model when retraining fails")
    void shouldKeepModelWhenRetrainFails() {
        AtomicInteger calls = new AtomicInteger();
        AnomalyDetector detector = new AnomalyDetector(samples -> {
            if (calls.incrementAndGet() > 1) {
                throw new IllegalStateException("retrain failed");
            }
            return fixedModel(0.9);
        }, 2, 0.5, 10);
        detector.detect(context(new double[] { 1 }));
        detector.detect(context(new double[] { 2 }));

        assertThat(detector.retrain()).isFalse();

        assertThat(detector.getState()).isEqualTo(AnomalyState.TRAINED);
        assertThat(detector.detect(context(new double[] { 3 }))).hasSize(1);
    }

    @Test
    @DisplayName("Should swap in a retrained model")
    void shouldSwapRetrainedModel() {
        AtomicInteger calls = new AtomicInteger();
        AnomalyDetector detector = new AnomalyDetector(
                samples -> fixedModel(calls.incrementAndGet() == 1 ? 0.9 : 0.1), 2, 0.5, 10);
        detector.detect(context(new double[] { 1 }));
        detector.detect(context(new double[] { 2 }));

        assertThat(detector.retrain()).isTrue();

        assertThat(detector.detect(context(new double[] { 3 }))).isEmpty();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static AnalysisContext context(double[] values) {
        PacketRecord packet = Packets.tcp("10.0.0.5", "10.0.0.1", 80).build();
        return new AnalysisContext(packet, FeatureVector.of(values), SourceActivity.empty("10.0.0.5"));
    }

    private static AnomalyModel fixedModel(double confidence) {
        return new AnomalyModel() {
            @Override
            public double score(double[] features) {
                return confidence;
            }

            @Override
            public double confidence(double[] features) {
                return confidence;
            }

            @Override
            public int featureCount() {
                return 1;
            }
        };
    }
}
