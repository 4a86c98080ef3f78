package com.packetsentinel.app;

import com.packetsentinel.core.alert.PersistenceSink;
import com.packetsentinel.core.config.DetectionSettings;
import com.packetsentinel.core.config.SignatureRulesLoader;
import com.packetsentinel.core.model.Alert;
import com.packetsentinel.core.model.TrafficStatsSnapshot;
import com.packetsentinel.core.pipeline.PacketPipeline;
import com.packetsentinel.core.pipeline.PipelineAssembler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link HealthServer}.
 */
class HealthServerTest {

    private final HttpClient client = HttpClient.newHttpClient();

    private PacketPipeline pipeline;
    private HealthServer server;

    @BeforeEach
    void setUp() {
        pipeline = PipelineAssembler.forSettings(new DetectionSettings.Builder().workerCount(1).build())
                .rules(SignatureRulesLoader.fromClasspath("signatures.yml"))
                .persistence(new DiscardingSink())
                .assemble();
        server = new HealthServer(pipeline);
        server.start(0);
    }

    @AfterEach
    void tearDown() {
        server.stop();
        pipeline.shutdown(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("Should report not ready before the pipeline starts")
    void shouldReportNotReadyBeforeStart() throws Exception {
        HttpResponse<String> health = get("/health");
        HttpResponse<String> readiness = get("/readiness");

        assertThat(health.statusCode()).isEqualTo(200);
        assertThat(health.body()).contains("\"status\":\"DOWN\"").contains("\"state\":\"NEW\"");
        assertThat(readiness.statusCode()).isEqualTo(503);
    }

    @Test
    @DisplayName("Should report ready with pipeline counters once running")
    void shouldReportReadyWhenRunning() throws Exception {
        pipeline.start();

        HttpResponse<String> readiness = get("/readiness");

        assertThat(readiness.statusCode()).isEqualTo(200);
        assertThat(readiness.headers().firstValue("Content-Type")).contains("application/json");
        assertThat(readiness.body())
                .contains("\"status\":\"UP\"")
                .contains("\"pipeline\":\"" + pipeline.getName() + "\"")
                .contains("\"processed\":0")
                .contains("\"dropped\":0")
                .contains("\"openAlerts\":0");
    }

    @Test
    @DisplayName("Should bind an ephemeral port and stop cleanly")
    void shouldStopCleanly() {
        assertThat(server.isRunning()).isTrue();
        assertThat(server.getPort()).isPositive();

        server.stop();

        assertThat(server.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Should reject an out-of-range port")
    void shouldRejectBadPort() {
        assertThatThrownBy(() -> new HealthServer(pipeline).start(70_000))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://localhost:" + server.getPort() + path))
                .timeout(Duration.ofSeconds(5))
                .GET()
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private static final class DiscardingSink implements PersistenceSink {
        @Override
        public void persistAlert(Alert alert) {
        }

        @Override
        public void persistSnapshot(TrafficStatsSnapshot snapshot) {
        }
    }
}
