package com.packetsentinel.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.packetsentinel.core.pipeline.PacketPipeline;
import com.packetsentinel.core.pipeline.PipelineState;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lightweight HTTP server that exposes health and readiness endpoints.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health} - {@code 200 OK} while the process is up, with the
 * pipeline counters as JSON</li>
 * <li>{@code GET /readiness} - the same body; {@code 200 OK} only while the
 * pipeline is {@link PipelineState#RUNNING}, {@code 503} otherwise</li>
 * </ul>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer} so no external server is
 * required.
 * </p>
 *
 * @since 1.0.0
 */
public class HealthServer {

    private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);

    private final PacketPipeline pipeline;
    private final ObjectMapper mapper = new ObjectMapper();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private HttpServer server;
    private ExecutorService executor;

    public HealthServer(PacketPipeline pipeline) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
    }

    /**
     * Start the health server on the given port.
     *
     * @param port TCP port to bind to; {@code 0} picks a free port
     * @throws IllegalArgumentException if port is out of range
     * @throws IllegalStateException    if the port cannot be bound
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Health port must be in range [0, 65535], got: " + port);
        }
        if (running.get()) {
            throw new IllegalStateException("Health server is already running on port " + getPort());
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext("/health", exchange -> respond(exchange, 200));
            server.createContext("/readiness", exchange -> respond(exchange,
                    pipeline.getState() == PipelineState.RUNNING ? 200 : 503));

            executor = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "health-server");
                t.setDaemon(true);
                return t;
            });
            server.setExecutor(executor);

            server.start();
            running.set(true);
            LOG.info("Health server started on port {}", getPort());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to start health server on port " + port, e);
        }
    }

    /**
     * Stop the health server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            executor.shutdownNow();
            LOG.info("Health server stopped");
        }
    }

    /**
     * @return {@code true} if the server is currently running
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port, or {@code -1} before {@link #start(int)}
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : -1;
    }

    /**
     * @return the status document served by both endpoints
     */
    Map<String, Object> status() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("status", pipeline.getState() == PipelineState.RUNNING ? "UP" : "DOWN");
        status.put("pipeline", pipeline.getName());
        status.put("state", pipeline.getState().name());
        status.put("processed", pipeline.processedCount());
        status.put("dropped", pipeline.droppedCount());
        status.put("queueDepth", pipeline.queueDepth());
        status.put("openAlerts", pipeline.getAlertSink().indexSize());
        return status;
    }

    // ---------------------------------------------------------------
    // Handler (shared between /health and /readiness)
    // ---------------------------------------------------------------

    private void respond(HttpExchange exchange, int statusCode) throws IOException {
        byte[] body = mapper.writeValueAsBytes(status());
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }
}
