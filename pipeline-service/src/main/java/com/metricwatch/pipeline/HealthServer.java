package com.metricwatch.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Lightweight HTTP server that exposes health, readiness and pipeline
 * metrics.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health} – {@code 200 OK} with body {@code {"status":"UP"}}
 * while the process is alive</li>
 * <li>{@code GET /readiness} – {@code 200} with {@code {"status":"UP"}} while
 * the pipeline is running, otherwise {@code 503} with
 * {@code {"status":"DOWN"}}</li>
 * <li>{@code GET /metrics} – {@link PipelineMetricsSnapshot} as JSON</li>
 * </ul>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer} so no external dependencies
 * (Jetty, Netty, etc.) are required.
 * </p>
 *
 * @since 1.0.0
 */
public class HealthServer {

    private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);
    private static final byte[] UP_RESPONSE = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);
    private static final byte[] DOWN_RESPONSE = "{\"status\":\"DOWN\"}".getBytes(StandardCharsets.UTF_8);

    private final Supplier<PipelineMetricsSnapshot> metrics;
    private final BooleanSupplier ready;
    private final ObjectMapper mapper;

    private HttpServer server;
    private ExecutorService executor;
    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * @param metrics source of the {@code /metrics} body
     * @param ready   readiness check, usually {@link IngestionPipeline#isRunning()}
     */
    public HealthServer(Supplier<PipelineMetricsSnapshot> metrics, BooleanSupplier ready) {
        this.metrics = Objects.requireNonNull(metrics, "metrics supplier must not be null");
        this.ready = Objects.requireNonNull(ready, "readiness check must not be null");
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    /**
     * Start the health server on the given port.
     *
     * @param port TCP port to bind to; 0 picks a free port
     * @throws IllegalArgumentException if port is out of range
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Health port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext("/health", HealthServer::handleHealth);
            server.createContext("/readiness", this::handleReadiness);
            server.createContext("/metrics", this::handleMetrics);

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
            LOG.error("Failed to start health server on port {}: {}", port, e.getMessage(), e);
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
     * @return the bound port, or -1 if the server is not running
     */
    public int getPort() {
        return running.get() ? server.getAddress().getPort() : -1;
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private static void handleHealth(HttpExchange exchange) throws IOException {
        respond(exchange, 200, UP_RESPONSE);
    }

    private void handleReadiness(HttpExchange exchange) throws IOException {
        if (ready.getAsBoolean()) {
            respond(exchange, 200, UP_RESPONSE);
        } else {
            respond(exchange, 503, DOWN_RESPONSE);
        }
    }

    private void handleMetrics(HttpExchange exchange) throws IOException {
        byte[] body;
        try {
            body = mapper.writeValueAsBytes(metrics.get());
        } catch (RuntimeException | IOException e) {
            LOG.error("Failed to render metrics: {}", e.getMessage(), e);
            respond(exchange, 500, DOWN_RESPONSE);
            return;
        }
        respond(exchange, 200, body);
    }

    private static void respond(HttpExchange exchange, int status, byte[] body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }
}
