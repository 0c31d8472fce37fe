package com.contextguard.server;

import com.contextguard.core.detection.RemoteAnalyzeRequest;
import com.contextguard.core.detection.RemoteAnalyzeResponse;
import com.contextguard.core.model.AnalysisResult;
import com.contextguard.core.model.JsonMappers;
import com.contextguard.core.orchestration.AnalysisOrchestrator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * HTTP front end of the remote detection service.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health}: {@code 200} with {@code {"status":"UP"}}</li>
 * <li>{@code GET /readiness}: same; container readiness probe target</li>
 * <li>{@code POST /api/v1/analyze}: body {@code {content, language, name}},
 * answers {@code {success, result?, error?}}</li>
 * <li>{@code GET /api/v1/stats}: cache, security and performance
 * statistics</li>
 * </ul>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer} so no external server runtime is
 * required.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionServer {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionServer.class);
    private static final Map<String, String> HEALTH_RESPONSE = Map.of("status", "UP");

    private final AnalysisOrchestrator orchestrator;
    private final int workerThreads;
    private final ObjectMapper mapper = JsonMappers.create();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private HttpServer server;
    private ExecutorService executor;

    public DetectionServer(AnalysisOrchestrator orchestrator, int workerThreads) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "AnalysisOrchestrator must not be null");
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be >= 1, got: " + workerThreads);
        }
        this.workerThreads = workerThreads;
    }

    /**
     * Start the server on the given port.
     *
     * @param port TCP port to bind to; {@code 0} picks a free port
     * @throws IllegalArgumentException if port is out of range
     * @throws UncheckedIOException     if the port cannot be bound
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException("Port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
        } catch (IOException e) {
            LOG.error("Failed to start detection server on port {}: {}", port, e.getMessage(), e);
            throw new UncheckedIOException("Cannot bind detection server to port " + port, e);
        }
        server.createContext("/health", this::handleHealthCheck);
        server.createContext("/readiness", this::handleHealthCheck);
        server.createContext("/api/v1/analyze", this::handleAnalyze);
        server.createContext("/api/v1/stats", this::handleStats);

        AtomicInteger threadIndex = new AtomicInteger();
        executor = Executors.newFixedThreadPool(workerThreads, r -> {
            Thread t = new Thread(r, "detection-server-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.start();
        running.set(true);
        LOG.info("Detection server started on port {}", getPort());
    }

    /**
     * Stop the server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            executor.shutdownNow();
            LOG.info("Detection server stopped");
        }
    }

    /**
     * @return {@code true} if the server is currently running
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port
     * @throws IllegalStateException if the server was never started
     */
    public int getPort() {
        if (server == null) {
            throw new IllegalStateException("Detection server not started");
        }
        return server.getAddress().getPort();
    }

    private void handleHealthCheck(HttpExchange exchange) throws IOException {
        JsonExchange.send(exchange, 200, HEALTH_RESPONSE, mapper);
    }

    private void handleAnalyze(HttpExchange exchange) throws IOException {
        if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Allow", "POST");
            JsonExchange.send(exchange, 405,
                    RemoteAnalyzeResponse.failure("Method " + exchange.getRequestMethod() + " not allowed"), mapper);
            return;
        }

        RemoteAnalyzeRequest body;
        try {
            body = mapper.readValue(JsonExchange.readBody(exchange), RemoteAnalyzeRequest.class);
        } catch (IOException e) {
            LOG.debug("Rejected malformed analyze request: {}", e.getMessage());
            JsonExchange.send(exchange, 400, RemoteAnalyzeResponse.failure("Malformed request body"), mapper);
            return;
        }
        if (body == null || body.getContent() == null || body.getLanguage() == null
                || body.getLanguage().isBlank()) {
            JsonExchange.send(exchange, 400,
                    RemoteAnalyzeResponse.failure("Fields 'content' and 'language' are required"), mapper);
            return;
        }

        try {
            AnalysisResult result = orchestrator.analyze(body.toRequest());
            JsonExchange.send(exchange, 200, RemoteAnalyzeResponse.ok(result.toReport()), mapper);
        } catch (IllegalStateException e) {
            LOG.error("Analysis failed for {}: {}", body.getName(), e.getMessage());
            JsonExchange.send(exchange, 500, RemoteAnalyzeResponse.failure(e.getMessage()), mapper);
        }
    }

    private void handleStats(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Allow", "GET");
            JsonExchange.send(exchange, 405, Map.of("error", "Method not allowed"), mapper);
            return;
        }
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("cache", orchestrator.getCacheStats());
        stats.put("securitySummary", orchestrator.getSecuritySummary());
        stats.put("performance", orchestrator.getPerformanceStats());
        JsonExchange.send(exchange, 200, stats, mapper);
    }
}
