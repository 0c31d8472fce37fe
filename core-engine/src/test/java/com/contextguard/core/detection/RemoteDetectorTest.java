package com.contextguard.core.detection;

import com.contextguard.core.config.RemoteSettings;
import com.contextguard.core.model.AnalysisRequest;
import com.contextguard.core.model.DetectionReport;
import com.contextguard.core.model.JsonMappers;
import com.contextguard.core.model.PatternMatch;
import com.contextguard.core.model.PatternTags;
import com.contextguard.core.model.RiskLevel;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests {@link RemoteDetector} against an in-process HTTP stub.
 */
class RemoteDetectorTest {

    private final ObjectMapper mapper = JsonMappers.create();

    private HttpServer server;
    private boolean serverStopped;
    private RemoteDetector detector;

    private final AtomicInteger analyzeStatus = new AtomicInteger(200);
    private final AtomicReference<String> analyzeBody = new AtomicReference<>("{}");
    private final AtomicReference<String> receivedBody = new AtomicReference<>();
    private final AtomicInteger healthStatus = new AtomicInteger(200);

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/api/v1/analyze", exchange -> {
            receivedBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            respond(exchange, analyzeStatus.get(), analyzeBody.get());
        });
        server.createContext("/health", exchange -> respond(exchange, healthStatus.get(), "{\"status\":\"ok\"}"));
        server.start();

        RemoteSettings settings = new RemoteSettings();
        settings.setBaseUrl("http://127.0.0.1:" + server.getAddress().getPort() + "/");
        settings.setRequestTimeoutMillis(2_000);
        detector = new RemoteDetector(settings);
    }

    @AfterEach
    void tearDown() {
        if (!serverStopped) {
            server.stop(0);
        }
    }

    @Test
    @DisplayName("Should post the snippet and return the service's report")
    void shouldReturnRemoteReport() throws Exception {
        DetectionReport expected = new DetectionReport(RiskLevel.HIGH, Set.of(PatternTags.SECRET),
                List.of("Rotate the key"),
                List.of(new PatternMatch(PatternTags.SECRET, 1, 7, "password =", RiskLevel.HIGH)));
        analyzeBody.set(mapper.writeValueAsString(RemoteAnalyzeResponse.ok(expected)));

        DetectionReport report = detector
                .detect(AnalysisRequest.of("const password = 'abc123';", "javascript", "a.js"))
                .orElseThrow();

        assertThat(report).isEqualTo(expected);
        RemoteAnalyzeRequest sent = mapper.readValue(receivedBody.get(), RemoteAnalyzeRequest.class);
        assertThat(sent.getContent()).isEqualTo("const password = 'abc123';");
        assertThat(sent.getLanguage()).isEqualTo("javascript");
        assertThat(sent.getName()).isEqualTo("a.js");
    }

    @Test
    @DisplayName("Should fail on a non-2xx status")
    void shouldFailOnHttpError() {
        analyzeStatus.set(500);

        assertThatThrownBy(() -> detector.detect(request()))
                .isInstanceOf(DetectionException.class)
                .hasMessageContaining("HTTP 500");
    }

    @Test
    @DisplayName("Should fail when the service reports success=false")
    void shouldFailOnUnsuccessfulEnvelope() throws Exception {
        analyzeBody.set(mapper.writeValueAsString(RemoteAnalyzeResponse.failure("model unavailable")));

        assertThatThrownBy(() -> detector.detect(request()))
                .isInstanceOf(DetectionException.class)
                .hasMessageContaining("model unavailable");
    }

    @Test
    @DisplayName("Should fail on success without a result")
    void shouldFailOnMissingResult() {
        analyzeBody.set("{\"success\":true}");

        assertThatThrownBy(() -> detector.detect(request()))
                .isInstanceOf(DetectionException.class)
                .hasMessageContaining("without a result");
    }

    @Test
    @DisplayName("Should fail on a malformed body")
    void shouldFailOnMalformedBody() {
        analyzeBody.set("<html>oops</html>");

        assertThatThrownBy(() -> detector.detect(request()))
                .isInstanceOf(DetectionException.class)
                .hasMessageContaining("Malformed");
    }

    @Test
    @DisplayName("Health check should follow the /health status")
    void shouldReportHealth() throws Exception {
        assertThat(detector.isHealthy(Duration.ofSeconds(2))).isTrue();

        healthStatus.set(503);
        assertThat(detector.isHealthy(Duration.ofSeconds(2))).isFalse();
    }

    @Test
    @DisplayName("Should fail when the service is unreachable")
    void shouldFailWhenUnreachable() {
        server.stop(0);
        serverStopped = true;

        assertThatThrownBy(() -> detector.isHealthy(Duration.ofSeconds(1)))
                .isInstanceOf(DetectionException.class)
                .hasMessageContaining("unreachable");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static AnalysisRequest request() {
        return AnalysisRequest.of("int x = 1;", "java", null);
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
