package com.contextguard.server;

import com.contextguard.core.config.GuardConfig;
import com.contextguard.core.config.GuardConfigLoader;
import com.contextguard.core.model.JsonMappers;
import com.contextguard.core.orchestration.AnalysisOrchestrator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Exercises {@link DetectionServer} over real HTTP on an ephemeral port.
 */
class DetectionServerTest {

    private final ObjectMapper mapper = JsonMappers.create();
    private final HttpClient client = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(2))
            .build();

    private AnalysisOrchestrator orchestrator;
    private DetectionServer server;

    @BeforeEach
    void setUp() {
        GuardConfig config = GuardConfigLoader.fromClasspath(GuardConfigLoader.DEFAULT_RESOURCE);
        config.getRemote().setEnabled(false);
        orchestrator = AnalysisOrchestrator.fromConfig(config);
        orchestrator.start();
        server = new DetectionServer(orchestrator, 2);
        server.start(0);
    }

    @AfterEach
    void tearDown() {
        server.stop();
        orchestrator.close();
    }

    @Test
    @DisplayName("Health and readiness endpoints should answer UP")
    void shouldAnswerHealth() throws Exception {
        HttpResponse<String> health = get("/health");
        HttpResponse<String> readiness = get("/readiness");

        assertThat(health.statusCode()).isEqualTo(200);
        assertThat(mapper.readTree(health.body()).get("status").asText()).isEqualTo("UP");
        assertThat(readiness.statusCode()).isEqualTo(200);
    }

    @Test
    @DisplayName("Should analyse a snippet and answer with a success envelope")
    void shouldAnalyse() throws Exception {
        HttpResponse<String> response = post("/api/v1/analyze",
                "{\"content\":\"const password = 'abc123';\",\"language\":\"javascript\",\"name\":\"app.js\"}");

        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode body = mapper.readTree(response.body());
        assertThat(body.get("success").asBoolean()).isTrue();
        assertThat(body.has("error")).isFalse();
        assertThat(body.get("result").get("riskLevel").asText()).isEqualTo("high");
        assertThat(body.get("result").get("detectedPatterns").toString()).contains("potential_secret");
    }

    @Test
    @DisplayName("Should reject a malformed body with 400")
    void shouldRejectMalformedBody() throws Exception {
        HttpResponse<String> response = post("/api/v1/analyze", "{not json");

        assertThat(response.statusCode()).isEqualTo(400);
        JsonNode body = mapper.readTree(response.body());
        assertThat(body.get("success").asBoolean()).isFalse();
        assertThat(body.get("error").asText()).contains("Malformed");
    }

    @Test
    @DisplayName("Should reject a request without language with 400")
    void shouldRejectMissingLanguage() throws Exception {
        HttpResponse<String> response = post("/api/v1/analyze", "{\"content\":\"int x = 1;\"}");

        assertThat(response.statusCode()).isEqualTo(400);
        assertThat(mapper.readTree(response.body()).get("error").asText()).contains("language");
    }

    @Test
    @DisplayName("Should answer 405 with an Allow header for the wrong method")
    void shouldRejectWrongMethod() throws Exception {
        HttpResponse<String> response = get("/api/v1/analyze");

        assertThat(response.statusCode()).isEqualTo(405);
        assertThat(response.headers().firstValue("Allow")).contains("POST");
    }

    @Test
    @DisplayName("Stats should reflect completed analyses")
    void shouldExposeStats() throws Exception {
        post("/api/v1/analyze", "{\"content\":\"fetch('http://localhost:3000')\",\"language\":\"javascript\"}");

        HttpResponse<String> response = get("/api/v1/stats");

        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode stats = mapper.readTree(response.body());
        assertThat(stats.get("securitySummary").get("total").asInt()).isEqualTo(1);
        assertThat(stats.get("cache").get("totalEntries").asInt()).isEqualTo(1);
        assertThat(stats.get("performance").get("byOperation").has("analyze_code")).isTrue();
    }

    @Test
    @DisplayName("Should report its bound port and stop cleanly")
    void shouldStopCleanly() {
        assertThat(server.isRunning()).isTrue();
        assertThat(server.getPort()).isPositive();

        server.stop();

        assertThat(server.isRunning()).isFalse();
        assertThatThrownBy(() -> get("/health")).isInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("Should reject invalid construction and ports")
    void shouldValidateArguments() {
        assertThatThrownBy(() -> new DetectionServer(orchestrator, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DetectionServer(orchestrator, 1).start(70_000))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private HttpResponse<String> get(String path) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(uri(path)).timeout(Duration.ofSeconds(5)).GET().build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String json) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(uri(path))
                .timeout(Duration.ofSeconds(5))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://localhost:" + server.getPort() + path);
    }
}
