package com.contextguard.core.detection;

import com.contextguard.core.config.RemoteSettings;
import com.contextguard.core.model.AnalysisRequest;
import com.contextguard.core.model.DetectionReport;
import com.contextguard.core.model.JsonMappers;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * HTTP client for the remote detection service.
 *
 * <p>
 * Speaks the two-call contract of the service: {@code GET /health} for
 * reachability and {@code POST /api/v1/analyze} for analysis. Any transport
 * error, non-2xx status, malformed body or {@code success=false} envelope is
 * reported as a {@link DetectionException}.
 * </p>
 *
 * <p>
 * Thread-safe: {@link HttpClient} and {@link ObjectMapper} are shared.
 * </p>
 *
 * @since 1.0.0
 */
public class RemoteDetector implements CodeDetector, HealthProbe {

    private static final Logger LOG = LoggerFactory.getLogger(RemoteDetector.class);

    static final String HEALTH_PATH = "/health";
    static final String ANALYZE_PATH = "/api/v1/analyze";

    private final String baseUrl;
    private final Duration requestTimeout;
    private final HttpClient httpClient;
    private final ObjectMapper mapper;

    public RemoteDetector(RemoteSettings settings) {
        this(settings, HttpClient.newBuilder()
                .connectTimeout(settings.probeTimeout())
                .build());
    }

    RemoteDetector(RemoteSettings settings, HttpClient httpClient) {
        Objects.requireNonNull(settings, "RemoteSettings must not be null");
        if (settings.getBaseUrl() == null || settings.getBaseUrl().isBlank()) {
            throw new IllegalArgumentException("Remote detector requires a base URL");
        }
        this.baseUrl = settings.getBaseUrl();
        this.requestTimeout = settings.requestTimeout();
        this.httpClient = Objects.requireNonNull(httpClient, "HttpClient must not be null");
        this.mapper = JsonMappers.create();
    }

    @Override
    public Optional<DetectionReport> detect(AnalysisRequest request) throws DetectionException {
        Objects.requireNonNull(request, "AnalysisRequest must not be null");

        byte[] body;
        try {
            body = mapper.writeValueAsBytes(RemoteAnalyzeRequest.from(request));
        } catch (JsonProcessingException e) {
            throw new DetectionException("Failed to serialize analyze request", e);
        }

        HttpRequest httpRequest = HttpRequest.newBuilder(URI.create(baseUrl + ANALYZE_PATH))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                .build();

        HttpResponse<String> response = send(httpRequest);
        if (response.statusCode() / 100 != 2) {
            throw new DetectionException("Remote service answered HTTP " + response.statusCode());
        }

        RemoteAnalyzeResponse envelope;
        try {
            envelope = mapper.readValue(response.body(), RemoteAnalyzeResponse.class);
        } catch (IOException e) {
            throw new DetectionException("Malformed response from remote service", e);
        }
        if (!envelope.isSuccess()) {
            throw new DetectionException("Remote analysis failed: "
                    + (envelope.getError() != null ? envelope.getError() : "no error given"));
        }
        if (envelope.getResult() == null) {
            throw new DetectionException("Remote service reported success without a result");
        }
        LOG.debug("Remote analysis returned risk={}", envelope.getResult().getRiskLevel());
        return Optional.of(envelope.getResult());
    }

    @Override
    public boolean isHealthy(Duration timeout) throws DetectionException {
        HttpRequest httpRequest = HttpRequest.newBuilder(URI.create(baseUrl + HEALTH_PATH))
                .timeout(timeout)
                .GET()
                .build();
        HttpResponse<String> response = send(httpRequest);
        boolean healthy = response.statusCode() == 200;
        LOG.debug("Remote health check at {} answered HTTP {}", baseUrl, response.statusCode());
        return healthy;
    }

    @Override
    public String getName() {
        return "remote";
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    private HttpResponse<String> send(HttpRequest httpRequest) throws DetectionException {
        try {
            return httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new DetectionException("Remote service unreachable at " + httpRequest.uri(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DetectionException("Interrupted while calling " + httpRequest.uri(), e);
        }
    }
}
