package com.contextguard.core.config;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.List;

/**
 * Settings of the remote detection tier.
 *
 * <p>
 * The remote tier is only consulted when {@code enabled} is set and the
 * circuit breaker reports the service reachable. Reachability is re-probed
 * every {@code probeIntervalMillis}, each probe bounded by
 * {@code probeTimeoutMillis}.
 * </p>
 *
 * @since 1.0.0
 */
public class RemoteSettings {

    private boolean enabled = false;
    private String baseUrl = "http://localhost:8080";
    private long probeIntervalMillis = 5L * 60 * 1000;
    private long probeTimeoutMillis = 2000;
    private long requestTimeoutMillis = 10_000;

    void validate(List<String> errors) {
        if (baseUrl == null || baseUrl.isBlank()) {
            errors.add("remote.baseUrl is required");
        } else {
            try {
                URI uri = new URI(baseUrl);
                if (uri.getScheme() == null || uri.getHost() == null) {
                    errors.add("remote.baseUrl must be an absolute http(s) URL, got: " + baseUrl);
                }
            } catch (URISyntaxException e) {
                errors.add("remote.baseUrl is not a valid URL: " + baseUrl);
            }
        }
        if (probeIntervalMillis <= 0) {
            errors.add("remote.probeIntervalMillis must be > 0, got: " + probeIntervalMillis);
        }
        if (probeTimeoutMillis <= 0) {
            errors.add("remote.probeTimeoutMillis must be > 0, got: " + probeTimeoutMillis);
        }
        if (requestTimeoutMillis <= 0) {
            errors.add("remote.requestTimeoutMillis must be > 0, got: " + requestTimeoutMillis);
        }
    }

    public Duration probeInterval() {
        return Duration.ofMillis(probeIntervalMillis);
    }

    public Duration probeTimeout() {
        return Duration.ofMillis(probeTimeoutMillis);
    }

    public Duration requestTimeout() {
        return Duration.ofMillis(requestTimeoutMillis);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    /**
     * Set the service base URL; a trailing slash is removed.
     *
     * @param baseUrl base URL, e.g. {@code http://localhost:8080}
     */
    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl != null && baseUrl.endsWith("/")
                ? baseUrl.substring(0, baseUrl.length() - 1)
                : baseUrl;
    }

    public long getProbeIntervalMillis() {
        return probeIntervalMillis;
    }

    public void setProbeIntervalMillis(long probeIntervalMillis) {
        this.probeIntervalMillis = probeIntervalMillis;
    }

    public long getProbeTimeoutMillis() {
        return probeTimeoutMillis;
    }

    public void setProbeTimeoutMillis(long probeTimeoutMillis) {
        this.probeTimeoutMillis = probeTimeoutMillis;
    }

    public long getRequestTimeoutMillis() {
        return requestTimeoutMillis;
    }

    public void setRequestTimeoutMillis(long requestTimeoutMillis) {
        this.requestTimeoutMillis = requestTimeoutMillis;
    }

    @Override
    public String toString() {
        return "RemoteSettings{" +
                "enabled=" + enabled +
                ", baseUrl='" + baseUrl + '\'' +
                ", probeIntervalMillis=" + probeIntervalMillis +
                ", probeTimeoutMillis=" + probeTimeoutMillis +
                '}';
    }
}
