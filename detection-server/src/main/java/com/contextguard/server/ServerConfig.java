package com.contextguard.server;

import java.util.Objects;
import java.util.Optional;

/**
 * Typed, immutable configuration of the detection server process.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults,
 * so the server is configurable through container env vars or a shell
 * environment.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic and test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class ServerConfig {

    public static final String ENV_PORT = "GUARD_SERVER_PORT";
    public static final String ENV_CONFIG_PATH = "CONTEXT_GUARD_CONFIG";
    public static final String ENV_HISTORY_PATH = "GUARD_HISTORY_PATH";
    public static final String ENV_WORKER_THREADS = "GUARD_SERVER_THREADS";

    private final int port;
    private final String configPath;
    private final String historyPath;
    private final int workerThreads;

    private ServerConfig(Builder b) {
        this.port = b.port;
        this.configPath = b.configPath;
        this.historyPath = b.historyPath;
        this.workerThreads = b.workerThreads;
    }

    /**
     * Build a {@link ServerConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static ServerConfig fromEnvironment() {
        try {
            return new Builder()
                    .port(Integer.parseInt(env(ENV_PORT, "8080")))
                    .configPath(env(ENV_CONFIG_PATH, null))
                    .historyPath(env(ENV_HISTORY_PATH, null))
                    .workerThreads(Integer.parseInt(env(ENV_WORKER_THREADS, "4")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    public int getPort() {
        return port;
    }

    public Optional<String> getConfigPath() {
        return Optional.ofNullable(configPath);
    }

    public Optional<String> getHistoryPath() {
        return Optional.ofNullable(historyPath);
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    /**
     * Fluent builder for {@link ServerConfig}.
     *
     * <p>
     * {@link #build()} checks the port is in [1, 65535] and the worker
     * thread count is positive. Blank paths are treated as absent.
     * </p>
     */
    public static class Builder {
        private int port = 8080;
        private String configPath;
        private String historyPath;
        private int workerThreads = 4;

        public Builder port(int v) {
            this.port = v;
            return this;
        }

        public Builder configPath(String v) {
            this.configPath = blankToNull(v);
            return this;
        }

        public Builder historyPath(String v) {
            this.historyPath = blankToNull(v);
            return this;
        }

        public Builder workerThreads(int v) {
            this.workerThreads = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link ServerConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public ServerConfig build() {
            if (port < 1 || port > 65_535) {
                throw new IllegalArgumentException("port must be in [1, 65535], got: " + port);
            }
            if (workerThreads < 1) {
                throw new IllegalArgumentException("workerThreads must be >= 1, got: " + workerThreads);
            }
            return new ServerConfig(this);
        }

        private static String blankToNull(String value) {
            return value == null || value.isBlank() ? null : value;
        }
    }

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "ServerConfig{" +
                "port=" + port +
                ", configPath='" + configPath + '\'' +
                ", historyPath='" + historyPath + '\'' +
                ", workerThreads=" + workerThreads +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ServerConfig that))
            return false;
        return port == that.port && workerThreads == that.workerThreads
                && Objects.equals(configPath, that.configPath)
                && Objects.equals(historyPath, that.historyPath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(port, configPath, historyPath, workerThreads);
    }
}
