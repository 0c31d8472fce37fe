package com.contextguard.server;

import com.contextguard.core.config.GuardConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ServerConfig} and the server's config loading.
 */
class ServerConfigTest {

    @Test
    @DisplayName("Builder defaults should match the documented defaults")
    void shouldApplyDefaults() {
        ServerConfig config = new ServerConfig.Builder().build();

        assertThat(config.getPort()).isEqualTo(8080);
        assertThat(config.getWorkerThreads()).isEqualTo(4);
        assertThat(config.getConfigPath()).isEmpty();
        assertThat(config.getHistoryPath()).isEmpty();
    }

    @Test
    @DisplayName("Blank paths should be treated as absent")
    void shouldTreatBlankPathsAsAbsent() {
        ServerConfig config = new ServerConfig.Builder()
                .configPath("  ")
                .historyPath("/var/lib/guard/history.json")
                .build();

        assertThat(config.getConfigPath()).isEmpty();
        assertThat(config.getHistoryPath()).contains("/var/lib/guard/history.json");
    }

    @Test
    @DisplayName("Should reject out-of-range values")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> new ServerConfig.Builder().port(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("port");
        assertThatThrownBy(() -> new ServerConfig.Builder().port(65_536).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ServerConfig.Builder().workerThreads(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("workerThreads");
    }

    @Test
    @DisplayName("Equal settings should give equal configs")
    void shouldImplementEquality() {
        ServerConfig a = new ServerConfig.Builder().port(9000).historyPath("h.json").build();
        ServerConfig b = new ServerConfig.Builder().port(9000).historyPath("h.json").build();

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(a).isNotEqualTo(new ServerConfig.Builder().port(9001).build());
    }

    @Test
    @DisplayName("The service should disable its own remote tier and apply the history path")
    void shouldPrepareGuardConfig(@TempDir Path tempDir) throws IOException {
        Path yaml = tempDir.resolve("guard.yml");
        Files.writeString(yaml, String.join("\n",
                "remote:",
                "  enabled: true",
                "  baseUrl: http://elsewhere:8080",
                "rules:",
                "  - name: pw",
                "    category: potential_secret",
                "    pattern: 'password'",
                "    severity: high",
                ""), StandardCharsets.UTF_8);
        Path history = tempDir.resolve("history.json");
        ServerConfig config = new ServerConfig.Builder()
                .configPath(yaml.toString())
                .historyPath(history.toString())
                .build();

        GuardConfig guardConfig = DetectionServerMain.loadGuardConfig(config);

        assertThat(guardConfig.getRemote().isEnabled()).isFalse();
        assertThat(guardConfig.getHistory().getPath()).isEqualTo(history.toString());
        assertThat(guardConfig.getRules()).hasSize(1);
    }
}
