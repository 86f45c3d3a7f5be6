package com.driftsentinel.daemon;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DaemonConfig}.
 */
class DaemonConfigTest {

    @Test
    @DisplayName("Should fall back to defaults when no variables are set")
    void shouldUseDefaults() {
        DaemonConfig config = DaemonConfig.fromEnvironment(name -> null);

        Path cwd = Path.of(".").toAbsolutePath().normalize();
        assertThat(config.getProjectPath()).isEqualTo(cwd);
        assertThat(config.getSignaturesPath()).isEqualTo(cwd.resolve(".drift/signatures.json"));
        assertThat(config.getHealthPort()).isEqualTo(8080);
        assertThat(config.getSentinelConfigPath()).isEmpty();
        assertThat(config.getSpecsPath()).isEmpty();
        assertThat(config.getAlertStorePath()).isEmpty();
    }

    @Test
    @DisplayName("Should read every variable and resolve a relative snapshot path against the project")
    void shouldReadVariables() {
        Map<String, String> env = new HashMap<>();
        env.put(DaemonConfig.ENV_PROJECT_PATH, "/srv/app");
        env.put(DaemonConfig.ENV_SENTINEL_CONFIG, " /etc/drift/drift-sentinel.yml ");
        env.put(DaemonConfig.ENV_SPECS_PATH, "/etc/drift/specifications.yml");
        env.put(DaemonConfig.ENV_SIGNATURES_PATH, "build/signatures.json");
        env.put(DaemonConfig.ENV_ALERT_STORE, "/var/lib/drift/alerts.json");
        env.put(DaemonConfig.ENV_HEALTH_PORT, "9090");

        DaemonConfig config = DaemonConfig.fromEnvironment(env::get);

        assertThat(config.getProjectPath()).isEqualTo(Path.of("/srv/app").toAbsolutePath());
        assertThat(config.getSentinelConfigPath()).isEqualTo("/etc/drift/drift-sentinel.yml");
        assertThat(config.getSpecsPath()).isEqualTo("/etc/drift/specifications.yml");
        assertThat(config.getSignaturesPath())
                .isEqualTo(Path.of("/srv/app").toAbsolutePath().resolve("build/signatures.json"));
        assertThat(config.getAlertStorePath()).isEqualTo("/var/lib/drift/alerts.json");
        assertThat(config.getHealthPort()).isEqualTo(9090);
    }

    @Test
    @DisplayName("Should reject a port that is not a number")
    void shouldRejectUnparseablePort() {
        assertThatThrownBy(() -> DaemonConfig.fromEnvironment(
                name -> DaemonConfig.ENV_HEALTH_PORT.equals(name) ? "http" : null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Failed to parse numeric environment variable");
    }

    @Test
    @DisplayName("Should reject a port outside the valid range")
    void shouldRejectOutOfRangePort() {
        assertThatThrownBy(() -> DaemonConfig.fromEnvironment(
                name -> DaemonConfig.ENV_HEALTH_PORT.equals(name) ? "70000" : null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("healthPort must be in [1, 65535]");
    }
}
