package com.driftsentinel.daemon;

import java.nio.file.Path;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Process settings of the daemon, read from environment variables.
 *
 * <p>
 * Only locations and the status port live here. Monitoring, detection and
 * alerting behaviour comes from the YAML file named by
 * {@link #getSentinelConfigPath()}. A relative snapshot path is resolved
 * against the project root.
 * </p>
 *
 * @since 1.0.0
 */
public final class DaemonConfig {

    public static final String ENV_PROJECT_PATH = "DRIFT_PROJECT_PATH";
    public static final String ENV_SENTINEL_CONFIG = "DRIFT_SENTINEL_CONFIG";
    public static final String ENV_SPECS_PATH = "DRIFT_SPECS_PATH";
    public static final String ENV_SIGNATURES_PATH = "DRIFT_SIGNATURES_PATH";
    public static final String ENV_ALERT_STORE = "DRIFT_ALERT_STORE";
    public static final String ENV_HEALTH_PORT = "HEALTH_PORT";

    static final String DEFAULT_SIGNATURES_PATH = ".drift/signatures.json";

    private final Path projectPath;
    private final String sentinelConfigPath;
    private final String specsPath;
    private final Path signaturesPath;
    private final String alertStorePath;
    private final int healthPort;

    private DaemonConfig(Builder b) {
        this.projectPath = b.projectPath;
        this.sentinelConfigPath = b.sentinelConfigPath;
        this.specsPath = b.specsPath;
        this.signaturesPath = b.signaturesPath;
        this.alertStorePath = b.alertStorePath;
        this.healthPort = b.healthPort;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link DaemonConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static DaemonConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    static DaemonConfig fromEnvironment(UnaryOperator<String> env) {
        Path project = Path.of(env(env, ENV_PROJECT_PATH, ".")).toAbsolutePath().normalize();
        Path signatures = Path.of(env(env, ENV_SIGNATURES_PATH, DEFAULT_SIGNATURES_PATH));
        try {
            return new Builder()
                    .projectPath(project)
                    .sentinelConfigPath(env(env, ENV_SENTINEL_CONFIG, ""))
                    .specsPath(env(env, ENV_SPECS_PATH, ""))
                    .signaturesPath(signatures.isAbsolute() ? signatures : project.resolve(signatures))
                    .alertStorePath(env(env, ENV_ALERT_STORE, ""))
                    .healthPort(Integer.parseInt(env(env, ENV_HEALTH_PORT, "8080")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Path getProjectPath() {
        return projectPath;
    }

    /**
     * @return YAML config file, or blank to use {@code drift-sentinel.yml} from
     *         the classpath
     */
    public String getSentinelConfigPath() {
        return sentinelConfigPath;
    }

    /**
     * @return specifications file, or blank to use {@code specifications.yml}
     *         from the classpath
     */
    public String getSpecsPath() {
        return specsPath;
    }

    public Path getSignaturesPath() {
        return signaturesPath;
    }

    /**
     * @return alert store file overriding {@code alerting.storePath}, or blank
     */
    public String getAlertStorePath() {
        return alertStorePath;
    }

    public int getHealthPort() {
        return healthPort;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link DaemonConfig}.
     *
     * <p>
     * The {@link #build()} method validates that a project and a signature
     * snapshot path are set and that the port is in [1, 65535].
     * </p>
     */
    public static class Builder {
        private Path projectPath = Path.of(".");
        private String sentinelConfigPath = "";
        private String specsPath = "";
        private Path signaturesPath = Path.of(DEFAULT_SIGNATURES_PATH);
        private String alertStorePath = "";
        private int healthPort = 8080;

        public Builder projectPath(Path v) {
            this.projectPath = v;
            return this;
        }

        public Builder sentinelConfigPath(String v) {
            this.sentinelConfigPath = v;
            return this;
        }

        public Builder specsPath(String v) {
            this.specsPath = v;
            return this;
        }

        public Builder signaturesPath(Path v) {
            this.signaturesPath = v;
            return this;
        }

        public Builder alertStorePath(String v) {
            this.alertStorePath = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link DaemonConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public DaemonConfig build() {
            Objects.requireNonNull(projectPath, "projectPath required");
            Objects.requireNonNull(signaturesPath, "signaturesPath required");
            sentinelConfigPath = sentinelConfigPath == null ? "" : sentinelConfigPath.trim();
            specsPath = specsPath == null ? "" : specsPath.trim();
            alertStorePath = alertStorePath == null ? "" : alertStorePath.trim();

            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [1, 65535], got: " + healthPort);
            }

            return new DaemonConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(UnaryOperator<String> env, String name, String defaultValue) {
        String value = env.apply(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "DaemonConfig{" +
                "projectPath=" + projectPath +
                ", sentinelConfigPath='" + sentinelConfigPath + '\'' +
                ", specsPath='" + specsPath + '\'' +
                ", signaturesPath=" + signaturesPath +
                ", alertStorePath='" + alertStorePath + '\'' +
                ", healthPort=" + healthPort +
                '}';
    }
}
