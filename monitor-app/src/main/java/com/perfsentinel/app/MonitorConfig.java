package com.perfsentinel.app;

import java.util.Objects;

/**
 * Typed, immutable configuration of the monitor process.
 *
 * <p>
 * Values are resolved from environment variables with defaults, so the
 * process is configurable through container env vars or a shell
 * environment. Detection tunables live in {@code detection.yml}; see
 * {@link com.perfsentinel.core.config.DetectionSettingsLoader}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} in production, or the {@link Builder} in
 * tests. The builder validates at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class MonitorConfig {

    // ---------------------------------------------------------------
    // Persistence
    // ---------------------------------------------------------------
    private final String alertStorePath;
    private final String thresholdStorePath;
    private final int persistenceThreads;

    // ---------------------------------------------------------------
    // Detection settings
    // ---------------------------------------------------------------
    private final String detectionConfigPath;

    // ---------------------------------------------------------------
    // Health
    // ---------------------------------------------------------------
    private final int healthPort;

    private MonitorConfig(Builder b) {
        this.alertStorePath = b.alertStorePath;
        this.thresholdStorePath = b.thresholdStorePath;
        this.persistenceThreads = b.persistenceThreads;
        this.detectionConfigPath = b.detectionConfigPath;
        this.healthPort = b.healthPort;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link MonitorConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static MonitorConfig fromEnvironment() {
        try {
            return new Builder()
                    .alertStorePath(env("ALERT_STORE_PATH", "data/alerts.json"))
                    .thresholdStorePath(env("THRESHOLD_STORE_PATH", "data/thresholds.json"))
                    .persistenceThreads(parseIntEnv("PERSISTENCE_THREADS", "1"))
                    .detectionConfigPath(env("DETECTION_CONFIG_PATH", ""))
                    .healthPort(parseIntEnv("HEALTH_PORT", "8080"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getAlertStorePath() {
        return alertStorePath;
    }

    public String getThresholdStorePath() {
        return thresholdStorePath;
    }

    public int getPersistenceThreads() {
        return persistenceThreads;
    }

    /**
     * @return settings file path; blank means classpath resolution
     */
    public String getDetectionConfigPath() {
        return detectionConfigPath;
    }

    public int getHealthPort() {
        return healthPort;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link MonitorConfig}.
     *
     * <p>
     * {@link #build()} checks store paths are non-blank, the writer pool has
     * at least one thread and the port is in [1, 65535].
     * </p>
     */
    public static class Builder {
        private String alertStorePath = "data/alerts.json";
        private String thresholdStorePath = "data/thresholds.json";
        private int persistenceThreads = 1;
        private String detectionConfigPath = "";
        private int healthPort = 8080;

        public Builder alertStorePath(String v) {
            this.alertStorePath = v;
            return this;
        }

        public Builder thresholdStorePath(String v) {
            this.thresholdStorePath = v;
            return this;
        }

        public Builder persistenceThreads(int v) {
            this.persistenceThreads = v;
            return this;
        }

        public Builder detectionConfigPath(String v) {
            this.detectionConfigPath = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link MonitorConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public MonitorConfig build() {
            requireNonBlank(alertStorePath, "alertStorePath");
            requireNonBlank(thresholdStorePath, "thresholdStorePath");
            Objects.requireNonNull(detectionConfigPath, "detectionConfigPath required");

            if (alertStorePath.equals(thresholdStorePath)) {
                throw new IllegalArgumentException(
                        "alertStorePath and thresholdStorePath must differ, both are: " + alertStorePath);
            }
            if (persistenceThreads < 1) {
                throw new IllegalArgumentException(
                        "persistenceThreads must be >= 1, got: " + persistenceThreads);
            }
            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [1, 65535], got: " + healthPort);
            }

            return new MonitorConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue));
    }

    @Override
    public String toString() {
        return "MonitorConfig{" +
                "alertStorePath='" + alertStorePath + '\'' +
                ", thresholdStorePath='" + thresholdStorePath + '\'' +
                ", persistenceThreads=" + persistenceThreads +
                ", detectionConfigPath='" + detectionConfigPath + '\'' +
                ", healthPort=" + healthPort +
                '}';
    }
}
