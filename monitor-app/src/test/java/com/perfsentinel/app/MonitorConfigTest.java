package com.perfsentinel.app;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MonitorConfig}.
 */
class MonitorConfigTest {

    @Test
    @DisplayName("Builder should apply defaults")
    void shouldApplyDefaults() {
        MonitorConfig config = new MonitorConfig.Builder().build();

        assertThat(config.getHealthPort()).isEqualTo(8080);
        assertThat(config.getPersistenceThreads()).isEqualTo(1);
        assertThat(config.getAlertStorePath()).isEqualTo("data/alerts.json");
        assertThat(config.getThresholdStorePath()).isEqualTo("data/thresholds.json");
        assertThat(config.getDetectionConfigPath()).isEmpty();
    }

    @Test
    @DisplayName("Should reject an out-of-range port")
    void shouldRejectBadPort() {
        assertThatThrownBy(() -> new MonitorConfig.Builder().healthPort(70_000).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("healthPort");
    }

    @Test
    @DisplayName("Should reject an empty writer pool")
    void shouldRejectZeroThreads() {
        assertThatThrownBy(() -> new MonitorConfig.Builder().persistenceThreads(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("persistenceThreads");
    }

    @Test
    @DisplayName("Should reject blank or shared store paths")
    void shouldRejectBadStorePaths() {
        assertThatThrownBy(() -> new MonitorConfig.Builder().alertStorePath(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("alertStorePath");
        assertThatThrownBy(() -> new MonitorConfig.Builder()
                .alertStorePath("store.json").thresholdStorePath("store.json").build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
