package com.perfsentinel.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectionSettingsLoader}.
 */
class DetectionSettingsLoaderTest {

    @Test
    @DisplayName("Should load settings from classpath and keep defaults for missing keys")
    void shouldLoadFromClasspath() {
        DetectionSettings settings = DetectionSettingsLoader.fromClasspath("test-detection.yml");

        assertThat(settings.getHistoryCapacity()).isEqualTo(24);
        assertThat(settings.exclusionWindow()).isEqualTo(Duration.ofMinutes(30));
        assertThat(settings.getMinBaselinePoints()).isEqualTo(5);
        assertThat(settings.getDefaultAlertLimit()).isEqualTo(50);
        assertThat(settings.getHistoryDaysBack()).isEqualTo(30);
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> DetectionSettingsLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should reject invalid values listing every violation")
    void shouldRejectInvalidSettings() {
        assertThatThrownBy(() -> DetectionSettingsLoader.fromClasspath("invalid-detection.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("historyCapacity")
                .hasMessageContaining("minBaselinePoints");
    }

    @Test
    @DisplayName("Should reject duplicate keys")
    void shouldRejectDuplicateKeys() {
        assertThatThrownBy(() -> DetectionSettingsLoader.fromClasspath("duplicate-keys-detection.yml"))
                .isInstanceOf(YAMLException.class);
    }

    @Test
    @DisplayName("Should prefer an existing file over the classpath")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("detection.yml");
        Files.writeString(file, "historyCapacity: 12\ndefaultAlertLimit: 10\n");

        DetectionSettings settings = DetectionSettingsLoader.load(file.toString());

        assertThat(settings.getHistoryCapacity()).isEqualTo(12);
        assertThat(settings.getDefaultAlertLimit()).isEqualTo(10);
    }

    @Test
    @DisplayName("Should fall back to defaults for an empty document")
    void shouldUseDefaultsForEmptyFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("empty.yml");
        Files.writeString(file, "");

        DetectionSettings settings = DetectionSettingsLoader.fromFile(file.toString());

        assertThat(settings.getHistoryCapacity()).isEqualTo(168);
        assertThat(settings.exclusionWindow()).isEqualTo(Duration.ofHours(1));
    }

    @Test
    @DisplayName("Should fall back to the bundled resource when the path does not exist")
    void shouldFallBackToClasspath() {
        DetectionSettings settings = DetectionSettingsLoader.load("/no/such/detection.yml");

        assertThat(settings.getHistoryCapacity()).isEqualTo(168);
        assertThat(settings.getMinBaselinePoints()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should throw when an explicit file does not exist")
    void shouldThrowForMissingFile() {
        assertThatThrownBy(() -> DetectionSettingsLoader.fromFile("/no/such/detection.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }
}
