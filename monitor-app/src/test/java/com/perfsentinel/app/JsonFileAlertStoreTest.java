package com.perfsentinel.app;

import com.perfsentinel.core.model.AnomalyAlert;
import com.perfsentinel.core.model.AnomalyType;
import com.perfsentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JsonFileAlertStore}.
 */
class JsonFileAlertStoreTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @TempDir
    Path dir;

    @Test
    @DisplayName("A missing file should load as empty")
    void shouldStartEmpty() {
        JsonFileAlertStore store = new JsonFileAlertStore(dir.resolve("alerts.json"));

        assertThat(store.loadUnresolved()).isEmpty();
    }

    @Test
    @DisplayName("Saved rows should survive reopening and only unresolved ones reload")
    void shouldPersistAcrossInstances() {
        Path file = dir.resolve("nested/alerts.json");
        JsonFileAlertStore store = new JsonFileAlertStore(file);
        AnomalyAlert open = alert("a-1", null);
        AnomalyAlert resolved = alert("a-2", NOW);
        store.save(open);
        store.save(resolved);

        JsonFileAlertStore reopened = new JsonFileAlertStore(file);

        List<AnomalyAlert> unresolved = reopened.loadUnresolved();
        assertThat(unresolved).containsExactly(open);
        assertThat(unresolved.get(0).getZScore()).isEqualTo(7.17);
        assertThat(unresolved.get(0).getDetectedAt()).isEqualTo(NOW);
        assertThat(reopened.loadAll()).hasSize(2);
    }

    @Test
    @DisplayName("Saving the same id should replace the row")
    void shouldUpsertById() {
        JsonFileAlertStore store = new JsonFileAlertStore(dir.resolve("alerts.json"));
        store.save(alert("a-1", null));
        AnomalyAlert acknowledged = alert("a-1", null);
        acknowledged.setAcknowledged(true);
        store.save(acknowledged);

        assertThat(store.loadAll()).hasSize(1);
        assertThat(store.loadUnresolved().get(0).isAcknowledged()).isTrue();
    }

    @Test
    @DisplayName("Rows should be written with snake_case names and ISO-8601 instants")
    void shouldWriteSnakeCase() throws IOException {
        Path file = dir.resolve("alerts.json");
        new JsonFileAlertStore(file).save(alert("a-1", null));

        String json = Files.readString(file);
        assertThat(json)
                .contains("\"tenant_id\"")
                .contains("\"anomaly_type\" : \"CPC_SPIKE\"")
                .contains("\"z_score\"")
                .contains("\"detected_at\" : \"2024-03-01T12:00:00Z\"")
                .doesNotContain("\"active\"");
    }

    @Test
    @DisplayName("An unreadable file should fail loudly")
    void shouldRejectCorruptFile() throws IOException {
        Path file = dir.resolve("alerts.json");
        Files.writeString(file, "{not json");

        assertThatThrownBy(() -> new JsonFileAlertStore(file))
                .isInstanceOf(UncheckedIOException.class);
    }

    private static AnomalyAlert alert(String id, Instant resolvedAt) {
        return AnomalyAlert.builder()
                .id(id)
                .tenantId("tenant-1")
                .scopeId("naver")
                .anomalyType(AnomalyType.CPC_SPIKE)
                .severity(Severity.HIGH)
                .metricName("cpc")
                .currentValue(1600)
                .baselineValue(987.5)
                .changePercent(62.03)
                .zScore(7.17)
                .detectedAt(NOW)
                .resolvedAt(resolvedAt)
                .build();
    }
}
