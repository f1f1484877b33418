package com.perfsentinel.app;

import com.perfsentinel.core.config.ThresholdConfig;
import com.perfsentinel.core.config.ThresholdOverride;
import com.perfsentinel.core.model.AnomalyType;
import com.perfsentinel.core.model.AutoAction;
import com.perfsentinel.core.model.Direction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link JsonFileThresholdStore}.
 */
class JsonFileThresholdStoreTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @TempDir
    Path dir;

    @Test
    @DisplayName("Saved overrides should reload with every field intact")
    void shouldRoundTripOverride() {
        Path file = dir.resolve("thresholds.json");
        ThresholdOverride override = override("t-1", "naver", true);
        new JsonFileThresholdStore(file).save(override);

        List<ThresholdOverride> loaded = new JsonFileThresholdStore(file).loadAll();

        assertThat(loaded).containsExactly(override);
        ThresholdConfig config = loaded.get(0).getConfig();
        assertThat(config.getLookback()).isEqualTo(Duration.ofHours(12));
        assertThat(config.getAutoAction()).isEqualTo(AutoAction.PAUSE_KEYWORD);
    }

    @Test
    @DisplayName("One row per tenant, scope and type; a tenant-wide row is separate")
    void shouldKeepOneRowPerKey() {
        JsonFileThresholdStore store = new JsonFileThresholdStore(dir.resolve("thresholds.json"));
        store.save(override("t-1", "naver", true));
        store.save(override("t-2", "naver", false));
        store.save(override("t-3", null, true));

        assertThat(store.loadAll())
                .extracting(ThresholdOverride::getId)
                .containsExactlyInAnyOrder("t-2", "t-3");
    }

    @Test
    @DisplayName("Should persist the enabled flag as is_enabled")
    void shouldWriteEnabledFlag() throws IOException {
        Path file = dir.resolve("thresholds.json");
        new JsonFileThresholdStore(file).save(override("t-1", "naver", false));

        assertThat(Files.readString(file))
                .contains("\"is_enabled\" : false")
                .contains("\"lookback_hours\" : 12");
    }

    @Test
    @DisplayName("Rows that no longer validate should be skipped")
    void shouldSkipInvalidRows() throws IOException {
        Path file = dir.resolve("thresholds.json");
        Files.writeString(file, "[ {"
                + "\"id\" : \"bad\", \"tenant_id\" : \"tenant-1\", \"anomaly_type\" : \"CPC_SPIKE\","
                + "\"metric\" : \"cpc\", \"low\" : 0.5, \"medium\" : 0.4, \"high\" : 0.6, \"critical\" : 1.0,"
                + "\"direction\" : \"UP\", \"lookback_hours\" : 24, \"auto_action\" : \"NONE\","
                + "\"is_enabled\" : true, \"updated_at\" : \"2024-03-01T12:00:00Z\""
                + "} ]");

        assertThat(new JsonFileThresholdStore(file).loadAll()).isEmpty();
    }

    @Test
    @DisplayName("Rows missing an identifying field should be skipped while valid rows load")
    void shouldSkipRowsMissingTenant() throws IOException {
        Path file = dir.resolve("thresholds.json");
        String fields = "\"anomaly_type\" : \"CPC_SPIKE\", \"metric\" : \"cpc\","
                + "\"low\" : 0.1, \"medium\" : 0.25, \"high\" : 0.5, \"critical\" : 0.9,"
                + "\"direction\" : \"UP\", \"lookback_hours\" : 12, \"auto_action\" : \"NONE\","
                + "\"is_enabled\" : true, \"updated_at\" : \"2024-03-01T12:00:00Z\"";
        Files.writeString(file, "[ {"
                + "\"id\" : \"orphan\", " + fields
                + "}, {"
                + "\"id\" : \"good\", \"tenant_id\" : \"tenant-1\", \"scope_id\" : \"naver\", " + fields
                + "} ]");

        List<ThresholdOverride> loaded = new JsonFileThresholdStore(file).loadAll();

        assertThat(loaded).extracting(ThresholdOverride::getId).containsExactly("good");
    }

    private static ThresholdOverride override(String id, String scope, boolean enabled) {
        ThresholdConfig config = ThresholdConfig.builder()
                .metric("cpc")
                .cutoffs(0.1, 0.25, 0.5, 0.9)
                .direction(Direction.UP)
                .lookbackHours(12)
                .autoAction(AutoAction.PAUSE_KEYWORD)
                .build();
        return new ThresholdOverride(id, "tenant-1", scope, AnomalyType.CPC_SPIKE, config, enabled, NOW);
    }
}
