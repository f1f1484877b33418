package com.perfsentinel.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.perfsentinel.core.config.ThresholdOverride;
import com.perfsentinel.core.config.ThresholdValidationException;
import com.perfsentinel.core.persistence.ThresholdStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link ThresholdStore} keeping one row per
 * {@code (tenant, scope, anomaly type)} in a JSON file.
 *
 * <p>
 * Rows that no longer validate are skipped on load with a warning, so one
 * hand-edited row cannot keep the process from starting.
 * </p>
 *
 * @since 1.0.0
 */
public class JsonFileThresholdStore implements ThresholdStore {

    private static final Logger LOG = LoggerFactory.getLogger(JsonFileThresholdStore.class);

    private final Path file;
    private final ObjectMapper mapper = JsonFiles.newMapper();
    private final Map<String, ThresholdRow> rows = new LinkedHashMap<>();

    /**
     * @param file JSON file; created on first save if missing
     * @throws java.io.UncheckedIOException if an existing file cannot be read
     */
    public JsonFileThresholdStore(Path file) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        for (ThresholdRow row : JsonFiles.readList(mapper, file, ThresholdRow.class)) {
            rows.put(keyOf(row), row);
        }
        LOG.info("Threshold store [{}] opened with {} row(s)", file, rows.size());
    }

    @Override
    public synchronized List<ThresholdOverride> loadAll() {
        List<ThresholdOverride> result = new ArrayList<>(rows.size());
        for (ThresholdRow row : rows.values()) {
            try {
                result.add(row.toOverride());
            } catch (ThresholdValidationException e) {
                LOG.warn("Skipping unusable threshold row [{}]: {}", row.getId(), e.getMessage());
            }
        }
        return result;
    }

    @Override
    public synchronized void save(ThresholdOverride override) {
        Objects.requireNonNull(override, "override must not be null");
        ThresholdRow row = ThresholdRow.from(override);
        String key = keyOf(row);
        ThresholdRow previous = rows.put(key, row);
        try {
            JsonFiles.writeAtomically(mapper, file, new ArrayList<>(rows.values()));
        } catch (RuntimeException e) {
            if (previous != null) {
                rows.put(key, previous);
            } else {
                rows.remove(key);
            }
            throw e;
        }
        LOG.debug("Threshold row [{}] saved for {}", row.getId(), key);
    }

    private static String keyOf(ThresholdRow row) {
        return row.getTenantId() + "|" + (row.getScopeId() != null ? row.getScopeId() : "*")
                + "|" + row.getAnomalyType();
    }
}
