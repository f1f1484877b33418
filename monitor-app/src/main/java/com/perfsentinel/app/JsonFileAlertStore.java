package com.perfsentinel.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.perfsentinel.core.model.AnomalyAlert;
import com.perfsentinel.core.persistence.AlertStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link AlertStore} keeping every alert row, active or resolved, in one JSON
 * file.
 *
 * <p>
 * The file is read once on construction; each {@link #save} upserts the row
 * by id and rewrites the file atomically. Saves are serialized on this
 * instance.
 * </p>
 *
 * @since 1.0.0
 */
public class JsonFileAlertStore implements AlertStore {

    private static final Logger LOG = LoggerFactory.getLogger(JsonFileAlertStore.class);

    private final Path file;
    private final ObjectMapper mapper = JsonFiles.newMapper();
    private final Map<String, AnomalyAlert> rows = new LinkedHashMap<>();

    /**
     * @param file JSON file; created on first save if missing
     * @throws java.io.UncheckedIOException if an existing file cannot be read
     */
    public JsonFileAlertStore(Path file) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        for (AnomalyAlert row : JsonFiles.readList(mapper, file, AnomalyAlert.class)) {
            rows.put(row.getId(), row);
        }
        LOG.info("Alert store [{}] opened with {} row(s)", file, rows.size());
    }

    @Override
    public synchronized List<AnomalyAlert> loadUnresolved() {
        List<AnomalyAlert> result = new ArrayList<>();
        for (AnomalyAlert row : rows.values()) {
            if (row.isActive()) {
                result.add(row.copy());
            }
        }
        return result;
    }

    @Override
    public synchronized void save(AnomalyAlert alert) {
        Objects.requireNonNull(alert, "alert must not be null");
        AnomalyAlert previous = rows.put(alert.getId(), alert.copy());
        try {
            JsonFiles.writeAtomically(mapper, file, new ArrayList<>(rows.values()));
        } catch (RuntimeException e) {
            if (previous != null) {
                rows.put(alert.getId(), previous);
            } else {
                rows.remove(alert.getId());
            }
            throw e;
        }
        LOG.debug("Alert row [{}] saved", alert.getId());
    }

    /**
     * @return every stored row; test access only
     */
    synchronized List<AnomalyAlert> loadAll() {
        List<AnomalyAlert> result = new ArrayList<>(rows.size());
        for (AnomalyAlert row : rows.values()) {
            result.add(row.copy());
        }
        return result;
    }
}
