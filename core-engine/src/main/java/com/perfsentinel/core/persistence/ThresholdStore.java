package com.perfsentinel.core.persistence;

import com.perfsentinel.core.config.ThresholdOverride;

import java.util.List;

/**
 * Durable storage for threshold override rows, owned outside the engine.
 *
 * <p>
 * Rows carry an enabled flag; disabling never deletes a row.
 * </p>
 *
 * @since 1.0.0
 */
public interface ThresholdStore {

    /**
     * @return every persisted override, enabled or not; never {@code null}
     */
    List<ThresholdOverride> loadAll();

    /**
     * Insert or replace the row for the override's
     * {@code (tenant, scope, anomaly type)}.
     */
    void save(ThresholdOverride override);
}
