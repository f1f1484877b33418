package com.perfsentinel.core.persistence;

import com.perfsentinel.core.model.AnomalyAlert;

import java.util.List;

/**
 * Durable storage for alert rows, owned outside the engine.
 *
 * @since 1.0.0
 */
public interface AlertStore {

    /**
     * Read every alert whose {@code resolvedAt} is unset. Called once at
     * startup, before ingestion begins.
     *
     * @return unresolved alerts; never {@code null}
     */
    List<AnomalyAlert> loadUnresolved();

    /**
     * Insert or replace the row with the alert's id.
     *
     * @param alert the alert as it stands after a transition
     */
    void save(AnomalyAlert alert);
}
