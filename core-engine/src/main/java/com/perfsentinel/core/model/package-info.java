/**
 * Domain model classes for Perf Sentinel.
 *
 * <p>
 * Shared between history, detection, alerting and the persistence boundary:
 * </p>
 * <ul>
 * <li>{@link com.perfsentinel.core.model.MetricSample} and
 * {@link com.perfsentinel.core.model.SeriesKey} — time-series data</li>
 * <li>{@link com.perfsentinel.core.model.AnomalyCandidate} — a positive
 * detection</li>
 * <li>{@link com.perfsentinel.core.model.AnomalyAlert} — a tracked alert,
 * keyed for dedup by {@link com.perfsentinel.core.model.DedupKey}</li>
 * <li>{@link com.perfsentinel.core.model.AlertSummary} — per-tenant
 * aggregates</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.perfsentinel.core.model;
