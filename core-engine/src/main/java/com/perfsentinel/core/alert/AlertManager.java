package com.perfsentinel.core.alert;

import com.perfsentinel.core.model.AlertSummary;
import com.perfsentinel.core.model.AnomalyAlert;
import com.perfsentinel.core.model.AnomalyCandidate;
import com.perfsentinel.core.model.AnomalyType;
import com.perfsentinel.core.model.DedupKey;
import com.perfsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the alert table and every alert lifecycle transition.
 *
 * <h3>States</h3>
 * <p>
 * ACTIVE ({@code resolvedAt} unset, optionally acknowledged) and RESOLVED
 * (terminal). A candidate for a dedup key whose alert is resolved opens a
 * brand-new alert; the resolved one is kept for audit.
 * </p>
 *
 * <h3>Indexes</h3>
 * <ul>
 * <li>{@code alerts}: id → alert, every alert ever held</li>
 * <li>{@code openByKey}: {@link DedupKey} → id of its unresolved alert, making
 * dedup lookup O(1)</li>
 * <li>{@code byTenant}: tenant → ids, so queries only touch one tenant's
 * alerts</li>
 * </ul>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Upserts for one dedup key are serialized by {@code openByKey.compute},
 * which locks only that key. Field updates on an alert happen under the
 * alert's own monitor. Nothing outside this class ever sees an owned
 * instance: every method returns copies.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertManager {

    private static final Logger LOG = LoggerFactory.getLogger(AlertManager.class);

    /** CRITICAL first, then freshest first. */
    static final Comparator<AnomalyAlert> URGENCY_ORDER =
            Comparator.comparing(AnomalyAlert::getSeverity, Severity.MOST_URGENT_FIRST)
                    .thenComparing(AnomalyAlert::getDetectedAt, Comparator.reverseOrder());

    private static final Comparator<AnomalyAlert> NEWEST_FIRST =
            Comparator.comparing(AnomalyAlert::getDetectedAt, Comparator.reverseOrder());

    private final Clock clock;
    private final AlertListener listener;

    private final Map<String, AnomalyAlert> alerts = new ConcurrentHashMap<>();
    private final Map<DedupKey, String> openByKey = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> byTenant = new ConcurrentHashMap<>();

    public AlertManager(Clock clock, AlertListener listener) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
    }

    public AlertManager(Clock clock) {
        this(clock, AlertListener.NO_OP);
    }

    // ---------------------------------------------------------------
    // Transitions
    // ---------------------------------------------------------------

    /**
     * Open a new alert for {@code key}, or fold the candidate into the
     * unresolved alert already open for it.
     *
     * <p>
     * On update, current value, baseline, change, severity, z-score and
     * detection time are overwritten in place; the id and the acknowledged
     * flag are kept.
     * </p>
     *
     * @param candidate detection outcome; must not be {@code null}
     * @param key       dedup key; its anomaly type must match the candidate's
     * @return copy of the created or updated alert
     * @throws IllegalArgumentException if the anomaly types differ
     */
    public AnomalyAlert upsert(AnomalyCandidate candidate, DedupKey key) {
        Objects.requireNonNull(candidate, "candidate must not be null");
        Objects.requireNonNull(key, "key must not be null");
        if (candidate.getAnomalyType() != key.getAnomalyType()) {
            throw new IllegalArgumentException("Candidate type " + candidate.getAnomalyType()
                    + " does not match dedup key type " + key.getAnomalyType());
        }

        AnomalyAlert[] result = new AnomalyAlert[1];
        boolean[] created = new boolean[1];

        openByKey.compute(key, (k, openId) -> {
            AnomalyAlert open = openId != null ? alerts.get(openId) : null;
            if (open != null) {
                synchronized (open) {
                    if (open.isActive()) {
                        apply(open, candidate);
                        result[0] = open.copy();
                        listener.onChange(result[0]);
                        return openId;
                    }
                }
            }
            AnomalyAlert fresh = newAlert(candidate, k);
            synchronized (fresh) {
                alerts.put(fresh.getId(), fresh);
                byTenant.computeIfAbsent(k.getTenantId(), t -> ConcurrentHashMap.newKeySet()).add(fresh.getId());
                result[0] = fresh.copy();
                created[0] = true;
                listener.onChange(result[0]);
            }
            return fresh.getId();
        });

        AnomalyAlert alert = result[0];
        if (created[0]) {
            LOG.warn("Anomaly detected: type={} scope={} change={}% severity={} alert={}",
                    alert.getAnomalyType(), alert.getScopeId(),
                    String.format("%.1f", alert.getChangePercent()), alert.getSeverity(), alert.getId());
        } else {
            LOG.debug("Alert [{}] updated: severity={} change={}%", alert.getId(),
                    alert.getSeverity(), String.format("%.1f", alert.getChangePercent()));
        }
        return alert;
    }

    /**
     * Flag an alert as seen. Severity, values and resolution are untouched.
     *
     * @return {@code true} if the flag changed; {@code false} if the alert
     *         was already acknowledged or is resolved
     * @throws AlertNotFoundException if the id is unknown
     */
    public boolean acknowledge(String alertId) {
        AnomalyAlert alert = require(alertId);
        AnomalyAlert snapshot;
        synchronized (alert) {
            if (!alert.isActive() || alert.isAcknowledged()) {
                return false;
            }
            alert.setAcknowledged(true);
            snapshot = alert.copy();
            listener.onChange(snapshot);
        }
        LOG.info("Alert [{}] acknowledged", snapshot.getId());
        return true;
    }

    /**
     * Resolve an alert. Terminal: a later candidate for the same dedup key
     * opens a new alert.
     *
     * @param notes optional resolution notes, may be {@code null}
     * @return {@code true} if the alert was resolved by this call;
     *         {@code false} if it was already resolved
     * @throws AlertNotFoundException if the id is unknown
     */
    public boolean resolve(String alertId, String notes) {
        boolean resolved = resolveOwned(require(alertId), notes, clock.instant());
        if (resolved) {
            LOG.info("Alert [{}] resolved", alertId);
        }
        return resolved;
    }

    /**
     * Resolve every unresolved alert of a tenant, optionally limited to one
     * scope, in one pass.
     *
     * @param scopeId scope filter, may be {@code null} for all scopes
     * @param notes   resolution notes, may be {@code null}
     * @return number of alerts resolved
     */
    public int batchResolve(String tenantId, String scopeId, String notes) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        Instant now = clock.instant();
        int count = 0;
        for (AnomalyAlert alert : owned(tenantId)) {
            if (scopeId != null && !scopeId.equals(alert.getScopeId())) {
                continue;
            }
            if (resolveOwned(alert, notes, now)) {
                count++;
            }
        }
        LOG.info("Batch-resolved {} alert(s) for tenant [{}] scope [{}]", count, tenantId,
                scopeId != null ? scopeId : "*");
        return count;
    }

    /**
     * Load persisted alerts at startup.
     *
     * <p>
     * Unresolved alerts are indexed for dedup. When the store holds more than
     * one unresolved alert for a key, the most recently detected one is
     * indexed and the others stay listed as active until resolved.
     * </p>
     *
     * @return number of alerts loaded
     */
    public int restore(Collection<AnomalyAlert> persisted) {
        Objects.requireNonNull(persisted, "persisted alerts must not be null");
        int loaded = 0;
        for (AnomalyAlert row : persisted) {
            AnomalyAlert alert = row.copy();
            alerts.put(alert.getId(), alert);
            byTenant.computeIfAbsent(alert.getTenantId(), t -> ConcurrentHashMap.newKeySet()).add(alert.getId());
            loaded++;
            if (!alert.isActive()) {
                continue;
            }
            openByKey.merge(DedupKey.of(alert), alert.getId(), (currentId, candidateId) -> {
                AnomalyAlert current = alerts.get(currentId);
                LOG.warn("Duplicate unresolved alerts [{}] and [{}] for {}", currentId, candidateId,
                        DedupKey.of(alert));
                return alert.getDetectedAt().isAfter(current.getDetectedAt()) ? candidateId : currentId;
            });
        }
        LOG.info("Restored {} alert(s), {} open", loaded, openByKey.size());
        return loaded;
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    public Optional<AnomalyAlert> find(String alertId) {
        AnomalyAlert alert = alerts.get(Objects.requireNonNull(alertId, "alertId must not be null"));
        return alert == null ? Optional.empty() : Optional.of(snapshot(alert));
    }

    /**
     * Unresolved alerts, most urgent and freshest first.
     *
     * @param scopeId  scope filter, may be {@code null}
     * @param severity severity filter, may be {@code null}
     */
    public List<AnomalyAlert> activeAlerts(String tenantId, String scopeId, Severity severity) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        List<AnomalyAlert> result = new ArrayList<>();
        for (AnomalyAlert alert : owned(tenantId)) {
            AnomalyAlert s = snapshot(alert);
            if (s.isActive()
                    && (scopeId == null || scopeId.equals(s.getScopeId()))
                    && (severity == null || severity == s.getSeverity())) {
                result.add(s);
            }
        }
        result.sort(URGENCY_ORDER);
        return result;
    }

    public List<AnomalyAlert> activeAlerts(String tenantId, String scopeId, Severity severity, int limit) {
        return truncate(activeAlerts(tenantId, scopeId, severity), limit);
    }

    /**
     * Active and resolved alerts detected at or after {@code since}, newest
     * first.
     *
     * @param scopeId scope filter, may be {@code null}
     */
    public List<AnomalyAlert> history(String tenantId, String scopeId, Instant since, int limit) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        Objects.requireNonNull(since, "since must not be null");
        List<AnomalyAlert> result = new ArrayList<>();
        for (AnomalyAlert alert : owned(tenantId)) {
            AnomalyAlert s = snapshot(alert);
            if ((scopeId == null || scopeId.equals(s.getScopeId())) && !s.getDetectedAt().isBefore(since)) {
                result.add(s);
            }
        }
        result.sort(NEWEST_FIRST);
        return truncate(result, limit);
    }

    /**
     * Aggregate counts over {@code activeAlerts(tenantId, null, null)}.
     */
    public AlertSummary summary(String tenantId) {
        List<AnomalyAlert> active = activeAlerts(tenantId, null, null);

        Map<Severity, Integer> bySeverity = new EnumMap<>(Severity.class);
        Map<String, Integer> byScope = new LinkedHashMap<>();
        Map<AnomalyType, Integer> byType = new EnumMap<>(AnomalyType.class);
        for (AnomalyAlert alert : active) {
            bySeverity.merge(alert.getSeverity(), 1, Integer::sum);
            byScope.merge(alert.getScopeId(), 1, Integer::sum);
            byType.merge(alert.getAnomalyType(), 1, Integer::sum);
        }
        return new AlertSummary(active.size(), bySeverity, byScope, byType);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private boolean resolveOwned(AnomalyAlert alert, String notes, Instant at) {
        AnomalyAlert snapshot;
        synchronized (alert) {
            if (!alert.isActive()) {
                return false;
            }
            alert.setResolvedAt(at);
            if (notes != null) {
                alert.setNotes(notes);
            }
            snapshot = alert.copy();
            listener.onChange(snapshot);
        }
        openByKey.remove(DedupKey.of(snapshot), snapshot.getId());
        return true;
    }

    private AnomalyAlert newAlert(AnomalyCandidate candidate, DedupKey key) {
        return AnomalyAlert.builder()
                .id(UUID.randomUUID().toString())
                .tenantId(key.getTenantId())
                .scopeId(key.getScopeId())
                .campaignId(key.getCampaignId())
                .keywordId(key.getKeywordId())
                .anomalyType(candidate.getAnomalyType())
                .severity(candidate.getSeverity())
                .metricName(candidate.getMetricName())
                .currentValue(candidate.getCurrentValue())
                .baselineValue(candidate.getBaselineValue())
                .changePercent(candidate.getChangePercent())
                .zScore(candidate.getZScore())
                .detectedAt(candidate.getObservedAt())
                .build();
    }

    private static void apply(AnomalyAlert alert, AnomalyCandidate candidate) {
        alert.setCurrentValue(candidate.getCurrentValue());
        alert.setBaselineValue(candidate.getBaselineValue());
        alert.setChangePercent(candidate.getChangePercent());
        alert.setSeverity(candidate.getSeverity());
        alert.setZScore(candidate.getZScore());
        alert.setDetectedAt(candidate.getObservedAt());
    }

    private AnomalyAlert require(String alertId) {
        Objects.requireNonNull(alertId, "alertId must not be null");
        AnomalyAlert alert = alerts.get(alertId);
        if (alert == null) {
            throw new AlertNotFoundException(alertId);
        }
        return alert;
    }

    private List<AnomalyAlert> owned(String tenantId) {
        Set<String> ids = byTenant.get(tenantId);
        if (ids == null) {
            return List.of();
        }
        List<AnomalyAlert> result = new ArrayList<>(ids.size());
        for (String id : ids) {
            AnomalyAlert alert = alerts.get(id);
            if (alert != null) {
                result.add(alert);
            }
        }
        return result;
    }

    private static AnomalyAlert snapshot(AnomalyAlert alert) {
        synchronized (alert) {
            return alert.copy();
        }
    }

    private static List<AnomalyAlert> truncate(List<AnomalyAlert> alerts, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0, got: " + limit);
        }
        return alerts.size() <= limit ? alerts : new ArrayList<>(alerts.subList(0, limit));
    }
}
