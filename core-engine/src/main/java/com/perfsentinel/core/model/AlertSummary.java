package com.perfsentinel.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregate view of a tenant's active alerts.
 *
 * <p>
 * {@link #getBySeverity()} always lists every {@link Severity}, zero counts
 * included, and partitions the same population that
 * {@code activeAlerts(tenant)} returns.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertSummary {

    private final int totalActive;
    private final Map<Severity, Integer> bySeverity;
    private final Map<String, Integer> byScope;
    private final Map<AnomalyType, Integer> byType;

    public AlertSummary(int totalActive, Map<Severity, Integer> bySeverity,
            Map<String, Integer> byScope, Map<AnomalyType, Integer> byType) {
        this.totalActive = totalActive;
        EnumMap<Severity, Integer> severities = new EnumMap<>(Severity.class);
        for (Severity s : Severity.values()) {
            severities.put(s, 0);
        }
        severities.putAll(Objects.requireNonNull(bySeverity, "bySeverity must not be null"));
        this.bySeverity = Collections.unmodifiableMap(severities);
        this.byScope = Collections.unmodifiableMap(
                new LinkedHashMap<>(Objects.requireNonNull(byScope, "byScope must not be null")));
        this.byType = Collections.unmodifiableMap(
                new LinkedHashMap<>(Objects.requireNonNull(byType, "byType must not be null")));
    }

    public int getTotalActive() {
        return totalActive;
    }

    public Map<Severity, Integer> getBySeverity() {
        return bySeverity;
    }

    public Map<String, Integer> getByScope() {
        return byScope;
    }

    public Map<AnomalyType, Integer> getByType() {
        return byType;
    }

    public int getCriticalCount() {
        return bySeverity.get(Severity.CRITICAL);
    }

    public int getHighCount() {
        return bySeverity.get(Severity.HIGH);
    }

    /**
     * @return {@code true} when at least one CRITICAL or HIGH alert is active
     */
    public boolean needsAttention() {
        return getCriticalCount() + getHighCount() > 0;
    }

    @Override
    public String toString() {
        return "AlertSummary{" +
                "totalActive=" + totalActive +
                ", bySeverity=" + bySeverity +
                ", byScope=" + byScope +
                ", byType=" + byType +
                ", needsAttention=" + needsAttention() +
                '}';
    }
}
