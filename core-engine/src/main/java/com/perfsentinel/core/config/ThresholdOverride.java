package com.perfsentinel.core.config;

import com.perfsentinel.core.model.AnomalyType;

import java.time.Instant;
import java.util.Objects;

/**
 * A tenant-specific threshold replacing the default for one anomaly type.
 *
 * <p>
 * {@code scopeId} may be {@code null}, in which case the override applies to
 * every scope of the tenant that has no scope-specific override. Disabling
 * keeps the row; the default applies again until it is re-enabled.
 * </p>
 *
 * @since 1.0.0
 */
public final class ThresholdOverride {

    private final String id;
    private final String tenantId;
    private final String scopeId;
    private final AnomalyType anomalyType;
    private final ThresholdConfig config;
    private final boolean enabled;
    private final Instant updatedAt;

    public ThresholdOverride(String id, String tenantId, String scopeId, AnomalyType anomalyType,
            ThresholdConfig config, boolean enabled, Instant updatedAt) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.tenantId = Objects.requireNonNull(tenantId, "tenantId must not be null");
        this.scopeId = scopeId;
        this.anomalyType = Objects.requireNonNull(anomalyType, "anomalyType must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.enabled = enabled;
        this.updatedAt = Objects.requireNonNull(updatedAt, "updatedAt must not be null");
    }

    ThresholdOverride withEnabled(boolean enabled, Instant at) {
        return new ThresholdOverride(id, tenantId, scopeId, anomalyType, config, enabled, at);
    }

    public String getId() {
        return id;
    }

    public String getTenantId() {
        return tenantId;
    }

    public String getScopeId() {
        return scopeId;
    }

    public AnomalyType getAnomalyType() {
        return anomalyType;
    }

    public ThresholdConfig getConfig() {
        return config;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ThresholdOverride that))
            return false;
        return enabled == that.enabled
                && id.equals(that.id)
                && tenantId.equals(that.tenantId)
                && Objects.equals(scopeId, that.scopeId)
                && anomalyType == that.anomalyType
                && config.equals(that.config)
                && updatedAt.equals(that.updatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, tenantId, scopeId, anomalyType, enabled);
    }

    @Override
    public String toString() {
        return "ThresholdOverride{" +
                "id='" + id + '\'' +
                ", tenantId='" + tenantId + '\'' +
                ", scopeId='" + scopeId + '\'' +
                ", anomalyType=" + anomalyType +
                ", enabled=" + enabled +
                ", config=" + config +
                '}';
    }
}
