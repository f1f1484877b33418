package com.perfsentinel.app;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.perfsentinel.core.config.ThresholdConfig;
import com.perfsentinel.core.config.ThresholdOverride;
import com.perfsentinel.core.config.ThresholdValidationException;
import com.perfsentinel.core.model.AnomalyType;
import com.perfsentinel.core.model.AutoAction;
import com.perfsentinel.core.model.Direction;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Persisted form of a {@link ThresholdOverride}: the threshold fields plus
 * the {@code is_enabled} flag.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ThresholdRow {

    private String id;
    private String tenantId;
    private String scopeId;
    private AnomalyType anomalyType;
    private String metric;
    private double low;
    private double medium;
    private double high;
    private double critical;
    private Direction direction;
    private long lookbackHours;
    private AutoAction autoAction;
    private boolean enabled;
    private Instant updatedAt;

    /** No-arg constructor required by Jackson. */
    public ThresholdRow() {
    }

    static ThresholdRow from(ThresholdOverride override) {
        ThresholdConfig config = override.getConfig();
        ThresholdRow row = new ThresholdRow();
        row.id = override.getId();
        row.tenantId = override.getTenantId();
        row.scopeId = override.getScopeId();
        row.anomalyType = override.getAnomalyType();
        row.metric = config.getMetric();
        row.low = config.getLow();
        row.medium = config.getMedium();
        row.high = config.getHigh();
        row.critical = config.getCritical();
        row.direction = config.getDirection();
        row.lookbackHours = config.getLookback().toHours();
        row.autoAction = config.getAutoAction();
        row.enabled = override.isEnabled();
        row.updatedAt = override.getUpdatedAt();
        return row;
    }

    /**
     * @throws com.perfsentinel.core.config.ThresholdValidationException if the
     *         stored values no longer validate
     */
    /**
     * @throws ThresholdValidationException if an identifying field is missing
     *         or the threshold values are invalid
     */
    ThresholdOverride toOverride() {
        List<String> errors = new ArrayList<>();
        if (id == null) {
            errors.add("'id' is required");
        }
        if (tenantId == null) {
            errors.add("'tenant_id' is required");
        }
        if (anomalyType == null) {
            errors.add("'anomaly_type' is required");
        }
        if (updatedAt == null) {
            errors.add("'updated_at' is required");
        }
        if (!errors.isEmpty()) {
            throw new ThresholdValidationException(errors);
        }
        ThresholdConfig config = ThresholdConfig.builder()
                .metric(metric)
                .cutoffs(low, medium, high, critical)
                .direction(direction)
                .lookbackHours(lookbackHours)
                .autoAction(autoAction)
                .build();
        return new ThresholdOverride(id, tenantId, scopeId, anomalyType, config, enabled, updatedAt);
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getTenantId() {
        return tenantId;
    }

    public void setTenantId(String tenantId) {
        this.tenantId = tenantId;
    }

    public String getScopeId() {
        return scopeId;
    }

    public void setScopeId(String scopeId) {
        this.scopeId = scopeId;
    }

    public AnomalyType getAnomalyType() {
        return anomalyType;
    }

    public void setAnomalyType(AnomalyType anomalyType) {
        this.anomalyType = anomalyType;
    }

    public String getMetric() {
        return metric;
    }

    public void setMetric(String metric) {
        this.metric = metric;
    }

    public double getLow() {
        return low;
    }

    public void setLow(double low) {
        this.low = low;
    }

    public double getMedium() {
        return medium;
    }

    public void setMedium(double medium) {
        this.medium = medium;
    }

    public double getHigh() {
        return high;
    }

    public void setHigh(double high) {
        this.high = high;
    }

    public double getCritical() {
        return critical;
    }

    public void setCritical(double critical) {
        this.critical = critical;
    }

    public Direction getDirection() {
        return direction;
    }

    public void setDirection(Direction direction) {
        this.direction = direction;
    }

    public long getLookbackHours() {
        return lookbackHours;
    }

    public void setLookbackHours(long lookbackHours) {
        this.lookbackHours = lookbackHours;
    }

    public AutoAction getAutoAction() {
        return autoAction;
    }

    public void setAutoAction(AutoAction autoAction) {
        this.autoAction = autoAction;
    }

    @JsonProperty("is_enabled")
    public boolean isEnabled() {
        return enabled;
    }

    @JsonProperty("is_enabled")
    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
