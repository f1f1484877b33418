package com.perfsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A tracked anomaly alert.
 *
 * <p>
 * Field set matches the persisted alerts table one to one, so instances are
 * handed to the persistence collaborator as rows.
 * </p>
 *
 * <h3>Lifecycle</h3>
 * <p>
 * ACTIVE while {@code resolvedAt} is unset, optionally flagged
 * {@code acknowledged}, then RESOLVED once {@code resolvedAt} is set. Only the
 * {@link com.perfsentinel.core.alert.AlertManager} mutates alerts it owns;
 * everything it hands out is a {@link #copy()}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code id}, {@code tenantId}, {@code scopeId},
 * {@code anomalyType}, {@code severity}, {@code metricName} and
 * {@code detectedAt} are required.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AnomalyAlert implements Serializable {

    private static final long serialVersionUID = 1L;

    private String id;
    private String tenantId;
    private String scopeId;
    private String campaignId;
    private String keywordId;
    private AnomalyType anomalyType;
    private Severity severity;
    private String metricName;
    private double currentValue;
    private double baselineValue;
    private double changePercent;
    private double zScore;
    private Instant detectedAt;
    private boolean acknowledged;
    private Instant resolvedAt;
    private String notes;

    // ---------------------------------------------------------------
    // Constructors
    // ---------------------------------------------------------------

    /** No-arg constructor required by Jackson. */
    public AnomalyAlert() {
    }

    private AnomalyAlert(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.tenantId = Objects.requireNonNull(builder.tenantId, "tenantId must not be null");
        this.scopeId = Objects.requireNonNull(builder.scopeId, "scopeId must not be null");
        this.campaignId = builder.campaignId;
        this.keywordId = builder.keywordId;
        this.anomalyType = Objects.requireNonNull(builder.anomalyType, "anomalyType must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.metricName = Objects.requireNonNull(builder.metricName, "metricName must not be null");
        this.currentValue = builder.currentValue;
        this.baselineValue = builder.baselineValue;
        this.changePercent = builder.changePercent;
        this.zScore = builder.zScore;
        this.detectedAt = Objects.requireNonNull(builder.detectedAt, "detectedAt must not be null");
        this.acknowledged = builder.acknowledged;
        this.resolvedAt = builder.resolvedAt;
        this.notes = builder.notes;
    }

    /**
     * Field-by-field copy.
     *
     * @return an independent copy of this alert
     */
    public AnomalyAlert copy() {
        AnomalyAlert c = new AnomalyAlert();
        c.id = id;
        c.tenantId = tenantId;
        c.scopeId = scopeId;
        c.campaignId = campaignId;
        c.keywordId = keywordId;
        c.anomalyType = anomalyType;
        c.severity = severity;
        c.metricName = metricName;
        c.currentValue = currentValue;
        c.baselineValue = baselineValue;
        c.changePercent = changePercent;
        c.zScore = zScore;
        c.detectedAt = detectedAt;
        c.acknowledged = acknowledged;
        c.resolvedAt = resolvedAt;
        c.notes = notes;
        return c;
    }

    /**
     * @return {@code true} while the alert has not been resolved
     */
    @JsonIgnore
    public boolean isActive() {
        return resolvedAt == null;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link AnomalyAlert} instances.
     */
    public static class Builder {
        private String id;
        private String tenantId;
        private String scopeId;
        private String campaignId;
        private String keywordId;
        private AnomalyType anomalyType;
        private Severity severity;
        private String metricName;
        private double currentValue;
        private double baselineValue;
        private double changePercent;
        private double zScore;
        private Instant detectedAt;
        private boolean acknowledged;
        private Instant resolvedAt;
        private String notes;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder scopeId(String scopeId) {
            this.scopeId = scopeId;
            return this;
        }

        public Builder campaignId(String campaignId) {
            this.campaignId = campaignId;
            return this;
        }

        public Builder keywordId(String keywordId) {
            this.keywordId = keywordId;
            return this;
        }

        public Builder anomalyType(AnomalyType anomalyType) {
            this.anomalyType = anomalyType;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder metricName(String metricName) {
            this.metricName = metricName;
            return this;
        }

        public Builder currentValue(double currentValue) {
            this.currentValue = currentValue;
            return this;
        }

        public Builder baselineValue(double baselineValue) {
            this.baselineValue = baselineValue;
            return this;
        }

        public Builder changePercent(double changePercent) {
            this.changePercent = changePercent;
            return this;
        }

        public Builder zScore(double zScore) {
            this.zScore = zScore;
            return this;
        }

        public Builder detectedAt(Instant detectedAt) {
            this.detectedAt = detectedAt;
            return this;
        }

        public Builder acknowledged(boolean acknowledged) {
            this.acknowledged = acknowledged;
            return this;
        }

        public Builder resolvedAt(Instant resolvedAt) {
            this.resolvedAt = resolvedAt;
            return this;
        }

        public Builder notes(String notes) {
            this.notes = notes;
            return this;
        }

        /**
         * @throws NullPointerException if a required field is missing
         */
        public AnomalyAlert build() {
            return new AnomalyAlert(this);
        }
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

    public String getCampaignId() {
        return campaignId;
    }

    public void setCampaignId(String campaignId) {
        this.campaignId = campaignId;
    }

    public String getKeywordId() {
        return keywordId;
    }

    public void setKeywordId(String keywordId) {
        this.keywordId = keywordId;
    }

    public AnomalyType getAnomalyType() {
        return anomalyType;
    }

    public void setAnomalyType(AnomalyType anomalyType) {
        this.anomalyType = anomalyType;
    }

    public Severity getSeverity() {
        return severity;
    }

    public void setSeverity(Severity severity) {
        this.severity = severity;
    }

    public String getMetricName() {
        return metricName;
    }

    public void setMetricName(String metricName) {
        this.metricName = metricName;
    }

    public double getCurrentValue() {
        return currentValue;
    }

    public void setCurrentValue(double currentValue) {
        this.currentValue = currentValue;
    }

    public double getBaselineValue() {
        return baselineValue;
    }

    public void setBaselineValue(double baselineValue) {
        this.baselineValue = baselineValue;
    }

    public double getChangePercent() {
        return changePercent;
    }

    public void setChangePercent(double changePercent) {
        this.changePercent = changePercent;
    }

    @JsonProperty("z_score")
    public double getZScore() {
        return zScore;
    }

    @JsonProperty("z_score")
    public void setZScore(double zScore) {
        this.zScore = zScore;
    }

    public Instant getDetectedAt() {
        return detectedAt;
    }

    public void setDetectedAt(Instant detectedAt) {
        this.detectedAt = detectedAt;
    }

    public boolean isAcknowledged() {
        return acknowledged;
    }

    public void setAcknowledged(boolean acknowledged) {
        this.acknowledged = acknowledged;
    }

    public Instant getResolvedAt() {
        return resolvedAt;
    }

    public void setResolvedAt(Instant resolvedAt) {
        this.resolvedAt = resolvedAt;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyAlert that))
            return false;
        return acknowledged == that.acknowledged
                && Double.compare(currentValue, that.currentValue) == 0
                && Double.compare(baselineValue, that.baselineValue) == 0
                && Double.compare(changePercent, that.changePercent) == 0
                && Double.compare(zScore, that.zScore) == 0
                && Objects.equals(id, that.id)
                && Objects.equals(tenantId, that.tenantId)
                && Objects.equals(scopeId, that.scopeId)
                && Objects.equals(campaignId, that.campaignId)
                && Objects.equals(keywordId, that.keywordId)
                && anomalyType == that.anomalyType
                && severity == that.severity
                && Objects.equals(metricName, that.metricName)
                && Objects.equals(detectedAt, that.detectedAt)
                && Objects.equals(resolvedAt, that.resolvedAt)
                && Objects.equals(notes, that.notes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, tenantId, scopeId, anomalyType, detectedAt);
    }

    @Override
    public String toString() {
        return "AnomalyAlert{" +
                "id='" + id + '\'' +
                ", tenantId='" + tenantId + '\'' +
                ", scopeId='" + scopeId + '\'' +
                ", campaignId='" + campaignId + '\'' +
                ", keywordId='" + keywordId + '\'' +
                ", anomalyType=" + anomalyType +
                ", severity=" + severity +
                ", currentValue=" + currentValue +
                ", baselineValue=" + baselineValue +
                ", changePercent=" + changePercent +
                ", detectedAt=" + detectedAt +
                ", acknowledged=" + acknowledged +
                ", resolvedAt=" + resolvedAt +
                '}';
    }
}
