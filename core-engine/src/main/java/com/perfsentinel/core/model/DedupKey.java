package com.perfsentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Identifies "the same ongoing problem": at most one unresolved alert exists
 * per key at any time.
 *
 * <p>
 * {@code campaignId} and {@code keywordId} are optional and compared as-is,
 * so an account-level alert and a campaign-level alert of the same type are
 * different problems.
 * </p>
 *
 * @since 1.0.0
 */
public final class DedupKey implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String tenantId;
    private final AnomalyType anomalyType;
    private final String scopeId;
    private final String campaignId;
    private final String keywordId;

    public DedupKey(String tenantId, AnomalyType anomalyType, String scopeId,
            String campaignId, String keywordId) {
        this.tenantId = Objects.requireNonNull(tenantId, "tenantId must not be null");
        this.anomalyType = Objects.requireNonNull(anomalyType, "anomalyType must not be null");
        this.scopeId = Objects.requireNonNull(scopeId, "scopeId must not be null");
        this.campaignId = campaignId;
        this.keywordId = keywordId;
    }

    /**
     * Derive the key an alert is deduplicated under.
     *
     * @param alert the alert; must not be {@code null}
     * @return dedup key of the alert
     */
    public static DedupKey of(AnomalyAlert alert) {
        Objects.requireNonNull(alert, "alert must not be null");
        return new DedupKey(alert.getTenantId(), alert.getAnomalyType(), alert.getScopeId(),
                alert.getCampaignId(), alert.getKeywordId());
    }

    public String getTenantId() {
        return tenantId;
    }

    public AnomalyType getAnomalyType() {
        return anomalyType;
    }

    public String getScopeId() {
        return scopeId;
    }

    public String getCampaignId() {
        return campaignId;
    }

    public String getKeywordId() {
        return keywordId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DedupKey that))
            return false;
        return tenantId.equals(that.tenantId)
                && anomalyType == that.anomalyType
                && scopeId.equals(that.scopeId)
                && Objects.equals(campaignId, that.campaignId)
                && Objects.equals(keywordId, that.keywordId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tenantId, anomalyType, scopeId, campaignId, keywordId);
    }

    @Override
    public String toString() {
        return "DedupKey{" +
                "tenantId='" + tenantId + '\'' +
                ", anomalyType=" + anomalyType +
                ", scopeId='" + scopeId + '\'' +
                ", campaignId='" + campaignId + '\'' +
                ", keywordId='" + keywordId + '\'' +
                '}';
    }
}
