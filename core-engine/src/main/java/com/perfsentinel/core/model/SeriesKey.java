package com.perfsentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Identifies one metric time series.
 *
 * <p>
 * A series belongs to a tenant, a monitored scope (e.g. an ad platform
 * account) and an entity inside that scope. The entity is the keyword id when
 * one is given, otherwise the campaign id, otherwise {@value #ACCOUNT_ENTITY}.
 * Account-level and campaign/keyword-level samples therefore never share a
 * baseline.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeriesKey implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Entity id used when neither a campaign nor a keyword is given. */
    public static final String ACCOUNT_ENTITY = "account";

    private final String tenantId;
    private final String scopeId;
    private final String entityId;
    private final String metricName;

    private SeriesKey(String tenantId, String scopeId, String entityId, String metricName) {
        this.tenantId = Objects.requireNonNull(tenantId, "tenantId must not be null");
        this.scopeId = Objects.requireNonNull(scopeId, "scopeId must not be null");
        this.entityId = Objects.requireNonNull(entityId, "entityId must not be null");
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
    }

    /**
     * Key of an account-level series.
     */
    public static SeriesKey of(String tenantId, String scopeId, String metricName) {
        return new SeriesKey(tenantId, scopeId, ACCOUNT_ENTITY, metricName);
    }

    /**
     * Key of a series for the most specific entity given.
     *
     * @param campaignId campaign id, may be {@code null}
     * @param keywordId  keyword id, may be {@code null}; wins over the campaign
     */
    public static SeriesKey of(String tenantId, String scopeId, String campaignId,
            String keywordId, String metricName) {
        return new SeriesKey(tenantId, scopeId, entityOf(campaignId, keywordId), metricName);
    }

    /**
     * Resolve the entity id for a campaign/keyword pair.
     */
    public static String entityOf(String campaignId, String keywordId) {
        if (keywordId != null) {
            return keywordId;
        }
        return campaignId != null ? campaignId : ACCOUNT_ENTITY;
    }

    public String getTenantId() {
        return tenantId;
    }

    public String getScopeId() {
        return scopeId;
    }

    public String getEntityId() {
        return entityId;
    }

    public String getMetricName() {
        return metricName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SeriesKey that))
            return false;
        return tenantId.equals(that.tenantId)
                && scopeId.equals(that.scopeId)
                && entityId.equals(that.entityId)
                && metricName.equals(that.metricName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tenantId, scopeId, entityId, metricName);
    }

    @Override
    public String toString() {
        return tenantId + ":" + scopeId + ":" + entityId + ":" + metricName;
    }
}
