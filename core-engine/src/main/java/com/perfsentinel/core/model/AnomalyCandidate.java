package com.perfsentinel.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of a positive detection: one sample deviated from its baseline far
 * enough to reach a severity tier.
 *
 * <p>
 * A candidate is not yet an alert. The alert manager turns it into a new
 * alert or folds it into the unresolved alert already open for the same
 * {@link DedupKey}.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyCandidate {

    private final AnomalyType anomalyType;
    private final Severity severity;
    private final String metricName;
    private final double currentValue;
    private final double baselineValue;
    private final double changePercent;
    private final double zScore;
    private final Instant observedAt;

    public AnomalyCandidate(AnomalyType anomalyType, Severity severity, String metricName,
            double currentValue, double baselineValue, double changePercent, double zScore,
            Instant observedAt) {
        this.anomalyType = Objects.requireNonNull(anomalyType, "anomalyType must not be null");
        this.severity = Objects.requireNonNull(severity, "severity must not be null");
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        this.currentValue = currentValue;
        this.baselineValue = baselineValue;
        this.changePercent = changePercent;
        this.zScore = zScore;
        this.observedAt = Objects.requireNonNull(observedAt, "observedAt must not be null");
    }

    public AnomalyType getAnomalyType() {
        return anomalyType;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getMetricName() {
        return metricName;
    }

    public double getCurrentValue() {
        return currentValue;
    }

    /**
     * @return mean of the baseline window
     */
    public double getBaselineValue() {
        return baselineValue;
    }

    /**
     * @return relative change times 100, signed
     */
    public double getChangePercent() {
        return changePercent;
    }

    public double getZScore() {
        return zScore;
    }

    /**
     * @return timestamp of the sample that produced this candidate
     */
    public Instant getObservedAt() {
        return observedAt;
    }

    @Override
    public String toString() {
        return "AnomalyCandidate{" +
                "anomalyType=" + anomalyType +
                ", severity=" + severity +
                ", metricName='" + metricName + '\'' +
                ", currentValue=" + currentValue +
                ", baselineValue=" + baselineValue +
                ", changePercent=" + changePercent +
                ", zScore=" + zScore +
                ", observedAt=" + observedAt +
                '}';
    }
}
