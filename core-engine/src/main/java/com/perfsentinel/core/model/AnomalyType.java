package com.perfsentinel.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Kinds of performance anomaly the engine can raise.
 *
 * <p>
 * Every type watches exactly one metric. The compiled-in default thresholds
 * for each type live in
 * {@link com.perfsentinel.core.config.DefaultThresholds}.
 * </p>
 *
 * @since 1.0.0
 */
public enum AnomalyType {

    CPC_SPIKE("cpc", "CPC spike", "Cost per click rose sharply"),
    CTR_DROP("ctr", "CTR drop", "Click-through rate fell sharply"),
    CVR_DROP("cvr", "Conversion drop", "Conversion rate fell sharply"),
    ROAS_DROP("roas", "ROAS drop", "Return on ad spend fell sharply"),
    SPEND_SPIKE("spend", "Spend spike", "Ad spend rose faster than expected"),
    IMPRESSION_DROP("impressions", "Impression drop", "Ad impressions fell sharply");

    private final String metric;
    private final String displayName;
    private final String description;

    AnomalyType(String metric, String displayName, String description) {
        this.metric = metric;
        this.displayName = displayName;
        this.description = description;
    }

    /**
     * @return name of the metric this type watches
     */
    public String getMetric() {
        return metric;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Find the anomaly type that watches the given metric.
     *
     * @param metricName metric name, case-insensitive; may be {@code null}
     * @return the watching type, or empty if the metric is not monitored
     */
    public static Optional<AnomalyType> forMetric(String metricName) {
        if (metricName == null) {
            return Optional.empty();
        }
        String normalised = metricName.toLowerCase(Locale.ROOT);
        for (AnomalyType type : values()) {
            if (type.metric.equals(normalised)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
