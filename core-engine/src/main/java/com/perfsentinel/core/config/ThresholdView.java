package com.perfsentinel.core.config;

import com.perfsentinel.core.model.AnomalyType;

import java.util.Objects;
import java.util.Optional;

/**
 * The threshold in force for one anomaly type, tagged with where it came
 * from.
 *
 * @since 1.0.0
 */
public final class ThresholdView {

    private final AnomalyType anomalyType;
    private final ThresholdConfig config;
    private final String thresholdId;

    ThresholdView(AnomalyType anomalyType, ThresholdConfig config, String thresholdId) {
        this.anomalyType = Objects.requireNonNull(anomalyType, "anomalyType must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.thresholdId = thresholdId;
    }

    public AnomalyType getAnomalyType() {
        return anomalyType;
    }

    public ThresholdConfig getConfig() {
        return config;
    }

    /**
     * @return {@code true} if a tenant override is in force
     */
    public boolean isCustom() {
        return thresholdId != null;
    }

    /**
     * @return id of the override in force, empty for the default
     */
    public Optional<String> getThresholdId() {
        return Optional.ofNullable(thresholdId);
    }

    @Override
    public String toString() {
        return "ThresholdView{anomalyType=" + anomalyType + ", custom=" + isCustom()
                + ", config=" + config + '}';
    }
}
