package com.perfsentinel.core.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Tunables of the detection engine, loaded from YAML.
 *
 * <p>
 * Expected YAML structure (every key optional):
 * </p>
 *
 * <pre>
 * historyCapacity: 168
 * exclusionWindowMinutes: 60
 * minBaselinePoints: 3
 * defaultAlertLimit: 50
 * historyDaysBack: 30
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionSettings {

    /** Baselines with fewer points than this never produce a detection. */
    public static final int MIN_BASELINE_POINTS_FLOOR = 3;

    /** Samples kept per series before the oldest is evicted. */
    private int historyCapacity = 168;

    /** Most recent period left out of every baseline window. */
    private int exclusionWindowMinutes = 60;

    private int minBaselinePoints = MIN_BASELINE_POINTS_FLOOR;

    /** Result cap for alert queries that do not pass one. */
    private int defaultAlertLimit = 50;

    private int historyDaysBack = 30;

    /**
     * @return a settings instance holding the built-in defaults
     */
    public static DetectionSettings defaults() {
        return new DetectionSettings();
    }

    /**
     * Check every value is legal.
     *
     * @throws IllegalStateException listing all violations
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (historyCapacity < 1) {
            errors.add("'historyCapacity' must be >= 1, got: " + historyCapacity);
        }
        if (exclusionWindowMinutes < 0) {
            errors.add("'exclusionWindowMinutes' must be >= 0, got: " + exclusionWindowMinutes);
        }
        if (minBaselinePoints < MIN_BASELINE_POINTS_FLOOR) {
            errors.add("'minBaselinePoints' must be >= " + MIN_BASELINE_POINTS_FLOOR
                    + ", got: " + minBaselinePoints);
        }
        if (defaultAlertLimit < 1) {
            errors.add("'defaultAlertLimit' must be >= 1, got: " + defaultAlertLimit);
        }
        if (historyDaysBack < 1) {
            errors.add("'historyDaysBack' must be >= 1, got: " + historyDaysBack);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid detection settings: " + String.join("; ", errors));
        }
    }

    public Duration exclusionWindow() {
        return Duration.ofMinutes(exclusionWindowMinutes);
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required by SnakeYAML)
    // ---------------------------------------------------------------

    public int getHistoryCapacity() {
        return historyCapacity;
    }

    public void setHistoryCapacity(int historyCapacity) {
        this.historyCapacity = historyCapacity;
    }

    public int getExclusionWindowMinutes() {
        return exclusionWindowMinutes;
    }

    public void setExclusionWindowMinutes(int exclusionWindowMinutes) {
        this.exclusionWindowMinutes = exclusionWindowMinutes;
    }

    public int getMinBaselinePoints() {
        return minBaselinePoints;
    }

    public void setMinBaselinePoints(int minBaselinePoints) {
        this.minBaselinePoints = minBaselinePoints;
    }

    public int getDefaultAlertLimit() {
        return defaultAlertLimit;
    }

    public void setDefaultAlertLimit(int defaultAlertLimit) {
        this.defaultAlertLimit = defaultAlertLimit;
    }

    public int getHistoryDaysBack() {
        return historyDaysBack;
    }

    public void setHistoryDaysBack(int historyDaysBack) {
        this.historyDaysBack = historyDaysBack;
    }

    @Override
    public String toString() {
        return "DetectionSettings{" +
                "historyCapacity=" + historyCapacity +
                ", exclusionWindowMinutes=" + exclusionWindowMinutes +
                ", minBaselinePoints=" + minBaselinePoints +
                ", defaultAlertLimit=" + defaultAlertLimit +
                ", historyDaysBack=" + historyDaysBack +
                '}';
    }
}
