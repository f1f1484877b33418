package com.perfsentinel.core.model;

import java.util.Comparator;

/**
 * Severity tier of an anomaly alert.
 *
 * <p>
 * Assigned by comparing the magnitude of relative change against the
 * ascending cutoffs of a threshold configuration.
 * </p>
 *
 * @since 1.0.0
 */
public enum Severity {

    LOW(1, "Minor deviation, keep monitoring"),
    MEDIUM(2, "Noticeable deviation, review recommended"),
    HIGH(3, "Large deviation, act soon"),
    CRITICAL(4, "Severe deviation, immediate action required");

    /** Most urgent first: CRITICAL, HIGH, MEDIUM, LOW. */
    public static final Comparator<Severity> MOST_URGENT_FIRST =
            Comparator.comparingInt(Severity::getLevel).reversed();

    private final int level;
    private final String description;

    Severity(int level, String description) {
        this.level = level;
        this.description = description;
    }

    public int getLevel() {
        return level;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @return {@code true} for HIGH and CRITICAL
     */
    public boolean needsAttention() {
        return level >= HIGH.level;
    }
}
