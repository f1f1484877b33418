package com.perfsentinel.core.model;

/**
 * Remediation an anomaly type names for downstream automation.
 *
 * <p>
 * The engine only names the action; carrying it out is left to callers.
 * </p>
 *
 * @since 1.0.0
 */
public enum AutoAction {
    NONE,
    REDUCE_BID,
    PAUSE_KEYWORD,
    PAUSE_CAMPAIGN,
    REDUCE_BUDGET
}
