package com.perfsentinel.core.model;

import java.util.Objects;

/**
 * Advice attached to an alert: what an operator should do and how soon.
 *
 * @since 1.0.0
 */
public final class RecommendedAction {

    /** How soon the advice should be acted on. */
    public enum Urgency {
        IMMEDIATE,
        REVIEW
    }

    private final String action;
    private final Urgency urgency;
    private final AutoAction autoAction;

    public RecommendedAction(String action, Urgency urgency, AutoAction autoAction) {
        this.action = Objects.requireNonNull(action, "action must not be null");
        this.urgency = Objects.requireNonNull(urgency, "urgency must not be null");
        this.autoAction = Objects.requireNonNull(autoAction, "autoAction must not be null");
    }

    public String getAction() {
        return action;
    }

    public Urgency getUrgency() {
        return urgency;
    }

    public AutoAction getAutoAction() {
        return autoAction;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RecommendedAction that))
            return false;
        return action.equals(that.action) && urgency == that.urgency && autoAction == that.autoAction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(action, urgency, autoAction);
    }

    @Override
    public String toString() {
        return "RecommendedAction{action='" + action + "', urgency=" + urgency
                + ", autoAction=" + autoAction + '}';
    }
}
