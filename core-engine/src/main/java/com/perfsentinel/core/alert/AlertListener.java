package com.perfsentinel.core.alert;

import com.perfsentinel.core.model.AnomalyAlert;

/**
 * Callback invoked after every alert state transition.
 *
 * <p>
 * Receives a copy of the alert as it stands after the transition. Invoked on
 * the thread that performed the transition while that alert's monitor is
 * held, so calls for one alert arrive in transition order. Implementations
 * must return quickly and must not call back into the manager.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface AlertListener {

    /** Listener that ignores every change. */
    AlertListener NO_OP = alert -> {
    };

    void onChange(AnomalyAlert alert);
}
