package com.perfsentinel.core.config;

import java.util.List;

/**
 * Thrown when a threshold configuration is rejected.
 *
 * <p>
 * Carries every violation found, not just the first one.
 * </p>
 *
 * @since 1.0.0
 */
public class ThresholdValidationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public ThresholdValidationException(List<String> errors) {
        super("Invalid threshold configuration: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
