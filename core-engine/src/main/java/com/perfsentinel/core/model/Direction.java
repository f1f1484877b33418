package com.perfsentinel.core.model;

/**
 * Which direction of change a threshold reacts to.
 *
 * @since 1.0.0
 */
public enum Direction {

    UP,
    DOWN,
    BOTH;

    /**
     * Whether a relative change points the way this direction watches.
     *
     * <p>
     * A change of exactly zero is never admitted by {@link #UP} or
     * {@link #DOWN}.
     * </p>
     *
     * @param change relative change {@code (current - mean) / mean}
     * @return {@code true} if the change should be classified
     */
    public boolean admits(double change) {
        return switch (this) {
            case UP -> change > 0;
            case DOWN -> change < 0;
            case BOTH -> true;
        };
    }
}
