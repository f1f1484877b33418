package com.perfsentinel.core.config;

import com.perfsentinel.core.model.AutoAction;
import com.perfsentinel.core.model.Direction;
import com.perfsentinel.core.model.Severity;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Severity cutoffs for one anomaly type.
 *
 * <p>
 * Cutoffs are fractional change magnitudes: {@code 0.2} means a 20% move away
 * from the baseline mean. They must satisfy
 * {@code 0 < low < medium < high < critical}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Instances are immutable and only obtainable through {@link Builder#build()},
 * which validates all fields and reports every violation in a single
 * {@link ThresholdValidationException}. An existing {@code ThresholdConfig}
 * is therefore always valid.
 * </p>
 *
 * @since 1.0.0
 */
public final class ThresholdConfig {

    static final Duration MIN_LOOKBACK = Duration.ofHours(1);
    static final Duration MAX_LOOKBACK = Duration.ofHours(168);

    private final String metric;
    private final double low;
    private final double medium;
    private final double high;
    private final double critical;
    private final Direction direction;
    private final Duration lookback;
    private final AutoAction autoAction;

    private ThresholdConfig(Builder b) {
        this.metric = b.metric;
        this.low = b.low;
        this.medium = b.medium;
        this.high = b.high;
        this.critical = b.critical;
        this.direction = b.direction;
        this.lookback = b.lookback;
        this.autoAction = b.autoAction;
    }

    /**
     * Classify a change magnitude into the highest tier whose cutoff it meets
     * or exceeds.
     *
     * @param magnitude absolute relative change
     * @return the tier, or empty when below {@code low}
     */
    public Optional<Severity> classify(double magnitude) {
        if (magnitude >= critical) {
            return Optional.of(Severity.CRITICAL);
        }
        if (magnitude >= high) {
            return Optional.of(Severity.HIGH);
        }
        if (magnitude >= medium) {
            return Optional.of(Severity.MEDIUM);
        }
        if (magnitude >= low) {
            return Optional.of(Severity.LOW);
        }
        return Optional.empty();
    }

    public String getMetric() {
        return metric;
    }

    public double getLow() {
        return low;
    }

    public double getMedium() {
        return medium;
    }

    public double getHigh() {
        return high;
    }

    public double getCritical() {
        return critical;
    }

    public Direction getDirection() {
        return direction;
    }

    public Duration getLookback() {
        return lookback;
    }

    public AutoAction getAutoAction() {
        return autoAction;
    }

    /**
     * @return a builder pre-filled with this configuration
     */
    public Builder toBuilder() {
        return new Builder()
                .metric(metric)
                .low(low)
                .medium(medium)
                .high(high)
                .critical(critical)
                .direction(direction)
                .lookback(lookback)
                .autoAction(autoAction);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link ThresholdConfig}.
     *
     * <p>
     * {@code direction} defaults to {@link Direction#BOTH}, {@code lookback}
     * to 24 hours and {@code autoAction} to {@link AutoAction#NONE}.
     * </p>
     */
    public static class Builder {
        private String metric;
        private double low;
        private double medium;
        private double high;
        private double critical;
        private Direction direction = Direction.BOTH;
        private Duration lookback = Duration.ofHours(24);
        private AutoAction autoAction = AutoAction.NONE;

        public Builder metric(String metric) {
            this.metric = metric;
            return this;
        }

        public Builder low(double low) {
            this.low = low;
            return this;
        }

        public Builder medium(double medium) {
            this.medium = medium;
            return this;
        }

        public Builder high(double high) {
            this.high = high;
            return this;
        }

        public Builder critical(double critical) {
            this.critical = critical;
            return this;
        }

        /**
         * Set all four cutoffs at once, lowest first.
         */
        public Builder cutoffs(double low, double medium, double high, double critical) {
            this.low = low;
            this.medium = medium;
            this.high = high;
            this.critical = critical;
            return this;
        }

        public Builder direction(Direction direction) {
            this.direction = direction;
            return this;
        }

        public Builder lookback(Duration lookback) {
            this.lookback = lookback;
            return this;
        }

        public Builder lookbackHours(long hours) {
            this.lookback = Duration.ofHours(hours);
            return this;
        }

        public Builder autoAction(AutoAction autoAction) {
            this.autoAction = autoAction;
            return this;
        }

        /**
         * Validate and build.
         *
         * @return a valid, immutable {@link ThresholdConfig}
         * @throws ThresholdValidationException if any field is invalid
         */
        public ThresholdConfig build() {
            List<String> errors = new ArrayList<>();

            if (metric == null || metric.isBlank()) {
                errors.add("'metric' is required");
            }
            requirePositive(errors, "low", low);
            requirePositive(errors, "medium", medium);
            requirePositive(errors, "high", high);
            requirePositive(errors, "critical", critical);
            if (!(low < medium)) {
                errors.add("'low' (" + low + ") must be less than 'medium' (" + medium + ")");
            }
            if (!(medium < high)) {
                errors.add("'medium' (" + medium + ") must be less than 'high' (" + high + ")");
            }
            if (!(high < critical)) {
                errors.add("'high' (" + high + ") must be less than 'critical' (" + critical + ")");
            }
            if (direction == null) {
                errors.add("'direction' is required");
            }
            if (autoAction == null) {
                errors.add("'autoAction' is required");
            }
            if (lookback == null) {
                errors.add("'lookback' is required");
            } else if (lookback.compareTo(MIN_LOOKBACK) < 0 || lookback.compareTo(MAX_LOOKBACK) > 0) {
                errors.add("'lookback' must be between " + MIN_LOOKBACK.toHours() + " and "
                        + MAX_LOOKBACK.toHours() + " hours, got: " + lookback);
            }

            if (!errors.isEmpty()) {
                throw new ThresholdValidationException(errors);
            }
            return new ThresholdConfig(this);
        }

        private static void requirePositive(List<String> errors, String name, double value) {
            if (!Double.isFinite(value) || value <= 0) {
                errors.add("'" + name + "' must be a finite value > 0, got: " + value);
            }
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ThresholdConfig that))
            return false;
        return Double.compare(low, that.low) == 0
                && Double.compare(medium, that.medium) == 0
                && Double.compare(high, that.high) == 0
                && Double.compare(critical, that.critical) == 0
                && metric.equals(that.metric)
                && direction == that.direction
                && lookback.equals(that.lookback)
                && autoAction == that.autoAction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(metric, low, medium, high, critical, direction, lookback, autoAction);
    }

    @Override
    public String toString() {
        return "ThresholdConfig{" +
                "metric='" + metric + '\'' +
                ", low=" + low +
                ", medium=" + medium +
                ", high=" + high +
                ", critical=" + critical +
                ", direction=" + direction +
                ", lookback=" + lookback +
                ", autoAction=" + autoAction +
                '}';
    }
}
