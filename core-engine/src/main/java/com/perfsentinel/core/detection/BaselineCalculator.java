package com.perfsentinel.core.detection;

import com.perfsentinel.core.config.DetectionSettings;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Pure statistics over a window of historical values.
 *
 * <p>
 * Stateless and thread-safe. "Not enough data" and "undefined" outcomes are
 * returned as empty optionals, never thrown.
 * </p>
 *
 * @since 1.0.0
 */
public class BaselineCalculator {

    private final int minPoints;

    public BaselineCalculator() {
        this(DetectionSettings.MIN_BASELINE_POINTS_FLOOR);
    }

    /**
     * @param minPoints minimum window size; at least
     *                  {@value DetectionSettings#MIN_BASELINE_POINTS_FLOOR}
     * @throws IllegalArgumentException if {@code minPoints} is too small
     */
    public BaselineCalculator(int minPoints) {
        if (minPoints < DetectionSettings.MIN_BASELINE_POINTS_FLOOR) {
            throw new IllegalArgumentException("minPoints must be >= "
                    + DetectionSettings.MIN_BASELINE_POINTS_FLOOR + ", got: " + minPoints);
        }
        this.minPoints = minPoints;
    }

    /**
     * Mean and standard deviation of {@code values}.
     *
     * @return the baseline, or empty when fewer than {@code minPoints} values
     */
    public Optional<Baseline> baseline(List<Double> values) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.size() < minPoints) {
            return Optional.empty();
        }
        double mean = mean(values);
        return Optional.of(new Baseline(mean, stdev(values, mean), values.size()));
    }

    /**
     * Relative change {@code (current - mean) / mean}.
     *
     * @return the change, or empty when {@code mean == 0}
     */
    public OptionalDouble changeFraction(double current, double mean) {
        if (mean == 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of((current - mean) / mean);
    }

    /**
     * Normalised deviation {@code (current - mean) / stdev} of {@code current}
     * against {@code values}.
     *
     * @return the z-score, or {@code 0} when the deviation is zero or there
     *         are fewer than two values
     */
    public double zScore(List<Double> values, double current) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.size() < 2) {
            return 0;
        }
        double mean = mean(values);
        double stdev = stdev(values, mean);
        if (stdev == 0) {
            return 0;
        }
        return (current - mean) / stdev;
    }

    public int getMinPoints() {
        return minPoints;
    }

    // ---------------------------------------------------------------
    // Statistics helpers
    // ---------------------------------------------------------------

    private static double mean(List<Double> values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    private static double stdev(List<Double> values, double mean) {
        if (values.size() < 2) {
            return 0;
        }
        double sumSquaredDiff = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / (values.size() - 1));
    }
}
