package com.perfsentinel.core.detection;

import com.perfsentinel.core.config.ThresholdConfig;
import com.perfsentinel.core.config.ThresholdRegistry;
import com.perfsentinel.core.history.MetricHistoryStore;
import com.perfsentinel.core.model.AnomalyCandidate;
import com.perfsentinel.core.model.AnomalyType;
import com.perfsentinel.core.model.SeriesKey;
import com.perfsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Decides whether one incoming sample is a significant deviation from its
 * recent history.
 *
 * <h3>Evaluation</h3>
 * <ol>
 * <li>Record the sample into the {@link MetricHistoryStore}.</li>
 * <li>Map the metric to its {@link AnomalyType}; unmonitored metrics stop
 * here.</li>
 * <li>Take the baseline window: the threshold's lookback, ending
 * {@code exclusionWindow} before the sample.</li>
 * <li>Stop if the window is too small or its mean is zero.</li>
 * <li>Stop if the relative change points the wrong way for the threshold's
 * direction.</li>
 * <li>Classify the change magnitude into the highest tier reached; stop if
 * none.</li>
 * <li>Attach the z-score (informational only) and emit a candidate.</li>
 * </ol>
 *
 * <p>
 * Every stop is an empty result, never an exception. Apart from step 1 the
 * evaluation has no side effects, so re-evaluating the same input is safe.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Safe for concurrent use across keys; see {@link MetricHistoryStore} for the
 * per-key ordering requirement.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyDetector.class);

    private final MetricHistoryStore history;
    private final ThresholdRegistry thresholds;
    private final BaselineCalculator calculator;
    private final Duration exclusionWindow;

    /**
     * @param exclusionWindow most recent period left out of every baseline
     */
    public AnomalyDetector(MetricHistoryStore history, ThresholdRegistry thresholds,
            BaselineCalculator calculator, Duration exclusionWindow) {
        this.history = Objects.requireNonNull(history, "history must not be null");
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds must not be null");
        this.calculator = Objects.requireNonNull(calculator, "calculator must not be null");
        this.exclusionWindow = Objects.requireNonNull(exclusionWindow, "exclusionWindow must not be null");
        if (exclusionWindow.isNegative()) {
            throw new IllegalArgumentException("exclusionWindow must not be negative, got: " + exclusionWindow);
        }
    }

    /**
     * Record and evaluate one sample.
     *
     * @param key       series the sample belongs to; must not be {@code null}
     * @param value     observed value
     * @param timestamp observation time; anchors the baseline window
     * @return a candidate when a severity tier is reached, empty otherwise
     */
    public Optional<AnomalyCandidate> evaluate(SeriesKey key, double value, Instant timestamp) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");

        if (!Double.isFinite(value)) {
            LOG.debug("Series [{}]: dropping non-finite sample {}", key, value);
            return Optional.empty();
        }
        history.record(key, value, timestamp);

        Optional<AnomalyType> type = AnomalyType.forMetric(key.getMetricName());
        if (type.isEmpty()) {
            LOG.trace("Series [{}]: metric not monitored, skipping", key);
            return Optional.empty();
        }
        ThresholdConfig config = thresholds.effective(key.getTenantId(), key.getScopeId(), type.get());

        List<Double> window = history.baselineValues(key, config.getLookback(), exclusionWindow, timestamp);
        Optional<Baseline> baseline = calculator.baseline(window);
        if (baseline.isEmpty()) {
            LOG.trace("Series [{}]: insufficient data ({} point(s)), no signal", key, window.size());
            return Optional.empty();
        }
        double mean = baseline.get().getMean();

        OptionalDouble change = calculator.changeFraction(value, mean);
        if (change.isEmpty()) {
            LOG.trace("Series [{}]: baseline mean is zero, no signal", key);
            return Optional.empty();
        }
        double c = change.getAsDouble();
        if (!config.getDirection().admits(c)) {
            LOG.trace("Series [{}]: change {} outside direction {}, no signal", key, c, config.getDirection());
            return Optional.empty();
        }

        Optional<Severity> severity = config.classify(Math.abs(c));
        if (severity.isEmpty()) {
            LOG.trace("Series [{}]: change {} below lowest cutoff, no signal", key, c);
            return Optional.empty();
        }

        double zScore = calculator.zScore(window, value);
        AnomalyCandidate candidate = new AnomalyCandidate(type.get(), severity.get(),
                config.getMetric(), value, mean, c * 100, zScore, timestamp);
        LOG.debug("Series [{}]: candidate {}", key, candidate);
        return Optional.of(candidate);
    }

    public Duration getExclusionWindow() {
        return exclusionWindow;
    }
}
