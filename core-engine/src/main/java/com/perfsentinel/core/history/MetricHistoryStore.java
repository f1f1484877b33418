package com.perfsentinel.core.history;

import com.perfsentinel.core.model.MetricSample;
import com.perfsentinel.core.model.SeriesKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds one bounded time series per {@link SeriesKey}.
 *
 * <p>
 * Series are created lazily on the first sample for a key and are never
 * removed, only trimmed by capacity.
 * </p>
 *
 * <h3>Windows</h3>
 * <ul>
 * <li>{@link #recentValues} — {@code [asOf - lookback, asOf]}</li>
 * <li>{@link #baselineValues} —
 * {@code [asOf - lookback - excludeRecent, asOf - excludeRecent]}, so the
 * sample being evaluated never contaminates its own baseline</li>
 * </ul>
 * <p>
 * Both bounds are inclusive. The overloads without {@code asOf} use the
 * store's clock.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Safe for concurrent use. Each series is guarded by its own monitor; there
 * is no store-wide lock. Callers must still feed a single key in
 * non-decreasing timestamp order, because window boundaries are computed from
 * timestamps.
 * </p>
 *
 * @since 1.0.0
 */
public class MetricHistoryStore {

    private static final Logger LOG = LoggerFactory.getLogger(MetricHistoryStore.class);

    /** Seven days of hourly samples. */
    public static final int DEFAULT_CAPACITY = 168;

    private final int capacity;
    private final Clock clock;
    private final Map<SeriesKey, MetricSeries> series = new ConcurrentHashMap<>();

    public MetricHistoryStore(int capacity, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
        }
        this.capacity = capacity;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public MetricHistoryStore(Clock clock) {
        this(DEFAULT_CAPACITY, clock);
    }

    // ---------------------------------------------------------------
    // Writes
    // ---------------------------------------------------------------

    /**
     * Append a sample to the series for {@code key}. Always succeeds.
     *
     * @param key       series key; must not be {@code null}
     * @param value     observed value
     * @param timestamp observation time; must not be {@code null}
     */
    public void record(SeriesKey key, double value, Instant timestamp) {
        Objects.requireNonNull(key, "key must not be null");
        MetricSample sample = new MetricSample(value, timestamp);
        boolean outOfOrder = series.computeIfAbsent(key, k -> new MetricSeries(capacity)).append(sample);
        if (outOfOrder) {
            LOG.debug("Out-of-order sample for series [{}] at {}", key, timestamp);
        }
    }

    // ---------------------------------------------------------------
    // Reads
    // ---------------------------------------------------------------

    public List<Double> recentValues(SeriesKey key, Duration lookback) {
        return recentValues(key, lookback, clock.instant());
    }

    /**
     * Values recorded within {@code [asOf - lookback, asOf]}.
     *
     * @return values oldest first; empty if the series does not exist
     */
    public List<Double> recentValues(SeriesKey key, Duration lookback, Instant asOf) {
        Objects.requireNonNull(lookback, "lookback must not be null");
        Objects.requireNonNull(asOf, "asOf must not be null");
        MetricSeries s = series.get(Objects.requireNonNull(key, "key must not be null"));
        if (s == null) {
            return List.of();
        }
        return s.valuesBetween(asOf.minus(lookback), asOf);
    }

    public List<Double> baselineValues(SeriesKey key, Duration lookback, Duration excludeRecent) {
        return baselineValues(key, lookback, excludeRecent, clock.instant());
    }

    /**
     * Values recorded within
     * {@code [asOf - lookback - excludeRecent, asOf - excludeRecent]}.
     *
     * @return values oldest first; empty if the series does not exist
     */
    public List<Double> baselineValues(SeriesKey key, Duration lookback, Duration excludeRecent,
            Instant asOf) {
        Objects.requireNonNull(lookback, "lookback must not be null");
        Objects.requireNonNull(excludeRecent, "excludeRecent must not be null");
        Objects.requireNonNull(asOf, "asOf must not be null");
        MetricSeries s = series.get(Objects.requireNonNull(key, "key must not be null"));
        if (s == null) {
            return List.of();
        }
        Instant end = asOf.minus(excludeRecent);
        return s.valuesBetween(end.minus(lookback), end);
    }

    /**
     * Copy of every sample currently held for {@code key}, oldest first.
     */
    public List<MetricSample> samples(SeriesKey key) {
        MetricSeries s = series.get(Objects.requireNonNull(key, "key must not be null"));
        return s == null ? List.of() : s.snapshot();
    }

    public int getCapacity() {
        return capacity;
    }

    /**
     * @return number of series created so far
     */
    public int seriesCount() {
        return series.size();
    }
}
