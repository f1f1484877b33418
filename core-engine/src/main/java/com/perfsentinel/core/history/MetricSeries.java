package com.perfsentinel.core.history;

import com.perfsentinel.core.model.MetricSample;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded, append-only sequence of samples for one series key.
 *
 * <p>
 * Once {@code capacity} is exceeded the oldest sample is evicted. All access
 * is synchronized on the series itself, so each key has its own lock and
 * unrelated keys never contend.
 * </p>
 *
 * @since 1.0.0
 */
final class MetricSeries {

    private final int capacity;

    /** Oldest sample first. */
    private final Deque<MetricSample> samples = new ArrayDeque<>();

    MetricSeries(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Append a sample, evicting the oldest when over capacity.
     *
     * @return {@code true} if the sample is older than the last one recorded
     */
    synchronized boolean append(MetricSample sample) {
        MetricSample last = samples.peekLast();
        boolean outOfOrder = last != null && sample.getTimestamp().isBefore(last.getTimestamp());
        samples.addLast(sample);
        while (samples.size() > capacity) {
            samples.pollFirst();
        }
        return outOfOrder;
    }

    /**
     * Values whose timestamp lies in {@code [from, to]}, in insertion order.
     */
    synchronized List<Double> valuesBetween(Instant from, Instant to) {
        List<Double> values = new ArrayList<>();
        for (MetricSample s : samples) {
            Instant t = s.getTimestamp();
            if (!t.isBefore(from) && !t.isAfter(to)) {
                values.add(s.getValue());
            }
        }
        return values;
    }

    synchronized List<MetricSample> snapshot() {
        return List.copyOf(samples);
    }
}
