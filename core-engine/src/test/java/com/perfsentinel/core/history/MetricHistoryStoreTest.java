package com.perfsentinel.core.history;

import com.perfsentinel.core.MutableClock;
import com.perfsentinel.core.model.MetricSample;
import com.perfsentinel.core.model.SeriesKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MetricHistoryStore}.
 */
class MetricHistoryStoreTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
    private static final SeriesKey CPC = SeriesKey.of("tenant-1", "naver", "cpc");

    private MutableClock clock;
    private MetricHistoryStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        store = new MetricHistoryStore(5, clock);
    }

    @Test
    @DisplayName("Should return nothing for a series that was never recorded")
    void shouldReturnEmptyForUnknownSeries() {
        assertThat(store.recentValues(CPC, Duration.ofHours(24))).isEmpty();
        assertThat(store.baselineValues(CPC, Duration.ofHours(24), Duration.ofHours(1))).isEmpty();
        assertThat(store.samples(CPC)).isEmpty();
    }

    @Test
    @DisplayName("Should evict the oldest samples once capacity is exceeded")
    void shouldEvictOldestBeyondCapacity() {
        for (int i = 0; i < 7; i++) {
            store.record(CPC, i, NOW.minus(Duration.ofHours(7 - i)));
        }

        List<MetricSample> samples = store.samples(CPC);
        assertThat(samples).hasSize(5);
        assertThat(samples).extracting(MetricSample::getValue)
                .containsExactly(2.0, 3.0, 4.0, 5.0, 6.0);
    }

    @Test
    @DisplayName("Recent window should include both bounds")
    void recentWindowShouldBeInclusive() {
        store.record(CPC, 1, NOW.minus(Duration.ofHours(25)));
        store.record(CPC, 2, NOW.minus(Duration.ofHours(24)));
        store.record(CPC, 3, NOW.minus(Duration.ofHours(3)));
        store.record(CPC, 4, NOW);

        assertThat(store.recentValues(CPC, Duration.ofHours(24))).containsExactly(2.0, 3.0, 4.0);
    }

    @Test
    @DisplayName("Baseline window should leave out the most recent exclusion period")
    void baselineWindowShouldExcludeRecentPeriod() {
        store.record(CPC, 10, NOW.minus(Duration.ofHours(26)));
        store.record(CPC, 20, NOW.minus(Duration.ofHours(25)));
        store.record(CPC, 30, NOW.minus(Duration.ofHours(2)));
        store.record(CPC, 40, NOW.minus(Duration.ofMinutes(59)));
        store.record(CPC, 50, NOW);

        assertThat(store.baselineValues(CPC, Duration.ofHours(24), Duration.ofHours(1)))
                .containsExactly(20.0, 30.0);
    }

    @Test
    @DisplayName("Explicit reference instant should override the clock")
    void shouldUseExplicitReferenceInstant() {
        Instant earlier = NOW.minus(Duration.ofDays(3));
        store.record(CPC, 7, earlier.minus(Duration.ofHours(2)));

        assertThat(store.baselineValues(CPC, Duration.ofHours(24), Duration.ofHours(1))).isEmpty();
        assertThat(store.baselineValues(CPC, Duration.ofHours(24), Duration.ofHours(1), earlier))
                .containsExactly(7.0);
    }

    @Test
    @DisplayName("Series with different entities should not share samples")
    void shouldIsolateEntities() {
        SeriesKey campaign = SeriesKey.of("tenant-1", "naver", "camp-9", null, "cpc");
        store.record(CPC, 1, NOW);
        store.record(campaign, 2, NOW);

        assertThat(store.samples(CPC)).extracting(MetricSample::getValue).containsExactly(1.0);
        assertThat(store.samples(campaign)).extracting(MetricSample::getValue).containsExactly(2.0);
        assertThat(store.seriesCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should keep appending out-of-order samples")
    void shouldAcceptOutOfOrderSample() {
        store.record(CPC, 1, NOW);
        store.record(CPC, 2, NOW.minus(Duration.ofHours(1)));

        assertThat(store.samples(CPC)).hasSize(2);
    }

    @Test
    @DisplayName("Should reject a non-positive capacity")
    void shouldRejectInvalidCapacity() {
        assertThatThrownBy(() -> new MetricHistoryStore(0, clock))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("capacity");
    }
}
