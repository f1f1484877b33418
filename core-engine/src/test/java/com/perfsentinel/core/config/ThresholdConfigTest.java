package com.perfsentinel.core.config;

import com.perfsentinel.core.model.AnomalyType;
import com.perfsentinel.core.model.AutoAction;
import com.perfsentinel.core.model.Direction;
import com.perfsentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Unit tests for {@link ThresholdConfig} and {@link DefaultThresholds}.
 */
class ThresholdConfigTest {

    @Test
    @DisplayName("Should apply builder defaults")
    void shouldApplyDefaults() {
        ThresholdConfig config = ThresholdConfig.builder()
                .metric("cpc").cutoffs(0.1, 0.2, 0.3, 0.4).build();

        assertThat(config.getDirection()).isEqualTo(Direction.BOTH);
        assertThat(config.getLookback()).isEqualTo(Duration.ofHours(24));
        assertThat(config.getAutoAction()).isEqualTo(AutoAction.NONE);
    }

    @Test
    @DisplayName("Cutoffs should be inclusive lower bounds")
    void shouldClassifyInclusively() {
        ThresholdConfig config = DefaultThresholds.forType(AnomalyType.CPC_SPIKE);

        assertThat(config.classify(0.19)).isEmpty();
        assertThat(config.classify(0.2)).contains(Severity.LOW);
        assertThat(config.classify(0.4)).contains(Severity.MEDIUM);
        assertThat(config.classify(0.6)).contains(Severity.HIGH);
        assertThat(config.classify(1.0)).contains(Severity.CRITICAL);
        assertThat(config.classify(5.0)).contains(Severity.CRITICAL);
    }

    @Test
    @DisplayName("Should reject non-increasing cutoffs")
    void shouldRejectUnorderedCutoffs() {
        assertThatThrownBy(() -> ThresholdConfig.builder()
                .metric("cpc").cutoffs(0.5, 0.4, 0.6, 1.0).build())
                .isInstanceOf(ThresholdValidationException.class)
                .hasMessageContaining("'low'");

        assertThatThrownBy(() -> ThresholdConfig.builder()
                .metric("cpc").cutoffs(0.2, 0.4, 0.4, 1.0).build())
                .isInstanceOf(ThresholdValidationException.class)
                .hasMessageContaining("'medium'");
    }

    @Test
    @DisplayName("Should collect every violation")
    void shouldCollectAllErrors() {
        ThresholdValidationException e = catchThrowableOfType(() -> ThresholdConfig.builder()
                .cutoffs(-1, Double.NaN, 0.6, 1.0)
                .direction(null)
                .lookbackHours(200)
                .build(), ThresholdValidationException.class);

        assertThat(e).isNotNull();
        assertThat(e.getErrors())
                .anyMatch(m -> m.contains("'metric'"))
                .anyMatch(m -> m.contains("'low'"))
                .anyMatch(m -> m.contains("'medium'"))
                .anyMatch(m -> m.contains("'direction'"))
                .anyMatch(m -> m.contains("'lookback'"));
    }

    @Test
    @DisplayName("Should accept lookback bounds of 1 and 168 hours")
    void shouldAcceptLookbackBounds() {
        ThresholdConfig.Builder builder = ThresholdConfig.builder().metric("cpc").cutoffs(0.1, 0.2, 0.3, 0.4);

        assertThat(builder.lookbackHours(1).build().getLookback()).isEqualTo(Duration.ofHours(1));
        assertThat(builder.lookbackHours(168).build().getLookback()).isEqualTo(Duration.ofHours(168));
        assertThatThrownBy(() -> builder.lookbackHours(0).build())
                .isInstanceOf(ThresholdValidationException.class);
    }

    @Test
    @DisplayName("toBuilder should produce an equal config")
    void toBuilderShouldRoundTrip() {
        ThresholdConfig original = DefaultThresholds.forType(AnomalyType.ROAS_DROP);

        assertThat(original.toBuilder().build()).isEqualTo(original);
        assertThat(original.toBuilder().high(0.55).build()).isNotEqualTo(original);
    }

    @Test
    @DisplayName("Should ship a default for every anomaly type")
    void shouldProvideDefaultsForEveryType() {
        assertThat(DefaultThresholds.all()).containsOnlyKeys(AnomalyType.values());
        for (AnomalyType type : AnomalyType.values()) {
            assertThat(DefaultThresholds.forType(type).getMetric()).isEqualTo(type.getMetric());
        }

        ThresholdConfig spend = DefaultThresholds.forType(AnomalyType.SPEND_SPIKE);
        assertThat(spend.getDirection()).isEqualTo(Direction.UP);
        assertThat(spend.getCritical()).isEqualTo(1.5);
        assertThat(spend.getAutoAction()).isEqualTo(AutoAction.REDUCE_BUDGET);

        assertThat(DefaultThresholds.forType(AnomalyType.CVR_DROP).getLookback())
                .isEqualTo(Duration.ofHours(48));
    }
}
