package com.perfsentinel.core.alert;

import com.perfsentinel.core.model.AnomalyType;
import com.perfsentinel.core.model.AutoAction;
import com.perfsentinel.core.model.RecommendedAction;
import com.perfsentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link RecommendedActions}.
 */
class RecommendedActionsTest {

    @Test
    @DisplayName("Critical CPC spike should recommend pausing immediately")
    void shouldRecommendForCriticalCpc() {
        RecommendedAction action = RecommendedActions.recommend(
                AnomalyType.CPC_SPIKE, Severity.CRITICAL, AutoAction.REDUCE_BID);

        assertThat(action.getAction()).isEqualTo("Pause the campaign and investigate the cause");
        assertThat(action.getUrgency()).isEqualTo(RecommendedAction.Urgency.IMMEDIATE);
        assertThat(action.getAutoAction()).isEqualTo(AutoAction.REDUCE_BID);
    }

    @Test
    @DisplayName("Low and medium severities should only need review")
    void shouldMarkLowSeveritiesForReview() {
        assertThat(RecommendedActions.recommend(AnomalyType.CTR_DROP, Severity.LOW, null).getUrgency())
                .isEqualTo(RecommendedAction.Urgency.REVIEW);
        assertThat(RecommendedActions.recommend(AnomalyType.CTR_DROP, Severity.MEDIUM, null).getAutoAction())
                .isEqualTo(AutoAction.NONE);
        assertThat(RecommendedActions.recommend(AnomalyType.CTR_DROP, Severity.HIGH, null).getUrgency())
                .isEqualTo(RecommendedAction.Urgency.IMMEDIATE);
    }

    @ParameterizedTest
    @EnumSource(AnomalyType.class)
    @DisplayName("Every type should have advice for every severity")
    void shouldCoverEveryType(AnomalyType type) {
        for (Severity severity : Severity.values()) {
            assertThat(RecommendedActions.recommend(type, severity, AutoAction.NONE).getAction())
                    .isNotBlank()
                    .isNotEqualTo(RecommendedActions.FALLBACK);
        }
    }
}
