package com.perfsentinel.core.alert;

import com.perfsentinel.core.model.AnomalyAlert;
import com.perfsentinel.core.model.AnomalyType;
import com.perfsentinel.core.model.AutoAction;
import com.perfsentinel.core.model.RecommendedAction;
import com.perfsentinel.core.model.Severity;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Static advice table keyed by anomaly type and severity.
 *
 * @since 1.0.0
 */
public final class RecommendedActions {

    static final String FALLBACK = "Keep monitoring the situation";

    private static final Map<AnomalyType, Map<Severity, String>> ACTIONS = new EnumMap<>(AnomalyType.class);

    static {
        register(AnomalyType.CPC_SPIKE,
                "Consider lowering bids by 10%",
                "Lower bids by 20%",
                "Lower bids by 30% and review keywords",
                "Pause the campaign and investigate the cause");
        register(AnomalyType.CTR_DROP,
                "Review ad creatives",
                "Start an A/B test of ad creatives",
                "Replace ad creatives now",
                "Review the campaign and adjust targeting");
        register(AnomalyType.CVR_DROP,
                "Check the landing page",
                "A/B test the landing page",
                "Fix the landing page urgently",
                "Stop the campaign and rework the landing page");
        register(AnomalyType.ROAS_DROP,
                "Review budget allocation",
                "Lower bids on underperforming keywords",
                "Cut budget of underperforming campaigns by 20%",
                "Freeze budget and investigate the cause");
        register(AnomalyType.SPEND_SPIKE,
                "Watch the budget burn rate",
                "Review daily budget caps",
                "Adjust budget caps urgently",
                "Pause the campaign");
        register(AnomalyType.IMPRESSION_DROP,
                "Check bids and budget",
                "Analyse the competitive landscape",
                "Consider raising bids",
                "Inspect the campaign urgently");
    }

    private RecommendedActions() {
        // utility class
    }

    /**
     * Advice for an alert.
     *
     * @param alert      the alert; must not be {@code null}
     * @param autoAction automation named by the threshold in force
     * @return advice; HIGH and CRITICAL alerts are {@code IMMEDIATE}
     */
    public static RecommendedAction recommend(AnomalyAlert alert, AutoAction autoAction) {
        Objects.requireNonNull(alert, "alert must not be null");
        return recommend(alert.getAnomalyType(), alert.getSeverity(), autoAction);
    }

    public static RecommendedAction recommend(AnomalyType type, Severity severity, AutoAction autoAction) {
        Objects.requireNonNull(severity, "severity must not be null");
        String text = ACTIONS.getOrDefault(type, Map.of()).getOrDefault(severity, FALLBACK);
        RecommendedAction.Urgency urgency = severity.needsAttention()
                ? RecommendedAction.Urgency.IMMEDIATE
                : RecommendedAction.Urgency.REVIEW;
        return new RecommendedAction(text, urgency, autoAction != null ? autoAction : AutoAction.NONE);
    }

    private static void register(AnomalyType type, String low, String medium, String high, String critical) {
        Map<Severity, String> bySeverity = new EnumMap<>(Severity.class);
        bySeverity.put(Severity.LOW, low);
        bySeverity.put(Severity.MEDIUM, medium);
        bySeverity.put(Severity.HIGH, high);
        bySeverity.put(Severity.CRITICAL, critical);
        ACTIONS.put(type, bySeverity);
    }
}
