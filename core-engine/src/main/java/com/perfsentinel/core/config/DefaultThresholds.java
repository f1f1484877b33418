package com.perfsentinel.core.config;

import com.perfsentinel.core.model.AnomalyType;
import com.perfsentinel.core.model.AutoAction;
import com.perfsentinel.core.model.Direction;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Compiled-in default threshold for every {@link AnomalyType}.
 *
 * <p>
 * Each entry goes through {@link ThresholdConfig.Builder#build()} during class
 * initialisation, so a bad default fails at startup rather than at detection
 * time.
 * </p>
 *
 * @since 1.0.0
 */
public final class DefaultThresholds {

    private static final Map<AnomalyType, ThresholdConfig> DEFAULTS;

    static {
        EnumMap<AnomalyType, ThresholdConfig> m = new EnumMap<>(AnomalyType.class);
        m.put(AnomalyType.CPC_SPIKE, of(AnomalyType.CPC_SPIKE, 0.2, 0.4, 0.6, 1.0,
                Direction.UP, 24, AutoAction.REDUCE_BID));
        m.put(AnomalyType.CTR_DROP, of(AnomalyType.CTR_DROP, 0.15, 0.3, 0.5, 0.7,
                Direction.DOWN, 24, AutoAction.NONE));
        m.put(AnomalyType.CVR_DROP, of(AnomalyType.CVR_DROP, 0.2, 0.4, 0.6, 0.8,
                Direction.DOWN, 48, AutoAction.NONE));
        m.put(AnomalyType.ROAS_DROP, of(AnomalyType.ROAS_DROP, 0.2, 0.35, 0.5, 0.7,
                Direction.DOWN, 24, AutoAction.REDUCE_BUDGET));
        m.put(AnomalyType.SPEND_SPIKE, of(AnomalyType.SPEND_SPIKE, 0.3, 0.5, 0.8, 1.5,
                Direction.UP, 24, AutoAction.REDUCE_BUDGET));
        m.put(AnomalyType.IMPRESSION_DROP, of(AnomalyType.IMPRESSION_DROP, 0.3, 0.5, 0.7, 0.9,
                Direction.DOWN, 24, AutoAction.NONE));

        for (AnomalyType type : AnomalyType.values()) {
            if (!m.containsKey(type)) {
                throw new IllegalStateException("No default threshold for " + type);
            }
        }
        DEFAULTS = Collections.unmodifiableMap(m);
    }

    private DefaultThresholds() {
        // utility class
    }

    /**
     * @param type anomaly type; must not be {@code null}
     * @return the compiled-in default for {@code type}
     */
    public static ThresholdConfig forType(AnomalyType type) {
        return DEFAULTS.get(Objects.requireNonNull(type, "type must not be null"));
    }

    /**
     * @return unmodifiable view of every default, in declaration order
     */
    public static Map<AnomalyType, ThresholdConfig> all() {
        return DEFAULTS;
    }

    private static ThresholdConfig of(AnomalyType type, double low, double medium, double high,
            double critical, Direction direction, long lookbackHours, AutoAction autoAction) {
        return ThresholdConfig.builder()
                .metric(type.getMetric())
                .cutoffs(low, medium, high, critical)
                .direction(direction)
                .lookbackHours(lookbackHours)
                .autoAction(autoAction)
                .build();
    }
}
