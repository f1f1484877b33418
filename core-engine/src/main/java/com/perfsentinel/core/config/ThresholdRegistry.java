package com.perfsentinel.core.config;

import com.perfsentinel.core.model.AnomalyType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves the threshold in force for a {@code (tenant, scope, anomaly type)}.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Enabled override for the exact scope</li>
 * <li>Enabled tenant-wide override (scope {@code null})</li>
 * <li>{@link DefaultThresholds compiled-in default}</li>
 * </ol>
 *
 * <h3>Updates</h3>
 * <p>
 * {@link #set} validates first and only then replaces the whole override in a
 * single map write, so a rejected call leaves the previous configuration
 * untouched and readers never observe a partially-applied update.
 * </p>
 *
 * @since 1.0.0
 */
public class ThresholdRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(ThresholdRegistry.class);

    private final Clock clock;
    private final Map<OverrideKey, ThresholdOverride> overrides = new ConcurrentHashMap<>();

    public ThresholdRegistry(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // ---------------------------------------------------------------
    // Lookup
    // ---------------------------------------------------------------

    /**
     * The threshold in force.
     *
     * @param tenantId tenant; must not be {@code null}
     * @param scopeId  scope, may be {@code null} to consult tenant-wide overrides only
     * @param type     anomaly type; must not be {@code null}
     * @return the override config if one is enabled, else the default
     */
    public ThresholdConfig effective(String tenantId, String scopeId, AnomalyType type) {
        return activeOverride(tenantId, scopeId, type)
                .map(ThresholdOverride::getConfig)
                .orElseGet(() -> DefaultThresholds.forType(type));
    }

    /**
     * Every anomaly type with the threshold in force, tagged custom or
     * default.
     *
     * @return map in {@link AnomalyType} declaration order
     */
    public Map<AnomalyType, ThresholdView> view(String tenantId, String scopeId) {
        Map<AnomalyType, ThresholdView> result = new EnumMap<>(AnomalyType.class);
        for (AnomalyType type : AnomalyType.values()) {
            Optional<ThresholdOverride> active = activeOverride(tenantId, scopeId, type);
            result.put(type, active
                    .map(o -> new ThresholdView(type, o.getConfig(), o.getId()))
                    .orElseGet(() -> new ThresholdView(type, DefaultThresholds.forType(type), null)));
        }
        return result;
    }

    /**
     * The stored override for an exact key, enabled or not.
     */
    public Optional<ThresholdOverride> override(String tenantId, String scopeId, AnomalyType type) {
        return Optional.ofNullable(overrides.get(new OverrideKey(tenantId, scopeId, type)));
    }

    // ---------------------------------------------------------------
    // Mutation
    // ---------------------------------------------------------------

    /**
     * Validate and install an override, replacing any prior one for the key.
     *
     * @param draft unvalidated configuration; must not be {@code null}
     * @return the installed, enabled override carrying a fresh id
     * @throws ThresholdValidationException if the draft is invalid or names a
     *                                      metric other than the one
     *                                      {@code type} watches; nothing is
     *                                      changed in that case
     */
    public ThresholdOverride set(String tenantId, String scopeId, AnomalyType type,
            ThresholdConfig.Builder draft) {
        Objects.requireNonNull(draft, "draft must not be null");
        OverrideKey key = new OverrideKey(tenantId, scopeId, type);

        ThresholdConfig config;
        try {
            config = draft.build();
        } catch (ThresholdValidationException e) {
            LOG.warn("Rejected threshold for [{}]: {}", key, e.getMessage());
            throw e;
        }
        if (!config.getMetric().equals(type.getMetric())) {
            ThresholdValidationException e = new ThresholdValidationException(List.of(
                    "'metric' must be '" + type.getMetric() + "' for " + type
                            + ", got: '" + config.getMetric() + "'"));
            LOG.warn("Rejected threshold for [{}]: {}", key, e.getMessage());
            throw e;
        }

        ThresholdOverride installed = new ThresholdOverride(UUID.randomUUID().toString(),
                tenantId, scopeId, type, config, true, clock.instant());
        overrides.put(key, installed);
        LOG.info("Threshold override [{}] installed for [{}]: {}", installed.getId(), key, config);
        return installed;
    }

    /**
     * Soft-disable the override for a key. The default applies until it is
     * re-enabled.
     *
     * @return the disabled override, or empty if there is none
     */
    public Optional<ThresholdOverride> disable(String tenantId, String scopeId, AnomalyType type) {
        return toggle(new OverrideKey(tenantId, scopeId, type), false);
    }

    /**
     * Re-activate a previously disabled override.
     *
     * @return the enabled override, or empty if there is none
     */
    public Optional<ThresholdOverride> enable(String tenantId, String scopeId, AnomalyType type) {
        return toggle(new OverrideKey(tenantId, scopeId, type), true);
    }

    /**
     * Load persisted overrides at startup. Later entries for the same key win.
     *
     * @return number of overrides installed
     */
    public int restore(Collection<ThresholdOverride> persisted) {
        Objects.requireNonNull(persisted, "persisted overrides must not be null");
        for (ThresholdOverride o : persisted) {
            overrides.put(new OverrideKey(o.getTenantId(), o.getScopeId(), o.getAnomalyType()), o);
        }
        LOG.info("Restored {} threshold override(s)", persisted.size());
        return persisted.size();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Optional<ThresholdOverride> toggle(OverrideKey key, boolean enabled) {
        ThresholdOverride updated = overrides.computeIfPresent(key,
                (k, current) -> current.isEnabled() == enabled
                        ? current
                        : current.withEnabled(enabled, clock.instant()));
        if (updated != null) {
            LOG.info("Threshold override [{}] for [{}] {}", updated.getId(), key,
                    enabled ? "enabled" : "disabled");
        }
        return Optional.ofNullable(updated);
    }

    private Optional<ThresholdOverride> activeOverride(String tenantId, String scopeId,
            AnomalyType type) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (scopeId != null) {
            ThresholdOverride scoped = overrides.get(new OverrideKey(tenantId, scopeId, type));
            if (scoped != null && scoped.isEnabled()) {
                return Optional.of(scoped);
            }
        }
        ThresholdOverride tenantWide = overrides.get(new OverrideKey(tenantId, null, type));
        if (tenantWide != null && tenantWide.isEnabled()) {
            return Optional.of(tenantWide);
        }
        return Optional.empty();
    }

    private static final class OverrideKey {
        private final String tenantId;
        private final String scopeId;
        private final AnomalyType type;

        OverrideKey(String tenantId, String scopeId, AnomalyType type) {
            this.tenantId = Objects.requireNonNull(tenantId, "tenantId must not be null");
            this.scopeId = scopeId;
            this.type = Objects.requireNonNull(type, "type must not be null");
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof OverrideKey that))
                return false;
            return tenantId.equals(that.tenantId)
                    && Objects.equals(scopeId, that.scopeId)
                    && type == that.type;
        }

        @Override
        public int hashCode() {
            return Objects.hash(tenantId, scopeId, type);
        }

        @Override
        public String toString() {
            return tenantId + ":" + (scopeId != null ? scopeId : "*") + ":" + type;
        }
    }
}
