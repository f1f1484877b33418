package com.perfsentinel.core.service;

import com.perfsentinel.core.alert.AlertListener;
import com.perfsentinel.core.alert.AlertManager;
import com.perfsentinel.core.alert.AlertNotFoundException;
import com.perfsentinel.core.alert.RecommendedActions;
import com.perfsentinel.core.config.DetectionSettings;
import com.perfsentinel.core.config.ThresholdConfig;
import com.perfsentinel.core.config.ThresholdOverride;
import com.perfsentinel.core.config.ThresholdRegistry;
import com.perfsentinel.core.config.ThresholdView;
import com.perfsentinel.core.detection.AnomalyDetector;
import com.perfsentinel.core.detection.BaselineCalculator;
import com.perfsentinel.core.history.MetricHistoryStore;
import com.perfsentinel.core.model.AlertSummary;
import com.perfsentinel.core.model.AnomalyAlert;
import com.perfsentinel.core.model.AnomalyCandidate;
import com.perfsentinel.core.model.AnomalyType;
import com.perfsentinel.core.model.DedupKey;
import com.perfsentinel.core.model.RecommendedAction;
import com.perfsentinel.core.model.SeriesKey;
import com.perfsentinel.core.model.Severity;
import com.perfsentinel.core.persistence.AlertStore;
import com.perfsentinel.core.persistence.PersistenceDispatcher;
import com.perfsentinel.core.persistence.ThresholdStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point of the engine: the ingestion boundary and the query and
 * administration boundary.
 *
 * <p>
 * Built once at application start through the {@link Builder} and passed to
 * every caller. There is no global instance.
 * </p>
 *
 * <h3>Startup</h3>
 * <p>
 * {@link #start()} reloads threshold overrides and unresolved alerts from the
 * persistence collaborator. Until it completes, ingestion is refused so that
 * dedup and summaries stay correct across restarts.
 * </p>
 *
 * <h3>Error Handling</h3>
 * <ul>
 * <li>Ingestion is fail-open: a metric that cannot be evaluated is logged and
 * skipped, the rest of the batch proceeds and nothing is thrown.</li>
 * <li>Administration is fail-closed: invalid thresholds throw
 * {@link com.perfsentinel.core.config.ThresholdValidationException}, unknown
 * alert ids throw {@link AlertNotFoundException}.</li>
 * <li>Persistence writes run after the in-memory transition and never block
 * or fail the caller.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class AnomalyMonitoringService implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyMonitoringService.class);

    private final Clock clock;
    private final DetectionSettings settings;
    private final AlertStore alertStore;
    private final ThresholdStore thresholdStore;
    private final PersistenceDispatcher dispatcher;

    private final ThresholdRegistry thresholds;
    private final AnomalyDetector detector;
    private final AlertManager alerts;

    private volatile boolean started;

    private AnomalyMonitoringService(Builder b) {
        this.clock = b.clock;
        this.settings = b.settings;
        this.alertStore = b.alertStore;
        this.thresholdStore = b.thresholdStore;
        this.dispatcher = b.dispatcher;

        this.thresholds = new ThresholdRegistry(clock);
        MetricHistoryStore history = new MetricHistoryStore(settings.getHistoryCapacity(), clock);
        this.detector = new AnomalyDetector(history, thresholds,
                new BaselineCalculator(settings.getMinBaselinePoints()), settings.exclusionWindow());
        AlertListener persist = alert -> dispatcher.dispatch(alert.getId(), "alert " + alert.getId(),
                () -> alertStore.save(alert));
        this.alerts = new AlertManager(clock, persist);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Reload persisted state. Idempotent.
     *
     * @throws RuntimeException whatever the stores throw; the service stays
     *                          not ready
     */
    public synchronized void start() {
        if (started) {
            return;
        }
        LOG.info("Starting anomaly monitoring with {}", settings);
        thresholds.restore(thresholdStore.loadAll());
        alerts.restore(alertStore.loadUnresolved());
        started = true;
        LOG.info("Anomaly monitoring ready");
    }

    /**
     * @return {@code true} once persisted state has been reloaded
     */
    public boolean isReady() {
        return started;
    }

    @Override
    public void close() {
        LOG.info("Anomaly monitoring closing");
        dispatcher.close();
    }

    // ---------------------------------------------------------------
    // Ingestion
    // ---------------------------------------------------------------

    public List<AnomalyAlert> recordMetrics(String tenantId, String scopeId, Map<String, Double> metrics) {
        return recordMetrics(tenantId, scopeId, metrics, null, null, null);
    }

    /**
     * Record a batch of samples and evaluate each monitored metric.
     *
     * <p>
     * Every metric is recorded into history; only metrics an
     * {@link AnomalyType} watches are evaluated. Null or non-finite values are
     * skipped.
     * </p>
     *
     * @param campaignId optional campaign the batch belongs to
     * @param keywordId  optional keyword the batch belongs to
     * @param timestamp  sample time, {@code null} for now
     * @return alerts created or updated by this batch
     * @throws IllegalStateException if {@link #start()} has not completed
     */
    public List<AnomalyAlert> recordMetrics(String tenantId, String scopeId, Map<String, Double> metrics,
            String campaignId, String keywordId, Instant timestamp) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        Objects.requireNonNull(scopeId, "scopeId must not be null");
        Objects.requireNonNull(metrics, "metrics must not be null");
        if (!started) {
            throw new IllegalStateException("Anomaly monitoring not started; call start() first");
        }
        Instant at = timestamp != null ? timestamp : clock.instant();

        List<AnomalyAlert> raised = new ArrayList<>();
        for (Map.Entry<String, Double> metric : metrics.entrySet()) {
            if (metric.getKey() == null || metric.getValue() == null) {
                LOG.debug("Skipping incomplete metric entry {} for tenant [{}]", metric, tenantId);
                continue;
            }
            try {
                SeriesKey key = SeriesKey.of(tenantId, scopeId, campaignId, keywordId, metric.getKey());
                Optional<AnomalyCandidate> candidate = detector.evaluate(key, metric.getValue(), at);
                if (candidate.isPresent()) {
                    DedupKey dedup = new DedupKey(tenantId, candidate.get().getAnomalyType(), scopeId,
                            campaignId, keywordId);
                    raised.add(alerts.upsert(candidate.get(), dedup));
                }
            } catch (RuntimeException e) {
                LOG.error("Evaluation of metric [{}] for tenant [{}] scope [{}] failed, continuing with next metric",
                        metric.getKey(), tenantId, scopeId, e);
            }
        }
        return raised;
    }

    // ---------------------------------------------------------------
    // Alert queries and administration
    // ---------------------------------------------------------------

    /**
     * @return every unresolved alert of the tenant, most urgent and freshest
     *         first; the same population {@link #getSummary} counts
     */
    public List<AnomalyAlert> getActiveAlerts(String tenantId) {
        return alerts.activeAlerts(tenantId, null, null);
    }

    /**
     * @param scopeId  optional scope filter
     * @param severity optional severity filter
     * @return unresolved alerts, most urgent and freshest first
     */
    public List<AnomalyAlert> getActiveAlerts(String tenantId, String scopeId, Severity severity, int limit) {
        return alerts.activeAlerts(tenantId, scopeId, severity, limit);
    }

    public List<AnomalyAlert> getAlertHistory(String tenantId, String scopeId) {
        return getAlertHistory(tenantId, scopeId, settings.getHistoryDaysBack(), settings.getDefaultAlertLimit());
    }

    /**
     * Active and resolved alerts detected within the last {@code daysBack}
     * days, newest first.
     */
    public List<AnomalyAlert> getAlertHistory(String tenantId, String scopeId, int daysBack, int limit) {
        if (daysBack < 0) {
            throw new IllegalArgumentException("daysBack must be >= 0, got: " + daysBack);
        }
        Instant since = clock.instant().minus(Duration.ofDays(daysBack));
        return alerts.history(tenantId, scopeId, since, limit);
    }

    /**
     * @throws AlertNotFoundException if the id is unknown
     */
    public boolean acknowledge(String alertId) {
        return alerts.acknowledge(alertId);
    }

    /**
     * @return {@code false} if the alert was already resolved
     * @throws AlertNotFoundException if the id is unknown
     */
    public boolean resolve(String alertId, String notes) {
        return alerts.resolve(alertId, notes);
    }

    public int batchResolve(String tenantId, String scopeId, String notes) {
        return alerts.batchResolve(tenantId, scopeId, notes);
    }

    public AlertSummary getSummary(String tenantId) {
        return alerts.summary(tenantId);
    }

    /**
     * Advice for an alert, with the automation named by the threshold in
     * force for its tenant and scope.
     */
    public RecommendedAction recommendedAction(AnomalyAlert alert) {
        Objects.requireNonNull(alert, "alert must not be null");
        ThresholdConfig config = thresholds.effective(alert.getTenantId(), alert.getScopeId(),
                alert.getAnomalyType());
        return RecommendedActions.recommend(alert, config.getAutoAction());
    }

    /**
     * @throws AlertNotFoundException if the id is unknown
     */
    public RecommendedAction recommendedAction(String alertId) {
        return recommendedAction(alerts.find(alertId).orElseThrow(() -> new AlertNotFoundException(alertId)));
    }

    // ---------------------------------------------------------------
    // Thresholds
    // ---------------------------------------------------------------

    /**
     * @return every anomaly type with the threshold in force, tagged custom
     *         or default
     */
    public Map<AnomalyType, ThresholdView> getThresholds(String tenantId, String scopeId) {
        return Collections.unmodifiableMap(thresholds.view(tenantId, scopeId));
    }

    /**
     * Validate and install a custom threshold.
     *
     * @return id of the new override
     * @throws com.perfsentinel.core.config.ThresholdValidationException if the
     *         draft is invalid; the configuration in force is unchanged
     */
    public String setThreshold(String tenantId, String scopeId, AnomalyType type, ThresholdConfig.Builder draft) {
        ThresholdOverride installed = thresholds.set(tenantId, scopeId, type, draft);
        persist(installed);
        return installed.getId();
    }

    /**
     * Disable the custom threshold, reverting to the default.
     *
     * @return {@code true} if an override existed
     */
    public boolean resetThreshold(String tenantId, String scopeId, AnomalyType type) {
        Optional<ThresholdOverride> disabled = thresholds.disable(tenantId, scopeId, type);
        disabled.ifPresent(this::persist);
        return disabled.isPresent();
    }

    /**
     * Re-enable a previously reset custom threshold.
     *
     * @return {@code true} if an override existed
     */
    public boolean enableThreshold(String tenantId, String scopeId, AnomalyType type) {
        Optional<ThresholdOverride> enabled = thresholds.enable(tenantId, scopeId, type);
        enabled.ifPresent(this::persist);
        return enabled.isPresent();
    }

    private void persist(ThresholdOverride override) {
        String key = override.getTenantId() + "|" + override.getScopeId() + "|" + override.getAnomalyType();
        dispatcher.dispatch(key, "threshold " + override.getId(), () -> thresholdStore.save(override));
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link AnomalyMonitoringService}.
     *
     * <p>
     * Both stores are required. The clock defaults to the UTC system clock,
     * the settings to {@link DetectionSettings#defaults()} and the dispatcher
     * to a single writer thread.
     * </p>
     */
    public static class Builder {
        private Clock clock = Clock.systemUTC();
        private DetectionSettings settings = DetectionSettings.defaults();
        private AlertStore alertStore;
        private ThresholdStore thresholdStore;
        private PersistenceDispatcher dispatcher;

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder settings(DetectionSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder alertStore(AlertStore alertStore) {
            this.alertStore = alertStore;
            return this;
        }

        public Builder thresholdStore(ThresholdStore thresholdStore) {
            this.thresholdStore = thresholdStore;
            return this;
        }

        public Builder dispatcher(PersistenceDispatcher dispatcher) {
            this.dispatcher = dispatcher;
            return this;
        }

        /**
         * @throws NullPointerException  if a required collaborator is missing
         * @throws IllegalStateException if the settings are invalid
         */
        public AnomalyMonitoringService build() {
            Objects.requireNonNull(clock, "clock must not be null");
            Objects.requireNonNull(settings, "settings must not be null");
            Objects.requireNonNull(alertStore, "alertStore must not be null");
            Objects.requireNonNull(thresholdStore, "thresholdStore must not be null");
            settings.validate();
            if (dispatcher == null) {
                dispatcher = PersistenceDispatcher.withThreads(1);
            }
            return new AnomalyMonitoringService(this);
        }
    }
}
