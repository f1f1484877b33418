/**
 * Process bootstrap for Perf Sentinel.
 *
 * <p>
 * Wires the core engine to file-backed persistence and exposes health endpoints for
 * the container runtime. Metric batches reach the engine from in-process
 * callers through {@link com.perfsentinel.core.service.AnomalyMonitoringService}.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.perfsentinel.app.MonitorApplication}: main entry point</li>
 * <li>{@link com.perfsentinel.app.MonitorConfig}: environment-driven
 * configuration</li>
 * <li>{@link com.perfsentinel.app.JsonFileAlertStore} and
 * {@link com.perfsentinel.app.JsonFileThresholdStore}: JSON-file
 * persistence</li>
 * <li>{@link com.perfsentinel.app.HealthServer}: HTTP health/readiness
 * endpoints</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.perfsentinel.app;
