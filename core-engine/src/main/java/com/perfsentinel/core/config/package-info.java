/**
 * Threshold configuration and engine settings.
 *
 * <p>
 * {@link com.perfsentinel.core.config.ThresholdRegistry} resolves the
 * {@link com.perfsentinel.core.config.ThresholdConfig} in force per tenant,
 * scope and anomaly type, falling back to
 * {@link com.perfsentinel.core.config.DefaultThresholds}. Engine tunables are
 * read from YAML by
 * {@link com.perfsentinel.core.config.DetectionSettingsLoader}.
 * </p>
 *
 * @since 1.0.0
 */
package com.perfsentinel.core.config;
