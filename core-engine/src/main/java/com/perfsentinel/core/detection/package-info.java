/**
 * Baseline statistics and per-sample anomaly detection.
 *
 * <p>
 * {@link com.perfsentinel.core.detection.AnomalyDetector} combines the metric
 * history, the threshold registry and
 * {@link com.perfsentinel.core.detection.BaselineCalculator} into a single
 * decision per sample. Absence of a signal is an empty result.
 * </p>
 *
 * @since 1.0.0
 */
package com.perfsentinel.core.detection;
