/**
 * Service facade wiring history, detection, thresholds, alerts and the
 * persistence boundary together.
 *
 * @since 1.0.0
 */
package com.perfsentinel.core.service;
