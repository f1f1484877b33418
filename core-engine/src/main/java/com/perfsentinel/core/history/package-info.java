/**
 * Bounded per-key metric history.
 *
 * @since 1.0.0
 */
package com.perfsentinel.core.history;
