/**
 * Alert lifecycle: dedup, acknowledgement, resolution and summaries.
 *
 * @since 1.0.0
 */
package com.perfsentinel.core.alert;
