/**
 * Narrow boundary to the persistence collaborator.
 *
 * <p>
 * The engine never persists anything itself. It reads
 * {@link com.perfsentinel.core.persistence.AlertStore} and
 * {@link com.perfsentinel.core.persistence.ThresholdStore} once at startup
 * and afterwards only hands them writes through
 * {@link com.perfsentinel.core.persistence.PersistenceDispatcher}.
 * </p>
 *
 * @since 1.0.0
 */
package com.perfsentinel.core.persistence;
