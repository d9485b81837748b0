/**
 * Storage seams for observations, alerts and model configurations, with
 * thread-safe in-memory implementations.
 *
 * <p>
 * The engine reaches every store through
 * {@link com.modelsentinel.core.store.TimedStoreExecutor}, so a slow backend
 * surfaces as a timeout rather than a hung request.
 * </p>
 *
 * @since 1.0.0
 */
package com.modelsentinel.core.store;
