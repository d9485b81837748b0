/**
 * Domain model for Model Sentinel.
 *
 * <ul>
 * <li>{@link com.modelsentinel.core.model.MetricObservation}: append-only
 * metric observation</li>
 * <li>{@link com.modelsentinel.core.model.MonitoringConfig}: per-model
 * thresholds and alert routing</li>
 * <li>{@link com.modelsentinel.core.model.AlertDraft}: breach proposal
 * produced by evaluation</li>
 * <li>{@link com.modelsentinel.core.model.Alert}: versioned alert
 * snapshot</li>
 * </ul>
 *
 * <p>
 * Enumerations serialize to their lower-case wire identifiers and reject
 * unknown values with a
 * {@link com.modelsentinel.core.error.ValidationException}.
 * </p>
 *
 * @since 1.0.0
 */
package com.modelsentinel.core.model;
