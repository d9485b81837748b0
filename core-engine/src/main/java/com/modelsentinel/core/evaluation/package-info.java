/**
 * Threshold evaluation.
 *
 * <p>
 * {@link com.modelsentinel.core.evaluation.ThresholdEvaluator} dispatches an
 * observation to the {@link com.modelsentinel.core.evaluation.ThresholdRule}
 * registered for its metric type in
 * {@link com.modelsentinel.core.evaluation.ThresholdRules}. Severity is
 * derived by {@link com.modelsentinel.core.evaluation.SeverityCalculator}.
 * </p>
 *
 * <h3>Extending</h3>
 * <p>
 * To add a rule, extend {@code BoundRule} (or implement
 * {@code ThresholdRule}) and register it in {@code ThresholdRules}.
 * </p>
 *
 * @since 1.0.0
 */
package com.modelsentinel.core.evaluation;
