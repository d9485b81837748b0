package com.modelsentinel.core.evaluation;

import com.modelsentinel.core.model.AlertDraft;
import com.modelsentinel.core.model.MetricObservation;
import com.modelsentinel.core.model.MetricType;
import com.modelsentinel.core.model.MonitoringConfig;

import java.io.Serializable;
import java.util.Optional;

/**
 * Breach policy for one metric type.
 *
 * <p>
 * Rules are stateless: the decision depends only on the observation and the
 * configuration snapshot, so the same inputs always give the same answer.
 * Rules are {@link Serializable} so the streaming job can ship them to its
 * operators.
 * </p>
 */
public interface ThresholdRule extends Serializable {

    /**
     * Decide whether the observation breaches the configured threshold.
     *
     * @param observation the observation; its metric type must match
     *                    {@link #getMetricType()}
     * @param config      snapshot of the owning model's configuration
     * @return a draft alert on breach, empty otherwise
     */
    Optional<AlertDraft> evaluate(MetricObservation observation, MonitoringConfig config);

    /**
     * @return the metric type this rule applies to
     */
    MetricType getMetricType();
}
