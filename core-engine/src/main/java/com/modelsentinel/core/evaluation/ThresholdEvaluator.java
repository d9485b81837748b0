package com.modelsentinel.core.evaluation;

import com.modelsentinel.core.error.ValidationException;
import com.modelsentinel.core.model.AlertDraft;
import com.modelsentinel.core.model.MetricObservation;
import com.modelsentinel.core.model.MetricType;
import com.modelsentinel.core.model.MonitoringConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides whether an observation breaches its model's monitoring policy.
 *
 * <p>
 * The evaluator is pure: it takes a snapshot of the configuration, looks up
 * the rule for the observation's metric type and returns a draft on breach.
 * It does not consult existing alerts. Cooldown handling, persistence and
 * notification are the caller's job.
 * </p>
 *
 * @since 1.0.0
 */
public class ThresholdEvaluator implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(ThresholdEvaluator.class);

    private final Map<MetricType, ThresholdRule> rules;

    /** Evaluator backed by {@link ThresholdRules#defaults()}. */
    public ThresholdEvaluator() {
        this(ThresholdRules.defaults());
    }

    /**
     * @param rules rules keyed by metric type; must not be {@code null}
     */
    public ThresholdEvaluator(Map<MetricType, ThresholdRule> rules) {
        this.rules = Map.copyOf(Objects.requireNonNull(rules, "rules must not be null"));
    }

    /**
     * @param metricType metric type to check
     * @return {@code true} if observations of this type can breach
     */
    public boolean hasRule(MetricType metricType) {
        return rules.containsKey(metricType);
    }

    /**
     * Evaluate one observation against a configuration.
     *
     * @param observation the observation
     * @param config      the owning model's configuration; read once as a
     *                    snapshot
     * @return a draft on breach; empty when within threshold or when the type
     *         has no rule (use {@link #hasRule(MetricType)} to tell the two
     *         apart)
     * @throws ValidationException if the configuration is invalid or belongs
     *                             to another model
     */
    public Optional<AlertDraft> evaluate(MetricObservation observation, MonitoringConfig config) {
        Objects.requireNonNull(observation, "Observation must not be null");
        Objects.requireNonNull(config, "MonitoringConfig must not be null");

        MonitoringConfig snapshot = config.snapshot();
        snapshot.validate();
        if (!snapshot.getModelId().equals(observation.getModelId())) {
            throw new ValidationException("Configuration for model '" + snapshot.getModelId()
                    + "' cannot evaluate an observation of model '" + observation.getModelId() + "'");
        }

        ThresholdRule rule = rules.get(observation.getMetricType());
        if (rule == null) {
            LOG.trace("No default rule for metric type '{}'; passing through",
                    observation.getMetricType().wireValue());
            return Optional.empty();
        }
        return rule.evaluate(observation, snapshot);
    }
}
