package com.modelsentinel.core.evaluation;

import com.modelsentinel.core.model.MetricType;
import com.modelsentinel.core.model.MonitoringConfig;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Registry of the built-in threshold rules, keyed by metric type.
 *
 * <p>
 * This is the single point of extension when adding a rule: map the metric
 * type to a rule here. Metric types that are absent have no default rule and
 * are reported as such by the evaluator rather than silently ignored.
 * </p>
 *
 * <ul>
 * <li>{@code accuracy}: breaches when value &lt; {@code accuracyThreshold}</li>
 * <li>{@code latency}: breaches when value &gt; {@code latencyThreshold}</li>
 * <li>{@code drift_score}: breaches when value &gt; {@code driftThreshold}</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class ThresholdRules {

    private static final Map<MetricType, ThresholdRule> DEFAULT_RULES;

    static {
        Map<MetricType, ThresholdRule> rules = new EnumMap<>(MetricType.class);
        rules.put(MetricType.ACCURACY,
                new LowerBoundRule(MetricType.ACCURACY, MonitoringConfig::getAccuracyThreshold));
        rules.put(MetricType.LATENCY,
                new UpperBoundRule(MetricType.LATENCY, MonitoringConfig::getLatencyThreshold));
        rules.put(MetricType.DRIFT_SCORE,
                new UpperBoundRule(MetricType.DRIFT_SCORE, MonitoringConfig::getDriftThreshold));
        DEFAULT_RULES = Collections.unmodifiableMap(rules);
    }

    private ThresholdRules() {
        // utility class, not instantiable
    }

    /**
     * @return unmodifiable view of every built-in rule
     */
    public static Map<MetricType, ThresholdRule> defaults() {
        return DEFAULT_RULES;
    }
}
