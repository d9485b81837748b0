package com.modelsentinel.core.evaluation;

import com.modelsentinel.core.model.MetricType;

/**
 * Breaches when the observed value is strictly greater than the threshold.
 * Used for latency and drift score.
 */
public class UpperBoundRule extends BoundRule {

    private static final long serialVersionUID = 1L;

    public UpperBoundRule(MetricType metricType, ThresholdSource thresholdSource) {
        super(metricType, thresholdSource);
    }

    @Override
    protected boolean breaches(double value, double threshold) {
        return value > threshold;
    }

    @Override
    protected String breachVerb() {
        return "exceeded";
    }
}
