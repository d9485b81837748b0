package com.modelsentinel.core.evaluation;

import com.modelsentinel.core.model.MetricType;

/**
 * Breaches when the observed value is strictly less than the threshold.
 * Used for accuracy.
 */
public class LowerBoundRule extends BoundRule {

    private static final long serialVersionUID = 1L;

    public LowerBoundRule(MetricType metricType, ThresholdSource thresholdSource) {
        super(metricType, thresholdSource);
    }

    @Override
    protected boolean breaches(double value, double threshold) {
        return value < threshold;
    }

    @Override
    protected String breachVerb() {
        return "fell below";
    }
}
