package com.modelsentinel.core.evaluation;

import com.modelsentinel.core.model.AlertSeverity;

/**
 * Maps how far a value deviates from its threshold to an alert severity.
 *
 * <p>
 * Relative deviation is {@code |value - threshold| / |threshold|}; when the
 * threshold is zero the absolute deviation is used instead. Bands:
 * </p>
 * <ul>
 * <li>&lt; {@value #MEDIUM_FROM}: low</li>
 * <li>&lt; {@value #HIGH_FROM}: medium</li>
 * <li>&lt; {@value #CRITICAL_FROM}: high</li>
 * <li>otherwise critical</li>
 * </ul>
 *
 * <p>
 * The mapping is deterministic and non-decreasing in the deviation.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeverityCalculator {

    static final double MEDIUM_FROM = 0.10;
    static final double HIGH_FROM = 0.25;
    static final double CRITICAL_FROM = 0.50;

    private SeverityCalculator() {
        // utility class, not instantiable
    }

    public static AlertSeverity severityOf(double value, double threshold) {
        return severityForDeviation(relativeDeviation(value, threshold));
    }

    static double relativeDeviation(double value, double threshold) {
        double diff = Math.abs(value - threshold);
        return threshold == 0 ? diff : diff / Math.abs(threshold);
    }

    static AlertSeverity severityForDeviation(double deviation) {
        if (deviation < MEDIUM_FROM) {
            return AlertSeverity.LOW;
        }
        if (deviation < HIGH_FROM) {
            return AlertSeverity.MEDIUM;
        }
        if (deviation < CRITICAL_FROM) {
            return AlertSeverity.HIGH;
        }
        return AlertSeverity.CRITICAL;
    }
}
