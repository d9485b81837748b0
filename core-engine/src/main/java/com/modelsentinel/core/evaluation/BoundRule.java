package com.modelsentinel.core.evaluation;

import com.modelsentinel.core.model.AlertDraft;
import com.modelsentinel.core.model.AlertType;
import com.modelsentinel.core.model.MetricObservation;
import com.modelsentinel.core.model.MetricType;
import com.modelsentinel.core.model.MonitoringConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Shared implementation of single-bound threshold rules.
 *
 * <p>
 * Subclasses decide the direction of the comparison. Comparisons are
 * strict, so a value equal to its threshold never breaches.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class BoundRule implements ThresholdRule {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(BoundRule.class);

    private final MetricType metricType;
    private final AlertType alertType;
    private final ThresholdSource thresholdSource;

    /**
     * @param metricType      metric this rule applies to; must map to an alert
     *                        type
     * @param thresholdSource reads the threshold from the configuration
     * @throws IllegalArgumentException if {@code metricType} has no alert type
     */
    protected BoundRule(MetricType metricType, ThresholdSource thresholdSource) {
        this.metricType = Objects.requireNonNull(metricType, "metricType must not be null");
        this.thresholdSource = Objects.requireNonNull(thresholdSource, "thresholdSource must not be null");
        this.alertType = metricType.alertType().orElseThrow(() -> new IllegalArgumentException(
                "Metric type '" + metricType.wireValue() + "' has no alert type"));
    }

    /**
     * @return {@code true} if {@code value} violates {@code threshold}
     */
    protected abstract boolean breaches(double value, double threshold);

    /**
     * @return verb phrase used in alert messages, e.g. "exceeded"
     */
    protected abstract String breachVerb();

    @Override
    public Optional<AlertDraft> evaluate(MetricObservation observation, MonitoringConfig config) {
        Objects.requireNonNull(observation, "Observation must not be null");
        Objects.requireNonNull(config, "MonitoringConfig must not be null");
        if (observation.getMetricType() != metricType) {
            throw new IllegalArgumentException("Rule for '" + metricType.wireValue()
                    + "' cannot evaluate '" + observation.getMetricType().wireValue() + "'");
        }

        double value = observation.getValue();
        double threshold = thresholdSource.thresholdOf(config);

        if (!breaches(value, threshold)) {
            return Optional.empty();
        }

        LOG.debug("Rule [{}] fired for model {}: value={} threshold={}",
                metricType.wireValue(), observation.getModelId(), value, threshold);

        return Optional.of(AlertDraft.builder()
                .modelId(observation.getModelId())
                .alertType(alertType)
                .severity(SeverityCalculator.severityOf(value, threshold))
                .metricType(metricType)
                .thresholdValue(threshold)
                .currentValue(value)
                .observedAt(observation.getTimestamp())
                .observationId(observation.getObservationId())
                .title(alertType.label() + " on model " + observation.getModelId())
                .message(String.format(Locale.ROOT, "%s=%.4f %s threshold %.4f",
                        metricType.wireValue(), value, breachVerb(), threshold))
                .metadata(observation.getMetadata())
                .tags(observation.getTags())
                .build());
    }

    @Override
    public MetricType getMetricType() {
        return metricType;
    }

    public AlertType getAlertType() {
        return alertType;
    }
}
