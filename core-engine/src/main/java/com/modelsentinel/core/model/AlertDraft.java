package com.modelsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Proposal for a new alert, produced by the threshold evaluator when an
 * observation breaches its model's policy.
 *
 * <p>
 * A draft has no identity and no lifecycle status. The engine either turns
 * it into an OPEN {@link Alert} or, when an active alert of the same type is
 * inside its cooldown, uses it only to refresh that alert's current value.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertDraft implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String modelId;
    private final AlertType alertType;
    private final AlertSeverity severity;
    private final MetricType metricType;
    private final double thresholdValue;
    private final double currentValue;
    private final Instant observedAt;
    private final String observationId;
    private final String title;
    private final String message;
    private final Map<String, Object> metadata;
    private final List<String> tags;

    private AlertDraft(Builder b) {
        this.modelId = Objects.requireNonNull(b.modelId, "modelId must not be null");
        this.alertType = Objects.requireNonNull(b.alertType, "alertType must not be null");
        this.severity = Objects.requireNonNull(b.severity, "severity must not be null");
        this.metricType = Objects.requireNonNull(b.metricType, "metricType must not be null");
        this.observedAt = Objects.requireNonNull(b.observedAt, "observedAt must not be null");
        this.thresholdValue = b.thresholdValue;
        this.currentValue = b.currentValue;
        this.observationId = b.observationId;
        this.title = b.title;
        this.message = b.message;
        this.metadata = JsonValues.immutableCopy(b.metadata);
        this.tags = Collections.unmodifiableList(new ArrayList<>(b.tags));
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getModelId() {
        return modelId;
    }

    public AlertType getAlertType() {
        return alertType;
    }

    public AlertSeverity getSeverity() {
        return severity;
    }

    public MetricType getMetricType() {
        return metricType;
    }

    public double getThresholdValue() {
        return thresholdValue;
    }

    public double getCurrentValue() {
        return currentValue;
    }

    /**
     * @return timestamp of the breaching observation
     */
    public Instant getObservedAt() {
        return observedAt;
    }

    public String getObservationId() {
        return observationId;
    }

    public String getTitle() {
        return title;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public List<String> getTags() {
        return tags;
    }

    /** Fluent builder for {@link AlertDraft}. */
    public static class Builder {
        private String modelId;
        private AlertType alertType;
        private AlertSeverity severity;
        private MetricType metricType;
        private double thresholdValue;
        private double currentValue;
        private Instant observedAt;
        private String observationId;
        private String title;
        private String message;
        private Map<String, Object> metadata = Map.of();
        private List<String> tags = List.of();

        public Builder modelId(String modelId) {
            this.modelId = modelId;
            return this;
        }

        public Builder alertType(AlertType alertType) {
            this.alertType = alertType;
            return this;
        }

        public Builder severity(AlertSeverity severity) {
            this.severity = severity;
            return this;
        }

        public Builder metricType(MetricType metricType) {
            this.metricType = metricType;
            return this;
        }

        public Builder thresholdValue(double thresholdValue) {
            this.thresholdValue = thresholdValue;
            return this;
        }

        public Builder currentValue(double currentValue) {
            this.currentValue = currentValue;
            return this;
        }

        public Builder observedAt(Instant observedAt) {
            this.observedAt = observedAt;
            return this;
        }

        public Builder observationId(String observationId) {
            this.observationId = observationId;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata != null ? metadata : Map.of();
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags != null ? tags : List.of();
            return this;
        }

        public AlertDraft build() {
            return new AlertDraft(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertDraft that))
            return false;
        return Double.compare(thresholdValue, that.thresholdValue) == 0
                && Double.compare(currentValue, that.currentValue) == 0
                && Objects.equals(modelId, that.modelId)
                && alertType == that.alertType
                && severity == that.severity
                && Objects.equals(observedAt, that.observedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(modelId, alertType, severity, thresholdValue, currentValue, observedAt);
    }

    @Override
    public String toString() {
        return "AlertDraft{" +
                "modelId='" + modelId + '\'' +
                ", alertType=" + alertType +
                ", severity=" + severity +
                ", thresholdValue=" + thresholdValue +
                ", currentValue=" + currentValue +
                ", observedAt=" + observedAt +
                '}';
    }
}
