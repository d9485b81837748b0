package com.modelsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Alert raised when a metric observation breaches its model's threshold.
 *
 * <p>
 * Instances are immutable snapshots. Every change produces a new snapshot
 * with {@link #getVersion()} incremented by one; the alert store only
 * accepts a snapshot whose predecessor version matches the stored one.
 * Changes go through
 * {@link com.modelsentinel.core.lifecycle.AlertLifecycle}, which enforces the
 * forward-only status order.
 * </p>
 *
 * <h3>Write-once fields</h3>
 * <p>
 * {@code triggeredAt} is fixed at creation. The acknowledgment, resolution
 * and closure stamps are each set by their own transition and never again.
 * {@code timeToResolveMinutes} is computed at resolution and never
 * recomputed.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({"alert_id", "model_id", "alert_type", "severity", "status"})
public final class Alert implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String alertId;
    private final String modelId;
    private final AlertType alertType;
    private final AlertSeverity severity;
    private final AlertStatus status;

    private final String title;
    private final String message;

    private final MetricType metricType;
    private final String observationId;
    private final double thresholdValue;
    private final double currentValue;

    private final Instant triggeredAt;
    private final Instant acknowledgedAt;
    private final String acknowledgedBy;
    private final Instant resolvedAt;
    private final String resolvedBy;
    private final String resolutionAction;
    private final String resolutionNotes;
    private final Long timeToResolveMinutes;
    private final Instant closedAt;
    private final String closedBy;

    private final boolean notificationSent;
    private final List<String> notificationChannels;
    private final int notificationAttempts;

    private final Map<String, Object> metadata;
    private final List<String> tags;

    private final Instant updatedAt;
    private final long version;

    private Alert(Builder b) {
        this.alertId = Objects.requireNonNull(b.alertId, "alertId must not be null");
        this.modelId = Objects.requireNonNull(b.modelId, "modelId must not be null");
        this.alertType = Objects.requireNonNull(b.alertType, "alertType must not be null");
        this.severity = Objects.requireNonNull(b.severity, "severity must not be null");
        this.status = Objects.requireNonNull(b.status, "status must not be null");
        this.triggeredAt = Objects.requireNonNull(b.triggeredAt, "triggeredAt must not be null");
        this.title = b.title;
        this.message = b.message;
        this.metricType = b.metricType;
        this.observationId = b.observationId;
        this.thresholdValue = b.thresholdValue;
        this.currentValue = b.currentValue;
        this.acknowledgedAt = b.acknowledgedAt;
        this.acknowledgedBy = b.acknowledgedBy;
        this.resolvedAt = b.resolvedAt;
        this.resolvedBy = b.resolvedBy;
        this.resolutionAction = b.resolutionAction;
        this.resolutionNotes = b.resolutionNotes;
        this.timeToResolveMinutes = b.timeToResolveMinutes;
        this.closedAt = b.closedAt;
        this.closedBy = b.closedBy;
        this.notificationSent = b.notificationSent;
        this.notificationChannels = Collections.unmodifiableList(new ArrayList<>(b.notificationChannels));
        this.notificationAttempts = b.notificationAttempts;
        this.metadata = JsonValues.immutableCopy(b.metadata);
        this.tags = Collections.unmodifiableList(new ArrayList<>(b.tags));
        this.updatedAt = b.updatedAt;
        this.version = b.version;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-populated with every field of this snapshot
     */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.alertId = alertId;
        b.modelId = modelId;
        b.alertType = alertType;
        b.severity = severity;
        b.status = status;
        b.title = title;
        b.message = message;
        b.metricType = metricType;
        b.observationId = observationId;
        b.thresholdValue = thresholdValue;
        b.currentValue = currentValue;
        b.triggeredAt = triggeredAt;
        b.acknowledgedAt = acknowledgedAt;
        b.acknowledgedBy = acknowledgedBy;
        b.resolvedAt = resolvedAt;
        b.resolvedBy = resolvedBy;
        b.resolutionAction = resolutionAction;
        b.resolutionNotes = resolutionNotes;
        b.timeToResolveMinutes = timeToResolveMinutes;
        b.closedAt = closedAt;
        b.closedBy = closedBy;
        b.notificationSent = notificationSent;
        b.notificationChannels = new ArrayList<>(notificationChannels);
        b.notificationAttempts = notificationAttempts;
        b.metadata = new LinkedHashMap<>(metadata);
        b.tags = new ArrayList<>(tags);
        b.updatedAt = updatedAt;
        b.version = version;
        return b;
    }

    /**
     * Whole minutes elapsed since the alert was triggered. Derived on every
     * call, never stored.
     *
     * @param now the reference instant
     * @return elapsed minutes, or 0 if {@code now} precedes the trigger time
     */
    public long timeSinceTriggeredMinutes(Instant now) {
        Duration elapsed = Duration.between(triggeredAt, now);
        return elapsed.isNegative() ? 0 : elapsed.toMinutes();
    }

    @JsonIgnore
    public boolean isActive() {
        return status.isActive();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    @JsonProperty("alert_id")
    public String getAlertId() {
        return alertId;
    }

    @JsonProperty("model_id")
    public String getModelId() {
        return modelId;
    }

    @JsonProperty("alert_type")
    public AlertType getAlertType() {
        return alertType;
    }

    @JsonProperty("severity")
    public AlertSeverity getSeverity() {
        return severity;
    }

    @JsonProperty("status")
    public AlertStatus getStatus() {
        return status;
    }

    @JsonProperty("title")
    public String getTitle() {
        return title;
    }

    @JsonProperty("message")
    public String getMessage() {
        return message;
    }

    @JsonProperty("metric_type")
    public MetricType getMetricType() {
        return metricType;
    }

    @JsonProperty("observation_id")
    public String getObservationId() {
        return observationId;
    }

    @JsonProperty("threshold_value")
    public double getThresholdValue() {
        return thresholdValue;
    }

    @JsonProperty("current_value")
    public double getCurrentValue() {
        return currentValue;
    }

    @JsonProperty("triggered_at")
    public Instant getTriggeredAt() {
        return triggeredAt;
    }

    @JsonProperty("acknowledged_at")
    public Instant getAcknowledgedAt() {
        return acknowledgedAt;
    }

    @JsonProperty("acknowledged_by")
    public String getAcknowledgedBy() {
        return acknowledgedBy;
    }

    @JsonProperty("resolved_at")
    public Instant getResolvedAt() {
        return resolvedAt;
    }

    @JsonProperty("resolved_by")
    public String getResolvedBy() {
        return resolvedBy;
    }

    @JsonProperty("resolution_action")
    public String getResolutionAction() {
        return resolutionAction;
    }

    @JsonProperty("resolution_notes")
    public String getResolutionNotes() {
        return resolutionNotes;
    }

    @JsonProperty("time_to_resolve")
    public Long getTimeToResolveMinutes() {
        return timeToResolveMinutes;
    }

    @JsonProperty("closed_at")
    public Instant getClosedAt() {
        return closedAt;
    }

    @JsonProperty("closed_by")
    public String getClosedBy() {
        return closedBy;
    }

    @JsonProperty("notification_sent")
    public boolean isNotificationSent() {
        return notificationSent;
    }

    /**
     * @return every channel attempted so far, in attempt order (repeats
     *         included)
     */
    @JsonProperty("notification_channels")
    public List<String> getNotificationChannels() {
        return notificationChannels;
    }

    @JsonProperty("notification_attempts")
    public int getNotificationAttempts() {
        return notificationAttempts;
    }

    @JsonProperty("metadata")
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    @JsonProperty("tags")
    public List<String> getTags() {
        return tags;
    }

    @JsonProperty("updated_at")
    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @JsonProperty("version")
    public long getVersion() {
        return version;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link Alert} snapshots.
     *
     * <p>
     * {@code alertId}, {@code modelId}, {@code alertType}, {@code severity},
     * {@code status} and {@code triggeredAt} are required; {@link #build()}
     * throws {@link NullPointerException} without them.
     * </p>
     */
    public static class Builder {
        private String alertId;
        private String modelId;
        private AlertType alertType;
        private AlertSeverity severity;
        private AlertStatus status = AlertStatus.OPEN;
        private String title;
        private String message;
        private MetricType metricType;
        private String observationId;
        private double thresholdValue;
        private double currentValue;
        private Instant triggeredAt;
        private Instant acknowledgedAt;
        private String acknowledgedBy;
        private Instant resolvedAt;
        private String resolvedBy;
        private String resolutionAction;
        private String resolutionNotes;
        private Long timeToResolveMinutes;
        private Instant closedAt;
        private String closedBy;
        private boolean notificationSent;
        private List<String> notificationChannels = new ArrayList<>();
        private int notificationAttempts;
        private Map<String, Object> metadata = new LinkedHashMap<>();
        private List<String> tags = new ArrayList<>();
        private Instant updatedAt;
        private long version;

        public Builder alertId(String alertId) {
            this.alertId = alertId;
            return this;
        }

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

        public Builder status(AlertStatus status) {
            this.status = status;
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

        public Builder metricType(MetricType metricType) {
            this.metricType = metricType;
            return this;
        }

        public Builder observationId(String observationId) {
            this.observationId = observationId;
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

        public Builder triggeredAt(Instant triggeredAt) {
            this.triggeredAt = triggeredAt;
            return this;
        }

        public Builder acknowledgedAt(Instant acknowledgedAt) {
            this.acknowledgedAt = acknowledgedAt;
            return this;
        }

        public Builder acknowledgedBy(String acknowledgedBy) {
            this.acknowledgedBy = acknowledgedBy;
            return this;
        }

        public Builder resolvedAt(Instant resolvedAt) {
            this.resolvedAt = resolvedAt;
            return this;
        }

        public Builder resolvedBy(String resolvedBy) {
            this.resolvedBy = resolvedBy;
            return this;
        }

        public Builder resolutionAction(String resolutionAction) {
            this.resolutionAction = resolutionAction;
            return this;
        }

        public Builder resolutionNotes(String resolutionNotes) {
            this.resolutionNotes = resolutionNotes;
            return this;
        }

        public Builder timeToResolveMinutes(Long timeToResolveMinutes) {
            this.timeToResolveMinutes = timeToResolveMinutes;
            return this;
        }

        public Builder closedAt(Instant closedAt) {
            this.closedAt = closedAt;
            return this;
        }

        public Builder closedBy(String closedBy) {
            this.closedBy = closedBy;
            return this;
        }

        public Builder notificationSent(boolean notificationSent) {
            this.notificationSent = notificationSent;
            return this;
        }

        public Builder notificationChannels(List<String> notificationChannels) {
            this.notificationChannels = notificationChannels != null
                    ? new ArrayList<>(notificationChannels)
                    : new ArrayList<>();
            return this;
        }

        public Builder notificationAttempts(int notificationAttempts) {
            this.notificationAttempts = notificationAttempts;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags != null ? new ArrayList<>(tags) : new ArrayList<>();
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Alert build() {
            return new Alert(this);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert alert))
            return false;
        return version == alert.version && Objects.equals(alertId, alert.alertId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(alertId, version);
    }

    @Override
    public String toString() {
        return "Alert{" +
                "alertId='" + alertId + '\'' +
                ", modelId='" + modelId + '\'' +
                ", alertType=" + alertType +
                ", severity=" + severity +
                ", status=" + status +
                ", currentValue=" + currentValue +
                ", thresholdValue=" + thresholdValue +
                ", triggeredAt=" + triggeredAt +
                ", version=" + version +
                '}';
    }
}
