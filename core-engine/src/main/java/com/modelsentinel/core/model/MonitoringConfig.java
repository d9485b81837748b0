package com.modelsentinel.core.model;

import com.modelsentinel.core.error.ValidationException;

import java.io.Serializable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Per-model thresholds and alert-routing policy.
 *
 * <p>
 * Loaded from YAML by SnakeYAML (hence the mutable bean shape) or built by
 * the model-management collaborator. The evaluator never reads a live
 * instance: it works on a {@link #snapshot()} so thresholds cannot change
 * during a single evaluation.
 * </p>
 *
 * <h3>Valid ranges</h3>
 * <ul>
 * <li>{@code driftThreshold} in [0, 1] (default {@value #DEFAULT_DRIFT_THRESHOLD})</li>
 * <li>{@code accuracyThreshold} in [0, 1] (default {@value #DEFAULT_ACCURACY_THRESHOLD})</li>
 * <li>{@code latencyThreshold} &gt; 0 ms (default {@value #DEFAULT_LATENCY_THRESHOLD})</li>
 * <li>{@code alertCooldownSeconds} &ge; 0 (default {@value #DEFAULT_ALERT_COOLDOWN_SECONDS})</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class MonitoringConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final double DEFAULT_DRIFT_THRESHOLD = 0.05;
    public static final double DEFAULT_ACCURACY_THRESHOLD = 0.8;
    public static final double DEFAULT_LATENCY_THRESHOLD = 100.0;
    public static final long DEFAULT_ALERT_COOLDOWN_SECONDS = 900;

    /** Owning model. */
    private String modelId;

    private double driftThreshold = DEFAULT_DRIFT_THRESHOLD;
    private double accuracyThreshold = DEFAULT_ACCURACY_THRESHOLD;

    /** Milliseconds. */
    private double latencyThreshold = DEFAULT_LATENCY_THRESHOLD;

    /** Ordered channel identifiers, e.g. {@code email}, {@code slack}. */
    private List<String> alertChannels = new ArrayList<>();

    private long alertCooldownSeconds = DEFAULT_ALERT_COOLDOWN_SECONDS;

    public MonitoringConfig() {
    }

    public MonitoringConfig(String modelId) {
        this.modelId = modelId;
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Check that every field is present and inside its valid range.
     *
     * @throws ValidationException listing every problem found
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (modelId == null || modelId.isBlank()) {
            errors.add("'modelId' is required");
        }
        if (!inRange(driftThreshold, 0, 1)) {
            errors.add("'driftThreshold' must be in [0, 1], got: " + driftThreshold);
        }
        if (!inRange(accuracyThreshold, 0, 1)) {
            errors.add("'accuracyThreshold' must be in [0, 1], got: " + accuracyThreshold);
        }
        if (!Double.isFinite(latencyThreshold) || latencyThreshold <= 0) {
            errors.add("'latencyThreshold' must be > 0, got: " + latencyThreshold);
        }
        if (alertCooldownSeconds < 0) {
            errors.add("'alertCooldownSeconds' must be >= 0, got: " + alertCooldownSeconds);
        }
        for (String channel : alertChannels) {
            if (channel == null || channel.isBlank()) {
                errors.add("'alertChannels' must not contain blank entries");
                break;
            }
        }

        if (!errors.isEmpty()) {
            throw new ValidationException("monitoring config for model '" + modelId + "'", errors);
        }
    }

    private static boolean inRange(double v, double min, double max) {
        return Double.isFinite(v) && v >= min && v <= max;
    }

    /**
     * @return an independent copy, safe to read while the original changes
     */
    public MonitoringConfig snapshot() {
        MonitoringConfig copy = new MonitoringConfig(modelId);
        copy.driftThreshold = driftThreshold;
        copy.accuracyThreshold = accuracyThreshold;
        copy.latencyThreshold = latencyThreshold;
        copy.alertChannels = new ArrayList<>(alertChannels);
        copy.alertCooldownSeconds = alertCooldownSeconds;
        return copy;
    }

    public Duration getAlertCooldown() {
        return Duration.ofSeconds(alertCooldownSeconds);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getModelId() {
        return modelId;
    }

    public void setModelId(String modelId) {
        this.modelId = modelId;
    }

    public double getDriftThreshold() {
        return driftThreshold;
    }

    public void setDriftThreshold(double driftThreshold) {
        this.driftThreshold = driftThreshold;
    }

    public double getAccuracyThreshold() {
        return accuracyThreshold;
    }

    public void setAccuracyThreshold(double accuracyThreshold) {
        this.accuracyThreshold = accuracyThreshold;
    }

    public double getLatencyThreshold() {
        return latencyThreshold;
    }

    public void setLatencyThreshold(double latencyThreshold) {
        this.latencyThreshold = latencyThreshold;
    }

    /**
     * @return unmodifiable list of channel identifiers, in dispatch order
     */
    public List<String> getAlertChannels() {
        return Collections.unmodifiableList(alertChannels);
    }

    public void setAlertChannels(List<String> alertChannels) {
        this.alertChannels = alertChannels != null ? new ArrayList<>(alertChannels) : new ArrayList<>();
    }

    public long getAlertCooldownSeconds() {
        return alertCooldownSeconds;
    }

    public void setAlertCooldownSeconds(long alertCooldownSeconds) {
        this.alertCooldownSeconds = alertCooldownSeconds;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MonitoringConfig that))
            return false;
        return Double.compare(driftThreshold, that.driftThreshold) == 0
                && Double.compare(accuracyThreshold, that.accuracyThreshold) == 0
                && Double.compare(latencyThreshold, that.latencyThreshold) == 0
                && alertCooldownSeconds == that.alertCooldownSeconds
                && Objects.equals(modelId, that.modelId)
                && Objects.equals(alertChannels, that.alertChannels);
    }

    @Override
    public int hashCode() {
        return Objects.hash(modelId, driftThreshold, accuracyThreshold, latencyThreshold,
                alertChannels, alertCooldownSeconds);
    }

    @Override
    public String toString() {
        return "MonitoringConfig{" +
                "modelId='" + modelId + '\'' +
                ", driftThreshold=" + driftThreshold +
                ", accuracyThreshold=" + accuracyThreshold +
                ", latencyThreshold=" + latencyThreshold +
                ", alertChannels=" + alertChannels +
                ", alertCooldownSeconds=" + alertCooldownSeconds +
                '}';
    }
}
