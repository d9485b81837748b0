package com.modelsentinel.flink;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.modelsentinel.core.model.Alert;

import java.io.Serializable;
import java.util.Locale;
import java.util.Objects;

/**
 * Record published to the alerts topic whenever an observation opens or
 * refreshes an alert.
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"event", "observation_id", "alert"})
public final class AlertEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    /** What happened to the alert. */
    public enum Kind {
        /** A new alert was opened. */
        CREATED,
        /** An active alert absorbed a repeated breach inside its cooldown. */
        REFRESHED
    }

    private final Kind kind;
    private final String observationId;
    private final Alert alert;

    public AlertEvent(Kind kind, String observationId, Alert alert) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.observationId = Objects.requireNonNull(observationId, "observationId must not be null");
        this.alert = Objects.requireNonNull(alert, "alert must not be null");
    }

    @JsonIgnore
    public Kind getKind() {
        return kind;
    }

    @JsonProperty("event")
    public String getEvent() {
        return kind.name().toLowerCase(Locale.ROOT);
    }

    @JsonProperty("observation_id")
    public String getObservationId() {
        return observationId;
    }

    @JsonProperty("alert")
    public Alert getAlert() {
        return alert;
    }

    @Override
    public String toString() {
        return "AlertEvent{kind=" + kind + ", observationId='" + observationId
                + "', alertId='" + alert.getAlertId() + "'}";
    }
}
