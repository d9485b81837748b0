package com.modelsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.modelsentinel.core.error.ValidationException;

import java.util.Locale;

/**
 * Category of an alert.
 *
 * @since 1.0.0
 */
public enum AlertType {

    DRIFT_DETECTED("drift_detected", "Drift detected"),
    ACCURACY_DEGRADATION("accuracy_degradation", "Accuracy degradation"),
    LATENCY_INCREASE("latency_increase", "Latency increase"),
    ERROR_RATE_SPIKE("error_rate_spike", "Error rate spike"),
    DATA_QUALITY_ISSUE("data_quality_issue", "Data quality issue"),
    MODEL_FAILURE("model_failure", "Model failure"),
    INFRASTRUCTURE_ISSUE("infrastructure_issue", "Infrastructure issue"),
    COMPLIANCE_VIOLATION("compliance_violation", "Compliance violation");

    private final String wireValue;
    private final String label;

    AlertType(String wireValue, String label) {
        this.wireValue = wireValue;
        this.label = label;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /**
     * @return human-readable label used in alert titles
     */
    public String label() {
        return label;
    }

    @JsonCreator
    public static AlertType fromWire(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (AlertType type : values()) {
                if (type.wireValue.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new ValidationException("Unknown alert_type: '" + value + "'");
    }
}
