package com.modelsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.modelsentinel.core.error.ValidationException;

import java.util.Locale;
import java.util.Optional;

/**
 * Kind of a metric observation.
 *
 * <p>
 * Each type optionally maps to the {@link AlertType} raised when an
 * observation of that type breaches its threshold. Types without a mapping
 * never raise alerts.
 * </p>
 *
 * @since 1.0.0
 */
public enum MetricType {

    ACCURACY("accuracy", AlertType.ACCURACY_DEGRADATION),
    PRECISION("precision", null),
    RECALL("recall", null),
    F1_SCORE("f1_score", null),
    LATENCY("latency", AlertType.LATENCY_INCREASE),
    THROUGHPUT("throughput", null),
    ERROR_RATE("error_rate", AlertType.ERROR_RATE_SPIKE),
    DRIFT_SCORE("drift_score", AlertType.DRIFT_DETECTED),
    DATA_QUALITY("data_quality", AlertType.DATA_QUALITY_ISSUE),
    BUSINESS_IMPACT("business_impact", null);

    private final String wireValue;
    private final AlertType alertType;

    MetricType(String wireValue, AlertType alertType) {
        this.wireValue = wireValue;
        this.alertType = alertType;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /**
     * @return the alert type raised for breaches of this metric, if any
     */
    public Optional<AlertType> alertType() {
        return Optional.ofNullable(alertType);
    }

    /**
     * Parse a wire identifier (case-insensitive). {@code f1} is accepted as an
     * alias of {@code f1_score}.
     *
     * @param value wire identifier
     * @return the matching type
     * @throws ValidationException if the value is blank or unknown
     */
    @JsonCreator
    public static MetricType fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("metric_type is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("f1".equals(normalized)) {
            return F1_SCORE;
        }
        for (MetricType type : values()) {
            if (type.wireValue.equals(normalized)) {
                return type;
            }
        }
        throw new ValidationException("Unknown metric_type: '" + value + "'");
    }
}
