package com.modelsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.modelsentinel.core.error.ValidationException;

import java.util.Locale;

/**
 * Alert severity, ordered from least to most severe.
 *
 * @since 1.0.0
 */
public enum AlertSeverity {

    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String wireValue;

    AlertSeverity(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static AlertSeverity fromWire(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (AlertSeverity severity : values()) {
                if (severity.wireValue.equals(normalized)) {
                    return severity;
                }
            }
        }
        throw new ValidationException("Unknown severity: '" + value + "'");
    }
}
