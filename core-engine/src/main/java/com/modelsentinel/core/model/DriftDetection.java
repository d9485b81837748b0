package com.modelsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.modelsentinel.core.error.ValidationException;

import java.util.Locale;

/** Tri-state drift verdict reported by the upstream detector. */
public enum DriftDetection {

    TRUE("true"),
    FALSE("false"),
    UNKNOWN("unknown");

    private final String wireValue;

    DriftDetection(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static DriftDetection fromWire(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (DriftDetection d : values()) {
            if (d.wireValue.equals(normalized)) {
                return d;
            }
        }
        throw new ValidationException("Unknown drift verdict: '" + value + "'");
    }
}
