package com.modelsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.modelsentinel.core.error.ValidationException;

import java.util.Locale;

/** Kind of distribution shift reported with a drift score. */
public enum DriftType {

    COVARIATE_DRIFT("covariate_drift"),
    LABEL_DRIFT("label_drift"),
    CONCEPT_DRIFT("concept_drift"),
    FEATURE_DRIFT("feature_drift");

    private final String wireValue;

    DriftType(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static DriftType fromWire(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (DriftType type : values()) {
                if (type.wireValue.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new ValidationException("Unknown drift_type: '" + value + "'");
    }
}
