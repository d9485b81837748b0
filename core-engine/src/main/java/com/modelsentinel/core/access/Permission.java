package com.modelsentinel.core.access;

import com.modelsentinel.core.error.ValidationException;

import java.util.Locale;

/** Capability checked before an operation is allowed. */
public enum Permission {

    MANAGE_MODELS("manage_models"),
    VIEW_METRICS("view_metrics"),
    GENERATE_REPORTS("generate_reports"),
    MANAGE_ALERTS("manage_alerts");

    private final String wireValue;

    Permission(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static Permission fromWire(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (Permission p : values()) {
                if (p.wireValue.equals(normalized)) {
                    return p;
                }
            }
        }
        throw new ValidationException("Unknown permission: '" + value + "'");
    }
}
