package com.modelsentinel.core.access;

import com.modelsentinel.core.error.ValidationException;

import java.util.Locale;

/** User role. Permissions per role are defined by {@link CapabilityTable}. */
public enum Role {

    ADMIN("admin"),
    DATA_SCIENTIST("data_scientist"),
    ML_ENGINEER("ml_engineer"),
    BUSINESS_ANALYST("business_analyst"),
    VIEWER("viewer");

    private final String wireValue;

    Role(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static Role fromWire(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (Role role : values()) {
                if (role.wireValue.equals(normalized)) {
                    return role;
                }
            }
        }
        throw new ValidationException("Unknown role: '" + value + "'");
    }
}
