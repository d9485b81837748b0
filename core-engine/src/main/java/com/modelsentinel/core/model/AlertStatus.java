package com.modelsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.modelsentinel.core.error.ValidationException;

import java.util.Locale;

/**
 * Alert lifecycle status. Declaration order is the forward order of the
 * lifecycle; an alert never moves to a status declared before its current one.
 *
 * @since 1.0.0
 */
public enum AlertStatus {

    OPEN("open"),
    ACKNOWLEDGED("acknowledged"),
    RESOLVED("resolved"),
    CLOSED("closed");

    private final String wireValue;

    AlertStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /**
     * @return {@code true} for statuses that still count toward cooldown
     */
    public boolean isActive() {
        return this == OPEN || this == ACKNOWLEDGED;
    }

    public boolean isTerminal() {
        return this == CLOSED;
    }

    /**
     * @param target the status to move to
     * @return {@code true} if {@code target} lies strictly after this status
     */
    public boolean precedes(AlertStatus target) {
        return ordinal() < target.ordinal();
    }

    @JsonCreator
    public static AlertStatus fromWire(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (AlertStatus status : values()) {
                if (status.wireValue.equals(normalized)) {
                    return status;
                }
            }
        }
        throw new ValidationException("Unknown alert status: '" + value + "'");
    }
}
