package com.modelsentinel.core.error;

import com.modelsentinel.core.model.AlertStatus;

/**
 * Raised when a lifecycle operation is attempted from a status that forbids
 * it. The alert is left unchanged.
 *
 * @since 1.0.0
 */
public class InvalidTransitionException extends MonitoringException {

    private static final long serialVersionUID = 1L;

    private final String alertId;
    private final String operation;
    private final AlertStatus currentStatus;

    public InvalidTransitionException(String alertId, String operation, AlertStatus currentStatus) {
        super("Cannot " + operation + " alert " + alertId + " in status " + currentStatus.wireValue());
        this.alertId = alertId;
        this.operation = operation;
        this.currentStatus = currentStatus;
    }

    public String getAlertId() {
        return alertId;
    }

    public String getOperation() {
        return operation;
    }

    /**
     * @return the status the alert actually has
     */
    public AlertStatus getCurrentStatus() {
        return currentStatus;
    }
}
