package com.modelsentinel.core.error;

/**
 * Raised when an alert changed between being read and being written.
 *
 * <p>
 * The write did not take effect. Callers should re-read the alert and
 * decide whether to retry.
 * </p>
 *
 * @since 1.0.0
 */
public class ConcurrencyConflictException extends MonitoringException {

    private static final long serialVersionUID = 1L;

    private final String alertId;
    private final long expectedVersion;

    public ConcurrencyConflictException(String alertId, long expectedVersion) {
        super("Alert " + alertId + " was modified concurrently (expected version "
                + expectedVersion + ")");
        this.alertId = alertId;
        this.expectedVersion = expectedVersion;
    }

    public String getAlertId() {
        return alertId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }
}
