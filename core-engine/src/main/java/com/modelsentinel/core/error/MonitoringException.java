package com.modelsentinel.core.error;

/**
 * Root of the typed failures raised by the monitoring engine.
 *
 * <p>
 * Every failure the engine reports to its callers is a subclass of this
 * type. Nothing below the engine's public operations is swallowed: each
 * failure either propagates as one of these subclasses or wraps the
 * underlying cause.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class MonitoringException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected MonitoringException(String message) {
        super(message);
    }

    protected MonitoringException(String message, Throwable cause) {
        super(message, cause);
    }
}
