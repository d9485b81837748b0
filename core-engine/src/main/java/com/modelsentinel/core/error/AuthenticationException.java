package com.modelsentinel.core.error;

/**
 * Raised when credentials cannot be turned into a principal.
 *
 * @since 1.0.0
 */
public class AuthenticationException extends MonitoringException {

    private static final long serialVersionUID = 1L;

    public AuthenticationException(String message) {
        super(message);
    }
}
