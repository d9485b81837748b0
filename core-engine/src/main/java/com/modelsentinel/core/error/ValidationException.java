package com.modelsentinel.core.error;

import java.util.List;

/**
 * Raised when an observation or a monitoring configuration is malformed.
 *
 * <p>
 * Validation happens before evaluation, so nothing has been persisted when
 * this is thrown.
 * </p>
 *
 * @since 1.0.0
 */
public class ValidationException extends MonitoringException {

    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public ValidationException(String message) {
        super(message);
        this.errors = List.of(message);
    }

    public ValidationException(String subject, List<String> errors) {
        super("Invalid " + subject + ": " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    /**
     * @return every individual problem that was found
     */
    public List<String> getErrors() {
        return errors;
    }
}
