package com.modelsentinel.core.error;

/**
 * Raised for an unknown model or alert id.
 *
 * @since 1.0.0
 */
public class NotFoundException extends MonitoringException {

    private static final long serialVersionUID = 1L;

    private final String kind;
    private final String id;

    public NotFoundException(String kind, String id) {
        super(kind + " not found: " + id);
        this.kind = kind;
        this.id = id;
    }

    public static NotFoundException model(String modelId) {
        return new NotFoundException("Model", modelId);
    }

    public static NotFoundException alert(String alertId) {
        return new NotFoundException("Alert", alertId);
    }

    public String getKind() {
        return kind;
    }

    public String getId() {
        return id;
    }
}
