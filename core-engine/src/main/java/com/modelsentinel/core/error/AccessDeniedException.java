package com.modelsentinel.core.error;

import com.modelsentinel.core.access.Permission;

/**
 * Raised when an authenticated principal lacks a required permission.
 *
 * @since 1.0.0
 */
public class AccessDeniedException extends MonitoringException {

    private static final long serialVersionUID = 1L;

    private final String principalId;
    private final Permission permission;

    public AccessDeniedException(String principalId, Permission permission) {
        super("Principal " + principalId + " lacks permission " + permission.wireValue());
        this.principalId = principalId;
        this.permission = permission;
    }

    public String getPrincipalId() {
        return principalId;
    }

    public Permission getPermission() {
        return permission;
    }
}
