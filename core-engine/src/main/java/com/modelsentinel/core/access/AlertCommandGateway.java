package com.modelsentinel.core.access;

import com.modelsentinel.core.engine.MonitoringEngine;
import com.modelsentinel.core.error.AccessDeniedException;
import com.modelsentinel.core.model.Alert;

import java.util.List;
import java.util.Objects;

/**
 * Authenticated front door to the alert operations of
 * {@link MonitoringEngine}.
 *
 * <p>
 * Each call authenticates the bearer token, checks the required permission
 * and then delegates with the principal's id as the actor. Mutations require
 * {@link Permission#MANAGE_ALERTS}; reads require
 * {@link Permission#VIEW_METRICS}.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertCommandGateway {

    private final AccessControl accessControl;
    private final MonitoringEngine engine;

    public AlertCommandGateway(AccessControl accessControl, MonitoringEngine engine) {
        this.accessControl = Objects.requireNonNull(accessControl, "accessControl must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
    }

    public Alert acknowledge(String bearerToken, String alertId, String notes) {
        Principal actor = require(bearerToken, Permission.MANAGE_ALERTS);
        return engine.acknowledgeAlert(alertId, actor.getId(), notes);
    }

    public Alert resolve(String bearerToken, String alertId, String action, String notes) {
        Principal actor = require(bearerToken, Permission.MANAGE_ALERTS);
        return engine.resolveAlert(alertId, actor.getId(), action, notes);
    }

    public Alert close(String bearerToken, String alertId) {
        Principal actor = require(bearerToken, Permission.MANAGE_ALERTS);
        return engine.closeAlert(alertId, actor.getId());
    }

    public Alert get(String bearerToken, String alertId) {
        require(bearerToken, Permission.VIEW_METRICS);
        return engine.getAlert(alertId);
    }

    public List<Alert> listForModel(String bearerToken, String modelId) {
        require(bearerToken, Permission.VIEW_METRICS);
        return engine.findAlerts(modelId);
    }

    private Principal require(String bearerToken, Permission permission) {
        Principal principal = accessControl.authenticate(bearerToken);
        if (!accessControl.authorize(principal, permission)) {
            throw new AccessDeniedException(principal.getId(), permission);
        }
        return principal;
    }
}
