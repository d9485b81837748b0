package com.modelsentinel.core.notification;

import com.modelsentinel.core.model.Alert;

import java.util.List;

/**
 * Receives alert events from the engine and attempts delivery on each of
 * the model's configured channels.
 *
 * <p>
 * The engine calls the dispatcher synchronously and records every returned
 * result on the alert before the triggering request completes.
 * Implementations must return one result per attempted channel, in order,
 * and must not throw for a failed delivery.
 * </p>
 */
public interface NotificationDispatcher {

    /**
     * @param alert    the newly created alert
     * @param channels channel identifiers to attempt, in order
     * @return one result per attempted channel
     */
    List<DeliveryResult> onAlertCreated(Alert alert, List<String> channels);

    /**
     * @param alert    the alert after a lifecycle transition
     * @param channels channel identifiers to attempt, in order
     * @return one result per attempted channel
     */
    List<DeliveryResult> onAlertUpdated(Alert alert, List<String> channels);
}
