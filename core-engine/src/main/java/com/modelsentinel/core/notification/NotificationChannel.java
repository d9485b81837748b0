package com.modelsentinel.core.notification;

import com.modelsentinel.core.model.Alert;

/**
 * A single delivery transport (email, Slack, webhook, ...).
 *
 * <p>
 * Transport mechanics live outside the engine. A channel only reports
 * whether delivery worked; throwing is treated as a failed attempt.
 * </p>
 */
public interface NotificationChannel {

    /**
     * @return identifier referenced from a model's {@code alertChannels}
     */
    String id();

    /**
     * Deliver one alert event.
     *
     * @param alert the alert snapshot to announce
     * @param kind  whether the alert was created or updated
     * @return {@code true} if the transport accepted the message
     * @throws Exception on transport failure
     */
    boolean deliver(Alert alert, AlertEventKind kind) throws Exception;
}
