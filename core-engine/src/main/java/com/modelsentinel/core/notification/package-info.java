/**
 * Notification dispatch seam.
 *
 * <p>
 * The engine hands alert events to a
 * {@link com.modelsentinel.core.notification.NotificationDispatcher} and
 * records each {@link com.modelsentinel.core.notification.DeliveryResult}
 * on the alert before returning to its caller.
 * </p>
 *
 * @since 1.0.0
 */
package com.modelsentinel.core.notification;
