package com.modelsentinel.core.notification;

/** Why an alert is being handed to the notification dispatcher. */
public enum AlertEventKind {
    /** A new OPEN alert was created. */
    CREATED,
    /** An existing alert went through a lifecycle transition. */
    UPDATED
}
