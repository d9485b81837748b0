package com.modelsentinel.core.notification;

import com.modelsentinel.core.model.Alert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Channel that writes alert events to the application log. Always succeeds.
 */
public class LoggingNotificationChannel implements NotificationChannel {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingNotificationChannel.class);

    private final String id;

    public LoggingNotificationChannel(String id) {
        this.id = Objects.requireNonNull(id, "id must not be null");
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean deliver(Alert alert, AlertEventKind kind) {
        LOG.info("[{}] {} alert {} model={} type={} severity={} status={} value={} threshold={}",
                id, kind, alert.getAlertId(), alert.getModelId(), alert.getAlertType().wireValue(),
                alert.getSeverity().wireValue(), alert.getStatus().wireValue(),
                alert.getCurrentValue(), alert.getThresholdValue());
        return true;
    }
}
