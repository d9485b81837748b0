package com.modelsentinel.core.notification;

import com.modelsentinel.core.model.Alert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link NotificationDispatcher} that routes to registered
 * {@link NotificationChannel}s by id.
 *
 * <p>
 * Channels are attempted one after another in configuration order. An
 * unknown channel id, a channel returning {@code false} and a channel
 * throwing are all reported as failed attempts; the remaining channels are
 * still tried.
 * </p>
 *
 * @since 1.0.0
 */
public class ChannelNotificationDispatcher implements NotificationDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(ChannelNotificationDispatcher.class);

    private final Map<String, NotificationChannel> channels;

    /**
     * @param channels available channels; ids must be unique
     * @throws IllegalArgumentException on duplicate ids
     */
    public ChannelNotificationDispatcher(Collection<? extends NotificationChannel> channels) {
        Objects.requireNonNull(channels, "channels must not be null");
        Map<String, NotificationChannel> byId = new LinkedHashMap<>();
        for (NotificationChannel channel : channels) {
            if (byId.putIfAbsent(channel.id(), channel) != null) {
                throw new IllegalArgumentException("Duplicate notification channel id: " + channel.id());
            }
        }
        this.channels = Collections.unmodifiableMap(byId);
        LOG.info("Notification channels available: {}", this.channels.keySet());
    }

    @Override
    public List<DeliveryResult> onAlertCreated(Alert alert, List<String> channelIds) {
        return dispatch(alert, channelIds, AlertEventKind.CREATED);
    }

    @Override
    public List<DeliveryResult> onAlertUpdated(Alert alert, List<String> channelIds) {
        return dispatch(alert, channelIds, AlertEventKind.UPDATED);
    }

    private List<DeliveryResult> dispatch(Alert alert, List<String> channelIds, AlertEventKind kind) {
        Objects.requireNonNull(alert, "alert must not be null");
        Objects.requireNonNull(channelIds, "channelIds must not be null");

        List<DeliveryResult> results = new ArrayList<>(channelIds.size());
        for (String id : channelIds) {
            results.add(attempt(alert, id, kind));
        }
        return results;
    }

    private DeliveryResult attempt(Alert alert, String channelId, AlertEventKind kind) {
        NotificationChannel channel = channels.get(channelId);
        if (channel == null) {
            LOG.warn("Alert {}: unknown notification channel '{}'", alert.getAlertId(), channelId);
            return DeliveryResult.failed(channelId, "unknown channel");
        }
        try {
            if (channel.deliver(alert, kind)) {
                return DeliveryResult.delivered(channelId);
            }
            LOG.warn("Alert {}: channel '{}' rejected the {} event", alert.getAlertId(), channelId, kind);
            return DeliveryResult.failed(channelId, "rejected by channel");
        } catch (Exception e) {
            LOG.warn("Alert {}: channel '{}' failed: {}", alert.getAlertId(), channelId, e.getMessage(), e);
            return DeliveryResult.failed(channelId, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
