package com.modelsentinel.core.store;

import com.modelsentinel.core.error.ConcurrencyConflictException;
import com.modelsentinel.core.error.NotFoundException;
import com.modelsentinel.core.model.Alert;
import com.modelsentinel.core.model.AlertType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory {@link AlertStore} that keeps only the most recently inserted
 * alert of each (model, alert type).
 *
 * <p>
 * The engine opens a new alert for a key only when no active alert of that
 * key falls inside the cooldown window, so the superseded alert can no
 * longer suppress anything and is evicted on insert. Memory is bounded by
 * models times alert types. Callers that need the full audit trail use a
 * durable store instead; a streaming job publishes every alert downstream.
 * </p>
 *
 * <p>
 * Version checks on {@link #update(Alert)} work as in
 * {@link InMemoryAlertStore}. An update of an evicted alert raises
 * {@link NotFoundException}.
 * </p>
 *
 * @since 1.0.0
 */
public class LatestAlertStore implements AlertStore {

    private static final Logger LOG = LoggerFactory.getLogger(LatestAlertStore.class);

    private static final Comparator<Alert> MOST_RECENT_FIRST =
            Comparator.comparing(Alert::getTriggeredAt).reversed();

    private final Map<String, Alert> latestByKey = new HashMap<>();
    private final Map<String, String> keyById = new HashMap<>();

    @Override
    public synchronized void insert(Alert alert) {
        Objects.requireNonNull(alert, "Alert must not be null");
        if (keyById.containsKey(alert.getAlertId())) {
            throw new IllegalStateException("Alert already exists: " + alert.getAlertId());
        }
        String key = keyOf(alert.getModelId(), alert.getAlertType());
        Alert superseded = latestByKey.put(key, alert);
        keyById.put(alert.getAlertId(), key);
        if (superseded != null) {
            keyById.remove(superseded.getAlertId());
            LOG.debug("Alert {} superseded by {} for {}", superseded.getAlertId(), alert.getAlertId(), key);
        }
    }

    @Override
    public synchronized void update(Alert next) {
        Objects.requireNonNull(next, "Alert must not be null");
        String key = keyById.get(next.getAlertId());
        if (key == null) {
            throw NotFoundException.alert(next.getAlertId());
        }
        Alert stored = latestByKey.get(key);
        if (stored.getVersion() != next.getVersion() - 1) {
            throw new ConcurrencyConflictException(next.getAlertId(), next.getVersion() - 1);
        }
        latestByKey.put(key, next);
    }

    @Override
    public synchronized Optional<Alert> findById(String alertId) {
        String key = keyById.get(alertId);
        return key == null ? Optional.empty() : Optional.of(latestByKey.get(key));
    }

    @Override
    public synchronized Optional<Alert> findLatestActive(String modelId, AlertType alertType) {
        return Optional.ofNullable(latestByKey.get(keyOf(modelId, alertType)))
                .filter(Alert::isActive);
    }

    @Override
    public synchronized List<Alert> findByModel(String modelId) {
        return latestByKey.values().stream()
                .filter(a -> a.getModelId().equals(modelId))
                .sorted(MOST_RECENT_FIRST)
                .toList();
    }

    /** Alerts currently retained. */
    public synchronized int size() {
        return latestByKey.size();
    }

    private static String keyOf(String modelId, AlertType alertType) {
        return modelId + '|' + alertType.wireValue();
    }
}
