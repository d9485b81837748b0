package com.modelsentinel.core.store;

import com.modelsentinel.core.error.ConcurrencyConflictException;
import com.modelsentinel.core.error.NotFoundException;
import com.modelsentinel.core.model.Alert;
import com.modelsentinel.core.model.AlertType;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe, in-memory {@link AlertStore}.
 *
 * <p>
 * The version check and the write happen inside a single
 * {@link ConcurrentHashMap#compute} call, so two writers racing on the same
 * predecessor cannot both succeed.
 * </p>
 *
 * @since 1.0.0
 */
public class InMemoryAlertStore implements AlertStore {

    private static final Comparator<Alert> MOST_RECENT_FIRST =
            Comparator.comparing(Alert::getTriggeredAt).reversed();

    private final Map<String, Alert> alerts = new ConcurrentHashMap<>();

    @Override
    public void insert(Alert alert) {
        Objects.requireNonNull(alert, "Alert must not be null");
        Alert existing = alerts.putIfAbsent(alert.getAlertId(), alert);
        if (existing != null) {
            throw new IllegalStateException("Alert already exists: " + alert.getAlertId());
        }
    }

    @Override
    public void update(Alert next) {
        Objects.requireNonNull(next, "Alert must not be null");
        alerts.compute(next.getAlertId(), (id, stored) -> {
            if (stored == null) {
                throw NotFoundException.alert(id);
            }
            if (stored.getVersion() != next.getVersion() - 1) {
                throw new ConcurrencyConflictException(id, next.getVersion() - 1);
            }
            return next;
        });
    }

    @Override
    public Optional<Alert> findById(String alertId) {
        return Optional.ofNullable(alerts.get(alertId));
    }

    @Override
    public Optional<Alert> findLatestActive(String modelId, AlertType alertType) {
        return alerts.values().stream()
                .filter(a -> a.getModelId().equals(modelId))
                .filter(a -> a.getAlertType() == alertType)
                .filter(Alert::isActive)
                .min(MOST_RECENT_FIRST);
    }

    @Override
    public List<Alert> findByModel(String modelId) {
        return alerts.values().stream()
                .filter(a -> a.getModelId().equals(modelId))
                .sorted(MOST_RECENT_FIRST)
                .toList();
    }
}
