package com.modelsentinel.core.store;

import com.modelsentinel.core.error.ConcurrencyConflictException;
import com.modelsentinel.core.model.Alert;
import com.modelsentinel.core.model.AlertType;

import java.util.List;
import java.util.Optional;

/**
 * Durable home of alert snapshots.
 *
 * <p>
 * Alerts are never deleted. Writes use optimistic concurrency: an update is
 * accepted only if the stored snapshot is the direct predecessor of the new
 * one ({@code stored.version == next.version - 1}).
 * </p>
 */
public interface AlertStore {

    /**
     * Store a new alert.
     *
     * @throws IllegalStateException if an alert with the same id exists
     */
    void insert(Alert alert);

    /**
     * Replace the stored snapshot with its successor.
     *
     * @param next the successor snapshot
     * @throws ConcurrencyConflictException if the stored version is not
     *                                      {@code next.getVersion() - 1}
     * @throws com.modelsentinel.core.error.NotFoundException if the alert
     *                                      does not exist
     */
    void update(Alert next);

    Optional<Alert> findById(String alertId);

    /**
     * @return the most recently triggered OPEN or ACKNOWLEDGED alert of the
     *         given model and type
     */
    Optional<Alert> findLatestActive(String modelId, AlertType alertType);

    /**
     * @return every alert of the model, most recently triggered first
     */
    List<Alert> findByModel(String modelId);
}
