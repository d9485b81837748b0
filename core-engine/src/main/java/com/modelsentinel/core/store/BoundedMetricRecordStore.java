package com.modelsentinel.core.store;

import com.modelsentinel.core.model.MetricObservation;
import com.modelsentinel.core.model.MetricType;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * In-memory {@link MetricRecordStore} that keeps only the most recently
 * appended observations of each model.
 *
 * <p>
 * Each model has a queue of at most {@code capacityPerModel} entries. On
 * append, the oldest entries beyond that capacity are evicted together with
 * their id index entries, so memory is bounded by the number of models. Meant
 * for long-running streaming jobs where the history lives downstream.
 * </p>
 *
 * @since 1.0.0
 */
public class BoundedMetricRecordStore implements MetricRecordStore {

    private final int capacityPerModel;

    private final Map<String, Deque<MetricObservation>> byModel = new HashMap<>();
    private final Map<String, MetricObservation> byId = new HashMap<>();

    /**
     * @param capacityPerModel observations kept per model; must be &gt;= 1
     */
    public BoundedMetricRecordStore(int capacityPerModel) {
        if (capacityPerModel < 1) {
            throw new IllegalArgumentException("capacityPerModel must be >= 1, got: " + capacityPerModel);
        }
        this.capacityPerModel = capacityPerModel;
    }

    @Override
    public synchronized MetricObservation append(MetricObservation observation) {
        Objects.requireNonNull(observation, "Observation must not be null");
        MetricObservation stored = observation.withObservationId(UUID.randomUUID().toString());
        Deque<MetricObservation> series = byModel.computeIfAbsent(stored.getModelId(), k -> new ArrayDeque<>());
        series.addLast(stored);
        byId.put(stored.getObservationId(), stored);

        // Evict beyond capacity
        while (series.size() > capacityPerModel) {
            byId.remove(series.pollFirst().getObservationId());
        }
        return stored;
    }

    @Override
    public synchronized Optional<MetricObservation> findById(String observationId) {
        return Optional.ofNullable(byId.get(observationId));
    }

    @Override
    public synchronized List<MetricObservation> findByModel(String modelId) {
        Deque<MetricObservation> series = byModel.get(modelId);
        return series == null ? List.of() : List.copyOf(series);
    }

    @Override
    public List<MetricObservation> findByModelAndType(String modelId, MetricType metricType,
            Instant from, Instant to) {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        return findByModel(modelId).stream()
                .filter(o -> o.getMetricType() == metricType)
                .filter(o -> !o.getTimestamp().isBefore(from) && o.getTimestamp().isBefore(to))
                .sorted(Comparator.comparing(MetricObservation::getTimestamp))
                .toList();
    }

    /** Observations currently retained across all models. */
    public synchronized int size() {
        return byId.size();
    }

    public int getCapacityPerModel() {
        return capacityPerModel;
    }
}
