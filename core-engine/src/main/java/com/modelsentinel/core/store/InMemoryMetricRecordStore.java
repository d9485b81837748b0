package com.modelsentinel.core.store;

import com.modelsentinel.core.model.MetricObservation;
import com.modelsentinel.core.model.MetricType;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Thread-safe, in-memory {@link MetricRecordStore}.
 *
 * @since 1.0.0
 */
public class InMemoryMetricRecordStore implements MetricRecordStore {

    private final Map<String, ConcurrentLinkedQueue<MetricObservation>> byModel = new ConcurrentHashMap<>();
    private final Map<String, MetricObservation> byId = new ConcurrentHashMap<>();

    @Override
    public MetricObservation append(MetricObservation observation) {
        Objects.requireNonNull(observation, "Observation must not be null");
        MetricObservation stored = observation.withObservationId(UUID.randomUUID().toString());
        byId.put(stored.getObservationId(), stored);
        byModel.computeIfAbsent(stored.getModelId(), k -> new ConcurrentLinkedQueue<>()).add(stored);
        return stored;
    }

    @Override
    public Optional<MetricObservation> findById(String observationId) {
        return Optional.ofNullable(byId.get(observationId));
    }

    @Override
    public List<MetricObservation> findByModel(String modelId) {
        ConcurrentLinkedQueue<MetricObservation> series = byModel.get(modelId);
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
}
