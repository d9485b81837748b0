package com.modelsentinel.core.store;

import com.modelsentinel.core.model.MetricObservation;
import com.modelsentinel.core.model.MetricType;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only time series of metric observations.
 *
 * <p>
 * Implementations must be thread-safe. Observations are never updated.
 * Bounded implementations may evict the oldest observations of a model.
 * </p>
 */
public interface MetricRecordStore {

    /**
     * Append an observation and assign its id.
     *
     * @param observation validated observation without an id
     * @return the stored copy, carrying its assigned id
     */
    MetricObservation append(MetricObservation observation);

    Optional<MetricObservation> findById(String observationId);

    /**
     * @return every observation of the model, in append order
     */
    List<MetricObservation> findByModel(String modelId);

    /**
     * @param from inclusive lower bound on the observation timestamp
     * @param to   exclusive upper bound on the observation timestamp
     * @return matching observations ordered by timestamp
     */
    List<MetricObservation> findByModelAndType(String modelId, MetricType metricType, Instant from, Instant to);
}
