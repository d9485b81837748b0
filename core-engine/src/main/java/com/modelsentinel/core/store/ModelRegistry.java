package com.modelsentinel.core.store;

import com.modelsentinel.core.model.MonitoringConfig;

import java.util.Optional;
import java.util.Set;

/**
 * Read side of the model-management collaborator: resolves a model id to
 * its monitoring configuration.
 */
public interface ModelRegistry {

    /**
     * @return a snapshot of the model's configuration, or empty if the model
     *         is unknown
     */
    Optional<MonitoringConfig> findConfig(String modelId);

    Set<String> modelIds();
}
