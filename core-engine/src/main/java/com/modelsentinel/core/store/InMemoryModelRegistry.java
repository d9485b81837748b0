package com.modelsentinel.core.store;

import com.modelsentinel.core.model.MonitoringConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe, in-memory {@link ModelRegistry}.
 *
 * <p>
 * Configurations are validated and copied on registration; lookups return
 * further copies, so callers always see a consistent snapshot.
 * </p>
 *
 * @since 1.0.0
 */
public class InMemoryModelRegistry implements ModelRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryModelRegistry.class);

    private final Map<String, MonitoringConfig> configs = new ConcurrentHashMap<>();

    public InMemoryModelRegistry() {
    }

    public InMemoryModelRegistry(Collection<MonitoringConfig> initial) {
        Objects.requireNonNull(initial, "initial configs must not be null");
        initial.forEach(this::register);
    }

    /**
     * Register or replace a model's configuration.
     *
     * @param config configuration to store
     * @throws com.modelsentinel.core.error.ValidationException if the
     *                                                          configuration is
     *                                                          invalid
     */
    public void register(MonitoringConfig config) {
        Objects.requireNonNull(config, "MonitoringConfig must not be null");
        MonitoringConfig copy = config.snapshot();
        copy.validate();
        MonitoringConfig previous = configs.put(copy.getModelId(), copy);
        LOG.info("{} monitoring config for model {}", previous == null ? "Registered" : "Replaced",
                copy.getModelId());
    }

    @Override
    public Optional<MonitoringConfig> findConfig(String modelId) {
        MonitoringConfig config = modelId == null ? null : configs.get(modelId);
        return config == null ? Optional.empty() : Optional.of(config.snapshot());
    }

    @Override
    public Set<String> modelIds() {
        return Set.copyOf(configs.keySet());
    }
}
