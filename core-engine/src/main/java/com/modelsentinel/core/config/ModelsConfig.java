package com.modelsentinel.core.config;

import com.modelsentinel.core.error.ValidationException;
import com.modelsentinel.core.model.MonitoringConfig;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Top-level POJO of the models YAML file.
 *
 * <pre>
 * models:
 *   - modelId: churn-v3
 *     accuracyThreshold: 0.85
 *     latencyThreshold: 120
 *     driftThreshold: 0.1
 *     alertChannels: [email, slack]
 *     alertCooldownSeconds: 600
 * </pre>
 *
 * @since 1.0.0
 */
public class ModelsConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private List<MonitoringConfig> models = new ArrayList<>();

    public List<MonitoringConfig> getModels() {
        return Collections.unmodifiableList(models);
    }

    /** Used by SnakeYAML. */
    public void setModels(List<MonitoringConfig> models) {
        this.models = models != null ? new ArrayList<>(models) : new ArrayList<>();
    }

    /**
     * Validate every entry and reject duplicate model ids.
     *
     * @throws ValidationException listing every problem found
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (int i = 0; i < models.size(); i++) {
            MonitoringConfig model = models.get(i);
            if (model == null) {
                errors.add("Model at index " + i + " is null");
                continue;
            }
            try {
                model.validate();
            } catch (ValidationException e) {
                errors.addAll(e.getErrors().isEmpty() ? List.of(e.getMessage()) : e.getErrors());
            }
            if (model.getModelId() != null && !seen.add(model.getModelId())) {
                errors.add("Duplicate modelId: '" + model.getModelId() + "'");
            }
        }

        if (!errors.isEmpty()) {
            throw new ValidationException("models configuration", errors);
        }
    }

    @Override
    public String toString() {
        return "ModelsConfig{models=" + models + '}';
    }
}
