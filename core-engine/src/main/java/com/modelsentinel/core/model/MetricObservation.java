package com.modelsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.modelsentinel.core.error.ValidationException;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A single metric observation reported for a deployed model.
 *
 * <p>
 * Observations are append-only: once built they are never mutated. The
 * store assigns {@link #getObservationId()} on append via
 * {@link #withObservationId(String)}, which returns a copy.
 * </p>
 *
 * <p>
 * Timestamps are not required to be monotonic per model. Late observations
 * are evaluated like any other.
 * </p>
 *
 * <h3>Metadata</h3>
 * <p>
 * {@link #getMetadata()} is a {@code map<string, JSON value>}: only strings,
 * finite numbers, booleans, {@code null}, lists and string-keyed maps of
 * those are accepted. Anything else is rejected when the observation is
 * built.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonDeserialize(builder = MetricObservation.Builder.class)
public final class MetricObservation implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String observationId;
    private final String modelId;
    private final MetricType metricType;
    private final double value;
    private final Instant timestamp;

    private final Integer windowSize;
    private final Integer sampleSize;

    // --- Drift ---
    private final DriftType driftType;
    private final DriftDetection driftDetected;

    // --- Data quality ---
    private final Double missingValuesPct;
    private final Double outlierPct;
    private final Double dataFreshnessHours;

    // --- Business impact ---
    private final Double revenueImpact;
    private final Double customerSatisfaction;

    private final List<String> tags;
    private final Map<String, Object> metadata;

    private MetricObservation(Builder b) {
        this.observationId = b.observationId;
        this.modelId = b.modelId;
        this.metricType = b.metricType;
        this.value = b.value;
        this.timestamp = b.timestamp;
        this.windowSize = b.windowSize;
        this.sampleSize = b.sampleSize;
        this.driftType = b.driftType;
        this.driftDetected = b.driftDetected;
        this.missingValuesPct = b.missingValuesPct;
        this.outlierPct = b.outlierPct;
        this.dataFreshnessHours = b.dataFreshnessHours;
        this.revenueImpact = b.revenueImpact;
        this.customerSatisfaction = b.customerSatisfaction;
        this.tags = Collections.unmodifiableList(new ArrayList<>(b.tags));
        this.metadata = JsonValues.immutableCopy(b.metadata);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Return a copy of this observation carrying the given id.
     *
     * @param id identifier assigned by the metric store
     * @return a new observation; this instance is unchanged
     */
    public MetricObservation withObservationId(String id) {
        return toBuilder().observationId(Objects.requireNonNull(id, "id must not be null")).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .observationId(observationId)
                .modelId(modelId)
                .metricType(metricType)
                .value(value)
                .timestamp(timestamp)
                .windowSize(windowSize)
                .sampleSize(sampleSize)
                .driftType(driftType)
                .driftDetected(driftDetected)
                .missingValuesPct(missingValuesPct)
                .outlierPct(outlierPct)
                .dataFreshnessHours(dataFreshnessHours)
                .revenueImpact(revenueImpact)
                .customerSatisfaction(customerSatisfaction)
                .tags(tags)
                .metadata(metadata);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    @JsonProperty("observation_id")
    public String getObservationId() {
        return observationId;
    }

    @JsonProperty("model_id")
    public String getModelId() {
        return modelId;
    }

    @JsonProperty("metric_type")
    public MetricType getMetricType() {
        return metricType;
    }

    @JsonProperty("value")
    public double getValue() {
        return value;
    }

    @JsonProperty("timestamp")
    public Instant getTimestamp() {
        return timestamp;
    }

    @JsonProperty("window_size")
    public Integer getWindowSize() {
        return windowSize;
    }

    @JsonProperty("sample_size")
    public Integer getSampleSize() {
        return sampleSize;
    }

    @JsonProperty("drift_type")
    public DriftType getDriftType() {
        return driftType;
    }

    @JsonProperty("drift_detected")
    public DriftDetection getDriftDetected() {
        return driftDetected;
    }

    @JsonProperty("missing_values_pct")
    public Double getMissingValuesPct() {
        return missingValuesPct;
    }

    @JsonProperty("outlier_pct")
    public Double getOutlierPct() {
        return outlierPct;
    }

    @JsonProperty("data_freshness_hours")
    public Double getDataFreshnessHours() {
        return dataFreshnessHours;
    }

    @JsonProperty("revenue_impact")
    public Double getRevenueImpact() {
        return revenueImpact;
    }

    @JsonProperty("customer_satisfaction")
    public Double getCustomerSatisfaction() {
        return customerSatisfaction;
    }

    @JsonProperty("tags")
    public List<String> getTags() {
        return tags;
    }

    @JsonProperty("metadata")
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder. {@link #build()} validates the observation and collects
     * every problem into a single {@link ValidationException}.
     */
    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Builder {
        private String observationId;
        private String modelId;
        private MetricType metricType;
        private double value = Double.NaN;
        private Instant timestamp;
        private Integer windowSize;
        private Integer sampleSize;
        private DriftType driftType;
        private DriftDetection driftDetected;
        private Double missingValuesPct;
        private Double outlierPct;
        private Double dataFreshnessHours;
        private Double revenueImpact;
        private Double customerSatisfaction;
        private List<String> tags = new ArrayList<>();
        private Map<String, Object> metadata = new LinkedHashMap<>();

        @JsonProperty("observation_id")
        public Builder observationId(String observationId) {
            this.observationId = observationId;
            return this;
        }

        @JsonProperty("model_id")
        public Builder modelId(String modelId) {
            this.modelId = modelId;
            return this;
        }

        @JsonProperty("metric_type")
        public Builder metricType(MetricType metricType) {
            this.metricType = metricType;
            return this;
        }

        @JsonProperty("value")
        public Builder value(double value) {
            this.value = value;
            return this;
        }

        @JsonProperty("timestamp")
        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        @JsonProperty("window_size")
        public Builder windowSize(Integer windowSize) {
            this.windowSize = windowSize;
            return this;
        }

        @JsonProperty("sample_size")
        public Builder sampleSize(Integer sampleSize) {
            this.sampleSize = sampleSize;
            return this;
        }

        @JsonProperty("drift_type")
        public Builder driftType(DriftType driftType) {
            this.driftType = driftType;
            return this;
        }

        @JsonProperty("drift_detected")
        public Builder driftDetected(DriftDetection driftDetected) {
            this.driftDetected = driftDetected;
            return this;
        }

        @JsonProperty("missing_values_pct")
        public Builder missingValuesPct(Double missingValuesPct) {
            this.missingValuesPct = missingValuesPct;
            return this;
        }

        @JsonProperty("outlier_pct")
        public Builder outlierPct(Double outlierPct) {
            this.outlierPct = outlierPct;
            return this;
        }

        @JsonProperty("data_freshness_hours")
        public Builder dataFreshnessHours(Double dataFreshnessHours) {
            this.dataFreshnessHours = dataFreshnessHours;
            return this;
        }

        @JsonProperty("revenue_impact")
        public Builder revenueImpact(Double revenueImpact) {
            this.revenueImpact = revenueImpact;
            return this;
        }

        @JsonProperty("customer_satisfaction")
        public Builder customerSatisfaction(Double customerSatisfaction) {
            this.customerSatisfaction = customerSatisfaction;
            return this;
        }

        @JsonProperty("tags")
        public Builder tags(List<String> tags) {
            this.tags = tags != null ? new ArrayList<>(tags) : new ArrayList<>();
            return this;
        }

        public Builder tag(String tag) {
            this.tags.add(tag);
            return this;
        }

        @JsonProperty("metadata")
        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        /**
         * Validate and build the observation.
         *
         * @return a new immutable observation
         * @throws ValidationException if any field is missing or out of range
         */
        public MetricObservation build() {
            List<String> errors = new ArrayList<>();

            if (modelId == null || modelId.isBlank()) {
                errors.add("model_id is required");
            }
            if (metricType == null) {
                errors.add("metric_type is required");
            }
            if (!Double.isFinite(value)) {
                errors.add("value must be a finite number");
            }
            if (timestamp == null) {
                errors.add("timestamp is required");
            }
            if (windowSize != null && windowSize < 0) {
                errors.add("window_size must be >= 0, got: " + windowSize);
            }
            if (sampleSize != null && sampleSize < 0) {
                errors.add("sample_size must be >= 0, got: " + sampleSize);
            }
            checkRange(errors, "missing_values_pct", missingValuesPct, 0, 100);
            checkRange(errors, "outlier_pct", outlierPct, 0, 100);
            checkRange(errors, "data_freshness_hours", dataFreshnessHours, 0, Double.MAX_VALUE);
            checkRange(errors, "customer_satisfaction", customerSatisfaction, 0, 1);
            if (revenueImpact != null && !Double.isFinite(revenueImpact)) {
                errors.add("revenue_impact must be a finite number");
            }
            for (String tag : tags) {
                if (tag == null || tag.isBlank()) {
                    errors.add("tags must not contain blank entries");
                    break;
                }
            }
            for (Map.Entry<String, Object> entry : metadata.entrySet()) {
                if (entry.getKey() == null || entry.getKey().isBlank()) {
                    errors.add("metadata keys must not be blank");
                } else if (!JsonValues.isJsonValue(entry.getValue())) {
                    errors.add("metadata '" + entry.getKey() + "' is not a JSON value");
                }
            }

            if (!errors.isEmpty()) {
                throw new ValidationException("metric observation", errors);
            }
            return new MetricObservation(this);
        }

        private static void checkRange(List<String> errors, String name, Double v, double min, double max) {
            if (v != null && (!Double.isFinite(v) || v < min || v > max)) {
                errors.add(name + " must be in [" + min + ", " + max + "], got: " + v);
            }
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricObservation that))
            return false;
        return Double.compare(value, that.value) == 0
                && Objects.equals(observationId, that.observationId)
                && Objects.equals(modelId, that.modelId)
                && metricType == that.metricType
                && Objects.equals(timestamp, that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(observationId, modelId, metricType, value, timestamp);
    }

    @Override
    public String toString() {
        return "MetricObservation{" +
                "observationId='" + observationId + '\'' +
                ", modelId='" + modelId + '\'' +
                ", metricType=" + metricType +
                ", value=" + value +
                ", timestamp=" + timestamp +
                '}';
    }
}
