package com.modelsentinel.flink;

import com.modelsentinel.core.config.ModelsConfigLoader;

import java.io.Serializable;
import java.util.Objects;
import java.util.Properties;

/**
 * Typed, immutable configuration of the Model Sentinel Flink job.
 *
 * <p>
 * Values come from environment variables with defaults, so the job is
 * configured entirely through its deployment environment.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} in production or the {@link Builder} in
 * tests. The builder validates inputs at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    // ---------------------------------------------------------------
    // Kafka
    // ---------------------------------------------------------------
    private final String kafkaBootstrapServers;
    private final String kafkaMetricsTopic;
    private final String kafkaAlertsTopic;
    private final String kafkaGroupId;

    // ---------------------------------------------------------------
    // Flink
    // ---------------------------------------------------------------
    private final int parallelism;
    private final long checkpointIntervalMs;

    // ---------------------------------------------------------------
    // Models
    // ---------------------------------------------------------------
    private final String modelsConfigPath;

    // ---------------------------------------------------------------
    // Health
    // ---------------------------------------------------------------
    private final int healthPort;

    private JobConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaMetricsTopic = b.kafkaMetricsTopic;
        this.kafkaAlertsTopic = b.kafkaAlertsTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.parallelism = b.parallelism;
        this.checkpointIntervalMs = b.checkpointIntervalMs;
        this.modelsConfigPath = b.modelsConfigPath;
        this.healthPort = b.healthPort;
    }

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @throws IllegalStateException    if a numeric variable cannot be parsed
     * @throws IllegalArgumentException if a value is out of range
     */
    public static JobConfig fromEnvironment() {
        try {
            return new Builder()
                    .kafkaBootstrapServers(env("KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .kafkaMetricsTopic(env("KAFKA_METRICS_TOPIC", Builder.DEFAULT_METRICS_TOPIC))
                    .kafkaAlertsTopic(env("KAFKA_ALERTS_TOPIC", Builder.DEFAULT_ALERTS_TOPIC))
                    .kafkaGroupId(env("KAFKA_GROUP_ID", Builder.DEFAULT_GROUP_ID))
                    .parallelism(Integer.parseInt(env("FLINK_PARALLELISM", "1")))
                    .checkpointIntervalMs(Long.parseLong(env("FLINK_CHECKPOINT_INTERVAL_MS", "60000")))
                    .modelsConfigPath(env(ModelsConfigLoader.ENV_MODELS_PATH, ""))
                    .healthPort(Integer.parseInt(env("HEALTH_PORT", "8080")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Kafka properties helpers
    // ---------------------------------------------------------------

    public Properties kafkaConsumerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("group.id", kafkaGroupId);
        props.setProperty("auto.offset.reset", "earliest");
        return props;
    }

    public Properties kafkaProducerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("transaction.timeout.ms", "900000");
        return props;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaMetricsTopic() {
        return kafkaMetricsTopic;
    }

    public String getKafkaAlertsTopic() {
        return kafkaAlertsTopic;
    }

    public String getKafkaGroupId() {
        return kafkaGroupId;
    }

    public int getParallelism() {
        return parallelism;
    }

    public long getCheckpointIntervalMs() {
        return checkpointIntervalMs;
    }

    /**
     * @return path of the models YAML file, or an empty string to use the
     *         bundled {@code models.yml}
     */
    public String getModelsConfigPath() {
        return modelsConfigPath;
    }

    public int getHealthPort() {
        return healthPort;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * {@link #build()} checks parallelism &gt; 0, checkpoint interval &gt; 0,
     * port in [1, 65535] and non-blank topic names.
     * </p>
     */
    public static class Builder {
        static final String DEFAULT_METRICS_TOPIC = "model_metrics";
        static final String DEFAULT_ALERTS_TOPIC = "model_alerts";
        static final String DEFAULT_GROUP_ID = "model-sentinel";

        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaMetricsTopic = DEFAULT_METRICS_TOPIC;
        private String kafkaAlertsTopic = DEFAULT_ALERTS_TOPIC;
        private String kafkaGroupId = DEFAULT_GROUP_ID;
        private int parallelism = 1;
        private long checkpointIntervalMs = 60_000;
        private String modelsConfigPath = "";
        private int healthPort = 8080;

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaMetricsTopic(String v) {
            this.kafkaMetricsTopic = v;
            return this;
        }

        public Builder kafkaAlertsTopic(String v) {
            this.kafkaAlertsTopic = v;
            return this;
        }

        public Builder kafkaGroupId(String v) {
            this.kafkaGroupId = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder checkpointIntervalMs(long v) {
            this.checkpointIntervalMs = v;
            return this;
        }

        public Builder modelsConfigPath(String v) {
            this.modelsConfigPath = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        /**
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            Objects.requireNonNull(kafkaBootstrapServers, "kafkaBootstrapServers required");
            requireNonBlank(kafkaMetricsTopic, "kafkaMetricsTopic");
            requireNonBlank(kafkaAlertsTopic, "kafkaAlertsTopic");
            requireNonBlank(kafkaGroupId, "kafkaGroupId");
            if (kafkaMetricsTopic.equals(kafkaAlertsTopic)) {
                throw new IllegalArgumentException(
                        "kafkaMetricsTopic and kafkaAlertsTopic must differ, both are: " + kafkaAlertsTopic);
            }
            if (modelsConfigPath == null) {
                modelsConfigPath = "";
            }

            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (checkpointIntervalMs < 1) {
                throw new IllegalArgumentException(
                        "checkpointIntervalMs must be >= 1, got: " + checkpointIntervalMs);
            }
            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [1, 65535], got: " + healthPort);
            }

            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", kafkaMetricsTopic='" + kafkaMetricsTopic + '\'' +
                ", kafkaAlertsTopic='" + kafkaAlertsTopic + '\'' +
                ", kafkaGroupId='" + kafkaGroupId + '\'' +
                ", parallelism=" + parallelism +
                ", checkpointIntervalMs=" + checkpointIntervalMs +
                ", modelsConfigPath='" + modelsConfigPath + '\'' +
                ", healthPort=" + healthPort +
                '}';
    }
}
