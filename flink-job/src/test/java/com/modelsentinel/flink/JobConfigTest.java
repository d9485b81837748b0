package com.modelsentinel.flink;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobConfig}.
 */
class JobConfigTest {

    @Test
    @DisplayName("Builder defaults should match the deployment topics")
    void defaults() {
        JobConfig config = new JobConfig.Builder().build();

        assertThat(config.getKafkaMetricsTopic()).isEqualTo("model_metrics");
        assertThat(config.getKafkaAlertsTopic()).isEqualTo("model_alerts");
        assertThat(config.getKafkaGroupId()).isEqualTo("model-sentinel");
        assertThat(config.getParallelism()).isEqualTo(1);
        assertThat(config.getModelsConfigPath()).isEmpty();
        assertThat(config.getHealthPort()).isEqualTo(8080);
    }

    @Test
    @DisplayName("Should build Kafka client properties")
    void kafkaProperties() {
        JobConfig config = new JobConfig.Builder()
                .kafkaBootstrapServers("kafka:29092")
                .kafkaGroupId("monitor")
                .build();

        Properties consumer = config.kafkaConsumerProperties();
        assertThat(consumer.getProperty("bootstrap.servers")).isEqualTo("kafka:29092");
        assertThat(consumer.getProperty("group.id")).isEqualTo("monitor");
        assertThat(config.kafkaProducerProperties().getProperty("bootstrap.servers")).isEqualTo("kafka:29092");
    }

    @Test
    @DisplayName("Should reject invalid values")
    void rejectsInvalidValues() {
        assertThatThrownBy(() -> new JobConfig.Builder().parallelism(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new JobConfig.Builder().checkpointIntervalMs(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new JobConfig.Builder().healthPort(70_000).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new JobConfig.Builder().kafkaAlertsTopic(" ").build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should refuse to publish alerts onto the metrics topic")
    void rejectsSameTopic() {
        assertThatThrownBy(() -> new JobConfig.Builder()
                .kafkaMetricsTopic("shared").kafkaAlertsTopic("shared").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("shared");
    }
}
