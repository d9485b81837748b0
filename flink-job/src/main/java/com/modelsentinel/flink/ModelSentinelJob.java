package com.modelsentinel.flink;

import com.modelsentinel.core.config.EngineSettings;
import com.modelsentinel.core.config.ModelsConfig;
import com.modelsentinel.core.config.ModelsConfigLoader;
import com.modelsentinel.core.model.MetricObservation;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.CheckpointConfig;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Entry point of the Model Sentinel Flink job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (model_metrics)
 *     → JSON → MetricObservation (invalid records dropped)
 *     → key by model_id
 *     → MonitoringProcessFunction (threshold evaluation, cooldown, alert lifecycle)
 *     → AlertEvent → JSON, keyed by model_id
 *     → Kafka (model_alerts)
 * </pre>
 *
 * <p>
 * Configuration comes from environment variables via {@link JobConfig} and
 * {@link EngineSettings}; the monitored models come from the models YAML file.
 * </p>
 *
 * @since 1.0.0
 */
public final class ModelSentinelJob {

        private static final Logger LOG = LoggerFactory.getLogger(ModelSentinelJob.class);

        private ModelSentinelJob() {
                // entry-point class, not instantiable
        }

        public static void main(String[] args) throws Exception {
                JobConfig config = JobConfig.fromEnvironment();
                EngineSettings settings = EngineSettings.fromEnvironment();
                LOG.info("Starting Model Sentinel with config: {}, engine: {}", config, settings);

                ModelsConfig models = loadModels(config);
                if (models.getModels().isEmpty()) {
                        throw new IllegalStateException(
                                        "No models configured. Provide them via "
                                                        + ModelsConfigLoader.ENV_MODELS_PATH
                                                        + " or a classpath models.yml file.");
                }

                HealthServer healthServer = new HealthServer(models.getModels().size());
                healthServer.start(config.getHealthPort());
                Runtime.getRuntime().addShutdownHook(new Thread(healthServer::stop, "health-shutdown"));

                StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
                env.setParallelism(config.getParallelism());
                configureCheckpointing(env, config);

                buildPipeline(env, config, models, settings);

                env.execute("Model Sentinel - Model Monitoring");
        }

        // ---------------------------------------------------------------
        // Pipeline assembly
        // ---------------------------------------------------------------

        static void buildPipeline(StreamExecutionEnvironment env,
                        JobConfig config,
                        ModelsConfig models,
                        EngineSettings settings) {
                KafkaSource<MetricObservation> source = KafkaSource.<MetricObservation>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setTopics(config.getKafkaMetricsTopic())
                                .setGroupId(config.getKafkaGroupId())
                                .setStartingOffsets(OffsetsInitializer.earliest())
                                .setValueOnlyDeserializer(new MetricObservationDeserializationSchema())
                                .build();

                // observation timestamps may arrive out of order; the engine handles that itself
                DataStream<MetricObservation> observations = env.fromSource(
                                source, WatermarkStrategy.noWatermarks(), "kafka-metrics-source");

                DataStream<AlertEvent> alerts = observations
                                .filter(Objects::nonNull)
                                .keyBy(MetricObservation::getModelId)
                                .process(new MonitoringProcessFunction(models, settings))
                                .name("model-monitoring");

                KafkaSink<AlertEvent> sink = KafkaSink.<AlertEvent>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setKafkaProducerConfig(config.kafkaProducerProperties())
                                .setRecordSerializer(
                                                KafkaRecordSerializationSchema.<AlertEvent>builder()
                                                                .setTopic(config.getKafkaAlertsTopic())
                                                                .setKeySerializationSchema(
                                                                                AlertEventSerializationSchema.keySchema())
                                                                .setValueSerializationSchema(
                                                                                new AlertEventSerializationSchema())
                                                                .build())
                                .build();

                alerts.sinkTo(sink).name("kafka-alerts-sink");
        }

        // ---------------------------------------------------------------
        // Helpers
        // ---------------------------------------------------------------

        private static ModelsConfig loadModels(JobConfig config) {
                String path = config.getModelsConfigPath();
                if (path != null && !path.isBlank()) {
                        return ModelsConfigLoader.fromFile(path);
                }
                return ModelsConfigLoader.load();
        }

        private static void configureCheckpointing(StreamExecutionEnvironment env, JobConfig config) {
                long interval = config.getCheckpointIntervalMs();
                env.enableCheckpointing(interval, CheckpointingMode.EXACTLY_ONCE);

                CheckpointConfig cpConfig = env.getCheckpointConfig();
                cpConfig.setMinPauseBetweenCheckpoints(interval / 2);
                cpConfig.setCheckpointTimeout(interval * 2);
                cpConfig.setMaxConcurrentCheckpoints(1);
                cpConfig.setExternalizedCheckpointCleanup(
                                CheckpointConfig.ExternalizedCheckpointCleanup.RETAIN_ON_CANCELLATION);
        }
}
