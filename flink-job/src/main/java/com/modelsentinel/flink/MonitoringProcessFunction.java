package com.modelsentinel.flink;

import com.modelsentinel.core.config.EngineSettings;
import com.modelsentinel.core.config.ModelsConfig;
import com.modelsentinel.core.config.ModelsConfigLoader;
import com.modelsentinel.core.engine.MonitoringEngine;
import com.modelsentinel.core.error.MonitoringException;
import com.modelsentinel.core.model.MetricObservation;
import com.modelsentinel.core.model.MonitoringConfig;
import com.modelsentinel.core.model.SubmissionResult;
import com.modelsentinel.core.notification.ChannelNotificationDispatcher;
import com.modelsentinel.core.notification.LoggingNotificationChannel;
import com.modelsentinel.core.notification.NotificationChannel;
import com.modelsentinel.core.store.AlertStore;
import com.modelsentinel.core.store.BoundedMetricRecordStore;
import com.modelsentinel.core.store.LatestAlertStore;
import com.modelsentinel.core.store.MetricRecordStore;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Runs every observation of a model through a {@link MonitoringEngine} and
 * emits an {@link AlertEvent} when an alert is opened or refreshed.
 *
 * <p>
 * The stream is keyed by model id, so all observations of one model reach
 * the same subtask and its engine sees a consistent alert history for the
 * cooldown check.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * The engine and its in-memory stores are created in
 * {@link #open(Configuration)} and are not part of Flink checkpoints. After a
 * restart the alert history starts empty, so the first breach of each type
 * opens a fresh alert.
 * </p>
 * <p>
 * State is bounded for an unbounded stream: a {@link LatestAlertStore} keeps
 * one alert per (model, alert type) and a {@link BoundedMetricRecordStore}
 * keeps the last {@value #OBSERVATIONS_RETAINED_PER_MODEL} observations per
 * model. Full history is carried by the alerts topic.
 * </p>
 *
 * <h3>Notification</h3>
 * <p>
 * Each channel id named in the models configuration is bound to a
 * {@link LoggingNotificationChannel}. Downstream consumers of the alerts topic
 * handle real delivery.
 * </p>
 *
 * @since 1.0.0
 */
public class MonitoringProcessFunction
        extends KeyedProcessFunction<String, MetricObservation, AlertEvent> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(MonitoringProcessFunction.class);

    static final int OBSERVATIONS_RETAINED_PER_MODEL = 1_000;

    private final ModelsConfig models;
    private final EngineSettings settings;

    private transient MonitoringEngine engine;
    private transient MonitoringMetrics metrics;

    /**
     * @param models   validated models configuration; must define at least one
     *                 model
     * @param settings engine limits
     * @throws IllegalArgumentException if no model is configured
     */
    public MonitoringProcessFunction(ModelsConfig models, EngineSettings settings) {
        this.models = Objects.requireNonNull(models, "models must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        if (models.getModels().isEmpty()) {
            throw new IllegalArgumentException("At least one model must be configured");
        }
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Override
    public void open(Configuration parameters) {
        engine = createEngine(models, settings);
        metrics = new MonitoringMetrics(getRuntimeContext().getMetricGroup());
        LOG.info("MonitoringProcessFunction opened with {} model(s)", models.getModels().size());
    }

    @Override
    public void close() {
        if (engine != null) {
            engine.close();
        }
        LOG.info("MonitoringProcessFunction closing");
    }

    static MonitoringEngine createEngine(ModelsConfig models, EngineSettings settings) {
        return createEngine(models, settings,
                new BoundedMetricRecordStore(OBSERVATIONS_RETAINED_PER_MODEL), new LatestAlertStore());
    }

    static MonitoringEngine createEngine(ModelsConfig models, EngineSettings settings,
            MetricRecordStore observations, AlertStore alerts) {
        Set<String> channelIds = new LinkedHashSet<>();
        for (MonitoringConfig model : models.getModels()) {
            channelIds.addAll(model.getAlertChannels());
        }
        List<NotificationChannel> channels = new ArrayList<>();
        channelIds.forEach(id -> channels.add(new LoggingNotificationChannel(id)));

        return new MonitoringEngine(
                ModelsConfigLoader.toRegistry(models),
                observations,
                alerts,
                new ChannelNotificationDispatcher(channels),
                settings,
                Clock.systemUTC());
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    @Override
    public void processElement(MetricObservation observation,
            KeyedProcessFunction<String, MetricObservation, AlertEvent>.Context ctx,
            Collector<AlertEvent> out) {
        long startNanos = System.nanoTime();

        try {
            SubmissionResult result = engine.submitMetric(observation);
            switch (result.getOutcome()) {
                case ALERT_CREATED:
                    out.collect(toEvent(AlertEvent.Kind.CREATED, result));
                    metrics.incrementAlertsCreated();
                    break;
                case SUPPRESSED_BY_COOLDOWN:
                    out.collect(toEvent(AlertEvent.Kind.REFRESHED, result));
                    metrics.incrementAlertsSuppressed();
                    break;
                default:
                    break;
            }
            metrics.incrementObservationsProcessed();
        } catch (MonitoringException e) {
            metrics.incrementObservationsRejected();
            LOG.warn("Observation for model {} rejected: {}", ctx.getCurrentKey(), e.getMessage());
        }

        long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
        metrics.recordLatency(durationMs);
    }

    private AlertEvent toEvent(AlertEvent.Kind kind, SubmissionResult result) {
        String alertId = result.getAlertId().orElseThrow();
        return new AlertEvent(kind, result.getObservationId(), engine.getAlert(alertId));
    }
}
