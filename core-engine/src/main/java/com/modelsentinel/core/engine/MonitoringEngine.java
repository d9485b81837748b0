package com.modelsentinel.core.engine;

import com.modelsentinel.core.config.EngineSettings;
import com.modelsentinel.core.error.ConcurrencyConflictException;
import com.modelsentinel.core.error.NotFoundException;
import com.modelsentinel.core.evaluation.ThresholdEvaluator;
import com.modelsentinel.core.lifecycle.AlertLifecycle;
import com.modelsentinel.core.model.Alert;
import com.modelsentinel.core.model.AlertDraft;
import com.modelsentinel.core.model.AlertType;
import com.modelsentinel.core.model.MetricObservation;
import com.modelsentinel.core.model.MetricType;
import com.modelsentinel.core.model.MonitoringConfig;
import com.modelsentinel.core.model.SubmissionResult;
import com.modelsentinel.core.notification.DeliveryResult;
import com.modelsentinel.core.notification.NotificationDispatcher;
import com.modelsentinel.core.store.AlertStore;
import com.modelsentinel.core.store.MetricRecordStore;
import com.modelsentinel.core.store.ModelRegistry;
import com.modelsentinel.core.store.TimedStoreExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Inbound interface of the monitoring core: metric submission and the alert
 * operations called by authenticated request handlers.
 *
 * <h3>Submission</h3>
 * <ol>
 * <li>The owning model's config is read and validated; an unknown model is
 * {@link NotFoundException}.</li>
 * <li>The observation is appended to the metric store.</li>
 * <li>The {@link ThresholdEvaluator} decides whether it breaches.</li>
 * <li>Under the lock of (model, alert type) the latest active alert is read.
 * Inside the cooldown window it is refreshed with the new value; otherwise a
 * new alert is opened.</li>
 * <li>New alerts are dispatched to the model's channels and every delivery
 * outcome is recorded before the call returns.</li>
 * </ol>
 *
 * <h3>Concurrency</h3>
 * <p>
 * Every alert write made by this engine runs under the lock of the alert's
 * (model, alert type), acquired within {@link EngineSettings#getLockTimeout()}.
 * The store additionally compares {@link Alert#getVersion()} on each update,
 * so a write that races with another writer fails with
 * {@link ConcurrencyConflictException}. Lifecycle transitions are never
 * retried here because they are not idempotent. Recording delivery outcomes
 * and cooldown refreshes are retried up to
 * {@link EngineSettings#getNotificationRecordRetries()} times. Every store call
 * runs under {@link EngineSettings#getStoreTimeout()}. A timed-out write that
 * the store keeps executing holds its alert lock until it returns, so the next
 * submission for that key reads its result before deciding on cooldown.
 * </p>
 *
 * @since 1.0.0
 */
public class MonitoringEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(MonitoringEngine.class);

    private final ModelRegistry models;
    private final MetricRecordStore metrics;
    private final AlertStore alerts;
    private final NotificationDispatcher dispatcher;
    private final EngineSettings settings;
    private final Clock clock;

    private final ThresholdEvaluator evaluator;
    private final AlertLifecycle lifecycle;
    private final TimedStoreExecutor store;
    private final KeyedLocks<String> alertLocks = new KeyedLocks<>();

    public MonitoringEngine(ModelRegistry models,
            MetricRecordStore metrics,
            AlertStore alerts,
            NotificationDispatcher dispatcher,
            EngineSettings settings,
            Clock clock) {
        this(models, metrics, alerts, dispatcher, settings, clock, new ThresholdEvaluator());
    }

    public MonitoringEngine(ModelRegistry models,
            MetricRecordStore metrics,
            AlertStore alerts,
            NotificationDispatcher dispatcher,
            EngineSettings settings,
            Clock clock,
            ThresholdEvaluator evaluator) {
        this.models = Objects.requireNonNull(models, "models must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.alerts = Objects.requireNonNull(alerts, "alerts must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
        this.lifecycle = new AlertLifecycle(clock);
        this.store = new TimedStoreExecutor(settings.getStoreTimeout());
    }

    // ---------------------------------------------------------------
    // Metric submission
    // ---------------------------------------------------------------

    /**
     * Store an observation and raise or refresh an alert if it breaches.
     *
     * @param observation a validated observation (see
     *                    {@link MetricObservation.Builder#build()})
     * @return the outcome, with the assigned observation id
     * @throws NotFoundException                                      if the model is unknown
     * @throws com.modelsentinel.core.error.ValidationException       if the model's config is invalid
     * @throws com.modelsentinel.core.error.OperationTimeoutException if a store call or an alert lock times out
     */
    public SubmissionResult submitMetric(MetricObservation observation) {
        Objects.requireNonNull(observation, "observation must not be null");
        MonitoringConfig config = requireConfig(observation.getModelId());
        config.validate();

        MetricObservation stored = store.call("appendObservation", () -> metrics.append(observation));
        String observationId = stored.getObservationId();

        if (!evaluator.hasRule(stored.getMetricType())) {
            LOG.debug("No rule for metric '{}' of model '{}'",
                    stored.getMetricType().wireValue(), stored.getModelId());
            return SubmissionResult.noRule(observationId);
        }

        Optional<AlertDraft> draft = evaluator.evaluate(stored, config);
        if (draft.isEmpty()) {
            return SubmissionResult.withinThreshold(observationId);
        }

        AlertDraft breach = draft.get();
        Breach outcome = withAlertLock(breach.getModelId(), breach.getAlertType(),
                () -> openOrRefresh(breach, config.getAlertCooldown()));

        if (outcome.suppressed) {
            LOG.debug("Alert {} refreshed within cooldown by observation {}",
                    outcome.alert.getAlertId(), observationId);
            return SubmissionResult.suppressed(observationId, outcome.alert.getAlertId());
        }

        Alert created = outcome.alert;
        LOG.info("Alert {} opened: model={}, type={}, severity={}, value={}, threshold={}",
                created.getAlertId(), created.getModelId(), created.getAlertType().wireValue(),
                created.getSeverity().wireValue(), created.getCurrentValue(), created.getThresholdValue());

        List<DeliveryResult> deliveries = dispatcher.onAlertCreated(created, config.getAlertChannels());
        recordDeliveries(created, deliveries);
        return SubmissionResult.alertCreated(observationId, created.getAlertId());
    }

    /** Must run under the lock of the draft's (model, alert type). */
    private Breach openOrRefresh(AlertDraft draft, Duration cooldown) {
        for (int attempt = 1;; attempt++) {
            Optional<Alert> latest = store.call("findLatestActive",
                    () -> alerts.findLatestActive(draft.getModelId(), draft.getAlertType()));

            if (latest.isEmpty() || !withinCooldown(latest.get(), draft.getObservedAt(), cooldown)) {
                Alert opened = lifecycle.open(draft, UUID.randomUUID().toString());
                store.run("insertAlert", () -> alerts.insert(opened));
                return new Breach(opened, false);
            }

            Alert refreshed = lifecycle.refreshCurrentValue(latest.get(), draft.getCurrentValue(),
                    draft.getObservationId());
            try {
                store.run("updateAlert", () -> alerts.update(refreshed));
                return new Breach(refreshed, true);
            } catch (ConcurrencyConflictException e) {
                // a concurrent transition moved the alert; re-read and decide again
                if (attempt >= settings.getNotificationRecordRetries()) {
                    throw e;
                }
                LOG.debug("Refresh of alert {} lost a race (attempt {}), retrying",
                        refreshed.getAlertId(), attempt);
            }
        }
    }

    static boolean withinCooldown(Alert active, Instant observedAt, Duration cooldown) {
        if (cooldown.isZero()) {
            return false;
        }
        Duration gap = Duration.between(active.getTriggeredAt(), observedAt).abs();
        return gap.compareTo(cooldown) < 0;
    }

    // ---------------------------------------------------------------
    // Alert lifecycle
    // ---------------------------------------------------------------

    /**
     * @throws NotFoundException                                        if the alert is unknown
     * @throws com.modelsentinel.core.error.InvalidTransitionException  unless the alert is OPEN
     * @throws ConcurrencyConflictException                             if the alert changed concurrently
     */
    public Alert acknowledgeAlert(String alertId, String actorId, String notes) {
        return transition(alertId, current -> lifecycle.acknowledge(current, actorId, notes));
    }

    /**
     * @throws com.modelsentinel.core.error.InvalidTransitionException from RESOLVED or CLOSED
     */
    public Alert resolveAlert(String alertId, String actorId, String action, String notes) {
        return transition(alertId, current -> lifecycle.resolve(current, actorId, action, notes));
    }

    /**
     * @throws com.modelsentinel.core.error.InvalidTransitionException if already CLOSED
     */
    public Alert closeAlert(String alertId, String actorId) {
        return transition(alertId, current -> lifecycle.close(current, actorId));
    }

    private Alert transition(String alertId, UnaryOperator<Alert> change) {
        Alert located = getAlert(alertId);
        Alert next = withAlertLock(located.getModelId(), located.getAlertType(), () -> {
            Alert current = getAlert(alertId);
            Alert changed = change.apply(current);
            store.run("updateAlert", () -> alerts.update(changed));
            LOG.info("Alert {} {} -> {}", alertId,
                    current.getStatus().wireValue(), changed.getStatus().wireValue());
            return changed;
        });

        List<DeliveryResult> deliveries = dispatcher.onAlertUpdated(next, channelsOf(next.getModelId()));
        return recordDeliveries(next, deliveries).orElse(next);
    }

    /**
     * Record one delivery outcome on an alert.
     *
     * @return the updated alert
     * @throws ConcurrencyConflictException if every retry lost a race
     */
    public Alert recordNotificationAttempt(String alertId, String channel, boolean success) {
        DeliveryResult delivery = success
                ? DeliveryResult.delivered(channel)
                : DeliveryResult.failed(channel, "reported failed");
        return recordDeliveries(getAlert(alertId), List.of(delivery)).orElseThrow();
    }

    private Optional<Alert> recordDeliveries(Alert alert, List<DeliveryResult> deliveries) {
        if (deliveries.isEmpty()) {
            return Optional.empty();
        }
        String alertId = alert.getAlertId();
        int retries = settings.getNotificationRecordRetries();
        return Optional.of(withAlertLock(alert.getModelId(), alert.getAlertType(), () -> {
            for (int attempt = 1;; attempt++) {
                Alert next = getAlert(alertId);
                for (DeliveryResult delivery : deliveries) {
                    next = lifecycle.recordNotificationAttempt(next, delivery.getChannel(), delivery.isSuccess());
                }
                Alert recorded = next;
                try {
                    store.run("updateAlert", () -> alerts.update(recorded));
                    return recorded;
                } catch (ConcurrencyConflictException e) {
                    if (attempt >= retries) {
                        LOG.error("Giving up recording {} delivery outcome(s) on alert {} after {} attempts",
                                deliveries.size(), alertId, attempt);
                        throw e;
                    }
                    LOG.debug("Recording deliveries on alert {} conflicted (attempt {}), retrying",
                            alertId, attempt);
                }
            }
        }));
    }

    // ---------------------------------------------------------------
    // Read accessors
    // ---------------------------------------------------------------

    /**
     * @throws NotFoundException if the alert is unknown
     */
    public Alert getAlert(String alertId) {
        Objects.requireNonNull(alertId, "alertId must not be null");
        return store.call("findAlert", () -> alerts.findById(alertId))
                .orElseThrow(() -> NotFoundException.alert(alertId));
    }

    /**
     * @return alerts of the model, most recently triggered first
     * @throws NotFoundException if the model is unknown
     */
    public List<Alert> findAlerts(String modelId) {
        requireConfig(modelId);
        return store.call("findAlertsByModel", () -> alerts.findByModel(modelId));
    }

    /** Whole minutes since the alert was triggered, derived from the clock. */
    public long timeSinceTriggeredMinutes(String alertId) {
        return getAlert(alertId).timeSinceTriggeredMinutes(clock.instant());
    }

    /**
     * @throws NotFoundException if the model is unknown
     */
    public List<MetricObservation> findObservations(String modelId) {
        requireConfig(modelId);
        return store.call("findObservations", () -> metrics.findByModel(modelId));
    }

    /**
     * Observations of one metric in {@code [from, to)}.
     */
    public List<MetricObservation> findObservations(String modelId, MetricType metricType, Instant from, Instant to) {
        requireConfig(modelId);
        return store.call("findObservations",
                () -> metrics.findByModelAndType(modelId, metricType, from, to));
    }

    public Optional<MetricObservation> findObservation(String observationId) {
        return store.call("findObservation", () -> metrics.findById(observationId));
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    /**
     * Every alert write of this engine runs under the lock of its
     * (model, alert type), so conflicts only come from outside writers.
     */
    private <T> T withAlertLock(String modelId, AlertType alertType, Supplier<T> action) {
        return alertLocks.withLock(modelId + '|' + alertType.wireValue(), settings.getLockTimeout(), action);
    }

    private MonitoringConfig requireConfig(String modelId) {
        return store.call("findConfig", () -> models.findConfig(modelId))
                .orElseThrow(() -> NotFoundException.model(modelId));
    }

    private List<String> channelsOf(String modelId) {
        return store.call("findConfig", () -> models.findConfig(modelId))
                .map(MonitoringConfig::getAlertChannels)
                .orElse(List.of());
    }

    @Override
    public void close() {
        store.close();
    }

    private static final class Breach {
        final Alert alert;
        final boolean suppressed;

        Breach(Alert alert, boolean suppressed) {
            this.alert = alert;
            this.suppressed = suppressed;
        }
    }
}
