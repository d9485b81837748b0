package com.modelsentinel.core.engine;

import com.modelsentinel.core.TestClock;
import com.modelsentinel.core.config.EngineSettings;
import com.modelsentinel.core.error.ConcurrencyConflictException;
import com.modelsentinel.core.error.InvalidTransitionException;
import com.modelsentinel.core.error.NotFoundException;
import com.modelsentinel.core.error.OperationTimeoutException;
import com.modelsentinel.core.model.Alert;
import com.modelsentinel.core.model.AlertStatus;
import com.modelsentinel.core.model.AlertType;
import com.modelsentinel.core.model.MetricObservation;
import com.modelsentinel.core.model.MetricType;
import com.modelsentinel.core.model.MonitoringConfig;
import com.modelsentinel.core.model.SubmissionResult;
import com.modelsentinel.core.notification.ChannelNotificationDispatcher;
import com.modelsentinel.core.notification.LoggingNotificationChannel;
import com.modelsentinel.core.store.AlertStore;
import com.modelsentinel.core.store.InMemoryAlertStore;
import com.modelsentinel.core.store.InMemoryMetricRecordStore;
import com.modelsentinel.core.store.InMemoryModelRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link MonitoringEngine} wired with the in-memory stores.
 */
class MonitoringEngineTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");
    private static final String MODEL = "churn-v3";

    private TestClock clock;
    private InMemoryModelRegistry registry;
    private InMemoryMetricRecordStore metrics;
    private InjectingAlertStore alerts;
    private MonitoringEngine engine;

    @BeforeEach
    void setUp() {
        clock = new TestClock(T0);
        registry = new InMemoryModelRegistry();
        MonitoringConfig config = new MonitoringConfig(MODEL);
        config.setAlertChannels(List.of("email", "pager"));
        config.setAlertCooldownSeconds(900);
        registry.register(config);

        metrics = new InMemoryMetricRecordStore();
        alerts = new InjectingAlertStore(new InMemoryAlertStore());
        engine = newEngine(alerts, EngineSettings.defaults());
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private MonitoringEngine newEngine(AlertStore store, EngineSettings settings) {
        ChannelNotificationDispatcher dispatcher =
                new ChannelNotificationDispatcher(List.of(new LoggingNotificationChannel("email")));
        return new MonitoringEngine(registry, metrics, store, dispatcher, settings, clock);
    }

    // ---------------------------------------------------------------
    // Submission
    // ---------------------------------------------------------------

    @Test
    @DisplayName("A breach should open an alert and record every delivery attempt")
    void breachOpensAlert() {
        SubmissionResult result = engine.submitMetric(observation(MetricType.ACCURACY, 0.70, T0));

        assertThat(result.getOutcome()).isEqualTo(SubmissionResult.Outcome.ALERT_CREATED);
        Alert alert = engine.getAlert(result.getAlertId().orElseThrow());
        assertThat(alert.getStatus()).isEqualTo(AlertStatus.OPEN);
        assertThat(alert.getAlertType()).isEqualTo(AlertType.ACCURACY_DEGRADATION);
        assertThat(alert.getObservationId()).isEqualTo(result.getObservationId());
        assertThat(alert.getNotificationAttempts()).isEqualTo(2);
        assertThat(alert.getNotificationChannels()).containsExactly("email", "pager");
        assertThat(alert.isNotificationSent()).isTrue();
        assertThat(engine.findObservations(MODEL)).hasSize(1);
    }

    @Test
    @DisplayName("Non-breaching and rule-less observations should be stored but raise nothing")
    void nonBreachingOutcomes() {
        SubmissionResult within = engine.submitMetric(observation(MetricType.LATENCY, 50, T0));
        SubmissionResult noRule = engine.submitMetric(observation(MetricType.THROUGHPUT, 0, T0));

        assertThat(within.getOutcome()).isEqualTo(SubmissionResult.Outcome.WITHIN_THRESHOLD);
        assertThat(noRule.getOutcome()).isEqualTo(SubmissionResult.Outcome.NO_RULE);
        assertThat(within.isBreach()).isFalse();
        assertThat(engine.findObservation(noRule.getObservationId())).isPresent();
        assertThat(engine.findAlerts(MODEL)).isEmpty();
    }

    @Test
    @DisplayName("Unknown models should be rejected before anything is stored")
    void unknownModelIsRejected() {
        MetricObservation obs = MetricObservation.builder()
                .modelId("ghost").metricType(MetricType.LATENCY).value(500).timestamp(T0).build();

        assertThatThrownBy(() -> engine.submitMetric(obs)).isInstanceOf(NotFoundException.class);
        assertThat(metrics.findByModel("ghost")).isEmpty();
    }

    @Test
    @DisplayName("A repeated breach within the cooldown should refresh the existing alert only")
    void cooldownSuppressesDuplicate() {
        SubmissionResult first = engine.submitMetric(observation(MetricType.DRIFT_SCORE, 0.2, T0));
        SubmissionResult second = engine.submitMetric(
                observation(MetricType.DRIFT_SCORE, 0.4, T0.plusSeconds(300)));

        assertThat(second.getOutcome()).isEqualTo(SubmissionResult.Outcome.SUPPRESSED_BY_COOLDOWN);
        assertThat(second.getAlertId()).isEqualTo(first.getAlertId());
        assertThat(second.isBreach()).isTrue();

        List<Alert> all = engine.findAlerts(MODEL);
        assertThat(all).hasSize(1);
        assertThat(all.get(0).getCurrentValue()).isEqualTo(0.4);
        assertThat(all.get(0).getNotificationAttempts()).isEqualTo(2);
        assertThat(all.get(0).getTriggeredAt()).isEqualTo(T0);
    }

    @Test
    @DisplayName("Late observations inside the cooldown window should also be suppressed")
    void lateArrivalInsideCooldown() {
        engine.submitMetric(observation(MetricType.LATENCY, 150, T0));
        SubmissionResult late = engine.submitMetric(observation(MetricType.LATENCY, 180, T0.minusSeconds(120)));

        assertThat(late.getOutcome()).isEqualTo(SubmissionResult.Outcome.SUPPRESSED_BY_COOLDOWN);
    }

    @Test
    @DisplayName("A breach after the cooldown should open a new alert")
    void breachAfterCooldownOpensNewAlert() {
        engine.submitMetric(observation(MetricType.LATENCY, 150, T0));
        SubmissionResult later = engine.submitMetric(observation(MetricType.LATENCY, 150, T0.plusSeconds(900)));

        assertThat(later.getOutcome()).isEqualTo(SubmissionResult.Outcome.ALERT_CREATED);
        assertThat(engine.findAlerts(MODEL)).hasSize(2);
    }

    @Test
    @DisplayName("A resolved alert should not suppress a new breach")
    void resolvedAlertDoesNotSuppress() {
        String alertId = engine.submitMetric(observation(MetricType.LATENCY, 150, T0)).getAlertId().orElseThrow();
        engine.resolveAlert(alertId, "alice", "scaled out", null);

        SubmissionResult next = engine.submitMetric(observation(MetricType.LATENCY, 150, T0.plusSeconds(10)));

        assertThat(next.getOutcome()).isEqualTo(SubmissionResult.Outcome.ALERT_CREATED);
    }

    @Test
    @DisplayName("Different alert types should not suppress each other")
    void cooldownIsKeyedByType() {
        engine.submitMetric(observation(MetricType.LATENCY, 150, T0));
        SubmissionResult drift = engine.submitMetric(observation(MetricType.DRIFT_SCORE, 0.3, T0));

        assertThat(drift.getOutcome()).isEqualTo(SubmissionResult.Outcome.ALERT_CREATED);
    }

    @Test
    @DisplayName("A zero cooldown should never suppress")
    void zeroCooldownNeverSuppresses() {
        MonitoringConfig config = registry.findConfig(MODEL).orElseThrow();
        config.setAlertCooldownSeconds(0);
        registry.register(config);

        engine.submitMetric(observation(MetricType.LATENCY, 150, T0));
        SubmissionResult second = engine.submitMetric(observation(MetricType.LATENCY, 150, T0));

        assertThat(second.getOutcome()).isEqualTo(SubmissionResult.Outcome.ALERT_CREATED);
    }

    @Test
    @DisplayName("Concurrent breaches with no prior alert should produce exactly one alert")
    void concurrentBreachesProduceOneAlert() throws Exception {
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<SubmissionResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                double value = 200 + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    return engine.submitMetric(observation(MetricType.LATENCY, value, T0));
                }));
            }
            start.countDown();

            int created = 0;
            for (Future<SubmissionResult> f : futures) {
                if (f.get(10, TimeUnit.SECONDS).getOutcome() == SubmissionResult.Outcome.ALERT_CREATED) {
                    created++;
                }
            }
            assertThat(created).isEqualTo(1);
            assertThat(engine.findAlerts(MODEL)).hasSize(1);
            assertThat(engine.findObservations(MODEL)).hasSize(threads);
        } finally {
            pool.shutdownNow();
        }
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Lifecycle operations should persist and notify on every change")
    void lifecycleThroughEngine() {
        String alertId = engine.submitMetric(observation(MetricType.LATENCY, 150, T0)).getAlertId().orElseThrow();

        clock.advance(Duration.ofMinutes(20));
        Alert acked = engine.acknowledgeAlert(alertId, "alice", "on it");
        assertThat(acked.getStatus()).isEqualTo(AlertStatus.ACKNOWLEDGED);
        assertThat(acked.getNotificationAttempts()).isEqualTo(4);

        clock.advance(Duration.ofMinutes(105));
        Alert resolved = engine.resolveAlert(alertId, "alice", "scaled out", null);
        assertThat(resolved.getTimeToResolveMinutes()).isEqualTo(125L);

        Alert closed = engine.closeAlert(alertId, "alice");
        assertThat(closed.getStatus()).isEqualTo(AlertStatus.CLOSED);
        assertThat(engine.getAlert(alertId)).isEqualTo(closed);
        assertThat(engine.getAlert(alertId).getNotificationAttempts()).isEqualTo(8);
        assertThat(engine.timeSinceTriggeredMinutes(alertId)).isEqualTo(125);
    }

    @Test
    @DisplayName("An illegal transition should leave the stored alert unchanged")
    void illegalTransitionLeavesRecord() {
        String alertId = engine.submitMetric(observation(MetricType.LATENCY, 150, T0)).getAlertId().orElseThrow();
        engine.resolveAlert(alertId, "alice", "fixed", null);
        Alert before = engine.getAlert(alertId);

        assertThatThrownBy(() -> engine.acknowledgeAlert(alertId, "bob", null))
                .isInstanceOf(InvalidTransitionException.class);
        assertThat(engine.getAlert(alertId).getVersion()).isEqualTo(before.getVersion());
    }

    @Test
    @DisplayName("A transition that loses a race should fail with a conflict")
    void transitionConflict() {
        String alertId = engine.submitMetric(observation(MetricType.LATENCY, 150, T0)).getAlertId().orElseThrow();
        alerts.interfereOnNextUpdate();

        assertThatThrownBy(() -> engine.acknowledgeAlert(alertId, "alice", null))
                .isInstanceOf(ConcurrencyConflictException.class);
        assertThat(engine.getAlert(alertId).getStatus()).isEqualTo(AlertStatus.OPEN);
    }

    @Test
    @DisplayName("Recording a notification attempt should retry after a concurrent write")
    void recordingRetriesAfterConflict() {
        String alertId = engine.submitMetric(observation(MetricType.LATENCY, 150, T0)).getAlertId().orElseThrow();
        alerts.interfereOnNextUpdate();

        Alert recorded = engine.recordNotificationAttempt(alertId, "sms", false);

        assertThat(recorded.getNotificationAttempts()).isEqualTo(3);
        assertThat(recorded.getNotificationChannels()).endsWith("sms");
    }

    @Test
    @DisplayName("Unknown alerts should raise NotFound")
    void unknownAlert() {
        assertThatThrownBy(() -> engine.closeAlert("missing", "alice"))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("A store call that exceeds its budget should fail with a timeout")
    void slowStoreTimesOut() {
        AlertStore slow = new InjectingAlertStore(new InMemoryAlertStore()) {
            @Override
            public Optional<Alert> findById(String alertId) {
                try {
                    Thread.sleep(2_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return super.findById(alertId);
            }
        };
        try (MonitoringEngine timed = newEngine(slow, new EngineSettings.Builder().storeTimeoutMs(50).build())) {
            assertThatThrownBy(() -> timed.getAlert("a-1")).isInstanceOf(OperationTimeoutException.class);
        }
    }

    @Test
    @DisplayName("An insert that ignores cancellation should keep the key locked until it lands")
    void timedOutInsertStillDeduplicates() {
        AtomicBoolean stall = new AtomicBoolean(true);
        AlertStore stubborn = new InjectingAlertStore(new InMemoryAlertStore()) {
            @Override
            public void insert(Alert alert) {
                if (stall.compareAndSet(true, false)) {
                    long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(600);
                    while (System.nanoTime() < deadline) {
                        Thread.onSpinWait();
                    }
                }
                super.insert(alert);
            }
        };
        EngineSettings settings = new EngineSettings.Builder()
                .storeTimeoutMs(100)
                .lockTimeoutMs(5_000)
                .build();
        try (MonitoringEngine timed = newEngine(stubborn, settings)) {
            assertThatThrownBy(() -> timed.submitMetric(observation(MetricType.LATENCY, 200, T0)))
                    .isInstanceOf(OperationTimeoutException.class);

            SubmissionResult second = timed.submitMetric(
                    observation(MetricType.LATENCY, 300, T0.plusSeconds(1)));

            assertThat(second.getOutcome()).isEqualTo(SubmissionResult.Outcome.SUPPRESSED_BY_COOLDOWN);
            List<Alert> latency = timed.findAlerts(MODEL);
            assertThat(latency).hasSize(1);
            assertThat(latency.get(0).getCurrentValue()).isEqualTo(300.0);
        }
    }

    private static MetricObservation observation(MetricType type, double value, Instant at) {
        return MetricObservation.builder()
                .modelId(MODEL)
                .metricType(type)
                .value(value)
                .timestamp(at)
                .build();
    }

    /**
     * Delegating store that can simulate a competing writer.
     */
    static class InjectingAlertStore implements AlertStore {

        private final AlertStore delegate;
        private final AtomicBoolean interfere = new AtomicBoolean();

        InjectingAlertStore(AlertStore delegate) {
            this.delegate = delegate;
        }

        void interfereOnNextUpdate() {
            interfere.set(true);
        }

        @Override
        public void insert(Alert alert) {
            delegate.insert(alert);
        }

        @Override
        public void update(Alert next) {
            if (interfere.compareAndSet(true, false)) {
                Alert current = delegate.findById(next.getAlertId()).orElseThrow();
                delegate.update(current.toBuilder().version(current.getVersion() + 1).build());
            }
            delegate.update(next);
        }

        @Override
        public Optional<Alert> findById(String alertId) {
            return delegate.findById(alertId);
        }

        @Override
        public Optional<Alert> findLatestActive(String modelId, AlertType alertType) {
            return delegate.findLatestActive(modelId, alertType);
        }

        @Override
        public List<Alert> findByModel(String modelId) {
            return delegate.findByModel(modelId);
        }
    }
}
