package com.modelsentinel.core.lifecycle;

import com.modelsentinel.core.TestClock;
import com.modelsentinel.core.error.InvalidTransitionException;
import com.modelsentinel.core.error.ValidationException;
import com.modelsentinel.core.model.Alert;
import com.modelsentinel.core.model.AlertDraft;
import com.modelsentinel.core.model.AlertSeverity;
import com.modelsentinel.core.model.AlertStatus;
import com.modelsentinel.core.model.AlertType;
import com.modelsentinel.core.model.MetricType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Random;
import java.util.function.UnaryOperator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Unit tests for {@link AlertLifecycle}.
 */
class AlertLifecycleTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private TestClock clock;
    private AlertLifecycle lifecycle;
    private Alert open;

    @BeforeEach
    void setUp() {
        clock = new TestClock(T0);
        lifecycle = new AlertLifecycle(clock);
        open = lifecycle.open(draft(), "alert-1");
    }

    @Test
    @DisplayName("open should create version 1 in OPEN, triggered at the observation time")
    void openCreatesInitialSnapshot() {
        assertThat(open.getStatus()).isEqualTo(AlertStatus.OPEN);
        assertThat(open.getVersion()).isEqualTo(1);
        assertThat(open.getTriggeredAt()).isEqualTo(T0.minusSeconds(30));
        assertThat(open.getNotificationAttempts()).isZero();
        assertThat(open.isNotificationSent()).isFalse();
        assertThat(open.getTimeToResolveMinutes()).isNull();
    }

    @Nested
    @DisplayName("acknowledge")
    class Acknowledge {

        @Test
        @DisplayName("Should stamp actor and time and append notes")
        void acknowledgesOpenAlert() {
            clock.advance(Duration.ofMinutes(5));
            Alert acked = lifecycle.acknowledge(open, "alice", "looking into it");

            assertThat(acked.getStatus()).isEqualTo(AlertStatus.ACKNOWLEDGED);
            assertThat(acked.getAcknowledgedBy()).isEqualTo("alice");
            assertThat(acked.getAcknowledgedAt()).isEqualTo(T0.plus(Duration.ofMinutes(5)));
            assertThat(acked.getResolutionNotes()).isEqualTo("looking into it");
            assertThat(acked.getVersion()).isEqualTo(2);
            assertThat(open.getStatus()).isEqualTo(AlertStatus.OPEN);
        }

        @Test
        @DisplayName("Should fail a second time and report the current status")
        void secondAcknowledgeFails() {
            Alert acked = lifecycle.acknowledge(open, "alice", null);

            InvalidTransitionException e = catchThrowableOfType(
                    () -> lifecycle.acknowledge(acked, "bob", null), InvalidTransitionException.class);

            assertThat(e).isNotNull();
            assertThat(e.getCurrentStatus()).isEqualTo(AlertStatus.ACKNOWLEDGED);
        }

        @Test
        @DisplayName("Should reject a blank actor")
        void rejectsBlankActor() {
            assertThatThrownBy(() -> lifecycle.acknowledge(open, " ", null))
                    .isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    @DisplayName("resolve")
    class Resolve {

        @Test
        @DisplayName("Should compute time to resolve in whole minutes")
        void computesTimeToResolve() {
            Alert alert = lifecycle.open(draftAt(T0), "alert-2");
            clock.set(T0.plus(Duration.ofMinutes(125)).plusSeconds(59));

            Alert resolved = lifecycle.resolve(alert, "alice", "retrained", null);

            assertThat(resolved.getStatus()).isEqualTo(AlertStatus.RESOLVED);
            assertThat(resolved.getTimeToResolveMinutes()).isEqualTo(125L);
            assertThat(resolved.getResolutionAction()).isEqualTo("retrained");
            assertThat(resolved.getResolvedBy()).isEqualTo("alice");
        }

        @Test
        @DisplayName("Should skip acknowledgment and keep earlier notes")
        void resolvesFromOpenAndAppendsNotes() {
            Alert acked = lifecycle.acknowledge(open, "alice", "first");
            Alert resolved = lifecycle.resolve(acked, "alice", "rollback", "second");

            assertThat(resolved.getResolutionNotes()).isEqualTo("first\nsecond");
            assertThat(lifecycle.resolve(open, "bob", "rollback", null).getStatus())
                    .isEqualTo(AlertStatus.RESOLVED);
        }

        @Test
        @DisplayName("Time to resolve should not change when the alert is later closed")
        void timeToResolveIsNeverRecomputed() {
            clock.advance(Duration.ofMinutes(10));
            Alert resolved = lifecycle.resolve(open, "alice", "fixed", null);
            clock.advance(Duration.ofHours(3));
            Alert closed = lifecycle.close(resolved, "alice");

            assertThat(closed.getTimeToResolveMinutes()).isEqualTo(resolved.getTimeToResolveMinutes());
        }

        @Test
        @DisplayName("Should clamp a resolve before the trigger time to zero minutes")
        void clampsNegativeDuration() {
            assertThat(AlertLifecycle.minutesBetween(T0, T0.minusSeconds(90))).isZero();
            assertThat(AlertLifecycle.minutesBetween(T0, T0.plusSeconds(119))).isEqualTo(1);
        }

        @Test
        @DisplayName("Should require an action")
        void requiresAction() {
            assertThatThrownBy(() -> lifecycle.resolve(open, "alice", "", null))
                    .isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    @DisplayName("close")
    class Close {

        @Test
        @DisplayName("Should be reachable directly from OPEN")
        void closesFromOpen() {
            Alert closed = lifecycle.close(open, "admin");

            assertThat(closed.getStatus()).isEqualTo(AlertStatus.CLOSED);
            assertThat(closed.getClosedBy()).isEqualTo("admin");
            assertThat(closed.getClosedAt()).isEqualTo(T0);
            assertThat(closed.getResolvedAt()).isNull();
        }

        @Test
        @DisplayName("Should be reachable from RESOLVED")
        void closesFromResolved() {
            Alert resolved = lifecycle.resolve(open, "alice", "fixed", null);

            assertThat(lifecycle.close(resolved, "alice").getStatus()).isEqualTo(AlertStatus.CLOSED);
        }

        @Test
        @DisplayName("Should fail on an already closed alert")
        void closingTwiceFails() {
            Alert closed = lifecycle.close(open, "admin");

            assertThatThrownBy(() -> lifecycle.close(closed, "admin"))
                    .isInstanceOf(InvalidTransitionException.class)
                    .hasMessageContaining("closed");
        }
    }

    @Test
    @DisplayName("resolve then acknowledge should fail")
    void resolveThenAcknowledgeFails() {
        Alert resolved = lifecycle.resolve(open, "alice", "fixed", null);

        assertThatThrownBy(() -> lifecycle.acknowledge(resolved, "alice", null))
                .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    @DisplayName("Recording notification attempts should be legal in every status")
    void recordsAttemptsInAnyStatus() {
        Alert closed = lifecycle.close(open, "admin");

        Alert once = lifecycle.recordNotificationAttempt(closed, "email", false);
        Alert twice = lifecycle.recordNotificationAttempt(once, "slack", true);
        Alert thrice = lifecycle.recordNotificationAttempt(twice, "email", false);

        assertThat(thrice.getNotificationAttempts()).isEqualTo(3);
        assertThat(thrice.getNotificationChannels()).containsExactly("email", "slack", "email");
        assertThat(once.isNotificationSent()).isFalse();
        assertThat(thrice.isNotificationSent()).isTrue();
        assertThat(thrice.getStatus()).isEqualTo(AlertStatus.CLOSED);
    }

    @Test
    @DisplayName("refreshCurrentValue should only apply to active alerts")
    void refreshOnlyWhileActive() {
        Alert refreshed = lifecycle.refreshCurrentValue(open, 0.5, "obs-2");
        assertThat(refreshed.getCurrentValue()).isEqualTo(0.5);
        assertThat(refreshed.getNotificationAttempts()).isEqualTo(open.getNotificationAttempts());

        Alert resolved = lifecycle.resolve(open, "alice", "fixed", null);
        assertThatThrownBy(() -> lifecycle.refreshCurrentValue(resolved, 0.4, "obs-3"))
                .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    @DisplayName("Random operation sequences should never move status backwards")
    void statusNeverRegresses() {
        Random random = new Random(42);
        List<UnaryOperator<Alert>> operations = List.of(
                a -> lifecycle.acknowledge(a, "u", null),
                a -> lifecycle.resolve(a, "u", "fix", null),
                a -> lifecycle.close(a, "u"),
                a -> lifecycle.recordNotificationAttempt(a, "email", random.nextBoolean()));

        for (int run = 0; run < 200; run++) {
            Alert current = lifecycle.open(draft(), "alert-" + run);
            for (int step = 0; step < 8; step++) {
                UnaryOperator<Alert> op = operations.get(random.nextInt(operations.size()));
                try {
                    Alert next = op.apply(current);
                    assertThat(next.getStatus().ordinal()).isGreaterThanOrEqualTo(current.getStatus().ordinal());
                    assertThat(next.getVersion()).isEqualTo(current.getVersion() + 1);
                    current = next;
                } catch (InvalidTransitionException e) {
                    assertThat(e.getCurrentStatus()).isEqualTo(current.getStatus());
                }
            }
        }
    }

    private static AlertDraft draft() {
        return draftAt(T0.minusSeconds(30));
    }

    private static AlertDraft draftAt(Instant observedAt) {
        return AlertDraft.builder()
                .modelId("m-1")
                .alertType(AlertType.LATENCY_INCREASE)
                .severity(AlertSeverity.HIGH)
                .metricType(MetricType.LATENCY)
                .thresholdValue(100)
                .currentValue(130)
                .observedAt(observedAt)
                .observationId("obs-1")
                .title("Latency increase on model m-1")
                .message("latency=130 exceeded threshold 100")
                .build();
    }
}
