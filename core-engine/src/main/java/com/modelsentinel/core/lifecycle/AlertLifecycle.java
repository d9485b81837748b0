package com.modelsentinel.core.lifecycle;

import com.modelsentinel.core.error.InvalidTransitionException;
import com.modelsentinel.core.error.ValidationException;
import com.modelsentinel.core.model.Alert;
import com.modelsentinel.core.model.AlertDraft;
import com.modelsentinel.core.model.AlertStatus;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Forward-only alert state machine.
 *
 * <pre>
 *   OPEN ──► ACKNOWLEDGED ──► RESOLVED ──► CLOSED
 *     │                          ▲           ▲
 *     ├──────────────────────────┘           │
 *     └──────────────────────────────────────┘  (administrative close)
 * </pre>
 *
 * <p>
 * Every operation takes a snapshot and returns the next snapshot, with the
 * version incremented and {@code updatedAt} stamped from the clock. The input
 * snapshot is never modified. Re-applying a transition that already happened
 * fails with {@link InvalidTransitionException} instead of succeeding
 * silently.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Stateless apart from the clock; safe to share. Making the result durable
 * (and detecting concurrent writers) is up to the alert store.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertLifecycle {

    static final String ACKNOWLEDGE = "acknowledge";
    static final String RESOLVE = "resolve";
    static final String CLOSE = "close";
    static final String REFRESH = "refresh";

    private final Clock clock;

    public AlertLifecycle(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Create the initial OPEN snapshot for a breach.
     *
     * @param draft   evaluation result
     * @param alertId identity for the new alert
     * @return version 1 of the alert; {@code triggeredAt} is the breaching
     *         observation's timestamp
     */
    public Alert open(AlertDraft draft, String alertId) {
        Objects.requireNonNull(draft, "draft must not be null");
        requireText(alertId, "alertId");
        return Alert.builder()
                .alertId(alertId)
                .modelId(draft.getModelId())
                .alertType(draft.getAlertType())
                .severity(draft.getSeverity())
                .status(AlertStatus.OPEN)
                .title(draft.getTitle())
                .message(draft.getMessage())
                .metricType(draft.getMetricType())
                .observationId(draft.getObservationId())
                .thresholdValue(draft.getThresholdValue())
                .currentValue(draft.getCurrentValue())
                .triggeredAt(draft.getObservedAt())
                .metadata(draft.getMetadata())
                .tags(draft.getTags())
                .updatedAt(clock.instant())
                .version(1)
                .build();
    }

    /**
     * OPEN → ACKNOWLEDGED.
     *
     * @param alert current snapshot
     * @param actor id of the acknowledging user
     * @param notes optional notes, appended to the resolution notes
     * @return the acknowledged snapshot
     * @throws InvalidTransitionException unless the alert is OPEN
     */
    public Alert acknowledge(Alert alert, String actor, String notes) {
        Objects.requireNonNull(alert, "alert must not be null");
        requireText(actor, "actor");
        if (alert.getStatus() != AlertStatus.OPEN) {
            throw new InvalidTransitionException(alert.getAlertId(), ACKNOWLEDGE, alert.getStatus());
        }
        return next(alert)
                .status(AlertStatus.ACKNOWLEDGED)
                .acknowledgedBy(actor)
                .acknowledgedAt(clock.instant())
                .resolutionNotes(appendNotes(alert.getResolutionNotes(), notes))
                .build();
    }

    /**
     * OPEN or ACKNOWLEDGED → RESOLVED. Computes the time to resolve, in whole
     * minutes rounded down, once.
     *
     * @param alert  current snapshot
     * @param actor  id of the resolving user
     * @param action what was done to resolve the alert
     * @param notes  optional notes
     * @return the resolved snapshot
     * @throws InvalidTransitionException from RESOLVED or CLOSED
     */
    public Alert resolve(Alert alert, String actor, String action, String notes) {
        Objects.requireNonNull(alert, "alert must not be null");
        requireText(actor, "actor");
        requireText(action, "resolution action");
        if (!alert.getStatus().isActive()) {
            throw new InvalidTransitionException(alert.getAlertId(), RESOLVE, alert.getStatus());
        }
        Instant now = clock.instant();
        return next(alert)
                .status(AlertStatus.RESOLVED)
                .resolvedBy(actor)
                .resolvedAt(now)
                .resolutionAction(action)
                .resolutionNotes(appendNotes(alert.getResolutionNotes(), notes))
                .timeToResolveMinutes(minutesBetween(alert.getTriggeredAt(), now))
                .updatedAt(now)
                .build();
    }

    /**
     * Any non-CLOSED status → CLOSED. Closing an unresolved alert is an
     * administrative dismissal.
     *
     * @param alert current snapshot
     * @param actor id of the closing user
     * @return the closed snapshot
     * @throws InvalidTransitionException if the alert is already CLOSED
     */
    public Alert close(Alert alert, String actor) {
        Objects.requireNonNull(alert, "alert must not be null");
        requireText(actor, "actor");
        if (alert.getStatus().isTerminal()) {
            throw new InvalidTransitionException(alert.getAlertId(), CLOSE, alert.getStatus());
        }
        return next(alert)
                .status(AlertStatus.CLOSED)
                .closedAt(clock.instant())
                .closedBy(actor)
                .build();
    }

    /**
     * Record one delivery attempt. Legal in every status.
     *
     * @param alert   current snapshot
     * @param channel channel identifier that was attempted
     * @param success whether delivery succeeded
     * @return snapshot with the attempt counted
     */
    public Alert recordNotificationAttempt(Alert alert, String channel, boolean success) {
        Objects.requireNonNull(alert, "alert must not be null");
        requireText(channel, "channel");
        List<String> channels = new ArrayList<>(alert.getNotificationChannels());
        channels.add(channel);
        return next(alert)
                .notificationAttempts(alert.getNotificationAttempts() + 1)
                .notificationChannels(channels)
                .notificationSent(alert.isNotificationSent() || success)
                .build();
    }

    /**
     * Replace the current value of an active alert with a newer breaching
     * value. Used when a repeated breach falls inside the cooldown.
     *
     * @param alert         current snapshot; must be OPEN or ACKNOWLEDGED
     * @param currentValue  the new breaching value
     * @param observationId the observation carrying it
     * @return the refreshed snapshot
     * @throws InvalidTransitionException if the alert is no longer active
     */
    public Alert refreshCurrentValue(Alert alert, double currentValue, String observationId) {
        Objects.requireNonNull(alert, "alert must not be null");
        if (!alert.getStatus().isActive()) {
            throw new InvalidTransitionException(alert.getAlertId(), REFRESH, alert.getStatus());
        }
        return next(alert)
                .currentValue(currentValue)
                .observationId(observationId)
                .build();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Alert.Builder next(Alert alert) {
        return alert.toBuilder()
                .version(alert.getVersion() + 1)
                .updatedAt(clock.instant());
    }

    static long minutesBetween(Instant from, Instant to) {
        long seconds = Duration.between(from, to).getSeconds();
        return Math.max(0, Math.floorDiv(seconds, 60));
    }

    private static String appendNotes(String existing, String notes) {
        if (notes == null || notes.isBlank()) {
            return existing;
        }
        return existing == null || existing.isEmpty() ? notes : existing + "\n" + notes;
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(name + " must not be blank");
        }
    }
}
