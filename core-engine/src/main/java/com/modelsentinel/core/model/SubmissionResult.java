package com.modelsentinel.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of submitting one metric observation.
 *
 * <p>
 * Cooldown suppression is a successful outcome, reported as
 * {@link Outcome#SUPPRESSED_BY_COOLDOWN} and distinct from
 * {@link Outcome#WITHIN_THRESHOLD}.
 * </p>
 *
 * @since 1.0.0
 */
public final class SubmissionResult {

    /** What the engine did with the observation. */
    public enum Outcome {
        /** The metric type has no threshold rule. */
        NO_RULE,
        /** A rule exists and the value did not breach it. */
        WITHIN_THRESHOLD,
        /** The value breached and a new OPEN alert was created. */
        ALERT_CREATED,
        /** The value breached inside the cooldown of an active alert, whose current value was refreshed. */
        SUPPRESSED_BY_COOLDOWN
    }

    private final String observationId;
    private final Outcome outcome;
    private final String alertId;

    private SubmissionResult(String observationId, Outcome outcome, String alertId) {
        this.observationId = Objects.requireNonNull(observationId, "observationId must not be null");
        this.outcome = Objects.requireNonNull(outcome, "outcome must not be null");
        this.alertId = alertId;
    }

    public static SubmissionResult noRule(String observationId) {
        return new SubmissionResult(observationId, Outcome.NO_RULE, null);
    }

    public static SubmissionResult withinThreshold(String observationId) {
        return new SubmissionResult(observationId, Outcome.WITHIN_THRESHOLD, null);
    }

    public static SubmissionResult alertCreated(String observationId, String alertId) {
        return new SubmissionResult(observationId, Outcome.ALERT_CREATED,
                Objects.requireNonNull(alertId, "alertId must not be null"));
    }

    public static SubmissionResult suppressed(String observationId, String alertId) {
        return new SubmissionResult(observationId, Outcome.SUPPRESSED_BY_COOLDOWN,
                Objects.requireNonNull(alertId, "alertId must not be null"));
    }

    public String getObservationId() {
        return observationId;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    /**
     * @return the created or refreshed alert, empty when nothing breached
     */
    public Optional<String> getAlertId() {
        return Optional.ofNullable(alertId);
    }

    public boolean isBreach() {
        return outcome == Outcome.ALERT_CREATED || outcome == Outcome.SUPPRESSED_BY_COOLDOWN;
    }

    @Override
    public String toString() {
        return "SubmissionResult{" +
                "observationId='" + observationId + '\'' +
                ", outcome=" + outcome +
                ", alertId='" + alertId + '\'' +
                '}';
    }
}
