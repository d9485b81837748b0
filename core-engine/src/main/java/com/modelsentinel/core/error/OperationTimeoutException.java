package com.modelsentinel.core.error;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Raised when a store call or a lock acquisition exceeds its budget.
 *
 * <p>
 * The effect of the operation is unknown. Lifecycle transitions are not
 * idempotent, so callers must re-read the alert before retrying one.
 * </p>
 *
 * <p>
 * A store call that was already running when its budget ran out may still be
 * in flight. {@link #getInFlight()} completes once that call has settled.
 * Holders of a per-key lock keep the key locked until then.
 * </p>
 *
 * @since 1.0.0
 */
public class OperationTimeoutException extends MonitoringException {

    private static final long serialVersionUID = 1L;

    private final String operation;
    private final Duration budget;
    private final transient CompletionStage<Void> inFlight;

    public OperationTimeoutException(String operation, Duration budget) {
        this(operation, budget, null, CompletableFuture.completedFuture(null));
    }

    public OperationTimeoutException(String operation, Duration budget, Throwable cause) {
        this(operation, budget, cause, CompletableFuture.completedFuture(null));
    }

    /**
     * @param inFlight completes when the timed-out call has stopped running
     */
    public OperationTimeoutException(String operation, Duration budget, Throwable cause,
            CompletionStage<Void> inFlight) {
        super("Operation '" + operation + "' timed out after " + budget.toMillis() + " ms", cause);
        this.operation = operation;
        this.budget = budget;
        this.inFlight = inFlight;
    }

    public String getOperation() {
        return operation;
    }

    public Duration getBudget() {
        return budget;
    }

    /** Completed once the timed-out call can no longer change any record. */
    public CompletionStage<Void> getInFlight() {
        return inFlight == null ? CompletableFuture.completedFuture(null) : inFlight;
    }
}
