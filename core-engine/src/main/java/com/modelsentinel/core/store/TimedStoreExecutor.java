package com.modelsentinel.core.store;

import com.modelsentinel.core.error.OperationTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs store calls with a time budget.
 *
 * <p>
 * A call that does not finish within the budget is cancelled and reported as
 * {@link OperationTimeoutException}. A call still queued at that point never
 * runs. A call already running is interrupted, but a store that ignores
 * interrupts may still complete it; the exception's
 * {@link OperationTimeoutException#getInFlight()} completes only once the
 * call has returned. Runtime exceptions thrown by the call are rethrown
 * unchanged.
 * </p>
 *
 * @since 1.0.0
 */
public class TimedStoreExecutor implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(TimedStoreExecutor.class);

    private final Duration timeout;
    private final ExecutorService executor;

    /**
     * @param timeout budget for each call; must be positive
     */
    public TimedStoreExecutor(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be > 0, got: " + timeout);
        }
        this.timeout = timeout;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "store-call-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Run {@code call} within the budget.
     *
     * @param operation name used in errors and logs
     * @param call      the store call
     * @return the call's result
     * @throws OperationTimeoutException if the budget is exceeded or the
     *                                   caller is interrupted while waiting
     */
    public <T> T call(String operation, Callable<T> call) {
        AtomicReference<CallState> state = new AtomicReference<>(CallState.QUEUED);
        CompletableFuture<Void> settled = new CompletableFuture<>();
        Future<T> future = executor.submit(() -> {
            if (!state.compareAndSet(CallState.QUEUED, CallState.RUNNING)) {
                return null;
            }
            try {
                return call.call();
            } finally {
                settled.complete(null);
            }
        });
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            LOG.warn("Store call '{}' exceeded {} ms", operation, timeout.toMillis());
            throw abandon(operation, future, state, settled, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw abandon(operation, future, state, settled, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new IllegalStateException("Store call '" + operation + "' failed", cause);
        }
    }

    private OperationTimeoutException abandon(String operation, Future<?> future,
            AtomicReference<CallState> state, CompletableFuture<Void> settled, Exception cause) {
        if (state.compareAndSet(CallState.QUEUED, CallState.ABANDONED)) {
            future.cancel(false);
            return new OperationTimeoutException(operation, timeout, cause);
        }
        future.cancel(true);
        if (!settled.isDone()) {
            LOG.warn("Store call '{}' is still running after cancellation", operation);
        }
        return new OperationTimeoutException(operation, timeout, cause, settled);
    }

    /**
     * Variant of {@link #call(String, Callable)} for calls without a result.
     */
    public void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private enum CallState {
        QUEUED, RUNNING, ABANDONED
    }
}
