package com.modelsentinel.core.engine;

import com.modelsentinel.core.error.OperationTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Mutual exclusion per key with a bounded wait.
 *
 * <p>
 * One permit is kept per distinct key for the lifetime of the instance. Keys
 * are (model, alert type) pairs, a small and bounded set, so permits are never
 * evicted. Locks are not reentrant.
 * </p>
 *
 * <p>
 * When the action fails with an {@link OperationTimeoutException} whose store
 * call is still in flight, the key stays locked until that call has settled.
 * The next holder therefore always sees the late write, if any.
 * </p>
 *
 * @param <K> key type; must implement {@code equals}/{@code hashCode}
 * @since 1.0.0
 */
public final class KeyedLocks<K> {

    private static final Logger LOG = LoggerFactory.getLogger(KeyedLocks.class);

    private final Map<K, Semaphore> locks = new ConcurrentHashMap<>();

    /**
     * Run {@code action} while holding the lock of {@code key}.
     *
     * @throws OperationTimeoutException if the lock is not acquired within
     *                                   {@code timeout}, or the wait is
     *                                   interrupted
     */
    public <T> T withLock(K key, Duration timeout, Supplier<T> action) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        Objects.requireNonNull(action, "action must not be null");

        Semaphore lock = locks.computeIfAbsent(key, k -> new Semaphore(1));
        String operation = "lock " + key;
        boolean acquired;
        try {
            acquired = lock.tryAcquire(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationTimeoutException(operation, timeout, e);
        }
        if (!acquired) {
            throw new OperationTimeoutException(operation, timeout);
        }
        try {
            T result = action.get();
            lock.release();
            return result;
        } catch (OperationTimeoutException e) {
            if (e.getInFlight().toCompletableFuture().isDone()) {
                lock.release();
            } else {
                LOG.warn("Holding lock {} until timed-out '{}' settles", key, e.getOperation());
                e.getInFlight().whenComplete((ignored, failure) -> lock.release());
            }
            throw e;
        } catch (RuntimeException | Error e) {
            lock.release();
            throw e;
        }
    }

    /** Number of keys seen so far. */
    int size() {
        return locks.size();
    }

    /** Whether {@code key} is currently held. */
    boolean isLocked(K key) {
        Semaphore lock = locks.get(key);
        return lock != null && lock.availablePermits() == 0;
    }
}
