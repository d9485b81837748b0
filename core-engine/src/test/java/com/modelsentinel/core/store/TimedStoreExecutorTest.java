package com.modelsentinel.core.store;

import com.modelsentinel.core.error.NotFoundException;
import com.modelsentinel.core.error.OperationTimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TimedStoreExecutor}.
 */
class TimedStoreExecutorTest {

    private final TimedStoreExecutor executor = new TimedStoreExecutor(Duration.ofMillis(100));

    @AfterEach
    void tearDown() {
        executor.close();
    }

    @Test
    @DisplayName("Should return the result of a fast call")
    void returnsResult() {
        assertThat(executor.call("fast", () -> 42)).isEqualTo(42);
    }

    @Test
    @DisplayName("Should fail with a timeout when the call is too slow")
    void timesOut() {
        assertThatThrownBy(() -> executor.call("slow", () -> {
            Thread.sleep(5_000);
            return 1;
        }))
                .isInstanceOf(OperationTimeoutException.class)
                .satisfies(e -> assertThat(((OperationTimeoutException) e).getOperation()).isEqualTo("slow"));
    }

    @Test
    @DisplayName("Should report a finished call as settled when it honours interruption")
    void interruptedCallIsSettled() {
        assertThatThrownBy(() -> executor.call("slow", () -> {
            Thread.sleep(5_000);
            return 1;
        }))
                .isInstanceOf(OperationTimeoutException.class)
                .satisfies(e -> assertThat(((OperationTimeoutException) e).getInFlight()
                        .toCompletableFuture().get(2, TimeUnit.SECONDS)).isNull());
    }

    @Test
    @DisplayName("Should expose a call that ignores interruption until it returns")
    void stubbornCallStaysInFlight() throws Exception {
        AtomicBoolean finished = new AtomicBoolean();
        OperationTimeoutException timeout = null;
        try {
            executor.call("stubborn", () -> {
                long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(500);
                while (System.nanoTime() < deadline) {
                    Thread.onSpinWait();
                }
                finished.set(true);
                return 1;
            });
        } catch (OperationTimeoutException e) {
            timeout = e;
        }

        assertThat(timeout).isNotNull();
        assertThat(timeout.getInFlight().toCompletableFuture().isDone()).isFalse();
        timeout.getInFlight().toCompletableFuture().get(5, TimeUnit.SECONDS);
        assertThat(finished).isTrue();
    }

    @Test
    @DisplayName("Should rethrow runtime exceptions from the store unchanged")
    void rethrowsStoreErrors() {
        assertThatThrownBy(() -> executor.run("find", () -> {
            throw NotFoundException.alert("a-1");
        })).isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Should reject a non-positive budget")
    void rejectsZeroTimeout() {
        assertThatThrownBy(() -> new TimedStoreExecutor(Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
