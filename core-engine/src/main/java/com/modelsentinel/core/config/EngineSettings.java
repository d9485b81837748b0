package com.modelsentinel.core.config;

import java.io.Serializable;
import java.time.Duration;
import java.util.Objects;

/**
 * Operational limits of the monitoring engine.
 *
 * <h3>Environment</h3>
 * <ul>
 * <li>{@code STORE_TIMEOUT_MS}: budget of a single store call (default 2000)</li>
 * <li>{@code LOCK_TIMEOUT_MS}: how long to wait for a per-(model, alert type)
 * lock (default 2000)</li>
 * <li>{@code NOTIFICATION_RECORD_RETRIES}: attempts to record a notification
 * outcome when the alert keeps changing underneath (default 3)</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class EngineSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final long DEFAULT_STORE_TIMEOUT_MS = 2_000;
    public static final long DEFAULT_LOCK_TIMEOUT_MS = 2_000;
    public static final int DEFAULT_NOTIFICATION_RECORD_RETRIES = 3;

    private final long storeTimeoutMs;
    private final long lockTimeoutMs;
    private final int notificationRecordRetries;

    private EngineSettings(Builder b) {
        this.storeTimeoutMs = b.storeTimeoutMs;
        this.lockTimeoutMs = b.lockTimeoutMs;
        this.notificationRecordRetries = b.notificationRecordRetries;
    }

    public static EngineSettings defaults() {
        return new Builder().build();
    }

    /**
     * @throws IllegalStateException    if a variable is not a number
     * @throws IllegalArgumentException if a value is out of range
     */
    public static EngineSettings fromEnvironment() {
        try {
            return new Builder()
                    .storeTimeoutMs(Long.parseLong(env("STORE_TIMEOUT_MS",
                            String.valueOf(DEFAULT_STORE_TIMEOUT_MS))))
                    .lockTimeoutMs(Long.parseLong(env("LOCK_TIMEOUT_MS",
                            String.valueOf(DEFAULT_LOCK_TIMEOUT_MS))))
                    .notificationRecordRetries(Integer.parseInt(env("NOTIFICATION_RECORD_RETRIES",
                            String.valueOf(DEFAULT_NOTIFICATION_RECORD_RETRIES))))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    public Duration getStoreTimeout() {
        return Duration.ofMillis(storeTimeoutMs);
    }

    public Duration getLockTimeout() {
        return Duration.ofMillis(lockTimeoutMs);
    }

    public int getNotificationRecordRetries() {
        return notificationRecordRetries;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private long storeTimeoutMs = DEFAULT_STORE_TIMEOUT_MS;
        private long lockTimeoutMs = DEFAULT_LOCK_TIMEOUT_MS;
        private int notificationRecordRetries = DEFAULT_NOTIFICATION_RECORD_RETRIES;

        public Builder storeTimeoutMs(long v) {
            this.storeTimeoutMs = v;
            return this;
        }

        public Builder lockTimeoutMs(long v) {
            this.lockTimeoutMs = v;
            return this;
        }

        public Builder notificationRecordRetries(int v) {
            this.notificationRecordRetries = v;
            return this;
        }

        public EngineSettings build() {
            if (storeTimeoutMs < 1) {
                throw new IllegalArgumentException("storeTimeoutMs must be >= 1, got: " + storeTimeoutMs);
            }
            if (lockTimeoutMs < 1) {
                throw new IllegalArgumentException("lockTimeoutMs must be >= 1, got: " + lockTimeoutMs);
            }
            if (notificationRecordRetries < 1) {
                throw new IllegalArgumentException(
                        "notificationRecordRetries must be >= 1, got: " + notificationRecordRetries);
            }
            return new EngineSettings(this);
        }
    }

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EngineSettings that))
            return false;
        return storeTimeoutMs == that.storeTimeoutMs
                && lockTimeoutMs == that.lockTimeoutMs
                && notificationRecordRetries == that.notificationRecordRetries;
    }

    @Override
    public int hashCode() {
        return Objects.hash(storeTimeoutMs, lockTimeoutMs, notificationRecordRetries);
    }

    @Override
    public String toString() {
        return "EngineSettings{storeTimeoutMs=" + storeTimeoutMs
                + ", lockTimeoutMs=" + lockTimeoutMs
                + ", notificationRecordRetries=" + notificationRecordRetries + '}';
    }
}
