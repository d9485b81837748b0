package com.modelsentinel.core.notification;

import java.util.Objects;

/**
 * Outcome of one delivery attempt on one channel.
 *
 * @since 1.0.0
 */
public final class DeliveryResult {

    private final String channel;
    private final boolean success;
    private final String error;

    private DeliveryResult(String channel, boolean success, String error) {
        this.channel = Objects.requireNonNull(channel, "channel must not be null");
        this.success = success;
        this.error = error;
    }

    public static DeliveryResult delivered(String channel) {
        return new DeliveryResult(channel, true, null);
    }

    public static DeliveryResult failed(String channel, String error) {
        return new DeliveryResult(channel, false, error);
    }

    public String getChannel() {
        return channel;
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * @return failure description, or {@code null} on success
     */
    public String getError() {
        return error;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DeliveryResult that))
            return false;
        return success == that.success && channel.equals(that.channel) && Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(channel, success, error);
    }

    @Override
    public String toString() {
        return success ? "DeliveryResult{" + channel + ": delivered}"
                : "DeliveryResult{" + channel + ": failed (" + error + ")}";
    }
}
