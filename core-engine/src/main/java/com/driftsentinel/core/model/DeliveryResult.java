package com.driftsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of delivering one alert through one channel.
 *
 * @since 1.0.0
 */
public final class DeliveryResult {

    private final String channel;
    private final boolean success;
    private final String reason;
    private final Instant attemptedAt;
    private final long durationMs;

    @JsonCreator
    public DeliveryResult(@JsonProperty("channel") String channel,
            @JsonProperty("success") boolean success,
            @JsonProperty("reason") String reason,
            @JsonProperty("attemptedAt") Instant attemptedAt,
            @JsonProperty("durationMs") long durationMs) {
        this.channel = Objects.requireNonNull(channel, "channel must not be null");
        this.success = success;
        this.reason = reason;
        this.attemptedAt = attemptedAt;
        this.durationMs = durationMs;
    }

    public static DeliveryResult success(String channel) {
        return new DeliveryResult(channel, true, null, null, 0);
    }

    public static DeliveryResult failure(String channel, String reason) {
        return new DeliveryResult(channel, false, reason, null, 0);
    }

    /**
     * @return a copy stamped with the attempt time and duration measured by the
     *         dispatcher
     */
    public DeliveryResult timed(Instant attemptedAt, long durationMs) {
        return new DeliveryResult(channel, success, reason, attemptedAt, durationMs);
    }

    public String getChannel() {
        return channel;
    }

    public boolean isSuccess() {
        return success;
    }

    public String getReason() {
        return reason;
    }

    public Instant getAttemptedAt() {
        return attemptedAt;
    }

    public long getDurationMs() {
        return durationMs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DeliveryResult that))
            return false;
        return success == that.success
                && durationMs == that.durationMs
                && channel.equals(that.channel)
                && Objects.equals(reason, that.reason)
                && Objects.equals(attemptedAt, that.attemptedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(channel, success, reason, attemptedAt, durationMs);
    }

    @Override
    public String toString() {
        return "DeliveryResult{" + channel + (success ? " OK" : " FAILED: " + reason) + '}';
    }
}
