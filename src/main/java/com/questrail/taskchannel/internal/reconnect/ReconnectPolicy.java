package com.questrail.taskchannel.internal.reconnect;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * ReconnectPolicy
 * -----------------------------------------------------------------------------
 * Exponential backoff configuration for reconnecting after an unexpected loss.
 *
 * <pre>
 *   nextDelay(n) = min(baseDelay * backoffMultiplier^(n-1), maxDelay)     n >= 1
 * </pre>
 *
 * <p>Attempt 1 is the first retry after a loss. The policy is stateless: the attempt
 * counter lives in {@link ReconnectAttemptTracker} and is reset by the channel on every
 * successful open.</p>
 *
 * @param baseDelay         delay before the first retry
 * @param backoffMultiplier growth factor per attempt; at least 1
 * @param maxDelay          optional cap; {@code null} for uncapped
 * @param maxAttempts       retries allowed before giving up
 */
public record ReconnectPolicy(
        Duration baseDelay,
        double backoffMultiplier,
        Duration maxDelay,
        int maxAttempts
) {
    public ReconnectPolicy {
        Objects.requireNonNull(baseDelay, "baseDelay");

        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be non-negative");
        }
        if (Double.isNaN(backoffMultiplier) || Double.isInfinite(backoffMultiplier) || backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be a finite value >= 1");
        }
        if (maxDelay != null && maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        }
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be >= 0");
        }
    }

    /**
     * Defaults: 1 s base delay, doubling, capped at 30 s, five attempts.
     */
    public static ReconnectPolicy defaults() {
        return new ReconnectPolicy(Duration.ofSeconds(1), 2.0, Duration.ofSeconds(30), 5);
    }

    public Optional<Duration> maxDelayCap() {
        return Optional.ofNullable(maxDelay);
    }

    /**
     * Delay to wait before the given attempt.
     *
     * @param attempt attempt number, starting at 1
     */
    public Duration nextDelay(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }

        long capNanos = maxDelay != null ? maxDelay.toNanos() : Long.MAX_VALUE;
        double nanos = baseDelay.toNanos() * Math.pow(backoffMultiplier, attempt - 1);

        if (Double.isInfinite(nanos) || nanos >= capNanos) {
            return Duration.ofNanos(capNanos);
        }
        return Duration.ofNanos(Math.round(nanos));
    }

    /**
     * True once {@code attempt} is past the configured limit.
     */
    public boolean isExhausted(int attempt) {
        return attempt > maxAttempts;
    }
}
