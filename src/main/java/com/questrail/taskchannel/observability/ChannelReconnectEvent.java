package com.questrail.taskchannel.observability;

import java.time.Duration;
import java.time.Instant;

/**
 * Record representing a scheduled reconnection attempt.
 */
public record ChannelReconnectEvent(
    Instant timestamp,
    int attempt,
    int maxAttempts,
    Duration delay
) {
}
