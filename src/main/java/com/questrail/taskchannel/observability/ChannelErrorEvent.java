package com.questrail.taskchannel.observability;

import com.questrail.taskchannel.api.ChannelErrorKind;

import java.time.Instant;

/**
 * Record representing an error or anomaly observed by the channel.
 */
public record ChannelErrorEvent(
    Instant timestamp,
    ChannelErrorKind kind,
    String message,
    Throwable cause
) {
}
