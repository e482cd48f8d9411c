package com.questrail.taskchannel.api;

import java.time.Instant;
import java.util.Objects;

/**
 * Last transport-level failure observed by a channel.
 *
 * @param kind      failure classification
 * @param message   human-readable description
 * @param timestamp wall-clock time of the failure (observational only)
 */
public record ChannelError(ChannelErrorKind kind, String message, Instant timestamp)
{
    public ChannelError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    /**
     * True when the channel has stopped retrying and needs an explicit {@code connect()}.
     */
    public boolean isPersistent() {
        return kind == ChannelErrorKind.RECONNECT_EXHAUSTED;
    }
}
