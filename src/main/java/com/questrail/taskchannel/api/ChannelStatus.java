package com.questrail.taskchannel.api;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of a channel's observable state.
 *
 * @param state             current lifecycle state
 * @param lastError         last transport-level failure, or {@code null} if none since the last open
 * @param reconnectAttempts consecutive reconnection attempts since the last successful open
 */
public record ChannelStatus(ConnectionState state, ChannelError lastError, int reconnectAttempts)
{
    public ChannelStatus {
        Objects.requireNonNull(state, "state");
        if (reconnectAttempts < 0) {
            throw new IllegalArgumentException("reconnectAttempts must be >= 0");
        }
    }

    public boolean connected() {
        return state == ConnectionState.OPEN;
    }

    public boolean reconnecting() {
        return state == ConnectionState.RECONNECTING;
    }

    public Optional<ChannelError> error() {
        return Optional.ofNullable(lastError);
    }
}
