package com.questrail.taskchannel.observability;

import com.questrail.taskchannel.api.ConnectionState;

import java.time.Instant;

/**
 * Record representing a connection state transition.
 */
public record ChannelStateTransitionEvent(
    Instant timestamp,
    ConnectionState oldState,
    ConnectionState newState,
    String reason
) {
}
