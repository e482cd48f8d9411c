package com.questrail.taskchannel.observability;

import java.time.Instant;

/**
 * Record representing a transport lifecycle event.
 *
 * @param closeCode WebSocket close code for CLOSED and FORCED_CLOSE, otherwise 0
 */
public record ChannelTransportEvent(
    Instant timestamp,
    Kind kind,
    int closeCode,
    String detail
) {
    public enum Kind {
        /** A transport open was started. */
        OPENING,
        /** The transport finished its handshake. */
        OPENED,
        /** The transport closed (orderly or not) without the channel asking. */
        CLOSED,
        /** The channel closed the transport itself (disconnect or heartbeat timeout). */
        FORCED_CLOSE
    }
}
