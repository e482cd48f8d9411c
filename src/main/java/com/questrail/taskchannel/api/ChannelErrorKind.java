package com.questrail.taskchannel.api;

/**
 * Classification of the failures a channel can observe.
 *
 * <p>Only {@link #RECONNECT_EXHAUSTED} requires consumer action (an explicit
 * {@code connect()}); every other kind is recovered inside the channel.</p>
 */
public enum ChannelErrorKind
{
    /** The transport could not be established. */
    TRANSPORT_OPEN_FAILURE,

    /** An open transport closed without the channel asking it to. */
    CONNECTION_LOST,

    /** An inbound payload could not be decoded into a frame. */
    PARSE_ERROR,

    /** A subscriber or listener threw while handling a frame. */
    CALLBACK_ERROR,

    /** No heartbeat acknowledgment arrived within the timeout window. */
    HEARTBEAT_TIMEOUT,

    /** The reconnection attempt limit was exceeded. */
    RECONNECT_EXHAUSTED
}
