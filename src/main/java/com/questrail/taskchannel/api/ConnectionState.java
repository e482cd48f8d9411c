package com.questrail.taskchannel.api;

/**
 * Lifecycle state of a {@link TaskChannel}.
 *
 * <pre>
 *   IDLE → CONNECTING → OPEN
 *   OPEN → RECONNECTING → CONNECTING → OPEN      (unexpected loss)
 *   any  → CLOSED                                (disconnect, or retries exhausted)
 * </pre>
 */
public enum ConnectionState
{
    /** Constructed, {@code connect()} not yet called. */
    IDLE,

    /** A transport open is in flight. */
    CONNECTING,

    /** Transport is up; frames are written immediately. */
    OPEN,

    /** Connection was lost; a backoff timer is pending. */
    RECONNECTING,

    /** Terminal until the consumer calls {@code connect()} again. */
    CLOSED
}
