package com.questrail.taskchannel.transport;

/**
 * One physical connection created by {@link ChannelTransport#open}.
 */
public interface TransportConnection
{
    /** Normal closure, used for consumer-initiated disconnects. */
    int NORMAL_CLOSURE = 1000;

    /** Abnormal closure: no close frame was exchanged (connect failure, dropped socket). */
    int ABNORMAL_CLOSURE = 1006;

    /** Application close code used when the channel gives up on an unresponsive peer. */
    int HEARTBEAT_TIMEOUT = 4000;

    /**
     * Hand a text payload to the transport.
     *
     * @return {@code false} if the connection is not open and the payload was not accepted
     */
    boolean send(String payload);

    /**
     * Close the connection, or abandon it if it is still opening. Idempotent.
     */
    void close(int code, String reason);
}
