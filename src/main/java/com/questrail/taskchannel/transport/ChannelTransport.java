package com.questrail.taskchannel.transport;

import java.net.URI;

/**
 * ChannelTransport
 * -----------------------------------------------------------------------------
 * Minimal port for a persistent, duplex, message-oriented connection (WebSocket-style).
 *
 * <p>Implementations may be backed by Netty, the JDK HTTP client, or a test harness.</p>
 */
public interface ChannelTransport
{
    /**
     * Begin opening a connection. Must not block on network I/O.
     *
     * <p>The returned handle may be closed before the connection is established, which
     * abandons the attempt. The listener is told about the outcome exactly once through
     * {@link ChannelTransportListener#onOpen(TransportConnection)} or
     * {@link ChannelTransportListener#onClose(int, String, Throwable)}, and a connection
     * that opened is later reported closed at most once.</p>
     *
     * @param uri      full connection URI, credential included
     * @param listener receiver for this connection's events only
     * @return handle for the connection being opened
     */
    TransportConnection open(URI uri, ChannelTransportListener listener);
}
