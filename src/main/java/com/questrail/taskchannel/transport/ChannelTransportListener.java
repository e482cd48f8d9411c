package com.questrail.taskchannel.transport;

/**
 * ChannelTransportListener
 * -----------------------------------------------------------------------------
 * Callback sink for one {@link TransportConnection}.
 *
 * <p>Callbacks for a connection must be delivered serially. Netty-backed
 * implementations deliver them on the channel's event loop.</p>
 */
public interface ChannelTransportListener
{
    /**
     * The connection completed its handshake and can carry frames.
     */
    void onOpen(TransportConnection connection);

    /**
     * A text frame arrived. The payload is delivered exactly as received.
     */
    void onMessage(String payload);

    /**
     * The connection closed, or could not be opened at all.
     *
     * @param code   close code received or {@link TransportConnection#ABNORMAL_CLOSURE}
     * @param reason close reason; may be empty
     * @param cause  failure that caused the close, or {@code null} for orderly closure
     */
    void onClose(int code, String reason, Throwable cause);
}
