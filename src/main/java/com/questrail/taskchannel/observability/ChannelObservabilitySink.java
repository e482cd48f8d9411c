package com.questrail.taskchannel.observability;

/**
 * Main interface for receiving channel observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Called while the channel holds its monitor. Implementations must be fast and
 * must not throw.</p>
 */
public interface ChannelObservabilitySink {
    /**
     * Called when the connection state changes.
     */
    void onStateTransition(ChannelStateTransitionEvent event);

    /**
     * Called when the transport opens, closes, or is closed by the channel.
     */
    void onTransportEvent(ChannelTransportEvent event);

    /**
     * Called when a reconnection attempt is scheduled.
     */
    void onReconnectScheduled(ChannelReconnectEvent event);

    /**
     * Called when an error or anomaly occurs, recovered or not.
     */
    void onError(ChannelErrorEvent event);
}
