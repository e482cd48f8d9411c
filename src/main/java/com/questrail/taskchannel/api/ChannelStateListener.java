package com.questrail.taskchannel.api;

/**
 * Receives a {@link ChannelStatus} snapshot after every connection state transition.
 *
 * <p>Invoked serially with the channel's other callbacks. Implementations may call back
 * into the channel.</p>
 */
@FunctionalInterface
public interface ChannelStateListener
{
    void onStatusChanged(ChannelStatus status);
}
