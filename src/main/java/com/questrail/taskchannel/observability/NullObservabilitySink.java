package com.questrail.taskchannel.observability;

/**
 * No-op implementation of ChannelObservabilitySink.
 */
public final class NullObservabilitySink implements ChannelObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(ChannelStateTransitionEvent event) {}

    @Override
    public void onTransportEvent(ChannelTransportEvent event) {}

    @Override
    public void onReconnectScheduled(ChannelReconnectEvent event) {}

    @Override
    public void onError(ChannelErrorEvent event) {}
}
