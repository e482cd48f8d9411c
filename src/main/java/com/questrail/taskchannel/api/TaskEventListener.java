package com.questrail.taskchannel.api;

import com.questrail.taskchannel.model.InboundFrame;

/**
 * Callback for inbound frames routed by task id or by frame type.
 *
 * <p>Each invocation is isolated: an exception thrown here is logged and reported as
 * {@link ChannelErrorKind#CALLBACK_ERROR}; it never reaches other listeners or the transport.</p>
 */
@FunctionalInterface
public interface TaskEventListener
{
    void onFrame(InboundFrame frame);
}
