package com.questrail.taskchannel.internal.queue;

import com.questrail.taskchannel.model.OutboundFrame;

import java.util.Objects;

/**
 * An outbound frame paired with its serialized payload.
 *
 * <p>Frames are serialized once, when the consumer submits them, so a frame that
 * cannot be encoded is rejected at the call site instead of failing later in a flush.</p>
 */
public record EncodedFrame(OutboundFrame frame, String payload)
{
    public EncodedFrame {
        Objects.requireNonNull(frame, "frame");
        Objects.requireNonNull(payload, "payload");
    }
}
