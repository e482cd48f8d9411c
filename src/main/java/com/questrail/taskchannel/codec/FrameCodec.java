package com.questrail.taskchannel.codec;

import com.questrail.taskchannel.model.InboundFrame;
import com.questrail.taskchannel.model.OutboundFrame;

/**
 * Text codec between wire payloads and frame records.
 *
 * <p>Implementations are stateless and never touch the transport. Invalid inbound
 * payloads are reported with {@link FrameDecodeException}; the caller decides whether to
 * drop them.</p>
 */
public interface FrameCodec
{
    /**
     * @throws FrameDecodeException if the payload is not a well-formed frame
     */
    InboundFrame decode(String payload);

    /**
     * @throws IllegalArgumentException if the frame data cannot be represented on the wire
     */
    String encode(OutboundFrame frame);
}
