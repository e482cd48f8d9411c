package com.questrail.taskchannel.codec;

/**
 * Indicates that an inbound payload could not be turned into an
 * {@link com.questrail.taskchannel.model.InboundFrame}.
 *
 * This typically reflects:
 * <ul>
 *   <li>Payload that is not JSON</li>
 *   <li>JSON that is not an object</li>
 *   <li>Missing or blank {@code type}</li>
 *   <li>A {@code data} member that is not an object</li>
 * </ul>
 */
public final class FrameDecodeException extends RuntimeException
{
    public FrameDecodeException(String message) {
        super(message);
    }

    public FrameDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
