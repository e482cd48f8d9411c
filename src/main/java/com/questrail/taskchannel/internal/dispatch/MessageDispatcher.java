package com.questrail.taskchannel.internal.dispatch;

import com.questrail.taskchannel.api.ChannelErrorKind;
import com.questrail.taskchannel.api.TaskEventListener;
import com.questrail.taskchannel.codec.FrameCodec;
import com.questrail.taskchannel.codec.FrameDecodeException;
import com.questrail.taskchannel.internal.subscription.SubscriptionRegistry;
import com.questrail.taskchannel.internal.time.WallClock;
import com.questrail.taskchannel.model.FrameType;
import com.questrail.taskchannel.model.InboundFrame;
import com.questrail.taskchannel.observability.ChannelErrorEvent;
import com.questrail.taskchannel.observability.ChannelObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * MessageDispatcher
 * =============================================================================
 * Inbound path of the channel.
 *
 * <pre>
 *   payload text
 *        → FrameCodec.decode
 *            → heartbeat_response → heartbeat ack
 *            → taskId present     → every callback subscribed to that id
 *            → type listeners     → every listener registered for that type
 * </pre>
 *
 * <h2>Failure containment</h2>
 * <ul>
 *   <li>Undecodable payloads are dropped and reported as {@link ChannelErrorKind#PARSE_ERROR}.</li>
 *   <li>Each callback runs in isolation; a throwing callback is reported as
 *       {@link ChannelErrorKind#CALLBACK_ERROR} and delivery continues.</li>
 *   <li>Unrecognized types with nobody listening are ignored.</li>
 *   <li>A callback removed while a frame is being delivered does not receive that frame.</li>
 * </ul>
 * Nothing thrown by a payload or a callback escapes {@link #dispatch(String)}.
 */
public final class MessageDispatcher {
    private static final Logger log = LoggerFactory.getLogger(MessageDispatcher.class);

    private static final int MAX_LOGGED_PAYLOAD = 256;

    private final FrameCodec codec;
    private final SubscriptionRegistry registry;
    private final Runnable heartbeatAck;
    private final ChannelObservabilitySink sink;
    private final WallClock wallClock;

    public MessageDispatcher(FrameCodec codec,
                             SubscriptionRegistry registry,
                             Runnable heartbeatAck,
                             ChannelObservabilitySink sink,
                             WallClock wallClock) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.heartbeatAck = Objects.requireNonNull(heartbeatAck, "heartbeatAck");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    /**
     * Decode and route one payload.
     *
     * @return number of callbacks the frame was delivered to; 0 when dropped
     */
    public int dispatch(String payload) {
        final InboundFrame frame;
        try {
            frame = codec.decode(payload);
        } catch (FrameDecodeException e) {
            sink.onError(new ChannelErrorEvent(
                    wallClock.now(),
                    ChannelErrorKind.PARSE_ERROR,
                    "Failed to parse inbound frame: " + abbreviate(payload),
                    e
            ));
            return 0;
        }
        return dispatch(frame);
    }

    /**
     * Route an already-decoded frame.
     */
    public int dispatch(InboundFrame frame) {
        Objects.requireNonNull(frame, "frame");

        if (frame.isType(FrameType.HEARTBEAT_RESPONSE)) {
            heartbeatAck.run();
        }

        int delivered = 0;
        if (frame.hasTaskId()) {
            for (TaskEventListener callback : registry.listenersFor(frame.taskId())) {
                // An earlier callback may have removed this one, or cleared the registry.
                if (registry.contains(frame.taskId(), callback) && deliver(callback, frame)) {
                    delivered++;
                }
            }
        }
        for (TaskEventListener listener : registry.typeListenersFor(frame.type())) {
            if (registry.containsTypeListener(frame.type(), listener) && deliver(listener, frame)) {
                delivered++;
            }
        }

        if (delivered == 0 && frame.knownType().isEmpty()) {
            log.debug("Ignoring frame with unrecognized type '{}'", frame.type());
        }
        return delivered;
    }

    private boolean deliver(TaskEventListener callback, InboundFrame frame) {
        try {
            callback.onFrame(frame);
            return true;
        } catch (RuntimeException e) {
            sink.onError(new ChannelErrorEvent(
                    wallClock.now(),
                    ChannelErrorKind.CALLBACK_ERROR,
                    "Subscriber failed on " + frame.type() + " for task " + frame.taskId(),
                    e
            ));
            return false;
        }
    }

    private static String abbreviate(String payload) {
        if (payload == null) {
            return "<null>";
        }
        return payload.length() <= MAX_LOGGED_PAYLOAD
                ? payload
                : payload.substring(0, MAX_LOGGED_PAYLOAD) + "...";
    }
}
