package com.questrail.taskchannel.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A client-to-server frame awaiting serialization.
 *
 * @param type      wire type
 * @param taskId    task id for subscription frames, otherwise {@code null}
 * @param data      payload; omitted from the wire when empty
 * @param timestamp epoch milliseconds
 */
public record OutboundFrame(String type, String taskId, Map<String, Object> data, long timestamp)
{
    public OutboundFrame {
        Objects.requireNonNull(type, "type");
        if (type.isBlank()) {
            throw new IllegalArgumentException("type must not be blank");
        }
        data = data == null || data.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static OutboundFrame heartbeat(long timestamp) {
        return new OutboundFrame(FrameType.HEARTBEAT.wireName(), null, Map.of(), timestamp);
    }

    public static OutboundFrame subscribe(String taskId, long timestamp) {
        return new OutboundFrame(FrameType.SUBSCRIBE.wireName(), Objects.requireNonNull(taskId, "taskId"), Map.of(), timestamp);
    }

    public static OutboundFrame unsubscribe(String taskId, long timestamp) {
        return new OutboundFrame(FrameType.UNSUBSCRIBE.wireName(), Objects.requireNonNull(taskId, "taskId"), Map.of(), timestamp);
    }

    public static OutboundFrame of(String type, Map<String, Object> data, long timestamp) {
        return new OutboundFrame(type, null, data, timestamp);
    }

    public boolean isType(FrameType frameType) {
        return frameType.wireName().equals(type);
    }

    /**
     * Subscribe and unsubscribe frames describe registry state rather than application data.
     */
    public boolean isSubscriptionControl() {
        return isType(FrameType.SUBSCRIBE) || isType(FrameType.UNSUBSCRIBE);
    }
}
