package com.questrail.taskchannel.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A decoded server-to-client frame. Immutable once parsed.
 *
 * @param type      raw wire type; never blank
 * @param taskId    task the frame refers to, or {@code null}
 * @param data      structured payload; empty when the frame has none
 * @param timestamp epoch milliseconds as sent by the server, or 0 when absent
 */
public record InboundFrame(String type, String taskId, Map<String, Object> data, long timestamp)
{
    public InboundFrame {
        Objects.requireNonNull(type, "type");
        if (type.isBlank()) {
            throw new IllegalArgumentException("type must not be blank");
        }
        // JSON nulls are legal values, so Map.copyOf is not an option here.
        data = data == null || data.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public Optional<FrameType> knownType() {
        return FrameType.fromWireName(type);
    }

    public boolean isType(FrameType frameType) {
        return frameType.wireName().equals(type);
    }

    public boolean hasTaskId() {
        return taskId != null && !taskId.isEmpty();
    }

    public Optional<Object> dataValue(String key) {
        return Optional.ofNullable(data.get(key));
    }
}
