package com.questrail.taskchannel.codec.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.taskchannel.codec.FrameCodec;
import com.questrail.taskchannel.codec.FrameDecodeException;
import com.questrail.taskchannel.model.InboundFrame;
import com.questrail.taskchannel.model.OutboundFrame;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Objects;

/**
 * JSON {@link FrameCodec} backed by Jackson.
 *
 * <h2>Wire shape</h2>
 * <pre>
 *   { "type": "task_update", "taskId": "T1", "data": { "progress": 40 }, "timestamp": 1700000000000 }
 * </pre>
 *
 * <p>{@code taskId} and {@code data} are omitted on encode when absent. On decode a
 * numeric {@code taskId} is accepted and rendered as text, and an ISO-8601
 * {@code timestamp} is accepted alongside epoch milliseconds.</p>
 */
public final class JacksonFrameCodec implements FrameCodec {

    private static final TypeReference<Map<String, Object>> DATA_TYPE = new TypeReference<>() { };

    private final ObjectMapper mapper;

    public JacksonFrameCodec() {
        this(new ObjectMapper());
    }

    public JacksonFrameCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public InboundFrame decode(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new FrameDecodeException("Empty frame payload");
        }

        final JsonNode root;
        try {
            root = mapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new FrameDecodeException("Malformed JSON frame", e);
        }

        if (root == null || !root.isObject()) {
            throw new FrameDecodeException("Frame is not a JSON object");
        }

        JsonNode typeNode = root.get("type");
        if (typeNode == null || !typeNode.isTextual() || typeNode.asText().isBlank()) {
            throw new FrameDecodeException("Frame has no type");
        }

        return new InboundFrame(
                typeNode.asText(),
                readTaskId(root.get("taskId")),
                readData(root.get("data")),
                readTimestamp(root.get("timestamp"))
        );
    }

    @Override
    public String encode(OutboundFrame frame) {
        Objects.requireNonNull(frame, "frame");

        ObjectNode node = mapper.createObjectNode();
        node.put("type", frame.type());
        if (frame.taskId() != null) {
            node.put("taskId", frame.taskId());
        }
        if (!frame.data().isEmpty()) {
            // valueToTree throws IllegalArgumentException for unserializable values.
            node.set("data", mapper.valueToTree(frame.data()));
        }
        node.put("timestamp", frame.timestamp());

        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize frame of type " + frame.type(), e);
        }
    }

    private static String readTaskId(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual() || node.isNumber()) {
            String text = node.asText();
            return text.isEmpty() ? null : text;
        }
        throw new FrameDecodeException("taskId must be a string or number");
    }

    private Map<String, Object> readData(JsonNode node) {
        if (node == null || node.isNull()) {
            return Map.of();
        }
        if (!node.isObject()) {
            throw new FrameDecodeException("data must be a JSON object");
        }
        return mapper.convertValue(node, DATA_TYPE);
    }

    private static long readTimestamp(JsonNode node) {
        if (node == null || node.isNull()) {
            return 0L;
        }
        if (node.isNumber()) {
            return node.asLong();
        }
        if (node.isTextual()) {
            try {
                return Instant.parse(node.asText()).toEpochMilli();
            } catch (DateTimeParseException e) {
                return 0L;
            }
        }
        return 0L;
    }
}
