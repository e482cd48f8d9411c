package com.questrail.taskchannel.model;

import java.util.Optional;

/**
 * Frame types understood by this client.
 *
 * <p>Inbound frames keep their raw wire type (see {@link InboundFrame#type()}) so that
 * types added by newer servers are carried through instead of being rejected.</p>
 */
public enum FrameType
{
    HEARTBEAT("heartbeat", Direction.CLIENT_TO_SERVER),
    HEARTBEAT_RESPONSE("heartbeat_response", Direction.SERVER_TO_CLIENT),
    SUBSCRIBE("subscribe", Direction.CLIENT_TO_SERVER),
    UNSUBSCRIBE("unsubscribe", Direction.CLIENT_TO_SERVER),
    TASK_UPDATE("task_update", Direction.SERVER_TO_CLIENT),
    TASK_COMPLETE("task_complete", Direction.SERVER_TO_CLIENT),
    TASK_ERROR("task_error", Direction.SERVER_TO_CLIENT);

    public enum Direction { CLIENT_TO_SERVER, SERVER_TO_CLIENT }

    private final String wireName;
    private final Direction direction;

    FrameType(String wireName, Direction direction) {
        this.wireName = wireName;
        this.direction = direction;
    }

    public String wireName() {
        return wireName;
    }

    public Direction direction() {
        return direction;
    }

    public static Optional<FrameType> fromWireName(String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        for (FrameType type : values()) {
            if (type.wireName.equals(wireName)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
