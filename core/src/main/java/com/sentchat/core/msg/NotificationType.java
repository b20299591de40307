package com.sentchat.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of out-of-band notifications published on a user's notification channel.
 * <p>
 * The bridge never interprets the kind; it exists for producers and clients.
 * </p>
 */
public enum NotificationType {
    FRIEND_REQUEST("friend_request"),
    FRIEND_ACCEPTED("friend_accepted"),
    FRIEND_DECLINED("friend_declined"),
    CHAT_INVITE("chat_invite"),
    MESSAGE("message"),
    MESSAGE_SEEN("message_seen"),
    ROOM_ADDED("room_added");

    private final String wireName;

    NotificationType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static NotificationType fromWire(String value) {
        for (NotificationType type : values()) {
            if (type.wireName.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown notification type: " + value);
    }
}
