package com.sentchat.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Discriminator of server-to-client envelopes ({@code type} on the wire).
 */
public enum EnvelopeType {
    /**
     * Chat message broadcast to a room (also used for history replay).
     */
    MESSAGE("message"),
    TYPING("typing"),
    READ("read"),
    /**
     * Membership change in a room, see {@link SystemAction}.
     */
    SYSTEM("system"),
    /**
     * Acknowledgment to the sender of a chat message, carries the generated message id.
     */
    MESSAGE_SENT("message_sent"),
    THREAD_CREATED("thread_created"),
    ERROR("error");

    private final String wireName;

    EnvelopeType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static EnvelopeType fromWire(String value) {
        for (EnvelopeType type : values()) {
            if (type.wireName.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown envelope type: " + value);
    }
}
