package com.sentchat.core.msg;

/**
 * Kinds of client-to-server frames, see {@link ClientFrame}.
 */
public enum FrameKind {
    SUBSCRIBE("subscribe"),
    UNSUBSCRIBE("unsubscribe"),
    CREATE_THREAD("create_thread"),
    MESSAGE("message"),
    TYPING("typing"),
    READ("read");

    private final String wireName;

    FrameKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Whether the sender must already be a member of the referenced room.
     */
    public boolean requiresMembership() {
        return this == UNSUBSCRIBE || this == MESSAGE || this == TYPING || this == READ;
    }
}
