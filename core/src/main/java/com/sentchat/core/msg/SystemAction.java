package com.sentchat.core.msg;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Action carried by {@link EnvelopeType#SYSTEM} envelopes.
 */
public enum SystemAction {
    JOINED("joined"),
    LEFT("left");

    private final String wireName;

    SystemAction(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
