package com.sentchat.socket.store;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A persisted chat message with the sender's display attributes.
 */
@Value
@Builder(toBuilder = true)
public class StoredMessage {
    String id;
    String roomId;
    String userId;
    String userName;
    String userAvatar;
    String content;
    Instant createdAt;
    Instant updatedAt;
}
