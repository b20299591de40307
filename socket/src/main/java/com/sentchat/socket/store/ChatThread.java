package com.sentchat.socket.store;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Set;

@Value
@Builder
public class ChatThread {
    String roomId;
    String title;
    String creatorId;
    Set<String> memberIds;
    Instant createdAt;
}
