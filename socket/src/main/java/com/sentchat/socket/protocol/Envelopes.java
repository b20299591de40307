package com.sentchat.socket.protocol;

import com.google.common.base.Strings;
import com.sentchat.core.auth.Identity;
import com.sentchat.core.msg.Envelope;
import com.sentchat.core.msg.EnvelopeType;
import com.sentchat.core.msg.SystemAction;
import com.sentchat.core.util.JsonUtils;
import com.sentchat.socket.store.StoredMessage;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Builders for every server-to-client envelope.
 */
public final class Envelopes {
    private Envelopes() {
    }

    public static Envelope system(SystemAction action, String roomId, Identity user) {
        return Envelope.builder()
            .type(EnvelopeType.SYSTEM)
            .action(action)
            .roomId(roomId)
            .userId(user.getUserId())
            .timestamp(Instant.now())
            .data(Map.of("user_name", Strings.nullToEmpty(user.getDisplayName())))
            .build();
    }

    public static Envelope chat(StoredMessage message) {
        return Envelope.builder()
            .type(EnvelopeType.MESSAGE)
            .id(message.getId())
            .roomId(message.getRoomId())
            .userId(message.getUserId())
            .userName(message.getUserName())
            .userAvatar(message.getUserAvatar())
            .content(message.getContent())
            .createdAt(message.getCreatedAt())
            .updatedAt(message.getUpdatedAt())
            .build();
    }

    /**
     * A stored message replayed to a subscriber, flagged {@code history: true}.
     */
    public static Envelope history(StoredMessage message) {
        return chat(message).toBuilder()
            .history(true)
            .build();
    }

    public static Envelope typing(String roomId, Identity user, boolean isTyping) {
        return Envelope.builder()
            .type(EnvelopeType.TYPING)
            .roomId(roomId)
            .userId(user.getUserId())
            .timestamp(Instant.now())
            .data(Map.of(
                "user_name", Strings.nullToEmpty(user.getDisplayName()),
                "is_typing", isTyping
            ))
            .build();
    }

    public static Envelope read(String roomId, Identity user, List<String> messageIds) {
        return Envelope.builder()
            .type(EnvelopeType.READ)
            .roomId(roomId)
            .userId(user.getUserId())
            .messageIds(List.copyOf(messageIds))
            .timestamp(Instant.now())
            .build();
    }

    public static Envelope messageSent(StoredMessage message) {
        return Envelope.builder()
            .type(EnvelopeType.MESSAGE_SENT)
            .success(true)
            .messageId(message.getId())
            .roomId(message.getRoomId())
            .createdAt(message.getCreatedAt())
            .build();
    }

    public static Envelope threadCreated(String roomId, String title) {
        return Envelope.builder()
            .type(EnvelopeType.THREAD_CREATED)
            .success(true)
            .threadId(roomId)
            .roomId(roomId)
            .data(Map.of("title", title))
            .build();
    }

    public static Envelope error(ProtocolException error) {
        return Envelope.builder()
            .type(EnvelopeType.ERROR)
            .success(false)
            .message(error.getMessage())
            .request(error.getRequest() == null ? null : error.getRequest().wireName())
            .roomId(error.getRoomId())
            .timestamp(Instant.now())
            .build();
    }

    public static String toJson(Envelope envelope) {
        return JsonUtils.writeValueAsString(envelope);
    }
}
