package com.sentchat.core.msg;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Universal server-to-client envelope.
 * <p>
 * A flat JSON object discriminated by {@link #type}; only the fields relevant to the
 * type are populated, null fields are omitted on the wire. Field names are snake_case
 * ({@code room_id}, {@code message_id}, ...).
 * </p>
 * <p>
 * <b>Ordering guarantee:</b> envelopes broadcast to one room reach every member in the
 * order the broadcasts were accepted by the coordinator. Nothing is guaranteed across
 * rooms or relative to notifications.
 * </p>
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Envelope {
    EnvelopeType type;

    /**
     * Outcome flag for replies ({@code message_sent}, {@code thread_created}, {@code error}).
     */
    Boolean success;

    /**
     * Human-readable reason, set on error replies.
     */
    String message;

    /**
     * Inbound frame kind an error reply answers (e.g. "message", "subscribe").
     */
    String request;

    /**
     * Persisted message id, set on chat messages.
     */
    String id;

    String roomId;
    String threadId;
    String messageId;

    String userId;
    String userName;
    String userAvatar;

    String content;
    SystemAction action;
    List<String> messageIds;

    Instant createdAt;
    Instant updatedAt;
    Instant timestamp;

    /**
     * Marks messages replayed from history on subscribe.
     */
    Boolean history;

    /**
     * Type-specific extras (user_name on system frames, is_typing on typing frames, title on thread_created).
     */
    Map<String, Object> data;
}
