package com.sentchat.core.msg;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Type-tagged payload published to {@link Channels#userNotify(String)}.
 * <p>
 * <b>Durability:</b> none. A payload reaches only the connections of the recipient that
 * are attached to the channel at publish time; nothing is replayed after a reconnect.
 * Unread state is reconciled from the persistent store, not from this channel.
 * </p>
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class NotificationPayload {
    NotificationType type;

    /**
     * User the event originates from (requester, inviter, sender).
     */
    String userId;
    String userName;
    String roomId;
    String messageId;

    Map<String, Object> data;
}
