package com.sentchat.core.msg;

/**
 * Pub/sub channel and topic naming shared by producers and socket nodes.
 */
public final class Channels {
    private Channels() {
    }

    /**
     * Prefix of per-user notification channels.
     */
    public static final String USER_NOTIFY_PREFIX = "user:notify:";

    /**
     * Kafka topic carrying room broadcasts between socket nodes, keyed by room id.
     */
    public static final String ROOM_RELAY_TOPIC = "chat.room.relay";

    /**
     * Notification channel of a user: {@code user:notify:{userId}}
     *
     * @param userId Recipient user identifier
     * @return Channel name
     */
    public static String userNotify(String userId) {
        return USER_NOTIFY_PREFIX + userId;
    }
}
