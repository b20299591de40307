package com.sentchat.socket.notify;

import com.sentchat.core.msg.Channels;
import com.sentchat.core.msg.NotificationPayload;
import com.sentchat.core.util.JsonUtils;
import com.sentchat.socket.pubsub.IPubSub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Producer side of user notifications, for services that raise friend requests,
 * invites and unread-message events.
 */
public class NotificationPublisher {
    private static final Logger log = LoggerFactory.getLogger(NotificationPublisher.class);

    private final IPubSub pubSub;

    public NotificationPublisher(IPubSub pubSub) {
        this.pubSub = pubSub;
    }

    /**
     * @return Number of listeners reached; 0 when the user has no live connection anywhere
     */
    public Mono<Long> publish(String userId, NotificationPayload payload) {
        return Mono.fromCallable(() -> JsonUtils.writeValueAsString(payload))
            .flatMap(json -> pubSub.publish(Channels.userNotify(userId), json))
            .doOnNext(receivers -> log.debug("Notification {} for user {} reached {} listeners",
                payload.getType(), userId, receivers));
    }
}
