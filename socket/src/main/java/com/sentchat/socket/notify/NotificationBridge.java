package com.sentchat.socket.notify;

import com.sentchat.core.msg.Channels;
import com.sentchat.socket.metrics.MetricsService;
import com.sentchat.socket.pubsub.IPubSub;
import com.sentchat.socket.session.ClientConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;

/**
 * Forwards a user's out-of-band notifications to one of their live connections.
 * <p>
 * Each connection gets its own listener on {@code user:notify:<userId>}, so every
 * simultaneous connection of a user receives every notification. Payloads are
 * forwarded verbatim. Nothing published before {@link #attach} or after the connection
 * closes is delivered.
 * </p>
 */
public class NotificationBridge {
    private static final Logger log = LoggerFactory.getLogger(NotificationBridge.class);

    private final IPubSub pubSub;
    private final MetricsService metricsService;

    public NotificationBridge(IPubSub pubSub, MetricsService metricsService) {
        this.pubSub = pubSub;
        this.metricsService = metricsService;
    }

    /**
     * Starts listening for the connection's user. The listener stops on its own when the
     * connection closes; a full delivery queue closes the connection.
     *
     * @param connection Registered connection
     * @return Handle to stop listening early
     */
    public Disposable attach(ClientConnection connection) {
        String channel = Channels.userNotify(connection.getUserId());
        log.debug("Attaching notification listener on {} for {}", channel, connection);

        return pubSub.subscribe(channel)
            .takeUntilOther(connection.onClose())
            .subscribe(
                payload -> forward(connection, payload),
                err -> log.error("Notification listener for {} failed", connection, err),
                () -> log.debug("Notification listener on {} ended for {}", channel, connection)
            );
    }

    private void forward(ClientConnection connection, String payload) {
        if (connection.tryEnqueue(payload)) {
            metricsService.recordNotificationForwarded();
            return;
        }
        if (connection.close()) {
            log.warn("Closed {}: delivery queue full while forwarding a notification", connection);
        }
    }
}
