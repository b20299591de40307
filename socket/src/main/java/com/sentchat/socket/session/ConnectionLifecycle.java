package com.sentchat.socket.session;

import com.sentchat.core.auth.Identity;
import com.sentchat.socket.coordinator.IBroadcastCoordinator;
import com.sentchat.socket.metrics.MetricsService;
import com.sentchat.socket.notify.NotificationBridge;
import com.sentchat.socket.protocol.ProtocolHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Opens and tears down client connections.
 * <p>
 * Teardown is the single exit path for every way a connection ends (client close, read
 * error, idle timeout, failed ping, full delivery queue, drain) and runs at most once per
 * connection.
 * </p>
 */
public class ConnectionLifecycle {
    private static final Logger log = LoggerFactory.getLogger(ConnectionLifecycle.class);

    private final ConnectionFactory connectionFactory;
    private final IBroadcastCoordinator coordinator;
    private final NotificationBridge notificationBridge;
    private final ProtocolHandler protocolHandler;
    private final MetricsService metricsService;

    public ConnectionLifecycle(ConnectionFactory connectionFactory, IBroadcastCoordinator coordinator,
                               NotificationBridge notificationBridge, ProtocolHandler protocolHandler,
                               MetricsService metricsService) {
        this.connectionFactory = connectionFactory;
        this.coordinator = coordinator;
        this.notificationBridge = notificationBridge;
        this.protocolHandler = protocolHandler;
        this.metricsService = metricsService;
    }

    /**
     * Creates a connection for a verified identity, registers it with the coordinator and
     * starts its notification listener.
     */
    public Mono<ClientConnection> open(Identity identity) {
        ClientConnection connection = connectionFactory.createConnection(identity);
        return coordinator.register(connection)
            .then(Mono.fromCallable(() -> {
                notificationBridge.attach(connection);
                metricsService.recordConnectionOpened();
                log.info("Connection {} opened for user {} (active: {})",
                    connection.getConnectionId(), identity.getUserId(), coordinator.connectionCount());
                return connection;
            }));
    }

    /**
     * Announces departure from every joined room (excluding the leaver), deregisters, and
     * closes the connection, which also stops its notification listener. Repeated calls
     * are no-ops.
     */
    public Mono<Void> teardown(ClientConnection connection) {
        return Mono.defer(() -> {
            if (!connection.markTornDown()) {
                return Mono.empty();
            }
            List<String> rooms = new ArrayList<>(connection.getJoinedRooms());
            log.debug("Tearing down {} (rooms: {})", connection, rooms);

            return Flux.fromIterable(rooms)
                .concatMap(roomId -> protocolHandler.announceLeave(connection, roomId)
                    .onErrorResume(err -> {
                        log.warn("Failed to announce leave of {} in room {}", connection, roomId, err);
                        return Mono.empty();
                    }))
                .then(coordinator.deregister(connection))
                .onErrorResume(err -> {
                    log.error("Failed to deregister {}", connection, err);
                    return Mono.empty();
                })
                .doFinally(signal -> {
                    connection.close();
                    metricsService.recordConnectionClosed();
                    log.info("Connection {} closed for user {} (active: {})",
                        connection.getConnectionId(), connection.getUserId(), coordinator.connectionCount());
                });
        });
    }
}
