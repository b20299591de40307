package com.sentchat.socket;

import com.sentchat.socket.config.SocketConfig;
import com.sentchat.socket.coordinator.BroadcastCoordinator;
import com.sentchat.socket.drain.DrainService;
import com.sentchat.socket.http.HttpServer;
import com.sentchat.socket.identity.TokenIdentityService;
import com.sentchat.socket.metrics.MetricsService;
import com.sentchat.socket.metrics.PrometheusMetricsExporter;
import com.sentchat.socket.notify.NotificationBridge;
import com.sentchat.socket.protocol.ProtocolHandler;
import com.sentchat.socket.pubsub.IPubSub;
import com.sentchat.socket.pubsub.LocalPubSub;
import com.sentchat.socket.pubsub.RedisPubSub;
import com.sentchat.socket.relay.IRoomRelay;
import com.sentchat.socket.relay.KafkaRoomRelay;
import com.sentchat.socket.relay.NoopRoomRelay;
import com.sentchat.socket.session.ConnectionFactory;
import com.sentchat.socket.session.ConnectionLifecycle;
import com.sentchat.socket.store.InMemoryChatStore;
import com.sentchat.socket.ws.WebSocketHandler;
import com.sentchat.socket.ws.WebSocketUpgradeHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;

/**
 * Main entry point for a chat socket node.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Serve authenticated WebSockets at /ws (query: token)</li>
 *   <li>Fan room events out to local subscribers through the broadcast coordinator</li>
 *   <li>Forward user notifications from the pub/sub substrate</li>
 *   <li>Optionally relay room events to other nodes over Kafka</li>
 *   <li>Expose /healthz, /readyz, /metrics and /drain endpoints</li>
 * </ul>
 * </p>
 */
public class SocketApp {
    private static final Logger log = LoggerFactory.getLogger(SocketApp.class);

    public static void main(String[] args) {
        SocketConfig config = SocketConfig.fromEnv();
        MDC.put("nodeId", config.getNodeId());

        log.info("Starting socket node: {}", config.getNodeId());
        log.info("  Pub/sub: {}{}", config.getPubSubMode(), config.isRedisPubSub() ? " (" + config.getRedisUrl() + ")" : "");
        log.info("  Room relay: {}", config.isRoomRelayEnabled() ? config.getKafkaBootstrap() : "disabled");

        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config.getNodeId());
        MetricsService metricsService = new MetricsService(metricsExporter.getRegistry(), config);

        BroadcastCoordinator coordinator = new BroadcastCoordinator(config.getCoordinatorQueueSize(), metricsService);
        metricsService.bindCoordinator(coordinator);

        IPubSub pubSub = config.isRedisPubSub() ? new RedisPubSub(config) : new LocalPubSub();
        IRoomRelay relay = config.isRoomRelayEnabled()
            ? new KafkaRoomRelay(config, coordinator, metricsService)
            : new NoopRoomRelay();

        ProtocolHandler protocolHandler = new ProtocolHandler(
            config, coordinator, new InMemoryChatStore(), relay, metricsService
        );
        ConnectionLifecycle lifecycle = new ConnectionLifecycle(
            new ConnectionFactory(config),
            coordinator,
            new NotificationBridge(pubSub, metricsService),
            protocolHandler,
            metricsService
        );
        DrainService drainService = new DrainService(coordinator);

        WebSocketUpgradeHandler upgradeHandler = new WebSocketUpgradeHandler(
            config,
            new WebSocketHandler(config, lifecycle, protocolHandler, metricsService),
            new TokenIdentityService(config.getIdentitySecret()),
            metricsService,
            drainService
        );

        // Start relay consumers (block until initialized)
        relay.start().block(Duration.ofSeconds(30));

        HttpServer httpServer = new HttpServer(config.getHttpPort(), upgradeHandler, metricsExporter, drainService);
        httpServer.start();

        log.info("Socket node {} is ready", config.getNodeId());

        handleShutdown(config, coordinator, relay, httpServer, pubSub, drainService);

        // Keep the application running until shutdown signal
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted");
        }
    }

    private static void handleShutdown(SocketConfig config,
                                       BroadcastCoordinator coordinator,
                                       IRoomRelay relay,
                                       HttpServer httpServer,
                                       IPubSub pubSub,
                                       DrainService drainService) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            MDC.put("nodeId", config.getNodeId());
            log.info("Shutdown signal received, initiating graceful shutdown...");

            drainService.stop();
            relay.stop().block(Duration.ofSeconds(10));

            // Close remaining connections before the server goes away
            Integer closed = coordinator.closeAll().block(Duration.ofSeconds(10));
            log.info("Closed {} connections", closed);

            httpServer.stop();
            coordinator.shutdown();
            pubSub.close();

            log.info("Shutdown complete");
        }));
    }
}
