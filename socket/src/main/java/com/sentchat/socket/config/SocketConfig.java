package com.sentchat.socket.config;

import lombok.Builder;
import lombok.Value;

/**
 * Configuration for a socket node, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class SocketConfig {

    String nodeId;
    int httpPort;
    String redisUrl;
    /**
     * Pub/sub substrate: {@code redis} for multi-node deployments, {@code local} for a single process.
     */
    String pubSubMode;
    String kafkaBootstrap;
    boolean roomRelayEnabled;
    /**
     * Capacity of each connection's outbound delivery queue; overflow disconnects the client.
     */
    int perConnBufferSize;
    int coordinatorQueueSize;
    /**
     * Seconds of write inactivity before a ping is sent.
     */
    int pingInterval;
    /**
     * Seconds without any inbound frame (pongs included) before the connection is closed.
     */
    int idleTimeout;
    int maxFrameBytes;
    int historyLimit;
    long historyFrameDelayMs;
    String identitySecret;

    public static SocketConfig fromEnv() {
        return SocketConfig.builder()
                .nodeId(getEnv("NODE_ID", "socket-node-1"))
                .httpPort(Integer.parseInt(getEnv("HTTP_PORT", "8080")))
                .redisUrl(getEnv("REDIS_URL", "redis://localhost:6379"))
                .pubSubMode(getEnv("PUBSUB_MODE", "local"))
                .kafkaBootstrap(getEnv("KAFKA_BOOTSTRAP", "localhost:9092"))
                .roomRelayEnabled(Boolean.parseBoolean(getEnv("ROOM_RELAY_ENABLED", "false")))
                .perConnBufferSize(Integer.parseInt(getEnv("PER_CONN_BUFFER_SIZE", "256")))
                .coordinatorQueueSize(Integer.parseInt(getEnv("COORDINATOR_QUEUE_SIZE", "8192")))
                .pingInterval(Integer.parseInt(getEnv("PING_INTERVAL", "54")))
                .idleTimeout(Integer.parseInt(getEnv("IDLE_TIMEOUT", "60")))
                .maxFrameBytes(Integer.parseInt(getEnv("MAX_FRAME_BYTES", "4096")))
                .historyLimit(Integer.parseInt(getEnv("HISTORY_LIMIT", "50")))
                .historyFrameDelayMs(Long.parseLong(getEnv("HISTORY_FRAME_DELAY_MS", "5")))
                .identitySecret(getEnv("IDENTITY_SECRET", "change-me-in-production"))
                .build();
    }

    public boolean isRedisPubSub() {
        return "redis".equalsIgnoreCase(pubSubMode);
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
