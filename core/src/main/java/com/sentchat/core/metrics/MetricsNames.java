package com.sentchat.core.metrics;

/**
 * Micrometer metric names used by socket nodes.
 * <p>
 * <b>Naming convention:</b> {@code chat.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: WebSocket connections accepted after identity validation.
     */
    public static final String CONNECTIONS_OPENED_TOTAL = "chat.socket.connections.opened.total";

    /**
     * Counter: Connections torn down, for any reason.
     * <p>
     * Tags: nodeId
     * </p>
     */
    public static final String CONNECTIONS_CLOSED_TOTAL = "chat.socket.connections.closed.total";

    /**
     * Counter: Upgrade requests rejected (missing or invalid token, draining).
     * <p>
     * Tags: nodeId, reason
     * </p>
     */
    public static final String CONNECTIONS_REJECTED_TOTAL = "chat.socket.connections.rejected.total";

    /**
     * Gauge: Connections registered with the coordinator.
     */
    public static final String CONNECTIONS_ACTIVE = "chat.socket.connections.active";

    /**
     * Gauge: Rooms with at least one local member.
     */
    public static final String ROOMS_ACTIVE = "chat.socket.rooms.active";

    /**
     * Counter: Frames placed on member queues by room broadcasts.
     * <p>
     * Tags: nodeId, type (local/relay)
     * </p>
     */
    public static final String BROADCAST_DELIVERIES_TOTAL = "chat.socket.broadcast.deliveries.total";

    /**
     * Counter: Connections evicted because their delivery queue overflowed.
     * <p>
     * Tags: nodeId, reason
     * </p>
     */
    public static final String EVICTIONS_TOTAL = "chat.socket.evictions.total";

    /**
     * Counter: Inbound frames by kind.
     * <p>
     * Tags: nodeId, type
     * </p>
     */
    public static final String FRAMES_INBOUND_TOTAL = "chat.socket.frames.inbound.total";

    /**
     * Counter: Error replies sent to clients.
     * <p>
     * Tags: nodeId, reason (decode/precondition/collaborator)
     * </p>
     */
    public static final String PROTOCOL_ERRORS_TOTAL = "chat.socket.protocol.errors.total";

    /**
     * Counter: Notifications forwarded from a user channel to a connection.
     */
    public static final String NOTIFICATIONS_FORWARDED_TOTAL = "chat.socket.notifications.forwarded.total";

    /**
     * Counter: Network traffic inbound from WebSocket (bytes).
     */
    public static final String NETWORK_INBOUND_WS_BYTES = "chat.socket.network.inbound.ws.bytes";

    /**
     * Counter: Network traffic outbound to WebSocket (bytes).
     */
    public static final String NETWORK_OUTBOUND_WS_BYTES = "chat.socket.network.outbound.ws.bytes";
}
