package com.sentchat.socket.metrics;

import com.sentchat.core.metrics.MetricsNames;
import com.sentchat.core.metrics.MetricsTags;
import com.sentchat.socket.config.SocketConfig;
import com.sentchat.socket.coordinator.IBroadcastCoordinator;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;

/**
 * Centralized metrics service for a chat socket node.
 */
public class MetricsService {

    private final MeterRegistry registry;
    private final String nodeId;

    private final Counter connectionsOpened;
    private final Counter connectionsClosed;
    private final Counter deliverLocal;
    private final Counter deliverRelay;
    private final Counter evictionsQueueFull;
    private final Counter notificationsForwarded;

    // Network traffic counters (bytes)
    private final Counter networkInboundWs;
    private final Counter networkOutboundWs;

    private final DistributionSummary messageSizeInbound;

    public MetricsService(MeterRegistry registry, SocketConfig config) {
        this.registry = registry;
        this.nodeId = config.getNodeId();

        new ProcessorMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);

        connectionsOpened = Counter.builder(MetricsNames.CONNECTIONS_OPENED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("WebSocket connections accepted")
            .register(registry);

        connectionsClosed = Counter.builder(MetricsNames.CONNECTIONS_CLOSED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Connections torn down")
            .register(registry);

        deliverLocal = Counter.builder(MetricsNames.BROADCAST_DELIVERIES_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.TYPE, "local")
            .description("Room frames enqueued for local members")
            .register(registry);

        deliverRelay = Counter.builder(MetricsNames.BROADCAST_DELIVERIES_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.TYPE, "relay")
            .description("Room frames received from other nodes")
            .register(registry);

        evictionsQueueFull = Counter.builder(MetricsNames.EVICTIONS_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.REASON, "queue_full")
            .description("Connections evicted due to a full delivery queue")
            .register(registry);

        notificationsForwarded = Counter.builder(MetricsNames.NOTIFICATIONS_FORWARDED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .register(registry);

        networkInboundWs = Counter.builder(MetricsNames.NETWORK_INBOUND_WS_BYTES)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Total bytes received from WebSocket clients")
            .baseUnit("bytes")
            .register(registry);

        networkOutboundWs = Counter.builder(MetricsNames.NETWORK_OUTBOUND_WS_BYTES)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Total bytes sent to WebSocket clients")
            .baseUnit("bytes")
            .register(registry);

        messageSizeInbound = DistributionSummary.builder(MetricsNames.NETWORK_INBOUND_WS_BYTES + ".size")
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Inbound frame size distribution")
            .baseUnit("bytes")
            .register(registry);
    }

    /**
     * Exposes room and connection counts of the coordinator as gauges.
     *
     * @param coordinator coordinator to sample
     */
    public void bindCoordinator(IBroadcastCoordinator coordinator) {
        Gauge.builder(MetricsNames.CONNECTIONS_ACTIVE, coordinator, IBroadcastCoordinator::connectionCount)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Connections registered with the coordinator")
            .register(registry);

        Gauge.builder(MetricsNames.ROOMS_ACTIVE, coordinator, IBroadcastCoordinator::roomCount)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Rooms with at least one local member")
            .register(registry);
    }

    public void recordConnectionOpened() {
        connectionsOpened.increment();
    }

    public void recordConnectionClosed() {
        connectionsClosed.increment();
    }

    /**
     * @param reason e.g. missing_token, invalid_token, draining
     */
    public void recordConnectionRejected(String reason) {
        registry.counter(MetricsNames.CONNECTIONS_REJECTED_TOTAL,
            MetricsTags.NODE_ID, nodeId, MetricsTags.REASON, reason).increment();
    }

    public void recordDeliverLocal(int deliveries) {
        deliverLocal.increment(deliveries);
    }

    public void recordDeliverRelay() {
        deliverRelay.increment();
    }

    public void recordEviction() {
        evictionsQueueFull.increment();
    }

    public void recordNotificationForwarded() {
        notificationsForwarded.increment();
    }

    public void recordFrameInbound(String kind) {
        registry.counter(MetricsNames.FRAMES_INBOUND_TOTAL,
            MetricsTags.NODE_ID, nodeId, MetricsTags.TYPE, kind).increment();
    }

    public void recordProtocolError(String category) {
        registry.counter(MetricsNames.PROTOCOL_ERRORS_TOTAL,
            MetricsTags.NODE_ID, nodeId, MetricsTags.REASON, category).increment();
    }

    /**
     * Records bytes received from WebSocket client.
     *
     * @param bytes number of bytes received
     */
    public void recordNetworkInboundWs(long bytes) {
        networkInboundWs.increment(bytes);
        messageSizeInbound.record(bytes);
    }

    public void recordNetworkOutboundWs(long bytes) {
        networkOutboundWs.increment(bytes);
    }

    public double getDeliveredTotal() {
        return deliverLocal.count() + deliverRelay.count();
    }

    public double getEvictedTotal() {
        return evictionsQueueFull.count();
    }
}
