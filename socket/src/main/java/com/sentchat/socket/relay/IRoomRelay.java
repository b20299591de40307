package com.sentchat.socket.relay;

import reactor.core.publisher.Mono;

/**
 * Cross-node fan-out of room broadcasts.
 * <p>
 * A node publishes every room event it broadcasts locally; every other node replays it
 * to its own members of that room.
 * </p>
 */
public interface IRoomRelay {
    /**
     * Publishes a frame already broadcast to local members.
     */
    Mono<Void> publish(String roomId, String payload);

    /**
     * Starts consuming events from other nodes.
     */
    Mono<Void> start();

    Mono<Void> stop();
}
