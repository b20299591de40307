package com.sentchat.socket.relay;

import reactor.core.publisher.Mono;

/**
 * Relay used when rooms are not shared across nodes.
 */
public class NoopRoomRelay implements IRoomRelay {

    @Override
    public Mono<Void> publish(String roomId, String payload) {
        return Mono.empty();
    }

    @Override
    public Mono<Void> start() {
        return Mono.empty();
    }

    @Override
    public Mono<Void> stop() {
        return Mono.empty();
    }
}
