package com.sentchat.socket.pubsub;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Fire-and-forget channel messaging shared by all nodes.
 * <p>
 * Delivery is at-most-once and non-durable: a subscriber only sees messages published
 * while its subscription is active.
 * </p>
 */
public interface IPubSub {
    /**
     * Publishes a payload to a channel.
     *
     * @return Number of receivers that got it (as reported by the substrate)
     */
    Mono<Long> publish(String channel, String payload);

    /**
     * Messages published on a channel from now on. Cancelling the returned flux
     * unsubscribes.
     */
    Flux<String> subscribe(String channel);

    /**
     * Releases connections held by the substrate.
     */
    void close();
}
