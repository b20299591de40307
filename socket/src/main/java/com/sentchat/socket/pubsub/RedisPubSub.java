package com.sentchat.socket.pubsub;

import com.sentchat.socket.config.SocketConfig;
import io.lettuce.core.RedisClient;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import io.lettuce.core.pubsub.StatefulRedisPubSubConnection;
import io.lettuce.core.pubsub.api.reactive.ChannelMessage;
import io.lettuce.core.pubsub.api.reactive.RedisPubSubReactiveCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;


/**
 * Redis pub/sub through Lettuce's reactive API.
 * <p>
 * One pub/sub connection per node carries every channel subscription; channels are
 * reference-counted so that SUBSCRIBE is issued for the first listener of a channel and
 * UNSUBSCRIBE after the last one goes away, in the order the count changed. Publishing uses a separate regular
 * connection, since a connection in subscriber mode cannot publish.
 * </p>
 */
public class RedisPubSub implements IPubSub {
    private static final Logger log = LoggerFactory.getLogger(RedisPubSub.class);

    private final RedisClient client;
    private final StatefulRedisConnection<String, String> connection;
    private final StatefulRedisPubSubConnection<String, String> pubSubConnection;
    private final RedisReactiveCommands<String, String> commands;
    private final RedisPubSubReactiveCommands<String, String> pubSubCommands;
    private final Flux<ChannelMessage<String, String>> messages;
    private final ChannelListeners listeners = new ChannelListeners();

    public RedisPubSub(SocketConfig config) {
        this.client = RedisClient.create(config.getRedisUrl());
        this.connection = client.connect();
        this.pubSubConnection = client.connectPubSub();
        this.commands = connection.reactive();
        this.pubSubCommands = pubSubConnection.reactive();
        this.messages = pubSubCommands.observeChannels().share();
        log.info("Connected to Redis pub/sub: {}", config.getRedisUrl());
    }

    @Override
    public Mono<Long> publish(String channel, String payload) {
        return commands.publish(channel, payload)
            .doOnError(err -> log.error("Failed to publish to channel {}", channel, err));
    }

    @Override
    public Flux<String> subscribe(String channel) {
        // Observe first so nothing published right after SUBSCRIBE is missed
        return messages
            .filter(msg -> channel.equals(msg.getChannel()))
            .map(ChannelMessage::getMessage)
            .doOnSubscribe(s -> listeners.acquire(channel, () -> dispatch(pubSubCommands.subscribe(channel),
                "Subscribed to", channel)))
            .doFinally(signal -> listeners.release(channel, () -> dispatch(pubSubCommands.unsubscribe(channel),
                "Unsubscribed from", channel)));
    }

    @Override
    public void close() {
        pubSubConnection.close();
        connection.close();
        client.shutdown();
        log.info("Redis pub/sub closed");
    }

    /**
     * Sends a (UN)SUBSCRIBE right away. Lettuce writes a command when it is subscribed to,
     * so calling this inside the listener count update keeps per-channel command order.
     */
    private void dispatch(Mono<Void> command, String action, String channel) {
        command.subscribe(
            null,
            err -> log.warn("Failed: {} channel {}", action, channel, err),
            () -> log.debug("{} channel {}", action, channel)
        );
    }
}
