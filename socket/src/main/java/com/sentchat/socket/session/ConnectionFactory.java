package com.sentchat.socket.session;

import com.sentchat.core.auth.Identity;
import com.sentchat.socket.config.SocketConfig;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

import java.util.UUID;

/**
 * Factory for {@link ClientConnection} objects.
 * <p>
 * Separated from the lifecycle to isolate delivery queue sizing.
 * </p>
 */
public class ConnectionFactory {
    private final SocketConfig config;

    public ConnectionFactory(SocketConfig config) {
        this.config = config;
    }

    /**
     * Creates a new connection instance.
     * <p>
     * The delivery queue is a bounded single-consumer buffer; its capacity is
     * {@code PER_CONN_BUFFER_SIZE} rounded up to a power of two (minimum 8).
     * </p>
     *
     * @param identity Verified identity of the user
     * @return Connection instance
     */
    public ClientConnection createConnection(Identity identity) {
        Sinks.Many<String> outbound = Sinks.many().unicast().onBackpressureBuffer(
            Queues.<String>get(config.getPerConnBufferSize()).get()
        );

        return new ClientConnection(UUID.randomUUID().toString(), identity, outbound);
    }

}
