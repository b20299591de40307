package com.sentchat.socket.coordinator;

import com.sentchat.socket.session.ClientConnection;
import reactor.core.publisher.Mono;

import java.util.Set;

/**
 * Owner of room membership and room fan-out.
 * <p>
 * Every operation is a command applied by one serialized loop; the returned Mono
 * completes after the command was applied. Membership is never mutated any other way.
 * </p>
 */
public interface IBroadcastCoordinator {

    /**
     * Adds a connection to the live set. No room membership yet.
     */
    Mono<Void> register(ClientConnection connection);

    /**
     * Removes a connection from every room (deleting rooms that become empty) and closes
     * its delivery queue. Safe to call any number of times.
     */
    Mono<Void> deregister(ClientConnection connection);

    /**
     * Adds a connection to a room, creating the room if needed.
     *
     * @return true if newly added; false if already a member or no longer registered
     */
    Mono<Boolean> subscribe(ClientConnection connection, String roomId);

    /**
     * Removes a connection from a room, deleting the room if it becomes empty.
     *
     * @return true if the connection was a member
     */
    Mono<Boolean> unsubscribe(ClientConnection connection, String roomId);

    /**
     * Enqueues a frame for every member of a room except {@code exclude}. Members whose
     * queue is full are deregistered on the spot.
     *
     * @param exclude Sender to skip, or null to reach every member
     * @return Number of members the frame was enqueued for
     */
    Mono<Integer> broadcast(String roomId, String payload, ClientConnection exclude);

    /**
     * Snapshot of a room's members, empty if the room does not exist.
     */
    Mono<Set<ClientConnection>> members(String roomId);

    /**
     * Deregisters and closes up to {@code max} live connections, oldest first (node drain).
     *
     * @return Number of connections closed
     */
    Mono<Integer> closeConnections(int max);

    default Mono<Integer> closeAll() {
        return closeConnections(Integer.MAX_VALUE);
    }

    int roomCount();

    int connectionCount();
}
