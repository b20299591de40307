package com.sentchat.socket.session;

import com.sentchat.core.auth.Identity;
import com.sentchat.socket.util.SinkEmissions;
import lombok.Getter;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One live client connection.
 * <p>
 * Owns a bounded outbound delivery queue of serialized frames, drained by the WebSocket
 * write side. Enqueueing never blocks: a full queue is reported to the caller, whose
 * policy is to close the connection (a consumer that cannot drain is treated as dead).
 * </p>
 * <p>
 * The joined-room set is written only by the broadcast coordinator and kept after
 * deregistration, so that teardown can announce departures from every room the
 * connection was in.
 * </p>
 */
public class ClientConnection {
    @Getter
    private final String connectionId;
    @Getter
    private final Identity identity;

    private final Sinks.Many<String> outbound;
    private final Sinks.Empty<Void> closeSignal = Sinks.empty();
    private final Set<String> joinedRooms = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean tornDown = new AtomicBoolean(false);

    public ClientConnection(String connectionId, Identity identity, Sinks.Many<String> outbound) {
        this.connectionId = connectionId;
        this.identity = identity;
        this.outbound = outbound;
    }

    public String getUserId() {
        return identity.getUserId();
    }

    /**
     * Places a frame on the delivery queue without blocking.
     *
     * @param frame Serialized frame
     * @return false if the queue is full, the writer went away, or the connection is closed
     */
    public boolean tryEnqueue(String frame) {
        if (closed.get()) {
            return false;
        }
        return SinkEmissions.tryEmitNext(outbound, frame).isSuccess();
    }

    /**
     * Frames to write to the transport; completes when the connection is closed.
     * Single subscriber only.
     */
    public Flux<String> outboundFrames() {
        return outbound.asFlux();
    }

    /**
     * Completes the delivery queue and fires the close signal.
     *
     * @return true for the call that actually closed the connection, false for repeats
     */
    public boolean close() {
        if (!closed.compareAndSet(false, true)) {
            return false;
        }
        SinkEmissions.tryEmitComplete(outbound);
        closeSignal.tryEmitEmpty();
        return true;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Completes once the connection is closed, whoever closed it.
     */
    public Mono<Void> onClose() {
        return closeSignal.asMono();
    }

    /**
     * Claims the single teardown run for this connection.
     *
     * @return true only for the first caller
     */
    public boolean markTornDown() {
        return tornDown.compareAndSet(false, true);
    }

    public boolean isMember(String roomId) {
        return roomId != null && joinedRooms.contains(roomId);
    }

    public Set<String> getJoinedRooms() {
        return Collections.unmodifiableSet(joinedRooms);
    }

    /**
     * Records a subscription. Called by the coordinator only.
     */
    public void joinRoom(String roomId) {
        joinedRooms.add(roomId);
    }

    /**
     * Drops a subscription. Called by the coordinator only.
     */
    public void leaveRoom(String roomId) {
        joinedRooms.remove(roomId);
    }

    @Override
    public String toString() {
        return "ClientConnection{" + connectionId + ", user=" + identity.getUserId() + "}";
    }
}
