package com.sentchat.socket.coordinator;

import com.sentchat.socket.metrics.MetricsService;
import com.sentchat.socket.session.ClientConnection;
import com.sentchat.socket.util.SinkEmissions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.concurrent.Queues;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Serialized owner of the room registry.
 * <p>
 * Callers submit commands to a bounded mailbox; a single loop thread applies them one at
 * a time in arrival order, so a broadcast submitted after a subscribe always sees the new
 * member. Replies are published off the loop thread so callers' continuations never run
 * on it.
 * </p>
 * <p>
 * Fan-out never blocks: a member whose delivery queue rejects a frame is deregistered
 * and closed inside the same command, and the remaining members still get the frame.
 * </p>
 */
public class BroadcastCoordinator implements IBroadcastCoordinator {
    private static final Logger log = LoggerFactory.getLogger(BroadcastCoordinator.class);

    private final RoomRegistry registry = new RoomRegistry();
    private final Sinks.Many<CoordinatorCommand> mailbox;
    private final Scheduler loop;
    private final Disposable loopSubscription;
    private final MetricsService metricsService;

    // Sampled by gauges from other threads
    private volatile int roomCount;
    private volatile int connectionCount;

    public BroadcastCoordinator(int mailboxSize, MetricsService metricsService) {
        this.metricsService = metricsService;
        this.mailbox = Sinks.many().unicast().onBackpressureBuffer(
            Queues.<CoordinatorCommand>get(mailboxSize).get()
        );
        this.loop = Schedulers.newSingle("broadcast-coordinator");
        this.loopSubscription = mailbox.asFlux()
            .publishOn(loop)
            .subscribe(this::apply, err -> log.error("Coordinator loop terminated", err));
    }

    @Override
    public Mono<Void> register(ClientConnection connection) {
        return submit(CoordinatorCommand.Kind.REGISTER, connection, null, null, 0).then();
    }

    @Override
    public Mono<Void> deregister(ClientConnection connection) {
        return submit(CoordinatorCommand.Kind.DEREGISTER, connection, null, null, 0).then();
    }

    @Override
    public Mono<Boolean> subscribe(ClientConnection connection, String roomId) {
        return submit(CoordinatorCommand.Kind.SUBSCRIBE, connection, roomId, null, 0).cast(Boolean.class);
    }

    @Override
    public Mono<Boolean> unsubscribe(ClientConnection connection, String roomId) {
        return submit(CoordinatorCommand.Kind.UNSUBSCRIBE, connection, roomId, null, 0).cast(Boolean.class);
    }

    @Override
    public Mono<Integer> broadcast(String roomId, String payload, ClientConnection exclude) {
        return submit(CoordinatorCommand.Kind.BROADCAST, exclude, roomId, payload, 0).cast(Integer.class);
    }

    @Override
    public Mono<Set<ClientConnection>> members(String roomId) {
        return submit(CoordinatorCommand.Kind.MEMBERS, null, roomId, null, 0)
            .flatMapIterable(members -> (Collection<?>) members)
            .cast(ClientConnection.class)
            .collect(Collectors.<ClientConnection, Set<ClientConnection>>toCollection(LinkedHashSet::new));
    }

    @Override
    public Mono<Integer> closeConnections(int max) {
        return submit(CoordinatorCommand.Kind.CLOSE, null, null, null, max).cast(Integer.class);
    }

    @Override
    public int roomCount() {
        return roomCount;
    }

    @Override
    public int connectionCount() {
        return connectionCount;
    }

    /**
     * Stops accepting commands and releases the loop thread.
     */
    public void shutdown() {
        mailbox.tryEmitComplete();
        loopSubscription.dispose();
        loop.dispose();
    }

    private Mono<Object> submit(CoordinatorCommand.Kind kind, ClientConnection connection,
                                String roomId, String payload, int limit) {
        return Mono.defer(() -> {
            CoordinatorCommand command = CoordinatorCommand.of(kind, connection, roomId, payload, limit);
            Sinks.EmitResult result = SinkEmissions.tryEmitNext(mailbox, command);
            if (result.isFailure()) {
                return Mono.error(new IllegalStateException(
                    "Coordinator rejected " + kind + " command: " + result));
            }
            return command.getReply().asMono().publishOn(Schedulers.parallel());
        });
    }

    private void apply(CoordinatorCommand command) {
        Sinks.One<Object> reply = command.getReply();
        Object result;
        try {
            result = execute(command);
        } catch (RuntimeException e) {
            log.error("Coordinator failed to apply {} command", command.getKind(), e);
            refreshCounts();
            reply.tryEmitError(e);
            return;
        }
        // Counts first, so a caller resuming on the reply sees them
        refreshCounts();
        if (result == null) {
            reply.tryEmitEmpty();
        } else {
            reply.tryEmitValue(result);
        }
    }

    private Object execute(CoordinatorCommand command) {
        ClientConnection connection = command.getConnection();
        switch (command.getKind()) {
            case REGISTER:
                registry.register(connection);
                return null;
            case DEREGISTER:
                registry.deregister(connection);
                connection.close();
                return null;
            case SUBSCRIBE:
                return subscribeMember(connection, command.getRoomId());
            case UNSUBSCRIBE:
                return registry.unsubscribe(connection, command.getRoomId());
            case BROADCAST:
                return fanOut(command.getRoomId(), command.getPayload(), connection);
            case MEMBERS:
                return List.copyOf(registry.members(command.getRoomId()));
            case CLOSE:
                return closeBatch(command.getLimit());
            default:
                throw new IllegalArgumentException("Unknown command " + command.getKind());
        }
    }

    private void refreshCounts() {
        roomCount = registry.roomCount();
        connectionCount = registry.connectionCount();
    }

    private boolean subscribeMember(ClientConnection connection, String roomId) {
        if (!registry.isRegistered(connection) || connection.isClosed()) {
            log.debug("Ignoring subscribe of unregistered {} to room {}", connection, roomId);
            return false;
        }
        return registry.subscribe(connection, roomId);
    }

    private int fanOut(String roomId, String payload, ClientConnection exclude) {
        List<ClientConnection> overflowed = new ArrayList<>();
        int delivered = 0;
        for (ClientConnection member : registry.members(roomId)) {
            if (member == exclude) {
                continue;
            }
            if (member.tryEnqueue(payload)) {
                delivered++;
            } else {
                overflowed.add(member);
            }
        }
        for (ClientConnection member : overflowed) {
            evict(member, roomId);
        }
        if (delivered > 0) {
            metricsService.recordDeliverLocal(delivered);
        }
        return delivered;
    }

    private void evict(ClientConnection member, String roomId) {
        registry.deregister(member);
        if (member.close()) {
            metricsService.recordEviction();
            log.warn("Evicted {} from room {}: delivery queue full", member, roomId);
        }
    }

    private int closeBatch(int max) {
        List<ClientConnection> batch = new ArrayList<>();
        for (ClientConnection connection : registry.connections()) {
            if (batch.size() >= max) {
                break;
            }
            batch.add(connection);
        }
        for (ClientConnection connection : batch) {
            registry.deregister(connection);
            connection.close();
        }
        log.info("Closed {} connections ({} remaining)", batch.size(), registry.connectionCount());
        return batch.size();
    }
}
