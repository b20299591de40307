package com.sentchat.socket.protocol;

import com.sentchat.core.msg.ClientFrame;
import com.sentchat.core.msg.Envelope;
import com.sentchat.core.msg.FrameKind;
import com.sentchat.core.msg.SystemAction;
import com.sentchat.core.util.BytesUtils;
import com.sentchat.socket.config.SocketConfig;
import com.sentchat.socket.coordinator.IBroadcastCoordinator;
import com.sentchat.socket.metrics.MetricsService;
import com.sentchat.socket.relay.IRoomRelay;
import com.sentchat.socket.session.ClientConnection;
import com.sentchat.socket.store.IChatStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Interprets client frames against a connection's state.
 * <p>
 * Each frame is decoded, checked (room id present, sender subscribed where required,
 * non-blank content), ignored outright once the connection is closed, persisted when applicable, and answered with broadcasts and/or a
 * reply. A failed check has no side effect besides the {@code error} reply. The returned
 * Mono completes once the frame is fully applied, which is what lets the caller process
 * one connection's frames strictly in order.
 * </p>
 */
public class ProtocolHandler {
    private static final Logger log = LoggerFactory.getLogger(ProtocolHandler.class);

    private final SocketConfig config;
    private final IBroadcastCoordinator coordinator;
    private final IChatStore store;
    private final IRoomRelay relay;
    private final MetricsService metricsService;
    private final FrameDecoder decoder = new FrameDecoder();

    public ProtocolHandler(SocketConfig config, IBroadcastCoordinator coordinator, IChatStore store,
                           IRoomRelay relay, MetricsService metricsService) {
        this.config = config;
        this.coordinator = coordinator;
        this.store = store;
        this.relay = relay;
        this.metricsService = metricsService;
    }

    /**
     * Applies one raw text frame. Never errors: failures become an {@code error} reply.
     *
     * @param connection Sender
     * @param raw        Frame text
     * @return Mono completing when the frame has been applied
     */
    public Mono<Void> handle(ClientConnection connection, String raw) {
        return Mono.defer(() -> {
                if (connection.isClosed()) {
                    // Evicted or drained: joined rooms are kept for teardown but confer no rights
                    log.debug("Dropping frame from closed {}", connection);
                    return Mono.<Void>empty();
                }
                metricsService.recordNetworkInboundWs(BytesUtils.getBytesLength(raw));
                ClientFrame frame = decoder.decode(raw);
                metricsService.recordFrameInbound(frame.kind().wireName());
                log.debug("Frame {} from {} for room {}", frame.kind(), connection, frame.getRoomId());

                return dispatch(connection, frame)
                    .onErrorMap(err -> !(err instanceof ProtocolException),
                        err -> ProtocolException.collaborator(frame.kind(), frame.getRoomId(), "Request failed", err));
            })
            .onErrorResume(err -> replyError(connection, asProtocolException(err)));
    }

    /**
     * Tells a room that the connection's user is gone. Used by teardown.
     */
    public Mono<Void> announceLeave(ClientConnection connection, String roomId) {
        return broadcast(roomId, Envelopes.system(SystemAction.LEFT, roomId, connection.getIdentity()), connection);
    }

    private Mono<Void> dispatch(ClientConnection connection, ClientFrame frame) {
        FrameKind kind = frame.kind();
        String roomId = frame.getRoomId();

        if (kind != FrameKind.CREATE_THREAD && isBlank(roomId)) {
            throw ProtocolException.precondition(kind, null, "room_id is required");
        }
        if (kind.requiresMembership() && !connection.isMember(roomId)) {
            throw ProtocolException.precondition(kind, roomId, "Not subscribed to room " + roomId);
        }

        switch (kind) {
            case SUBSCRIBE -> {
                return subscribe(connection, roomId);
            }
            case UNSUBSCRIBE -> {
                return unsubscribe(connection, roomId);
            }
            case CREATE_THREAD -> {
                return createThread(connection, (ClientFrame.CreateThread) frame);
            }
            case MESSAGE -> {
                return chat(connection, (ClientFrame.Chat) frame);
            }
            case TYPING -> {
                return typing(connection, (ClientFrame.Typing) frame);
            }
            case READ -> {
                return read(connection, (ClientFrame.Read) frame);
            }
            default -> throw ProtocolException.precondition(kind, roomId, "Unsupported message type");
        }
    }

    private Mono<Void> subscribe(ClientConnection connection, String roomId) {
        return coordinator.subscribe(connection, roomId)
            .flatMap(added -> {
                if (!connection.isMember(roomId)) {
                    // Torn down while the command was queued
                    log.debug("Subscribe of {} to room {} rejected", connection, roomId);
                    return Mono.empty();
                }
                Mono<Void> announce = added
                    ? broadcast(roomId, Envelopes.system(SystemAction.JOINED, roomId, connection.getIdentity()), connection)
                    : Mono.empty();
                return announce.doOnSuccess(v -> replayHistory(connection, roomId));
            });
    }

    private Mono<Void> unsubscribe(ClientConnection connection, String roomId) {
        return coordinator.unsubscribe(connection, roomId)
            .flatMap(removed -> removed
                ? broadcast(roomId, Envelopes.system(SystemAction.LEFT, roomId, connection.getIdentity()), connection)
                : Mono.empty());
    }

    private Mono<Void> createThread(ClientConnection connection, ClientFrame.CreateThread frame) {
        String title = frame.title();
        if (isBlank(title)) {
            throw ProtocolException.precondition(FrameKind.CREATE_THREAD, null, "Thread title is required");
        }
        String trimmed = title.trim();
        return store.createThread(trimmed, connection.getUserId())
            .onErrorMap(err -> ProtocolException.collaborator(FrameKind.CREATE_THREAD, null, "Failed to create thread", err))
            .flatMap(roomId -> {
                log.info("Thread {} created by {}", roomId, connection.getUserId());
                return reply(connection, Envelopes.threadCreated(roomId, trimmed));
            });
    }

    private Mono<Void> chat(ClientConnection connection, ClientFrame.Chat frame) {
        String roomId = frame.getRoomId();
        if (isBlank(frame.getContent())) {
            throw ProtocolException.precondition(FrameKind.MESSAGE, roomId, "Message content is required");
        }
        return store.createMessage(roomId, connection.getIdentity(), frame.getContent())
            .onErrorMap(err -> ProtocolException.collaborator(FrameKind.MESSAGE, roomId, "Failed to save message", err))
            .flatMap(stored -> reply(connection, Envelopes.messageSent(stored))
                .then(broadcast(roomId, Envelopes.chat(stored), connection)));
    }

    private Mono<Void> typing(ClientConnection connection, ClientFrame.Typing frame) {
        boolean isTyping = frame.getData() != null && Boolean.TRUE.equals(frame.getData().getIsTyping());
        return broadcast(frame.getRoomId(), Envelopes.typing(frame.getRoomId(), connection.getIdentity(), isTyping),
            connection);
    }

    private Mono<Void> read(ClientConnection connection, ClientFrame.Read frame) {
        String roomId = frame.getRoomId();
        List<String> messageIds = frame.getData() == null ? null : frame.getData().getMessageIds();
        if (messageIds == null || messageIds.isEmpty()) {
            throw ProtocolException.precondition(FrameKind.READ, roomId, "message_ids is required");
        }

        List<String> marked = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        return Flux.fromIterable(messageIds)
            .concatMap(messageId -> store.markRead(messageId, connection.getUserId())
                .doOnSuccess(v -> marked.add(messageId))
                .onErrorResume(err -> {
                    log.warn("Failed to mark message {} as read for {}: {}",
                        messageId, connection.getUserId(), err.getMessage());
                    failed.add(messageId);
                    return Mono.empty();
                }))
            .then(Mono.defer(() -> {
                Mono<Void> announce = marked.isEmpty()
                    ? Mono.empty()
                    : broadcast(roomId, Envelopes.read(roomId, connection.getIdentity(), marked), connection);
                Mono<Void> failure = failed.isEmpty()
                    ? Mono.empty()
                    : replyError(connection, ProtocolException.collaborator(FrameKind.READ, roomId,
                        "Failed to mark " + failed.size() + " of " + messageIds.size() + " messages as read", null));
                return announce.then(failure);
            }));
    }

    /**
     * Sends the latest stored messages of a room to one subscriber, newest first, paced
     * by the configured delay. Runs detached from the frame pipeline and stops silently
     * at the first frame the connection's queue rejects.
     */
    private void replayHistory(ClientConnection connection, String roomId) {
        Flux<String> frames = store.listMessages(roomId, config.getHistoryLimit(), 0)
            .map(message -> Envelopes.toJson(Envelopes.history(message)));
        if (config.getHistoryFrameDelayMs() > 0) {
            frames = frames.delayElements(Duration.ofMillis(config.getHistoryFrameDelayMs()));
        }
        frames.takeWhile(connection::tryEnqueue)
            .takeUntilOther(connection.onClose())
            .subscribe(
                null,
                err -> log.error("Failed to replay history of room {} to {}", roomId, connection, err)
            );
    }

    private Mono<Void> broadcast(String roomId, Envelope envelope, ClientConnection exclude) {
        String payload = Envelopes.toJson(envelope);
        return coordinator.broadcast(roomId, payload, exclude)
            .doOnNext(delivered -> log.debug("{} in room {} delivered to {} members", envelope.getType(), roomId, delivered))
            .then(relay.publish(roomId, payload)
                .onErrorResume(err -> {
                    log.error("Failed to relay {} for room {}", envelope.getType(), roomId, err);
                    return Mono.empty();
                }));
    }

    private Mono<Void> reply(ClientConnection connection, Envelope envelope) {
        return Mono.fromRunnable(() -> {
            if (!connection.tryEnqueue(Envelopes.toJson(envelope)) && connection.close()) {
                log.warn("Closed {}: delivery queue full on {} reply", connection, envelope.getType());
            }
        });
    }

    private Mono<Void> replyError(ClientConnection connection, ProtocolException error) {
        metricsService.recordProtocolError(error.getCategory().wireName());
        if (error.getCategory() == ProtocolException.Category.COLLABORATOR) {
            log.error("Request {} from {} failed: {}", error.getRequest(), connection, error.getMessage(), error.getCause());
        } else {
            log.warn("Rejected {} from {}: {}", error.getRequest(), connection, error.getMessage());
        }
        return reply(connection, Envelopes.error(error));
    }

    private static ProtocolException asProtocolException(Throwable err) {
        if (err instanceof ProtocolException) {
            return (ProtocolException) err;
        }
        return ProtocolException.collaborator(null, null, "Request failed", err);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
