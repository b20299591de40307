package com.sentchat.socket.store;

import com.sentchat.core.auth.Identity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local chat store.
 * <p>
 * Messages are kept per room in insertion order; any room id is accepted. Suitable for a
 * single node and for tests; state is lost on restart.
 * </p>
 */
public class InMemoryChatStore implements IChatStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryChatStore.class);

    private final Clock clock;
    private final Map<String, List<StoredMessage>> messagesByRoom = new ConcurrentHashMap<>();
    private final Map<String, StoredMessage> messagesById = new ConcurrentHashMap<>();
    // messageId -> userId -> read time
    private final Map<String, Map<String, Instant>> readReceipts = new ConcurrentHashMap<>();
    private final Map<String, ChatThread> threads = new ConcurrentHashMap<>();

    public InMemoryChatStore() {
        this(Clock.systemUTC());
    }

    public InMemoryChatStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Mono<StoredMessage> createMessage(String roomId, Identity sender, String content) {
        return Mono.fromCallable(() -> {
            Instant now = clock.instant();
            StoredMessage message = StoredMessage.builder()
                .id(UUID.randomUUID().toString())
                .roomId(roomId)
                .userId(sender.getUserId())
                .userName(sender.getDisplayName())
                .userAvatar(sender.getAvatar())
                .content(content)
                .createdAt(now)
                .updatedAt(now)
                .build();

            List<StoredMessage> room = messagesByRoom.computeIfAbsent(roomId,
                id -> Collections.synchronizedList(new ArrayList<>()));
            room.add(message);
            messagesById.put(message.getId(), message);
            log.debug("Stored message {} in room {}", message.getId(), roomId);
            return message;
        });
    }

    @Override
    public Flux<StoredMessage> listMessages(String roomId, int limit, int offset) {
        return Flux.defer(() -> {
            List<StoredMessage> room = messagesByRoom.get(roomId);
            if (room == null || limit <= 0) {
                return Flux.empty();
            }
            List<StoredMessage> page = new ArrayList<>();
            synchronized (room) {
                int from = room.size() - 1 - Math.max(0, offset);
                for (int i = from; i >= 0 && page.size() < limit; i--) {
                    page.add(room.get(i));
                }
            }
            return Flux.fromIterable(page);
        });
    }

    @Override
    public Mono<Void> markRead(String messageId, String userId) {
        return Mono.fromRunnable(() -> {
            if (messageId == null || !messagesById.containsKey(messageId)) {
                throw new NoSuchElementException("Unknown message " + messageId);
            }
            readReceipts.computeIfAbsent(messageId, id -> new ConcurrentHashMap<>())
                .put(userId, clock.instant());
        });
    }

    @Override
    public Mono<String> createThread(String title, String creatorId) {
        return Mono.fromCallable(() -> {
            String roomId = UUID.randomUUID().toString();
            Set<String> members = ConcurrentHashMap.newKeySet();
            members.add(creatorId);
            threads.put(roomId, ChatThread.builder()
                .roomId(roomId)
                .title(title)
                .creatorId(creatorId)
                .memberIds(members)
                .createdAt(clock.instant())
                .build());
            log.debug("Created thread {} '{}' for {}", roomId, title, creatorId);
            return roomId;
        });
    }

    public Optional<ChatThread> findThread(String roomId) {
        return Optional.ofNullable(threads.get(roomId));
    }

    public boolean isRead(String messageId, String userId) {
        Map<String, Instant> receipts = readReceipts.get(messageId);
        return receipts != null && receipts.containsKey(userId);
    }
}
