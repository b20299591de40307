package com.sentchat.socket.support;

import com.sentchat.core.auth.Identity;
import com.sentchat.socket.store.IChatStore;
import com.sentchat.socket.store.InMemoryChatStore;
import com.sentchat.socket.store.StoredMessage;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test stub for the chat store: delegates to the in-memory store, counts calls and can
 * be told to fail.
 */
public class RecordingChatStore implements IChatStore {
    private final InMemoryChatStore delegate = new InMemoryChatStore();

    public final AtomicInteger createMessageCalls = new AtomicInteger();
    public final AtomicInteger markReadCalls = new AtomicInteger();
    public final AtomicInteger createThreadCalls = new AtomicInteger();

    private volatile boolean failWrites;
    private final Set<String> failingReadIds = ConcurrentHashMap.newKeySet();

    public void failWrites() {
        this.failWrites = true;
    }

    public void failMarkRead(String messageId) {
        failingReadIds.add(messageId);
    }

    public int persistenceCalls() {
        return createMessageCalls.get() + markReadCalls.get() + createThreadCalls.get();
    }

    public InMemoryChatStore delegate() {
        return delegate;
    }

    @Override
    public Mono<StoredMessage> createMessage(String roomId, Identity sender, String content) {
        createMessageCalls.incrementAndGet();
        if (failWrites) {
            return Mono.error(new IllegalStateException("database unavailable"));
        }
        return delegate.createMessage(roomId, sender, content);
    }

    @Override
    public Flux<StoredMessage> listMessages(String roomId, int limit, int offset) {
        return delegate.listMessages(roomId, limit, offset);
    }

    @Override
    public Mono<Void> markRead(String messageId, String userId) {
        markReadCalls.incrementAndGet();
        if (failingReadIds.contains(messageId)) {
            return Mono.error(new IllegalStateException("cannot mark " + messageId));
        }
        return Mono.empty();
    }

    @Override
    public Mono<String> createThread(String title, String creatorId) {
        createThreadCalls.incrementAndGet();
        if (failWrites) {
            return Mono.error(new IllegalStateException("database unavailable"));
        }
        return delegate.createThread(title, creatorId);
    }
}
