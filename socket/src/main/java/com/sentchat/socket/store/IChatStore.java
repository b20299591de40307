package com.sentchat.socket.store;

import com.sentchat.core.auth.Identity;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Persistence boundary for chat messages, read receipts and threads.
 * <p>
 * Enables testing with stub implementations and swapping in a database-backed store.
 * </p>
 */
public interface IChatStore {
    /**
     * Persists a message and assigns its id and timestamps.
     */
    Mono<StoredMessage> createMessage(String roomId, Identity sender, String content);

    /**
     * Lists a room's messages, newest first.
     */
    Flux<StoredMessage> listMessages(String roomId, int limit, int offset);

    /**
     * Records that a user has read a message. Errors if the message does not exist.
     */
    Mono<Void> markRead(String messageId, String userId);

    /**
     * Creates a thread (a new room) with the creator as its first member.
     *
     * @return Id of the new room
     */
    Mono<String> createThread(String title, String creatorId);
}
