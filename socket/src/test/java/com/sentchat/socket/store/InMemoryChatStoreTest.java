package com.sentchat.socket.store;

import com.sentchat.core.auth.Identity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryChatStoreTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private InMemoryChatStore store;
    private Identity alice;

    @BeforeEach
    void setUp() {
        store = new InMemoryChatStore(Clock.fixed(NOW, ZoneOffset.UTC));
        alice = Identity.builder().userId("alice").displayName("Alice").avatar("a.png").build();
    }

    // ========== Message Tests ==========

    @Test
    @DisplayName("Should stamp a stored message with the sender's profile and the clock")
    void testCreateMessage() {
        StepVerifier.create(store.createMessage("r1", alice, "hi"))
            .assertNext(message -> {
                assertFalse(message.getId().isEmpty());
                assertEquals("r1", message.getRoomId());
                assertEquals("alice", message.getUserId());
                assertEquals("Alice", message.getUserName());
                assertEquals("a.png", message.getUserAvatar());
                assertEquals("hi", message.getContent());
                assertEquals(NOW, message.getCreatedAt());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("Should list newest first, honouring limit and offset")
    void testListMessages() {
        for (int i = 1; i <= 5; i++) {
            store.createMessage("r1", alice, "m" + i).block();
        }
        store.createMessage("r2", alice, "other").block();

        StepVerifier.create(store.listMessages("r1", 2, 0).map(StoredMessage::getContent))
            .expectNext("m5", "m4")
            .verifyComplete();
        StepVerifier.create(store.listMessages("r1", 10, 3).map(StoredMessage::getContent))
            .expectNext("m2", "m1")
            .verifyComplete();
        StepVerifier.create(store.listMessages("unknown", 10, 0))
            .verifyComplete();
    }

    // ========== Read Receipt Tests ==========

    @Test
    @DisplayName("Should record a read receipt for a known message")
    void testMarkRead() {
        StoredMessage message = store.createMessage("r1", alice, "hi").block();

        StepVerifier.create(store.markRead(message.getId(), "bob"))
            .verifyComplete();

        assertTrue(store.isRead(message.getId(), "bob"));
        assertFalse(store.isRead(message.getId(), "carol"));
    }

    @Test
    @DisplayName("Should fail to mark an unknown message")
    void testMarkReadUnknown() {
        StepVerifier.create(store.markRead("missing", "bob"))
            .expectError(NoSuchElementException.class)
            .verify();
    }

    // ========== Thread Tests ==========

    @Test
    @DisplayName("Should create a thread with the creator as its only member")
    void testCreateThread() {
        String roomId = store.createThread("weekend plans", "alice").block();

        ChatThread thread = store.findThread(roomId).orElseThrow();
        assertEquals("weekend plans", thread.getTitle());
        assertEquals("alice", thread.getCreatorId());
        assertEquals(1, thread.getMemberIds().size());
        assertTrue(thread.getMemberIds().contains("alice"));
        assertEquals(NOW, thread.getCreatedAt());
    }
}
