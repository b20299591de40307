package com.sentchat.socket.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.sentchat.socket.config.SocketConfig;
import com.sentchat.socket.coordinator.BroadcastCoordinator;
import com.sentchat.socket.metrics.MetricsService;
import com.sentchat.socket.session.ClientConnection;
import com.sentchat.socket.session.ConnectionFactory;
import com.sentchat.socket.support.FrameRecorder;
import com.sentchat.socket.support.RecordingChatStore;
import com.sentchat.socket.support.RecordingRoomRelay;
import com.sentchat.socket.support.TestFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for ProtocolHandler against a real coordinator and a stubbed store.
 */
class ProtocolHandlerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private SocketConfig config;
    private BroadcastCoordinator coordinator;
    private RecordingChatStore store;
    private RecordingRoomRelay relay;
    private ProtocolHandler handler;
    private ConnectionFactory connectionFactory;

    @BeforeEach
    void setUp() {
        config = TestFixtures.config();
        MetricsService metricsService = TestFixtures.metrics();
        coordinator = new BroadcastCoordinator(config.getCoordinatorQueueSize(), metricsService);
        store = new RecordingChatStore();
        relay = new RecordingRoomRelay();
        handler = new ProtocolHandler(config, coordinator, store, relay, metricsService);
        connectionFactory = new ConnectionFactory(config);
    }

    @AfterEach
    void tearDown() {
        coordinator.shutdown();
    }

    private ClientConnection connect(String userId) {
        ClientConnection connection = connectionFactory.createConnection(TestFixtures.identity(userId));
        coordinator.register(connection).block(TIMEOUT);
        return connection;
    }

    private void send(ClientConnection connection, String raw) {
        StepVerifier.create(handler.handle(connection, raw))
            .verifyComplete();
    }

    private static String subscribe(String roomId) {
        return "{\"type\":\"subscribe\",\"room_id\":\"" + roomId + "\"}";
    }

    private static String chat(String roomId, String content) {
        return "{\"type\":\"message\",\"room_id\":\"" + roomId + "\",\"content\":\"" + content + "\"}";
    }

    // ========== Subscribe Tests ==========

    @Test
    @DisplayName("Should announce a new subscriber to the room, but not to the subscriber itself")
    void testSubscribeAnnouncesJoin() {
        // Given
        ClientConnection alice = connect("alice");
        ClientConnection bob = connect("bob");
        FrameRecorder aliceFrames = FrameRecorder.attach(alice);
        FrameRecorder bobFrames = FrameRecorder.attach(bob);
        send(alice, subscribe("r1"));

        // When
        send(bob, subscribe("r1"));

        // Then
        List<JsonNode> joined = aliceFrames.ofType("system");
        assertEquals(1, joined.size());
        assertEquals("joined", joined.get(0).path("action").asText());
        assertEquals("bob", joined.get(0).path("user_id").asText());
        assertEquals("Bob", joined.get(0).path("data").path("user_name").asText());
        assertEquals("r1", joined.get(0).path("room_id").asText());
        assertTrue(bobFrames.ofType("system").isEmpty());
        assertTrue(bob.isMember("r1"));
    }

    @Test
    @DisplayName("Should not announce again when an existing member subscribes twice")
    void testDuplicateSubscribe() {
        ClientConnection alice = connect("alice");
        ClientConnection bob = connect("bob");
        FrameRecorder aliceFrames = FrameRecorder.attach(alice);
        send(alice, subscribe("r1"));

        send(bob, subscribe("r1"));
        send(bob, subscribe("r1"));

        assertEquals(1, aliceFrames.ofType("system").size());
        assertEquals(2, coordinator.members("r1").block(TIMEOUT).size());
    }

    @Test
    @DisplayName("Should replay the latest messages to a new subscriber, newest first and flagged as history")
    void testHistoryReplay() {
        // Given
        ClientConnection alice = connect("alice");
        FrameRecorder.attach(alice);
        send(alice, subscribe("r1"));
        send(alice, chat("r1", "one"));
        send(alice, chat("r1", "two"));
        send(alice, chat("r1", "three"));

        // When
        ClientConnection dave = connect("dave");
        FrameRecorder daveFrames = FrameRecorder.attach(dave);
        send(dave, subscribe("r1"));

        // Then
        List<JsonNode> history = daveFrames.ofType("message");
        List<String> contents = new ArrayList<>();
        history.forEach(frame -> contents.add(frame.path("content").asText()));
        assertEquals(List.of("three", "two", "one"), contents);
        assertTrue(history.stream().allMatch(frame -> frame.path("history").asBoolean()));
        assertEquals("Alice", history.get(0).path("user_name").asText());
    }

    @Test
    @DisplayName("Should stop history replay quietly when the subscriber's queue is full")
    void testHistoryReplayStopsOnFullQueue() {
        // Given
        ClientConnection alice = connect("alice");
        FrameRecorder.attach(alice);
        send(alice, subscribe("r1"));
        for (int i = 0; i < 20; i++) {
            send(alice, chat("r1", "m" + i));
        }

        // When: nobody drains dave's queue
        ClientConnection dave = connect("dave");
        send(dave, subscribe("r1"));

        // Then
        assertFalse(dave.isClosed());
        assertTrue(dave.isMember("r1"));
        dave.close();
        StepVerifier.create(dave.outboundFrames())
            .expectNextCount(TestFixtures.SMALL_BUFFER)
            .verifyComplete();
    }

    @Test
    @DisplayName("Should apply a subscribe before looking at the connection's next frame")
    void testSubscribeThenChatInOneBurst() {
        ClientConnection alice = connect("alice");
        ClientConnection bob = connect("bob");
        FrameRecorder aliceFrames = FrameRecorder.attach(alice);
        FrameRecorder bobFrames = FrameRecorder.attach(bob);
        send(bob, subscribe("r1"));

        Flux.just(subscribe("r1"), chat("r1", "first"))
            .concatMap(raw -> handler.handle(alice, raw))
            .blockLast(TIMEOUT);

        assertTrue(aliceFrames.ofType("error").isEmpty());
        assertEquals(1, bobFrames.ofType("message").size());
    }

    // ========== Chat Tests ==========

    @Test
    @DisplayName("Scenario: chat is acknowledged to the sender and broadcast to the other member")
    void testChatScenario() {
        // Given
        ClientConnection alice = connect("alice");
        ClientConnection bob = connect("bob");
        FrameRecorder aliceFrames = FrameRecorder.attach(alice);
        FrameRecorder bobFrames = FrameRecorder.attach(bob);
        send(alice, subscribe("r1"));
        send(bob, subscribe("r1"));
        aliceFrames.clear();

        // When
        send(alice, chat("r1", "hi"));

        // Then
        JsonNode ack = aliceFrames.last();
        assertEquals("message_sent", ack.path("type").asText());
        assertTrue(ack.path("success").asBoolean());
        assertTrue(aliceFrames.ofType("message").isEmpty(), "sender must not get its own message back");

        List<JsonNode> received = bobFrames.ofType("message");
        assertEquals(1, received.size());
        JsonNode message = received.get(0);
        assertEquals("hi", message.path("content").asText());
        assertEquals("alice", message.path("user_id").asText());
        assertEquals("Alice", message.path("user_name").asText());
        assertEquals(ack.path("message_id").asText(), message.path("id").asText());
        assertFalse(message.path("created_at").asText().isEmpty());

        assertEquals(1, store.createMessageCalls.get());
        assertTrue(relay.publishedRooms.contains("r1"));
    }

    @Test
    @DisplayName("Should reject blank content without persisting")
    void testBlankContent() {
        ClientConnection alice = connect("alice");
        FrameRecorder aliceFrames = FrameRecorder.attach(alice);
        send(alice, subscribe("r1"));

        send(alice, chat("r1", "   "));

        JsonNode error = aliceFrames.last();
        assertEquals("error", error.path("type").asText());
        assertEquals("message", error.path("request").asText());
        assertEquals(0, store.createMessageCalls.get());
    }

    @Test
    @DisplayName("Should answer a store failure with an error and broadcast nothing")
    void testStoreFailure() {
        // Given
        ClientConnection alice = connect("alice");
        ClientConnection bob = connect("bob");
        FrameRecorder aliceFrames = FrameRecorder.attach(alice);
        FrameRecorder bobFrames = FrameRecorder.attach(bob);
        send(alice, subscribe("r1"));
        send(bob, subscribe("r1"));
        store.failWrites();

        // When
        send(alice, chat("r1", "lost"));

        // Then
        JsonNode error = aliceFrames.last();
        assertEquals("error", error.path("type").asText());
        assertEquals("Failed to save message", error.path("message").asText());
        assertTrue(bobFrames.ofType("message").isEmpty());
        assertFalse(alice.isClosed());
    }

    @Test
    @DisplayName("Should still deliver locally when the relay fails")
    void testRelayFailureIsContained() {
        ClientConnection alice = connect("alice");
        ClientConnection bob = connect("bob");
        FrameRecorder aliceFrames = FrameRecorder.attach(alice);
        FrameRecorder bobFrames = FrameRecorder.attach(bob);
        send(alice, subscribe("r1"));
        send(bob, subscribe("r1"));
        relay.fail();

        send(alice, chat("r1", "still here"));

        assertEquals(1, bobFrames.ofType("message").size());
        assertEquals(1, aliceFrames.ofType("message_sent").size());
        assertTrue(aliceFrames.ofType("error").isEmpty());
    }

    // ========== Membership Precondition Tests ==========

    @Test
    @DisplayName("Non-members get an error and cause no persistence and no broadcast")
    void testNonMemberFramesHaveNoSideEffects() {
        // Given
        ClientConnection alice = connect("alice");
        ClientConnection mallory = connect("mallory");
        FrameRecorder aliceFrames = FrameRecorder.attach(alice);
        FrameRecorder malloryFrames = FrameRecorder.attach(mallory);
        send(alice, subscribe("r1"));
        int relayedBefore = relay.publishedRooms.size();

        // When
        send(mallory, chat("r1", "spam"));
        send(mallory, "{\"type\":\"typing\",\"room_id\":\"r1\",\"data\":{\"is_typing\":true}}");
        send(mallory, "{\"type\":\"read\",\"room_id\":\"r1\",\"data\":{\"message_ids\":[\"m1\"]}}");
        send(mallory, "{\"type\":\"unsubscribe\",\"room_id\":\"r1\"}");

        // Then
        List<JsonNode> errors = malloryFrames.ofType("error");
        assertEquals(4, errors.size());
        assertEquals(List.of("message", "typing", "read", "unsubscribe"),
            List.of(errors.get(0).path("request").asText(), errors.get(1).path("request").asText(),
                errors.get(2).path("request").asText(), errors.get(3).path("request").asText()));
        errors.forEach(error -> {
            assertFalse(error.path("success").asBoolean(true));
            assertEquals("r1", error.path("room_id").asText());
        });

        assertEquals(0, store.persistenceCalls());
        assertEquals(0, aliceFrames.size());
        assertEquals(relayedBefore, relay.publishedRooms.size());
        assertFalse(mallory.isClosed());
    }

    @Test
    @DisplayName("An evicted connection can no longer persist or broadcast, even though it keeps its joined rooms")
    void testEvictedSenderIsIgnored() {
        // Given: slow never drains its queue and gets evicted by alice's traffic
        ClientConnection alice = connect("alice");
        ClientConnection bob = connect("bob");
        ClientConnection slow = connect("slow");
        FrameRecorder.attach(alice);
        FrameRecorder bobFrames = FrameRecorder.attach(bob);
        send(slow, subscribe("r1"));
        send(alice, subscribe("r1"));
        send(bob, subscribe("r1"));
        for (int i = 0; i < TestFixtures.SMALL_BUFFER; i++) {
            send(alice, chat("r1", "m" + i));
        }
        assertTrue(slow.isClosed());
        assertTrue(slow.isMember("r1"));
        assertEquals(2, coordinator.members("r1").block(TIMEOUT).size());
        int storedBefore = store.createMessageCalls.get();
        int bobMessagesBefore = bobFrames.ofType("message").size();
        int relayedBefore = relay.publishedRooms.size();

        // When
        send(slow, chat("r1", "ghost"));
        send(slow, "{\"type\":\"typing\",\"room_id\":\"r1\",\"data\":{\"is_typing\":true}}");
        send(slow, subscribe("r2"));

        // Then
        assertEquals(storedBefore, store.createMessageCalls.get());
        assertEquals(bobMessagesBefore, bobFrames.ofType("message").size());
        assertTrue(bobFrames.ofType("typing").isEmpty());
        assertEquals(relayedBefore, relay.publishedRooms.size());
        assertEquals(0, coordinator.members("r2").block(TIMEOUT).size());
    }

    @Test
    @DisplayName("Should require a room id")
    void testMissingRoomId() {
        ClientConnection alice = connect("alice");
        FrameRecorder aliceFrames = FrameRecorder.attach(alice);

        send(alice, "{\"type\":\"subscribe\"}");

        JsonNode error = aliceFrames.last();
        assertEquals("error", error.path("type").asText());
        assertEquals("subscribe", error.path("request").asText());
        assertEquals(0, coordinator.roomCount());
    }

    // ========== Decode Tests ==========

    @Test
    @DisplayName("Should answer malformed or unknown frames with an error and keep the connection open")
    void testMalformedFrames() {
        ClientConnection alice = connect("alice");
        FrameRecorder aliceFrames = FrameRecorder.attach(alice);

        send(alice, "not json at all");
        send(alice, "{\"type\":\"dance\",\"room_id\":\"r1\"}");
        send(alice, "{\"room_id\":\"r1\"}");
        send(alice, "");

        List<JsonNode> errors = aliceFrames.ofType("error");
        assertEquals(4, errors.size());
        errors.forEach(error -> {
            String message = error.path("message").asText();
            assertTrue("Invalid message format".equals(message) || "Empty message".equals(message), message);
            assertTrue(error.path("request").isMissingNode());
        });
        assertFalse(alice.isClosed());
    }

    // ========== Typing, Read and Unsubscribe Tests ==========

    @Test
    @DisplayName("Should broadcast typing to the other members only")
    void testTyping() {
        ClientConnection alice = connect("alice");
        ClientConnection bob = connect("bob");
        FrameRecorder aliceFrames = FrameRecorder.attach(alice);
        FrameRecorder bobFrames = FrameRecorder.attach(bob);
        send(alice, subscribe("r1"));
        send(bob, subscribe("r1"));

        send(bob, "{\"type\":\"typing\",\"room_id\":\"r1\",\"data\":{\"is_typing\":true}}");

        List<JsonNode> typing = aliceFrames.ofType("typing");
        assertEquals(1, typing.size());
        assertEquals("bob", typing.get(0).path("user_id").asText());
        assertTrue(typing.get(0).path("data").path("is_typing").asBoolean());
        assertEquals("Bob", typing.get(0).path("data").path("user_name").asText());
        assertTrue(bobFrames.ofType("typing").isEmpty());
    }

    @Test
    @DisplayName("Should broadcast only the receipts that were stored and report the rest")
    void testPartialReadFailure() {
        // Given
        ClientConnection alice = connect("alice");
        ClientConnection bob = connect("bob");
        FrameRecorder aliceFrames = FrameRecorder.attach(alice);
        FrameRecorder bobFrames = FrameRecorder.attach(bob);
        send(alice, subscribe("r1"));
        send(bob, subscribe("r1"));
        store.failMarkRead("m2");

        // When
        send(bob, "{\"type\":\"read\",\"room_id\":\"r1\",\"data\":{\"message_ids\":[\"m1\",\"m2\",\"m3\"]}}");

        // Then
        List<JsonNode> reads = aliceFrames.ofType("read");
        assertEquals(1, reads.size());
        List<String> ids = new ArrayList<>();
        reads.get(0).path("message_ids").forEach(id -> ids.add(id.asText()));
        assertEquals(List.of("m1", "m3"), ids);

        JsonNode error = bobFrames.last();
        assertEquals("error", error.path("type").asText());
        assertEquals("read", error.path("request").asText());
        assertEquals(3, store.markReadCalls.get());
    }

    @Test
    @DisplayName("Should announce an unsubscribe and drop the membership")
    void testUnsubscribe() {
        ClientConnection alice = connect("alice");
        ClientConnection bob = connect("bob");
        FrameRecorder aliceFrames = FrameRecorder.attach(alice);
        FrameRecorder.attach(bob);
        send(alice, subscribe("r1"));
        send(bob, subscribe("r1"));

        send(bob, "{\"type\":\"unsubscribe\",\"room_id\":\"r1\"}");

        JsonNode left = aliceFrames.last();
        assertEquals("system", left.path("type").asText());
        assertEquals("left", left.path("action").asText());
        assertEquals("bob", left.path("user_id").asText());
        assertFalse(bob.isMember("r1"));

        send(bob, chat("r1", "after leaving"));
        assertTrue(aliceFrames.ofType("message").isEmpty());
    }

    // ========== Thread Tests ==========

    @Test
    @DisplayName("Should create a thread and reply with its id to the requester only")
    void testCreateThread() {
        ClientConnection alice = connect("alice");
        FrameRecorder aliceFrames = FrameRecorder.attach(alice);

        send(alice, "{\"type\":\"create_thread\",\"data\":{\"title\":\" weekend plans \"}}");

        JsonNode created = aliceFrames.last();
        assertEquals("thread_created", created.path("type").asText());
        assertTrue(created.path("success").asBoolean());
        String threadId = created.path("thread_id").asText();
        assertEquals(threadId, created.path("room_id").asText());
        assertEquals("weekend plans", created.path("data").path("title").asText());
        assertEquals("alice", store.delegate().findThread(threadId).orElseThrow().getCreatorId());
    }

    @Test
    @DisplayName("Should reject a thread without a title")
    void testCreateThreadWithoutTitle() {
        ClientConnection alice = connect("alice");
        FrameRecorder aliceFrames = FrameRecorder.attach(alice);

        send(alice, "{\"type\":\"create_thread\",\"data\":{}}");

        JsonNode error = aliceFrames.last();
        assertEquals("error", error.path("type").asText());
        assertEquals("create_thread", error.path("request").asText());
        assertEquals(0, store.createThreadCalls.get());
    }
}
