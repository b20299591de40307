package com.sentchat.socket.drain;

import com.sentchat.socket.coordinator.BroadcastCoordinator;
import com.sentchat.socket.session.ClientConnection;
import com.sentchat.socket.session.ConnectionFactory;
import com.sentchat.socket.support.TestFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DrainServiceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private BroadcastCoordinator coordinator;
    private DrainService drainService;
    private ConnectionFactory connectionFactory;

    @BeforeEach
    void setUp() {
        coordinator = new BroadcastCoordinator(1024, TestFixtures.metrics());
        drainService = new DrainService(coordinator, Duration.ofMillis(200), Duration.ofMillis(50));
        connectionFactory = new ConnectionFactory(TestFixtures.config());
    }

    @AfterEach
    void tearDown() {
        drainService.stop();
        coordinator.shutdown();
    }

    private ClientConnection connect(String userId) {
        ClientConnection connection = connectionFactory.createConnection(TestFixtures.identity(userId));
        coordinator.register(connection).block(TIMEOUT);
        return connection;
    }

    private void awaitDrainComplete() throws InterruptedException {
        long deadline = System.nanoTime() + TIMEOUT.toNanos();
        while (!drainService.isDrainComplete() && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
    }

    @Test
    @DisplayName("Should complete at once when there is nothing to drain")
    void testEmptyDrain() {
        drainService.startDrain().block(TIMEOUT);

        assertTrue(drainService.isDraining());
        assertTrue(drainService.isDrainComplete());
        assertEquals(0, drainService.getRemainingConnections());
    }

    @Test
    @DisplayName("Should close every connection within the drain window")
    void testDrainClosesConnections() throws InterruptedException {
        // Given
        List<ClientConnection> connections = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            connections.add(connect("user" + i));
        }

        // When
        drainService.startDrain().block(TIMEOUT);
        assertTrue(drainService.isDraining());
        awaitDrainComplete();

        // Then
        assertTrue(drainService.isDrainComplete());
        assertEquals(0, drainService.getRemainingConnections());
        assertTrue(connections.stream().allMatch(ClientConnection::isClosed));
    }

    @Test
    @DisplayName("A second drain request is ignored while the first one runs")
    void testDrainIsStartedOnce() throws InterruptedException {
        ClientConnection alice = connect("alice");

        drainService.startDrain().block(TIMEOUT);
        drainService.startDrain().block(TIMEOUT);
        awaitDrainComplete();

        assertTrue(drainService.isDraining());
        assertTrue(drainService.isDrainComplete());
        assertTrue(alice.isClosed());
    }
}
