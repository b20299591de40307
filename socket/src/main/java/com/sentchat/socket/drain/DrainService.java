package com.sentchat.socket.drain;

import com.sentchat.socket.coordinator.IBroadcastCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Gracefully empties a node before it is terminated.
 * <p>
 * Once started, new upgrades are refused and live connections are closed in batches
 * spread over the drain window, so that clients reconnect to other nodes gradually
 * instead of all at once. Each closed connection goes through normal teardown, so its
 * rooms still see it leave.
 * </p>
 */
public class DrainService {
    private static final Logger log = LoggerFactory.getLogger(DrainService.class);

    private static final Duration DEFAULT_DRAIN_WINDOW = Duration.ofMinutes(5);
    private static final Duration DEFAULT_BATCH_INTERVAL = Duration.ofSeconds(2);

    private final IBroadcastCoordinator coordinator;
    private final Duration drainWindow;
    private final Duration batchInterval;
    private final AtomicBoolean isDraining = new AtomicBoolean(false);
    private final AtomicBoolean isDrainComplete = new AtomicBoolean(false);

    private Disposable drainTask;

    public DrainService(IBroadcastCoordinator coordinator) {
        this(coordinator, DEFAULT_DRAIN_WINDOW, DEFAULT_BATCH_INTERVAL);
    }

    public DrainService(IBroadcastCoordinator coordinator, Duration drainWindow, Duration batchInterval) {
        this.coordinator = coordinator;
        this.drainWindow = drainWindow;
        this.batchInterval = batchInterval;
    }

    /**
     * Starts the draining process. Called from the {@code /drain} endpoint (preStop hook).
     *
     * @return Mono completing when the drain has been scheduled
     */
    public Mono<Void> startDrain() {
        if (!isDraining.compareAndSet(false, true)) {
            log.warn("Drain already in progress");
            return Mono.empty();
        }

        int totalConnections = coordinator.connectionCount();
        log.warn("Drain mode activated: closing {} connections over {}", totalConnections, drainWindow);

        if (totalConnections == 0) {
            isDrainComplete.set(true);
            return Mono.empty();
        }

        long totalBatches = Math.max(1, drainWindow.toMillis() / batchInterval.toMillis());
        int connectionsPerBatch = (int) Math.max(1, totalConnections / totalBatches);
        log.info("Drain plan: {} batches, ~{} connections per batch, batch every {}",
            totalBatches, connectionsPerBatch, batchInterval);

        drainTask = Flux.interval(batchInterval)
            .take(totalBatches)
            .concatMap(tick -> coordinator.closeConnections(connectionsPerBatch))
            .takeUntil(closed -> coordinator.connectionCount() == 0)
            .then(Mono.defer(coordinator::closeAll))
            .subscribe(
                rest -> {
                    isDrainComplete.set(true);
                    log.info("Drain complete ({} closed in final sweep)", rest);
                },
                err -> log.error("Drain failed", err)
            );

        return Mono.empty();
    }

    public boolean isDraining() {
        return isDraining.get();
    }

    public boolean isDrainComplete() {
        return isDrainComplete.get();
    }

    public int getRemainingConnections() {
        return coordinator.connectionCount();
    }

    public void stop() {
        if (drainTask != null) {
            drainTask.dispose();
        }
        log.info("Drain service stopped");
    }
}
