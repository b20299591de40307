package com.sentchat.socket.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;
import reactor.util.concurrent.Queues;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SinkEmissionsTest {

    @Test
    @DisplayName("Concurrent emitters all get through instead of failing as non-serialized")
    void testConcurrentEmitters() throws InterruptedException {
        // Given
        Sinks.Many<Integer> sink = Sinks.many().unicast().onBackpressureBuffer();
        AtomicInteger received = new AtomicInteger();
        sink.asFlux().subscribe(value -> received.incrementAndGet());
        int threads = 4;
        int perThread = 1_000;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger failures = new AtomicInteger();

        // When
        for (int t = 0; t < threads; t++) {
            pool.execute(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                for (int i = 0; i < perThread; i++) {
                    if (SinkEmissions.tryEmitNext(sink, i).isFailure()) {
                        failures.incrementAndGet();
                    }
                }
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(30, TimeUnit.SECONDS));

        // Then
        assertEquals(0, failures.get());
        assertEquals(threads * perThread, received.get());
    }

    @Test
    @DisplayName("A full buffer is reported as overflow and leaves the sink usable")
    void testOverflowIsReported() {
        Sinks.Many<String> sink = Sinks.many().unicast().onBackpressureBuffer(Queues.<String>get(8).get());
        for (int i = 0; i < 8; i++) {
            assertTrue(SinkEmissions.tryEmitNext(sink, "f" + i).isSuccess());
        }

        assertEquals(Sinks.EmitResult.FAIL_OVERFLOW, SinkEmissions.tryEmitNext(sink, "late"));
        assertEquals(Sinks.EmitResult.OK, SinkEmissions.tryEmitComplete(sink));

        StepVerifier.create(sink.asFlux())
            .expectNextCount(8)
            .verifyComplete();
    }
}
