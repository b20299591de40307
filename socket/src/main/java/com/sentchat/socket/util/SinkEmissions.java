package com.sentchat.socket.util;

import reactor.core.publisher.SignalType;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Sink emission with Reactor's busy-looping retry on concurrent emitters.
 * <p>
 * Only {@code FAIL_NON_SERIALIZED} is retried, for at most {@link #MAX_BUSY_LOOP}; every
 * other result (overflow, terminated, no subscriber) is returned to the caller unchanged,
 * so a full sink is reported rather than errored.
 * </p>
 */
public final class SinkEmissions {
    private SinkEmissions() {
    }

    public static final Duration MAX_BUSY_LOOP = Duration.ofMillis(100);

    public static <T> Sinks.EmitResult tryEmitNext(Sinks.Many<T> sink, T value) {
        return retryNonSerialized(SignalType.ON_NEXT, () -> sink.tryEmitNext(value));
    }

    public static Sinks.EmitResult tryEmitComplete(Sinks.Many<?> sink) {
        return retryNonSerialized(SignalType.ON_COMPLETE, sink::tryEmitComplete);
    }

    private static Sinks.EmitResult retryNonSerialized(SignalType signal, Supplier<Sinks.EmitResult> attempt) {
        Sinks.EmitResult result = attempt.get();
        if (result != Sinks.EmitResult.FAIL_NON_SERIALIZED) {
            return result;
        }
        // The handler's deadline starts when it is created
        Sinks.EmitFailureHandler retry = Sinks.EmitFailureHandler.busyLooping(MAX_BUSY_LOOP);
        while (result == Sinks.EmitResult.FAIL_NON_SERIALIZED && retry.onEmitFailure(signal, result)) {
            result = attempt.get();
        }
        return result;
    }
}
