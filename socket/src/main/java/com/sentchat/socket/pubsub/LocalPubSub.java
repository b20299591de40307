package com.sentchat.socket.pubsub;

import com.sentchat.socket.util.SinkEmissions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process pub/sub for single-node deployments and tests.
 */
public class LocalPubSub implements IPubSub {
    private static final Logger log = LoggerFactory.getLogger(LocalPubSub.class);

    private final Map<String, Channel> channels = new ConcurrentHashMap<>();

    @Override
    public Mono<Long> publish(String channel, String payload) {
        return Mono.fromCallable(() -> {
            Channel target = channels.get(channel);
            if (target == null) {
                return 0L;
            }
            long receivers = target.sink.currentSubscriberCount();
            Sinks.EmitResult result = SinkEmissions.tryEmitNext(target.sink, payload);
            if (result == Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
                return 0L;
            }
            return receivers;
        });
    }

    @Override
    public Flux<String> subscribe(String channel) {
        return Flux.defer(() -> {
            Channel target = channels.compute(channel, (name, existing) -> {
                Channel ch = existing != null ? existing : new Channel();
                ch.refs++;
                return ch;
            });
            return target.sink.asFlux()
                .doFinally(signal -> release(channel, target));
        });
    }

    @Override
    public void close() {
        channels.values().forEach(ch -> ch.sink.tryEmitComplete());
        channels.clear();
        log.info("Local pub/sub closed");
    }

    int channelCount() {
        return channels.size();
    }

    private void release(String channel, Channel target) {
        channels.computeIfPresent(channel, (name, existing) -> {
            if (existing != target) {
                return existing;
            }
            existing.refs--;
            return existing.refs <= 0 ? null : existing;
        });
    }

    // refs is only touched inside ConcurrentHashMap.compute for this key
    private static final class Channel {
        private final Sinks.Many<String> sink = Sinks.many().multicast().directBestEffort();
        private int refs;
    }
}
