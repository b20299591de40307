package com.sentchat.socket.pubsub;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Listener counts per channel.
 * <p>
 * The first-listener and last-listener callbacks run inside the map update for that
 * channel, so for one channel they are strictly ordered and alternate: a release that
 * drops the count to zero finishes its callback before a new acquire can run its own.
 * </p>
 */
final class ChannelListeners {
    private final Map<String, Integer> counts = new ConcurrentHashMap<>();

    /**
     * @param onFirst Run when the channel goes from no listener to one
     */
    void acquire(String channel, Runnable onFirst) {
        counts.compute(channel, (name, count) -> {
            if (count == null) {
                onFirst.run();
                return 1;
            }
            return count + 1;
        });
    }

    /**
     * @param onLast Run when the channel's last listener goes away
     */
    void release(String channel, Runnable onLast) {
        counts.computeIfPresent(channel, (name, count) -> {
            if (count > 1) {
                return count - 1;
            }
            onLast.run();
            return null;
        });
    }

    int count(String channel) {
        return counts.getOrDefault(channel, 0);
    }
}
