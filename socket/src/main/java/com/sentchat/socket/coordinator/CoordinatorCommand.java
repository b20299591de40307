package com.sentchat.socket.coordinator;

import com.sentchat.socket.session.ClientConnection;
import lombok.Value;
import reactor.core.publisher.Sinks;

/**
 * A request to the coordinator loop, consumed exactly once.
 */
@Value
class CoordinatorCommand {

    enum Kind {
        REGISTER,
        DEREGISTER,
        SUBSCRIBE,
        UNSUBSCRIBE,
        BROADCAST,
        MEMBERS,
        CLOSE
    }

    Kind kind;
    ClientConnection connection;
    String roomId;
    String payload;
    /**
     * Upper bound of connections affected, used by CLOSE.
     */
    int limit;
    Sinks.One<Object> reply;

    static CoordinatorCommand of(Kind kind, ClientConnection connection, String roomId, String payload, int limit) {
        return new CoordinatorCommand(kind, connection, roomId, payload, limit, Sinks.one());
    }
}
