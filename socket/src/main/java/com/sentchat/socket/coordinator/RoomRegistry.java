package com.sentchat.socket.coordinator;

import com.sentchat.socket.session.ClientConnection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Room id to member connections, plus the set of live connections.
 * <p>
 * Not thread-safe: confined to the coordinator loop. A room exists only while it has
 * at least one member; it is created on first subscription and removed as soon as the
 * last member leaves.
 * </p>
 */
public class RoomRegistry {

    private final Map<String, Set<ClientConnection>> rooms = new HashMap<>();
    private final Set<ClientConnection> connections = new LinkedHashSet<>();

    public boolean register(ClientConnection connection) {
        return connections.add(connection);
    }

    public boolean isRegistered(ClientConnection connection) {
        return connections.contains(connection);
    }

    /**
     * Removes a connection from every room and from the live set.
     * <p>
     * The connection keeps its own joined-room record.
     * </p>
     *
     * @return Rooms the connection was removed from
     */
    public List<String> deregister(ClientConnection connection) {
        List<String> left = new ArrayList<>();
        for (String roomId : new ArrayList<>(connection.getJoinedRooms())) {
            if (removeMember(roomId, connection)) {
                left.add(roomId);
            }
        }
        connections.remove(connection);
        return left;
    }

    public boolean subscribe(ClientConnection connection, String roomId) {
        boolean added = rooms.computeIfAbsent(roomId, id -> new LinkedHashSet<>()).add(connection);
        connection.joinRoom(roomId);
        return added;
    }

    public boolean unsubscribe(ClientConnection connection, String roomId) {
        boolean removed = removeMember(roomId, connection);
        connection.leaveRoom(roomId);
        return removed;
    }

    /**
     * Members of a room in subscription order, empty when the room does not exist.
     */
    public Set<ClientConnection> members(String roomId) {
        Set<ClientConnection> members = rooms.get(roomId);
        return members == null ? Collections.emptySet() : Collections.unmodifiableSet(members);
    }

    public boolean hasRoom(String roomId) {
        return rooms.containsKey(roomId);
    }

    public Set<ClientConnection> connections() {
        return Collections.unmodifiableSet(connections);
    }

    public int roomCount() {
        return rooms.size();
    }

    public int connectionCount() {
        return connections.size();
    }

    private boolean removeMember(String roomId, ClientConnection connection) {
        Set<ClientConnection> members = rooms.get(roomId);
        if (members == null) {
            return false;
        }
        boolean removed = members.remove(connection);
        if (members.isEmpty()) {
            rooms.remove(roomId);
        }
        return removed;
    }
}
