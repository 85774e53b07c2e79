package com.example.chatrelay.service;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Side-table connectionId → (roomCode, username). A back-reference only: it lets leave/disconnect
 * find the room and user of a connection without scanning every room.
 */
@Component
public class ConnectionAssociations {

    public record Association(String roomCode, String username) {
        public Association {
            Objects.requireNonNull(roomCode, "roomCode");
            Objects.requireNonNull(username, "username");
        }

        public boolean matches(String roomCode, String username) {
            return this.roomCode.equals(roomCode) && this.username.equals(username);
        }
    }

    private final Map<String, Association> byConnection = new ConcurrentHashMap<>();

    /** Replaces any previous association of the connection. */
    public void associate(String connectionId, String roomCode, String username) {
        byConnection.put(connectionId, new Association(roomCode, username));
    }

    public Optional<Association> get(String connectionId) {
        if (connectionId == null) return Optional.empty();
        return Optional.ofNullable(byConnection.get(connectionId));
    }

    public boolean matches(String connectionId, String roomCode, String username) {
        return get(connectionId).map(a -> a.matches(roomCode, username)).orElse(false);
    }

    public Optional<Association> clear(String connectionId) {
        if (connectionId == null) return Optional.empty();
        return Optional.ofNullable(byConnection.remove(connectionId));
    }
}
