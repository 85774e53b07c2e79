package com.example.chatrelay.service;

/**
 * Transport capability used by {@link ChatService}: room-scoped delivery to live connections.
 * Delivery is fire-and-forget; implementations must not throw on a dead recipient.
 */
public interface ConnectionRegistry {

    /** Adds the connection to the broadcast scope of the room. */
    void joinScope(String connectionId, String roomCode);

    void leaveScope(String connectionId, String roomCode);

    /** Sends {@code event} with {@code payload} to every connection in the room's scope. */
    void broadcast(String roomCode, String event, Object payload);
}
