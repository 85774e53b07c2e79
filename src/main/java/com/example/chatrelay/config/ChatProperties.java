package com.example.chatrelay.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Binds {@code chat.*}. Missing or non-positive values fall back to the defaults below,
 * so {@link #defaults()} is what a bare context (or a unit test) runs with.
 */
@ConfigurationProperties(prefix = "chat")
public record ChatProperties(int roomCapacity, int historyLimit, RoomCode roomCode, Websocket websocket) {

    public static final int DEFAULT_ROOM_CAPACITY = 4;
    public static final int DEFAULT_HISTORY_LIMIT = 100;

    public ChatProperties {
        if (roomCapacity <= 0) roomCapacity = DEFAULT_ROOM_CAPACITY;
        if (historyLimit <= 0) historyLimit = DEFAULT_HISTORY_LIMIT;
        if (roomCode == null) roomCode = new RoomCode(0, 0);
        if (websocket == null) websocket = new Websocket(null, null);
    }

    public static ChatProperties defaults() {
        return new ChatProperties(0, 0, null, null);
    }

    /** Room code shape and the collision retry cap. */
    public static record RoomCode(int length, int maxAttempts) {
        public RoomCode {
            if (length <= 0) length = 6;
            if (maxAttempts <= 0) maxAttempts = 1000;
        }
    }

    /** Endpoint path and CSV of allowed origins (patterns allowed, "*" opens everything). */
    public static record Websocket(String path, String allowedOrigins) {
        public Websocket {
            if (path == null || path.isBlank()) path = "/chat";
            if (allowedOrigins == null) allowedOrigins = "http://localhost:3000,http://127.0.0.1:3000";
        }
    }
}
