package com.example.chatrelay.handler;

import com.example.chatrelay.codec.EventCodec;
import com.example.chatrelay.service.Ack;
import com.example.chatrelay.service.ConnectionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Live WebSocket sessions by connection id (the session id) plus room scopes
 * (room code → connection ids) used for broadcasts.
 */
@Component
public class WebSocketConnectionRegistry implements ConnectionRegistry {

    private static final Logger log = LoggerFactory.getLogger(WebSocketConnectionRegistry.class);

    static final int SEND_TIME_LIMIT_MS = 10_000;
    static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final EventCodec codec;

    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> scopes = new ConcurrentHashMap<>();

    public WebSocketConnectionRegistry(EventCodec codec) {
        this.codec = codec;
    }

    // --- sessions ---

    /** Registers the session; sends go through a decorator so concurrent writers never interleave. */
    public void register(WebSocketSession session) {
        sessions.put(session.getId(),
                new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT));
    }

    public void unregister(String connectionId) {
        sessions.remove(connectionId);
        for (String roomCode : scopes.keySet()) {
            leaveScope(connectionId, roomCode);
        }
    }

    public boolean isRegistered(String connectionId) {
        return sessions.containsKey(connectionId);
    }

    // --- scopes ---

    @Override
    public void joinScope(String connectionId, String roomCode) {
        // add inside compute so a concurrent leaveScope cannot drop the set between create and add
        scopes.compute(roomCode, (k, ids) -> {
            if (ids == null) ids = new CopyOnWriteArraySet<>();
            ids.add(connectionId);
            return ids;
        });
    }

    @Override
    public void leaveScope(String connectionId, String roomCode) {
        scopes.computeIfPresent(roomCode, (k, ids) -> {
            ids.remove(connectionId);
            return ids.isEmpty() ? null : ids;
        });
    }

    public Set<String> scope(String roomCode) {
        return scopes.getOrDefault(roomCode, Set.of());
    }

    // --- delivery ---

    @Override
    public void broadcast(String roomCode, String event, Object payload) {
        Set<String> ids = scope(roomCode);
        if (ids.isEmpty()) return;

        String json;
        try {
            json = codec.encode(event, payload);
        } catch (IOException e) {
            log.error("Encoding {} for room={} failed", event, roomCode, e);
            return;
        }
        for (String id : ids) {
            sendRaw(id, json);
        }
    }

    public void sendAck(String connectionId, long ackId, Ack ack) {
        try {
            sendRaw(connectionId, codec.encodeAck(ackId, ack));
        } catch (IOException e) {
            log.error("Encoding ack {} for cid={} failed", ackId, connectionId, e);
        }
    }

    private void sendRaw(String connectionId, String json) {
        WebSocketSession session = sessions.get(connectionId);
        if (session == null) {
            log.debug("Send skipped: cid={} no longer registered", connectionId);
            return;
        }
        try {
            if (session.isOpen()) {
                session.sendMessage(new TextMessage(json));
            } else {
                log.debug("Send skipped: cid={} is closed", connectionId);
            }
        } catch (IOException | RuntimeException e) {
            // the close callback does the room cleanup; just stop writing to it
            log.warn("Send to cid={} failed: {}", connectionId, e.toString());
            sessions.remove(connectionId);
        }
    }
}
