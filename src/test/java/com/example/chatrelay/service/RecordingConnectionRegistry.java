package com.example.chatrelay.service;

import java.util.*;

/** In-memory transport double: keeps scopes and records what each connection would have received. */
class RecordingConnectionRegistry implements ConnectionRegistry {

    record Delivery(String connectionId, String event, Object payload) { }

    private final Map<String, Set<String>> scopes = new HashMap<>();
    private final List<Delivery> deliveries = new ArrayList<>();

    @Override
    public void joinScope(String connectionId, String roomCode) {
        scopes.computeIfAbsent(roomCode, k -> new LinkedHashSet<>()).add(connectionId);
    }

    @Override
    public void leaveScope(String connectionId, String roomCode) {
        Set<String> ids = scopes.get(roomCode);
        if (ids != null) {
            ids.remove(connectionId);
            if (ids.isEmpty()) scopes.remove(roomCode);
        }
    }

    @Override
    public void broadcast(String roomCode, String event, Object payload) {
        for (String id : scopes.getOrDefault(roomCode, Set.of())) {
            deliveries.add(new Delivery(id, event, payload));
        }
    }

    Set<String> scope(String roomCode) {
        return scopes.getOrDefault(roomCode, Set.of());
    }

    List<Delivery> deliveries() {
        return deliveries;
    }

    /** Payloads of {@code event} delivered to one connection, oldest first. */
    <T> List<T> received(String connectionId, String event, Class<T> type) {
        List<T> out = new ArrayList<>();
        for (Delivery d : deliveries) {
            if (d.connectionId().equals(connectionId) && d.event().equals(event)) {
                out.add(type.cast(d.payload()));
            }
        }
        return out;
    }

    <T> T last(String connectionId, String event, Class<T> type) {
        List<T> all = received(connectionId, event, type);
        return all.isEmpty() ? null : all.get(all.size() - 1);
    }

    void clear() {
        deliveries.clear();
    }
}
