package com.example.chatrelay.model;

import java.time.Instant;
import java.util.*;

/**
 * Room model: users keyed by username and the bounded message log.
 * Not thread-safe; ChatService serialises all access.
 */
public class Room {

    // ---------------------------------------------------------------------
    // Core identity
    // ---------------------------------------------------------------------

    private final String code;
    private final Instant createdAt;

    /** Users by username (insertion order preserved to keep a stable roster order). */
    private final Map<String, UserEntry> users = new LinkedHashMap<>();

    /** Oldest first. */
    private final Deque<ChatMessage> messages = new ArrayDeque<>();

    // ---------------------------------------------------------------------
    // Construction
    // ---------------------------------------------------------------------

    public Room(String code) {
        this(code, Instant.now());
    }

    public Room(String code, Instant createdAt) {
        if (code == null || code.isBlank()) throw new IllegalArgumentException("room code must not be blank");
        this.code = code;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    // ---------------------------------------------------------------------
    // Basic accessors
    // ---------------------------------------------------------------------

    public String getCode() {
        return code;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    // ---------------------------------------------------------------------
    // Users API (used by MembershipManager)
    // ---------------------------------------------------------------------

    public UserEntry getUser(String username) {
        if (username == null) return null;
        return users.get(username);
    }

    public boolean hasUser(String username) {
        return getUser(username) != null;
    }

    /** Existing entry for the name, or a new (still empty) one registered under it. */
    public UserEntry getOrAddUser(String username) {
        return users.computeIfAbsent(username, UserEntry::new);
    }

    public void removeUser(String username) {
        if (username == null) return;
        users.remove(username);
    }

    /** Returns a snapshot list of users, preserving insertion order. */
    public List<UserEntry> getUsers() {
        return new ArrayList<>(users.values());
    }

    public int getUserCount() {
        return users.size();
    }

    public boolean isEmpty() {
        return users.isEmpty();
    }

    // ---------------------------------------------------------------------
    // Messages (used by MessageBuffer)
    // ---------------------------------------------------------------------

    /** Appends and evicts from the head until at most {@code limit} messages remain. */
    public void appendMessage(ChatMessage message, int limit) {
        messages.addLast(Objects.requireNonNull(message, "message"));
        while (messages.size() > limit) {
            messages.removeFirst();
        }
    }

    /** Snapshot, oldest first. */
    public List<ChatMessage> getMessages() {
        return new ArrayList<>(messages);
    }

    @Override
    public String toString() {
        return "Room{code='" + code + "', users=" + users.keySet() + ", messages=" + messages.size() + '}';
    }
}
