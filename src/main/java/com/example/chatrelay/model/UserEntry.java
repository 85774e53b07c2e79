package com.example.chatrelay.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/** One logical user in a room and the connections currently representing it. */
public class UserEntry {

    private final String username;
    private final Set<String> connectionIds = new LinkedHashSet<>(); // insertion order, first = display id

    public UserEntry(String username) {
        this.username = Objects.requireNonNull(username, "username");
    }

    public String getUsername() { return username; }

    /** Returns false if the connection was already attached. */
    public boolean addConnection(String connectionId) {
        return connectionIds.add(connectionId);
    }

    public boolean removeConnection(String connectionId) {
        return connectionIds.remove(connectionId);
    }

    public boolean hasConnection(String connectionId) {
        return connectionId != null && connectionIds.contains(connectionId);
    }

    public boolean hasConnections() { return !connectionIds.isEmpty(); }

    /** First connection still attached, or null when none is left. */
    public String getDisplayId() {
        return connectionIds.isEmpty() ? null : connectionIds.iterator().next();
    }

    public Set<String> getConnectionIds() {
        return Collections.unmodifiableSet(connectionIds);
    }

    @Override
    public String toString() {
        return "UserEntry{" +
                "username='" + username + '\'' +
                ", connectionIds=" + connectionIds +
                '}';
    }
}
