package com.example.chatrelay.codec;

import com.example.chatrelay.model.RosterEntry;

import java.util.List;

public record RoomUpdatePayload(List<RosterEntry> users) {
    public RoomUpdatePayload {
        users = List.copyOf(users);
    }
}
