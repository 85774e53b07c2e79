package com.example.chatrelay.model;

import java.time.Instant;
import java.util.Objects;

/** Immutable chat line as stored in a room's message buffer. */
public record ChatMessage(String username, String text, Instant sentAt) {

    public ChatMessage {
        Objects.requireNonNull(username, "username");
        text = (text == null) ? "" : text.trim();
        Objects.requireNonNull(sentAt, "sentAt");
    }
}
