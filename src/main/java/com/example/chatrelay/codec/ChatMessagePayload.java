package com.example.chatrelay.codec;

import com.example.chatrelay.model.ChatMessage;

import java.time.format.DateTimeFormatter;

/** Outbound chat line; {@code time} is an ISO-8601 instant. */
public record ChatMessagePayload(String username, String message, String time) {

    public static ChatMessagePayload of(ChatMessage m) {
        return new ChatMessagePayload(m.username(), m.text(), DateTimeFormatter.ISO_INSTANT.format(m.sentAt()));
    }
}
