package com.example.chatrelay.codec;

import com.fasterxml.jackson.databind.JsonNode;

/** Decoded client frame: {@code {"event": ..., "ackId": ..., "data": {...}}}. */
public record InboundEvent(String event, Long ackId, JsonNode data) {

    public boolean wantsAck() {
        return ackId != null;
    }

    /** Text field of {@code data}, or null when absent or not textual. */
    public String text(String field) {
        if (data == null || !data.isObject()) return null;
        JsonNode node = data.get(field);
        return (node == null || !node.isTextual()) ? null : node.asText();
    }
}
