package com.example.chatrelay.codec;

import com.example.chatrelay.service.Ack;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

/** JSON envelopes in both directions. */
@Component
public class EventCodec {

    private final ObjectMapper objectMapper;

    public EventCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses a client frame.
     *
     * @throws JsonProcessingException if the payload is not JSON
     * @throws IllegalArgumentException if it is JSON but not an event envelope
     */
    public InboundEvent decode(String payload) throws JsonProcessingException {
        JsonNode root = objectMapper.readTree(payload);
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("event envelope must be a JSON object");
        }
        JsonNode event = root.get("event");
        if (event == null || !event.isTextual() || event.asText().isBlank()) {
            throw new IllegalArgumentException("event name missing");
        }
        JsonNode ack = root.get("ackId");
        Long ackId = (ack != null && ack.canConvertToLong()) ? ack.asLong() : null;
        return new InboundEvent(event.asText(), ackId, root.get("data"));
    }

    /** Best-effort ack id recovery for frames that failed {@link #decode}. */
    public Long peekAckId(String payload) {
        try {
            JsonNode ack = objectMapper.readTree(payload).get("ackId");
            return (ack != null && ack.canConvertToLong()) ? ack.asLong() : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    public String encode(String event, Object data) throws JsonProcessingException {
        return objectMapper.writeValueAsString(new OutboundEvent(event, null, data));
    }

    public String encodeAck(long ackId, Ack ack) throws JsonProcessingException {
        return objectMapper.writeValueAsString(new OutboundEvent(ChatEvents.ACK, ackId, ack));
    }
}
