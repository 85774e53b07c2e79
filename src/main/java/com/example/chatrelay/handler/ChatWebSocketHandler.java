package com.example.chatrelay.handler;

import com.example.chatrelay.codec.ChatEvents;
import com.example.chatrelay.codec.EventCodec;
import com.example.chatrelay.codec.InboundEvent;
import com.example.chatrelay.service.Ack;
import com.example.chatrelay.service.ChatError;
import com.example.chatrelay.service.ChatService;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * WebSocket handler for the chat endpoint.
 * - Frames are JSON envelopes {@code {"event", "ackId"?, "data"}}
 * - createRoom / joinRoom / leaveRoom answer with an "ack" frame when an ackId was given
 * - chatMessage is fire-and-forget
 * - On close: disconnect cleanup for whatever room the connection was in
 */
@Component
public class ChatWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(ChatWebSocketHandler.class);

    private final ChatService chatService;
    private final WebSocketConnectionRegistry registry;
    private final EventCodec codec;

    public ChatWebSocketHandler(ChatService chatService, WebSocketConnectionRegistry registry, EventCodec codec) {
        this.chatService = chatService;
        this.registry = registry;
        this.codec = codec;
    }

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) {
        registry.register(session);
        log.info("WS OPEN sid={} uri={}", session.getId(), safeUri(session));
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) {
        final String sid = session.getId();
        final String payload = message.getPayload();

        InboundEvent in;
        try {
            in = codec.decode(payload);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("WS malformed frame sid={} : {}", sid, e.getMessage());
            Long ackId = codec.peekAckId(payload);
            if (ackId != null) registry.sendAck(sid, ackId, Ack.failure(ChatError.INVALID_REQUEST));
            return;
        }

        try {
            switch (in.event()) {
                case ChatEvents.CREATE_ROOM ->
                        reply(sid, in, chatService.createRoom(sid, in.text("username")));
                case ChatEvents.JOIN_ROOM ->
                        reply(sid, in, chatService.joinRoom(sid, in.text("roomCode"), in.text("username")));
                case ChatEvents.LEAVE_ROOM ->
                        reply(sid, in, chatService.leaveRoom(sid, in.text("roomCode")));
                case ChatEvents.CHAT_MESSAGE ->
                        chatService.chatMessage(sid, in.text("roomCode"), in.text("username"), in.text("message"));
                default -> {
                    log.warn("WS unknown event '{}' sid={}", in.event(), sid);
                    reply(sid, in, Ack.failure(ChatError.INVALID_REQUEST));
                }
            }
        } catch (RuntimeException e) {
            log.error("WS handleTextMessage failed (sid={}, event={})", sid, in.event(), e);
            reply(sid, in, Ack.failure(ChatError.INTERNAL_ERROR));
        }
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession session, @NonNull Throwable exception) {
        log.error("WS ERROR sid={} uri={} : transport error", session.getId(), safeUri(session), exception);
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        final String sid = session.getId();
        log.info("WS CLOSE sid={} code={} reason={}", sid, status.getCode(), status.getReason());
        try {
            chatService.disconnect(sid, describe(status));
        } finally {
            registry.unregister(sid);
        }
    }

    /* ---------------- helpers ---------------- */

    private void reply(String sid, InboundEvent in, Ack ack) {
        if (in.wantsAck()) registry.sendAck(sid, in.ackId(), ack);
    }

    private static String describe(CloseStatus status) {
        String reason = status.getReason();
        return (reason == null || reason.isBlank()) ? String.valueOf(status.getCode()) : status.getCode() + " " + reason;
    }

    private String safeUri(WebSocketSession session) {
        try { return String.valueOf(session.getUri()); } catch (Exception e) { return "n/a"; }
    }
}
