package com.example.chatrelay.service;

import com.fasterxml.jackson.annotation.JsonInclude;

/** Reply to an inbound event: {@code {success, roomCode?, error?}}. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Ack(boolean success, String roomCode, String error) {

    public static Ack ok() {
        return new Ack(true, null, null);
    }

    public static Ack ok(String roomCode) {
        return new Ack(true, roomCode, null);
    }

    public static Ack failure(ChatError error) {
        return new Ack(false, null, error.getMessage());
    }
}
