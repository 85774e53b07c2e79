package com.example.chatrelay.service;

/** Failures reported through acknowledgements. Messages are part of the client contract. */
public enum ChatError {
    ROOM_NOT_FOUND("Room not found"),
    ROOM_FULL("Room is full"),
    USERNAME_REQUIRED("Username is required"),
    INVALID_REQUEST("Invalid request"),
    INTERNAL_ERROR("Internal server error");

    private final String message;

    ChatError(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
