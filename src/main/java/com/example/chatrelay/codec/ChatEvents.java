package com.example.chatrelay.codec;

/** Event names on the wire. */
public final class ChatEvents {
    private ChatEvents() {}

    // inbound
    public static final String CREATE_ROOM = "createRoom";
    public static final String JOIN_ROOM = "joinRoom";
    public static final String LEAVE_ROOM = "leaveRoom";
    // inbound and outbound
    public static final String CHAT_MESSAGE = "chatMessage";
    // outbound
    public static final String ROOM_UPDATE = "roomUpdate";
    public static final String ACK = "ack";
}
