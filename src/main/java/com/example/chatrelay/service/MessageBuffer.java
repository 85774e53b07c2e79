package com.example.chatrelay.service;

import com.example.chatrelay.config.ChatProperties;
import com.example.chatrelay.model.ChatMessage;
import com.example.chatrelay.model.Room;
import org.springframework.stereotype.Component;

/** Per-room bounded log; oldest messages are evicted first. */
@Component
public class MessageBuffer {

    private final int limit;

    public MessageBuffer(ChatProperties props) {
        this.limit = props.historyLimit();
    }

    public void append(Room room, ChatMessage message) {
        room.appendMessage(message, limit);
    }

    public int getLimit() {
        return limit;
    }
}
