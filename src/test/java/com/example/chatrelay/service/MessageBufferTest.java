package com.example.chatrelay.service;

import com.example.chatrelay.config.ChatProperties;
import com.example.chatrelay.model.ChatMessage;
import com.example.chatrelay.model.Room;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MessageBufferTest {

    @Test
    void hundredAndFirstMessage_evictsTheFirst() {
        MessageBuffer buffer = new MessageBuffer(ChatProperties.defaults());
        Room room = new Room("X");

        for (int i = 1; i <= 101; i++) {
            buffer.append(room, new ChatMessage("alice", "msg-" + i, Instant.now()));
        }

        List<ChatMessage> msgs = room.getMessages();
        assertEquals(100, msgs.size());
        assertEquals("msg-2", msgs.get(0).text());
        assertEquals("msg-101", msgs.get(99).text());
        assertTrue(msgs.stream().noneMatch(m -> "msg-1".equals(m.text())));
    }

    @Test
    void belowLimit_keepsEverythingInOrder() {
        MessageBuffer buffer = new MessageBuffer(ChatProperties.defaults());
        Room room = new Room("X");

        buffer.append(room, new ChatMessage("alice", "a", Instant.now()));
        buffer.append(room, new ChatMessage("bob", "b", Instant.now()));

        assertEquals(List.of("a", "b"), room.getMessages().stream().map(ChatMessage::text).toList());
        assertEquals(100, buffer.getLimit());
    }
}
