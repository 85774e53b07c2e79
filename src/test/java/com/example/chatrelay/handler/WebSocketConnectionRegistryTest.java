package com.example.chatrelay.handler;

import com.example.chatrelay.codec.EventCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class WebSocketConnectionRegistryTest {

    private final WebSocketConnectionRegistry registry = new WebSocketConnectionRegistry(new EventCodec(new ObjectMapper()));

    @Test
    void leaveScope_dropsEmptyScope() {
        registry.joinScope("c1", "ROOM01");
        registry.joinScope("c2", "ROOM01");

        registry.leaveScope("c1", "ROOM01");
        assertEquals(java.util.Set.of("c2"), registry.scope("ROOM01"));

        registry.leaveScope("c2", "ROOM01");
        assertTrue(registry.scope("ROOM01").isEmpty());
    }

    @Test
    void unregister_removesConnectionFromEveryScope() {
        registry.joinScope("c1", "ROOM01");
        registry.joinScope("c1", "ROOM02");
        registry.joinScope("c2", "ROOM02");

        registry.unregister("c1");

        assertTrue(registry.scope("ROOM01").isEmpty());
        assertEquals(java.util.Set.of("c2"), registry.scope("ROOM02"));
    }

    @Test
    void joinScope_survivesConcurrentUnregisterOfOtherConnections() throws Exception {
        AtomicBoolean running = new AtomicBoolean(true);
        Thread closer = new Thread(() -> {
            long n = 0;
            while (running.get()) {
                registry.unregister("gone-" + (n++));
            }
        }, "closer");
        closer.start();

        int lost = 0;
        try {
            for (int i = 0; i < 200_000; i++) {
                String room = "R" + i;
                registry.joinScope("c" + i, room);
                if (!registry.scope(room).contains("c" + i)) lost++;
                registry.leaveScope("c" + i, room);
            }
        } finally {
            running.set(false);
            closer.join();
        }

        assertEquals(0, lost, "joined connections must stay in their scope");
    }
}
