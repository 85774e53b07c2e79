package com.example.chatrelay.service;

import com.example.chatrelay.config.ChatProperties;
import com.example.chatrelay.model.Room;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Owns every live Room, keyed by room code. */
@Component
public class RoomStore {

    private static final Logger log = LoggerFactory.getLogger(RoomStore.class);

    private final Map<String, Room> rooms = new ConcurrentHashMap<>();
    private final RoomCodeGenerator codes;
    private final int maxAttempts;

    public RoomStore(RoomCodeGenerator codes, ChatProperties props) {
        this.codes = codes;
        this.maxAttempts = props.roomCode().maxAttempts();
    }

    /**
     * Inserts an empty room under a fresh code. The caller must populate it before its handler returns.
     *
     * @throws IllegalStateException if no unused code turned up within the attempt cap
     */
    public Room createRoom() {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String code = codes.next();
            if (rooms.containsKey(code)) {
                log.debug("Room code collision code={} attempt={}", code, attempt);
                continue;
            }
            Room room = new Room(code);
            rooms.put(code, room);
            return room;
        }
        log.error("No free room code after {} attempts (rooms={})", maxAttempts, rooms.size());
        throw new IllegalStateException("could not allocate a room code after " + maxAttempts + " attempts");
    }

    public Optional<Room> get(String code) {
        if (code == null) return Optional.empty();
        return Optional.ofNullable(rooms.get(code));
    }

    /** Removes the room iff it has no users; returns whether it was removed. */
    public boolean deleteIfEmpty(String code) {
        Room room = (code == null) ? null : rooms.get(code);
        if (room == null || !room.isEmpty()) return false;
        rooms.remove(code, room);
        return true;
    }

    /** Number of live rooms. */
    public int size() {
        return rooms.size();
    }
}
