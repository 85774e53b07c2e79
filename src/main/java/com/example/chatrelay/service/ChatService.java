package com.example.chatrelay.service;

import com.example.chatrelay.codec.ChatEvents;
import com.example.chatrelay.codec.ChatMessagePayload;
import com.example.chatrelay.codec.RoomUpdatePayload;
import com.example.chatrelay.model.ChatMessage;
import com.example.chatrelay.model.Room;
import com.example.chatrelay.model.UserEntry;
import com.example.chatrelay.service.ConnectionAssociations.Association;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * Chat service: the room/session state machine behind createRoom, joinRoom, leaveRoom,
 * chatMessage and disconnect.
 *
 * Handlers run one at a time (serialised on a single lock) and re-resolve the room by code on
 * entry. Roster broadcasts happen inside the lock so clients see them in state order.
 */
@Service
public class ChatService {

    private static final Logger log = LoggerFactory.getLogger(ChatService.class);

    private final RoomStore rooms;
    private final MembershipManager membership;
    private final MessageBuffer messages;
    private final ConnectionAssociations associations;
    private final ConnectionRegistry connections;

    private final Object lock = new Object();

    public ChatService(RoomStore rooms,
                       MembershipManager membership,
                       MessageBuffer messages,
                       ConnectionAssociations associations,
                       ConnectionRegistry connections) {
        this.rooms = rooms;
        this.membership = membership;
        this.messages = messages;
        this.associations = associations;
        this.connections = connections;
    }

    // ========================================================================
    //  CREATE / JOIN
    // ========================================================================

    public Ack createRoom(String connectionId, String username) {
        String name = normalizeUsername(username);
        if (name == null) return Ack.failure(ChatError.USERNAME_REQUIRED);

        synchronized (lock) {
            Room room = null;
            try {
                releaseAssociation(connectionId, null);

                room = rooms.createRoom();
                if (membership.join(room, name, connectionId) != JoinResult.JOINED) {
                    rooms.deleteIfEmpty(room.getCode());
                    log.error("createRoom: creator {} rejected by fresh room={}", name, room.getCode());
                    return Ack.failure(ChatError.INTERNAL_ERROR);
                }
                connections.joinScope(connectionId, room.getCode());

                log.info("Room created room={} by={} cid={}", room.getCode(), name, connectionId);
                broadcastRoster(room);
                return Ack.ok(room.getCode());
            } catch (RuntimeException e) {
                log.error("createRoom failed (username={}, cid={})", name, connectionId, e);
                if (room != null) {
                    // roll back the half-created room
                    membership.detach(room, name, connectionId);
                    connections.leaveScope(connectionId, room.getCode());
                    rooms.deleteIfEmpty(room.getCode());
                }
                return Ack.failure(ChatError.INTERNAL_ERROR);
            }
        }
    }

    public Ack joinRoom(String connectionId, String roomCode, String username) {
        String code = normalizeRoomCode(roomCode);
        String name = normalizeUsername(username);

        synchronized (lock) {
            Room room = null;
            boolean attached = false;
            try {
                room = rooms.get(code).orElse(null);
                if (room == null) {
                    log.info("Join rejected: room={} not found (username={})", code, name);
                    return Ack.failure(ChatError.ROOM_NOT_FOUND);
                }
                if (name == null) return Ack.failure(ChatError.USERNAME_REQUIRED);

                Association current = associations.get(connectionId).orElse(null);
                if (!membership.canJoin(room, name) && !vacatesSlot(current, code, connectionId)) {
                    log.info("Join rejected: room={} is full (username={})", code, name);
                    return Ack.failure(ChatError.ROOM_FULL);
                }

                // a connection belongs to at most one (room, username) pair
                if (current != null && !current.matches(code, name)) {
                    releaseAssociation(connectionId, code);
                }

                UserEntry existing = room.getUser(name);
                boolean alreadyAttached = existing != null && existing.hasConnection(connectionId);
                if (membership.join(room, name, connectionId) != JoinResult.JOINED) {
                    throw new IllegalStateException("join refused after capacity check in room " + code);
                }
                attached = !alreadyAttached;
                connections.joinScope(connectionId, code);

                log.info("Joined room={} username={} cid={}", code, name, connectionId);
                broadcastRoster(room);
                return Ack.ok(code);
            } catch (RuntimeException e) {
                log.error("joinRoom failed (room={}, username={}, cid={})", code, name, connectionId, e);
                if (attached) {
                    // undo the attach this call made
                    membership.detach(room, name, connectionId);
                    connections.leaveScope(connectionId, code);
                    rooms.deleteIfEmpty(code);
                }
                return Ack.failure(ChatError.INTERNAL_ERROR);
            }
        }
    }

    /**
     * True when switching this connection away from its current username frees a seat in
     * {@code roomCode}, i.e. it is the last connection of a user in that same room.
     */
    private boolean vacatesSlot(Association current, String roomCode, String connectionId) {
        if (current == null || !current.roomCode().equals(roomCode)) return false;
        Room room = rooms.get(roomCode).orElse(null);
        UserEntry user = (room == null) ? null : room.getUser(current.username());
        return user != null && user.hasConnection(connectionId) && user.getConnectionIds().size() == 1;
    }

    // ========================================================================
    //  LEAVE / DISCONNECT
    // ========================================================================

    /** Detaches the connection from whatever room it is associated with. Idempotent. */
    public Ack leaveRoom(String connectionId, String roomCode) {
        String code = normalizeRoomCode(roomCode);
        synchronized (lock) {
            try {
                Association current = associations.get(connectionId).orElse(null);
                if (current == null) {
                    log.debug("leaveRoom: cid={} not in any room (requested room={})", connectionId, code);
                    return Ack.ok();
                }
                if (code != null && !current.roomCode().equals(code)) {
                    log.debug("leaveRoom: cid={} asked to leave {} but is in {}", connectionId, code, current.roomCode());
                }
                releaseAssociation(connectionId, null);
                return Ack.ok();
            } catch (RuntimeException e) {
                log.error("leaveRoom failed (room={}, cid={})", code, connectionId, e);
                return Ack.failure(ChatError.INTERNAL_ERROR);
            }
        }
    }

    /** Same cleanup as {@link #leaveRoom}, driven by connection loss. Never throws. */
    public void disconnect(String connectionId, String reason) {
        synchronized (lock) {
            try {
                Optional<Association> current = associations.get(connectionId);
                if (current.isEmpty()) {
                    log.debug("Disconnect cid={} reason={} (no room)", connectionId, reason);
                    return;
                }
                log.info("Disconnect room={} username={} cid={} reason={}",
                        current.get().roomCode(), current.get().username(), connectionId, reason);
                releaseAssociation(connectionId, null);
            } catch (RuntimeException e) {
                log.error("disconnect cleanup failed (cid={}, reason={})", connectionId, reason, e);
            }
        }
    }

    /**
     * Detaches the connection from its associated room. The room is deleted once empty, otherwise
     * it gets a roster update. {@code keepRoomCode} names a room the caller is about to re-join:
     * it is neither deleted nor broadcast to here.
     */
    private void releaseAssociation(String connectionId, String keepRoomCode) {
        Association a = associations.get(connectionId).orElse(null);
        if (a == null) return;

        String code = a.roomCode();
        connections.leaveScope(connectionId, code);

        Room room = rooms.get(code).orElse(null);
        if (room == null) {
            associations.clear(connectionId);
            return;
        }

        membership.detach(room, a.username(), connectionId);
        if (code.equals(keepRoomCode)) return;

        if (rooms.deleteIfEmpty(code)) {
            log.info("Room closed room={} (last user {} left)", code, a.username());
            return;
        }
        broadcastRoster(room);
    }

    // ========================================================================
    //  MESSAGES
    // ========================================================================

    /**
     * Appends and broadcasts a chat line. Anything that does not check out (unknown room, a
     * connection that is not attached to the claimed username, blank text) is dropped without
     * feedback to the sender.
     */
    public void chatMessage(String connectionId, String roomCode, String username, String text) {
        String code = normalizeRoomCode(roomCode);
        String name = normalizeUsername(username);

        synchronized (lock) {
            try {
                Room room = rooms.get(code).orElse(null);
                if (room == null) {
                    log.debug("Dropped message: room={} not found (cid={})", code, connectionId);
                    return;
                }
                UserEntry user = room.getUser(name);
                if (user == null || !user.hasConnection(connectionId)
                        || !associations.matches(connectionId, code, name)) {
                    log.warn("Dropped message: cid={} is not {} in room={}", connectionId, name, code);
                    return;
                }
                String trimmed = (text == null) ? "" : text.trim();
                if (trimmed.isEmpty()) {
                    log.debug("Dropped blank message room={} username={}", code, name);
                    return;
                }

                ChatMessage message = new ChatMessage(name, trimmed, Instant.now());
                messages.append(room, message);
                connections.broadcast(code, ChatEvents.CHAT_MESSAGE, ChatMessagePayload.of(message));
            } catch (RuntimeException e) {
                log.error("chatMessage failed (room={}, username={}, cid={})", code, name, connectionId, e);
            }
        }
    }

    // ========================================================================
    //  HEALTH / HELPERS
    // ========================================================================

    public int liveRoomCount() {
        return rooms.size();
    }

    private void broadcastRoster(Room room) {
        connections.broadcast(room.getCode(), ChatEvents.ROOM_UPDATE, new RoomUpdatePayload(membership.snapshot(room)));
    }

    static String normalizeRoomCode(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t.toUpperCase(Locale.ROOT);
    }

    static String normalizeUsername(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
