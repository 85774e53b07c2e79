package com.example.chatrelay.service;

import com.example.chatrelay.config.ChatProperties;
import com.example.chatrelay.model.Room;
import com.example.chatrelay.model.RosterEntry;
import com.example.chatrelay.model.UserEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps usernames to their live connections inside a room. Capacity counts distinct usernames,
 * not connections, so extra tabs of a present user are always admitted.
 */
@Component
public class MembershipManager {

    private static final Logger log = LoggerFactory.getLogger(MembershipManager.class);

    private final ConnectionAssociations associations;
    private final int capacity;

    public MembershipManager(ConnectionAssociations associations, ChatProperties props) {
        this.associations = associations;
        this.capacity = props.roomCapacity();
    }

    public boolean canJoin(Room room, String username) {
        return room.hasUser(username) || room.getUserCount() < capacity;
    }

    public JoinResult join(Room room, String username, String connectionId) {
        if (!canJoin(room, username)) {
            log.info("Join rejected: room={} is full ({} users), username={}", room.getCode(), room.getUserCount(), username);
            return JoinResult.ROOM_FULL;
        }

        UserEntry user = room.getOrAddUser(username);
        if (!user.addConnection(connectionId)) {
            log.info("Connection {} already attached to {} in room={}", connectionId, username, room.getCode());
        }
        associations.associate(connectionId, room.getCode(), username);
        return JoinResult.JOINED;
    }

    /**
     * Removes the connection from the user; drops the user once no connection is left.
     * The caller decides whether the room survives.
     */
    public void detach(Room room, String username, String connectionId) {
        associations.clear(connectionId);
        UserEntry user = room.getUser(username);
        if (user == null) {
            log.debug("Detach: no user {} in room={}", username, room.getCode());
            return;
        }
        user.removeConnection(connectionId);
        if (!user.hasConnections()) {
            room.removeUser(username);
        }
    }

    /** One row per present username; the id is its first still-attached connection. */
    public List<RosterEntry> snapshot(Room room) {
        List<RosterEntry> out = new ArrayList<>();
        for (UserEntry u : room.getUsers()) {
            if (!u.hasConnections()) continue;
            out.add(new RosterEntry(u.getDisplayId(), u.getUsername()));
        }
        return out;
    }
}
