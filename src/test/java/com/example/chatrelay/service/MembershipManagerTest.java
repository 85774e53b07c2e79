package com.example.chatrelay.service;

import com.example.chatrelay.config.ChatProperties;
import com.example.chatrelay.model.Room;
import com.example.chatrelay.model.RosterEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MembershipManagerTest {

    private ConnectionAssociations associations;
    private MembershipManager membership;
    private Room room;

    @BeforeEach
    void setUp() {
        associations = new ConnectionAssociations();
        membership = new MembershipManager(associations, ChatProperties.defaults());
        room = new Room("ROOM01");
    }

    @Test
    void join_createsUserAndRecordsAssociation() {
        assertEquals(JoinResult.JOINED, membership.join(room, "alice", "c1"));

        assertTrue(room.getUser("alice").hasConnection("c1"));
        assertTrue(associations.matches("c1", "ROOM01", "alice"));
    }

    @Test
    void join_sameUsernameAddsConnection_andRosterShowsUserOnce() {
        membership.join(room, "alice", "c1");
        membership.join(room, "alice", "c2");
        membership.join(room, "alice", "c2"); // idempotent

        assertEquals(1, room.getUserCount());
        assertEquals(2, room.getUser("alice").getConnectionIds().size());
        assertEquals(List.of(new RosterEntry("c1", "alice")), membership.snapshot(room));
    }

    @Test
    void join_fifthDistinctUsernameIsRejected_butExistingNameStillGetsIn() {
        membership.join(room, "a", "c1");
        membership.join(room, "b", "c2");
        membership.join(room, "c", "c3");
        membership.join(room, "d", "c4");

        assertEquals(JoinResult.ROOM_FULL, membership.join(room, "e", "c5"));
        assertFalse(room.hasUser("e"));
        assertTrue(associations.get("c5").isEmpty(), "rejected connection gets no association");

        assertEquals(JoinResult.JOINED, membership.join(room, "a", "c6"));
        assertEquals(4, room.getUserCount());
    }

    @Test
    void detach_keepsUserWhileAnotherConnectionRemains() {
        membership.join(room, "alice", "c1");
        membership.join(room, "alice", "c2");

        membership.detach(room, "alice", "c1");

        assertTrue(room.hasUser("alice"));
        assertTrue(associations.get("c1").isEmpty());
        assertEquals(List.of(new RosterEntry("c2", "alice")), membership.snapshot(room),
                "display id changes to the remaining connection");

        membership.detach(room, "alice", "c2");
        assertFalse(room.hasUser("alice"));
        assertTrue(room.isEmpty());
    }

    @Test
    void detach_unknownUserIsHarmless() {
        membership.join(room, "alice", "c1");
        membership.detach(room, "ghost", "c9");
        assertEquals(1, room.getUserCount());
    }

    @Test
    void snapshot_listsUsersInJoinOrder() {
        membership.join(room, "alice", "c1");
        membership.join(room, "bob", "c2");
        membership.join(room, "alice", "c3");

        assertEquals(List.of(new RosterEntry("c1", "alice"), new RosterEntry("c2", "bob")),
                membership.snapshot(room));
    }
}
