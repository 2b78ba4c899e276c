package com.therian.chatbackend.realtime;

import com.therian.chatbackend.chat.ChannelId;
import com.therian.chatbackend.chat.DirectChannelName;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ChannelMembershipManagerTest {

    private ChannelMembershipManager membership;

    @BeforeEach
    void setUp() {
        membership = new ChannelMembershipManager();
    }

    private static ChatSession session(String identityId) {
        return new ChatSession(new RecordingConnection(), identityId, "Name " + identityId, "", false);
    }

    @Test
    void joiningAnotherChannelLeavesThePreviousOne() {
        ChatSession alice = session("A");

        assertTrue(membership.joinRoom(alice, "lounge"));
        assertTrue(membership.joinRoom(alice, "games"));

        assertEquals(Optional.of(ChannelId.room("games")), membership.currentChannel(alice.getConnection()));
        assertTrue(membership.membersOf(ChannelId.room("lounge")).isEmpty());
        assertEquals(Set.of(alice.getConnection()), membership.membersOf(ChannelId.room("games")));
    }

    @Test
    void channelDisappearsWithItsLastMember() {
        ChatSession alice = session("A");
        membership.joinRoom(alice, "lounge");

        membership.leave(alice.getConnection());

        assertTrue(membership.activeChannels().isEmpty());
        assertEquals(Optional.empty(), membership.currentChannel(alice.getConnection()));
    }

    @Test
    void leaveIsIdempotent() {
        ChatSession alice = session("A");
        ChatSession bob = session("B");
        membership.joinRoom(alice, "lounge");
        membership.joinRoom(bob, "lounge");

        membership.leave(alice.getConnection());
        membership.leave(alice.getConnection());

        assertEquals(Set.of(bob.getConnection()), membership.membersOf(ChannelId.room("lounge")));
    }

    @Test
    void blankRoomIsIgnored() {
        ChatSession alice = session("A");
        membership.joinRoom(alice, "lounge");

        assertFalse(membership.joinRoom(alice, " "));
        assertEquals(Optional.of(ChannelId.room("lounge")), membership.currentChannel(alice.getConnection()));
    }

    @Test
    void directChannelJoinsBothParticipantsWhateverTheOrder() {
        ChatSession alice = session("A");
        ChatSession bob = session("B");

        assertTrue(membership.joinDirect(alice, "B_A"));
        assertTrue(membership.joinDirect(bob, "A_B"));

        ChannelId channel = ChannelId.direct(DirectChannelName.of("A", "B"));
        assertEquals(Set.of(alice.getConnection(), bob.getConnection()), membership.membersOf(channel));
    }

    @Test
    void foreignDirectChannelLeavesMembershipUntouched() {
        ChatSession alice = session("A");
        membership.joinRoom(alice, "lounge");

        assertFalse(membership.joinDirect(alice, "B_C"));

        assertEquals(Optional.of(ChannelId.room("lounge")), membership.currentChannel(alice.getConnection()));
        assertEquals(Set.of(ChannelId.room("lounge")), membership.activeChannels());
    }

    @Test
    void malformedDirectChannelIsIgnored() {
        ChatSession alice = session("A");

        assertFalse(membership.joinDirect(alice, "A"));
        assertFalse(membership.joinDirect(alice, "A_B_C"));
        assertFalse(membership.joinDirect(alice, null));

        assertTrue(membership.activeChannels().isEmpty());
    }

    @Test
    void deactivatedSessionCannotJoin() {
        ChatSession alice = session("A");
        alice.deactivate();

        assertFalse(membership.joinRoom(alice, "lounge"));
        assertTrue(membership.activeChannels().isEmpty());
    }
}
