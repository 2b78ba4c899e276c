package com.therian.chatbackend.chat;

import com.therian.chatbackend.shared.ValidationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DirectChannelNameTest {

    @Test
    void bothOrderingsResolveToSameCanonicalName() {
        DirectChannelName a = DirectChannelName.parse("bob_alice");
        DirectChannelName b = DirectChannelName.parse("alice_bob");

        assertEquals(a, b);
        assertEquals("alice_bob", a.value());
        assertEquals(ChannelId.direct(a), ChannelId.direct(b));
    }

    @Test
    void includesOnlyTheTwoParticipants() {
        DirectChannelName name = DirectChannelName.of("alice", "bob");

        assertTrue(name.includes("alice"));
        assertTrue(name.includes("bob"));
        assertFalse(name.includes("carol"));
    }

    @Test
    void rejectsAnythingButTwoDistinctIds() {
        assertThrows(ValidationException.class, () -> DirectChannelName.parse("alice"));
        assertThrows(ValidationException.class, () -> DirectChannelName.parse("alice_bob_carol"));
        assertThrows(ValidationException.class, () -> DirectChannelName.parse("alice_"));
        assertThrows(ValidationException.class, () -> DirectChannelName.parse("_bob"));
        assertThrows(ValidationException.class, () -> DirectChannelName.parse("alice_alice"));
        assertThrows(ValidationException.class, () -> DirectChannelName.parse(null));
    }
}
