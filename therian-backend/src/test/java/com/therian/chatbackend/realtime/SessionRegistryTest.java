package com.therian.chatbackend.realtime;

import com.therian.chatbackend.auth.AuthError;
import com.therian.chatbackend.auth.AuthException;
import com.therian.chatbackend.auth.JwtService;
import com.therian.chatbackend.chat.ChannelId;
import com.therian.chatbackend.chat.DirectChannelName;
import com.therian.chatbackend.realtime.event.OutboundEvent;
import com.therian.chatbackend.user.User;
import com.therian.chatbackend.user.UserService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SessionRegistryTest {

    private JwtService jwtService;
    private UserService userService;
    private ChannelMembershipManager membership;
    private SessionRegistry registry;

    @BeforeEach
    void setUp() {
        jwtService = new JwtService("test-secret-for-session-tokens-0123456789abcdef", Duration.ofDays(30).toMillis());
        userService = mock(UserService.class);
        membership = new ChannelMembershipManager();
        registry = new SessionRegistry(jwtService, userService, membership);

        when(userService.findById("u1")).thenReturn(Optional.of(user("u1", false)));
        when(userService.findById("u2")).thenReturn(Optional.of(user("u2", false)));
        when(userService.findById("banned")).thenReturn(Optional.of(user("banned", true)));
        when(userService.findById("ghost")).thenReturn(Optional.empty());
    }

    private static User user(String id, boolean banned) {
        return User.builder()
                .id(id)
                .name("Name " + id)
                .photo("photo-" + id)
                .premium(true)
                .banned(banned)
                .build();
    }

    @Test
    void authenticateBindsProfileSnapshot() {
        RecordingConnection conn = new RecordingConnection();

        ChatSession session = registry.authenticate(conn, jwtService.issue("u1"));

        assertEquals("u1", session.getIdentityId());
        assertEquals("Name u1", session.getName());
        assertEquals("photo-u1", session.getPhoto());
        assertTrue(session.isPremium());
        assertSame(session, registry.lookup(conn).orElseThrow());
        verify(userService).touchLastSeen("u1");
    }

    @Test
    void invalidTokenLeavesNoBinding() {
        RecordingConnection conn = new RecordingConnection();

        AuthException ex = assertThrows(AuthException.class, () -> registry.authenticate(conn, "garbage"));

        assertEquals(AuthError.INVALID, ex.getError());
        assertTrue(registry.lookup(conn).isEmpty());
        verifyNoInteractions(userService);
    }

    @Test
    void unknownIdentityIsRejected() {
        RecordingConnection conn = new RecordingConnection();

        AuthException ex = assertThrows(AuthException.class,
                () -> registry.authenticate(conn, jwtService.issue("ghost")));

        assertEquals(AuthError.UNKNOWN_IDENTITY, ex.getError());
        assertEquals(0, registry.size());
    }

    @Test
    void bannedIdentityIsRejected() {
        RecordingConnection conn = new RecordingConnection();

        AuthException ex = assertThrows(AuthException.class,
                () -> registry.authenticate(conn, jwtService.issue("banned")));

        assertEquals(AuthError.BANNED, ex.getError());
        assertTrue(registry.lookup(conn).isEmpty());
    }

    @Test
    void closedConnectionCannotAuthenticate() {
        RecordingConnection conn = new RecordingConnection();
        conn.close("gone");

        assertThrows(AuthException.class, () -> registry.authenticate(conn, jwtService.issue("u1")));
        assertEquals(0, registry.size());
    }

    @Test
    void reauthenticatingReplacesTheBinding() {
        RecordingConnection conn = new RecordingConnection();
        ChatSession first = registry.authenticate(conn, jwtService.issue("u1"));
        assertTrue(membership.joinDirect(first, "u1_u3"));

        ChatSession second = registry.authenticate(conn, jwtService.issue("u2"));

        assertEquals("u2", registry.lookup(conn).orElseThrow().getIdentityId());
        assertTrue(registry.sessionsOf("u1").isEmpty());
        assertEquals(1, registry.sessionsOf("u2").size());
        assertFalse(first.isActive());
        assertEquals(1, registry.size());
        ChannelId previousChannel = ChannelId.direct(DirectChannelName.of("u1", "u3"));
        assertFalse(membership.isMember(conn, previousChannel));
        assertTrue(membership.currentChannel(conn).isEmpty());
        // the stale session cannot rejoin, the new one can
        assertFalse(membership.joinDirect(first, "u1_u3"));
        assertTrue(membership.joinRoom(second, "lounge"));
    }

    @Test
    void banDuringAuthenticationLeavesNoLiveSession() throws Exception {
        CountDownLatch loaded = new CountDownLatch(1);
        CountDownLatch evicted = new CountDownLatch(1);
        when(userService.findById("t")).thenAnswer(inv -> {
            loaded.countDown();
            assertTrue(evicted.await(5, TimeUnit.SECONDS));
            // the row was read before the ban committed
            return Optional.of(user("t", false));
        });
        RecordingConnection conn = new RecordingConnection();

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<ChatSession> attempt = pool.submit(() -> registry.authenticate(conn, jwtService.issue("t")));
            assertTrue(loaded.await(5, TimeUnit.SECONDS));
            assertEquals(0, registry.evict("t"));
            evicted.countDown();

            ExecutionException ex = assertThrows(ExecutionException.class, () -> attempt.get(5, TimeUnit.SECONDS));
            assertEquals(AuthError.BANNED, assertInstanceOf(AuthException.class, ex.getCause()).getError());
        } finally {
            pool.shutdownNow();
        }

        assertTrue(registry.sessionsOf("t").isEmpty());
        assertTrue(registry.lookup(conn).isEmpty());
    }

    @Test
    void readmittedIdentityCanAuthenticateAgain() {
        registry.evict("u1");
        assertEquals(AuthError.BANNED, assertThrows(AuthException.class,
                () -> registry.authenticate(new RecordingConnection(), jwtService.issue("u1"))).getError());

        registry.readmit("u1");

        assertEquals("u1", registry.authenticate(new RecordingConnection(), jwtService.issue("u1")).getIdentityId());
    }

    @Test
    void terminateRemovesBindingAndMembershipOnce() {
        RecordingConnection conn = new RecordingConnection();
        ChatSession session = registry.authenticate(conn, jwtService.issue("u1"));
        membership.joinRoom(session, "lounge");

        assertTrue(registry.terminate(conn));
        assertFalse(registry.terminate(conn));

        assertTrue(registry.lookup(conn).isEmpty());
        assertTrue(membership.membersOf(ChannelId.room("lounge")).isEmpty());
        // once on authenticate, once on terminate
        verify(userService, times(2)).touchLastSeen("u1");
    }

    @Test
    void terminateOfUnauthenticatedConnectionIsHarmless() {
        assertFalse(registry.terminate(new RecordingConnection()));
        verify(userService, never()).touchLastSeen(anyString());
    }

    @Test
    void evictNotifiesAndClosesEverySessionOfTheIdentity() {
        RecordingConnection phone = new RecordingConnection();
        RecordingConnection laptop = new RecordingConnection();
        RecordingConnection other = new RecordingConnection();
        membership.joinRoom(registry.authenticate(phone, jwtService.issue("u1")), "lounge");
        registry.authenticate(laptop, jwtService.issue("u1"));
        membership.joinRoom(registry.authenticate(other, jwtService.issue("u2")), "lounge");

        int evicted = registry.evict("u1");

        assertEquals(2, evicted);
        for (RecordingConnection conn : new RecordingConnection[]{phone, laptop}) {
            assertEquals(1, conn.eventsOfType(OutboundEvent.Banned.class).size());
            assertFalse(conn.isOpen());
            assertTrue(registry.lookup(conn).isEmpty());
        }
        assertTrue(other.isOpen());
        assertTrue(other.events().isEmpty());
        assertEquals(java.util.Set.of(other), membership.membersOf(ChannelId.room("lounge")));
        assertTrue(registry.sessionsOf("u1").isEmpty());
        assertEquals(1, registry.size());
    }

    @Test
    void disconnectAfterEvictionIsANoop() {
        RecordingConnection conn = new RecordingConnection();
        registry.authenticate(conn, jwtService.issue("u1"));
        registry.evict("u1");

        assertFalse(registry.terminate(conn));
        assertEquals(0, registry.evict("u1"));
    }

    @Test
    void concurrentEvictAndDisconnectRemoveTheSessionExactlyOnce() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int i = 0; i < 200; i++) {
                registry.readmit("u1");
                RecordingConnection conn = new RecordingConnection();
                registry.authenticate(conn, jwtService.issue("u1"));
                CountDownLatch start = new CountDownLatch(1);

                Future<Integer> evicted = pool.submit(() -> {
                    start.await();
                    return registry.evict("u1");
                });
                Future<Boolean> terminated = pool.submit(() -> {
                    start.await();
                    return registry.terminate(conn);
                });
                start.countDown();

                int removals = evicted.get(5, TimeUnit.SECONDS) + (terminated.get(5, TimeUnit.SECONDS) ? 1 : 0);
                assertEquals(1, removals);
                assertEquals(0, registry.size());
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
