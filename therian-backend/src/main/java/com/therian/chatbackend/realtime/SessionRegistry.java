package com.therian.chatbackend.realtime;

import com.therian.chatbackend.auth.AuthError;
import com.therian.chatbackend.auth.AuthException;
import com.therian.chatbackend.auth.JwtService;
import com.therian.chatbackend.realtime.event.OutboundEvent;
import com.therian.chatbackend.user.User;
import com.therian.chatbackend.user.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Who is online and as whom. Indexed by connection and by identity so that an
 * identity's sessions on every device can be evicted together.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionRegistry {

    private final JwtService jwtService;
    private final UserService userService;
    private final ChannelMembershipManager membershipManager;

    private final Object lock = new Object();
    private final Map<String, ChatSession> byConnection = new HashMap<>();
    private final Map<String, Set<String>> byIdentity = new HashMap<>();
    // evicted identities, refused until readmitted
    private final Set<String> barred = new HashSet<>();

    /**
     * The only write path into the registry. A second call on the same
     * connection replaces the earlier binding and drops its channel membership.
     *
     * @throws AuthException INVALID / EXPIRED for bad tokens, UNKNOWN_IDENTITY, BANNED
     */
    public ChatSession authenticate(ClientConnection connection, String token) {
        String identityId = jwtService.verify(token);
        User user = userService.findById(identityId)
                .orElseThrow(() -> new AuthException(AuthError.UNKNOWN_IDENTITY, "User not found"));
        if (user.isBanned()) {
            throw new AuthException(AuthError.BANNED, "This account has been banned.");
        }

        ChatSession session = new ChatSession(connection, user.getId(), user.getName(), user.getPhoto(), user.isPremium());
        ChatSession previous;
        synchronized (lock) {
            if (barred.contains(user.getId())) {
                throw new AuthException(AuthError.BANNED, "This account has been banned.");
            }
            // a close that already went through teardown must not leave a binding behind
            if (!connection.isOpen()) {
                throw new AuthException(AuthError.INVALID, "Connection closed");
            }
            previous = byConnection.put(connection.id(), session);
            if (previous != null) {
                unindex(previous);
                previous.deactivate();
            }
            byIdentity.computeIfAbsent(user.getId(), k -> new HashSet<>()).add(connection.id());
        }
        if (previous != null) {
            // channel rights belonged to the previous identity
            membershipManager.leave(connection);
        }

        userService.touchLastSeen(user.getId());
        log.info("Connection {} authenticated as {}", connection.id(), user.getId());
        return session;
    }

    public Optional<ChatSession> lookup(ClientConnection connection) {
        synchronized (lock) {
            return Optional.ofNullable(byConnection.get(connection.id()));
        }
    }

    public List<ChatSession> sessionsOf(String identityId) {
        synchronized (lock) {
            Set<String> ids = byIdentity.getOrDefault(identityId, Set.of());
            List<ChatSession> out = new ArrayList<>(ids.size());
            for (String id : ids) {
                out.add(byConnection.get(id));
            }
            return out;
        }
    }

    /**
     * Drops the binding and the channel membership. Safe to call any number of
     * times and concurrently with {@link #evict}; only the call that removes the
     * binding schedules the last-seen update.
     *
     * @return true if this call removed a binding
     */
    public boolean terminate(ClientConnection connection) {
        ChatSession removed;
        synchronized (lock) {
            removed = byConnection.remove(connection.id());
            if (removed != null) {
                unindex(removed);
                removed.deactivate();
            }
        }
        membershipManager.leave(connection);

        if (removed == null) {
            return false;
        }
        userService.touchLastSeen(removed.getIdentityId());
        log.debug("Connection {} of {} terminated", connection.id(), removed.getIdentityId());
        return true;
    }

    /**
     * Sends a banned notice to every live session of the identity and closes
     * their connections. The identity cannot authenticate again until
     * {@link #readmit} is called.
     *
     * @return number of sessions evicted
     */
    public int evict(String identityId) {
        List<ChatSession> evicted = new ArrayList<>();
        synchronized (lock) {
            barred.add(identityId);
            Set<String> ids = byIdentity.remove(identityId);
            if (ids != null) {
                for (String id : ids) {
                    ChatSession session = byConnection.remove(id);
                    if (session != null) {
                        session.deactivate();
                        evicted.add(session);
                    }
                }
            }
        }

        for (ChatSession session : evicted) {
            ClientConnection connection = session.getConnection();
            membershipManager.leave(connection);
            connection.send(new OutboundEvent.Banned("This account has been banned."));
            connection.close("banned");
        }
        if (!evicted.isEmpty()) {
            userService.touchLastSeen(identityId);
            log.info("Evicted {} session(s) of {}", evicted.size(), identityId);
        }
        return evicted.size();
    }

    /**
     * Lifts the bar set by {@link #evict}. Existing connections are not restored.
     */
    public void readmit(String identityId) {
        synchronized (lock) {
            barred.remove(identityId);
        }
    }

    public int size() {
        synchronized (lock) {
            return byConnection.size();
        }
    }

    private void unindex(ChatSession session) {
        Set<String> ids = byIdentity.get(session.getIdentityId());
        if (ids != null) {
            ids.remove(session.getConnection().id());
            if (ids.isEmpty()) {
                byIdentity.remove(session.getIdentityId());
            }
        }
    }
}
