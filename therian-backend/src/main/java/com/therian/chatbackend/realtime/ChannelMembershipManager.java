package com.therian.chatbackend.realtime;

import com.therian.chatbackend.chat.ChannelId;
import com.therian.chatbackend.chat.DirectChannelName;
import com.therian.chatbackend.shared.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Channel to member connections, plus each connection's current channel.
 * A connection is in at most one channel; a channel exists while it has members.
 * All access goes through one monitor so fanout reads never see half-applied moves.
 */
@Slf4j
@Component
public class ChannelMembershipManager {

    private final Object lock = new Object();
    private final Map<ChannelId, Set<ClientConnection>> members = new HashMap<>();
    private final Map<String, ChannelId> currentChannel = new HashMap<>();

    /**
     * Leaves the current channel and joins the room. No access control on rooms.
     */
    public boolean joinRoom(ChatSession session, String roomId) {
        if (roomId == null || roomId.isBlank()) {
            log.debug("Ignoring join of blank room from {}", session.getIdentityId());
            return false;
        }
        return join(session, ChannelId.room(roomId));
    }

    /**
     * Joins only when the name decomposes into two ids, one being the caller's.
     * Anything else leaves membership untouched and reports nothing to the client.
     */
    public boolean joinDirect(ChatSession session, String channelName) {
        DirectChannelName name;
        try {
            name = DirectChannelName.parse(channelName);
        } catch (ValidationException e) {
            log.debug("Ignoring join of malformed direct channel '{}' from {}", channelName, session.getIdentityId());
            return false;
        }
        if (!name.includes(session.getIdentityId())) {
            log.debug("Ignoring join of foreign direct channel {} from {}", name, session.getIdentityId());
            return false;
        }
        return join(session, ChannelId.direct(name));
    }

    /**
     * Idempotent.
     */
    public void leave(ClientConnection connection) {
        synchronized (lock) {
            leaveLocked(connection);
        }
    }

    public Optional<ChannelId> currentChannel(ClientConnection connection) {
        synchronized (lock) {
            return Optional.ofNullable(currentChannel.get(connection.id()));
        }
    }

    public boolean isMember(ClientConnection connection, ChannelId channel) {
        synchronized (lock) {
            return channel.equals(currentChannel.get(connection.id()));
        }
    }

    /**
     * Snapshot of the members at the time of the call.
     */
    public Set<ClientConnection> membersOf(ChannelId channel) {
        synchronized (lock) {
            Set<ClientConnection> set = members.get(channel);
            return set == null ? Set.of() : Set.copyOf(set);
        }
    }

    public Set<ChannelId> activeChannels() {
        synchronized (lock) {
            return Set.copyOf(members.keySet());
        }
    }

    private boolean join(ChatSession session, ChannelId channel) {
        ClientConnection connection = session.getConnection();
        synchronized (lock) {
            // lost the race with teardown
            if (!session.isActive()) {
                return false;
            }
            leaveLocked(connection);
            members.computeIfAbsent(channel, k -> new LinkedHashSet<>()).add(connection);
            currentChannel.put(connection.id(), channel);
        }
        log.debug("{} joined {}", session.getIdentityId(), channel);
        return true;
    }

    private void leaveLocked(ClientConnection connection) {
        ChannelId previous = currentChannel.remove(connection.id());
        if (previous == null) {
            return;
        }
        Set<ClientConnection> set = members.get(previous);
        if (set != null) {
            set.remove(connection);
            if (set.isEmpty()) {
                members.remove(previous);
            }
        }
    }
}
