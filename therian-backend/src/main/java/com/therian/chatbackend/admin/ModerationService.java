package com.therian.chatbackend.admin;

import com.therian.chatbackend.auth.AdminIdentity;
import com.therian.chatbackend.chat.MessageStore;
import com.therian.chatbackend.chat.StoredMessage;
import com.therian.chatbackend.realtime.MessageDispatcher;
import com.therian.chatbackend.realtime.SessionRegistry;
import com.therian.chatbackend.realtime.event.OutboundEvent;
import com.therian.chatbackend.shared.ValidationException;
import com.therian.chatbackend.user.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.Optional;

/**
 * Admin actions that must reach live sessions as well as the store.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModerationService {

    private final AdminIdentity adminIdentity;
    private final UserService userService;
    private final SessionRegistry sessionRegistry;
    private final MessageStore messageStore;
    private final MessageDispatcher messageDispatcher;

    /**
     * Persists the ban, then evicts every live session of the target.
     *
     * @return number of sessions evicted
     */
    public int banIdentity(String adminId, String targetId) {
        adminIdentity.requireAdmin(adminId);
        if (adminIdentity.isAdmin(targetId)) {
            throw new ValidationException("The administrator cannot be banned");
        }
        if (!userService.setBanned(targetId, true)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "User not found");
        }
        int evicted = sessionRegistry.evict(targetId);
        log.info("⛔ {} banned by {} ({} live session(s) evicted)", targetId, adminId, evicted);
        return evicted;
    }

    /**
     * Clears the flag only; nobody is reconnected.
     */
    public void unbanIdentity(String adminId, String targetId) {
        adminIdentity.requireAdmin(adminId);
        if (!userService.setBanned(targetId, false)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "User not found");
        }
        sessionRegistry.readmit(targetId);
        log.info("{} unbanned by {}", targetId, adminId);
    }

    /**
     * Deletes a room message and, when a row was removed, tells the room's
     * current members to drop it. Direct messages are not deletable.
     *
     * @return whether a message was deleted
     */
    public boolean deleteRoomMessage(String adminId, long messageId) {
        adminIdentity.requireAdmin(adminId);
        Optional<StoredMessage> removed = messageStore.deleteRoomMessage(messageId);
        removed.ifPresent(message -> {
            int notified = messageDispatcher.broadcast(
                    message.channel(),
                    new OutboundEvent.MessageDeleted(message.id(), message.channel().name()));
            log.info("Message {} in {} retracted by {} ({} member(s) notified)",
                    message.id(), message.channel(), adminId, notified);
        });
        return removed.isPresent();
    }
}
