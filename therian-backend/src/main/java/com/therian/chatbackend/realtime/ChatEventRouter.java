package com.therian.chatbackend.realtime;

import com.therian.chatbackend.auth.AuthException;
import com.therian.chatbackend.realtime.event.InboundEvent;
import com.therian.chatbackend.realtime.event.OutboundEvent;
import com.therian.chatbackend.shared.StorageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Applies decoded socket events to the registry, membership and dispatcher.
 * Everything except {@code auth} requires an authenticated connection and is
 * dropped otherwise.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChatEventRouter {

    private final SessionRegistry sessionRegistry;
    private final ChannelMembershipManager membershipManager;
    private final MessageDispatcher messageDispatcher;

    public void onEvent(ClientConnection connection, InboundEvent event) {
        if (event instanceof InboundEvent.Authenticate auth) {
            authenticate(connection, auth.token());
            return;
        }

        ChatSession session = sessionRegistry.lookup(connection).orElse(null);
        if (session == null) {
            log.debug("Dropping {} from unauthenticated connection {}", event.getClass().getSimpleName(), connection.id());
            return;
        }

        if (event instanceof InboundEvent.JoinRoom join) {
            membershipManager.joinRoom(session, join.roomId());
        } else if (event instanceof InboundEvent.JoinDirect join) {
            membershipManager.joinDirect(session, join.chatId());
        } else if (event instanceof InboundEvent.SendRoomMessage send) {
            messageDispatcher.sendRoomMessage(session, send.roomId(), send.text());
        } else if (event instanceof InboundEvent.SendDirectMessage send) {
            messageDispatcher.sendDirectMessage(session, send.chatId(), send.text());
        }
    }

    public void onDisconnect(ClientConnection connection) {
        sessionRegistry.terminate(connection);
    }

    private void authenticate(ClientConnection connection, String token) {
        try {
            ChatSession session = sessionRegistry.authenticate(connection, token);
            connection.send(new OutboundEvent.AuthOk(session.getIdentityId()));
        } catch (AuthException e) {
            log.warn("Socket auth failed on {} ({}): {}", connection.id(), e.getError(), e.getMessage());
            connection.send(new OutboundEvent.AuthFailed(e.getMessage()));
        } catch (StorageException e) {
            log.error("Socket auth on {} could not load the user", connection.id(), e);
            connection.send(new OutboundEvent.AuthFailed("Service unavailable"));
        }
    }
}
