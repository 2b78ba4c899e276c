package com.therian.chatbackend.realtime;

import com.therian.chatbackend.realtime.event.EventCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

@Slf4j
@Component
@RequiredArgsConstructor
public class ChatWebSocketHandler extends TextWebSocketHandler {

    static final String CONNECTION_ATTRIBUTE = "therian.connection";

    private final ChatEventRouter router;
    private final EventCodec codec;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        session.getAttributes().put(CONNECTION_ATTRIBUTE, new WebSocketClientConnection(session, codec));
        log.debug("Socket {} opened", session.getId());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        ClientConnection connection = connectionOf(session);
        if (connection == null) {
            return;
        }
        codec.decode(message.getPayload()).ifPresent(event -> router.onEvent(connection, event));
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        ClientConnection connection = connectionOf(session);
        if (connection != null) {
            router.onDisconnect(connection);
        }
        log.debug("Socket {} closed: {}", session.getId(), status);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("Transport error on {}: {}", session.getId(), exception.getMessage());
    }

    private static ClientConnection connectionOf(WebSocketSession session) {
        return (ClientConnection) session.getAttributes().get(CONNECTION_ATTRIBUTE);
    }
}
