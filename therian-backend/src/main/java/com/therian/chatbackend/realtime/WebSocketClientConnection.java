package com.therian.chatbackend.realtime;

import com.therian.chatbackend.realtime.event.EventCodec;
import com.therian.chatbackend.realtime.event.OutboundEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

@Slf4j
public class WebSocketClientConnection implements ClientConnection {

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final WebSocketSession session;
    private final EventCodec codec;

    public WebSocketClientConnection(WebSocketSession session, EventCodec codec) {
        // fanout writes come from many threads
        this.session = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
        this.codec = codec;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public void send(OutboundEvent event) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.sendMessage(new TextMessage(codec.encode(event)));
        } catch (IOException | IllegalStateException e) {
            log.debug("Send to {} failed: {}", id(), e.getMessage());
        }
    }

    @Override
    public void close(String reason) {
        try {
            session.close(CloseStatus.POLICY_VIOLATION.withReason(reason));
        } catch (IOException e) {
            log.debug("Close of {} failed: {}", id(), e.getMessage());
        }
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }
}
