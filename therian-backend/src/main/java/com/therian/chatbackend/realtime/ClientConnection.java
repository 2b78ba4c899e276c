package com.therian.chatbackend.realtime;

import com.therian.chatbackend.realtime.event.OutboundEvent;

/**
 * One live client transport. Sends are best effort; a dead peer is cleaned up
 * through the disconnect path.
 */
public interface ClientConnection {

    String id();

    void send(OutboundEvent event);

    void close(String reason);

    boolean isOpen();
}
