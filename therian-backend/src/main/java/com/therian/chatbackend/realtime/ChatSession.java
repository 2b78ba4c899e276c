package com.therian.chatbackend.realtime;

import lombok.Getter;

/**
 * A connection bound to an identity, with the profile snapshot taken at
 * authentication time. Never persisted.
 */
@Getter
public class ChatSession {

    private final ClientConnection connection;
    private final String identityId;
    private final String name;
    private final String photo;
    private final boolean premium;

    private volatile boolean active = true;

    public ChatSession(ClientConnection connection, String identityId, String name, String photo, boolean premium) {
        this.connection = connection;
        this.identityId = identityId;
        this.name = name;
        this.photo = photo;
        this.premium = premium;
    }

    void deactivate() {
        active = false;
    }
}
