package com.therian.chatbackend.chat;

public enum ChannelKind {
    ROOM,
    DIRECT
}
