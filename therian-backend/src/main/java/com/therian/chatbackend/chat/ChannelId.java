package com.therian.chatbackend.chat;

/**
 * A logical fanout group. Rooms are open, direct channels belong to two identities.
 */
public record ChannelId(ChannelKind kind, String name) {

    public static ChannelId room(String roomId) {
        return new ChannelId(ChannelKind.ROOM, roomId);
    }

    public static ChannelId direct(DirectChannelName name) {
        return new ChannelId(ChannelKind.DIRECT, name.value());
    }

    public boolean isRoom() {
        return kind == ChannelKind.ROOM;
    }

    @Override
    public String toString() {
        return (isRoom() ? "room_" : "dm_") + name;
    }
}
