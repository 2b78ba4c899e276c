package com.therian.chatbackend.friend.dto;

import com.therian.chatbackend.user.User;

import java.time.Instant;

public record FriendDto(
        String id,
        String name,
        String photo,
        boolean premium,
        Instant lastSeen
) {
    public static FriendDto from(User u) {
        return new FriendDto(u.getId(), u.getName(), u.getPhoto(), u.isPremium(), u.getLastSeen());
    }
}
