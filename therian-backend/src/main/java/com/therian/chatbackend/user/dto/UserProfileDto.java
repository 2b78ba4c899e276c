package com.therian.chatbackend.user.dto;

import com.therian.chatbackend.user.User;

import java.time.Instant;

public record UserProfileDto(
        String id,
        String name,
        String photo,
        String email,
        boolean premium,
        Instant lastSeen
) {
    public static UserProfileDto from(User u) {
        return new UserProfileDto(u.getId(), u.getName(), u.getPhoto(), u.getEmail(), u.isPremium(), u.getLastSeen());
    }
}
