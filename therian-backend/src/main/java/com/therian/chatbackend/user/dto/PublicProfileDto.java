package com.therian.chatbackend.user.dto;

import com.therian.chatbackend.user.User;

public record PublicProfileDto(String id, String name, String photo) {

    public static PublicProfileDto from(User u) {
        return new PublicProfileDto(u.getId(), u.getName(), u.getPhoto());
    }
}
