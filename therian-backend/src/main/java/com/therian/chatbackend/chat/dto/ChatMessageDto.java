package com.therian.chatbackend.chat.dto;

import com.therian.chatbackend.chat.ChatMessage;
import com.therian.chatbackend.user.User;

import java.time.Instant;

/**
 * A message joined with its author's display fields, used both for history
 * responses and live fanout.
 */
public record ChatMessageDto(
        long id,
        String channel,
        String userId,
        String name,
        String photo,
        boolean premium,
        String text,
        Instant createdAt
) {
    public static ChatMessageDto from(ChatMessage m) {
        User author = m.getAuthor();
        return new ChatMessageDto(
                m.getId(),
                m.channel().name(),
                author.getId(),
                author.getName(),
                author.getPhoto(),
                author.isPremium(),
                m.getText(),
                m.getCreatedAt()
        );
    }
}
