package com.therian.chatbackend.chat;

import java.time.Instant;

/**
 * A message as acknowledged by the store, with its server-assigned id and timestamp.
 */
public record StoredMessage(
        long id,
        ChannelId channel,
        String authorId,
        String text,
        Instant createdAt
) {
    static StoredMessage of(ChatMessage m) {
        return new StoredMessage(m.getId(), m.channel(), m.getAuthor().getId(), m.getText(), m.getCreatedAt());
    }
}
