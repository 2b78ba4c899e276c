package com.therian.chatbackend.chat;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(
        name = "dm_messages",
        indexes = @Index(name = "idx_dm_messages_chat", columnList = "chat_id, created_at")
)
@Getter
@Setter
@NoArgsConstructor
public class DirectMessage extends ChatMessage {

    // canonical uid1_uid2
    @Column(name = "chat_id", nullable = false)
    private String chatId;

    @Override
    public ChannelId channel() {
        return ChannelId.direct(DirectChannelName.parse(chatId));
    }
}
