package com.therian.chatbackend.chat;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(
        name = "messages",
        indexes = @Index(name = "idx_messages_room_created", columnList = "room_id, created_at")
)
@Getter
@Setter
@NoArgsConstructor
public class RoomMessage extends ChatMessage {

    @Column(name = "room_id", nullable = false)
    private String roomId;

    @Override
    public ChannelId channel() {
        return ChannelId.room(roomId);
    }
}
