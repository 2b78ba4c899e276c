package com.therian.chatbackend.friend;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * One direction of a friendship; a mutual add stores both rows.
 */
@Entity
@Table(name = "friends")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Friendship {

    @EmbeddedId
    private FriendshipId id;

    private Instant createdAt;
}
