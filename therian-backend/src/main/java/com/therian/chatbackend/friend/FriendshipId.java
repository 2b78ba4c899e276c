package com.therian.chatbackend.friend;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FriendshipId implements Serializable {

    @Column(name = "user_id")
    private String userId;

    @Column(name = "friend_id")
    private String friendId;
}
