package com.therian.chatbackend.friend;

import com.therian.chatbackend.user.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface FriendshipRepository extends JpaRepository<Friendship, FriendshipId> {

    @Query("SELECT u FROM Friendship f, User u WHERE u.id = f.id.friendId AND f.id.userId = :userId ORDER BY u.name")
    List<User> findFriendsOf(@Param("userId") String userId);
}
