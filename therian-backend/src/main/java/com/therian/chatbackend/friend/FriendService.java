package com.therian.chatbackend.friend;

import com.therian.chatbackend.friend.dto.FriendDto;
import com.therian.chatbackend.shared.ValidationException;
import com.therian.chatbackend.user.UserRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.List;

@Service
@RequiredArgsConstructor
public class FriendService {

    private final FriendshipRepository friendshipRepository;
    private final UserRepository userRepository;

    /**
     * Idempotent; creates both directions.
     */
    @Transactional
    public void addFriend(String userId, String friendId) {
        if (userId.equals(friendId)) {
            throw new ValidationException("You cannot add yourself as a friend");
        }
        if (!userRepository.existsById(friendId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "User not found");
        }

        Instant now = Instant.now();
        saveIfAbsent(new FriendshipId(userId, friendId), now);
        saveIfAbsent(new FriendshipId(friendId, userId), now);
    }

    @Transactional(readOnly = true)
    public List<FriendDto> listFriends(String userId) {
        return friendshipRepository.findFriendsOf(userId).stream()
                .map(FriendDto::from)
                .toList();
    }

    private void saveIfAbsent(FriendshipId id, Instant now) {
        if (!friendshipRepository.existsById(id)) {
            friendshipRepository.save(Friendship.builder().id(id).createdAt(now).build());
        }
    }
}
