package com.therian.chatbackend.friend;

import com.therian.chatbackend.friend.dto.FriendDto;
import com.therian.chatbackend.user.CurrentUserService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/friends")
@RequiredArgsConstructor
public class FriendController {

    private final FriendService friendService;
    private final CurrentUserService currentUserService;

    @GetMapping
    public List<FriendDto> myFriends() {
        return friendService.listFriends(currentUserService.getCurrentUserIdOrThrow());
    }

    @PostMapping("/{friendId}")
    public Map<String, Boolean> add(@PathVariable String friendId) {
        friendService.addFriend(currentUserService.getCurrentUserIdOrThrow(), friendId);
        return Map.of("ok", true);
    }
}
