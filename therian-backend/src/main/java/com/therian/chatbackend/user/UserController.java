package com.therian.chatbackend.user;

import com.therian.chatbackend.user.dto.PublicProfileDto;
import com.therian.chatbackend.user.dto.UpdateNameRequest;
import com.therian.chatbackend.user.dto.UpdatePhotoRequest;
import com.therian.chatbackend.user.dto.UserProfileDto;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
public class UserController {

    private final UserService userService;
    private final CurrentUserService currentUserService;

    @GetMapping("/me")
    public UserProfileDto me() {
        return UserProfileDto.from(userService.getOrThrow(currentUserService.getCurrentUserIdOrThrow()));
    }

    @PutMapping("/me/name")
    public Map<String, Boolean> updateName(@Valid @RequestBody UpdateNameRequest request) {
        userService.updateName(currentUserService.getCurrentUserIdOrThrow(), request.name());
        return Map.of("ok", true);
    }

    @PutMapping("/me/photo")
    public Map<String, Boolean> updatePhoto(@Valid @RequestBody UpdatePhotoRequest request) {
        userService.updatePhoto(currentUserService.getCurrentUserIdOrThrow(), request.photo());
        return Map.of("ok", true);
    }

    @GetMapping("/lookup/{uid}")
    public PublicProfileDto lookup(@PathVariable String uid) {
        return PublicProfileDto.from(userService.getOrThrow(uid));
    }
}
