package com.therian.chatbackend.admin;

import com.therian.chatbackend.user.CurrentUserService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@PreAuthorize("hasRole('ADMIN')")
public class AdminController {

    private final ModerationService moderationService;
    private final CurrentUserService currentUserService;

    @PostMapping("/users/{uid}/ban")
    public Map<String, Object> ban(@PathVariable String uid) {
        int evicted = moderationService.banIdentity(currentUserService.getCurrentUserIdOrThrow(), uid);
        return Map.of("ok", true, "evicted", evicted);
    }

    @PostMapping("/users/{uid}/unban")
    public Map<String, Object> unban(@PathVariable String uid) {
        moderationService.unbanIdentity(currentUserService.getCurrentUserIdOrThrow(), uid);
        return Map.of("ok", true);
    }

    @DeleteMapping("/messages/{id}")
    public ResponseEntity<Map<String, Object>> deleteMessage(@PathVariable long id) {
        if (!moderationService.deleteRoomMessage(currentUserService.getCurrentUserIdOrThrow(), id)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Message not found");
        }
        return ResponseEntity.ok(Map.of("ok", true));
    }
}
