package com.therian.chatbackend.user;

import com.therian.chatbackend.auth.ExternalIdentity;
import com.therian.chatbackend.shared.StorageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    static final String DEFAULT_NAME = "Anonymous Therian";

    private final UserRepository userRepository;

    /**
     * Upsert on login: creates the identity on first sight, otherwise refreshes
     * last-seen and the avatar. The stored display name is kept.
     */
    @Transactional
    public User upsertFromExternal(ExternalIdentity identity) {
        Instant now = Instant.now();
        User user = userRepository.findById(identity.subject())
                .map(existing -> {
                    if (identity.picture() != null && !identity.picture().isBlank()) {
                        existing.setPhoto(identity.picture());
                    }
                    existing.setLastSeen(now);
                    return existing;
                })
                .orElseGet(() -> User.builder()
                        .id(identity.subject())
                        .name(identity.name() != null && !identity.name().isBlank() ? identity.name() : DEFAULT_NAME)
                        .photo(identity.picture() != null ? identity.picture() : "")
                        .email(identity.email() != null ? identity.email() : "")
                        .lastSeen(now)
                        .build());
        return userRepository.save(user);
    }

    public Optional<User> findById(String id) {
        try {
            return userRepository.findById(id);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to load user " + id, e);
        }
    }

    public User getOrThrow(String id) {
        return findById(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "User not found"));
    }

    @Transactional
    public void updateName(String id, String name) {
        if (userRepository.updateName(id, name) == 0) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "User not found");
        }
    }

    @Transactional
    public void updatePhoto(String id, String photo) {
        if (userRepository.updatePhoto(id, photo) == 0) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "User not found");
        }
    }

    /**
     * @return false when no such identity exists
     */
    @Transactional
    public boolean setBanned(String id, boolean banned) {
        return userRepository.updateBanned(id, banned) > 0;
    }

    /**
     * Best effort; failures are logged and never reach the caller.
     */
    @Async
    public void touchLastSeen(String id) {
        try {
            userRepository.updateLastSeen(id, Instant.now());
        } catch (Exception e) {
            log.warn("Failed to update last_seen for {}: {}", id, e.getMessage());
        }
    }
}
