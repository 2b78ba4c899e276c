package com.therian.chatbackend.auth;

import com.therian.chatbackend.auth.dto.GoogleLoginRequest;
import com.therian.chatbackend.auth.dto.LoginResponse;
import com.therian.chatbackend.user.User;
import com.therian.chatbackend.user.UserService;
import com.therian.chatbackend.user.dto.UserProfileDto;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    private final CredentialVerifier credentialVerifier;
    private final UserService userService;
    private final JwtService jwtService;

    /**
     * Exchanges a Google id_token for a session token valid for 30 days.
     */
    @PostMapping("/google")
    public LoginResponse google(@Valid @RequestBody GoogleLoginRequest request) {
        ExternalIdentity identity = credentialVerifier.verify(request.idToken());
        User user = userService.upsertFromExternal(identity);

        if (user.isBanned()) {
            throw new AuthException(AuthError.BANNED, "This account has been banned.");
        }

        log.info("Login for identity {}", user.getId());
        return new LoginResponse(jwtService.issue(user.getId()), UserProfileDto.from(user));
    }
}
