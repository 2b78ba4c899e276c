package com.therian.chatbackend.user;

import com.therian.chatbackend.auth.CustomUserDetails;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

@Component
public class CurrentUserService {

    /**
     * Identity id of the authenticated caller, taken from the bearer token principal.
     */
    public String getCurrentUserIdOrThrow() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth == null || !(auth.getPrincipal() instanceof CustomUserDetails details)) {
            throw new IllegalStateException("Unauthenticated");
        }
        return details.getUser().getId();
    }
}
