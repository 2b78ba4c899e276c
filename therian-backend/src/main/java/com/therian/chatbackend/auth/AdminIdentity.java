package com.therian.chatbackend.auth;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * The single configured administrator identity.
 */
@Component
public class AdminIdentity {

    private final String adminId;

    public AdminIdentity(@Value("${therian.admin.identity-id:}") String adminId) {
        this.adminId = adminId;
    }

    public boolean isAdmin(String identityId) {
        return identityId != null && !adminId.isBlank() && adminId.equals(identityId);
    }

    public void requireAdmin(String identityId) {
        if (!isAdmin(identityId)) {
            throw new AuthException(AuthError.FORBIDDEN, "Admin only");
        }
    }
}
