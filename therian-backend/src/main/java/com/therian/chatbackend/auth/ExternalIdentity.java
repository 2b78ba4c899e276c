package com.therian.chatbackend.auth;

/**
 * Verified subject returned by the identity provider.
 */
public record ExternalIdentity(
        String subject,
        String name,
        String picture,
        String email
) {}
