package com.therian.chatbackend.auth;

public enum AuthError {
    INVALID,
    EXPIRED,
    UNKNOWN_IDENTITY,
    BANNED,
    FORBIDDEN
}
