package com.therian.chatbackend.auth;

import lombok.Getter;

@Getter
public class AuthException extends RuntimeException {

    private final AuthError error;

    public AuthException(AuthError error, String message) {
        super(message);
        this.error = error;
    }

    public AuthException(AuthError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }
}
