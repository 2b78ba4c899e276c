package com.therian.chatbackend.shared;

/**
 * Input rejected before any side effect: empty or oversized text, malformed
 * direct-channel identifier, self-befriending, invalid profile fields.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
