package com.therian.chatbackend.shared;

/**
 * A durable-store round trip failed. Never retried here; the caller decides.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
