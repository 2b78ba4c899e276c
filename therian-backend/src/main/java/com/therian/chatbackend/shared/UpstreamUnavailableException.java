package com.therian.chatbackend.shared;

/**
 * An external service could not be reached or answered with a server error.
 * The request itself may be fine; retrying later can succeed.
 */
public class UpstreamUnavailableException extends RuntimeException {

    public UpstreamUnavailableException(String message) {
        super(message);
    }

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
