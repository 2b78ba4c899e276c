package com.therian.chatbackend.chat;

/**
 * The caller is not a participant of the channel it addressed.
 */
public class ChannelAccessException extends RuntimeException {

    public ChannelAccessException(String message) {
        super(message);
    }
}
