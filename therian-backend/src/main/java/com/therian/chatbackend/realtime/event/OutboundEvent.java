package com.therian.chatbackend.realtime.event;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.therian.chatbackend.chat.dto.ChatMessageDto;

/**
 * Frames the server pushes to a client.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = OutboundEvent.AuthOk.class, name = "auth_ok"),
        @JsonSubTypes.Type(value = OutboundEvent.AuthFailed.class, name = "auth_error"),
        @JsonSubTypes.Type(value = OutboundEvent.Banned.class, name = "banned"),
        @JsonSubTypes.Type(value = OutboundEvent.NewRoomMessage.class, name = "new_message"),
        @JsonSubTypes.Type(value = OutboundEvent.NewDirectMessage.class, name = "new_dm"),
        @JsonSubTypes.Type(value = OutboundEvent.MessageDeleted.class, name = "message_deleted"),
        @JsonSubTypes.Type(value = OutboundEvent.MessageError.class, name = "message_error")
})
public sealed interface OutboundEvent {

    record AuthOk(String userId) implements OutboundEvent {}

    record AuthFailed(String reason) implements OutboundEvent {}

    record Banned(String reason) implements OutboundEvent {}

    record NewRoomMessage(ChatMessageDto message) implements OutboundEvent {}

    record NewDirectMessage(ChatMessageDto message) implements OutboundEvent {}

    record MessageDeleted(long messageId, String roomId) implements OutboundEvent {}

    record MessageError(String reason) implements OutboundEvent {}
}
