package com.therian.chatbackend.realtime.event;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Frames a client sends over the socket, discriminated by {@code type}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = InboundEvent.Authenticate.class, name = "auth"),
        @JsonSubTypes.Type(value = InboundEvent.JoinRoom.class, name = "join_room"),
        @JsonSubTypes.Type(value = InboundEvent.JoinDirect.class, name = "join_dm"),
        @JsonSubTypes.Type(value = InboundEvent.SendRoomMessage.class, name = "send_message"),
        @JsonSubTypes.Type(value = InboundEvent.SendDirectMessage.class, name = "send_dm")
})
public sealed interface InboundEvent {

    record Authenticate(String token) implements InboundEvent {}

    record JoinRoom(String roomId) implements InboundEvent {}

    record JoinDirect(String chatId) implements InboundEvent {}

    record SendRoomMessage(String roomId, String text) implements InboundEvent {}

    record SendDirectMessage(String chatId, String text) implements InboundEvent {}
}
