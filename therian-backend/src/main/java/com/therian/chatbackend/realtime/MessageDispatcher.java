package com.therian.chatbackend.realtime;

import com.therian.chatbackend.chat.ChannelId;
import com.therian.chatbackend.chat.ChatMessage;
import com.therian.chatbackend.chat.DirectChannelName;
import com.therian.chatbackend.chat.MessageStore;
import com.therian.chatbackend.chat.StoredMessage;
import com.therian.chatbackend.chat.dto.ChatMessageDto;
import com.therian.chatbackend.realtime.event.OutboundEvent;
import com.therian.chatbackend.shared.StorageException;
import com.therian.chatbackend.shared.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Validate, persist, then fan out. A message is broadcast only after the store
 * acknowledged it, with the id and timestamp the store assigned, to the members
 * of the channel at that moment. Work for one channel is serialised so that
 * delivery order follows id order.
 */
@Slf4j
@Service
public class MessageDispatcher {

    private static final int LOCK_STRIPES = 64;

    private final MessageStore messageStore;
    private final ChannelMembershipManager membershipManager;
    private final Object[] channelLocks = new Object[LOCK_STRIPES];

    public MessageDispatcher(MessageStore messageStore, ChannelMembershipManager membershipManager) {
        this.messageStore = messageStore;
        this.membershipManager = membershipManager;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            channelLocks[i] = new Object();
        }
    }

    /**
     * @return the broadcast message, empty when the send was dropped or not persisted
     */
    public Optional<ChatMessageDto> sendRoomMessage(ChatSession session, String roomId, String text) {
        if (!isSendable(session, text) || roomId == null || roomId.isBlank()) {
            return Optional.empty();
        }
        ChannelId channel = ChannelId.room(roomId);
        if (!membershipManager.isMember(session.getConnection(), channel)) {
            log.debug("Dropping message from {} to {}: not a member", session.getIdentityId(), channel);
            return Optional.empty();
        }
        String body = text.trim();
        return dispatch(session, channel,
                () -> messageStore.appendRoomMessage(roomId, session.getIdentityId(), body),
                OutboundEvent.NewRoomMessage::new);
    }

    /**
     * Participation is checked against the channel name itself, so the sender
     * need not have joined the channel first.
     */
    public Optional<ChatMessageDto> sendDirectMessage(ChatSession session, String channelId, String text) {
        if (!isSendable(session, text)) {
            return Optional.empty();
        }
        DirectChannelName name;
        try {
            name = DirectChannelName.parse(channelId);
        } catch (ValidationException e) {
            log.debug("Dropping direct message from {}: {}", session.getIdentityId(), e.getMessage());
            return Optional.empty();
        }
        if (!name.includes(session.getIdentityId())) {
            log.debug("Dropping direct message from {} to foreign channel {}", session.getIdentityId(), name);
            return Optional.empty();
        }
        String body = text.trim();
        return dispatch(session, ChannelId.direct(name),
                () -> messageStore.appendDirectMessage(name, session.getIdentityId(), body),
                OutboundEvent.NewDirectMessage::new);
    }

    /**
     * Delivers an event to the channel's current members, ordered with sends to the same channel.
     *
     * @return number of connections the event was handed to
     */
    public int broadcast(ChannelId channel, OutboundEvent event) {
        synchronized (lockFor(channel)) {
            return fanOut(channel, event);
        }
    }

    private Optional<ChatMessageDto> dispatch(ChatSession session,
                                              ChannelId channel,
                                              Supplier<StoredMessage> persist,
                                              Function<ChatMessageDto, OutboundEvent> toEvent) {
        synchronized (lockFor(channel)) {
            StoredMessage stored;
            try {
                stored = persist.get();
            } catch (StorageException e) {
                log.error("Message from {} to {} not stored", session.getIdentityId(), channel, e);
                session.getConnection().send(new OutboundEvent.MessageError("Message could not be delivered"));
                return Optional.empty();
            }

            ChatMessageDto message = new ChatMessageDto(
                    stored.id(),
                    channel.name(),
                    session.getIdentityId(),
                    session.getName(),
                    session.getPhoto(),
                    session.isPremium(),
                    stored.text(),
                    stored.createdAt()
            );
            fanOut(channel, toEvent.apply(message));
            return Optional.of(message);
        }
    }

    private int fanOut(ChannelId channel, OutboundEvent event) {
        Set<ClientConnection> members = membershipManager.membersOf(channel);
        for (ClientConnection member : members) {
            member.send(event);
        }
        return members.size();
    }

    private boolean isSendable(ChatSession session, String text) {
        if (!session.isActive()) {
            return false;
        }
        if (text == null || text.trim().isEmpty() || text.length() > ChatMessage.MAX_TEXT_LENGTH) {
            log.debug("Dropping invalid text from {}", session.getIdentityId());
            return false;
        }
        return true;
    }

    private Object lockFor(ChannelId channel) {
        return channelLocks[Math.floorMod(channel.hashCode(), LOCK_STRIPES)];
    }
}
