package com.therian.chatbackend.chat;

import com.therian.chatbackend.chat.dto.ChatMessageDto;
import com.therian.chatbackend.shared.StorageException;
import com.therian.chatbackend.user.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Append-only room and direct-channel logs. The store assigns ids and
 * timestamps; store failures surface as {@link StorageException}.
 */
@Slf4j
@Service
public class MessageStore {

    private final RoomMessageRepository roomMessageRepository;
    private final DirectMessageRepository directMessageRepository;
    private final UserRepository userRepository;
    private final int historyLimit;

    public MessageStore(
            RoomMessageRepository roomMessageRepository,
            DirectMessageRepository directMessageRepository,
            UserRepository userRepository,
            @Value("${therian.chat.history-limit:80}") int historyLimit
    ) {
        this.roomMessageRepository = roomMessageRepository;
        this.directMessageRepository = directMessageRepository;
        this.userRepository = userRepository;
        this.historyLimit = historyLimit;
    }

    @Transactional
    public StoredMessage appendRoomMessage(String roomId, String authorId, String text) {
        try {
            RoomMessage message = new RoomMessage();
            message.setRoomId(roomId);
            fill(message, authorId, text);
            return StoredMessage.of(roomMessageRepository.saveAndFlush(message));
        } catch (DataAccessException e) {
            throw new StorageException("Failed to store message for room " + roomId, e);
        }
    }

    @Transactional
    public StoredMessage appendDirectMessage(DirectChannelName chat, String authorId, String text) {
        try {
            DirectMessage message = new DirectMessage();
            message.setChatId(chat.value());
            fill(message, authorId, text);
            return StoredMessage.of(directMessageRepository.saveAndFlush(message));
        } catch (DataAccessException e) {
            throw new StorageException("Failed to store direct message for " + chat, e);
        }
    }

    /**
     * Last messages of the room, oldest first.
     */
    @Transactional(readOnly = true)
    public List<ChatMessageDto> roomHistory(String roomId) {
        try {
            return ascending(roomMessageRepository.findByRoomIdOrderByIdDesc(roomId, PageRequest.of(0, historyLimit)));
        } catch (DataAccessException e) {
            throw new StorageException("Failed to load history for room " + roomId, e);
        }
    }

    /**
     * @throws ChannelAccessException when the requester is not one of the two participants
     */
    @Transactional(readOnly = true)
    public List<ChatMessageDto> directHistory(String requesterId, String rawChatId) {
        DirectChannelName chat = DirectChannelName.parse(rawChatId);
        if (!chat.includes(requesterId)) {
            throw new ChannelAccessException("Access denied");
        }
        try {
            return ascending(directMessageRepository.findByChatIdOrderByIdDesc(chat.value(), PageRequest.of(0, historyLimit)));
        } catch (DataAccessException e) {
            throw new StorageException("Failed to load history for " + chat, e);
        }
    }

    /**
     * @return the removed message, empty when no row was deleted
     */
    @Transactional
    public Optional<StoredMessage> deleteRoomMessage(long messageId) {
        try {
            Optional<StoredMessage> existing = roomMessageRepository.findById(messageId).map(StoredMessage::of);
            if (existing.isEmpty() || roomMessageRepository.deleteRow(messageId) == 0) {
                return Optional.empty();
            }
            return existing;
        } catch (DataAccessException e) {
            throw new StorageException("Failed to delete message " + messageId, e);
        }
    }

    private void fill(ChatMessage message, String authorId, String text) {
        message.setAuthor(userRepository.getReferenceById(authorId));
        message.setText(text);
        message.setCreatedAt(Instant.now());
    }

    private static List<ChatMessageDto> ascending(List<? extends ChatMessage> newestFirst) {
        List<ChatMessageDto> out = new ArrayList<>(newestFirst.size());
        for (ChatMessage m : newestFirst) {
            out.add(ChatMessageDto.from(m));
        }
        Collections.reverse(out);
        return out;
    }
}
