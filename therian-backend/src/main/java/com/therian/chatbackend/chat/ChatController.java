package com.therian.chatbackend.chat;

import com.therian.chatbackend.chat.dto.ChatMessageDto;
import com.therian.chatbackend.user.CurrentUserService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
public class ChatController {

    private final MessageStore messageStore;
    private final CurrentUserService currentUserService;

    @GetMapping("/api/rooms/{roomId}/messages")
    public List<ChatMessageDto> roomMessages(@PathVariable String roomId) {
        return messageStore.roomHistory(roomId);
    }

    @GetMapping("/api/dms/{chatId}/messages")
    public List<ChatMessageDto> directMessages(@PathVariable String chatId) {
        return messageStore.directHistory(currentUserService.getCurrentUserIdOrThrow(), chatId);
    }
}
