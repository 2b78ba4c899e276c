package com.therian.chatbackend.chat;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface DirectMessageRepository extends JpaRepository<DirectMessage, Long> {

    @EntityGraph(attributePaths = "author")
    List<DirectMessage> findByChatIdOrderByIdDesc(String chatId, Pageable pageable);
}
