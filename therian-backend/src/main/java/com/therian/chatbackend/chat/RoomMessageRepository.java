package com.therian.chatbackend.chat;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface RoomMessageRepository extends JpaRepository<RoomMessage, Long> {

    // newest first; callers reverse for display
    @EntityGraph(attributePaths = "author")
    List<RoomMessage> findByRoomIdOrderByIdDesc(String roomId, Pageable pageable);

    @Modifying
    @Query("DELETE FROM RoomMessage m WHERE m.id = :id")
    int deleteRow(@Param("id") Long id);
}
