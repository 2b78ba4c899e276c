package com.therian.chatbackend.user;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

public interface UserRepository extends JpaRepository<User, String> {

    @Transactional
    @Modifying
    @Query("UPDATE User u SET u.lastSeen = :ts WHERE u.id = :id")
    int updateLastSeen(@Param("id") String id, @Param("ts") Instant ts);

    @Modifying
    @Query("UPDATE User u SET u.banned = :banned WHERE u.id = :id")
    int updateBanned(@Param("id") String id, @Param("banned") boolean banned);

    @Modifying
    @Query("UPDATE User u SET u.name = :name WHERE u.id = :id")
    int updateName(@Param("id") String id, @Param("name") String name);

    @Modifying
    @Query("UPDATE User u SET u.photo = :photo WHERE u.id = :id")
    int updatePhoto(@Param("id") String id, @Param("photo") String photo);
}
