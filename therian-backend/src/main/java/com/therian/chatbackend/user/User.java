package com.therian.chatbackend.user;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * An identity, keyed by the identity provider's subject id.
 */
@Entity
@Table(name = "users")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class User {

    @Id
    private String id;

    @Column(nullable = false)
    private String name;

    // base64 data URL or remote URL
    @Column(length = 1048576)
    private String photo;

    private String email;

    @Builder.Default
    @Column(nullable = false)
    private boolean premium = false;

    @Builder.Default
    @Column(nullable = false)
    private boolean banned = false;

    private Instant lastSeen;
}
