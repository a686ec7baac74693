package com.taskhub.api.infrastructure.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

@Entity
@Table(name = "users", uniqueConstraints = {
        @UniqueConstraint(name = UserEntity.NAME_CONSTRAINT, columnNames = "name"),
        @UniqueConstraint(name = UserEntity.EMAIL_CONSTRAINT, columnNames = "email")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UserEntity {

    public static final String NAME_CONSTRAINT = "uk_users_name";
    public static final String EMAIL_CONSTRAINT = "uk_users_email";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    // Stored lower-cased
    @Column(nullable = false)
    private String email;

    @ToString.Exclude
    @Column(name = "password_hash", nullable = false)
    private String passwordHash;

    @Column(name = "avatar_path")
    private String avatarPath;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    @Version
    private int version;

}
