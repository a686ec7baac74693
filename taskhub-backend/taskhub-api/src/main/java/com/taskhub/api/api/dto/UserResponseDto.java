package com.taskhub.api.api.dto;

import com.taskhub.api.infrastructure.entity.UserEntity;

import java.time.Instant;

/**
 * Public view of a user. The password hash has no counterpart here.
 */
public class UserResponseDto {

    private final Long id;
    private final String name;
    private final String email;
    private final String avatar;
    private final Instant createdAt;

    public UserResponseDto(Long id, String name, String email, String avatar, Instant createdAt) {
        this.id = id;
        this.name = name;
        this.email = email;
        this.avatar = avatar;
        this.createdAt = createdAt;
    }

    public static UserResponseDto from(UserEntity user) {
        return new UserResponseDto(user.getId(), user.getName(), user.getEmail(),
                user.getAvatarPath(), user.getCreatedAt());
    }

    public Long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getEmail() {
        return email;
    }

    public String getAvatar() {
        return avatar;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
