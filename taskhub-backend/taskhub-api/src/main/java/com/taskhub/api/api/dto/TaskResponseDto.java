package com.taskhub.api.api.dto;

import com.taskhub.api.infrastructure.entity.TaskEntity;

import java.time.Instant;

public class TaskResponseDto {

    private final Long id;
    private final String name;
    private final String state;
    private final Long userId;
    private final Instant createdAt;
    private final Instant updatedAt;

    public TaskResponseDto(Long id, String name, String state, Long userId, Instant createdAt, Instant updatedAt) {
        this.id = id;
        this.name = name;
        this.state = state;
        this.userId = userId;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public static TaskResponseDto from(TaskEntity task) {
        return new TaskResponseDto(task.getId(), task.getName(), task.getState(),
                task.getOwnerId(), task.getCreatedAt(), task.getUpdatedAt());
    }

    public Long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getState() {
        return state;
    }

    public Long getUserId() {
        return userId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
