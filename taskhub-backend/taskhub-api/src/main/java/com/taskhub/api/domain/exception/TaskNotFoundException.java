package com.taskhub.api.domain.exception;

/**
 * Thrown when no task exists with the requested id.
 * Mapped to 404 Not Found by GlobalExceptionHandler.
 */
public class TaskNotFoundException extends RuntimeException {

    public TaskNotFoundException(Long taskId) {
        super("Task not found: " + taskId);
    }
}
