package com.taskhub.api.domain.exception;

/**
 * Thrown when an authenticated user acts on a task owned by someone else.
 * Mapped to 403 Forbidden by GlobalExceptionHandler.
 */
public class TaskAccessDeniedException extends RuntimeException {

    public TaskAccessDeniedException(String message) {
        super(message);
    }
}
