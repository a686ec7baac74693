package com.taskhub.api.domain.exception;

/**
 * Thrown when the user behind a valid principal no longer exists.
 * Mapped to 404 Not Found by GlobalExceptionHandler.
 */
public class UserNotFoundException extends RuntimeException {

    public UserNotFoundException(Long userId) {
        super("User not found: " + userId);
    }
}
