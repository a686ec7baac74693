package com.taskhub.api.domain.exception;

/**
 * Thrown when an uploaded avatar cannot be written to disk.
 * Mapped to 500 Internal Server Error by GlobalExceptionHandler.
 */
public class AvatarStorageException extends RuntimeException {

    public AvatarStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
