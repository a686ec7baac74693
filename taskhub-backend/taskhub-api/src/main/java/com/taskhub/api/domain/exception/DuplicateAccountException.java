package com.taskhub.api.domain.exception;

import com.taskhub.api.domain.validation.FieldErrors;

/**
 * Thrown when the store's unique constraint rejects a name or email that passed the pre-check.
 * Mapped to 409 Conflict by GlobalExceptionHandler.
 */
public class DuplicateAccountException extends RuntimeException {

    private final FieldErrors errors;

    public DuplicateAccountException(String message, FieldErrors errors, Throwable cause) {
        super(message, cause);
        this.errors = errors;
    }

    public FieldErrors getErrors() {
        return errors;
    }
}
