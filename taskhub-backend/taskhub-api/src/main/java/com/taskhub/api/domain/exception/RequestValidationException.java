package com.taskhub.api.domain.exception;

import com.taskhub.api.domain.validation.FieldErrors;

/**
 * Thrown when a payload fails a rule that needs the store or the query string to evaluate.
 * Mapped to 422 Unprocessable Entity by GlobalExceptionHandler.
 */
public class RequestValidationException extends RuntimeException {

    private final FieldErrors errors;

    public RequestValidationException(FieldErrors errors) {
        super("The given data was invalid.");
        this.errors = errors;
    }

    public FieldErrors getErrors() {
        return errors;
    }
}
