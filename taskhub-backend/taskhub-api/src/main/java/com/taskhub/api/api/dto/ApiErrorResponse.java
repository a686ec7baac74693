package com.taskhub.api.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Unified error response for all API errors.
 * Used by GlobalExceptionHandler for consistent error structure.
 *
 * Example:
 * {
 *   "error": "VALIDATION_ERROR",
 *   "message": "The email has already been taken.",
 *   "trace_id": "abc-123",
 *   "timestamp": "2026-01-11T18:30:00Z",
 *   "errors": {"email": ["The email has already been taken."]}
 * }
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiErrorResponse {

    private final String error;       // Machine-readable error code
    private final String message;     // Human-readable error message
    private final String traceId;     // Trace ID for distributed tracing
    private final Instant timestamp;  // When the error occurred
    private Map<String, List<String>> errors;  // Field-keyed messages (422 / 409 only)
    private Long retryAfter;          // Seconds until the client may retry (429 only)

    public ApiErrorResponse(String error, String message, String traceId) {
        this.error = error;
        this.message = message;
        this.traceId = traceId;
        this.timestamp = Instant.now();
    }

    public ApiErrorResponse withErrors(Map<String, List<String>> errors) {
        this.errors = errors;
        return this;
    }

    public ApiErrorResponse withRetryAfter(long retryAfter) {
        this.retryAfter = retryAfter;
        return this;
    }

    // Getters
    public String getError() {
        return error;
    }

    public String getMessage() {
        return message;
    }

    public String getTraceId() {
        return traceId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Map<String, List<String>> getErrors() {
        return errors;
    }

    public Long getRetryAfter() {
        return retryAfter;
    }
}
