package com.taskhub.api.domain.exception;

import com.taskhub.api.api.dto.ApiErrorResponse;
import com.taskhub.api.config.TaskHubProperties;
import com.taskhub.api.domain.validation.FieldErrors;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.validation.BindException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import static com.taskhub.api.domain.constants.AuthConstants.TRACE_ID_HEADER;

/**
 * Global exception handler for all REST controllers and for failures raised in the security filters.
 * Maps exceptions to consistent ApiErrorResponse with proper HTTP status codes.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private final long maxAvatarKilobytes;

    public GlobalExceptionHandler(TaskHubProperties properties) {
        this.maxAvatarKilobytes = properties.getStorage().getMaxAvatarSize().toKilobytes();
    }

    /**
     * Handle validation errors from @Valid annotations on bodies and form models
     * Returns 422 Unprocessable Entity with every failed rule per field
     */
    @ExceptionHandler(BindException.class)
    public ResponseEntity<ApiErrorResponse> handleValidation(
            BindException ex,
            HttpServletRequest request) {

        return validationError(FieldErrors.from(ex.getBindingResult()), request);
    }

    /**
     * Handle validation errors that need the store or the query string
     * Returns 422 Unprocessable Entity
     */
    @ExceptionHandler(RequestValidationException.class)
    public ResponseEntity<ApiErrorResponse> handleRequestValidation(
            RequestValidationException ex,
            HttpServletRequest request) {

        return validationError(ex.getErrors(), request);
    }

    /**
     * Handle uploads the multipart resolver refused before binding
     * Returns 422 Unprocessable Entity
     */
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ApiErrorResponse> handleUploadTooLarge(
            MaxUploadSizeExceededException ex,
            HttpServletRequest request) {

        return validationError(FieldErrors.of("avatar",
                "The avatar field must not be greater than " + maxAvatarKilobytes + " kilobytes."), request);
    }

    /**
     * Handle path or query values of the wrong type
     * Returns 422 Unprocessable Entity
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex,
            HttpServletRequest request) {

        return validationError(FieldErrors.of(ex.getName(),
                "The " + ex.getName() + " field has an invalid value."), request);
    }

    /**
     * Handle bodies that are not valid JSON
     * Returns 400 Bad Request
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadable(
            HttpMessageNotReadableException ex,
            HttpServletRequest request) {

        log.debug("[MALFORMED_REQUEST] Body could not be read | path={} | error={}",
                request.getRequestURI(), ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST", "Malformed request body.", request);
    }

    /**
     * Handle invalid login credentials
     * Returns 401 Unauthorized
     */
    @ExceptionHandler(InvalidCredentialsException.class)
    public ResponseEntity<ApiErrorResponse> handleInvalidCredentials(
            InvalidCredentialsException ex,
            HttpServletRequest request) {

        return error(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS", ex.getMessage(), request);
    }

    /**
     * Handle missing, revoked or expired bearer tokens on protected routes
     * Returns 401 Unauthorized
     */
    @ExceptionHandler(AuthenticationException.class)
    public ResponseEntity<ApiErrorResponse> handleUnauthenticated(
            AuthenticationException ex,
            HttpServletRequest request) {

        log.debug("[UNAUTHENTICATED] Protected route without a valid token | path={}", request.getRequestURI());
        return error(HttpStatus.UNAUTHORIZED, "UNAUTHENTICATED", "Unauthenticated.", request);
    }

    /**
     * Handle actions on another user's task
     * Returns 403 Forbidden
     */
    @ExceptionHandler(TaskAccessDeniedException.class)
    public ResponseEntity<ApiErrorResponse> handleAccessDenied(
            TaskAccessDeniedException ex,
            HttpServletRequest request) {

        return error(HttpStatus.FORBIDDEN, "FORBIDDEN", ex.getMessage(), request);
    }

    /**
     * Handle unknown task or user ids
     * Returns 404 Not Found
     */
    @ExceptionHandler({TaskNotFoundException.class, UserNotFoundException.class})
    public ResponseEntity<ApiErrorResponse> handleNotFound(
            RuntimeException ex,
            HttpServletRequest request) {

        return error(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage(), request);
    }

    /**
     * Handle unmapped routes
     * Returns 404 Not Found
     */
    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiErrorResponse> handleNoRoute(
            NoResourceFoundException ex,
            HttpServletRequest request) {

        return error(HttpStatus.NOT_FOUND, "NOT_FOUND", "Not Found", request);
    }

    /**
     * Handle a known route called with the wrong verb
     * Returns 405 Method Not Allowed
     */
    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiErrorResponse> handleMethodNotAllowed(
            HttpRequestMethodNotSupportedException ex,
            HttpServletRequest request) {

        return error(HttpStatus.METHOD_NOT_ALLOWED, "METHOD_NOT_ALLOWED", ex.getMessage(), request);
    }

    /**
     * Handle bodies in a content type no endpoint variant accepts
     * Returns 415 Unsupported Media Type
     */
    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ApiErrorResponse> handleMediaType(
            HttpMediaTypeNotSupportedException ex,
            HttpServletRequest request) {

        return error(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "UNSUPPORTED_MEDIA_TYPE", ex.getMessage(), request);
    }

    /**
     * Handle name or email collisions caught by the unique constraints
     * Returns 409 Conflict
     */
    @ExceptionHandler(DuplicateAccountException.class)
    public ResponseEntity<ApiErrorResponse> handleDuplicateAccount(
            DuplicateAccountException ex,
            HttpServletRequest request) {

        ApiErrorResponse error = new ApiErrorResponse(
                "CONFLICT",
                ex.getMessage(),
                request.getHeader(TRACE_ID_HEADER)
        ).withErrors(ex.getErrors().asMap());

        return ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(error);
    }

    /**
     * Handle exhausted rate limit windows
     * Returns 429 Too Many Requests with Retry-After header
     */
    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ApiErrorResponse> handleRateLimited(
            RateLimitExceededException ex,
            HttpServletRequest request) {

        ApiErrorResponse error = new ApiErrorResponse(
                "RATE_LIMIT_EXCEEDED",
                ex.getMessage(),
                request.getHeader(TRACE_ID_HEADER)
        ).withRetryAfter(ex.getRetryAfterSeconds());

        return ResponseEntity
                .status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()))
                .header("X-RateLimit-Limit", String.valueOf(ex.getLimit()))
                .header("X-RateLimit-Remaining", "0")
                .body(error);
    }

    /**
     * Handle a counter store outage when the limiter is configured to fail closed
     * Returns 503 Service Unavailable
     */
    @ExceptionHandler(RateLimiterUnavailableException.class)
    public ResponseEntity<ApiErrorResponse> handleLimiterUnavailable(
            RateLimiterUnavailableException ex,
            HttpServletRequest request) {

        return error(HttpStatus.SERVICE_UNAVAILABLE, "SERVICE_UNAVAILABLE",
                "Service temporarily unavailable. Please try again later.", request);
    }

    /**
     * Handle all other unexpected exceptions
     * Returns 500 Internal Server Error
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleGeneric(
            Exception ex,
            HttpServletRequest request) {

        log.error("[UNHANDLED_ERROR] Request failed | method={} | path={}",
                request.getMethod(), request.getRequestURI(), ex);

        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR",
                "Something went wrong. Please try again later.", request);
    }

    private ResponseEntity<ApiErrorResponse> validationError(FieldErrors errors, HttpServletRequest request) {
        log.debug("[VALIDATION_FAILED] Request rejected | path={} | errors={}", request.getRequestURI(), errors);

        ApiErrorResponse error = new ApiErrorResponse(
                "VALIDATION_ERROR",
                errors.firstMessage(),
                request.getHeader(TRACE_ID_HEADER)
        ).withErrors(errors.asMap());

        return ResponseEntity
                .status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(error);
    }

    private ResponseEntity<ApiErrorResponse> error(HttpStatus status, String code, String message,
                                                   HttpServletRequest request) {
        ApiErrorResponse error = new ApiErrorResponse(code, message, request.getHeader(TRACE_ID_HEADER));
        return ResponseEntity
                .status(status)
                .body(error);
    }
}
