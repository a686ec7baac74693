package com.taskhub.api.domain.model;

import java.time.Instant;

/**
 * A freshly issued token. The plaintext exists only in this object and is never persisted.
 */
public record IssuedToken(String plainTextToken, Instant expiresAt) {
}
