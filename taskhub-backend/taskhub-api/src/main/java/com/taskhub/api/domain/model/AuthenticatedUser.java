package com.taskhub.api.domain.model;

/**
 * Principal resolved from a bearer token. Passed explicitly into every service call.
 */
public record AuthenticatedUser(Long id, String email) {
}
