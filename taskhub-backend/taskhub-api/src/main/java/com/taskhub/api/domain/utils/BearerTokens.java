package com.taskhub.api.domain.utils;

import static com.taskhub.api.domain.constants.AuthConstants.BEARER_PREFIX;

public final class BearerTokens {

    private BearerTokens() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }

    /**
     * Extract the token from an {@code Authorization: Bearer <token>} header value.
     *
     * @return the raw token, or null if the header is missing, uses another scheme or is empty
     */
    public static String resolve(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.length() <= BEARER_PREFIX.length()
                || !authorizationHeader.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }
}
