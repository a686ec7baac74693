package com.taskhub.api.domain.constants;

public final class AuthConstants {

    // Private constructor prevents instantiation
    private AuthConstants() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }

    public static final String HASH_ALGORITHM = "SHA-256";
    public static final int TOKEN_BYTE_LENGTH = 32;
    public static final String TOKEN_NAME = "auth_token";
    public static final String BEARER_PREFIX = "Bearer ";
    public static final String TOKEN_TYPE = "Bearer";

    public static final String DEFAULT_TASK_STATE = "active";

    public static final String INVALID_CREDENTIALS_MESSAGE = "Invalid credentials";

    // Rate limit key prefixes
    public static final String RATE_LIMIT_KEY_PREFIX = "ratelimit:";
    public static final String USER_KEY_PREFIX = "user:";
    public static final String IP_KEY_PREFIX = "ip:";

    public static final String TRACE_ID_HEADER = "X-Trace-Id";
}
