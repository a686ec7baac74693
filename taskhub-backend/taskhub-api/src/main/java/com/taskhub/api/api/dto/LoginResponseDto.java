package com.taskhub.api.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

public class LoginResponseDto {

    private final String message;
    private final String accessToken;   // Plaintext token, only ever returned here
    private final String tokenType;     // Bearer
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private final Instant expiresAt;    // Null when tokens live until logout

    public LoginResponseDto(String message, String accessToken, String tokenType, Instant expiresAt) {
        this.message = message;
        this.accessToken = accessToken;
        this.tokenType = tokenType;
        this.expiresAt = expiresAt;
    }

    // Getters
    public String getMessage() {
        return message;
    }

    public String getAccessToken() {
        return accessToken;
    }

    public String getTokenType() {
        return tokenType;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }
}
