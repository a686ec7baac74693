package com.taskhub.api.domain.service;

import com.taskhub.api.domain.model.AuthenticatedUser;
import com.taskhub.api.domain.utils.BearerTokens;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class LogoutService {

    private final AccessTokenService accessTokenService;

    public LogoutService(AccessTokenService accessTokenService) {
        this.accessTokenService = accessTokenService;
    }

    /**
     * Revoke the token presented with the current request. Other tokens of the user stay valid.
     */
    public void logout(AuthenticatedUser principal, String authHeader) {
        log.info("[LOGOUT_START] Logout initiated | userId={}", principal.id());

        String token = BearerTokens.resolve(authHeader);
        boolean revoked = accessTokenService.revoke(token);

        log.info("[LOGOUT_SUCCESS] Logout completed | userId={} | revoked={}", principal.id(), revoked);
    }
}
