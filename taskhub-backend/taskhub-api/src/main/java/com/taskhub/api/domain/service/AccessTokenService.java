package com.taskhub.api.domain.service;

import com.taskhub.api.config.TaskHubProperties;
import com.taskhub.api.domain.constants.AuthConstants;
import com.taskhub.api.domain.model.AuthenticatedUser;
import com.taskhub.api.domain.model.IssuedToken;
import com.taskhub.api.domain.utils.CryptoUtils;
import com.taskhub.api.infrastructure.entity.AccessTokenEntity;
import com.taskhub.api.infrastructure.entity.UserEntity;
import com.taskhub.api.infrastructure.repository.AccessTokenRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Access Token Service - Token issuance, validation and revocation
 * Uses 256-bit random opaque tokens with SHA-256 hashing for storage
 *
 * Lifecycle: Issued -> Valid -> Revoked (terminal). When a TTL is configured a token
 * also stops validating once it passes its expiry, and the cleanup job deletes it.
 */
@Service
@Slf4j
public class AccessTokenService {

    private final AccessTokenRepository tokenRepository;
    private final CryptoUtils cryptoUtils;
    private final TaskHubProperties properties;
    private final Clock clock;

    public AccessTokenService(AccessTokenRepository tokenRepository,
                              CryptoUtils cryptoUtils,
                              TaskHubProperties properties,
                              Clock clock) {
        this.tokenRepository = tokenRepository;
        this.cryptoUtils = cryptoUtils;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Issue a new token for the user. Only the hash is stored; the plaintext is returned once.
     */
    @Transactional
    public IssuedToken issue(UserEntity user) {
        String rawToken = cryptoUtils.randomUrlSafe(AuthConstants.TOKEN_BYTE_LENGTH);
        Instant now = clock.instant();
        Duration ttl = properties.getAuth().getTokenTtl();
        Instant expiresAt = ttl != null ? now.plus(ttl) : null;

        AccessTokenEntity token = new AccessTokenEntity();
        token.setTokenHash(hashToken(rawToken));
        token.setUser(user);
        token.setName(AuthConstants.TOKEN_NAME);
        token.setCreatedAt(now);
        token.setExpiresAt(expiresAt);

        AccessTokenEntity saved = tokenRepository.save(token);
        log.info("[TOKEN_ISSUED] Access token issued | userId={} | tokenId={} | expiresAt={}",
                user.getId(), saved.getId(), expiresAt);
        return new IssuedToken(rawToken, expiresAt);
    }

    /**
     * Resolve a raw token to its live user. Unknown, revoked and expired tokens resolve to empty.
     */
    @Transactional(readOnly = true)
    public Optional<AuthenticatedUser> validate(String rawToken) {
        if (rawToken == null || rawToken.isBlank()) {
            return Optional.empty();
        }

        String tokenHash = hashToken(rawToken);
        Optional<AccessTokenEntity> found = tokenRepository.findWithUserByTokenHash(tokenHash);
        if (found.isEmpty()) {
            log.debug("[TOKEN_INVALID] Token not found | tokenHash={}", abbreviate(tokenHash));
            return Optional.empty();
        }

        AccessTokenEntity token = found.get();
        if (!cryptoUtils.slowEquals(tokenHash, token.getTokenHash())) {
            return Optional.empty();
        }
        if (token.isExpiredAt(clock.instant())) {
            log.debug("[TOKEN_EXPIRED] Token has expired | tokenId={} | expiredAt={}",
                    token.getId(), token.getExpiresAt());
            return Optional.empty();
        }

        UserEntity user = token.getUser();
        return Optional.of(new AuthenticatedUser(user.getId(), user.getEmail()));
    }

    /**
     * Revoke a token. Revoking an unknown or already revoked token is a no-op.
     *
     * @return true if a token was removed
     */
    @Transactional
    public boolean revoke(String rawToken) {
        if (rawToken == null || rawToken.isBlank()) {
            return false;
        }
        String tokenHash = hashToken(rawToken);
        int deleted = tokenRepository.deleteByTokenHash(tokenHash);
        log.info("[TOKEN_REVOKED] Token revocation processed | tokenHash={} | removed={}",
                abbreviate(tokenHash), deleted > 0);
        return deleted > 0;
    }

    /**
     * Revoke every token of the user except the one presented with the current request.
     */
    @Transactional
    public int revokeOtherTokens(Long userId, String currentRawToken) {
        int deleted = tokenRepository.deleteOtherTokens(userId, hashToken(currentRawToken));
        log.info("[TOKENS_REVOKED] Other sessions revoked | userId={} | count={}", userId, deleted);
        return deleted;
    }

    /**
     * Cleanup expired tokens (scheduled task). Does nothing while tokens live until logout.
     */
    @Scheduled(fixedDelayString = "${taskhub.auth.token-cleanup-interval:PT1H}")
    @Transactional
    public void purgeExpiredTokens() {
        if (properties.getAuth().getTokenTtl() == null) {
            return;
        }
        Instant now = clock.instant();
        int deleted = tokenRepository.deleteExpiredTokens(now);
        log.info("[TOKEN_CLEANUP_DONE] Expired tokens cleaned up | cutoffTime={} | deleted={}", now, deleted);
    }

    /**
     * Hashes a raw token for storage and lookup.
     * SHA-256 suffices because high entropy tokens don't require salting/work factors like passwords.
     */
    String hashToken(String rawToken) {
        if (rawToken == null || rawToken.isBlank()) {
            throw new IllegalArgumentException("Raw token cannot be null or empty");
        }
        return cryptoUtils.hashToHex(rawToken);
    }

    private static String abbreviate(String tokenHash) {
        return tokenHash.substring(0, 8) + "...";
    }
}
