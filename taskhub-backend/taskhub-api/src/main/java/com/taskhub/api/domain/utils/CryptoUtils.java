package com.taskhub.api.domain.utils;

import com.taskhub.api.domain.constants.AuthConstants;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;

@Component
public class CryptoUtils {

    private final SecureRandom secureRandom;

    public CryptoUtils(SecureRandom secureRandom) {
        this.secureRandom = secureRandom;
    }

    /**
     * Generate URL-safe random string from the given number of bytes
     */
    public String randomUrlSafe(int byteLength) {
        byte[] randomBytes = new byte[byteLength];
        secureRandom.nextBytes(randomBytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(randomBytes);
    }

    /**
     * Hash value to Hex (for Tokens)
     */
    public String hashToHex(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance(AuthConstants.HASH_ALGORITHM);
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Constant-time comparison to prevent timing attacks
     */
    public boolean slowEquals(String providedHash, String storedHash) {
        if (providedHash == null || storedHash == null) {
            return false;
        }
        return MessageDigest.isEqual(
            providedHash.getBytes(StandardCharsets.UTF_8),
            storedHash.getBytes(StandardCharsets.UTF_8)
        );
    }
}
