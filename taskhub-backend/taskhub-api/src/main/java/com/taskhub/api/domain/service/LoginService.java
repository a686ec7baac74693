package com.taskhub.api.domain.service;

import com.taskhub.api.api.dto.LoginRequestDto;
import com.taskhub.api.api.dto.LoginResponseDto;
import com.taskhub.api.domain.exception.InvalidCredentialsException;
import com.taskhub.api.domain.model.IssuedToken;
import com.taskhub.api.infrastructure.entity.UserEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import static com.taskhub.api.domain.constants.AuthConstants.INVALID_CREDENTIALS_MESSAGE;
import static com.taskhub.api.domain.constants.AuthConstants.TOKEN_TYPE;

/**
 * Login Service - Exchanges email and password for an opaque bearer token
 *
 * An unknown email and a wrong password fail with the same message after the same amount of
 * hashing work, so the response never reveals whether an account exists.
 */
@Service
@Slf4j
public class LoginService {

    private final UserService userService;
    private final AccessTokenService accessTokenService;

    public LoginService(UserService userService, AccessTokenService accessTokenService) {
        this.userService = userService;
        this.accessTokenService = accessTokenService;
    }

    public LoginResponseDto login(LoginRequestDto request) {
        log.info("[LOGIN_START] Login attempt | email={}", request.getEmail());

        UserEntity user = authenticate(request.getEmail(), request.getPassword());
        IssuedToken token = accessTokenService.issue(user);

        log.info("[LOGIN_SUCCESS] Login completed | userId={} | email={}", user.getId(), user.getEmail());
        return new LoginResponseDto("Login successful", token.plainTextToken(), TOKEN_TYPE, token.expiresAt());
    }

    /**
     * Find the user by email and verify the password against the stored hash.
     *
     * @throws InvalidCredentialsException for an unknown email or a wrong password alike
     */
    public UserEntity authenticate(String email, String password) {
        UserEntity user = userService.findByEmail(email).orElse(null);

        if (user == null) {
            userService.verifyAgainstDummyHash(password);
            log.warn("[LOGIN_FAILED] User not found (timing protected) | email={}", email);
            throw new InvalidCredentialsException(INVALID_CREDENTIALS_MESSAGE);
        }

        if (!userService.verifyPassword(password, user.getPasswordHash())) {
            log.warn("[LOGIN_FAILED] Invalid credentials | email={}", email);
            throw new InvalidCredentialsException(INVALID_CREDENTIALS_MESSAGE);
        }
        return user;
    }
}
