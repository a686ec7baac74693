package com.taskhub.api.domain.service;

import com.taskhub.api.api.dto.LoginRequestDto;
import com.taskhub.api.api.dto.LoginResponseDto;
import com.taskhub.api.domain.exception.InvalidCredentialsException;
import com.taskhub.api.domain.model.IssuedToken;
import com.taskhub.api.infrastructure.entity.UserEntity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("LoginService")
class LoginServiceTest {

    @Mock
    private UserService userService;

    @Mock
    private AccessTokenService accessTokenService;

    private LoginService loginService;

    @BeforeEach
    void setUp() {
        loginService = new LoginService(userService, accessTokenService);
    }

    @Test
    @DisplayName("valid credentials return a bearer token")
    void loginSuccess() {
        UserEntity user = user();
        given(userService.findByEmail("alice@example.com")).willReturn(Optional.of(user));
        given(userService.verifyPassword("secret123", "$2a$hash")).willReturn(true);
        given(accessTokenService.issue(user)).willReturn(new IssuedToken("plain-token", null));

        LoginResponseDto response = loginService.login(new LoginRequestDto("alice@example.com", "secret123"));

        assertThat(response.getMessage()).isEqualTo("Login successful");
        assertThat(response.getAccessToken()).isEqualTo("plain-token");
        assertThat(response.getTokenType()).isEqualTo("Bearer");
    }

    @Test
    @DisplayName("a wrong password fails with the generic message and issues nothing")
    void wrongPassword() {
        given(userService.findByEmail("alice@example.com")).willReturn(Optional.of(user()));
        given(userService.verifyPassword("wrong", "$2a$hash")).willReturn(false);

        assertThatThrownBy(() -> loginService.login(new LoginRequestDto("alice@example.com", "wrong")))
                .isInstanceOf(InvalidCredentialsException.class)
                .hasMessage("Invalid credentials");
        verify(accessTokenService, never()).issue(any());
    }

    @Test
    @DisplayName("an unknown email fails the same way after a dummy hash check")
    void unknownEmail() {
        given(userService.findByEmail("ghost@example.com")).willReturn(Optional.empty());

        assertThatThrownBy(() -> loginService.login(new LoginRequestDto("ghost@example.com", "whatever")))
                .isInstanceOf(InvalidCredentialsException.class)
                .hasMessage("Invalid credentials");
        verify(userService).verifyAgainstDummyHash("whatever");
        verify(accessTokenService, never()).issue(any());
    }

    private static UserEntity user() {
        UserEntity user = new UserEntity();
        user.setId(1L);
        user.setEmail("alice@example.com");
        user.setPasswordHash("$2a$hash");
        return user;
    }
}
