package com.taskhub.api.domain.service;

import com.taskhub.api.api.dto.RegistrationRequestDto;
import com.taskhub.api.api.dto.UserResponseDto;
import com.taskhub.api.domain.exception.DuplicateAccountException;
import com.taskhub.api.domain.exception.RequestValidationException;
import com.taskhub.api.domain.validation.FieldErrors;
import com.taskhub.api.infrastructure.entity.UserEntity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("RegistrationService")
class RegistrationServiceTest {

    @Mock
    private UserService userService;

    @Mock
    private AvatarStorageService avatarStorage;

    private RegistrationService registrationService;

    @BeforeEach
    void setUp() {
        registrationService = new RegistrationService(userService, avatarStorage);
    }

    @Test
    @DisplayName("creates the user and returns its public view")
    void registerWithoutAvatar() {
        given(userService.existsByName("alice")).willReturn(false);
        given(userService.existsByEmail("alice@example.com")).willReturn(false);
        given(userService.createUser("alice", "alice@example.com", "secret123", null)).willReturn(saved(null));

        UserResponseDto user = registrationService.register(request(null));

        assertThat(user.getId()).isEqualTo(1L);
        assertThat(user.getEmail()).isEqualTo("alice@example.com");
        assertThat(user.getAvatar()).isNull();
        verify(avatarStorage, never()).store(any());
    }

    @Test
    @DisplayName("stores the avatar and keeps its relative path on the user")
    void registerWithAvatar() {
        MockMultipartFile avatar = new MockMultipartFile("avatar", "me.png", "image/png", new byte[]{1, 2});
        given(avatarStorage.store(avatar)).willReturn("uploads/abc.png");
        given(userService.createUser("alice", "alice@example.com", "secret123", "uploads/abc.png"))
                .willReturn(saved("uploads/abc.png"));

        UserResponseDto user = registrationService.register(request(avatar));

        assertThat(user.getAvatar()).isEqualTo("uploads/abc.png");
    }

    @Test
    @DisplayName("a taken name and email are both reported before anything is written")
    void duplicateNameAndEmail() {
        given(userService.existsByName("alice")).willReturn(true);
        given(userService.existsByEmail("alice@example.com")).willReturn(true);

        assertThatThrownBy(() -> registrationService.register(request(null)))
                .isInstanceOfSatisfying(RequestValidationException.class, e ->
                        assertThat(e.getErrors().asMap()).containsOnlyKeys("name", "email"));
        verify(userService, never()).createUser(anyString(), anyString(), anyString(), any());
    }

    @Test
    @DisplayName("the stored avatar is removed when the insert loses a race")
    void avatarCleanedUpOnConflict() {
        MockMultipartFile avatar = new MockMultipartFile("avatar", "me.png", "image/png", new byte[]{1, 2});
        given(avatarStorage.store(avatar)).willReturn("uploads/abc.png");
        given(userService.createUser("alice", "alice@example.com", "secret123", "uploads/abc.png"))
                .willThrow(new DuplicateAccountException("The email has already been taken.",
                        FieldErrors.of("email", "The email has already been taken."), null));

        assertThatThrownBy(() -> registrationService.register(request(avatar)))
                .isInstanceOf(DuplicateAccountException.class);
        verify(avatarStorage).delete("uploads/abc.png");
    }

    private static RegistrationRequestDto request(MockMultipartFile avatar) {
        RegistrationRequestDto request = new RegistrationRequestDto();
        request.setName("alice");
        request.setEmail("alice@example.com");
        request.setPassword("secret123");
        request.setAvatar(avatar);
        return request;
    }

    private static UserEntity saved(String avatarPath) {
        UserEntity user = new UserEntity();
        user.setId(1L);
        user.setName("alice");
        user.setEmail("alice@example.com");
        user.setAvatarPath(avatarPath);
        user.setCreatedAt(Instant.parse("2026-03-01T12:00:00Z"));
        return user;
    }
}
