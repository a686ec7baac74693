package com.taskhub.api.api.controller;

import com.taskhub.api.api.dto.DataResponseDto;
import com.taskhub.api.api.dto.MessageResponseDto;
import com.taskhub.api.api.dto.UpdatePasswordRequestDto;
import com.taskhub.api.api.dto.UpdateProfileRequestDto;
import com.taskhub.api.api.dto.UserResponseDto;
import com.taskhub.api.domain.model.AuthenticatedUser;
import com.taskhub.api.domain.service.UserService;
import com.taskhub.api.domain.utils.BearerTokens;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

/**
 * User Controller - the caller's own profile
 *
 * Endpoints:
 * - GET   /user
 * - PUT   /user (JSON, or multipart/form when an avatar is uploaded)
 * - PATCH /user (password)
 */
@RestController
@RequestMapping("/user")
@SecurityRequirement(name = "bearerAuth")
@Tag(name = "User", description = "Profile and password management")
public class UserController {

    private final UserService userService;

    public UserController(UserService userService) {
        this.userService = userService;
    }

    @GetMapping
    public ResponseEntity<DataResponseDto<UserResponseDto>> profile(
            @AuthenticationPrincipal AuthenticatedUser principal) {
        return ResponseEntity.ok(DataResponseDto.of(userService.getProfile(principal)));
    }

    @PutMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<DataResponseDto<UserResponseDto>> updateProfile(
            @AuthenticationPrincipal AuthenticatedUser principal,
            @Valid @RequestBody UpdateProfileRequestDto request) {
        return profileUpdated(principal, request);
    }

    /**
     * Update name, email and optionally replace the avatar
     * Returns 200 OK with the updated profile
     */
    @PutMapping(consumes = {MediaType.MULTIPART_FORM_DATA_VALUE, MediaType.APPLICATION_FORM_URLENCODED_VALUE})
    public ResponseEntity<DataResponseDto<UserResponseDto>> updateProfileForm(
            @AuthenticationPrincipal AuthenticatedUser principal,
            @Valid @ModelAttribute UpdateProfileRequestDto request) {
        return profileUpdated(principal, request);
    }

    /**
     * Change the password and revoke every other token of the caller
     * Returns 200 OK
     */
    @PatchMapping
    public ResponseEntity<MessageResponseDto> updatePassword(
            @AuthenticationPrincipal AuthenticatedUser principal,
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorizationHeader,
            @Valid @RequestBody UpdatePasswordRequestDto request) {
        userService.updatePassword(principal, request, BearerTokens.resolve(authorizationHeader));
        return ResponseEntity.ok(new MessageResponseDto("Password updated successfully"));
    }

    private ResponseEntity<DataResponseDto<UserResponseDto>> profileUpdated(AuthenticatedUser principal,
                                                                           UpdateProfileRequestDto request) {
        UserResponseDto user = userService.updateProfile(principal, request);
        return ResponseEntity.ok(new DataResponseDto<>("Profile Updated", user));
    }
}
