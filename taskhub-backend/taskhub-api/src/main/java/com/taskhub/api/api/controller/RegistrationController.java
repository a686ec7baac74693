package com.taskhub.api.api.controller;

import com.taskhub.api.api.dto.DataResponseDto;
import com.taskhub.api.api.dto.RegistrationRequestDto;
import com.taskhub.api.api.dto.UserResponseDto;
import com.taskhub.api.domain.service.RegistrationService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Registration Controller - Account Creation
 *
 * Endpoints:
 * - POST /auth/register (JSON, or multipart/form when an avatar is uploaded)
 */
@RestController
@RequestMapping("/auth")
@Tag(name = "Registration", description = "User registration")
public class RegistrationController {

    private final RegistrationService registrationService;

    public RegistrationController(RegistrationService registrationService) {
        this.registrationService = registrationService;
    }

    /**
     * Register a new user account
     * Returns 201 Created with the public view of the user
     */
    @PostMapping(value = "/register", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<DataResponseDto<UserResponseDto>> register(
            @Valid @RequestBody RegistrationRequestDto request) {
        return created(request);
    }

    /**
     * Register with an optional avatar upload
     * Returns 201 Created with the public view of the user
     */
    @PostMapping(value = "/register",
            consumes = {MediaType.MULTIPART_FORM_DATA_VALUE, MediaType.APPLICATION_FORM_URLENCODED_VALUE})
    public ResponseEntity<DataResponseDto<UserResponseDto>> registerForm(
            @Valid @ModelAttribute RegistrationRequestDto request) {
        return created(request);
    }

    private ResponseEntity<DataResponseDto<UserResponseDto>> created(RegistrationRequestDto request) {
        UserResponseDto user = registrationService.register(request);

        return ResponseEntity
                .status(HttpStatus.CREATED)
                .body(new DataResponseDto<>("User registered successfully", user));
    }
}
