package com.taskhub.api.api.controller;

import com.taskhub.api.api.dto.LoginRequestDto;
import com.taskhub.api.api.dto.LoginResponseDto;
import com.taskhub.api.api.dto.MessageResponseDto;
import com.taskhub.api.domain.model.AuthenticatedUser;
import com.taskhub.api.domain.service.LoginService;
import com.taskhub.api.domain.service.LogoutService;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

/**
 * Login Controller - Token Issue and Revocation
 *
 * Endpoints:
 * - POST /auth/login
 * - GET  /auth/logout
 */
@RestController
@RequestMapping("/auth")
@Tag(name = "Authentication", description = "Login and logout")
public class LoginController {

    private final LoginService loginService;
    private final LogoutService logoutService;

    public LoginController(LoginService loginService, LogoutService logoutService) {
        this.loginService = loginService;
        this.logoutService = logoutService;
    }

    /**
     * Password verification
     * Returns 200 OK with a new bearer token
     */
    @PostMapping("/login")
    public ResponseEntity<LoginResponseDto> login(@Valid @RequestBody LoginRequestDto request) {
        LoginResponseDto response = loginService.login(request);
        return ResponseEntity.ok(response);
    }

    /**
     * Logout - revoke the token used for this request
     * Returns 200 OK
     */
    @GetMapping("/logout")
    @SecurityRequirement(name = "bearerAuth")
    public ResponseEntity<MessageResponseDto> logout(
            @AuthenticationPrincipal AuthenticatedUser principal,
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorizationHeader) {
        logoutService.logout(principal, authorizationHeader);
        return ResponseEntity.ok(new MessageResponseDto("Successfully logged out. Token revoked."));
    }
}
