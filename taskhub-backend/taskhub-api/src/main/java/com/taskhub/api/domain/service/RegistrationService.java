package com.taskhub.api.domain.service;

import com.taskhub.api.api.dto.RegistrationRequestDto;
import com.taskhub.api.api.dto.UserResponseDto;
import com.taskhub.api.domain.exception.DuplicateAccountException;
import com.taskhub.api.domain.exception.RequestValidationException;
import com.taskhub.api.domain.validation.FieldErrors;
import com.taskhub.api.infrastructure.entity.UserEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

/**
 * Registration Service - Orchestrates user registration flow
 *
 * Flow:
 * 1. Check name and email are not taken (friendly 422 field errors)
 * 2. Store the avatar, if any
 * 3. Create user with hashed password (unique constraints catch concurrent duplicates)
 * 4. Return the public view of the user
 *
 * A stored avatar is removed again if the user row cannot be written.
 */
@Service
@Slf4j
public class RegistrationService {

    private final UserService userService;
    private final AvatarStorageService avatarStorage;

    public RegistrationService(UserService userService, AvatarStorageService avatarStorage) {
        this.userService = userService;
        this.avatarStorage = avatarStorage;
    }

    /**
     * Register new user
     *
     * @param request Registration details (name, email, password, optional avatar)
     * @return public view of the created user
     * @throws RequestValidationException if name or email is already registered
     * @throws DuplicateAccountException if a concurrent registration claimed them first
     */
    @Transactional
    public UserResponseDto register(RegistrationRequestDto request) {
        log.info("[REGISTER_START] User registration initiated | email={}", request.getEmail());

        // 1. Check name and email don't exist
        FieldErrors errors = new FieldErrors();
        if (userService.existsByName(request.getName())) {
            errors.add("name", "The name has already been taken.");
        }
        if (userService.existsByEmail(request.getEmail())) {
            errors.add("email", "The email has already been taken.");
        }
        if (!errors.isEmpty()) {
            log.warn("[REGISTER_REJECTED] Registration failed - name or email taken | email={} | fields={}",
                    request.getEmail(), errors.asMap().keySet());
            throw new RequestValidationException(errors);
        }

        // 2. Store avatar
        MultipartFile avatar = request.getAvatar();
        String avatarPath = avatar != null && !avatar.isEmpty() ? avatarStorage.store(avatar) : null;

        // 3. Create user with hashed password
        UserEntity user;
        try {
            user = userService.createUser(request.getName(), request.getEmail(), request.getPassword(), avatarPath);
        } catch (RuntimeException e) {
            avatarStorage.delete(avatarPath);
            throw e;
        }

        log.info("[REGISTER_SUCCESS] Registration completed successfully | userId={} | email={} | avatar={}",
                user.getId(), user.getEmail(), avatarPath != null);
        return UserResponseDto.from(user);
    }
}
