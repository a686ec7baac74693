package com.taskhub.api.domain.service;

import com.taskhub.api.api.dto.UpdatePasswordRequestDto;
import com.taskhub.api.api.dto.UpdateProfileRequestDto;
import com.taskhub.api.api.dto.UserResponseDto;
import com.taskhub.api.domain.exception.DuplicateAccountException;
import com.taskhub.api.domain.exception.RequestValidationException;
import com.taskhub.api.domain.exception.UserNotFoundException;
import com.taskhub.api.domain.model.AuthenticatedUser;
import com.taskhub.api.domain.utils.Emails;
import com.taskhub.api.domain.validation.FieldErrors;
import com.taskhub.api.infrastructure.entity.UserEntity;
import com.taskhub.api.infrastructure.repository.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * User Service - All user-related operations
 * Handles user creation, password hashing, profile and password updates
 */
@Service
@Slf4j
public class UserService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final AvatarStorageService avatarStorage;
    private final AccessTokenService accessTokenService;
    private final Clock clock;

    // Compared against when the email is unknown so both login failures cost one hash check
    private volatile String dummyPasswordHash;

    public UserService(UserRepository userRepository,
                       PasswordEncoder passwordEncoder,
                       AvatarStorageService avatarStorage,
                       AccessTokenService accessTokenService,
                       Clock clock) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.avatarStorage = avatarStorage;
        this.accessTokenService = accessTokenService;
        this.clock = clock;
    }

    /**
     * Check if email already exists
     */
    public boolean existsByEmail(String email) {
        boolean exists = userRepository.existsByEmail(Emails.normalize(email));
        log.debug("[EMAIL_CHECK] Email existence check | email={} | exists={}", email, exists);
        return exists;
    }

    public boolean existsByName(String name) {
        return userRepository.existsByName(name);
    }

    /**
     * Create new user with hashed password.
     * The unique constraints on name and email are the final word on duplicates.
     *
     * @throws DuplicateAccountException if a concurrent registration took the name or email first
     */
    public UserEntity createUser(String name, String email, String rawPassword, String avatarPath) {
        log.info("[USER_CREATE_START] Creating new user | email={}", email);

        Instant now = clock.instant();
        UserEntity user = new UserEntity();
        user.setName(name);
        user.setEmail(Emails.normalize(email));
        user.setPasswordHash(passwordEncoder.encode(rawPassword));
        user.setAvatarPath(avatarPath);
        user.setCreatedAt(now);
        user.setUpdatedAt(now);

        UserEntity savedUser = saveAndFlush(user);
        log.info("[USER_CREATED] User created successfully | userId={} | email={}", savedUser.getId(), email);
        return savedUser;
    }

    public Optional<UserEntity> findByEmail(String email) {
        log.debug("[USER_FIND] Finding user by email | email={}", email);
        return userRepository.findByEmail(Emails.normalize(email));
    }

    public UserEntity findById(Long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new UserNotFoundException(userId));
    }

    /**
     * Verify password matches stored hash
     */
    public boolean verifyPassword(String rawPassword, String passwordHash) {
        boolean matches = passwordEncoder.matches(rawPassword, passwordHash);
        log.debug("[PASSWORD_VERIFY] Password verification result | matches={}", matches);
        return matches;
    }

    /**
     * Run a full hash comparison that can never succeed, to keep unknown-email logins as slow as
     * wrong-password logins.
     */
    public void verifyAgainstDummyHash(String rawPassword) {
        String hash = dummyPasswordHash;
        if (hash == null) {
            hash = passwordEncoder.encode(UUID.randomUUID().toString());
            dummyPasswordHash = hash;
        }
        passwordEncoder.matches(rawPassword == null ? "" : rawPassword, hash);
    }

    @Transactional(readOnly = true)
    public UserResponseDto getProfile(AuthenticatedUser principal) {
        return UserResponseDto.from(findById(principal.id()));
    }

    /**
     * Update name, email and optionally the avatar. Uniqueness is checked against other users only.
     * The existing avatar is kept when no new file is sent.
     */
    @Transactional
    public UserResponseDto updateProfile(AuthenticatedUser principal, UpdateProfileRequestDto request) {
        log.info("[PROFILE_UPDATE_START] Updating profile | userId={}", principal.id());

        UserEntity user = findById(principal.id());
        String email = Emails.normalize(request.getEmail());

        FieldErrors errors = new FieldErrors();
        if (userRepository.existsByNameAndIdNot(request.getName(), user.getId())) {
            errors.add("name", "The name has already been taken.");
        }
        if (userRepository.existsByEmailAndIdNot(email, user.getId())) {
            errors.add("email", "The email has already been taken.");
        }
        if (!errors.isEmpty()) {
            log.warn("[PROFILE_UPDATE_REJECTED] Name or email taken | userId={} | fields={}",
                    user.getId(), errors.asMap().keySet());
            throw new RequestValidationException(errors);
        }

        MultipartFile avatar = request.getAvatar();
        String previousAvatar = user.getAvatarPath();
        String newAvatar = avatar != null && !avatar.isEmpty() ? avatarStorage.store(avatar) : null;

        user.setName(request.getName());
        user.setEmail(email);
        if (newAvatar != null) {
            user.setAvatarPath(newAvatar);
        }
        user.setUpdatedAt(clock.instant());

        UserEntity saved;
        try {
            saved = saveAndFlush(user);
        } catch (RuntimeException e) {
            avatarStorage.delete(newAvatar);
            throw e;
        }

        if (newAvatar != null && previousAvatar != null) {
            avatarStorage.delete(previousAvatar);
        }
        log.info("[PROFILE_UPDATED] Profile updated | userId={} | avatarChanged={}", saved.getId(), newAvatar != null);
        return UserResponseDto.from(saved);
    }

    /**
     * Re-hash and store the new password, then revoke every other token of the user.
     * The token that authorised this request stays valid.
     */
    @Transactional
    public void updatePassword(AuthenticatedUser principal, UpdatePasswordRequestDto request, String currentRawToken) {
        UserEntity user = findById(principal.id());
        user.setPasswordHash(passwordEncoder.encode(request.getPassword()));
        user.setUpdatedAt(clock.instant());
        userRepository.save(user);

        int revoked = accessTokenService.revokeOtherTokens(user.getId(), currentRawToken);
        log.info("[PASSWORD_UPDATED] Password changed | userId={} | otherTokensRevoked={}", user.getId(), revoked);
    }

    private UserEntity saveAndFlush(UserEntity user) {
        try {
            return userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            String field = duplicateFieldOf(e);
            log.warn("[USER_DUPLICATE] Unique constraint rejected user write | field={} | email={}",
                    field, user.getEmail());
            throw new DuplicateAccountException("The " + field + " has already been taken.",
                    FieldErrors.of(field, "The " + field + " has already been taken."), e);
        }
    }

    private static String duplicateFieldOf(DataIntegrityViolationException e) {
        String detail = String.valueOf(e.getMostSpecificCause().getMessage()).toLowerCase(Locale.ROOT);
        if (detail.contains(UserEntity.NAME_CONSTRAINT) || detail.contains("(name")) {
            return "name";
        }
        return "email";
    }
}
