package com.taskhub.api.infrastructure.repository;

import com.taskhub.api.infrastructure.entity.UserEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface UserRepository extends JpaRepository<UserEntity, Long> {

    /* ================= HOT PATHS ================= */

    Optional<UserEntity> findByEmail(String email);

    boolean existsByEmail(String email);

    boolean existsByName(String name);

    /* ================= PROFILE UPDATES ================= */

    boolean existsByEmailAndIdNot(String email, Long id);

    boolean existsByNameAndIdNot(String name, Long id);
}
