package com.taskhub.api.infrastructure.repository;

import com.taskhub.api.infrastructure.entity.AccessTokenEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository for issued bearer tokens
 */
@Repository
public interface AccessTokenRepository extends JpaRepository<AccessTokenEntity, Long> {

    /**
     * Find token by its SHA-256 hash, with its owner loaded in the same query
     */
    @Query("""
        select t
        from AccessTokenEntity t
        join fetch t.user
        where t.tokenHash = :tokenHash
    """)
    Optional<AccessTokenEntity> findWithUserByTokenHash(@Param("tokenHash") String tokenHash);

    @Modifying
    @Query("DELETE FROM AccessTokenEntity t WHERE t.tokenHash = :tokenHash")
    int deleteByTokenHash(@Param("tokenHash") String tokenHash);

    /**
     * Delete every token of a user except the one identified by the given hash
     */
    @Modifying
    @Query("DELETE FROM AccessTokenEntity t WHERE t.user.id = :userId AND t.tokenHash <> :keepHash")
    int deleteOtherTokens(@Param("userId") Long userId, @Param("keepHash") String keepHash);

    /**
     * Delete all expired tokens
     * Called periodically for cleanup
     */
    @Modifying
    @Query("DELETE FROM AccessTokenEntity t WHERE t.expiresAt is not null AND t.expiresAt <= :now")
    int deleteExpiredTokens(@Param("now") Instant now);
}
