package com.weatherdash.backend.auth.repo;

import com.weatherdash.backend.auth.entity.RefreshToken;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;

public interface RefreshTokenRepo extends JpaRepository<RefreshToken, Long> {

    Optional<RefreshToken> findByTokenAndExpiresAtAfter(String token, Instant now);

    long countByUserId(Long userId);

    /**
     * Rotation claim: only the caller that actually removes the row may mint a new pair.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from RefreshToken t where t.token = :token and t.expiresAt > :now")
    int deleteActive(@Param("token") String token, @Param("now") Instant now);

    @Modifying
    @Query("delete from RefreshToken t where t.token = :token")
    int deleteByTokenValue(@Param("token") String token);

    /** Sign out everywhere (password reset). */
    @Modifying
    @Query("delete from RefreshToken t where t.userId = :userId")
    int deleteAllByUserId(@Param("userId") Long userId);

    @Modifying
    @Query("delete from RefreshToken t where t.expiresAt <= :now")
    int deleteExpired(@Param("now") Instant now);
}
