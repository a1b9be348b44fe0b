package com.weatherdash.backend.auth.repo;

import com.weatherdash.backend.auth.otp.EmailOtpCode;
import com.weatherdash.backend.auth.otp.OtpPurpose;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;

public interface EmailOtpCodeRepository extends JpaRepository<EmailOtpCode, Long> {

    /**
     * Newest record for the pair. Issuing removes older unconsumed rows, so this is the
     * authoritative one whatever its state.
     */
    Optional<EmailOtpCode> findFirstByEmailAndPurposeOrderByIdDesc(String email, OtpPurpose purpose);

    long countByEmailAndPurpose(String email, OtpPurpose purpose);

    /**
     * Called before inserting a fresh code so only one code per (email, purpose) can verify.
     */
    @Modifying(flushAutomatically = true)
    @Query("""
           delete from EmailOtpCode c
            where c.email = :email
              and c.purpose = :purpose
              and c.consumedAt is null
           """)
    int deleteUnconsumed(@Param("email") String email,
                         @Param("purpose") OtpPurpose purpose);

    /**
     * Compare-and-set on consumed_at. Returns 1 for the single caller that wins the record.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
           update EmailOtpCode c
              set c.consumedAt = :now
            where c.id = :id
              and c.consumedAt is null
              and c.expiresAt > :now
           """)
    int consume(@Param("id") Long id, @Param("now") Instant now);

    @Modifying(flushAutomatically = true)
    @Query("delete from EmailOtpCode c where c.email = :email and c.purpose = :purpose")
    int deleteAllFor(@Param("email") String email, @Param("purpose") OtpPurpose purpose);

    @Modifying
    @Query("delete from EmailOtpCode c where c.expiresAt <= :now")
    int deleteExpired(@Param("now") Instant now);
}
