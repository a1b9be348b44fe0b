package com.weatherdash.backend.auth.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

/**
 * One row per outstanding refresh token. Rows are deleted on rotation, logout and
 * password reset; expired rows are rejected on lookup and removed by the sweep job.
 */
@Data
@Entity
@Table(
        name = "refresh_tokens",
        indexes = {
                @Index(name = "ix_refresh_tokens_user", columnList = "user_id"),
                @Index(name = "ix_refresh_tokens_expires", columnList = "expires_at")
        }
)
public class RefreshToken {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 128)
    private String token;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    public boolean isExpiredAt(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
