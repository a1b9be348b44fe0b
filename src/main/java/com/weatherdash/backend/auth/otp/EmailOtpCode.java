package com.weatherdash.backend.auth.otp;

import jakarta.persistence.*;
import lombok.Data;
import lombok.ToString;

import java.time.Instant;

@Data
@Entity
@Table(
        name = "email_otp_codes",
        indexes = {
                @Index(name = "ix_otp_email_purpose", columnList = "email,purpose"),
                @Index(name = "ix_otp_expires", columnList = "expires_at")
        }
)
public class EmailOtpCode {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 320)
    private String email;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private OtpPurpose purpose;

    // BCrypt of the 6-digit code; the plaintext only ever goes to the notification sender
    @ToString.Exclude
    @Column(name = "code_hash", length = 100, nullable = false)
    private String codeHash;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "consumed_at")
    private Instant consumedAt;
}
