package com.weatherdash.backend.auth.otp;

import com.weatherdash.backend.auth.repo.EmailOtpCodeRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

@Slf4j
@Service
public class OtpVerifier {

    private final EmailOtpCodeRepository codes;
    private final PasswordEncoder encoder;
    private final Clock clock;

    public OtpVerifier(EmailOtpCodeRepository codes, PasswordEncoder encoder, Clock clock) {
        this.codes = codes;
        this.encoder = encoder;
        this.clock = clock;
    }

    /**
     * Checks the code and, on a match, consumes the record. Of two concurrent callers
     * holding the right code only one gets {@link OtpCheck#VERIFIED}; a mismatch leaves the
     * record usable until it expires.
     */
    @Transactional
    public OtpCheck verifyAndConsume(String email, String code, OtpPurpose purpose) {
        final Instant now = clock.instant();
        var latest = codes.findFirstByEmailAndPurposeOrderByIdDesc(email, purpose).orElse(null);

        OtpCheck check = evaluate(latest, code, now);
        if (!check.isVerified()) {
            log.debug("{} code rejected for {}: {}", purpose, email, check);
            return check;
        }

        if (codes.consume(latest.getId(), now) == 0) {
            log.debug("{} code for {} consumed concurrently", purpose, email);
            return OtpCheck.ALREADY_CONSUMED;
        }
        return OtpCheck.VERIFIED;
    }

    /** Same evaluation as {@link #verifyAndConsume} without consuming anything. */
    @Transactional(readOnly = true)
    public OtpCheck check(String email, String code, OtpPurpose purpose) {
        var latest = codes.findFirstByEmailAndPurposeOrderByIdDesc(email, purpose).orElse(null);
        return evaluate(latest, code, clock.instant());
    }

    /** Drops every record of the pair once its flow has completed. */
    @Transactional
    public void discard(String email, OtpPurpose purpose) {
        codes.deleteAllFor(email, purpose);
    }

    private OtpCheck evaluate(EmailOtpCode rec, String code, Instant now) {
        if (rec == null) return OtpCheck.NOT_FOUND;
        if (rec.getConsumedAt() != null) return OtpCheck.ALREADY_CONSUMED;
        if (!rec.getExpiresAt().isAfter(now)) return OtpCheck.EXPIRED;
        if (!encoder.matches(code, rec.getCodeHash())) return OtpCheck.MISMATCH;
        return OtpCheck.VERIFIED;
    }
}
