package com.weatherdash.backend.auth.otp;

import com.weatherdash.backend.auth.config.OtpProperties;
import com.weatherdash.backend.config.AsyncConfig;
import com.weatherdash.backend.auth.notify.OtpNotificationSender;
import com.weatherdash.backend.auth.repo.EmailOtpCodeRepository;
import com.weatherdash.backend.auth.support.SecureToken;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

@Slf4j
@Service
public class OtpIssuer {

    private final EmailOtpCodeRepository codes;
    private final PasswordEncoder encoder;
    private final OtpNotificationSender sender;
    private final OtpProperties props;
    private final Clock clock;

    public OtpIssuer(EmailOtpCodeRepository codes,
                     PasswordEncoder encoder,
                     OtpNotificationSender sender,
                     OtpProperties props,
                     Clock clock) {
        this.codes = codes;
        this.encoder = encoder;
        this.sender = sender;
        this.props = props;
        this.clock = clock;
    }

    /**
     * Replaces any pending code for (email, purpose) with a fresh one and hands the
     * plaintext to the notification sender. Eligibility (account exists or not) is the
     * caller's decision.
     */
    @Transactional
    public OtpIssueResult issue(String email, OtpPurpose purpose, String displayName) {
        final Instant now = clock.instant();

        int superseded = codes.deleteUnconsumed(email, purpose);
        if (superseded > 0) {
            log.debug("superseded {} pending {} code(s) for {}", superseded, purpose, email);
        }

        final String code = SecureToken.newSixDigitCode();

        var ent = new EmailOtpCode();
        ent.setEmail(email);
        ent.setPurpose(purpose);
        ent.setCodeHash(encoder.encode(code));
        ent.setCreatedAt(now);
        ent.setExpiresAt(now.plus(props.getTtl()));
        codes.save(ent);

        boolean delivered = sender.send(email, purpose, code, displayName);
        log.info("{} code issued for {} (delivered={})", purpose, email, delivered);
        return new OtpIssueResult(delivered, ent.getExpiresAt());
    }

    /**
     * {@link #issue} on the delivery executor, so the caller's response time does not depend
     * on hashing or SMTP.
     */
    @Async(AsyncConfig.OTP_DELIVERY_EXECUTOR)
    @Transactional
    public void issueInBackground(String email, OtpPurpose purpose, String displayName) {
        issue(email, purpose, displayName);
    }
}
