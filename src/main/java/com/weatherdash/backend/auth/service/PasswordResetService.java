package com.weatherdash.backend.auth.service;

import com.weatherdash.backend.auth.dto.AckResponse;
import com.weatherdash.backend.auth.dto.CompletePasswordResetRequest;
import com.weatherdash.backend.auth.dto.PasswordResetCodeRequest;
import com.weatherdash.backend.auth.dto.VerifiedResponse;
import com.weatherdash.backend.auth.dto.VerifyResetCodeRequest;
import com.weatherdash.backend.auth.entity.User;
import com.weatherdash.backend.auth.otp.OtpIssuer;
import com.weatherdash.backend.auth.otp.OtpPurpose;
import com.weatherdash.backend.auth.otp.OtpVerifier;
import com.weatherdash.backend.auth.repo.UserRepo;
import com.weatherdash.backend.auth.support.CredentialRules;
import com.weatherdash.backend.auth.web.AuthError;
import com.weatherdash.backend.auth.web.AuthFlowException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Forgot-password flow. Only {@link #complete} changes state: it verifies, consumes the
 * code and applies the new password in one transaction. {@link #verify} is a read-only
 * pre-check so the client can validate the code before asking for a new password.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PasswordResetService {

    static final String REQUEST_ACK =
            "If an account with that email exists, a reset code has been sent";

    private final UserRepo users;
    private final OtpIssuer otpIssuer;
    private final OtpVerifier otpVerifier;
    private final PasswordEncoder passwordEncoder;
    private final TokenService tokens;

    /**
     * Same answer whether or not the address has an account. Issuing runs in the background
     * so both cases return after the same single lookup.
     */
    @Transactional
    public AckResponse requestCode(PasswordResetCodeRequest req) {
        final String email = CredentialRules.normalizeEmail(req.email());
        if (CredentialRules.looksLikeEmail(email)) {
            users.findByEmailIgnoreCase(email).ifPresentOrElse(
                    u -> otpIssuer.issueInBackground(u.getEmail(), OtpPurpose.PASSWORD_RESET, u.getUsername()),
                    () -> log.info("password reset requested for unknown email {}", email));
        }
        return new AckResponse(true, REQUEST_ACK);
    }

    @Transactional(readOnly = true)
    public VerifiedResponse verify(VerifyResetCodeRequest req) {
        final String email = CredentialRules.requireEmail(req.email());
        final String code = CredentialRules.requireCodeShape(req.code());

        if (!otpVerifier.check(email, code, OtpPurpose.PASSWORD_RESET).isVerified()) {
            throw new AuthFlowException(AuthError.INVALID_OR_EXPIRED_CODE);
        }
        return new VerifiedResponse(true, "Code verified. Please enter your new password.");
    }

    @Transactional
    public AckResponse complete(CompletePasswordResetRequest req) {
        final String email = CredentialRules.requireEmail(req.email());
        final String code = CredentialRules.requireCodeShape(req.code());
        CredentialRules.requireStrongPassword(req.newPassword());

        // no account means no code was ever issued; answer exactly like a wrong code
        User user = users.findByEmailIgnoreCase(email)
                .orElseThrow(() -> new AuthFlowException(AuthError.INVALID_OR_EXPIRED_CODE));

        if (!otpVerifier.verifyAndConsume(email, code, OtpPurpose.PASSWORD_RESET).isVerified()) {
            throw new AuthFlowException(AuthError.INVALID_OR_EXPIRED_CODE);
        }

        user.setPasswordHash(passwordEncoder.encode(req.newPassword()));
        users.save(user);

        tokens.revokeAll(user.getId());
        otpVerifier.discard(email, OtpPurpose.PASSWORD_RESET);

        log.info("password reset completed for user {}", user.getId());
        return new AckResponse(true, "Password reset successfully");
    }
}
