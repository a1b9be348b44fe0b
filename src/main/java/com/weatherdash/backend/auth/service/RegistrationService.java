package com.weatherdash.backend.auth.service;

import com.weatherdash.backend.auth.dto.AuthResponse;
import com.weatherdash.backend.auth.dto.CodeSentResponse;
import com.weatherdash.backend.auth.dto.CompleteRegistrationRequest;
import com.weatherdash.backend.auth.dto.RegistrationCodeRequest;
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
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Email-verified sign-up: request a code for an address, then come back with the code
 * plus the desired username and password. Nothing about the pending account is stored
 * server-side between the two calls.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RegistrationService {

    private final UserRepo users;
    private final OtpIssuer otpIssuer;
    private final OtpVerifier otpVerifier;
    private final PasswordEncoder passwordEncoder;
    private final TokenService tokens;

    @Transactional
    public CodeSentResponse requestCode(RegistrationCodeRequest req) {
        final String email = CredentialRules.requireEmail(req.email());

        String displayName = email.substring(0, email.indexOf('@'));
        if (req.username() != null && !req.username().isBlank()) {
            displayName = CredentialRules.requireUsername(req.username());
            if (users.existsByUsername(displayName)) {
                throw new AuthFlowException(AuthError.DUPLICATE_USERNAME);
            }
        }
        if (users.existsByEmailIgnoreCase(email)) {
            throw new AuthFlowException(AuthError.DUPLICATE_EMAIL);
        }

        var issued = otpIssuer.issue(email, OtpPurpose.REGISTRATION, displayName);
        return new CodeSentResponse(true, issued.delivered(), issued.delivered()
                ? "Verification code sent to your email address"
                : "Verification code created, but email delivery is currently unavailable");
    }

    @Transactional
    public AuthResponse complete(CompleteRegistrationRequest req) {
        final String email = CredentialRules.requireEmail(req.email());
        final String code = CredentialRules.requireCodeShape(req.code());
        final String username = CredentialRules.requireUsername(req.username());
        CredentialRules.requireStrongPassword(req.password());

        if (users.existsByUsername(username)) {
            throw new AuthFlowException(AuthError.DUPLICATE_USERNAME);
        }

        if (!otpVerifier.verifyAndConsume(email, code, OtpPurpose.REGISTRATION).isVerified()) {
            throw new AuthFlowException(AuthError.INVALID_OR_EXPIRED_CODE);
        }

        // registered by another request after the code went out
        if (users.existsByEmailIgnoreCase(email)) {
            throw new AuthFlowException(AuthError.ALREADY_REGISTERED);
        }

        User user = new User();
        user.setEmail(email);
        user.setUsername(username);
        user.setPasswordHash(passwordEncoder.encode(req.password()));
        user.setEmailVerified(true);
        try {
            user = users.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            // a concurrent registration took the email or username after the checks above
            log.info("registration for {} lost a race: {}", email, e.getMostSpecificCause().getMessage());
            throw new AuthFlowException(AuthError.ALREADY_REGISTERED);
        }

        var pair = tokens.issue(user);
        otpVerifier.discard(email, OtpPurpose.REGISTRATION);

        log.info("user {} registered ({})", user.getId(), email);
        return tokens.toResponse(pair, user);
    }
}
