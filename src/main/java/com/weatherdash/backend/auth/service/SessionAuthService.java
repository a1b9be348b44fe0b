package com.weatherdash.backend.auth.service;

import com.weatherdash.backend.auth.dto.AuthResponse;
import com.weatherdash.backend.auth.dto.LoginRequest;
import com.weatherdash.backend.auth.dto.UserSummary;
import com.weatherdash.backend.auth.entity.User;
import com.weatherdash.backend.auth.repo.UserRepo;
import com.weatherdash.backend.auth.support.CredentialRules;
import com.weatherdash.backend.auth.web.AuthError;
import com.weatherdash.backend.auth.web.AuthFlowException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.util.Optional;

/**
 * Password login, refresh rotation, logout and the current-user lookup.
 */
@Slf4j
@Service
public class SessionAuthService {

    private final UserRepo users;
    private final PasswordEncoder passwordEncoder;
    private final TokenService tokens;
    private final Clock clock;

    // compared against when the identifier is unknown, so both failure paths pay for a BCrypt check
    private final String dummyHash;

    public SessionAuthService(UserRepo users, PasswordEncoder passwordEncoder, TokenService tokens, Clock clock) {
        this.users = users;
        this.passwordEncoder = passwordEncoder;
        this.tokens = tokens;
        this.clock = clock;
        this.dummyHash = passwordEncoder.encode("unused-" + System.nanoTime());
    }

    @Transactional
    public AuthResponse login(LoginRequest req) {
        final String identifier = req.identifier() == null ? "" : req.identifier().trim();
        final String password = req.password() == null ? "" : req.password();

        Optional<User> found = CredentialRules.looksLikeEmail(identifier)
                ? users.findByEmailIgnoreCase(identifier)
                : users.findByUsername(identifier);

        if (found.isEmpty()) {
            passwordEncoder.matches(password, dummyHash);
            throw new AuthFlowException(AuthError.INVALID_CREDENTIALS);
        }
        User user = found.get();
        if (!passwordEncoder.matches(password, user.getPasswordHash())) {
            throw new AuthFlowException(AuthError.INVALID_CREDENTIALS);
        }

        user.setLastLoginAt(clock.instant());
        users.save(user);

        var pair = tokens.issue(user);
        return tokens.toResponse(pair, user);
    }

    public AuthResponse refresh(String refreshToken) {
        return tokens.toResponse(tokens.rotateRefresh(refreshToken), null);
    }

    public void logout(String refreshToken) {
        tokens.revoke(refreshToken);
    }

    @Transactional(readOnly = true)
    public UserSummary profile(Long userId) {
        return users.findById(userId)
                .map(UserSummary::from)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "User not found"));
    }
}
